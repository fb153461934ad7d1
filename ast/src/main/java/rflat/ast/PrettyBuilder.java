package rflat.ast;

public class PrettyBuilder {
  private final StringBuilder builder;
  private int indent;
  private boolean lineStart;

  public PrettyBuilder() {
    this.builder = new StringBuilder();
    this.indent = 0;
    this.lineStart = true;
  }

  public PrettyBuilder print(Object obj) {
    if (lineStart) {
      builder.append(" ".repeat(indent));
      lineStart = false;
    }
    builder.append(obj);
    return this;
  }

  public PrettyBuilder println() {
    builder.append('\n');
    lineStart = true;
    return this;
  }

  public PrettyBuilder indent(int delta) {
    indent = Math.max(0, indent + delta);
    return this;
  }

  @Override
  public String toString() {
    return builder.toString();
  }
}
