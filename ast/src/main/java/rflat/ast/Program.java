package rflat.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

public final class Program {

  private final String id;
  private final ImmutableList<String> arguments;
  private final ImmutableList<Statement> statements;

  private Program(String id, List<String> arguments, List<Statement> statements) {
    this.id = Objects.requireNonNull(id);
    this.arguments = ImmutableList.copyOf(arguments);
    this.statements = ImmutableList.copyOf(statements);
  }

  public static Program mk(String id, List<String> arguments, List<Statement> statements) {
    return new Program(id, arguments, statements);
  }

  public String id() {
    return id;
  }

  public ImmutableList<String> arguments() {
    return arguments;
  }

  public ImmutableList<Statement> statements() {
    return statements;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (!(obj instanceof Program)) return false;
    final Program that = (Program) obj;
    return id.equals(that.id)
        && arguments.equals(that.arguments)
        && statements.equals(that.statements);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, arguments, statements);
  }

  @Override
  public String toString() {
    final PrettyBuilder builder = new PrettyBuilder();
    builder.print("def ").print(id).print("(").print(String.join(", ", arguments)).print("):");
    builder.println().indent(2);
    for (Statement statement : statements) {
      statement.prettyPrint(builder);
      builder.println();
    }
    builder.indent(-2);
    return builder.toString();
  }
}
