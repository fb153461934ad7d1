package rflat.ast;

import java.util.Objects;

public class DefinitionImpl extends Statement {

  private final String target;
  private final Expression expr;

  DefinitionImpl(String target, Expression expr) {
    if (target == null || target.isEmpty()) throw new IllegalArgumentException("empty target");
    this.target = target;
    this.expr = Objects.requireNonNull(expr);
  }

  public String target() {
    return target;
  }

  public Expression expr() {
    return expr;
  }

  @Override
  public StatementKind kind() {
    return StatementKind.DEFINITION;
  }

  @Override
  protected void prettyPrint(PrettyBuilder builder) {
    builder.print(target).print(" = ").print(expr);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (!(obj instanceof DefinitionImpl)) return false;
    final DefinitionImpl that = (DefinitionImpl) obj;
    return target.equals(that.target) && expr.equals(that.expr);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind(), target, expr);
  }
}
