package rflat.ast;

import java.util.Objects;

public class ReturnImpl extends Statement {

  private final Expression expr;

  ReturnImpl(Expression expr) {
    this.expr = Objects.requireNonNull(expr);
  }

  public Expression expr() {
    return expr;
  }

  @Override
  public StatementKind kind() {
    return StatementKind.RETURN;
  }

  @Override
  protected void prettyPrint(PrettyBuilder builder) {
    builder.print("return ").print(expr);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (!(obj instanceof ReturnImpl)) return false;
    return expr.equals(((ReturnImpl) obj).expr);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind(), expr);
  }
}
