package rflat.ast;

import java.util.Objects;

/** Asserts that both sides evaluate to the same field element. */
public class ConstraintImpl extends Statement {

  private final Expression lhs;
  private final Expression rhs;

  ConstraintImpl(Expression lhs, Expression rhs) {
    this.lhs = Objects.requireNonNull(lhs);
    this.rhs = Objects.requireNonNull(rhs);
  }

  public Expression lhs() {
    return lhs;
  }

  public Expression rhs() {
    return rhs;
  }

  @Override
  public StatementKind kind() {
    return StatementKind.CONSTRAINT;
  }

  @Override
  protected void prettyPrint(PrettyBuilder builder) {
    builder.print(lhs).print(" == ").print(rhs);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (!(obj instanceof ConstraintImpl)) return false;
    final ConstraintImpl that = (ConstraintImpl) obj;
    return lhs.equals(that.lhs) && rhs.equals(that.rhs);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind(), lhs, rhs);
  }
}
