package rflat.ast;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

public abstract class BinaryExpression extends Expression {

  private final Expression left;
  private final Expression right;

  BinaryExpression(Expression left, Expression right) {
    this.left = Objects.requireNonNull(left);
    this.right = Objects.requireNonNull(right);
  }

  public Expression left() {
    return left;
  }

  public Expression right() {
    return right;
  }

  protected abstract String operatorText();

  protected abstract Expression rebuild(Expression left, Expression right);

  @Override
  public List<Expression> subExpressions() {
    return List.of(left, right);
  }

  @Override
  public boolean isFlattened() {
    return left.isLinear() && right.isLinear();
  }

  @Override
  public Expression transformPostOrder(Function<Expression, Expression> transformer) {
    final Expression left0 = left.transformPostOrder(transformer);
    final Expression right0 = right.transformPostOrder(transformer);
    if (left0 == left && right0 == right) return transformer.apply(this);
    return transformer.apply(rebuild(left0, right0));
  }

  @Override
  protected void prettyPrint(PrettyBuilder builder) {
    prettyPrintOperand(builder, left);
    builder.print(" ").print(operatorText()).print(" ");
    prettyPrintOperand(builder, right);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (obj == null || obj.getClass() != getClass()) return false;
    final BinaryExpression that = (BinaryExpression) obj;
    return left.equals(that.left) && right.equals(that.right);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind(), left, right);
  }
}
