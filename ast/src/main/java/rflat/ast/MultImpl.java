package rflat.ast;

public class MultImpl extends BinaryExpression {

  MultImpl(Expression left, Expression right) {
    super(left, right);
  }

  @Override
  public ExprKind kind() {
    return ExprKind.MULT;
  }

  /** A product is linear when at most one factor is a variable and neither is compound. */
  @Override
  public boolean isLinear() {
    final Expression left = left(), right = right();
    if (left.isNumber()) return right.isNumber() || right.isVariable();
    return left.isVariable() && right.isNumber();
  }

  @Override
  protected String operatorText() {
    return "*";
  }

  @Override
  protected Expression rebuild(Expression left, Expression right) {
    return mkMult(left, right);
  }
}
