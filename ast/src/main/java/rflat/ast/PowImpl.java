package rflat.ast;

public class PowImpl extends BinaryExpression {

  PowImpl(Expression base, Expression exponent) {
    super(base, exponent);
  }

  public Expression base() {
    return left();
  }

  public Expression exponent() {
    return right();
  }

  @Override
  public ExprKind kind() {
    return ExprKind.POW;
  }

  @Override
  public boolean isLinear() {
    return false;
  }

  @Override
  public boolean isFlattened() {
    return false;
  }

  @Override
  protected String operatorText() {
    return "**";
  }

  @Override
  protected Expression rebuild(Expression left, Expression right) {
    return mkPow(left, right);
  }
}
