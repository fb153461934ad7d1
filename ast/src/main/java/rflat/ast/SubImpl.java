package rflat.ast;

public class SubImpl extends BinaryExpression {

  SubImpl(Expression left, Expression right) {
    super(left, right);
  }

  @Override
  public ExprKind kind() {
    return ExprKind.SUB;
  }

  @Override
  public boolean isLinear() {
    return left().isLinear() && right().isLinear();
  }

  @Override
  protected String operatorText() {
    return "-";
  }

  @Override
  protected Expression rebuild(Expression left, Expression right) {
    return mkSub(left, right);
  }
}
