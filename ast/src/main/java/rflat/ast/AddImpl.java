package rflat.ast;

public class AddImpl extends BinaryExpression {

  AddImpl(Expression left, Expression right) {
    super(left, right);
  }

  @Override
  public ExprKind kind() {
    return ExprKind.ADD;
  }

  @Override
  public boolean isLinear() {
    return left().isLinear() && right().isLinear();
  }

  @Override
  protected String operatorText() {
    return "+";
  }

  @Override
  protected Expression rebuild(Expression left, Expression right) {
    return mkAdd(left, right);
  }
}
