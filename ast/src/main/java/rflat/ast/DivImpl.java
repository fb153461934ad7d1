package rflat.ast;

public class DivImpl extends BinaryExpression {

  DivImpl(Expression left, Expression right) {
    super(left, right);
  }

  @Override
  public ExprKind kind() {
    return ExprKind.DIV;
  }

  /** Only division by a literal scales linearly; {@code c / x} is not affine in x. */
  @Override
  public boolean isLinear() {
    return (left().isNumber() || left().isVariable()) && right().isNumber();
  }

  @Override
  protected String operatorText() {
    return "/";
  }

  @Override
  protected Expression rebuild(Expression left, Expression right) {
    return mkDiv(left, right);
  }
}
