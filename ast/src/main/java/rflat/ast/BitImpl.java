package rflat.ast;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Witness-only node. It names a value the prover computes outside the constraint system
 * and must therefore only appear on the right-hand side of a hint.
 */
public class BitImpl extends Expression {

  private final Expression operand;
  private final int index;

  BitImpl(Expression operand, int index) {
    if (index < 0) throw new IllegalArgumentException("negative bit index " + index);
    this.operand = Objects.requireNonNull(operand);
    this.index = index;
  }

  public Expression operand() {
    return operand;
  }

  public int index() {
    return index;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.BIT;
  }

  @Override
  public List<Expression> subExpressions() {
    return List.of(operand);
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
  public Expression transformPostOrder(Function<Expression, Expression> transformer) {
    final Expression operand0 = operand.transformPostOrder(transformer);
    if (operand0 == operand) return transformer.apply(this);
    return transformer.apply(mkBit(operand0, index));
  }

  @Override
  protected void prettyPrint(PrettyBuilder builder) {
    builder.print("bit(");
    operand.prettyPrint(builder);
    builder.print(", ").print(index).print(")");
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (!(obj instanceof BitImpl)) return false;
    final BitImpl that = (BitImpl) obj;
    return index == that.index && operand.equals(that.operand);
  }

  @Override
  public int hashCode() {
    return Objects.hash(operand, index);
  }
}
