package rflat.ast;

import java.util.List;
import java.util.function.Function;

public class NumberLiteralImpl extends Expression {

  private final FieldElement value;

  NumberLiteralImpl(FieldElement value) {
    this.value = value;
  }

  public FieldElement value() {
    return value;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.NUMBER;
  }

  @Override
  public List<Expression> subExpressions() {
    return List.of();
  }

  @Override
  public boolean isLinear() {
    return true;
  }

  @Override
  public boolean isFlattened() {
    return true;
  }

  @Override
  public Expression transformPostOrder(Function<Expression, Expression> transformer) {
    return transformer.apply(this);
  }

  @Override
  protected void prettyPrint(PrettyBuilder builder) {
    builder.print(value);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (!(obj instanceof NumberLiteralImpl)) return false;
    return value.equals(((NumberLiteralImpl) obj).value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }
}
