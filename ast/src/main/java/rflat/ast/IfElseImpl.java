package rflat.ast;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

public class IfElseImpl extends Expression {

  private final Condition condition;
  private final Expression consequent;
  private final Expression alternative;

  IfElseImpl(Condition condition, Expression consequent, Expression alternative) {
    this.condition = Objects.requireNonNull(condition);
    this.consequent = Objects.requireNonNull(consequent);
    this.alternative = Objects.requireNonNull(alternative);
  }

  public Condition condition() {
    return condition;
  }

  public Expression consequent() {
    return consequent;
  }

  public Expression alternative() {
    return alternative;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.IF_ELSE;
  }

  @Override
  public List<Expression> subExpressions() {
    return List.of(condition.lhs(), condition.rhs(), consequent, alternative);
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
    final Condition condition0 = condition.transformPostOrder(transformer);
    final Expression consequent0 = consequent.transformPostOrder(transformer);
    final Expression alternative0 = alternative.transformPostOrder(transformer);
    if (condition0 == condition && consequent0 == consequent && alternative0 == alternative)
      return transformer.apply(this);
    return transformer.apply(mkIfElse(condition0, consequent0, alternative0));
  }

  @Override
  protected void prettyPrint(PrettyBuilder builder) {
    builder.print("if ").print(condition).print(" then ");
    consequent.prettyPrint(builder);
    builder.print(" else ");
    alternative.prettyPrint(builder);
    builder.print(" fi");
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (!(obj instanceof IfElseImpl)) return false;
    final IfElseImpl that = (IfElseImpl) obj;
    return condition.equals(that.condition)
        && consequent.equals(that.consequent)
        && alternative.equals(that.alternative);
  }

  @Override
  public int hashCode() {
    return Objects.hash(condition, consequent, alternative);
  }
}
