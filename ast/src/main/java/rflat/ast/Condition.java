package rflat.ast;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/** A binary relation between two expressions, the guard of an if-else. */
public final class Condition {

  private final ConditionKind kind;
  private final Expression lhs;
  private final Expression rhs;

  private Condition(ConditionKind kind, Expression lhs, Expression rhs) {
    this.kind = Objects.requireNonNull(kind);
    this.lhs = Objects.requireNonNull(lhs);
    this.rhs = Objects.requireNonNull(rhs);
  }

  public static Condition mk(ConditionKind kind, Expression lhs, Expression rhs) {
    return new Condition(kind, lhs, rhs);
  }

  public static Condition mkLt(Expression lhs, Expression rhs) {
    return new Condition(ConditionKind.LT, lhs, rhs);
  }

  public static Condition mkEq(Expression lhs, Expression rhs) {
    return new Condition(ConditionKind.EQ, lhs, rhs);
  }

  public ConditionKind kind() {
    return kind;
  }

  public Expression lhs() {
    return lhs;
  }

  public Expression rhs() {
    return rhs;
  }

  public Condition transformPostOrder(Function<Expression, Expression> transformer) {
    final Expression lhs0 = lhs.transformPostOrder(transformer);
    final Expression rhs0 = rhs.transformPostOrder(transformer);
    if (lhs0 == lhs && rhs0 == rhs) return this;
    return new Condition(kind, lhs0, rhs0);
  }

  public Condition applySubstitution(Map<String, String> substitution) {
    return new Condition(
        kind, lhs.applySubstitution(substitution), rhs.applySubstitution(substitution));
  }

  public int depth() {
    return 1 + Math.max(lhs.depth(), rhs.depth());
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (!(obj instanceof Condition)) return false;
    final Condition that = (Condition) obj;
    return kind == that.kind && lhs.equals(that.lhs) && rhs.equals(that.rhs);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, lhs, rhs);
  }

  @Override
  public String toString() {
    return lhs + " " + kind.text() + " " + rhs;
  }
}
