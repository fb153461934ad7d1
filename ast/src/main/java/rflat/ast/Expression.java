package rflat.ast;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static rflat.ast.ExprKind.NUMBER;
import static rflat.ast.ExprKind.VAR;

/**
 * An arithmetic expression over field elements. Expressions are immutable: every
 * transformation builds a new tree and shares the unchanged sub-trees.
 */
public abstract class Expression {

  public abstract ExprKind kind();

  /** Direct sub-expressions. For if-else this includes both sides of the condition. */
  public abstract List<Expression> subExpressions();

  /**
   * Whether this is an affine combination: literals and variables joined by additions and
   * subtractions, where a product or quotient only ever scales by a literal.
   */
  public abstract boolean isLinear();

  /** Whether this can be the right-hand side of a single rank-1 constraint as it is. */
  public abstract boolean isFlattened();

  /** Rebuilds bottom-up, applying {@code transformer} to every rebuilt node. */
  public abstract Expression transformPostOrder(Function<Expression, Expression> transformer);

  protected abstract void prettyPrint(PrettyBuilder builder);

  public boolean isNumber() {
    return kind() == NUMBER;
  }

  public boolean isVariable() {
    return kind() == VAR;
  }

  /**
   * Replaces every referenced variable found in {@code substitution} by its image. Each
   * leaf is looked up once: images are not substituted again.
   */
  public Expression applySubstitution(Map<String, String> substitution) {
    if (substitution.isEmpty()) return this;
    return transformPostOrder(
        expr -> {
          if (!expr.isVariable()) return expr;
          final String replacement = substitution.get(((VariableImpl) expr).name());
          return replacement == null ? expr : mkVar(replacement);
        });
  }

  /** Height of the tree. A condition counts as one level between an if-else and its operands. */
  public int depth() {
    int max = 0;
    final Deque<Frame> stack = new ArrayDeque<>();
    stack.push(new Frame(this, 1));
    while (!stack.isEmpty()) {
      final Frame frame = stack.pop();
      max = Math.max(max, frame.level());
      if (frame.expr() instanceof IfElseImpl ifElse) {
        stack.push(new Frame(ifElse.condition().lhs(), frame.level() + 2));
        stack.push(new Frame(ifElse.condition().rhs(), frame.level() + 2));
        stack.push(new Frame(ifElse.consequent(), frame.level() + 1));
        stack.push(new Frame(ifElse.alternative(), frame.level() + 1));
      } else {
        for (Expression sub : frame.expr().subExpressions())
          stack.push(new Frame(sub, frame.level() + 1));
      }
    }
    return max;
  }

  private record Frame(Expression expr, int level) {}

  @Override
  public String toString() {
    final PrettyBuilder builder = new PrettyBuilder();
    prettyPrint(builder);
    return builder.toString();
  }

  protected static void prettyPrintOperand(PrettyBuilder builder, Expression operand) {
    if (operand.kind().isAtomic()) {
      operand.prettyPrint(builder);
    } else {
      builder.print("(");
      operand.prettyPrint(builder);
      builder.print(")");
    }
  }

  public static Expression mkNumber(FieldElement value) {
    return new NumberLiteralImpl(value);
  }

  public static Expression mkNumber(long value) {
    return new NumberLiteralImpl(FieldElement.of(value));
  }

  public static Expression mkVar(String name) {
    return new VariableImpl(name);
  }

  public static Expression mkAdd(Expression left, Expression right) {
    return new AddImpl(left, right);
  }

  public static Expression mkSub(Expression left, Expression right) {
    return new SubImpl(left, right);
  }

  public static Expression mkMult(Expression left, Expression right) {
    return new MultImpl(left, right);
  }

  public static Expression mkDiv(Expression left, Expression right) {
    return new DivImpl(left, right);
  }

  public static Expression mkPow(Expression base, Expression exponent) {
    return new PowImpl(base, exponent);
  }

  public static Expression mkIfElse(
      Condition condition, Expression consequent, Expression alternative) {
    return new IfElseImpl(condition, consequent, alternative);
  }

  /** Binary digit {@code index} of the two's-complement form of the signed lift of operand. */
  public static Expression mkBit(Expression operand, int index) {
    return new BitImpl(operand, index);
  }
}
