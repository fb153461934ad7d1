package rflat.flatten;

import org.apache.commons.lang3.tuple.Pair;
import rflat.ast.BinaryExpression;
import rflat.ast.ExprKind;
import rflat.ast.Expression;
import rflat.ast.FieldElement;
import rflat.ast.IfElseImpl;
import rflat.ast.NumberLiteralImpl;
import rflat.ast.PowImpl;

import static rflat.ast.Expression.mkAdd;
import static rflat.ast.Expression.mkDiv;
import static rflat.ast.Expression.mkMult;
import static rflat.ast.Expression.mkSub;
import static rflat.flatten.FlattenErrorKind.UNSUPPORTED_EXPONENT;
import static rflat.flatten.FlattenErrorKind.UNSUPPORTED_EXPRESSION;
import static rflat.flatten.FlattenErrorKind.UNSUPPORTED_POWER_BASE;

/**
 * Rewrites an expression so that every product and quotient has linear operands, binding
 * sub-expressions to fresh symbols in the context's statement buffer where needed.
 */
class ExpressionFlattener {
  /** Largest exponent unrolled. Each unit of exponent costs one definition. */
  static final int MAX_EXPONENT = 1 << 16;

  private final FlattenContext ctx;
  private final ConditionFlattener conditions;

  ExpressionFlattener(FlattenContext ctx) {
    this.ctx = ctx;
    this.conditions = new ConditionFlattener(ctx, this);
  }

  Expression flatten(Expression expr) throws FlattenException {
    switch (expr.kind()) {
      case NUMBER, VAR -> {
        return expr;
      }
      case ADD, SUB, MULT, DIV -> {
        if (expr.isFlattened()) return expr;
        return flattenArithmetic((BinaryExpression) expr);
      }
      case POW -> {
        return flattenPow((PowImpl) expr);
      }
      case IF_ELSE -> {
        // c_true * consequent + c_false * alternative
        final IfElseImpl ifElse = (IfElseImpl) expr;
        final Pair<Expression, Expression> indicators = conditions.flatten(ifElse.condition());
        return flatten(
            mkAdd(
                mkMult(indicators.getLeft(), ifElse.consequent()),
                mkMult(indicators.getRight(), ifElse.alternative())));
      }
      default -> throw ctx.error(UNSUPPORTED_EXPRESSION, expr);
    }
  }

  private Expression flattenArithmetic(BinaryExpression expr) throws FlattenException {
    final ExprKind kind = expr.kind();
    final Expression left = flatten(expr.left());
    final Expression right = flatten(expr.right());

    if (kind == ExprKind.MULT) {
      final Expression newLeft = asFactor(left);
      final Expression newRight = asFactor(right);
      return mkMult(newLeft, newRight);
    }

    final Expression newLeft = asLinear(left);
    final Expression newRight = asLinear(right);
    return switch (kind) {
      case ADD -> mkAdd(newLeft, newRight);
      case SUB -> mkSub(newLeft, newRight);
      default -> mkDiv(newLeft, newRight);
    };
  }

  private Expression asLinear(Expression flattened) {
    return flattened.isLinear() ? flattened : ctx.bind(flattened);
  }

  // A subtraction is never used directly as a factor of a product, even though it is linear.
  private Expression asFactor(Expression flattened) {
    if (flattened.isLinear() && flattened.kind() != ExprKind.SUB) return flattened;
    return ctx.bind(flattened);
  }

  /**
   * x**n becomes x*x for n = 2. For larger n the product for n-1 is bound to a fresh symbol
   * and multiplied by x once more, which costs one multiplication per unit of exponent.
   */
  private Expression flattenPow(PowImpl pow) throws FlattenException {
    final Expression exponent = pow.exponent();
    if (!exponent.isNumber()) throw ctx.error(UNSUPPORTED_EXPONENT, pow);

    final FieldElement value = ((NumberLiteralImpl) exponent).value();
    if (value.compareTo(FieldElement.one()) <= 0) throw ctx.error(UNSUPPORTED_EXPONENT, pow);

    final int n;
    try {
      n = value.intValueExact();
    } catch (ArithmeticException ex) {
      throw ctx.error(UNSUPPORTED_EXPONENT, pow, ex);
    }
    if (n > MAX_EXPONENT) throw ctx.error(UNSUPPORTED_EXPONENT, pow);

    final Expression base = pow.base();
    if (!base.isNumber() && !base.isVariable()) throw ctx.error(UNSUPPORTED_POWER_BASE, pow);

    Expression product = mkMult(base, base);
    for (int i = 3; i <= n; ++i) product = mkMult(ctx.bind(product), base);
    return product;
  }
}
