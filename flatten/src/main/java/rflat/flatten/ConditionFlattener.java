package rflat.flatten;

import org.apache.commons.lang3.tuple.Pair;
import rflat.ast.Condition;
import rflat.ast.Expression;
import rflat.ast.FieldElement;

import static rflat.ast.Expression.mkAdd;
import static rflat.ast.Expression.mkBit;
import static rflat.ast.Expression.mkDiv;
import static rflat.ast.Expression.mkIfElse;
import static rflat.ast.Expression.mkMult;
import static rflat.ast.Expression.mkNumber;
import static rflat.ast.Expression.mkSub;
import static rflat.ast.Expression.mkVar;
import static rflat.ast.Statement.mkConstraint;
import static rflat.ast.Statement.mkDefinition;
import static rflat.ast.Statement.mkHint;
import static rflat.flatten.FlattenContext.digitName;
import static rflat.flatten.FlattenErrorKind.UNSUPPORTED_CONDITION;

/**
 * Lowers a condition to a pair of indicators (c_true, c_false). Given a satisfying witness
 * exactly one of them is 1 and the other is 0.
 */
class ConditionFlattener {
  private final FlattenContext ctx;
  private final ExpressionFlattener expressions;

  ConditionFlattener(FlattenContext ctx, ExpressionFlattener expressions) {
    this.ctx = ctx;
    this.expressions = expressions;
  }

  Pair<Expression, Expression> flatten(Condition condition) throws FlattenException {
    return switch (condition.kind()) {
      case LT -> flattenLessThan(condition);
      case EQ -> flattenEqual(condition);
      default -> throw ctx.error(UNSUPPORTED_CONDITION, condition);
    };
  }

  /**
   * Decomposes d = lhs - rhs into {@code bits} binary digits with weights 2^i, except the top
   * digit which weighs -2^(bits-1). The top digit is then the sign of d, i.e. lhs < rhs.
   * Only sound while d lies in [-2^(bits-1), 2^(bits-1)).
   */
  private Pair<Expression, Expression> flattenLessThan(Condition condition)
      throws FlattenException {
    final int bits = ctx.bits();
    final Expression lhs = expressions.flatten(condition.lhs());
    final Expression rhs = expressions.flatten(condition.rhs());
    final Expression lhsVar = ctx.bind(lhs);
    final Expression rhsVar = ctx.bind(rhs);

    final String diff = ctx.freshDigitBase();
    ctx.emit(mkDefinition(diff, mkSub(lhsVar, rhsVar)));

    for (int i = 0; i < bits; ++i) {
      final Expression digit = mkVar(digitName(diff, i));
      ctx.emit(mkHint(digitName(diff, i), mkBit(mkVar(diff), i)));
      // b == b * b  <=>  b in {0, 1}
      ctx.emit(mkConstraint(digit, mkMult(digit, digit)));
    }

    final FieldElement two = FieldElement.of(2);
    Expression recomposed = mkMult(mkVar(digitName(diff, 0)), mkNumber(FieldElement.one()));
    for (int i = 1; i < bits - 1; ++i)
      recomposed = mkAdd(recomposed, mkMult(mkVar(digitName(diff, i)), mkNumber(two.pow(i))));
    final FieldElement topWeight = two.pow(bits - 1).negate();
    final Expression condTrue = mkVar(digitName(diff, bits - 1));
    recomposed = mkAdd(recomposed, mkMult(condTrue, mkNumber(topWeight)));
    ctx.emit(mkConstraint(mkVar(diff), recomposed));

    final Expression condFalse = ctx.bind(mkSub(mkNumber(1), condTrue));
    return Pair.of(condTrue, condFalse);
  }

  /**
   * With c = lhs - rhs: c * d = 0, d * (1 - d) = 0 and (c - d) * w = 1 force d to be 1 if c is
   * zero and 0 otherwise. d and w are supplied by hints.
   */
  private Pair<Expression, Expression> flattenEqual(Condition condition)
      throws FlattenException {
    final Expression c =
        ctx.bind(expressions.flatten(mkSub(condition.lhs(), condition.rhs())));
    final String d = ctx.freshName();
    final String oneMinusD = ctx.freshName();
    final String cMinusD = ctx.freshName();
    final String w = ctx.freshName();

    ctx.emit(mkHint(d, mkIfElse(Condition.mkEq(c, mkNumber(0)), mkNumber(1), mkNumber(0))));
    ctx.emit(mkDefinition(oneMinusD, mkSub(mkNumber(1), mkVar(d))));
    ctx.emit(mkDefinition(cMinusD, mkSub(c, mkVar(d))));
    ctx.emit(mkHint(w, mkDiv(mkNumber(1), mkVar(cMinusD))));

    ctx.emit(mkConstraint(mkNumber(0), mkMult(c, mkVar(d))));
    ctx.emit(mkConstraint(mkNumber(0), mkMult(mkVar(d), mkVar(oneMinusD))));
    ctx.emit(mkConstraint(mkNumber(1), mkMult(mkVar(cMinusD), mkVar(w))));

    return Pair.of(mkVar(d), mkVar(oneMinusD));
  }
}
