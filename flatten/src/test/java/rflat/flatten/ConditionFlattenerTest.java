package rflat.flatten;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import rflat.ast.Condition;
import rflat.ast.ConditionKind;
import rflat.ast.Expression;
import rflat.ast.FieldElement;
import rflat.ast.Program;
import rflat.ast.Statement;
import rflat.ast.StatementKind;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static rflat.ast.Expression.mkAdd;
import static rflat.ast.Expression.mkBit;
import static rflat.ast.Expression.mkIfElse;
import static rflat.ast.Expression.mkMult;
import static rflat.ast.Statement.mkConstraint;
import static rflat.ast.Statement.mkHint;
import static rflat.ast.Statement.mkReturn;
import static rflat.flatten.TestHelper.countOfKind;
import static rflat.flatten.TestHelper.num;
import static rflat.flatten.TestHelper.program;
import static rflat.flatten.TestHelper.var;

@Tag("fast")
class ConditionFlattenerTest {

  // return (lhs cond rhs) ? 1 : 0, so the output is the true indicator
  private static Program indicatorProgram(ConditionKind kind) {
    return program(
        List.of("a", "b"),
        mkReturn(mkIfElse(Condition.mk(kind, var("a"), var("b")), num(1), num(0))));
  }

  @Test
  void testLessThanShape() throws FlattenException {
    final FlattenContext ctx = new FlattenContext(4, 512);
    final ExpressionFlattener expressions = new ExpressionFlattener(ctx);
    final ConditionFlattener conditions = new ConditionFlattener(ctx, expressions);

    final Pair<Expression, Expression> indicators =
        conditions.flatten(Condition.mkLt(var("a"), var("b")));

    assertEquals(var("sym_2_b3"), indicators.getLeft());
    assertEquals(var("sym_3"), indicators.getRight());

    final Program gadget = Program.mk("gadget", List.of("a", "b"), ctx.statements());
    // l, r, d and 1 - top digit
    assertEquals(4, countOfKind(gadget, StatementKind.DEFINITION));
    assertEquals(4, countOfKind(gadget, StatementKind.HINT));
    // one boolean check per digit plus the recomposition
    assertEquals(5, countOfKind(gadget, StatementKind.CONSTRAINT));

    assertTrue(
        ctx.statements().contains(mkHint("sym_2_b0", mkBit(var("sym_2"), 0))));
    assertTrue(
        ctx.statements()
            .contains(mkConstraint(var("sym_2_b1"), mkMult(var("sym_2_b1"), var("sym_2_b1")))));

    final Expression recomposition =
        mkAdd(
            mkAdd(
                mkAdd(mkMult(var("sym_2_b0"), num(1)), mkMult(var("sym_2_b1"), num(2))),
                mkMult(var("sym_2_b2"), num(4))),
            mkMult(var("sym_2_b3"), Expression.mkNumber(FieldElement.of(-8))));
    assertTrue(ctx.statements().contains(mkConstraint(var("sym_2"), recomposition)));
  }

  @Test
  void testLessThanIndicator() throws FlattenException {
    final Program flattened = Flattener.mk(8).flattenProgram(indicatorProgram(ConditionKind.LT));
    final long[][] cases = {{3, 5}, {5, 3}, {4, 4}, {0, 1}, {-60, 60}, {60, -60}, {-1, -2}, {0, 0}};
    for (long[] c : cases) {
      final WitnessEvaluator witness = WitnessEvaluator.run(flattened, c[0], c[1]);
      assertTrue(witness.isSatisfied(), () -> witness.violations().toString());
      final FieldElement expected = c[0] < c[1] ? FieldElement.one() : FieldElement.zero();
      assertEquals(expected, witness.output(), () -> c[0] + " < " + c[1]);
    }
  }

  @Test
  void testLessThanIndicatorsAreComplementary() throws FlattenException {
    final FlattenContext ctx = new FlattenContext(16, 512);
    final Pair<Expression, Expression> indicators =
        new ConditionFlattener(ctx, new ExpressionFlattener(ctx))
            .flatten(Condition.mkLt(var("a"), num(1000)));

    final List<Statement> statements = new ArrayList<>(ctx.statements());
    statements.add(mkReturn(var("a")));
    final Program program = Program.mk("main", List.of("a"), statements);
    for (long a : new long[] {-5, 0, 999, 1000, 1001, 20000}) {
      final WitnessEvaluator witness = WitnessEvaluator.run(program, a);
      assertTrue(witness.isSatisfied());
      final FieldElement condTrue = witness.eval(indicators.getLeft());
      final FieldElement condFalse = witness.eval(indicators.getRight());
      assertEquals(FieldElement.one(), condTrue.add(condFalse));
      assertEquals(a < 1000, condTrue.equals(FieldElement.one()));
    }
  }

  @Test
  void testLessThanOutOfRangeIsUnsound() throws FlattenException {
    // 200 - 0 does not fit in 8 signed digits: the bit hints cannot satisfy the recomposition
    final Program flattened = Flattener.mk(8).flattenProgram(indicatorProgram(ConditionKind.LT));
    assertFalse(WitnessEvaluator.run(flattened, 200, 0).isSatisfied());
  }

  @Test
  void testEqualShape() throws FlattenException {
    final FlattenContext ctx = new FlattenContext(8, 512);
    final ConditionFlattener conditions =
        new ConditionFlattener(ctx, new ExpressionFlattener(ctx));

    final Pair<Expression, Expression> indicators =
        conditions.flatten(Condition.mkEq(var("a"), var("b")));

    assertEquals(var("sym_1"), indicators.getLeft());
    assertEquals(var("sym_2"), indicators.getRight());
    assertEquals(
        List.of(
            "sym_0 = a - b",
            "sym_1 := if sym_0 == 0 then 1 else 0 fi",
            "sym_2 = 1 - sym_1",
            "sym_3 = sym_0 - sym_1",
            "sym_4 := 1 / sym_3",
            "0 == sym_0 * sym_1",
            "0 == sym_1 * sym_2",
            "1 == sym_3 * sym_4"),
        ctx.statements().stream().map(Object::toString).toList());
  }

  @Test
  void testEqualIndicator() throws FlattenException {
    final Program flattened = Flattener.mk(8).flattenProgram(indicatorProgram(ConditionKind.EQ));
    final long[][] cases = {{3, 3}, {3, 4}, {0, 0}, {-7, -7}, {-7, 7}, {1 << 20, 1 << 20}};
    for (long[] c : cases) {
      final WitnessEvaluator witness = WitnessEvaluator.run(flattened, c[0], c[1]);
      assertTrue(witness.isSatisfied(), () -> witness.violations().toString());
      final FieldElement expected = c[0] == c[1] ? FieldElement.one() : FieldElement.zero();
      assertEquals(expected, witness.output(), () -> c[0] + " == " + c[1]);
    }
  }

  @Test
  void testEqualRejectsForgedIndicator() throws FlattenException {
    final Program flattened = Flattener.mk(8).flattenProgram(indicatorProgram(ConditionKind.EQ));
    // claim a == b for 3 and 4 by replacing the hint for d
    final List<Statement> forged = new ArrayList<>();
    for (Statement statement : flattened.statements()) {
      if (statement.kind() == StatementKind.HINT && statement.toString().startsWith("sym_1 :="))
        forged.add(mkHint("sym_1", num(1)));
      else forged.add(statement);
    }
    final Program program = Program.mk("main", flattened.arguments(), forged);
    assertFalse(WitnessEvaluator.run(program, 3, 4).isSatisfied());
  }

  @Test
  void testUnsupportedConditions() {
    for (ConditionKind kind : List.of(ConditionKind.LE, ConditionKind.GE, ConditionKind.GT)) {
      final FlattenException ex =
          assertThrows(
              FlattenException.class,
              () -> Flattener.mk(8).flattenProgram(indicatorProgram(kind)));
      assertEquals(FlattenErrorKind.UNSUPPORTED_CONDITION, ex.kind());
      assertEquals(0, ex.statementIndex());
    }
  }
}
