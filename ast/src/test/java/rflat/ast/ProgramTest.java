package rflat.ast;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static rflat.ast.Expression.mkAdd;
import static rflat.ast.Expression.mkDiv;
import static rflat.ast.Expression.mkMult;
import static rflat.ast.Expression.mkNumber;
import static rflat.ast.Expression.mkVar;
import static rflat.ast.Statement.mkConstraint;
import static rflat.ast.Statement.mkDefinition;
import static rflat.ast.Statement.mkHint;
import static rflat.ast.Statement.mkReturn;

class ProgramTest {

  @Test
  void testPrinting() {
    final Program program =
        Program.mk(
            "main",
            List.of("a", "b"),
            List.of(
                mkHint("inv", mkDiv(mkNumber(1), mkVar("b"))),
                mkConstraint(mkNumber(1), mkMult(mkVar("b"), mkVar("inv"))),
                mkDefinition("x", mkMult(mkVar("a"), mkVar("inv"))),
                mkReturn(mkAdd(mkVar("x"), mkNumber(1)))));

    assertEquals(
        "def main(a, b):\n"
            + "  inv := 1 / b\n"
            + "  1 == b * inv\n"
            + "  x = a * inv\n"
            + "  return x + 1\n",
        program.toString());
  }

  @Test
  void testStatementsAreCopied() {
    final List<Statement> statements = new ArrayList<>();
    statements.add(mkReturn(mkVar("a")));
    final Program program = Program.mk("f", List.of("a"), statements);
    statements.add(mkReturn(mkVar("b")));

    assertEquals(1, program.statements().size());
    assertEquals(program, Program.mk("f", List.of("a"), List.of(mkReturn(mkVar("a")))));
  }

  @Test
  void testConstraintBearing() {
    assertTrue(mkReturn(mkVar("a")).isConstraintBearing());
    assertTrue(mkDefinition("x", mkVar("a")).isConstraintBearing());
    assertTrue(mkConstraint(mkVar("a"), mkVar("b")).isConstraintBearing());
    assertFalse(mkHint("x", mkVar("a")).isConstraintBearing());
  }

  @Test
  void testEmptyTargetRejected() {
    assertThrows(IllegalArgumentException.class, () -> mkDefinition("", mkVar("a")));
  }
}
