package rflat.flatten;

import com.google.common.collect.ImmutableList;
import rflat.ast.ConstraintImpl;
import rflat.ast.DefinitionImpl;
import rflat.ast.ExprKind;
import rflat.ast.Expression;
import rflat.ast.Program;
import rflat.ast.ReturnImpl;
import rflat.ast.Statement;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Checks the shape of flattened programs: definitions and returns are flattened, products
 * and quotients have linear operands, every constraint has a linear side and no variable is
 * defined twice. Hints are not checked.
 */
public abstract class FlattenedForm {
  private FlattenedForm() {}

  public static boolean isFlattened(Program program) {
    return violations(program).isEmpty();
  }

  public static ImmutableList<String> violations(Program program) {
    final ImmutableList.Builder<String> violations = ImmutableList.builder();
    final Set<String> defined = new HashSet<>();

    for (Statement statement : program.statements()) {
      switch (statement.kind()) {
        case RETURN -> checkFlattened(((ReturnImpl) statement).expr(), statement, violations);
        case DEFINITION -> {
          final DefinitionImpl definition = (DefinitionImpl) statement;
          if (!defined.add(definition.target()))
            violations.add("redefinition of " + definition.target() + ": " + statement);
          checkFlattened(definition.expr(), statement, violations);
        }
        case CONSTRAINT -> {
          final ConstraintImpl constraint = (ConstraintImpl) statement;
          final Expression lhs = constraint.lhs(), rhs = constraint.rhs();
          if (lhs.isLinear()) checkFlattened(rhs, statement, violations);
          else if (rhs.isLinear()) checkFlattened(lhs, statement, violations);
          else violations.add("no linear side: " + statement);
        }
        case HINT -> {}
      }
    }
    return violations.build();
  }

  private static void checkFlattened(
      Expression expr, Statement owner, ImmutableList.Builder<String> violations) {
    if (!expr.isFlattened()) {
      violations.add("not flattened: " + owner);
      return;
    }
    final Deque<Expression> stack = new ArrayDeque<>();
    stack.push(expr);
    while (!stack.isEmpty()) {
      final Expression e = stack.pop();
      final ExprKind kind = e.kind();
      if (kind == ExprKind.MULT || kind == ExprKind.DIV) {
        for (Expression operand : e.subExpressions())
          if (!operand.isLinear()) violations.add("non-linear operand " + operand + ": " + owner);
      }
      e.subExpressions().forEach(stack::push);
    }
  }
}
