package rflat.flatten;

import rflat.ast.ConstraintImpl;
import rflat.ast.DefinitionImpl;
import rflat.ast.Expression;
import rflat.ast.HintImpl;
import rflat.ast.Program;
import rflat.ast.ReturnImpl;
import rflat.ast.Statement;

import java.util.List;

import static rflat.ast.Statement.mkConstraint;
import static rflat.ast.Statement.mkDefinition;
import static rflat.ast.Statement.mkReturn;
import static rflat.ast.StatementKind.HINT;
import static rflat.flatten.FlattenContext.RETURN_NAME;
import static rflat.flatten.FlattenErrorKind.EXPRESSION_TOO_DEEP;
import static rflat.flatten.FlattenErrorKind.UNRESOLVABLE_EQUALITY;

/** Drives the pass over the statements of one program, in order. */
class ProgramFlattener {
  private final FlattenContext ctx;
  private final ExpressionFlattener expressions;

  ProgramFlattener(FlattenContext ctx) {
    this.ctx = ctx;
    this.expressions = new ExpressionFlattener(ctx);
  }

  Program flatten(Program program) throws FlattenException {
    ctx.reserveAll(program.arguments());
    // A hint assigns its target wherever it appears, so no symbol may take that name.
    final List<Statement> statements = program.statements();
    for (Statement statement : statements)
      if (statement.kind() == HINT) ctx.reserve(((HintImpl) statement).target());

    for (int i = 0, bound = statements.size(); i < bound; ++i) {
      ctx.setStatementIndex(i);
      flattenStatement(statements.get(i));
    }
    ctx.setStatementIndex(-1);

    return Program.mk(program.id(), program.arguments(), ctx.statements());
  }

  private void flattenStatement(Statement statement) throws FlattenException {
    switch (statement.kind()) {
      case RETURN -> {
        final Expression expr = substituted(((ReturnImpl) statement).expr());
        final Expression rhs = expressions.flatten(expr);
        ctx.reserve(RETURN_NAME);
        ctx.emit(mkReturn(rhs));
      }
      case DEFINITION -> {
        final DefinitionImpl definition = (DefinitionImpl) statement;
        final Expression rhs = expressions.flatten(substituted(definition.expr()));
        ctx.emit(mkDefinition(ctx.rename(definition.target()), rhs));
      }
      case CONSTRAINT -> {
        final ConstraintImpl constraint = (ConstraintImpl) statement;
        final Expression lhs = substituted(constraint.lhs());
        final Expression rhs = substituted(constraint.rhs());
        if (lhs.isLinear()) ctx.emit(mkConstraint(lhs, expressions.flatten(rhs)));
        else if (rhs.isLinear()) ctx.emit(mkConstraint(rhs, expressions.flatten(lhs)));
        else throw ctx.error(UNRESOLVABLE_EQUALITY, statement);
      }
      // Hints are instructions for the witness generator and are kept verbatim.
      case HINT -> ctx.emit(statement);
    }
  }

  private Expression substituted(Expression expr) throws FlattenException {
    final int depth = expr.depth();
    if (depth > ctx.maxDepth())
      throw ctx.error(EXPRESSION_TOO_DEEP, "depth " + depth + " > " + ctx.maxDepth());
    return expr.applySubstitution(ctx.substitution());
  }
}
