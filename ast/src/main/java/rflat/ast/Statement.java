package rflat.ast;

/**
 * A statement of a program. Return, definition and constraint statements are enforced by the
 * constraint system; hints only tell the witness generator how to compute a value.
 */
public abstract class Statement {

  public abstract StatementKind kind();

  public boolean isConstraintBearing() {
    return kind() != StatementKind.HINT;
  }

  protected abstract void prettyPrint(PrettyBuilder builder);

  @Override
  public String toString() {
    final PrettyBuilder builder = new PrettyBuilder();
    prettyPrint(builder);
    return builder.toString();
  }

  public static Statement mkReturn(Expression expr) {
    return new ReturnImpl(expr);
  }

  public static Statement mkDefinition(String target, Expression expr) {
    return new DefinitionImpl(target, expr);
  }

  public static Statement mkConstraint(Expression lhs, Expression rhs) {
    return new ConstraintImpl(lhs, rhs);
  }

  public static Statement mkHint(String target, Expression expr) {
    return new HintImpl(target, expr);
  }
}
