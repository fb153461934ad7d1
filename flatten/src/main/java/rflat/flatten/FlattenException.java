package rflat.flatten;

/**
 * Rejection of a program that cannot be lowered to rank-1 constraints. The whole program is
 * rejected; no partially flattened output is ever produced.
 */
public class FlattenException extends Exception {
  private final FlattenErrorKind kind;
  private final int statementIndex;
  private final String offendingNode;

  public FlattenException(FlattenErrorKind kind, int statementIndex, String offendingNode) {
    super(mkMessage(kind, statementIndex, offendingNode));
    this.kind = kind;
    this.statementIndex = statementIndex;
    this.offendingNode = offendingNode;
  }

  public FlattenException(
      FlattenErrorKind kind, int statementIndex, String offendingNode, Throwable cause) {
    this(kind, statementIndex, offendingNode);
    initCause(cause);
  }

  public FlattenErrorKind kind() {
    return kind;
  }

  /** Index of the offending statement in the input program, -1 if unknown. */
  public int statementIndex() {
    return statementIndex;
  }

  public String offendingNode() {
    return offendingNode;
  }

  private static String mkMessage(FlattenErrorKind kind, int statementIndex, String node) {
    final StringBuilder builder = new StringBuilder(kind.description());
    if (statementIndex >= 0) builder.append(" (statement #").append(statementIndex).append(')');
    return builder.append(": ").append(node).toString();
  }
}
