package rflat.ast;

public enum StatementKind {
  RETURN,
  DEFINITION,
  CONSTRAINT,
  HINT
}
