package rflat.ast;

public enum ExprKind {
  NUMBER,
  VAR,
  ADD,
  SUB,
  MULT,
  DIV,
  POW,
  IF_ELSE,
  BIT;

  public boolean isAtomic() {
    return this == NUMBER || this == VAR;
  }
}
