package rflat.ast;

public enum ConditionKind {
  LT("<"),
  LE("<="),
  EQ("=="),
  GE(">="),
  GT(">");

  private final String text;

  ConditionKind(String text) {
    this.text = text;
  }

  public String text() {
    return text;
  }
}
