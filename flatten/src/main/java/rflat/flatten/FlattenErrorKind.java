package rflat.flatten;

public enum FlattenErrorKind {
  UNSUPPORTED_EXPONENT("expected a number in [2, 65536] as exponent"),
  UNSUPPORTED_POWER_BASE("only variables and numbers are allowed as base of a power"),
  UNSUPPORTED_CONDITION("only < and == conditions can be flattened"),
  UNRESOLVABLE_EQUALITY("neither side of the equality is linear"),
  UNSUPPORTED_EXPRESSION("expression cannot appear outside a hint"),
  EXPRESSION_TOO_DEEP("expression nesting exceeds the depth limit");

  private final String description;

  FlattenErrorKind(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
