package rflat.ast;

import java.util.List;
import java.util.function.Function;

public class VariableImpl extends Expression {

  private final String name;

  VariableImpl(String name) {
    if (name == null || name.isEmpty()) throw new IllegalArgumentException("empty variable name");
    this.name = name;
  }

  public String name() {
    return name;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.VAR;
  }

  @Override
  public List<Expression> subExpressions() {
    return List.of();
  }

  @Override
  public boolean isLinear() {
    return true;
  }

  @Override
  public boolean isFlattened() {
    return true;
  }

  @Override
  public Expression transformPostOrder(Function<Expression, Expression> transformer) {
    return transformer.apply(this);
  }

  @Override
  protected void prettyPrint(PrettyBuilder builder) {
    builder.print(name);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (!(obj instanceof VariableImpl)) return false;
    return name.equals(((VariableImpl) obj).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }
}
