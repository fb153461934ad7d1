package rflat.flatten;

import rflat.ast.Expression;
import rflat.ast.Statement;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static rflat.ast.Statement.mkDefinition;

/**
 * State of one program flattening: names already in use, renamings of reassigned variables,
 * the symbol counter and the statements emitted so far. A context is created per program and
 * discarded afterwards.
 */
class FlattenContext {
  static final String RETURN_NAME = "~out";
  static final String SYMBOL_PREFIX = "sym_";

  private final int bits;
  private final int maxDepth;
  private final Set<String> usedNames;
  private final Map<String, String> substitution;
  private final List<Statement> statements;
  private int nextSymbolIdx;
  private int statementIndex;

  FlattenContext(int bits, int maxDepth) {
    this.bits = bits;
    this.maxDepth = maxDepth;
    this.usedNames = new HashSet<>();
    this.substitution = new HashMap<>();
    this.statements = new ArrayList<>();
    this.nextSymbolIdx = 0;
    this.statementIndex = -1;
  }

  int bits() {
    return bits;
  }

  int maxDepth() {
    return maxDepth;
  }

  Map<String, String> substitution() {
    return Collections.unmodifiableMap(substitution);
  }

  List<Statement> statements() {
    return statements;
  }

  void setStatementIndex(int statementIndex) {
    this.statementIndex = statementIndex;
  }

  void emit(Statement statement) {
    statements.add(statement);
  }

  boolean isUsed(String name) {
    return usedNames.contains(name);
  }

  void reserve(String name) {
    usedNames.add(name);
  }

  void reserveAll(Collection<String> names) {
    usedNames.addAll(names);
  }

  String freshName() {
    String name;
    do name = SYMBOL_PREFIX + nextSymbolIdx++;
    while (usedNames.contains(name));
    usedNames.add(name);
    return name;
  }

  /** A fresh symbol whose binary digit names {@link #digitName} are all unused as well. */
  String freshDigitBase() {
    String name;
    do name = SYMBOL_PREFIX + nextSymbolIdx++;
    while (usedNames.contains(name) || anyDigitUsed(name));
    usedNames.add(name);
    for (int i = 0; i < bits; ++i) usedNames.add(digitName(name, i));
    return name;
  }

  static String digitName(String base, int index) {
    return base + "_b" + index;
  }

  private boolean anyDigitUsed(String base) {
    for (int i = 0; i < bits; ++i) if (usedNames.contains(digitName(base, i))) return true;
    return false;
  }

  /**
   * Returns a physical name for a (re)definition of {@code name} that has never been used in
   * this program: {@code name} itself, else the first free of {@code name_0}, {@code name_1},
   * ... Later references to {@code name} are redirected to the returned name.
   */
  String rename(String name) {
    String candidate = name;
    int suffix = 0;
    while (usedNames.contains(candidate)) candidate = name + "_" + suffix++;

    usedNames.add(candidate);
    if (!candidate.equals(name)) substitution.put(name, candidate);
    return candidate;
  }

  /** Binds {@code expr} to a fresh symbol and returns a reference to it. */
  Expression bind(Expression expr) {
    final String name = freshName();
    emit(mkDefinition(name, expr));
    return Expression.mkVar(name);
  }

  FlattenException error(FlattenErrorKind kind, Object offendingNode) {
    return new FlattenException(kind, statementIndex, String.valueOf(offendingNode));
  }

  FlattenException error(FlattenErrorKind kind, Object offendingNode, Throwable cause) {
    return new FlattenException(kind, statementIndex, String.valueOf(offendingNode), cause);
  }
}
