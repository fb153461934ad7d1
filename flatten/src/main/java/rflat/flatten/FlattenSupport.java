package rflat.flatten;

import rflat.ast.Program;

public abstract class FlattenSupport {
  public static final String BITS_PROPERTY = "rflat.flatten.bits";
  public static final String MAX_DEPTH_PROPERTY = "rflat.flatten.maxDepth";

  static final int DEFAULT_BITS = 64;
  static final int DEFAULT_MAX_DEPTH = 512;

  private FlattenSupport() {}

  public static int defaultBits() {
    return Integer.getInteger(BITS_PROPERTY, DEFAULT_BITS);
  }

  public static int defaultMaxDepth() {
    return Integer.getInteger(MAX_DEPTH_PROPERTY, DEFAULT_MAX_DEPTH);
  }

  public static Program flattenProgram(Program program) throws FlattenException {
    return Flattener.mk(defaultBits(), defaultMaxDepth()).flattenProgram(program);
  }

  public static boolean isFlattenedProgram(Program program) {
    return FlattenedForm.isFlattened(program);
  }
}
