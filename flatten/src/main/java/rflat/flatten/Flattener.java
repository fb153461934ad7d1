package rflat.flatten;

import rflat.ast.FieldElement;
import rflat.ast.Program;

import java.util.logging.Logger;

/**
 * Lowers a program to statements that are directly encodable as rank-1 constraints: every
 * product or quotient has linear operands, comparisons are replaced by boolean gadgets and
 * every variable is defined exactly once.
 *
 * <p>An instance only holds the configuration. All state of a run lives in a context created
 * by {@link #flattenProgram}, so an instance can be reused, though not concurrently by
 * several threads sharing one program.
 */
public class Flattener {
  private static final Logger LOG = Logger.getLogger(Flattener.class.getName());

  private final int bits;
  private final int maxDepth;

  private Flattener(int bits, int maxDepth) {
    this.bits = bits;
    this.maxDepth = maxDepth;
  }

  /**
   * @param bits width of the binary decomposition used by the {@code <} gadget. Comparisons
   *     are only sound for operands whose difference fits in {@code bits} signed digits;
   *     choosing a width large enough is the caller's responsibility.
   */
  public static Flattener mk(int bits) {
    return mk(bits, FlattenSupport.defaultMaxDepth());
  }

  public static Flattener mk(int bits, int maxDepth) {
    if (bits < 2 || bits >= FieldElement.MODULUS_BITS)
      throw new IllegalArgumentException(
          "bit width must be in [2, " + (FieldElement.MODULUS_BITS - 1) + "]: " + bits);
    if (maxDepth < 1) throw new IllegalArgumentException("depth limit must be positive");
    return new Flattener(bits, maxDepth);
  }

  public int bits() {
    return bits;
  }

  public int maxDepth() {
    return maxDepth;
  }

  public Program flattenProgram(Program program) throws FlattenException {
    final FlattenContext ctx = new FlattenContext(bits, maxDepth);
    final Program flattened;
    try {
      flattened = new ProgramFlattener(ctx).flatten(program);
    } catch (FlattenException ex) {
      LOG.warning("rejected " + program.id() + ": " + ex.getMessage());
      throw ex;
    }

    assert FlattenedForm.isFlattened(flattened) : FlattenedForm.violations(flattened);
    LOG.fine(
        () ->
            "flattened "
                + program.id()
                + ": "
                + program.statements().size()
                + " -> "
                + flattened.statements().size()
                + " statements");
    return flattened;
  }
}
