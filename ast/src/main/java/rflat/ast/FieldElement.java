package rflat.ast;

import java.math.BigInteger;

/**
 * An element of the scalar field of BN254 (alt_bn128), the default field of libsnark-based
 * proving back ends. Values are kept as their canonical representative in [0, p).
 */
public final class FieldElement implements Comparable<FieldElement> {
  public static final BigInteger MODULUS =
      new BigInteger(
          "21888242871839275222246405745257275088548364400416034343698204186575808495617");
  public static final int MODULUS_BITS = MODULUS.bitLength();

  private static final BigInteger HALF_MODULUS = MODULUS.shiftRight(1);
  private static final FieldElement ZERO = new FieldElement(BigInteger.ZERO);
  private static final FieldElement ONE = new FieldElement(BigInteger.ONE);

  private final BigInteger value;

  private FieldElement(BigInteger value) {
    this.value = value;
  }

  public static FieldElement zero() {
    return ZERO;
  }

  public static FieldElement one() {
    return ONE;
  }

  public static FieldElement of(long value) {
    return of(BigInteger.valueOf(value));
  }

  public static FieldElement of(BigInteger value) {
    return new FieldElement(value.mod(MODULUS));
  }

  public static FieldElement of(String decimal) {
    return of(new BigInteger(decimal));
  }

  public FieldElement add(FieldElement other) {
    return of(value.add(other.value));
  }

  public FieldElement sub(FieldElement other) {
    return of(value.subtract(other.value));
  }

  public FieldElement mul(FieldElement other) {
    return of(value.multiply(other.value));
  }

  public FieldElement div(FieldElement other) {
    return mul(other.inverse());
  }

  public FieldElement negate() {
    return of(value.negate());
  }

  public FieldElement inverse() {
    if (isZero()) throw new ArithmeticException("inverse of zero");
    return new FieldElement(value.modInverse(MODULUS));
  }

  public FieldElement pow(int exponent) {
    if (exponent < 0) throw new IllegalArgumentException("negative exponent " + exponent);
    return new FieldElement(value.modPow(BigInteger.valueOf(exponent), MODULUS));
  }

  public boolean isZero() {
    return value.signum() == 0;
  }

  public BigInteger toBigInteger() {
    return value;
  }

  /** The representative in (-p/2, p/2]. Values above (p-1)/2 read as negative. */
  public BigInteger toSignedBigInteger() {
    return value.compareTo(HALF_MODULUS) > 0 ? value.subtract(MODULUS) : value;
  }

  /** @throws ArithmeticException if the canonical representative does not fit an int */
  public int intValueExact() {
    return value.intValueExact();
  }

  @Override
  public int compareTo(FieldElement other) {
    return value.compareTo(other.value);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (!(obj instanceof FieldElement)) return false;
    return value.equals(((FieldElement) obj).value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
