package rflat.ast;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FieldElementTest {

  @Test
  void testReduction() {
    assertEquals(FieldElement.zero(), FieldElement.of(FieldElement.MODULUS));
    assertEquals(FieldElement.MODULUS.subtract(BigInteger.ONE), FieldElement.of(-1).toBigInteger());
    assertEquals(FieldElement.of(5), FieldElement.of("5"));
    assertEquals(254, FieldElement.MODULUS_BITS);
  }

  @Test
  void testArithmetic() {
    final FieldElement a = FieldElement.of(7), b = FieldElement.of(3);
    assertEquals(FieldElement.of(10), a.add(b));
    assertEquals(FieldElement.of(-4), b.sub(a));
    assertEquals(FieldElement.of(21), a.mul(b));
    assertEquals(a, a.div(b).mul(b));
    assertEquals(FieldElement.zero(), a.add(a.negate()));
    assertEquals(FieldElement.of(343), a.pow(3));
    assertEquals(FieldElement.one(), a.pow(0));
  }

  @Test
  void testInverse() {
    final FieldElement x = FieldElement.of("123456789123456789");
    assertEquals(FieldElement.one(), x.mul(x.inverse()));
    assertThrows(ArithmeticException.class, () -> FieldElement.zero().inverse());
    assertThrows(ArithmeticException.class, () -> FieldElement.one().div(FieldElement.zero()));
  }

  @Test
  void testSignedLift() {
    assertEquals(BigInteger.valueOf(-5), FieldElement.of(-5).toSignedBigInteger());
    assertEquals(BigInteger.valueOf(5), FieldElement.of(5).toSignedBigInteger());
    final FieldElement half = FieldElement.of(FieldElement.MODULUS.shiftRight(1));
    assertEquals(half.toBigInteger(), half.toSignedBigInteger());
    assertTrue(half.add(FieldElement.one()).toSignedBigInteger().signum() < 0);
  }

  @Test
  void testIntValueExact() {
    assertEquals(42, FieldElement.of(42).intValueExact());
    assertThrows(ArithmeticException.class, () -> FieldElement.of(-1).intValueExact());
    assertThrows(ArithmeticException.class, () -> FieldElement.of(1L << 40).intValueExact());
  }
}
