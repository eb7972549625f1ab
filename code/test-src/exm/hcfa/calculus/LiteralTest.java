package exm.hcfa.calculus;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

import java.math.BigDecimal;
import java.math.BigInteger;

import org.junit.Test;

public class LiteralTest {

  @Test
  public void testRendering() {
    assertEquals("42", Literal.integer(42).toString());
    assertEquals("-7", Literal.integer(-7).toString());
    assertEquals("2.5", Literal.rational(new BigDecimal("2.5")).toString());
    assertEquals(Double.toString(1.0 / 3),
        Literal.rational(BigInteger.ONE, BigInteger.valueOf(3)).toString());
    assertEquals("\"a\\\"b\\n\"", Literal.string("a\"b\n").toString());
    assertEquals("'a'", Literal.character('a').toString());
    assertEquals("'\\''", Literal.character('\'').toString());
    assertEquals("'\\n'", Literal.character('\n').toString());
  }

  private static Literal ratio(long num, long den) {
    return Literal.rational(BigInteger.valueOf(num), BigInteger.valueOf(den));
  }

  @Test
  public void testRationalExponentNotation() {
    assertEquals("1.0e-3", ratio(1, 1000).toString());
    assertEquals("-5.0e-2", ratio(-1, 20).toString());
    assertEquals("1.23e-2", ratio(123, 10000).toString());
    assertEquals("1.0e7", ratio(10000000, 1).toString());
    assertEquals("1.23456789e8", ratio(123456789, 1).toString());
    // Positional between 0.1 and 10^7
    assertEquals("0.1", ratio(1, 10).toString());
    assertEquals("9999999.0", ratio(9999999, 1).toString());
    assertEquals("0.0", ratio(0, 5).toString());
  }

  @Test
  public void testRationalExact() {
    Literal half = Literal.rational(BigInteger.valueOf(2),
                                    BigInteger.valueOf(4));
    assertEquals(Literal.rational(new BigDecimal("0.5")), half);
    assertEquals(Literal.rational(BigInteger.valueOf(-1),
                                  BigInteger.valueOf(2)),
                 Literal.rational(BigInteger.ONE, BigInteger.valueOf(-2)));
    assertEquals(Literal.rational(new BigDecimal("3")),
                 Literal.rational(BigInteger.valueOf(3), BigInteger.ONE));
    // Display is approximate, equality is not
    assertNotEquals(Literal.rational(new BigDecimal("0.1")),
        Literal.rational(new BigDecimal("0.10000000000000000001")));
  }

  @Test(expected=IllegalArgumentException.class)
  public void testZeroDenominator() {
    Literal.rational(BigInteger.ONE, BigInteger.ZERO);
  }

  @Test
  public void testHardwired() {
    assertEquals("()", HardwiredValue.tupleCon(0).toString());
    assertEquals("(,,)", HardwiredValue.tupleCon(2).toString());
    assertEquals("(:)", HardwiredValue.LIST_CONS.toString());
    assertEquals("[]", HardwiredValue.LIST_NIL.toString());
    assertEquals(HardwiredValue.tupleCon(3), HardwiredValue.tupleCon(3));
  }
}
