/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.hcfa.calculus;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

import org.apache.commons.lang3.StringEscapeUtils;

import com.google.common.base.Preconditions;

/**
 * Literal constants appearing in terms and case alternatives.
 */
public abstract class Literal {

  public enum LiteralKind {
    INTEGER,
    RATIONAL,
    STRING,
    CHAR,
  }

  public abstract LiteralKind kind();

  public static Literal integer(long value) {
    return new IntegerLit(BigInteger.valueOf(value));
  }

  public static Literal integer(BigInteger value) {
    return new IntegerLit(value);
  }

  public static Literal rational(BigInteger numerator, BigInteger denominator) {
    return new RationalLit(numerator, denominator);
  }

  /**
   * Exact rational for a decimal literal, e.g. 2.5 becomes 5/2
   */
  public static Literal rational(BigDecimal value) {
    if (value.scale() <= 0) {
      return new RationalLit(value.toBigIntegerExact(), BigInteger.ONE);
    }
    return new RationalLit(value.unscaledValue(),
                           BigInteger.TEN.pow(value.scale()));
  }

  public static Literal string(String value) {
    return new StringLit(value);
  }

  public static Literal character(int codePoint) {
    return new CharLit(codePoint);
  }

  public static class IntegerLit extends Literal {
    private final BigInteger value;

    private IntegerLit(BigInteger value) {
      this.value = Preconditions.checkNotNull(value);
    }

    public BigInteger value() {
      return value;
    }

    @Override
    public LiteralKind kind() {
      return LiteralKind.INTEGER;
    }

    @Override
    public String toString() {
      return value.toString();
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof IntegerLit)) {
        return false;
      }
      return value.equals(((IntegerLit)obj).value);
    }

    @Override
    public int hashCode() {
      return value.hashCode() ^ IntegerLit.class.hashCode();
    }
  }

  /**
   * Exact rational, always stored in lowest terms with positive denominator.
   */
  public static class RationalLit extends Literal {
    private final BigInteger numerator;
    private final BigInteger denominator;

    private RationalLit(BigInteger numerator, BigInteger denominator) {
      Preconditions.checkArgument(denominator.signum() != 0,
                                  "Zero denominator in rational literal");
      BigInteger gcd = numerator.gcd(denominator);
      if (denominator.signum() < 0) {
        gcd = gcd.negate();
      }
      this.numerator = numerator.divide(gcd);
      this.denominator = denominator.divide(gcd);
    }

    public BigInteger numerator() {
      return numerator;
    }

    public BigInteger denominator() {
      return denominator;
    }

    /**
     * Floating approximation, only meant for display
     */
    public double approximate() {
      return new BigDecimal(numerator).divide(new BigDecimal(denominator),
                                    MathContext.DECIMAL64).doubleValue();
    }

    @Override
    public LiteralKind kind() {
      return LiteralKind.RATIONAL;
    }

    @Override
    public String toString() {
      return showDouble(approximate());
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof RationalLit)) {
        return false;
      }
      RationalLit other = (RationalLit)obj;
      return numerator.equals(other.numerator) &&
             denominator.equals(other.denominator);
    }

    @Override
    public int hashCode() {
      return numerator.hashCode() * 31 + denominator.hashCode();
    }
  }

  /**
   * Render a double in the analyzed language's notation: positional for
   * magnitudes in [0.1, 10^7), otherwise a mantissa with at least one
   * fractional digit and a lower-case exponent, e.g. 1.0e-3 or 1.25e7
   */
  static String showDouble(double d) {
    double abs = Math.abs(d);
    if (d == 0.0 || Double.isNaN(d) || Double.isInfinite(d) ||
        (abs >= 0.1 && abs < 1e7)) {
      return Double.toString(d);
    }
    BigDecimal shortest = new BigDecimal(Double.toString(abs))
                                              .stripTrailingZeros();
    String digits = shortest.unscaledValue().toString();
    int exponent = digits.length() - 1 - shortest.scale();

    StringBuilder sb = new StringBuilder();
    if (d < 0) {
      sb.append('-');
    }
    sb.append(digits.charAt(0)).append('.');
    sb.append(digits.length() > 1 ? digits.substring(1) : "0");
    sb.append('e').append(exponent);
    return sb.toString();
  }

  public static class StringLit extends Literal {
    private final String value;

    private StringLit(String value) {
      this.value = Preconditions.checkNotNull(value);
    }

    public String value() {
      return value;
    }

    @Override
    public LiteralKind kind() {
      return LiteralKind.STRING;
    }

    @Override
    public String toString() {
      return "\"" + StringEscapeUtils.escapeJava(value) + "\"";
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof StringLit)) {
        return false;
      }
      return value.equals(((StringLit)obj).value);
    }

    @Override
    public int hashCode() {
      return value.hashCode() ^ StringLit.class.hashCode();
    }
  }

  public static class CharLit extends Literal {
    private final int codePoint;

    private CharLit(int codePoint) {
      Preconditions.checkArgument(Character.isValidCodePoint(codePoint),
                                  "Invalid code point %s", codePoint);
      this.codePoint = codePoint;
    }

    public int codePoint() {
      return codePoint;
    }

    @Override
    public LiteralKind kind() {
      return LiteralKind.CHAR;
    }

    @Override
    public String toString() {
      // escapeJava leaves single quotes alone, but escapes double quotes
      if (codePoint == '\'') {
        return "'\\''";
      } else if (codePoint == '"') {
        return "'\"'";
      }
      String str = new String(Character.toChars(codePoint));
      return "'" + StringEscapeUtils.escapeJava(str) + "'";
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof CharLit)) {
        return false;
      }
      return codePoint == ((CharLit)obj).codePoint;
    }

    @Override
    public int hashCode() {
      return codePoint ^ CharLit.class.hashCode();
    }
  }
}
