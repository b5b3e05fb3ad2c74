package rtlcore.util;

import java.math.BigInteger;

/** Integer and bit-vector helpers shared by the value model and the simulator. */
public class Bits {
  public static int log2(int n) {
    if (n < 0)
      throw new IllegalArgumentException("log2 of a negative number");
    return 31 - Integer.numberOfLeadingZeros(n);
  }

  /** Number of bits needed to address n distinct positions; clog2(1) == 0. */
  public static int clog2(int n) {
    if (n <= 0)
      throw new IllegalArgumentException("clog2 requires a positive argument");
    return n == 1 ? 0 : log2(n - 1) + 1;
  }

  /**
   * Minimal width needed to represent a literal.
   * @param value the literal
   * @param signed whether the representation is two's complement
   * @return the number of bits, at least 1 for signed representations
   */
  public static int bitsFor(BigInteger value, boolean signed) {
    if (signed)
      return value.bitLength() + 1;
    if (value.signum() < 0)
      throw new IllegalArgumentException("negative literal " + value + " needs a signed representation");
    return value.bitLength();
  }

  /** All-ones mask of the given width. */
  public static BigInteger mask(int width) { return BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE); }

  /**
   * Reduces an arbitrary integer to the canonical representative of a (width, signed) bit vector:
   * two's-complement reduction modulo 2^width, then reinterpretation per signedness.
   */
  public static BigInteger normalize(BigInteger value, int width, boolean signed) {
    BigInteger bits = value.and(mask(width));
    if (signed && width > 0 && bits.testBit(width - 1))
      return bits.subtract(BigInteger.ONE.shiftLeft(width));
    return bits;
  }

  /** Raw (unsigned) bit pattern of a value truncated to width. */
  public static BigInteger raw(BigInteger value, int width) { return value.and(mask(width)); }

  /** Extracts bits [start, start+width) as an unsigned number. */
  public static BigInteger extract(BigInteger value, int start, int width) { return value.shiftRight(start).and(mask(width)); }

  /** Returns base with bits [start, start+width) replaced by the low bits of part. */
  public static BigInteger insert(BigInteger base, int start, int width, BigInteger part) {
    BigInteger fieldMask = mask(width).shiftLeft(start);
    return base.andNot(fieldMask).or(part.and(mask(width)).shiftLeft(start));
  }
}
