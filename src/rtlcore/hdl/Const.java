package rtlcore.hdl;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Set;
import rtlcore.util.Bits;

/** A constant of a given shape. The stored literal is always representable in the shape. */
public final class Const extends Value {
  private final BigInteger value;
  private final Shape shape;

  /**
   * @throws ShapeException if the literal cannot be represented in the shape (use {@link #wrap(BigInteger, Shape)} to truncate)
   */
  public Const(BigInteger value, Shape shape) {
    if (!Bits.normalize(value, shape.getWidth(), shape.isSigned()).equals(value))
      throw new ShapeException("Constant " + value + " cannot be represented as " + shape);
    this.value = value;
    this.shape = shape;
  }

  /** Constant with the minimal shape for the literal: unsigned for non-negative values, signed otherwise. */
  public static Const of(BigInteger value) {
    boolean signed = value.signum() < 0;
    return new Const(value, Shape.of(Math.max(1, Bits.bitsFor(value, signed)), signed));
  }
  public static Const of(long value) { return of(BigInteger.valueOf(value)); }
  public static Const of(long value, Shape shape) { return new Const(BigInteger.valueOf(value), shape); }
  public static Const of(BigInteger value, Shape shape) { return new Const(value, shape); }

  /** Constant reduced modulo 2^width and reinterpreted per the signedness of the shape. */
  public static Const wrap(BigInteger value, Shape shape) {
    return new Const(Bits.normalize(value, shape.getWidth(), shape.isSigned()), shape);
  }

  public BigInteger getValue() { return value; }

  @Override
  public Shape shape() {
    return shape;
  }
  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitConst(this);
  }
  @Override
  protected void collectReadSignals(Set<Signal> into) {}

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Const other = (Const)obj;
    return value.equals(other.value) && shape.equals(other.shape);
  }
  @Override
  public int hashCode() {
    return Objects.hash(value, shape);
  }
  @Override
  public String toString() {
    return String.format("(const %d'%s%s)", shape.getWidth(), shape.isSigned() ? "sd" : "d", value);
  }
}
