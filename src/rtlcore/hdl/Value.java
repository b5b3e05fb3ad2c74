package rtlcore.hdl;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable expression tree node with a fixed {@link Shape}.
 * Values are built through the static factories of the concrete classes and {@link Ops}.
 * Equality is structural; only {@link Signal} compares by identity.
 */
public abstract class Value {

  /** The shape of this value, derived from its operands at construction. */
  public abstract Shape shape();

  public int width() { return shape().getWidth(); }
  public boolean isSigned() { return shape().isSigned(); }

  public abstract <R> R accept(ValueVisitor<R> visitor);

  /**
   * Collects the signals read when this value is evaluated, in first-occurrence order.
   * {@link ClockSignal} and {@link ResetSignal} contribute nothing before elaboration; a {@link Sample} contributes the
   * signals of the sampled expression.
   */
  protected abstract void collectReadSignals(Set<Signal> into);

  public Set<Signal> readSignals() {
    LinkedHashSet<Signal> result = new LinkedHashSet<>();
    collectReadSignals(result);
    return Collections.unmodifiableSet(result);
  }

  /**
   * Converts an object to a value.
   * Accepts values, {@link ValueCastable} objects, booleans and Java integers (as minimal constants).
   * @param obj the object to convert
   * @return the value
   * @throws IllegalArgumentException if the object has no value representation
   */
  public static Value cast(Object obj) {
    if (obj instanceof Value)
      return (Value)obj;
    if (obj instanceof ValueCastable) {
      Value value = ((ValueCastable)obj).asValue();
      if (value == null)
        throw new IllegalArgumentException("asValue() of " + obj + " returned null");
      return value;
    }
    if (obj instanceof Boolean)
      return Const.of((Boolean)obj ? 1 : 0, Shape.unsigned(1));
    if (obj instanceof Integer || obj instanceof Long || obj instanceof Short || obj instanceof Byte)
      return Const.of(((Number)obj).longValue());
    if (obj instanceof BigInteger)
      return Const.of((BigInteger)obj);
    throw new IllegalArgumentException("Object " + obj + " cannot be converted to a value");
  }

  @Override
  public abstract boolean equals(Object obj);
  @Override
  public abstract int hashCode();
}
