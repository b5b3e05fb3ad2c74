package rtlcore.hdl;

import java.util.Objects;
import java.util.Set;

/** A value repeated count times, as if concatenated with itself. Always unsigned. */
public final class Replicate extends Value {
  private final Value value;
  private final int count;
  private final int width;

  /**
   * @throws ShapeException if the count is negative or the replicated width does not fit an int
   */
  public Replicate(Value value, int count) {
    if (count < 0)
      throw new ShapeException("Replication count must be non-negative, not " + count);
    this.value = value;
    this.count = count;
    try {
      this.width = Math.multiplyExact(value.width(), count);
    } catch (ArithmeticException e) {
      throw new ShapeException(String.format("Replicating %d bits %d times exceeds the maximum width", value.width(), count));
    }
  }

  public static Replicate of(Object value, int count) { return new Replicate(Value.cast(value), count); }

  public Value getValue() { return value; }
  public int getCount() { return count; }

  @Override
  public Shape shape() {
    return Shape.unsigned(width);
  }
  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitReplicate(this);
  }
  @Override
  protected void collectReadSignals(Set<Signal> into) {
    value.collectReadSignals(into);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Replicate other = (Replicate)obj;
    return count == other.count && value.equals(other.value);
  }
  @Override
  public int hashCode() {
    return Objects.hash(value, count);
  }
  @Override
  public String toString() {
    return String.format("(repl %s %d)", value, count);
  }
}
