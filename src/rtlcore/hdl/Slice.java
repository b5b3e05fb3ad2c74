package rtlcore.hdl;

import java.util.Objects;
import java.util.Set;

/** Constant bit range [start, stop) of a value. Always unsigned. */
public final class Slice extends Value {
  private final Value value;
  private final int start;
  private final int stop;

  public Slice(Value value, int start, int stop) {
    int width = value.width();
    if (start < 0 || start > width)
      throw new ShapeException(String.format("Cannot start slice %d bits into %d-bit value", start, width));
    if (stop < 0 || stop > width)
      throw new ShapeException(String.format("Cannot stop slice %d bits into %d-bit value", stop, width));
    if (start > stop)
      throw new ShapeException(String.format("Slice start %d must not be greater than slice stop %d", start, stop));
    this.value = value;
    this.start = start;
    this.stop = stop;
  }

  public static Slice of(Object value, int start, int stop) { return new Slice(Value.cast(value), start, stop); }
  /** Single bit. */
  public static Slice bit(Object value, int index) { return of(value, index, index + 1); }

  public Value getValue() { return value; }
  public int getStart() { return start; }
  public int getStop() { return stop; }

  @Override
  public Shape shape() {
    return Shape.unsigned(stop - start);
  }
  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitSlice(this);
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
    Slice other = (Slice)obj;
    return start == other.start && stop == other.stop && value.equals(other.value);
  }
  @Override
  public int hashCode() {
    return Objects.hash(value, start, stop);
  }
  @Override
  public String toString() {
    return String.format("(slice %s %d:%d)", value, start, stop);
  }
}
