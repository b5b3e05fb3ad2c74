package rtlcore.hdl;

import java.util.Objects;
import java.util.Set;

/**
 * Variable-offset slice: bits [offset*stride, offset*stride+width) of a value.
 * Bits beyond the end of the value read as zero.
 */
public final class Part extends Value {
  private final Value value;
  private final Value offset;
  private final int partWidth;
  private final int stride;

  public Part(Value value, Value offset, int width, int stride) {
    if (width < 0)
      throw new ShapeException("Part width must be non-negative, not " + width);
    if (stride <= 0)
      throw new ShapeException("Part stride must be positive, not " + stride);
    if (offset.isSigned())
      throw new ShapeException("Part offset must be unsigned");
    this.value = value;
    this.offset = offset;
    this.partWidth = width;
    this.stride = stride;
  }

  public static Part of(Object value, Object offset, int width) { return of(value, offset, width, 1); }
  public static Part of(Object value, Object offset, int width, int stride) {
    return new Part(Value.cast(value), Value.cast(offset), width, stride);
  }
  /** Word-aligned part: the offset counts in units of the width. */
  public static Part word(Object value, Object offset, int width) { return of(value, offset, width, width); }

  public Value getValue() { return value; }
  public Value getOffset() { return offset; }
  public int getPartWidth() { return partWidth; }
  public int getStride() { return stride; }

  @Override
  public Shape shape() {
    return Shape.unsigned(partWidth);
  }
  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitPart(this);
  }
  @Override
  protected void collectReadSignals(Set<Signal> into) {
    value.collectReadSignals(into);
    offset.collectReadSignals(into);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Part other = (Part)obj;
    return partWidth == other.partWidth && stride == other.stride && value.equals(other.value) && offset.equals(other.offset);
  }
  @Override
  public int hashCode() {
    return Objects.hash(value, offset, partWidth, stride);
  }
  @Override
  public String toString() {
    return String.format("(part %s %s %d %d)", value, offset, partWidth, stride);
  }
}
