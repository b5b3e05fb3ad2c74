package rtlcore.hdl;

import java.util.Objects;

/**
 * Bit width and signedness of a value. Immutable.
 */
public final class Shape {
  private final int width;
  private final boolean signed;

  private Shape(int width, boolean signed) {
    if (width < 0)
      throw new ShapeException("Width must be non-negative, not " + width);
    if (signed && width == 0)
      throw new ShapeException("Signed shapes must be at least one bit wide");
    this.width = width;
    this.signed = signed;
  }

  public static Shape unsigned(int width) { return new Shape(width, false); }
  public static Shape signed(int width) { return new Shape(width, true); }
  public static Shape of(int width, boolean signed) { return new Shape(width, signed); }

  public int getWidth() { return width; }
  public boolean isSigned() { return signed; }

  /**
   * Returns the smallest shape that can represent every value of every given shape.
   * If all shapes are unsigned, the result is unsigned with the maximum width; otherwise
   * the result is signed, and unsigned shapes are promoted by one bit.
   * @param shapes the operand shapes
   * @return the unified shape, unsigned(0) for no shapes
   */
  public static Shape unify(Iterable<Shape> shapes) {
    int unsignedWidth = 0;
    int signedWidth = 0;
    boolean hasSigned = false;
    for (Shape shape : shapes) {
      if (shape.signed) {
        hasSigned = true;
        signedWidth = Math.max(signedWidth, shape.width);
      } else
        unsignedWidth = Math.max(unsignedWidth, shape.width);
    }
    if (!hasSigned)
      return unsigned(unsignedWidth);
    return signed(Math.max(signedWidth, unsignedWidth + 1));
  }

  public static Shape unify(Shape... shapes) { return unify(java.util.Arrays.asList(shapes)); }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Shape other = (Shape)obj;
    return width == other.width && signed == other.signed;
  }
  @Override
  public int hashCode() {
    return Objects.hash(width, signed);
  }
  @Override
  public String toString() {
    return (signed ? "signed(" : "unsigned(") + width + ")";
  }
}
