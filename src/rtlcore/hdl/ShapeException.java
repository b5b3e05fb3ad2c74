package rtlcore.hdl;

/**
 * Thrown while constructing a value whose operation is undefined for the shapes of its operands,
 * e.g. a signed shift amount or an index that cannot address every choice.
 */
public class ShapeException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public ShapeException(String message) { super(message); }
}
