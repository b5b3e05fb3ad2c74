package rtlcore.hdl;

/**
 * Implemented by foreign types (enums, records, interface bundles) that can stand in for a value.
 * {@link Value#cast(Object)} calls {@link #asValue()} at every value construction boundary.
 */
public interface ValueCastable {
  /**
   * Converts this object to a value.
   * @return the value representation, never null
   */
  Value asValue();
}
