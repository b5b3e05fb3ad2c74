package rtlcore.hdl;

/**
 * A design object that can describe itself as a module. User components implement this interface
 * and build their logic in {@link #elaborate()}.
 */
public interface Elaboratable {
  /**
   * Builds the module describing this object. Called once per elaboration run.
   * @return the module, which may nest further elaboratables as submodules
   */
  Module elaborate();
}
