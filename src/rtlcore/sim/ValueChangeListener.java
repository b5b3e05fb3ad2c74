package rtlcore.sim;

import java.math.BigInteger;
import rtlcore.hdl.Signal;

/** Receives the value-change feed of a simulation. */
@FunctionalInterface
public interface ValueChangeListener {
  /**
   * Called once per signal and timestamp in which the signal's settled value differs from the last reported one.
   * @param timestamp the simulated time
   * @param signal the signal
   * @param value the new value, canonical for the signal's shape
   */
  void valueChanged(long timestamp, Signal signal, BigInteger value);
}
