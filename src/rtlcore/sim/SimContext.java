package rtlcore.sim;

import java.math.BigInteger;
import rtlcore.hdl.ClockDomain;
import rtlcore.hdl.Signal;
import rtlcore.hdl.Value;

/**
 * The interface a process uses to observe and drive the design. Every waiting method suspends the
 * process and hands control back to the scheduler. Only the process the context was given to may use it.
 */
public interface SimContext {
  /** Current simulated time. */
  long now();

  /** Evaluates an expression on the current signal values. */
  BigInteger get(Value value);
  default long getLong(Value value) { return get(value).longValueExact(); }
  default boolean getBool(Value value) { return get(value).signum() != 0; }

  /** Drives a signal; the value is wrapped to the signal's shape. */
  void set(Signal signal, BigInteger value);
  default void set(Signal signal, long value) { set(signal, BigInteger.valueOf(value)); }

  /** Waits until the combinational logic has settled on the values written so far. */
  void settle();
  /** Waits for the next committed active edge of a domain. */
  void tick(String domain);
  default void tick() { tick(ClockDomain.SYNC); }
  /** Waits for several committed active edges of a domain. */
  default void tick(String domain, int count) {
    for (int i = 0; i < count; ++i)
      tick(domain);
  }
  /** Waits until any of the signals changes its value. */
  void changed(Signal... signals);
  /** Waits for the given number of time ticks; zero waits for the end of the current delta cycle. */
  void delay(long ticks);
}
