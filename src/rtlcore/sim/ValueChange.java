package rtlcore.sim;

import java.math.BigInteger;
import rtlcore.hdl.Signal;

/** One entry of a value-change trace. */
public record ValueChange(long timestamp, Signal signal, BigInteger value) {
  @Override
  public String toString() {
    return timestamp + " " + signal.getName() + " " + value;
  }
}
