package rtlcore.sim;

import java.util.List;
import rtlcore.hdl.Signal;

/** The design kept changing for more delta cycles than allowed within one timestamp. */
public class SimulationInstabilityException extends SimulationException {
  private static final long serialVersionUID = 1L;

  public SimulationInstabilityException(String message, long timestamp, List<Signal> changing) { super(message, timestamp, changing); }
}
