package rtlcore.sim;

import java.util.Collections;
import java.util.List;
import rtlcore.hdl.Signal;

/** Runtime failure of a simulation. The simulator state is undefined afterwards. */
public class SimulationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final long timestamp;
  private final transient List<Signal> signals;

  public SimulationException(String message, long timestamp, List<Signal> signals) {
    super(message);
    this.timestamp = timestamp;
    this.signals = List.copyOf(signals);
  }
  public SimulationException(String message, long timestamp, Throwable cause) {
    super(message, cause);
    this.timestamp = timestamp;
    this.signals = List.of();
  }

  /** Simulated time at which the failure happened. */
  public long getTimestamp() { return timestamp; }
  public List<Signal> getSignals() { return Collections.unmodifiableList(signals); }
}
