package rtlcore.hdl;

import java.util.List;

/** The same bit of a signal has more than one unconditional driver in one domain, or drivers in two modules. */
public class DriverConflictException extends ElaborationException {
  private static final long serialVersionUID = 1L;

  private final int bit;

  public DriverConflictException(String message, Signal signal, int bit, Statement statement, String domain) {
    super(message, List.of(signal), statement, domain);
    this.bit = bit;
  }

  public Signal getSignal() { return getSignals().get(0); }
  /** The first conflicting bit index. */
  public int getBit() { return bit; }
}
