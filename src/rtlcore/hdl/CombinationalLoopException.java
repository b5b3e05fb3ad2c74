package rtlcore.hdl;

import java.util.List;

/** Combinational statements depend on each other in a cycle that no register breaks. */
public class CombinationalLoopException extends ElaborationException {
  private static final long serialVersionUID = 1L;

  /**
   * @param signals the signals along the cycle, in dependency order
   */
  public CombinationalLoopException(String message, List<Signal> signals, Statement statement) {
    super(message, signals, statement, ClockDomain.COMB);
  }
}
