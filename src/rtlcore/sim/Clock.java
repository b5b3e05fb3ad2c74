package rtlcore.sim;

import java.math.BigInteger;
import rtlcore.hdl.Signal;

/** A free-running clock driving the clock signal of one domain. Starts low. */
final class Clock {
  final String domain;
  final Signal signal;
  private final long highTime;
  private final long lowTime;
  private long nextToggle;
  private BigInteger nextLevel = BigInteger.ONE;

  Clock(String domain, Signal signal, long period, long firstToggle) {
    this.domain = domain;
    this.signal = signal;
    this.highTime = period / 2;
    this.lowTime = period - highTime;
    this.nextToggle = firstToggle;
  }

  long getNextToggle() { return nextToggle; }
  BigInteger getNextLevel() { return nextLevel; }

  /** Moves to the following toggle after the current one was applied. */
  void advance() {
    boolean wasRising = nextLevel.signum() != 0;
    nextToggle += wasRising ? highTime : lowTime;
    nextLevel = wasRising ? BigInteger.ZERO : BigInteger.ONE;
  }
}
