package rtlcore.sim;

import java.math.BigInteger;
import java.util.concurrent.Semaphore;
import rtlcore.hdl.Signal;
import rtlcore.hdl.Value;

/**
 * Runs one process as a coroutine on its own daemon thread. Control is handed over synchronously:
 * the engine blocks while the process runs and the process blocks while it waits, so the two never run
 * at the same time.
 */
final class ProcessRunner implements SimContext {
  enum Kind { PROCESS, TESTBENCH, BACKGROUND }
  enum State { WAITING, RUNNING, DONE }
  enum Reason { START, SETTLE, TICK, CHANGED, DELAY }

  /** Unwinds a process thread when the simulator is closed. */
  private static final class Terminated extends Error {
    private static final long serialVersionUID = 1L;
  }

  final String name;
  final Kind kind;
  private final SimProcess body;
  private final Simulator sim;

  private State state = State.WAITING;
  private Reason reason = Reason.START;
  private String tickDomain = null;
  private long tickSnapshot = 0;
  private Signal[] watched = new Signal[0];
  private BigInteger[] watchedSnapshot = new BigInteger[0];
  private long wakeTime = 0;

  private Thread thread = null;
  private final Semaphore processTurn = new Semaphore(0);
  private final Semaphore engineTurn = new Semaphore(0);
  private Throwable failure = null;

  ProcessRunner(String name, Kind kind, SimProcess body, Simulator sim) {
    this.name = name;
    this.kind = kind;
    this.body = body;
    this.sim = sim;
  }

  boolean isDone() { return state == State.DONE; }
  Reason getReason() { return reason; }
  long getWakeTime() { return wakeTime; }

  /** Whether the condition the process waits for has occurred. */
  boolean isReady() {
    if (state != State.WAITING)
      return false;
    switch (reason) {
    case START:
    case SETTLE:
      return true;
    case TICK:
      return sim.getTickCount(tickDomain) > tickSnapshot;
    case CHANGED:
      for (int i = 0; i < watched.length; ++i) {
        if (!sim.read(watched[i]).equals(watchedSnapshot[i]))
          return true;
      }
      return false;
    case DELAY:
      return sim.now() >= wakeTime;
    default:
      throw new IllegalStateException("Unhandled wait reason " + reason);
    }
  }

  /** Runs the process until it waits again or finishes. Called by the engine only. */
  void resume() {
    state = State.RUNNING;
    if (thread == null) {
      thread = new Thread(this::threadMain, "sim-" + name);
      thread.setDaemon(true);
      thread.start();
    } else
      processTurn.release();
    engineTurn.acquireUninterruptibly();
    if (failure != null) {
      Throwable error = failure;
      failure = null;
      if (error instanceof RuntimeException)
        throw (RuntimeException)error;
      if (error instanceof Error)
        throw (Error)error;
      throw new SimulationException("Process " + name + " failed: " + error.getMessage(), sim.now(), error);
    }
  }

  private void threadMain() {
    try {
      body.run(this);
    } catch (Terminated terminated) {
      return;
    } catch (Throwable t) {
      failure = t;
    }
    state = State.DONE;
    Simulator.logger.debug("Process {} finished at t={}", name, sim.now());
    engineTurn.release();
  }

  private void suspend(Reason newReason) {
    checkThread();
    reason = newReason;
    state = State.WAITING;
    engineTurn.release();
    try {
      processTurn.acquire();
    } catch (InterruptedException e) {
      throw new Terminated();
    }
  }

  /** Stops a waiting process thread. */
  void terminate() {
    if (thread != null && state != State.DONE)
      thread.interrupt();
  }

  private void checkThread() {
    if (Thread.currentThread() != thread)
      throw new IllegalStateException("The context of process " + name + " may only be used by that process");
  }

  @Override
  public long now() {
    return sim.now();
  }
  @Override
  public BigInteger get(Value value) {
    checkThread();
    if (kind == Kind.TESTBENCH)
      sim.settleInline();
    return sim.evaluate(value);
  }
  @Override
  public void set(Signal signal, BigInteger value) {
    checkThread();
    sim.write(signal, value);
  }
  @Override
  public void settle() {
    suspend(Reason.SETTLE);
  }
  @Override
  public void tick(String domain) {
    tickDomain = domain;
    tickSnapshot = sim.getTickCount(domain);
    suspend(Reason.TICK);
  }
  @Override
  public void changed(Signal... signals) {
    if (signals.length == 0)
      throw new IllegalArgumentException("changed() needs at least one signal");
    watched = signals.clone();
    watchedSnapshot = new BigInteger[signals.length];
    for (int i = 0; i < signals.length; ++i)
      watchedSnapshot[i] = sim.read(signals[i]);
    suspend(Reason.CHANGED);
  }
  @Override
  public void delay(long ticks) {
    if (ticks < 0)
      throw new IllegalArgumentException("Cannot wait a negative amount of time");
    wakeTime = sim.now() + ticks;
    suspend(Reason.DELAY);
  }

  @Override
  public String toString() {
    return "Process(" + name + ", " + state + (state == State.WAITING ? " on " + reason : "") + ")";
  }
}
