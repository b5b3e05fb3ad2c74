package rtlcore.sim;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rtlcore.hdl.ClockDomain;
import rtlcore.hdl.Property;
import rtlcore.hdl.Signal;
import rtlcore.hdl.Statement;
import rtlcore.hdl.Switch;
import rtlcore.hdl.Value;
import rtlcore.ir.CombUnit;
import rtlcore.ir.Fragment;
import rtlcore.ui.RTLCoreConfig;
import rtlcore.util.Bits;

/**
 * Event-driven simulator for an elaborated {@link Fragment}.
 *
 * Each timestamp is processed in delta cycles: clock toggles and process writes are applied, the
 * combinational logic is settled in topological order, domains whose clock reached its active edge compute
 * their next state from the pre-edge values and commit together, and processes whose wait condition
 * occurred are resumed in registration order. Settled value changes are reported to listeners once per
 * timestamp.
 */
public class Simulator implements AutoCloseable {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Fragment fragment;
  private final RTLCoreConfig config;

  /** Current value of every known signal, in report order. */
  private final Map<Signal, BigInteger> current = new LinkedHashMap<>();
  private final Map<Signal, BigInteger> lastReported = new HashMap<>();
  private final Set<Signal> changedInDelta = new LinkedHashSet<>();

  private final List<CombUnit> units;
  private final Map<Signal, List<Integer>> unitReaders = new HashMap<>();
  private final boolean[] dirty;
  private boolean anyDirty = true;
  private final boolean hasCombProperties;

  private final Map<String, List<Signal>> domainSignals = new HashMap<>();
  private final Map<String, BigInteger> lastClock = new HashMap<>();
  private final Map<String, Long> tickCounts = new HashMap<>();

  private final List<Clock> clocks = new ArrayList<>();
  private final List<ProcessRunner> processes = new ArrayList<>();
  private final List<ValueChangeListener> listeners = new ArrayList<>();
  private final Map<Property, Long> coverHits = new IdentityHashMap<>();
  private final ValueEvaluator evaluator = new ValueEvaluator(this::read);

  private long timestamp = 0;
  private boolean started = false;
  private boolean closed = false;

  public Simulator(Fragment fragment) { this(fragment, new RTLCoreConfig()); }
  public Simulator(Fragment fragment, RTLCoreConfig config) {
    this.fragment = fragment;
    this.config = config;
    for (Signal signal : fragment.getSignals())
      current.put(signal, signal.getReset());

    this.units = fragment.getCombUnits();
    this.dirty = new boolean[units.size()];
    for (int i = 0; i < units.size(); ++i) {
      dirty[i] = true;
      for (Signal read : units.get(i).getReads())
        unitReaders.computeIfAbsent(read, s -> new ArrayList<>()).add(i);
    }
    this.hasCombProperties = fragment.getStatements(ClockDomain.COMB).stream().anyMatch(Simulator::containsProperty);

    for (Map.Entry<String, ClockDomain> entry : fragment.getDomains().entrySet()) {
      domainSignals.put(entry.getKey(), fragment.getDrivenSignals(entry.getKey()));
      lastClock.put(entry.getKey(), read(entry.getValue().getClk()));
      tickCounts.put(entry.getKey(), 0L);
    }
  }

  private static boolean containsProperty(Statement statement) {
    if (statement instanceof Property)
      return true;
    if (statement instanceof Switch) {
      for (Switch.Case c : ((Switch)statement).getCases()) {
        if (c.getBody().stream().anyMatch(Simulator::containsProperty))
          return true;
      }
    }
    return false;
  }

  public Fragment getFragment() { return fragment; }
  /** Current simulated time. */
  public long now() { return timestamp; }

  /////////////// setup ///////////////

  public void addClock(String domain) { addClock(domain, config.default_clock_period); }
  public void addClock(String domain, long period) { addClock(domain, period, period / 2); }
  /**
   * Drives the clock of a domain. The clock starts low and rises first at the given phase.
   * @param period full clock period in ticks, at least 2
   * @param phase time of the first rising edge relative to now
   * @throws IllegalArgumentException if the domain is unknown, already clocked, or its clock is driven by the design
   */
  public void addClock(String domain, long period, long phase) {
    checkOpen();
    ClockDomain clockDomain = fragment.getDomains().get(domain);
    if (clockDomain == null)
      throw new IllegalArgumentException("Domain '" + domain + "' is not part of the design");
    if (period < 2)
      throw new IllegalArgumentException("Clock period must be at least 2 ticks, got " + period);
    if (phase < 0)
      throw new IllegalArgumentException("Clock phase must not be negative");
    for (Clock clock : clocks) {
      if (clock.domain.equals(domain))
        throw new IllegalArgumentException("Domain '" + domain + "' already has a clock");
    }
    if (fragment.getDriverDomain(clockDomain.getClk()).isPresent())
      throw new IllegalArgumentException("Clock of domain '" + domain + "' is driven by the design");
    long firstToggle = started ? timestamp + Math.max(phase, 1) : phase;
    clocks.add(new Clock(domain, clockDomain.getClk(), period, firstToggle));
    logger.debug("Added clock for domain '{}': period {}, first edge at {}", domain, period, firstToggle);
  }

  /** Adds a process. Its writes take effect when it waits. */
  public void addProcess(String name, SimProcess process) { addRunner(name, ProcessRunner.Kind.PROCESS, process); }
  /** Adds a process that does not keep {@link #run()} alive. */
  public void addBackgroundProcess(String name, SimProcess process) { addRunner(name, ProcessRunner.Kind.BACKGROUND, process); }
  /** Adds a testbench: like a process, but every read sees the settled effect of its own writes. */
  public void addTestbench(String name, SimProcess process) { addRunner(name, ProcessRunner.Kind.TESTBENCH, process); }

  private void addRunner(String name, ProcessRunner.Kind kind, SimProcess process) {
    checkOpen();
    processes.add(new ProcessRunner(name, kind, process, this));
  }

  public void addListener(ValueChangeListener listener) { listeners.add(listener); }
  public void removeListener(ValueChangeListener listener) { listeners.remove(listener); }

  /////////////// inspection ///////////////

  /** Evaluates an expression on the settled current values. */
  public BigInteger get(Value value) {
    settleInline();
    return evaluate(value);
  }
  public long getLong(Value value) { return get(value).longValueExact(); }

  /** Drives a signal between runs; the value is wrapped to the signal's shape. */
  public void set(Signal signal, long value) { set(signal, BigInteger.valueOf(value)); }
  public void set(Signal signal, BigInteger value) {
    checkOpen();
    write(signal, value);
  }

  /**
   * Number of times a cover statement was reached with a true condition.
   * Covers whose condition samples past values are rebuilt by elaboration; look those up by name.
   */
  public long getCoverCount(Property cover) { return coverHits.getOrDefault(cover, 0L); }
  /** Hits of all covers with the given name. */
  public long getCoverCount(String name) {
    long hits = 0;
    for (Map.Entry<Property, Long> entry : coverHits.entrySet()) {
      if (name.equals(entry.getKey().getName()))
        hits += entry.getValue();
    }
    return hits;
  }

  /////////////// run control ///////////////

  /** Runs until every non-background process has finished, or nothing is left to simulate. */
  public void run() {
    start();
    while (hasForegroundProcesses() && advance()) {
    }
  }

  /** Processes every timestamp up to and including the deadline. Time stands at the deadline afterwards. */
  public void runUntil(long deadline) {
    start();
    while (nextEventTime() <= deadline && advance()) {
    }
    if (timestamp < deadline)
      timestamp = deadline;
  }

  public void runFor(long ticks) { runUntil(timestamp + ticks); }

  /**
   * Processes at most the given number of timestamps.
   * @return the number of timestamps processed
   */
  public int runSteps(int limit) {
    start();
    int steps = 0;
    while (steps < limit && advance())
      ++steps;
    return steps;
  }

  /**
   * Processes the next timestamp with pending events.
   * @return false if there are no more events
   */
  public boolean advance() {
    checkOpen();
    start();
    long next = nextEventTime();
    if (next == Long.MAX_VALUE)
      return false;
    timestamp = next;
    for (Clock clock : clocks) {
      if (clock.getNextToggle() == next) {
        write(clock.signal, clock.getNextLevel());
        clock.advance();
      }
    }
    step();
    checkCombProperties();
    emitChanges();
    return true;
  }

  private void start() {
    checkOpen();
    if (started)
      return;
    started = true;
    settleAndReset();
    for (Signal signal : new ArrayList<>(current.keySet())) {
      BigInteger value = current.get(signal);
      lastReported.put(signal, value);
      if (config.report_initial_values)
        listeners.forEach(listener -> listener.valueChanged(timestamp, signal, value));
    }
    step();
    checkCombProperties();
    emitChanges();
  }

  private long nextEventTime() {
    long next = Long.MAX_VALUE;
    for (Clock clock : clocks)
      next = Math.min(next, clock.getNextToggle());
    for (ProcessRunner process : processes) {
      if (!process.isDone() && process.getReason() == ProcessRunner.Reason.DELAY)
        next = Math.min(next, Math.max(process.getWakeTime(), timestamp + 1));
    }
    return next;
  }

  private boolean hasForegroundProcesses() {
    return processes.stream().anyMatch(process -> process.kind != ProcessRunner.Kind.BACKGROUND && !process.isDone());
  }

  /** Delta cycles of the current timestamp until nothing changes and no process is ready. */
  private void step() {
    int deltas = 0;
    while (true) {
      changedInDelta.clear();
      settleAndReset();
      if (processEdges()) {
        checkDeltaBound(++deltas);
        continue;
      }
      List<ProcessRunner> ready = new ArrayList<>();
      for (ProcessRunner process : processes) {
        if (process.isReady())
          ready.add(process);
      }
      if (ready.isEmpty())
        break;
      for (ProcessRunner process : ready) {
        logger.trace("t={} delta {}: resuming {}", timestamp, deltas, process);
        process.resume();
        settleAndReset();
      }
      checkDeltaBound(++deltas);
    }
  }

  private void checkDeltaBound(int deltas) {
    if (deltas > config.max_delta_cycles) {
      List<Signal> changing = new ArrayList<>(changedInDelta);
      String message = String.format("Design did not become stable within %d delta cycles at t=%d; still changing: %s", config.max_delta_cycles,
                                     timestamp, names(changing));
      logger.error(message);
      throw new SimulationInstabilityException(message, timestamp, changing);
    }
  }

  private static String names(List<Signal> signals) {
    List<String> names = new ArrayList<>(signals.size());
    signals.forEach(signal -> names.add(signal.getName()));
    return names.toString();
  }

  /////////////// settle ///////////////

  /** Settles the combinational logic. Used by reads, which must see consistent values. */
  void settleInline() {
    if (!closed)
      settleAndReset();
  }

  private void settleAndReset() {
    int rounds = 0;
    while (true) {
      settleComb();
      if (!forceAsyncResets())
        break;
      checkDeltaBound(++rounds);
    }
  }

  private void settleComb() {
    int passes = 0;
    while (anyDirty) {
      if (++passes > config.max_delta_cycles) {
        List<Signal> changing = new ArrayList<>();
        for (int i = 0; i < units.size(); ++i) {
          if (dirty[i])
            changing.addAll(units.get(i).getTargets());
        }
        String message = String.format("Combinational logic did not settle within %d passes at t=%d; still changing: %s",
                                       config.max_delta_cycles, timestamp, names(changing));
        logger.error(message);
        throw new SimulationInstabilityException(message, timestamp, changing);
      }
      anyDirty = false;
      for (int i = 0; i < units.size(); ++i) {
        if (!dirty[i])
          continue;
        dirty[i] = false;
        evaluateUnit(units.get(i));
      }
    }
  }

  private void evaluateUnit(CombUnit unit) {
    Map<Signal, BigInteger> working = new HashMap<>();
    for (Signal target : unit.getTargets())
      working.put(target, target.getReset());
    StatementExecutor.chained(this::read, working).execute(unit.getStatements());
    for (Signal target : unit.getTargets())
      write(target, working.get(target));
  }

  /** Holds the state of asynchronously reset domains at reset. Returns whether anything changed. */
  private boolean forceAsyncResets() {
    boolean changed = false;
    for (Map.Entry<String, ClockDomain> entry : fragment.getDomains().entrySet()) {
      ClockDomain domain = entry.getValue();
      if (!domain.isAsyncReset() || domain.getRst().isEmpty() || read(domain.getRst().get()).signum() == 0)
        continue;
      for (Signal signal : domainSignals.get(entry.getKey())) {
        if (!signal.isResetLess() && !read(signal).equals(signal.getReset())) {
          write(signal, signal.getReset());
          changed = true;
        }
      }
    }
    return changed;
  }

  /////////////// clock edges ///////////////

  /**
   * Detects active clock edges since the last call and updates the triggered domains together.
   * @return whether any domain was triggered
   */
  private boolean processEdges() {
    List<String> triggered = new ArrayList<>();
    for (Map.Entry<String, ClockDomain> entry : fragment.getDomains().entrySet()) {
      ClockDomain domain = entry.getValue();
      BigInteger level = read(domain.getClk());
      BigInteger previous = lastClock.put(entry.getKey(), level);
      if (previous == null || previous.equals(level))
        continue;
      boolean rising = level.signum() != 0;
      if (rising == (domain.getEdge() == ClockDomain.Edge.POS))
        triggered.add(entry.getKey());
    }
    if (triggered.isEmpty())
      return false;

    // Compute every triggered domain from the pre-edge values before committing any of them.
    Map<Signal, BigInteger> next = new LinkedHashMap<>();
    PropertyViolationException[] violation = new PropertyViolationException[1];
    StatementExecutor.PropertyHandler handler = (property, holds) -> {
      PropertyViolationException error = checkProperty(property, holds);
      if (error != null && violation[0] == null)
        violation[0] = error;
    };
    for (String name : triggered) {
      ClockDomain domain = fragment.getDomains().get(name);
      List<Signal> driven = domainSignals.get(name);
      Map<Signal, BigInteger> working = new HashMap<>();
      for (Signal signal : driven)
        working.put(signal, read(signal));
      new StatementExecutor(evaluator, working, handler).execute(fragment.getStatements(name));
      boolean inReset = domain.getRst().isPresent() && read(domain.getRst().get()).signum() != 0;
      for (Signal signal : driven)
        next.put(signal, inReset && !signal.isResetLess() ? signal.getReset() : working.get(signal));
    }
    next.forEach(this::write);
    for (String name : triggered)
      tickCounts.merge(name, 1L, Long::sum);
    logger.trace("t={}: active edge in {}", timestamp, triggered);
    if (violation[0] != null) {
      logger.error(violation[0].getMessage());
      throw violation[0];
    }
    return true;
  }

  /////////////// properties ///////////////

  private PropertyViolationException checkProperty(Property property, boolean holds) {
    if (property.getKind() == Property.Kind.COVER) {
      if (holds)
        coverHits.merge(property, 1L, Long::sum);
      return null;
    }
    if (holds)
      return null;
    String kind = property.getKind() == Property.Kind.ASSERT ? "Assertion" : "Assumption";
    String name = property.getName() != null ? " '" + property.getName() + "'" : "";
    return new PropertyViolationException(String.format("%s%s failed at t=%d: %s", kind, name, timestamp, property.getCondition()),
                                          timestamp, property);
  }

  private void checkCombProperties() {
    if (!hasCombProperties)
      return;
    new StatementExecutor(evaluator, null, (property, holds) -> {
      PropertyViolationException error = checkProperty(property, holds);
      if (error != null) {
        logger.error(error.getMessage());
        throw error;
      }
    }).execute(fragment.getStatements(ClockDomain.COMB));
  }

  /////////////// state access ///////////////

  BigInteger read(Signal signal) { return current.computeIfAbsent(signal, Signal::getReset); }

  BigInteger evaluate(Value value) { return evaluator.evaluate(value); }

  void write(Signal signal, BigInteger value) {
    BigInteger normalized = Bits.normalize(value, signal.width(), signal.isSigned());
    BigInteger old = current.put(signal, normalized);
    if (normalized.equals(old))
      return;
    changedInDelta.add(signal);
    List<Integer> readers = unitReaders.get(signal);
    if (readers != null) {
      for (int i : readers)
        dirty[i] = true;
      anyDirty = true;
    }
  }

  long getTickCount(String domain) {
    Long count = tickCounts.get(domain);
    if (count == null)
      throw new IllegalArgumentException("Domain '" + domain + "' is not part of the design");
    return count;
  }

  private void emitChanges() {
    for (Signal signal : new ArrayList<>(current.keySet())) {
      BigInteger value = current.get(signal);
      if (value.equals(lastReported.get(signal)))
        continue;
      lastReported.put(signal, value);
      for (ValueChangeListener listener : listeners)
        listener.valueChanged(timestamp, signal, value);
    }
  }

  private void checkOpen() {
    if (closed)
      throw new IllegalStateException("Simulator is closed");
  }

  /** Stops all process threads. The simulator cannot be used afterwards. */
  @Override
  public void close() {
    if (closed)
      return;
    closed = true;
    processes.forEach(ProcessRunner::terminate);
    logger.debug("Simulator closed at t={}", timestamp);
  }

  /** Read-only view of the current values, for diagnostics. */
  public Map<Signal, BigInteger> snapshot() { return Collections.unmodifiableMap(new LinkedHashMap<>(current)); }
}
