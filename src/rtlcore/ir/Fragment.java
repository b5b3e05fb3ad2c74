package rtlcore.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import rtlcore.hdl.ClockDomain;
import rtlcore.hdl.Signal;
import rtlcore.hdl.Statement;

/**
 * Flattened, immutable result of elaboration. Holds everything a simulator or netlist generator needs:
 * ports, clock domains, statements per domain, all signals and the combinational evaluation order.
 */
public final class Fragment {
  public enum Direction { IN, OUT }

  private final Map<Signal, Direction> ports;
  private final Map<String, ClockDomain> domains;
  private final Map<String, List<Statement>> statements;
  private final Set<Signal> signals;
  private final List<CombUnit> combUnits;
  private final Map<Signal, String> driverDomains;
  private final List<String> diagnostics;

  Fragment(Map<Signal, Direction> ports, Map<String, ClockDomain> domains, Map<String, List<Statement>> statements, Set<Signal> signals,
           List<CombUnit> combUnits, Map<Signal, String> driverDomains, List<String> diagnostics) {
    this.ports = Collections.unmodifiableMap(new LinkedHashMap<>(ports));
    this.domains = Collections.unmodifiableMap(new LinkedHashMap<>(domains));
    LinkedHashMap<String, List<Statement>> statementsCopy = new LinkedHashMap<>();
    statements.forEach((domain, list) -> statementsCopy.put(domain, List.copyOf(list)));
    this.statements = Collections.unmodifiableMap(statementsCopy);
    this.signals = Collections.unmodifiableSet(new LinkedHashSet<>(signals));
    this.combUnits = List.copyOf(combUnits);
    this.driverDomains = Collections.unmodifiableMap(new LinkedHashMap<>(driverDomains));
    this.diagnostics = List.copyOf(diagnostics);
  }

  /** Ports in order: domain clocks and resets, other inputs, then outputs. */
  public Map<Signal, Direction> getPorts() { return ports; }
  /** Clock domains keyed by their unique name in this fragment. */
  public Map<String, ClockDomain> getDomains() { return domains; }
  /** Statements keyed by domain name; combinational statements are keyed by {@link ClockDomain#COMB}. */
  public Map<String, List<Statement>> getStatements() { return statements; }
  public List<Statement> getStatements(String domain) { return statements.getOrDefault(domain, List.of()); }
  public Set<Signal> getSignals() { return signals; }
  /** Combinational evaluation units, producers before consumers. */
  public List<CombUnit> getCombUnits() { return combUnits; }
  /** The domain driving a signal, {@link ClockDomain#COMB} for combinational signals; empty for undriven signals. */
  public Optional<String> getDriverDomain(Signal signal) { return Optional.ofNullable(driverDomains.get(signal)); }
  /** Signals driven by the given domain, in signal order. */
  public List<Signal> getDrivenSignals(String domain) {
    List<Signal> result = new ArrayList<>();
    driverDomains.forEach((signal, driver) -> {
      if (driver.equals(domain))
        result.add(signal);
    });
    return result;
  }
  /** Non-fatal findings and notes such as created domains. */
  public List<String> getDiagnostics() { return diagnostics; }

  /** Finds a signal by name; names are not necessarily unique, the first match is returned. */
  public Optional<Signal> findSignal(String name) {
    return signals.stream().filter(signal -> signal.getName().equals(name)).findFirst();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Fragment(");
    sb.append("ports=").append(ports.size()).append(", domains=").append(domains.keySet());
    sb.append(", signals=").append(signals.size()).append(", comb units=").append(combUnits.size()).append(')');
    return sb.toString();
  }
}
