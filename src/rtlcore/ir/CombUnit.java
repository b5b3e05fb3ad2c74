package rtlcore.ir;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import rtlcore.hdl.Signal;
import rtlcore.hdl.Statement;

/**
 * An evaluation unit: all combinational statements that assign a common signal, in program order.
 * Evaluating a unit replays its statements starting from the reset values of its targets.
 */
public final class CombUnit {
  private final List<Statement> statements;
  private final Set<Signal> targets;
  private final Set<Signal> reads;

  CombUnit(List<Statement> statements) {
    this.statements = List.copyOf(statements);
    LinkedHashSet<Signal> targets = new LinkedHashSet<>();
    LinkedHashSet<Signal> reads = new LinkedHashSet<>();
    for (Statement statement : statements) {
      targets.addAll(statement.writtenSignals());
      reads.addAll(statement.readSignals());
    }
    this.targets = Collections.unmodifiableSet(targets);
    this.reads = Collections.unmodifiableSet(reads);
  }

  public List<Statement> getStatements() { return statements; }
  public Set<Signal> getTargets() { return targets; }
  /** Signals read by the unit, including its own targets if it reads them. */
  public Set<Signal> getReads() { return reads; }

  @Override
  public String toString() {
    return "CombUnit" + targets;
  }
}
