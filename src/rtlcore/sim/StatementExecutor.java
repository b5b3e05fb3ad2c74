package rtlcore.sim;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import rtlcore.hdl.Assign;
import rtlcore.hdl.Property;
import rtlcore.hdl.Signal;
import rtlcore.hdl.Statement;
import rtlcore.hdl.StatementVisitor;
import rtlcore.hdl.Switch;
import rtlcore.util.Bits;

/**
 * Replays a statement list. Assignments update a working set of target values in program order, so the last
 * applied assignment wins; properties are reported to a handler. Reads go to the evaluator; only a
 * {@link #chained chained} executor lets them see bits assigned earlier in the same replay.
 */
class StatementExecutor implements StatementVisitor<Void> {

  /** Receives each evaluated property with its outcome. */
  @FunctionalInterface
  interface PropertyHandler {
    void property(Property property, boolean holds);
  }

  private final ValueEvaluator evaluator;
  private final Map<Signal, BigInteger> working;
  private final PropertyHandler properties;
  /** Mask of the bits assigned so far per signal; null if not tracked. */
  private final Map<Signal, BigInteger> assigned;

  /**
   * @param working target values, updated in place; null to skip assignments
   * @param properties property handler; null to skip properties
   */
  StatementExecutor(ValueEvaluator evaluator, Map<Signal, BigInteger> working, PropertyHandler properties) {
    this(evaluator, working, properties, null);
  }
  private StatementExecutor(ValueEvaluator evaluator, Map<Signal, BigInteger> working, PropertyHandler properties,
                            Map<Signal, BigInteger> assigned) {
    this.evaluator = evaluator;
    this.working = working;
    this.properties = properties;
    this.assigned = assigned;
  }

  /**
   * Executor for combinational logic: a read of a bit that was already assigned in this replay sees the
   * assigned value, every other read sees the settled value.
   * @param settled settled value of each signal
   * @param working target values, updated in place
   */
  static StatementExecutor chained(Function<Signal, BigInteger> settled, Map<Signal, BigInteger> working) {
    Map<Signal, BigInteger> assigned = new HashMap<>();
    ValueEvaluator evaluator = new ValueEvaluator(signal -> {
      BigInteger mask = assigned.get(signal);
      if (mask == null)
        return settled.apply(signal);
      int width = signal.width();
      BigInteger bits = Bits.raw(settled.apply(signal), width).andNot(mask).or(Bits.raw(working.get(signal), width).and(mask));
      return Bits.normalize(bits, width, signal.isSigned());
    });
    return new StatementExecutor(evaluator, working, null, assigned);
  }

  void execute(List<Statement> statements) {
    for (Statement statement : statements)
      statement.accept(this);
  }

  @Override
  public Void visitAssign(Assign statement) {
    if (working == null)
      return null;
    int width = statement.getTarget().width();
    BigInteger bits = Bits.raw(evaluator.evaluate(statement.getSource()), width);
    int offset = 0;
    for (Assign.TargetRange range : statement.getRanges()) {
      Signal signal = range.signal();
      BigInteger old = Bits.raw(working.get(signal), signal.width());
      BigInteger updated = Bits.insert(old, range.start(), range.width(), Bits.extract(bits, offset, range.width()));
      working.put(signal, Bits.normalize(updated, signal.width(), signal.isSigned()));
      if (assigned != null)
        assigned.merge(signal, Bits.mask(range.width()).shiftLeft(range.start()), BigInteger::or);
      offset += range.width();
    }
    return null;
  }

  @Override
  public Void visitSwitch(Switch statement) {
    BigInteger test = Bits.raw(evaluator.evaluate(statement.getTest()), statement.getTest().width());
    for (Switch.Case c : statement.getCases()) {
      if (c.matches(test)) {
        execute(c.getBody());
        break;
      }
    }
    return null;
  }

  @Override
  public Void visitProperty(Property statement) {
    if (properties != null)
      properties.property(statement, evaluator.evaluate(statement.getCondition()).signum() != 0);
    return null;
  }
}
