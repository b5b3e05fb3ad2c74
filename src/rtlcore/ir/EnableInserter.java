package rtlcore.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import rtlcore.hdl.Assign;
import rtlcore.hdl.Elaboratable;
import rtlcore.hdl.Property;
import rtlcore.hdl.Signal;
import rtlcore.hdl.Statement;
import rtlcore.hdl.Value;

/**
 * Adds a clock enable to domains of a design: at an active edge with the control low, every signal the
 * design drives in the domain keeps its value and the domain's properties are not checked.
 */
public class EnableInserter extends ControlInserter {
  /** Control of the domain being transformed, null outside controlled domains. */
  private Value currentEnable = null;

  public EnableInserter(Elaboratable inner, String domain, Object enable) { this(inner, Map.of(domain, enable)); }
  public EnableInserter(Elaboratable inner, Map<String, ?> enables) { super(inner, enables); }

  @Override
  protected ControlInserter wrap(Elaboratable submodule, Map<String, Value> submoduleControls) {
    return new EnableInserter(submodule, submoduleControls);
  }

  @Override
  protected List<Statement> transformDomain(String domain, List<Statement> statements) {
    currentEnable = controls.get(domain);
    try {
      return currentEnable == null ? statements : transform(statements);
    } finally {
      currentEnable = null;
    }
  }

  @Override
  public Statement visitProperty(Property statement) {
    return currentEnable == null ? statement : onControl(currentEnable, 1, List.of(statement));
  }

  @Override
  protected Statement controlStatement(String domain, Value control, Set<Signal> driven) {
    List<Statement> holds = new ArrayList<>();
    for (Signal signal : driven)
      holds.add(Assign.of(signal, signal));
    return holds.isEmpty() ? null : onControl(control, 0, holds);
  }
}
