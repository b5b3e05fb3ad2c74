package rtlcore.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import rtlcore.hdl.Assign;
import rtlcore.hdl.Const;
import rtlcore.hdl.Elaboratable;
import rtlcore.hdl.Signal;
import rtlcore.hdl.Statement;
import rtlcore.hdl.Value;

/**
 * Adds a synchronous reset to domains of a design: while the control is high at an active edge, every
 * signal the design drives in the domain is set to its reset value. Reset-less signals are left alone.
 */
public class ResetInserter extends ControlInserter {

  public ResetInserter(Elaboratable inner, String domain, Object reset) { this(inner, Map.of(domain, reset)); }
  public ResetInserter(Elaboratable inner, Map<String, ?> resets) { super(inner, resets); }

  @Override
  protected ControlInserter wrap(Elaboratable submodule, Map<String, Value> submoduleControls) {
    return new ResetInserter(submodule, submoduleControls);
  }

  @Override
  protected Statement controlStatement(String domain, Value control, Set<Signal> driven) {
    List<Statement> resets = new ArrayList<>();
    for (Signal signal : driven) {
      if (!signal.isResetLess())
        resets.add(Assign.of(signal, Const.of(signal.getReset(), signal.shape())));
    }
    return resets.isEmpty() ? null : onControl(control, 1, resets);
  }
}
