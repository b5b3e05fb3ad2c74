package rtlcore.ir;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import rtlcore.hdl.ClockDomain;
import rtlcore.hdl.Elaboratable;
import rtlcore.hdl.Module;
import rtlcore.hdl.Ops;
import rtlcore.hdl.Signal;
import rtlcore.hdl.Statement;
import rtlcore.hdl.Switch;
import rtlcore.hdl.Value;

/**
 * Wraps a design and adds a control signal to some of its clocked domains, in the wrapped module and in
 * every submodule. Each module is rebuilt with its statements passed through this transformer and a
 * control statement appended per controlled domain; since the last applied assignment wins, the control
 * statement overrides the module's own assignments.
 * Submodule domain renames are followed, so a control given for a parent domain reaches the child domain
 * renamed to it.
 */
public abstract class ControlInserter extends ValueTransformer implements Elaboratable {
  private final Elaboratable inner;
  /** Control per domain name, each one bit wide. */
  protected final Map<String, Value> controls;

  /**
   * @param controls control value per domain name; wider values are reduced with {@link Ops#bool}
   * @throws IllegalArgumentException if a control is given for the combinational domain
   */
  protected ControlInserter(Elaboratable inner, Map<String, ?> controls) {
    this.inner = Objects.requireNonNull(inner);
    Map<String, Value> casted = new LinkedHashMap<>();
    controls.forEach((domain, control) -> {
      if (ClockDomain.COMB.equals(domain))
        throw new IllegalArgumentException("Cannot add a control signal to the '" + ClockDomain.COMB + "' domain");
      Value value = Value.cast(control);
      casted.put(domain, value.width() == 1 && !value.isSigned() ? value : Ops.bool(value));
    });
    this.controls = casted;
  }

  /** The same kind of inserter around a submodule, with controls keyed by the submodule's domain names. */
  protected abstract ControlInserter wrap(Elaboratable submodule, Map<String, Value> submoduleControls);

  /**
   * The statement appended to a controlled domain.
   * @param domain the domain name as used in the module
   * @param control the one-bit control
   * @param driven the signals the module drives in the domain, in first-assignment order
   * @return the statement, or null to append nothing
   */
  protected abstract Statement controlStatement(String domain, Value control, Set<Signal> driven);

  /** A switch executing the body when the control has the given value. */
  protected static Switch onControl(Value control, int value, List<Statement> body) {
    Map.Entry<List<?>, List<Statement>> onlyCase = Map.entry(List.of(value), body);
    return new Switch(control, List.of(onlyCase));
  }

  @Override
  public Module elaborate() {
    Module module = inner.elaborate();
    Module result = new Module(module.getName());
    module.getDomains().values().forEach(result::addDomain);
    for (Module.Submodule submodule : module.getSubmodules())
      result.addSubmodule(submodule.name(), wrap(submodule.elaboratable(), childControls(submodule.renames())),
                          submodule.renames());
    for (String domain : module.usedDomains()) {
      List<Statement> statements = transformDomain(domain, module.lower(domain));
      result.domain(domain, statements);
      Value control = controls.get(domain);
      if (control == null)
        continue;
      Set<Signal> driven = new LinkedHashSet<>();
      statements.forEach(statement -> driven.addAll(statement.writtenSignals()));
      Statement controlStatement = controlStatement(domain, control, driven);
      if (controlStatement != null)
        result.domain(domain, controlStatement);
    }
    return result;
  }

  /** Rewrites the statements of one domain of a module; by default with the value transformer. */
  protected List<Statement> transformDomain(String domain, List<Statement> statements) { return transform(statements); }

  private Map<String, Value> childControls(Map<String, String> renames) {
    Map<String, Value> result = new LinkedHashMap<>();
    controls.forEach((domain, control) -> {
      if (!renames.containsKey(domain))
        result.put(domain, control);
    });
    renames.forEach((innerName, outerName) -> {
      Value control = controls.get(outerName);
      if (control != null)
        result.put(innerName, control);
    });
    return result;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + inner + ", " + controls.keySet() + ")";
  }
}
