package rtlcore.hdl;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable statement. A statement is bound to a domain by the module list it is added to.
 */
public abstract class Statement {

  public abstract <R> R accept(StatementVisitor<R> visitor);

  /** Collects the signals whose value is needed to execute this statement. */
  protected abstract void collectReadSignals(Set<Signal> into);
  /** Collects the signals this statement may assign. */
  protected abstract void collectWrittenSignals(Set<Signal> into);

  public Set<Signal> readSignals() {
    LinkedHashSet<Signal> result = new LinkedHashSet<>();
    collectReadSignals(result);
    return Collections.unmodifiableSet(result);
  }
  public Set<Signal> writtenSignals() {
    LinkedHashSet<Signal> result = new LinkedHashSet<>();
    collectWrittenSignals(result);
    return Collections.unmodifiableSet(result);
  }
}
