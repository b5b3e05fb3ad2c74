package rtlcore.sim;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import rtlcore.hdl.Signal;

/** Collects the value-change feed in memory. */
public class TraceRecorder implements ValueChangeListener {
  private final List<ValueChange> changes = new ArrayList<>();

  @Override
  public void valueChanged(long timestamp, Signal signal, BigInteger value) {
    changes.add(new ValueChange(timestamp, signal, value));
  }

  public List<ValueChange> getChanges() { return Collections.unmodifiableList(changes); }

  /** Changes of one signal, in order. */
  public List<ValueChange> getChanges(Signal signal) {
    List<ValueChange> result = new ArrayList<>();
    for (ValueChange change : changes) {
      if (change.signal().equals(signal))
        result.add(change);
    }
    return result;
  }

  /** One line per change: timestamp, signal name, value. */
  public String toText() {
    StringBuilder sb = new StringBuilder();
    for (ValueChange change : changes)
      sb.append(change).append('\n');
    return sb.toString();
  }

  public void clear() { changes.clear(); }
}
