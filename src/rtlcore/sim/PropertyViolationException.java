package rtlcore.sim;

import java.util.List;
import rtlcore.hdl.Property;

/** An assertion or assumption evaluated to false. */
public class PropertyViolationException extends SimulationException {
  private static final long serialVersionUID = 1L;

  private final transient Property property;

  public PropertyViolationException(String message, long timestamp, Property property) {
    super(message, timestamp, List.copyOf(property.readSignals()));
    this.property = property;
  }

  public Property getProperty() { return property; }
}
