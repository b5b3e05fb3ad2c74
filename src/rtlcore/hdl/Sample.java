package rtlcore.hdl;

import java.util.Objects;
import java.util.Set;

/**
 * The value an expression had a number of active edges ago in a domain.
 * Lowered to a register chain during elaboration; a delay of zero is the value itself.
 */
public final class Sample extends Value {
  private final Value value;
  private final String domain;
  private final int clocks;

  public Sample(Value value, String domain, int clocks) {
    if (clocks < 0)
      throw new ShapeException("Cannot sample a value " + clocks + " cycles in the future");
    this.value = Objects.requireNonNull(value);
    this.domain = Objects.requireNonNull(domain, "Sample needs a domain");
    if (ClockDomain.COMB.equals(domain))
      throw new IllegalArgumentException("Values can only be sampled in clocked domains");
    this.clocks = clocks;
  }

  public static Sample of(Object value, String domain, int clocks) { return new Sample(Value.cast(value), domain, clocks); }

  public Value getValue() { return value; }
  public String getDomain() { return domain; }
  public int getClocks() { return clocks; }

  @Override
  public Shape shape() {
    return value.shape();
  }
  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitSample(this);
  }
  @Override
  protected void collectReadSignals(Set<Signal> into) {
    value.collectReadSignals(into);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Sample other = (Sample)obj;
    return clocks == other.clocks && domain.equals(other.domain) && value.equals(other.value);
  }
  @Override
  public int hashCode() {
    return Objects.hash(value, domain, clocks);
  }
  @Override
  public String toString() {
    return String.format("(sample %s @ %s[%d])", value, domain, clocks);
  }
}
