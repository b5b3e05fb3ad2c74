package rtlcore.hdl;

import java.util.Objects;
import java.util.Set;

/** Late-bound reference to the clock of a domain; resolved by the elaborator. */
public final class ClockSignal extends Value {
  private final String domain;

  public ClockSignal(String domain) {
    if (ClockDomain.COMB.equals(domain))
      throw new IllegalArgumentException("Domain '" + domain + "' does not have a clock");
    this.domain = Objects.requireNonNull(domain);
  }

  public String getDomain() { return domain; }

  @Override
  public Shape shape() {
    return Shape.unsigned(1);
  }
  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitClockSignal(this);
  }
  @Override
  protected void collectReadSignals(Set<Signal> into) {}

  @Override
  public boolean equals(Object obj) {
    return obj instanceof ClockSignal && domain.equals(((ClockSignal)obj).domain);
  }
  @Override
  public int hashCode() {
    return Objects.hash("clk", domain);
  }
  @Override
  public String toString() {
    return "(clk " + domain + ")";
  }
}
