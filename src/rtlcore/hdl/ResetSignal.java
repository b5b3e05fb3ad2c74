package rtlcore.hdl;

import java.util.Objects;
import java.util.Set;

/**
 * Late-bound reference to the reset of a domain; resolved by the elaborator.
 * Referring to the reset of a reset-less domain fails elaboration unless allowResetLess is set,
 * in which case it reads as constant zero.
 */
public final class ResetSignal extends Value {
  private final String domain;
  private final boolean allowResetLess;

  public ResetSignal(String domain) { this(domain, false); }
  public ResetSignal(String domain, boolean allowResetLess) {
    if (ClockDomain.COMB.equals(domain))
      throw new IllegalArgumentException("Domain '" + domain + "' does not have a reset");
    this.domain = Objects.requireNonNull(domain);
    this.allowResetLess = allowResetLess;
  }

  public String getDomain() { return domain; }
  public boolean isAllowResetLess() { return allowResetLess; }

  @Override
  public Shape shape() {
    return Shape.unsigned(1);
  }
  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitResetSignal(this);
  }
  @Override
  protected void collectReadSignals(Set<Signal> into) {}

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ResetSignal))
      return false;
    ResetSignal other = (ResetSignal)obj;
    return domain.equals(other.domain) && allowResetLess == other.allowResetLess;
  }
  @Override
  public int hashCode() {
    return Objects.hash("rst", domain, allowResetLess);
  }
  @Override
  public String toString() {
    return "(rst " + domain + ")";
  }
}
