package rtlcore.hdl;

import java.util.Objects;
import java.util.Set;

/**
 * Assertion, assumption or cover point on a one-bit condition, checked whenever its domain is evaluated.
 */
public final class Property extends Statement {
  public enum Kind { ASSERT, ASSUME, COVER }

  private final Kind kind;
  private final Value condition;
  private final String name;

  public Property(Kind kind, Value condition, String name) {
    this.kind = Objects.requireNonNull(kind);
    this.condition = condition.width() == 1 ? condition : Ops.bool(condition);
    this.name = name;
  }

  public static Property assertThat(Object condition, String name) { return new Property(Kind.ASSERT, Value.cast(condition), name); }
  public static Property assume(Object condition, String name) { return new Property(Kind.ASSUME, Value.cast(condition), name); }
  public static Property cover(Object condition, String name) { return new Property(Kind.COVER, Value.cast(condition), name); }

  public Kind getKind() { return kind; }
  public Value getCondition() { return condition; }
  /** The user-supplied name, or null. */
  public String getName() { return name; }

  @Override
  public <R> R accept(StatementVisitor<R> visitor) {
    return visitor.visitProperty(this);
  }
  @Override
  protected void collectReadSignals(Set<Signal> into) {
    condition.collectReadSignals(into);
  }
  @Override
  protected void collectWrittenSignals(Set<Signal> into) {}

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Property other = (Property)obj;
    return kind == other.kind && condition.equals(other.condition) && Objects.equals(name, other.name);
  }
  @Override
  public int hashCode() {
    return Objects.hash(kind, condition, name);
  }
  @Override
  public String toString() {
    return String.format("(%s%s %s)", kind.name().toLowerCase(), name == null ? "" : " " + name, condition);
  }
}
