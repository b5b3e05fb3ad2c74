package rtlcore.hdl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/** Concatenation. The first part occupies the least significant bits. Always unsigned. */
public final class Cat extends Value {
  private final List<Value> parts;

  public Cat(List<Value> parts) { this.parts = List.copyOf(parts); }

  public static Cat of(Object... parts) { return of(Arrays.asList(parts)); }
  public static Cat of(Iterable<?> parts) {
    List<Value> values = new ArrayList<>();
    for (Object part : parts)
      values.add(Value.cast(part));
    return new Cat(values);
  }

  public List<Value> getParts() { return Collections.unmodifiableList(parts); }

  @Override
  public Shape shape() {
    return Shape.unsigned(parts.stream().mapToInt(Value::width).sum());
  }
  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitCat(this);
  }
  @Override
  protected void collectReadSignals(Set<Signal> into) {
    parts.forEach(part -> part.collectReadSignals(into));
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    return parts.equals(((Cat)obj).parts);
  }
  @Override
  public int hashCode() {
    return parts.hashCode();
  }
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(cat");
    parts.forEach(part -> sb.append(' ').append(part));
    return sb.append(')').toString();
  }
}
