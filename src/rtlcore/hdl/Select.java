package rtlcore.hdl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import rtlcore.util.Bits;

/**
 * Indexed selection among a list of choices. The index must be wide enough to address every choice;
 * index values past the last choice select the last choice.
 */
public final class Select extends Value {
  private final Value index;
  private final List<Value> choices;
  private final Shape shape;

  public Select(Value index, List<Value> choices) {
    if (choices.isEmpty())
      throw new ShapeException("Cannot select from an empty list of choices");
    if (index.isSigned())
      throw new ShapeException("Select index must be unsigned");
    int required = Bits.clog2(choices.size());
    if (index.width() < required)
      throw new ShapeException(String.format("Select index of %d bits cannot address all %d choices (needs %d bits)", index.width(),
                                             choices.size(), required));
    this.index = index;
    this.choices = List.copyOf(choices);
    this.shape = Shape.unify(this.choices.stream().map(Value::shape).toList());
  }

  public static Select of(Object index, Object... choices) { return of(index, Arrays.asList(choices)); }
  public static Select of(Object index, List<?> choices) {
    List<Value> values = new ArrayList<>();
    for (Object choice : choices)
      values.add(Value.cast(choice));
    return new Select(Value.cast(index), values);
  }

  public Value getIndex() { return index; }
  public List<Value> getChoices() { return Collections.unmodifiableList(choices); }

  @Override
  public Shape shape() {
    return shape;
  }
  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitSelect(this);
  }
  @Override
  protected void collectReadSignals(Set<Signal> into) {
    index.collectReadSignals(into);
    choices.forEach(choice -> choice.collectReadSignals(into));
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Select other = (Select)obj;
    return index.equals(other.index) && choices.equals(other.choices);
  }
  @Override
  public int hashCode() {
    return Objects.hash(index, choices);
  }
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(select ").append(index);
    choices.forEach(choice -> sb.append(' ').append(choice));
    return sb.append(')').toString();
  }
}
