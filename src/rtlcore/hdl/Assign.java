package rtlcore.hdl;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Assignment of a source value to a target made of signal bit ranges.
 * The source is reduced or extended to the target width when the assignment is applied.
 */
public final class Assign extends Statement {
  /** A contiguous bit range [start, start+width) of one signal. */
  public record TargetRange(Signal signal, int start, int width) {
    public boolean overlaps(TargetRange other) {
      return signal.equals(other.signal) && start < other.start + other.width && other.start < start + width;
    }
  }

  private final Value target;
  private final Value source;
  /** Empty while the target still contains unresolved domain references. */
  private final Optional<List<TargetRange>> ranges;

  /**
   * @throws IllegalArgumentException if the target is not assignable or drives a bit twice
   */
  public Assign(Value target, Value source) {
    this.target = Objects.requireNonNull(target);
    this.source = Objects.requireNonNull(source);
    this.ranges = resolveTarget(target).map(Collections::unmodifiableList);
    this.ranges.ifPresent(Assign::checkDisjoint);
  }

  public static Assign of(Object target, Object source) { return new Assign(Value.cast(target), Value.cast(source)); }

  public Value getTarget() { return target; }
  public Value getSource() { return source; }

  /**
   * The target bit ranges, least significant first.
   * @throws IllegalStateException if the target refers to a domain clock or reset that has not been resolved yet
   */
  public List<TargetRange> getRanges() {
    return ranges.orElseThrow(() -> new IllegalStateException("Target " + target + " has unresolved domain references"));
  }

  /**
   * Flattens an assignment target into signal bit ranges.
   * Returns empty if the target contains {@link ClockSignal} or {@link ResetSignal} references.
   */
  static Optional<List<TargetRange>> resolveTarget(Value target) {
    if (target instanceof Signal) {
      Signal signal = (Signal)target;
      List<TargetRange> result = new ArrayList<>(1);
      if (signal.width() > 0)
        result.add(new TargetRange(signal, 0, signal.width()));
      return Optional.of(result);
    }
    if (target instanceof ClockSignal || target instanceof ResetSignal)
      return Optional.empty();
    if (target instanceof Slice) {
      Slice slice = (Slice)target;
      return resolveTarget(slice.getValue()).map(baseRanges -> sliceRanges(baseRanges, slice.getStart(), slice.getStop()));
    }
    if (target instanceof Cat) {
      List<TargetRange> result = new ArrayList<>();
      for (Value part : ((Cat)target).getParts()) {
        Optional<List<TargetRange>> partRanges = resolveTarget(part);
        if (partRanges.isEmpty())
          return Optional.empty();
        result.addAll(partRanges.get());
      }
      return Optional.of(result);
    }
    if (target instanceof Operator) {
      Operator op = (Operator)target;
      if (op.getKind() == Operator.Kind.AS_SIGNED || op.getKind() == Operator.Kind.AS_UNSIGNED)
        return resolveTarget(op.getOperand(0));
    }
    throw new IllegalArgumentException("Value " + target + " cannot be assigned to");
  }

  private static List<TargetRange> sliceRanges(List<TargetRange> baseRanges, int start, int stop) {
    List<TargetRange> result = new ArrayList<>();
    int offset = 0;
    for (TargetRange range : baseRanges) {
      int lo = Math.max(start, offset);
      int hi = Math.min(stop, offset + range.width());
      if (lo < hi)
        result.add(new TargetRange(range.signal(), range.start() + lo - offset, hi - lo));
      offset += range.width();
    }
    return result;
  }

  private static void checkDisjoint(List<TargetRange> ranges) {
    Map<Signal, BitSet> driven = new HashMap<>();
    for (TargetRange range : ranges) {
      BitSet bits = driven.computeIfAbsent(range.signal(), signal -> new BitSet());
      int overlap = bits.get(range.start(), range.start() + range.width()).nextSetBit(0);
      if (overlap >= 0)
        throw new IllegalArgumentException(String.format("Assignment target drives bit %d of signal '%s' more than once",
                                                         range.start() + overlap, range.signal().getName()));
      bits.set(range.start(), range.start() + range.width());
    }
  }

  @Override
  public <R> R accept(StatementVisitor<R> visitor) {
    return visitor.visitAssign(this);
  }
  @Override
  protected void collectReadSignals(Set<Signal> into) {
    source.collectReadSignals(into);
  }
  @Override
  protected void collectWrittenSignals(Set<Signal> into) {
    ranges.ifPresent(list -> list.forEach(range -> into.add(range.signal())));
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Assign other = (Assign)obj;
    return target.equals(other.target) && source.equals(other.source);
  }
  @Override
  public int hashCode() {
    return Objects.hash(target, source);
  }
  @Override
  public String toString() {
    return String.format("(eq %s %s)", target, source);
  }
}
