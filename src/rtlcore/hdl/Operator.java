package rtlcore.hdl;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Arithmetic, bitwise, comparison and selection operators.
 * The result shape is derived from the operand shapes so that arithmetic never truncates:
 * see {@link #inferShape(Kind, List)} for the rules.
 */
public final class Operator extends Value {
  /** Operator kinds with their printable symbol and arity. */
  public enum Kind {
    NOT("~", 1),
    NEG("-", 1),
    BOOL("b", 1),
    ANY("r|", 1),
    ALL("r&", 1),
    XOR_REDUCE("r^", 1),
    AS_UNSIGNED("u", 1),
    AS_SIGNED("s", 1),
    ADD("+", 2),
    SUB("-", 2),
    MUL("*", 2),
    FLOORDIV("//", 2),
    MOD("%", 2),
    AND("&", 2),
    OR("|", 2),
    XOR("^", 2),
    EQ("==", 2),
    NE("!=", 2),
    LT("<", 2),
    LE("<=", 2),
    GT(">", 2),
    GE(">=", 2),
    SHL("<<", 2),
    SHR(">>", 2),
    MUX("m", 3);

    public final String symbol;
    public final int arity;
    Kind(String symbol, int arity) {
      this.symbol = symbol;
      this.arity = arity;
    }
    public boolean isComparison() { return this == EQ || this == NE || this == LT || this == LE || this == GT || this == GE; }
  }

  /** Shift amounts wider than this would describe results with more than 2^16 bits. */
  public static final int MAX_SHIFT_AMOUNT_WIDTH = 16;

  private final Kind kind;
  private final List<Value> operands;
  private final Shape shape;

  /**
   * @throws ShapeException if the operator is undefined for the operand shapes
   */
  public Operator(Kind kind, List<Value> operands) {
    if (operands.size() != kind.arity)
      throw new IllegalArgumentException(String.format("Operator %s takes %d operands, got %d", kind.symbol, kind.arity, operands.size()));
    this.kind = kind;
    this.operands = List.copyOf(operands);
    this.shape = inferShape(kind, this.operands);
  }
  public Operator(Kind kind, Value... operands) { this(kind, Arrays.asList(operands)); }

  /**
   * Width/sign inference.
   * Bitwise operators unify their operands; addition and subtraction add a carry bit to the unified shape;
   * multiplication adds widths; comparisons and reductions produce one unsigned bit; negation always yields a
   * signed result one bit wider; a left shift by a variable amount grows by the largest possible shift.
   */
  static Shape inferShape(Kind kind, List<Value> operands) {
    Shape a = operands.get(0).shape();
    switch (kind) {
    case NOT:
      return a;
    case NEG:
      return Shape.signed(a.getWidth() + 1);
    case BOOL:
    case ANY:
    case ALL:
    case XOR_REDUCE:
      return Shape.unsigned(1);
    case AS_UNSIGNED:
      return Shape.unsigned(a.getWidth());
    case AS_SIGNED:
      if (a.getWidth() == 0)
        throw new ShapeException("Cannot reinterpret a zero-width value as signed");
      return Shape.signed(a.getWidth());
    case MUX:
      return Shape.unify(operands.get(1).shape(), operands.get(2).shape());
    default:
      break;
    }
    Shape b = operands.get(1).shape();
    switch (kind) {
    case ADD:
    case SUB: {
      Shape unified = Shape.unify(a, b);
      return Shape.of(unified.getWidth() + 1, unified.isSigned());
    }
    case MUL:
      if (a.getWidth() + b.getWidth() == 0)
        return Shape.unsigned(0);
      return Shape.of(a.getWidth() + b.getWidth(), a.isSigned() || b.isSigned());
    case FLOORDIV:
      return Shape.of(Math.max(1, a.getWidth() + (b.isSigned() ? 1 : 0)), a.isSigned() || b.isSigned());
    case MOD:
      return b;
    case AND:
    case OR:
    case XOR:
      return Shape.unify(a, b);
    case EQ:
    case NE:
    case LT:
    case LE:
    case GT:
    case GE:
      return Shape.unsigned(1);
    case SHL:
      if (b.isSigned())
        throw new ShapeException("Shift amount must be unsigned, got " + b);
      if (b.getWidth() > MAX_SHIFT_AMOUNT_WIDTH)
        throw new ShapeException("Shift amount of " + b.getWidth() + " bits is too wide to bound the result width");
      return Shape.of(a.getWidth() + (1 << b.getWidth()) - 1, a.isSigned());
    case SHR:
      if (b.isSigned())
        throw new ShapeException("Shift amount must be unsigned, got " + b);
      return a;
    default:
      throw new IllegalStateException("Unhandled operator " + kind);
    }
  }

  public Kind getKind() { return kind; }
  public List<Value> getOperands() { return Collections.unmodifiableList(operands); }
  public Value getOperand(int i) { return operands.get(i); }

  @Override
  public Shape shape() {
    return shape;
  }
  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitOperator(this);
  }
  @Override
  protected void collectReadSignals(Set<Signal> into) {
    operands.forEach(operand -> operand.collectReadSignals(into));
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Operator other = (Operator)obj;
    return kind == other.kind && operands.equals(other.operands);
  }
  @Override
  public int hashCode() {
    return Objects.hash(kind, operands);
  }
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(").append(kind.symbol);
    operands.forEach(operand -> sb.append(' ').append(operand));
    return sb.append(')').toString();
  }
}
