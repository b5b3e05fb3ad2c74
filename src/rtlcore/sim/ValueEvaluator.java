package rtlcore.sim;

import java.math.BigInteger;
import java.util.List;
import java.util.function.Function;
import rtlcore.hdl.Cat;
import rtlcore.hdl.ClockSignal;
import rtlcore.hdl.Const;
import rtlcore.hdl.Operator;
import rtlcore.hdl.Part;
import rtlcore.hdl.Replicate;
import rtlcore.hdl.ResetSignal;
import rtlcore.hdl.Sample;
import rtlcore.hdl.Select;
import rtlcore.hdl.Shape;
import rtlcore.hdl.Signal;
import rtlcore.hdl.Slice;
import rtlcore.hdl.Value;
import rtlcore.hdl.ValueVisitor;
import rtlcore.util.Bits;

/**
 * Computes the value of an expression from signal values. Every result is canonical for the shape of the
 * evaluated node: unsigned values in [0, 2^w), signed values in [-2^(w-1), 2^(w-1)).
 * Domain references must have been lowered by elaboration.
 */
public class ValueEvaluator implements ValueVisitor<BigInteger> {
  private final Function<Signal, BigInteger> signals;

  /** @param signals current (canonical) value of each signal */
  public ValueEvaluator(Function<Signal, BigInteger> signals) { this.signals = signals; }

  public BigInteger evaluate(Value value) { return value.accept(this); }

  private static BigInteger fit(BigInteger value, Shape shape) { return Bits.normalize(value, shape.getWidth(), shape.isSigned()); }
  private static BigInteger bool(boolean condition) { return condition ? BigInteger.ONE : BigInteger.ZERO; }

  @Override
  public BigInteger visitConst(Const value) {
    return value.getValue();
  }
  @Override
  public BigInteger visitSignal(Signal value) {
    return signals.apply(value);
  }

  @Override
  public BigInteger visitOperator(Operator value) {
    List<Value> operands = value.getOperands();
    BigInteger a = evaluate(operands.get(0));
    Shape shape = value.shape();
    int width = operands.get(0).width();
    switch (value.getKind()) {
    case NOT:
      return fit(a.not(), shape);
    case NEG:
      return fit(a.negate(), shape);
    case BOOL:
    case ANY:
      return bool(a.signum() != 0);
    case ALL:
      return bool(Bits.raw(a, width).equals(Bits.mask(width)));
    case XOR_REDUCE:
      return bool(Bits.raw(a, width).bitCount() % 2 == 1);
    case AS_UNSIGNED:
    case AS_SIGNED:
      return fit(a, shape);
    case MUX:
      return fit(a.signum() != 0 ? evaluate(operands.get(1)) : evaluate(operands.get(2)), shape);
    default:
      break;
    }
    BigInteger b = evaluate(operands.get(1));
    switch (value.getKind()) {
    case ADD:
      return fit(a.add(b), shape);
    case SUB:
      return fit(a.subtract(b), shape);
    case MUL:
      return fit(a.multiply(b), shape);
    case FLOORDIV:
      return b.signum() == 0 ? BigInteger.ZERO : fit(floorDiv(a, b), shape);
    case MOD:
      return b.signum() == 0 ? BigInteger.ZERO : fit(a.subtract(floorDiv(a, b).multiply(b)), shape);
    case AND:
      return fit(a.and(b), shape);
    case OR:
      return fit(a.or(b), shape);
    case XOR:
      return fit(a.xor(b), shape);
    case EQ:
      return bool(a.compareTo(b) == 0);
    case NE:
      return bool(a.compareTo(b) != 0);
    case LT:
      return bool(a.compareTo(b) < 0);
    case LE:
      return bool(a.compareTo(b) <= 0);
    case GT:
      return bool(a.compareTo(b) > 0);
    case GE:
      return bool(a.compareTo(b) >= 0);
    case SHL:
      // The amount is bounded by the shape rules.
      return fit(a.shiftLeft(b.intValueExact()), shape);
    case SHR:
      if (b.compareTo(BigInteger.valueOf(Math.max(width, 1))) >= 0)
        return a.signum() < 0 ? BigInteger.ONE.negate() : BigInteger.ZERO;
      return fit(a.shiftRight(b.intValueExact()), shape);
    default:
      throw new IllegalStateException("Unhandled operator " + value.getKind());
    }
  }

  private static BigInteger floorDiv(BigInteger a, BigInteger b) {
    BigInteger[] qr = a.divideAndRemainder(b);
    if (qr[1].signum() != 0 && qr[1].signum() != b.signum())
      return qr[0].subtract(BigInteger.ONE);
    return qr[0];
  }

  @Override
  public BigInteger visitSlice(Slice value) {
    BigInteger base = Bits.raw(evaluate(value.getValue()), value.getValue().width());
    return Bits.extract(base, value.getStart(), value.getStop() - value.getStart());
  }
  @Override
  public BigInteger visitPart(Part value) {
    int baseWidth = value.getValue().width();
    BigInteger start = evaluate(value.getOffset()).multiply(BigInteger.valueOf(value.getStride()));
    // Bits beyond the base read as zero.
    if (start.compareTo(BigInteger.valueOf(baseWidth)) >= 0)
      return BigInteger.ZERO;
    BigInteger base = Bits.raw(evaluate(value.getValue()), baseWidth);
    return Bits.extract(base, start.intValueExact(), value.getPartWidth());
  }
  @Override
  public BigInteger visitCat(Cat value) {
    BigInteger result = BigInteger.ZERO;
    int offset = 0;
    for (Value part : value.getParts()) {
      result = result.or(Bits.raw(evaluate(part), part.width()).shiftLeft(offset));
      offset += part.width();
    }
    return result;
  }
  @Override
  public BigInteger visitReplicate(Replicate value) {
    int width = value.getValue().width();
    BigInteger part = Bits.raw(evaluate(value.getValue()), width);
    BigInteger result = BigInteger.ZERO;
    for (int i = 0; i < value.getCount(); ++i)
      result = result.or(part.shiftLeft(i * width));
    return result;
  }
  @Override
  public BigInteger visitSelect(Select value) {
    List<Value> choices = value.getChoices();
    BigInteger index = evaluate(value.getIndex());
    int i = index.compareTo(BigInteger.valueOf(choices.size() - 1)) > 0 ? choices.size() - 1 : index.intValueExact();
    return fit(evaluate(choices.get(i)), value.shape());
  }

  @Override
  public BigInteger visitSample(Sample value) {
    throw new IllegalStateException("Sample " + value + " was not lowered by elaboration");
  }
  @Override
  public BigInteger visitClockSignal(ClockSignal value) {
    throw new IllegalStateException("Clock reference " + value + " was not resolved by elaboration");
  }
  @Override
  public BigInteger visitResetSignal(ResetSignal value) {
    throw new IllegalStateException("Reset reference " + value + " was not resolved by elaboration");
  }
}
