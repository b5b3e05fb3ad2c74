package rtlcore.hdl;

import java.util.ArrayList;
import java.util.List;
import rtlcore.hdl.Operator.Kind;

/**
 * Factory functions for operator expressions. Every argument goes through {@link Value#cast(Object)},
 * so Java integers and {@link ValueCastable} objects are accepted wherever a value is.
 */
public final class Ops {
  private Ops() {}

  private static Operator unary(Kind kind, Object a) { return new Operator(kind, Value.cast(a)); }
  private static Operator binary(Kind kind, Object a, Object b) { return new Operator(kind, Value.cast(a), Value.cast(b)); }

  public static Operator not(Object a) { return unary(Kind.NOT, a); }
  public static Operator neg(Object a) { return unary(Kind.NEG, a); }
  /** One if any bit is set. */
  public static Operator bool(Object a) { return unary(Kind.BOOL, a); }
  public static Operator any(Object a) { return unary(Kind.ANY, a); }
  public static Operator all(Object a) { return unary(Kind.ALL, a); }
  public static Operator xorReduce(Object a) { return unary(Kind.XOR_REDUCE, a); }
  public static Operator asUnsigned(Object a) { return unary(Kind.AS_UNSIGNED, a); }
  public static Operator asSigned(Object a) { return unary(Kind.AS_SIGNED, a); }

  public static Operator add(Object a, Object b) { return binary(Kind.ADD, a, b); }
  public static Operator sub(Object a, Object b) { return binary(Kind.SUB, a, b); }
  public static Operator mul(Object a, Object b) { return binary(Kind.MUL, a, b); }
  /** Floor division; division by zero yields zero. */
  public static Operator floorDiv(Object a, Object b) { return binary(Kind.FLOORDIV, a, b); }
  /** Floor modulo, sign follows the divisor; modulo by zero yields zero. */
  public static Operator mod(Object a, Object b) { return binary(Kind.MOD, a, b); }
  public static Operator and(Object a, Object b) { return binary(Kind.AND, a, b); }
  public static Operator or(Object a, Object b) { return binary(Kind.OR, a, b); }
  public static Operator xor(Object a, Object b) { return binary(Kind.XOR, a, b); }
  public static Operator eq(Object a, Object b) { return binary(Kind.EQ, a, b); }
  public static Operator ne(Object a, Object b) { return binary(Kind.NE, a, b); }
  public static Operator lt(Object a, Object b) { return binary(Kind.LT, a, b); }
  public static Operator le(Object a, Object b) { return binary(Kind.LE, a, b); }
  public static Operator gt(Object a, Object b) { return binary(Kind.GT, a, b); }
  public static Operator ge(Object a, Object b) { return binary(Kind.GE, a, b); }
  /** Left shift by a variable (unsigned) amount. */
  public static Operator shl(Object a, Object amount) { return binary(Kind.SHL, a, amount); }
  /** Right shift by a variable (unsigned) amount; arithmetic if a is signed. */
  public static Operator shr(Object a, Object amount) { return binary(Kind.SHR, a, amount); }

  /** Chooses a if sel is non-zero, else b. */
  public static Operator mux(Object sel, Object a, Object b) {
    Value selValue = Value.cast(sel);
    if (selValue.width() != 1)
      selValue = bool(selValue);
    return new Operator(Kind.MUX, selValue, Value.cast(a), Value.cast(b));
  }

  /** Left shift by a constant amount; grows the value by the amount. */
  public static Value shiftLeft(Object a, int amount) {
    if (amount < 0)
      return shiftRight(a, -amount);
    Value value = Value.cast(a);
    Value shifted = Cat.of(Const.of(0, Shape.unsigned(amount)), value);
    return value.isSigned() ? asSigned(shifted) : shifted;
  }

  /** Right shift by a constant amount; keeps the sign bit of signed values. */
  public static Value shiftRight(Object a, int amount) {
    if (amount < 0)
      return shiftLeft(a, -amount);
    Value value = Value.cast(a);
    int width = value.width();
    if (value.isSigned())
      return asSigned(Slice.of(value, Math.min(amount, width - 1), width));
    return Slice.of(value, Math.min(amount, width), width);
  }

  /**
   * Explicit width cast: the two's-complement reduction of the value to the given shape.
   * Widening sign-extends signed values and zero-extends unsigned ones.
   */
  public static Value truncate(Object a, Shape shape) {
    Value value = Value.cast(a);
    int width = shape.getWidth();
    Value bits;
    if (width <= value.width())
      bits = Slice.of(value, 0, width);
    else if (value.isSigned())
      bits = Cat.of(value, Replicate.of(Slice.bit(value, value.width() - 1), width - value.width()));
    else
      bits = Cat.of(value, Const.of(0, Shape.unsigned(width - value.width())));
    return shape.isSigned() ? asSigned(bits) : bits;
  }

  /** Value of an expression the given number of edges ago. */
  public static Sample past(Object value, String domain, int clocks) { return Sample.of(value, domain, clocks); }
  /** One while the lowest bit went from zero to one at the last edge of the domain. */
  public static Value rose(Object value, String domain) {
    Value v = Value.cast(value);
    return and(not(Slice.bit(past(v, domain, 1), 0)), Slice.bit(v, 0));
  }
  public static Value fell(Object value, String domain) {
    Value v = Value.cast(value);
    return and(Slice.bit(past(v, domain, 1), 0), not(Slice.bit(v, 0)));
  }
  public static Value stable(Object value, String domain) {
    Value v = Value.cast(value);
    return eq(past(v, domain, 1), v);
  }

  /** Bitwise reduction of several one-bit conditions. */
  public static Value allOf(Object... conditions) {
    List<Value> bits = new ArrayList<>();
    for (Object condition : conditions)
      bits.add(bool(condition));
    return all(new Cat(bits));
  }
  public static Value anyOf(Object... conditions) {
    List<Value> bits = new ArrayList<>();
    for (Object condition : conditions)
      bits.add(bool(condition));
    return any(new Cat(bits));
  }
}
