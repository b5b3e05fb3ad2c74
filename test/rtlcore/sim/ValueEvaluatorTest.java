package rtlcore.sim;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import rtlcore.hdl.Cat;
import rtlcore.hdl.Const;
import rtlcore.hdl.Ops;
import rtlcore.hdl.Part;
import rtlcore.hdl.Replicate;
import rtlcore.hdl.Select;
import rtlcore.hdl.Shape;
import rtlcore.hdl.Signal;
import rtlcore.hdl.Slice;
import rtlcore.hdl.Value;

class ValueEvaluatorTest {

  private final Map<Signal, BigInteger> values = new HashMap<>();
  private final ValueEvaluator evaluator = new ValueEvaluator(values::get);

  private long eval(Value value) { return evaluator.evaluate(value).longValueExact(); }
  private static Const u(long value, int width) { return Const.of(value, Shape.unsigned(width)); }
  private static Const s(long value, int width) { return Const.of(value, Shape.signed(width)); }

  @Test
  void testArithmetic() {
    Assertions.assertEquals(16, eval(Ops.add(u(15, 4), u(1, 4))));
    // unsigned subtraction wraps within the result shape
    Assertions.assertEquals(30, eval(Ops.sub(u(3, 4), u(5, 4))));
    Assertions.assertEquals(-2, eval(Ops.sub(u(3, 4), s(5, 4))));
    Assertions.assertEquals(-5, eval(Ops.neg(u(5, 4))));
    Assertions.assertEquals(10, eval(Ops.not(u(5, 4))));
    Assertions.assertEquals(-6, eval(Ops.not(s(5, 4))));
    Assertions.assertEquals(225, eval(Ops.mul(u(15, 4), u(15, 4))));
  }

  @Test
  void testFloorDivision() {
    Assertions.assertEquals(-4, eval(Ops.floorDiv(s(-7, 4), u(2, 2))));
    Assertions.assertEquals(1, eval(Ops.mod(s(-7, 4), u(2, 2))));
    Assertions.assertEquals(-1, eval(Ops.mod(s(7, 4), s(-2, 2))));
    Assertions.assertEquals(8, eval(Ops.floorDiv(s(-8, 4), s(-1, 1))));
    Assertions.assertEquals(0, eval(Ops.floorDiv(u(9, 4), u(0, 2))));
    Assertions.assertEquals(0, eval(Ops.mod(u(9, 4), u(0, 2))));
  }

  @Test
  void testShifts() {
    Assertions.assertEquals(12, eval(Ops.shl(u(3, 2), u(2, 2))));
    Assertions.assertEquals(-4, eval(Ops.shr(s(-8, 4), u(1, 2))));
    Assertions.assertEquals(-1, eval(Ops.shr(s(-8, 4), u(5, 3))));
    Assertions.assertEquals(0, eval(Ops.shr(u(8, 4), u(5, 3))));
    Assertions.assertEquals(-16, eval(Ops.shiftLeft(s(-2, 4), 3)));
    Assertions.assertEquals(-1, eval(Ops.shiftRight(s(-2, 4), 3)));
    Assertions.assertEquals(1, eval(Ops.shiftRight(u(14, 4), 3)));
  }

  @Test
  void testReductionsAndComparisons() {
    Assertions.assertEquals(1, eval(Ops.all(u(15, 4))));
    Assertions.assertEquals(0, eval(Ops.all(u(7, 4))));
    Assertions.assertEquals(1, eval(Ops.any(u(4, 4))));
    Assertions.assertEquals(1, eval(Ops.xorReduce(u(7, 4))));
    Assertions.assertEquals(1, eval(Ops.lt(s(-1, 4), u(0, 4))));
    Assertions.assertEquals(0, eval(Ops.eq(s(-1, 4), u(15, 4))));
  }

  @Test
  void testBitSelection() {
    Signal word = new Signal("word", Shape.unsigned(8));
    Signal index = new Signal("index", Shape.unsigned(4));
    values.put(word, BigInteger.valueOf(0xA5));
    values.put(index, BigInteger.ONE);
    Assertions.assertEquals(0x5, eval(Slice.of(word, 0, 4)));
    Assertions.assertEquals(0x2, eval(Part.of(word, index, 4)));
    Assertions.assertEquals(0xA, eval(Part.word(word, index, 4)));
    values.put(index, BigInteger.valueOf(9));
    Assertions.assertEquals(0, eval(Part.of(word, index, 4)));
    Assertions.assertEquals(0x5A5, eval(Cat.of(word, u(5, 4))));
    Assertions.assertEquals(0b101010, eval(Replicate.of(u(2, 2), 3)));
    Assertions.assertEquals(-1, eval(Ops.truncate(s(-1, 2), Shape.signed(8))));
    Assertions.assertEquals(0xFF, eval(Ops.truncate(s(-1, 2), Shape.unsigned(8))));
  }

  @Test
  void testSelect() {
    Signal index = new Signal("index", Shape.unsigned(3));
    Value select = Select.of(index, u(1, 2), u(2, 2), s(-1, 2));
    values.put(index, BigInteger.ONE);
    Assertions.assertEquals(2, eval(select));
    values.put(index, BigInteger.valueOf(2));
    Assertions.assertEquals(-1, eval(select));
    // past the last choice
    values.put(index, BigInteger.valueOf(7));
    Assertions.assertEquals(-1, eval(select));
    Assertions.assertEquals(2, eval(Ops.mux(u(0, 3), u(1, 2), u(2, 2))));
  }

  @RepeatedTest(64)
  void testExactOperators_random() {
    long seed = new Random().nextLong();
    try {
      testExactOperators(seed);
    } catch (Throwable t) {
      System.err.println("FAILED testExactOperators with seed " + seed);
      throw t;
    }
  }

  /** Operators whose result shape is wide enough to hold the exact mathematical result. */
  @ParameterizedTest
  @ValueSource(longs = {1, 42, 8080, -2652373455512344419L})
  void testExactOperators(long seed) {
    var rand = new Random(seed);
    for (int i = 0; i < 256; ++i) {
      Const a = randomConst(rand);
      Const b = randomConst(rand);
      long x = a.getValue().longValueExact();
      long y = b.getValue().longValueExact();
      Assertions.assertEquals(x + y, eval(Ops.add(a, b)), () -> a + " + " + b);
      Assertions.assertEquals(x * y, eval(Ops.mul(a, b)), () -> a + " * " + b);
      Assertions.assertEquals(x < y ? 1 : 0, eval(Ops.lt(a, b)), () -> a + " < " + b);
      if (a.isSigned() && b.isSigned())
        Assertions.assertEquals(x - y, eval(Ops.sub(a, b)), () -> a + " - " + b);
      if (y != 0) {
        Assertions.assertEquals(Math.floorDiv(x, y), eval(Ops.floorDiv(a, b)), () -> a + " // " + b);
        Assertions.assertEquals(Math.floorMod(x, y), eval(Ops.mod(a, b)), () -> a + " % " + b);
      }
    }
  }

  private static Const randomConst(Random rand) {
    int width = 1 + rand.nextInt(16);
    boolean signed = rand.nextBoolean();
    long value = signed ? rand.nextInt(1 << width) - (1 << (width - 1)) : rand.nextInt(1 << width);
    return Const.of(value, Shape.of(width, signed));
  }
}
