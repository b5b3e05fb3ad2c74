package rtlcore.hdl;

import java.util.function.BinaryOperator;
import java.util.stream.Stream;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class ShapeTest {

  @Test
  void testUnify() {
    Assertions.assertEquals(Shape.unsigned(8), Shape.unify(Shape.unsigned(4), Shape.unsigned(8)));
    Assertions.assertEquals(Shape.signed(5), Shape.unify(Shape.unsigned(4), Shape.signed(4)));
    Assertions.assertEquals(Shape.signed(8), Shape.unify(Shape.unsigned(4), Shape.signed(8)));
    Assertions.assertEquals(Shape.signed(9), Shape.unify(Shape.unsigned(8), Shape.signed(4)));
    Assertions.assertEquals(Shape.unsigned(0), Shape.unify());
  }

  @Test
  void testInvalidShapes() {
    Assertions.assertThrows(ShapeException.class, () -> Shape.unsigned(-1));
    Assertions.assertThrows(ShapeException.class, () -> Shape.signed(0));
    Assertions.assertEquals(0, Shape.unsigned(0).getWidth());
  }

  static Stream<Arguments> binaryShapes() {
    Shape u4 = Shape.unsigned(4);
    Shape s4 = Shape.signed(4);
    Shape u8 = Shape.unsigned(8);
    return Stream.of(Arguments.of("add", (BinaryOperator<Value>)Ops::add, u4, s4, Shape.signed(6)),
                     Arguments.of("add", (BinaryOperator<Value>)Ops::add, u4, u8, Shape.unsigned(9)),
                     Arguments.of("sub", (BinaryOperator<Value>)Ops::sub, u4, u4, Shape.unsigned(5)),
                     Arguments.of("sub", (BinaryOperator<Value>)Ops::sub, s4, u4, Shape.signed(6)),
                     Arguments.of("mul", (BinaryOperator<Value>)Ops::mul, u4, s4, Shape.signed(8)),
                     Arguments.of("mul", (BinaryOperator<Value>)Ops::mul, u4, u8, Shape.unsigned(12)),
                     Arguments.of("and", (BinaryOperator<Value>)Ops::and, u4, s4, Shape.signed(5)),
                     Arguments.of("or", (BinaryOperator<Value>)Ops::or, u4, u8, Shape.unsigned(8)),
                     Arguments.of("xor", (BinaryOperator<Value>)Ops::xor, s4, Shape.signed(6), Shape.signed(6)),
                     Arguments.of("lt", (BinaryOperator<Value>)Ops::lt, u8, s4, Shape.unsigned(1)),
                     Arguments.of("eq", (BinaryOperator<Value>)Ops::eq, u4, u4, Shape.unsigned(1)),
                     Arguments.of("floordiv", (BinaryOperator<Value>)Ops::floorDiv, u8, s4, Shape.signed(9)),
                     Arguments.of("mod", (BinaryOperator<Value>)Ops::mod, u8, s4, s4),
                     Arguments.of("shl", (BinaryOperator<Value>)Ops::shl, u4, Shape.unsigned(2), Shape.unsigned(7)),
                     Arguments.of("shr", (BinaryOperator<Value>)Ops::shr, s4, Shape.unsigned(3), s4));
  }

  @ParameterizedTest(name = "{0}({2}, {3}) = {4}")
  @MethodSource("binaryShapes")
  void testBinaryShape(String name, BinaryOperator<Value> op, Shape a, Shape b, Shape expected) {
    Value result = op.apply(new Signal("a", a), new Signal("b", b));
    Assertions.assertEquals(expected, result.shape());
  }

  @Test
  void testUnaryShapes() {
    Signal u4 = new Signal("u4", Shape.unsigned(4));
    Signal s4 = new Signal("s4", Shape.signed(4));
    Assertions.assertEquals(Shape.unsigned(4), Ops.not(u4).shape());
    Assertions.assertEquals(Shape.signed(5), Ops.neg(u4).shape());
    Assertions.assertEquals(Shape.signed(5), Ops.neg(s4).shape());
    Assertions.assertEquals(Shape.unsigned(1), Ops.bool(s4).shape());
    Assertions.assertEquals(Shape.unsigned(1), Ops.xorReduce(u4).shape());
    Assertions.assertEquals(Shape.signed(4), Ops.asSigned(u4).shape());
    Assertions.assertEquals(Shape.unsigned(4), Ops.asUnsigned(s4).shape());
    Assertions.assertEquals(Shape.signed(5), Ops.mux(u4, u4, s4).shape());
  }

  @Test
  void testConstantShifts() {
    Signal u4 = new Signal("u4", Shape.unsigned(4));
    Signal s4 = new Signal("s4", Shape.signed(4));
    Assertions.assertEquals(Shape.unsigned(6), Ops.shiftLeft(u4, 2).shape());
    Assertions.assertEquals(Shape.signed(6), Ops.shiftLeft(s4, 2).shape());
    Assertions.assertEquals(Shape.unsigned(1), Ops.shiftRight(u4, 3).shape());
    Assertions.assertEquals(Shape.unsigned(0), Ops.shiftRight(u4, 6).shape());
    Assertions.assertEquals(Shape.signed(1), Ops.shiftRight(s4, 6).shape());
  }

  @Test
  void testCompositeShapes() {
    Signal u4 = new Signal("u4", Shape.unsigned(4));
    Signal s3 = new Signal("s3", Shape.signed(3));
    Assertions.assertEquals(Shape.unsigned(7), Cat.of(u4, s3).shape());
    Assertions.assertEquals(Shape.unsigned(0), Cat.of().shape());
    Assertions.assertEquals(Shape.unsigned(12), Replicate.of(u4, 3).shape());
    Assertions.assertEquals(Shape.unsigned(2), Slice.of(s3, 1, 3).shape());
    Assertions.assertEquals(Shape.unsigned(2), Part.of(u4, new Signal("o", Shape.unsigned(2)), 2).shape());
    Assertions.assertEquals(Shape.signed(5), Select.of(new Signal("i", Shape.unsigned(1)), u4, s3).shape());
    Assertions.assertEquals(Shape.signed(3), Sample.of(s3, "sync", 1).shape());
  }

  @Test
  void testShapeErrors() {
    Signal u4 = new Signal("u4", Shape.unsigned(4));
    Signal s2 = new Signal("s2", Shape.signed(2));
    Assertions.assertThrows(ShapeException.class, () -> Ops.shl(u4, s2));
    Assertions.assertThrows(ShapeException.class, () -> Ops.shr(u4, s2));
    Assertions.assertThrows(ShapeException.class, () -> Ops.shl(u4, new Signal("wide", Shape.unsigned(32))));
    Assertions.assertThrows(ShapeException.class, () -> Select.of(new Signal("i", Shape.unsigned(1)), 1, 2, 3));
    Assertions.assertThrows(ShapeException.class, () -> Select.of(u4));
    Assertions.assertThrows(ShapeException.class, () -> Part.of(u4, s2, 1));
    Assertions.assertThrows(ShapeException.class, () -> Slice.of(u4, 2, 5));
    Assertions.assertThrows(ShapeException.class, () -> Slice.of(u4, 3, 2));
    Assertions.assertThrows(ShapeException.class, () -> Replicate.of(u4, -1));
    Assertions.assertThrows(ShapeException.class, () -> Replicate.of(u4, Integer.MAX_VALUE / 2));
    Assertions.assertEquals(Integer.MAX_VALUE - 1, Replicate.of(new Signal("u2", Shape.unsigned(2)), Integer.MAX_VALUE / 2).width());
    Assertions.assertThrows(ShapeException.class, () -> Const.of(16, Shape.unsigned(4)));
    Assertions.assertThrows(ShapeException.class, () -> Const.of(8, Shape.signed(4)));
  }
}
