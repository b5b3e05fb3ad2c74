package rtlcore.hdl;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SwitchTest {

  private final Signal test = new Signal("test", Shape.unsigned(4));
  private final Signal out = new Signal("out", Shape.unsigned(4));

  private static Map.Entry<List<?>, List<Statement>> entry(List<?> patterns, Statement... body) {
    return Map.entry(patterns, List.of(body));
  }

  @Test
  void testPatternNormalization() {
    Assertions.assertEquals("0101", Switch.normalizePattern(5, test.shape()));
    Assertions.assertEquals("1-0-", Switch.normalizePattern("1- 0-", test.shape()));
    Assertions.assertEquals("1111", Switch.normalizePattern(-1, Shape.signed(4)));
    Assertions.assertThrows(ShapeException.class, () -> Switch.normalizePattern("101", test.shape()));
    Assertions.assertThrows(ShapeException.class, () -> Switch.normalizePattern("10x1", test.shape()));
    Assertions.assertThrows(ShapeException.class, () -> Switch.normalizePattern(16, test.shape()));
    Assertions.assertThrows(ShapeException.class, () -> Switch.normalizePattern(-1, test.shape()));
  }

  @Test
  void testCaseMatching() {
    Switch sw = new Switch(test, List.of(entry(List.of("1---"), Assign.of(out, 1)),
                                         entry(List.of(1, 2), Assign.of(out, 2)),
                                         entry(List.of(), Assign.of(out, 3))));
    List<Switch.Case> cases = sw.getCases();
    Assertions.assertEquals(3, cases.size());
    Assertions.assertTrue(cases.get(0).matches(BigInteger.valueOf(0b1010)));
    Assertions.assertFalse(cases.get(0).matches(BigInteger.valueOf(0b0010)));
    Assertions.assertTrue(cases.get(1).matches(BigInteger.valueOf(2)));
    Assertions.assertFalse(cases.get(1).matches(BigInteger.valueOf(3)));
    Assertions.assertTrue(cases.get(2).isDefault());
    Assertions.assertTrue(cases.get(2).matches(BigInteger.valueOf(7)));
  }

  @Test
  void testReadAndWrittenSignals() {
    Signal a = new Signal("a", Shape.unsigned(4));
    Switch sw = new Switch(test, List.of(entry(List.of(0), Assign.of(out, a))));
    Assertions.assertEquals(List.of(test, a), List.copyOf(sw.readSignals()));
    Assertions.assertEquals(List.of(out), List.copyOf(sw.writtenSignals()));
  }
}
