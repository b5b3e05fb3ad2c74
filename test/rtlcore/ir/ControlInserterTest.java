package rtlcore.ir;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import rtlcore.hdl.Assign;
import rtlcore.hdl.ClockDomain;
import rtlcore.hdl.Const;
import rtlcore.hdl.Module;
import rtlcore.hdl.Ops;
import rtlcore.hdl.Property;
import rtlcore.hdl.Shape;
import rtlcore.hdl.Signal;
import rtlcore.hdl.Statement;
import rtlcore.hdl.Switch;
import rtlcore.sim.PropertyViolationException;
import rtlcore.sim.Simulator;

class ControlInserterTest {

  private final Signal count = new Signal("count", Shape.unsigned(4));
  private final Signal ctrl = new Signal("ctrl", Shape.unsigned(1));

  private Module counter() {
    Module m = new Module("counter");
    m.sync(Assign.of(count, Ops.add(count, 1)));
    return m;
  }

  @Test
  void testResetStatementAppended() {
    Signal keep = Signal.builder("keep", Shape.unsigned(4)).reset(3).resetLess().build();
    Module m = counter();
    m.sync(Assign.of(keep, count));
    List<Statement> sync = new ResetInserter(m, ClockDomain.SYNC, ctrl).elaborate().lower(ClockDomain.SYNC);

    Assertions.assertEquals(3, sync.size());
    Switch reset = (Switch)sync.get(2);
    Assertions.assertEquals(ctrl, reset.getTest());
    Assertions.assertEquals(List.of("1"), reset.getCases().get(0).getPatterns());
    Assertions.assertEquals(List.of(Assign.of(count, Const.of(0, Shape.unsigned(4)))), reset.getCases().get(0).getBody());
  }

  @Test
  void testResetInserterSimulation() throws Exception {
    Fragment fragment = new Elaborator().elaborate(new ResetInserter(counter(), ClockDomain.SYNC, ctrl), List.of(ctrl, count));
    try (Simulator sim = new Simulator(fragment)) {
      sim.addClock(ClockDomain.SYNC);
      sim.runUntil(5);
      Assertions.assertEquals(3, sim.getLong(count));
      sim.set(ctrl, 1);
      sim.runUntil(7);
      Assertions.assertEquals(0, sim.getLong(count));
      sim.set(ctrl, 0);
      sim.runUntil(9);
      Assertions.assertEquals(1, sim.getLong(count));
    }
  }

  @Test
  void testEnableHoldsAndGuardsProperties() throws Exception {
    Module m = counter();
    m.sync(Property.assertThat(Ops.eq(count, 9), "nine"));
    Fragment fragment = new Elaborator().elaborate(new EnableInserter(m, ClockDomain.SYNC, ctrl), List.of(ctrl, count));
    try (Simulator sim = new Simulator(fragment)) {
      sim.addClock(ClockDomain.SYNC);
      sim.runUntil(5);
      Assertions.assertEquals(0, sim.getLong(count));
      sim.set(ctrl, 1);
      PropertyViolationException e = Assertions.assertThrows(PropertyViolationException.class, () -> sim.runUntil(9));
      Assertions.assertEquals(7, e.getTimestamp());
      Assertions.assertEquals(1, sim.getLong(count));
    }
  }

  @Test
  void testControlFollowsRenames() throws Exception {
    Module top = new Module("top");
    top.addDomain(new ClockDomain("fast"));
    top.addSubmodule("c", counter(), Map.of(ClockDomain.SYNC, "fast"));
    Fragment fragment = new Elaborator().elaborate(new ResetInserter(top, "fast", ctrl), List.of(ctrl, count));
    try (Simulator sim = new Simulator(fragment)) {
      sim.addClock("fast");
      sim.runUntil(3);
      Assertions.assertEquals(2, sim.getLong(count));
      sim.set(ctrl, 1);
      sim.runUntil(5);
      Assertions.assertEquals(0, sim.getLong(count));
    }
  }

  @Test
  void testUncontrolledDomainUnchanged() {
    Module m = counter();
    List<Statement> before = m.lower(ClockDomain.SYNC);
    Assertions.assertEquals(before, new EnableInserter(m, "other", ctrl).elaborate().lower(ClockDomain.SYNC));
  }

  @Test
  void testCombControlRejected() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new ResetInserter(counter(), ClockDomain.COMB, ctrl));
  }
}
