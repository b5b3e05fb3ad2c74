package rtlcore.ir;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import rtlcore.hdl.Assign;
import rtlcore.hdl.ClockDomain;
import rtlcore.hdl.ClockSignal;
import rtlcore.hdl.CombinationalLoopException;
import rtlcore.hdl.Const;
import rtlcore.hdl.DomainConflictException;
import rtlcore.hdl.ElaborationException;
import rtlcore.hdl.Module;
import rtlcore.hdl.Ops;
import rtlcore.hdl.ResetDisciplineException;
import rtlcore.hdl.ResetSignal;
import rtlcore.hdl.Shape;
import rtlcore.hdl.Signal;
import rtlcore.hdl.Statement;
import rtlcore.ui.RTLCoreConfig;

class ElaboratorTest {

  private final Signal a = new Signal("a", Shape.unsigned(4));
  private final Signal b = new Signal("b", Shape.unsigned(4));
  private final Signal y = new Signal("y", Shape.unsigned(4));
  private final Signal r = new Signal("r", Shape.unsigned(4));

  private static Module counter(String name, Signal r) {
    Module m = new Module(name);
    m.sync(Assign.of(r, Ops.add(r, 1)));
    return m;
  }

  @Test
  void testMissingDomainCreated() throws Exception {
    Fragment fragment = new Elaborator().elaborate(counter("top", r), List.of(r));
    ClockDomain sync = fragment.getDomains().get(ClockDomain.SYNC);
    Assertions.assertNotNull(sync);
    Assertions.assertEquals(List.of(sync.getClk(), sync.getRst().get(), r), List.copyOf(fragment.getPorts().keySet()));
    Assertions.assertEquals(Fragment.Direction.IN, fragment.getPorts().get(sync.getClk()));
    Assertions.assertEquals(Fragment.Direction.OUT, fragment.getPorts().get(r));
    Assertions.assertEquals(1, fragment.getDiagnostics().size());
    Assertions.assertTrue(fragment.getDiagnostics().get(0).startsWith("Created missing domain 'sync'"));
    Assertions.assertEquals(ClockDomain.SYNC, fragment.getDriverDomain(r).get());
    Assertions.assertTrue(fragment.getDriverDomain(a).isEmpty());
  }

  @Test
  void testMissingDomainRejected() {
    RTLCoreConfig config = new RTLCoreConfig();
    config.create_missing_domains = false;
    DomainConflictException e =
        Assertions.assertThrows(DomainConflictException.class, () -> new Elaborator(config).elaborate(counter("top", r)));
    Assertions.assertEquals(ClockDomain.SYNC, e.getDomain().get());
  }

  @Test
  void testRename() throws Exception {
    Module top = new Module("top");
    ClockDomain fast = top.addDomain(new ClockDomain("fast"));
    top.addSubmodule("child", counter("child", r), Map.of(ClockDomain.SYNC, "fast"));
    Fragment fragment = new Elaborator().elaborate(top);

    Assertions.assertEquals(List.of("fast"), List.copyOf(fragment.getDomains().keySet()));
    Assertions.assertSame(fast, fragment.getDomains().get("fast"));
    Assertions.assertEquals(1, fragment.getStatements("fast").size());
    Assertions.assertEquals("fast", fragment.getDriverDomain(r).get());
    Assertions.assertTrue(fragment.getDiagnostics().isEmpty());
  }

  @Test
  void testDomainPropagatesUp() throws Exception {
    Module child = new Module("child");
    ClockDomain pix = child.addDomain(ClockDomain.builder("pix").asyncReset().build());
    child.domain("pix", Assign.of(r, Ops.add(r, 1)));
    Module top = new Module("top");
    top.addSubmodule("child", child, Map.of("pix", "video"));
    top.domain("video", Assign.of(y, a));
    Fragment fragment = new Elaborator().elaborate(top);

    Assertions.assertEquals(List.of("pix"), List.copyOf(fragment.getDomains().keySet()));
    Assertions.assertSame(pix, fragment.getDomains().get("pix"));
    Assertions.assertEquals("pix", fragment.getDriverDomain(y).get());
    Assertions.assertEquals("pix", fragment.getDriverDomain(r).get());
  }

  @Test
  void testLocalDomainsStayPrivate() throws Exception {
    Module top = new Module("top");
    for (String name : List.of("left", "right")) {
      Module child = new Module(name);
      child.addDomain(ClockDomain.builder("fast").local().build());
      child.domain("fast", Assign.of(new Signal(name + "_r", Shape.unsigned(2)), 1));
      top.addSubmodule(name, child);
    }
    Fragment fragment = new Elaborator().elaborate(top);
    Assertions.assertEquals(List.of("fast", "fast$1"), List.copyOf(fragment.getDomains().keySet()));
    Assertions.assertEquals("fast$1", fragment.getDomains().get("fast$1").getName());
    Assertions.assertEquals("fast$1", fragment.getDriverDomain(fragment.findSignal("right_r").get()).get());
  }

  @Test
  void testSiblingDomainConflict() {
    Module top = new Module("top");
    for (String name : List.of("left", "right")) {
      Module child = new Module(name);
      child.addDomain(new ClockDomain("fast"));
      top.addSubmodule(name, child);
    }
    DomainConflictException e = Assertions.assertThrows(DomainConflictException.class, () -> new Elaborator().elaborate(top));
    Assertions.assertTrue(e.getMessage().contains("top.left"), e.getMessage());
    Assertions.assertTrue(e.getMessage().contains("top.right"), e.getMessage());

    // Renaming one of them resolves the conflict.
    Module renamed = new Module("top");
    Module left = new Module("left");
    left.addDomain(new ClockDomain("fast"));
    Module right = new Module("right");
    right.addDomain(new ClockDomain("fast"));
    renamed.addSubmodule("left", left);
    renamed.addSubmodule("right", right, Map.of("fast", "fast2"));
    Assertions.assertDoesNotThrow(() -> new Elaborator().elaborate(renamed));
  }

  @Test
  void testParentChildDomainConflict() {
    Module top = new Module("top");
    top.addDomain(new ClockDomain("fast"));
    Module child = new Module("child");
    child.addDomain(new ClockDomain("fast"));
    top.addSubmodule("child", child);
    Assertions.assertThrows(DomainConflictException.class, () -> new Elaborator().elaborate(top));
  }

  @Test
  void testContradictoryReset() {
    Module top = new Module("top");
    top.addDomain(ClockDomain.builder("d").resetLess().asyncReset().build());
    Assertions.assertThrows(ResetDisciplineException.class, () -> new Elaborator().elaborate(top));
  }

  @Test
  void testResetOfResetLessDomain() throws Exception {
    Module top = new Module("top");
    top.addDomain(ClockDomain.builder("d").resetLess().build());
    top.domain("d", Assign.of(y, new ResetSignal("d")));
    Assertions.assertThrows(ResetDisciplineException.class, () -> new Elaborator().elaborate(top));

    Module allowed = new Module("top");
    allowed.addDomain(ClockDomain.builder("d").resetLess().build());
    allowed.domain("d", Assign.of(y, new ResetSignal("d", true)));
    Fragment fragment = new Elaborator().elaborate(allowed);
    Assign assign = (Assign)fragment.getStatements("d").get(0);
    Assertions.assertEquals(Const.of(0, Shape.unsigned(1)), assign.getSource());
  }

  @Test
  void testClockReference() throws Exception {
    Module top = new Module("top");
    top.comb(Assign.of(y, new ClockSignal(ClockDomain.SYNC)));
    Fragment fragment = new Elaborator().elaborate(top);
    ClockDomain sync = fragment.getDomains().get(ClockDomain.SYNC);
    Assign assign = (Assign)fragment.getStatements(ClockDomain.COMB).get(0);
    Assertions.assertSame(sync.getClk(), assign.getSource());
    Assertions.assertEquals(Fragment.Direction.IN, fragment.getPorts().get(sync.getClk()));
  }

  @Test
  void testSampleLowering() throws Exception {
    Module top = new Module("top");
    top.comb(Assign.of(y, Ops.xor(Ops.past(a, ClockDomain.SYNC, 2), Ops.past(a, ClockDomain.SYNC, 1))));
    Fragment fragment = new Elaborator().elaborate(top);

    List<Statement> registers = fragment.getStatements(ClockDomain.SYNC);
    Assertions.assertEquals(2, registers.size());
    Signal first = fragment.findSignal("$sample$a$1").get();
    Signal second = fragment.findSignal("$sample$a$2").get();
    Assertions.assertTrue(first.isResetLess());
    Assertions.assertEquals(List.of(Assign.of(first, a), Assign.of(second, first)), registers);
    Assertions.assertEquals(Ops.xor(second, first), ((Assign)fragment.getStatements(ClockDomain.COMB).get(0)).getSource());
  }

  @Test
  void testPortOrder() throws Exception {
    Signal unused = new Signal("unused", Shape.unsigned(1));
    Module top = new Module("top");
    top.comb(Assign.of(y, Ops.add(a, b)));
    top.sync(Assign.of(r, y));
    Fragment fragment = new Elaborator().elaborate(top, List.of(y, r, unused));
    ClockDomain sync = fragment.getDomains().get(ClockDomain.SYNC);

    Assertions.assertEquals(List.of(sync.getClk(), sync.getRst().get(), a, b, unused, y, r), List.copyOf(fragment.getPorts().keySet()));
    Assertions.assertEquals(Fragment.Direction.IN, fragment.getPorts().get(unused));
    Assertions.assertEquals(Fragment.Direction.OUT, fragment.getPorts().get(y));
    Assertions.assertTrue(fragment.getSignals().contains(unused));
  }

  @Test
  void testModuleInstantiatedTwice() {
    Module shared = counter("shared", r);
    Module top = new Module("top");
    top.addSubmodule("first", shared);
    top.addSubmodule("second", shared);
    ElaborationException e = Assertions.assertThrows(ElaborationException.class, () -> new Elaborator().elaborate(top));
    Assertions.assertTrue(e.getMessage().contains("top.second"), e.getMessage());
  }

  @Test
  void testElaboratableIndirection() throws Exception {
    Module inner = counter("inner", r);
    Module top = new Module("top");
    top.addSubmodule("wrapped", () -> inner);
    Fragment fragment = new Elaborator().elaborate(() -> top);
    Assertions.assertEquals(ClockDomain.SYNC, fragment.getDriverDomain(r).get());
  }

  @Test
  void testCombLoop() {
    Module top = new Module("top");
    top.comb(Assign.of(a, b));
    top.comb(Assign.of(b, a));
    Assertions.assertThrows(CombinationalLoopException.class, () -> new Elaborator().elaborate(top));
  }

  @Test
  void testLoopThroughRegister() throws Exception {
    Module top = new Module("top");
    top.comb(Assign.of(y, Ops.add(r, 1)));
    top.sync(Assign.of(r, y));
    Fragment fragment = new Elaborator().elaborate(top);
    Assertions.assertEquals(1, fragment.getCombUnits().size());
  }
}
