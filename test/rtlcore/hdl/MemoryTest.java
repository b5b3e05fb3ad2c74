package rtlcore.hdl;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import rtlcore.ir.Elaborator;
import rtlcore.ir.Fragment;
import rtlcore.sim.Simulator;

class MemoryTest {

  private static Simulator simulate(Memory mem, Signal... ports) throws ElaborationException {
    Module top = new Module("top");
    top.addSubmodule("mem", mem);
    Fragment fragment = new Elaborator().elaborate(top, List.of(ports));
    Simulator sim = new Simulator(fragment);
    sim.addClock(ClockDomain.SYNC);
    return sim;
  }

  @Test
  void testSyncReadSeesOldData() throws Exception {
    Memory mem = new Memory("mem", Shape.unsigned(4), 4, List.of(1, 2, 3, 4));
    Memory.ReadPort rd = mem.readPort(ClockDomain.SYNC, false);
    Memory.WritePort wr = mem.writePort(ClockDomain.SYNC);
    try (Simulator sim = simulate(mem, rd.getData())) {
      sim.set(rd.getAddr(), 2);
      sim.set(wr.getAddr(), 2);
      sim.set(wr.getData(), 7);
      sim.set(wr.getEn(), 1);
      sim.runUntil(1);
      Assertions.assertEquals(3, sim.getLong(rd.getData()));
      Assertions.assertEquals(7, sim.getLong(mem.getRow(2)));
      sim.set(wr.getEn(), 0);
      sim.runUntil(3);
      Assertions.assertEquals(7, sim.getLong(rd.getData()));

      // a disabled read port keeps its data
      sim.set(rd.getEn(), 0);
      sim.set(rd.getAddr(), 0);
      sim.runUntil(5);
      Assertions.assertEquals(7, sim.getLong(rd.getData()));
    }
  }

  @Test
  void testTransparentRead() throws Exception {
    Memory mem = new Memory("mem", Shape.unsigned(4), 4, List.of(1, 2, 3, 4));
    Memory.ReadPort rd = mem.readPort(ClockDomain.SYNC, true);
    Memory.WritePort wr = mem.writePort(ClockDomain.SYNC);
    try (Simulator sim = simulate(mem, rd.getData())) {
      Assertions.assertEquals(1, sim.getLong(rd.getData()));
      sim.set(rd.getAddr(), 2);
      sim.set(wr.getAddr(), 2);
      sim.set(wr.getData(), 7);
      sim.set(wr.getEn(), 1);
      sim.runUntil(1);
      Assertions.assertEquals(7, sim.getLong(rd.getData()));
    }
  }

  @Test
  void testCombReadAndLastWritePortWins() throws Exception {
    Memory mem = new Memory("mem", Shape.signed(8), 3);
    Memory.ReadPort rd = mem.readPort();
    Memory.WritePort first = mem.writePort(ClockDomain.SYNC);
    Memory.WritePort second = mem.writePort(ClockDomain.SYNC);
    Assertions.assertThrows(IllegalStateException.class, rd::getEn);
    try (Simulator sim = simulate(mem, rd.getData())) {
      sim.set(rd.getAddr(), 1);
      sim.set(first.getAddr(), 1);
      sim.set(first.getData(), -5);
      sim.set(first.getEn(), 1);
      sim.runUntil(1);
      Assertions.assertEquals(-5, sim.getLong(rd.getData()));

      sim.set(second.getAddr(), 1);
      sim.set(second.getData(), 100);
      sim.set(second.getEn(), 1);
      sim.runUntil(3);
      Assertions.assertEquals(100, sim.getLong(rd.getData()));

      // address 3 is past the last row: the write is dropped, the read returns the last row
      sim.set(first.getEn(), 0);
      sim.set(second.getAddr(), 3);
      sim.set(rd.getAddr(), 3);
      sim.runUntil(5);
      Assertions.assertEquals(0, sim.getLong(rd.getData()));
      Assertions.assertEquals(0, sim.getLong(mem.getRow(2)));
    }
  }

  @Test
  void testWriteGranularity() throws Exception {
    Memory mem = new Memory("mem", Shape.unsigned(8), 2, List.of(0x12, 0x34));
    Memory.ReadPort rd = mem.readPort();
    Memory.WritePort wr = mem.writePort(ClockDomain.SYNC, 4);
    Assertions.assertEquals(2, wr.getEn().width());
    try (Simulator sim = simulate(mem, rd.getData())) {
      sim.set(rd.getAddr(), 1);
      sim.set(wr.getAddr(), 1);
      sim.set(wr.getData(), 0xAB);
      sim.set(wr.getEn(), 0b10);
      sim.runUntil(1);
      Assertions.assertEquals(0xA4, sim.getLong(rd.getData()));
    }
  }

  @Test
  void testMemoryIgnoresDomainReset() throws Exception {
    Memory mem = new Memory("mem", Shape.unsigned(4), 2);
    Memory.ReadPort rd = mem.readPort();
    Memory.WritePort wr = mem.writePort(ClockDomain.SYNC);
    Module top = new Module("top");
    ClockDomain sync = top.addDomain(new ClockDomain(ClockDomain.SYNC));
    top.addSubmodule("mem", mem);
    try (Simulator sim = new Simulator(new Elaborator().elaborate(top, List.of(rd.getData())))) {
      sim.addClock(ClockDomain.SYNC);
      sim.set(wr.getData(), 9);
      sim.set(wr.getEn(), 1);
      sim.runUntil(1);
      sim.set(wr.getEn(), 0);
      sim.set(sync.getRst().get(), 1);
      sim.runUntil(3);
      Assertions.assertEquals(9, sim.getLong(rd.getData()));
    }
  }

  @Test
  void testReadOnlyMemoryUsesConstants() {
    Memory rom = new Memory("rom", Shape.unsigned(4), 2, List.of(5, 6));
    Memory.ReadPort rd = rom.readPort();
    List<Statement> comb = rom.elaborate().lower(ClockDomain.COMB);
    Assertions.assertEquals(List.of(Assign.of(rd.getData(), Select.of(rd.getAddr(), Const.of(5, Shape.unsigned(4)), Const.of(6, Shape.unsigned(4))))),
                            comb);
  }

  @Test
  void testMemoryErrors() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new Memory("m", Shape.unsigned(4), 0));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new Memory("m", Shape.unsigned(4), 1, List.of(1, 2)));
    Assertions.assertThrows(ShapeException.class, () -> new Memory("m", Shape.unsigned(4), 2, List.of(16)));
    Memory mem = new Memory("m", Shape.unsigned(8), 2);
    Assertions.assertThrows(IllegalArgumentException.class, () -> mem.writePort(ClockDomain.COMB));
    Assertions.assertThrows(IllegalArgumentException.class, () -> mem.writePort(ClockDomain.SYNC, 3));
  }
}
