package rtlcore.ui.demo;

import rtlcore.hdl.Assign;
import rtlcore.hdl.ClockDomain;
import rtlcore.hdl.Elaboratable;
import rtlcore.hdl.Module;
import rtlcore.hdl.Ops;
import rtlcore.hdl.Property;
import rtlcore.hdl.Shape;
import rtlcore.hdl.Signal;

/**
 * Toggles an output on every rising edge of a button input and counts the presses in a saturating counter.
 * The press counter lives in a submodule.
 */
public class EdgeToggle implements Elaboratable {
  public final Signal button = new Signal("button", Shape.unsigned(1));
  public final Signal led = new Signal("led", Shape.unsigned(1));
  public final Signal presses = new Signal("presses", Shape.unsigned(3));

  private static final class PressCounter implements Elaboratable {
    final Signal pulse = new Signal("pulse", Shape.unsigned(1));
    final Signal count;

    PressCounter(Signal count) { this.count = count; }

    @Override
    public Module elaborate() {
      Module m = new Module("press_counter");
      m.when(Ops.and(pulse, Ops.ne(count, 7)), body -> body.sync(Assign.of(count, Ops.add(count, 1))));
      return m;
    }
  }

  @Override
  public Module elaborate() {
    Module m = new Module("edge_toggle");
    PressCounter counter = new PressCounter(presses);
    m.addSubmodule("counter", counter);
    m.comb(Assign.of(counter.pulse, Ops.rose(button, ClockDomain.SYNC)));
    m.when(counter.pulse, body -> body.sync(Assign.of(led, Ops.not(led))));
    m.comb(Property.cover(Ops.eq(presses, 7), "saturated"));
    return m;
  }
}
