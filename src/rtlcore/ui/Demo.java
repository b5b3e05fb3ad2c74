package rtlcore.ui;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import rtlcore.hdl.ClockDomain;
import rtlcore.hdl.Elaboratable;
import rtlcore.hdl.Signal;
import rtlcore.ir.Fragment;
import rtlcore.sim.Simulator;
import rtlcore.ui.demo.Counter;
import rtlcore.ui.demo.EdgeToggle;

/** A bundled design together with the stimulus the command line runs it with. */
public abstract class Demo {
  public abstract String getDescription();
  public abstract Elaboratable getDesign();
  public abstract List<Signal> getPorts();
  /** Adds clocks and processes to a fresh simulator of the elaborated design. */
  public abstract void setUp(Simulator sim, Fragment fragment);

  /** All demos by name, in help text order. */
  public static Map<String, Demo> all() {
    Map<String, Demo> demos = new LinkedHashMap<>();
    demos.put("counter", new Demo() {
      final Counter counter = new Counter(4);
      @Override
      public String getDescription() {
        return "4-bit counter with enable, reset for the first cycle";
      }
      @Override
      public Elaboratable getDesign() {
        return counter;
      }
      @Override
      public List<Signal> getPorts() {
        return List.of(counter.en, counter.count, counter.wrap);
      }
      @Override
      public void setUp(Simulator sim, Fragment fragment) {
        Signal rst = fragment.getDomains().get(ClockDomain.SYNC).getRst().get();
        sim.addClock(ClockDomain.SYNC);
        sim.addBackgroundProcess("stimulus", ctx -> {
          ctx.set(rst, 1);
          ctx.tick();
          ctx.set(rst, 0);
          ctx.set(counter.en, 1);
        });
      }
    });
    demos.put("toggle", new Demo() {
      final EdgeToggle toggle = new EdgeToggle();
      @Override
      public String getDescription() {
        return "LED toggled by rising edges of a button, with a saturating press counter";
      }
      @Override
      public Elaboratable getDesign() {
        return toggle;
      }
      @Override
      public List<Signal> getPorts() {
        return List.of(toggle.button, toggle.led, toggle.presses);
      }
      @Override
      public void setUp(Simulator sim, Fragment fragment) {
        sim.addClock(ClockDomain.SYNC);
        sim.addBackgroundProcess("button", ctx -> {
          while (true) {
            ctx.tick(ClockDomain.SYNC, 2);
            ctx.set(toggle.button, 1);
            ctx.tick();
            ctx.set(toggle.button, 0);
          }
        });
      }
    });
    return demos;
  }
}
