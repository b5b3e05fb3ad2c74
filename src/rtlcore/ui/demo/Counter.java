package rtlcore.ui.demo;

import rtlcore.hdl.Assign;
import rtlcore.hdl.Elaboratable;
import rtlcore.hdl.Module;
import rtlcore.hdl.Ops;
import rtlcore.hdl.Shape;
import rtlcore.hdl.Signal;

/** Wrapping up-counter in the default synchronous domain with an enable input and a wrap flag. */
public class Counter implements Elaboratable {
  public final Signal en;
  public final Signal count;
  /** High while the counter holds its maximum value. */
  public final Signal wrap;

  public Counter(int width) {
    this.en = new Signal("en", Shape.unsigned(1));
    this.count = new Signal("count", Shape.unsigned(width));
    this.wrap = new Signal("wrap", Shape.unsigned(1));
  }

  @Override
  public Module elaborate() {
    Module m = new Module("counter");
    m.when(en, body -> body.sync(Assign.of(count, Ops.add(count, 1))));
    m.comb(Assign.of(wrap, Ops.all(count)));
    return m;
  }
}
