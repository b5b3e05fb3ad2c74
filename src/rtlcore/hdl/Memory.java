package rtlcore.hdl;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import rtlcore.util.Bits;

/**
 * An array of words with read and write ports. Add the memory to a module as a submodule; it elaborates to
 * logic over one reset-less signal per row, so the simulator and the checks treat it like any other logic.
 *
 * Reads past the last row return the last row; writes past the last row are dropped. Write ports of one
 * domain are applied in the order they were created, the last one wins.
 */
public final class Memory implements Elaboratable {

  /** Read port. Combinational ports have no enable. */
  public final class ReadPort {
    private final String domain;
    private final boolean transparent;
    private final Signal addr;
    private final Signal data;
    private final Signal en;

    private ReadPort(String domain, boolean transparent, String prefix) {
      this.domain = domain;
      this.transparent = transparent;
      this.addr = new Signal(prefix + "_addr", Shape.unsigned(addrWidth));
      this.data = new Signal(prefix + "_data", shape);
      this.en = ClockDomain.COMB.equals(domain) ? null : new Signal(prefix + "_en", Shape.unsigned(1), 1);
    }

    public String getDomain() { return domain; }
    public boolean isTransparent() { return transparent; }
    public Signal getAddr() { return addr; }
    public Signal getData() { return data; }
    /** @throws IllegalStateException for combinational ports */
    public Signal getEn() {
      if (en == null)
        throw new IllegalStateException("Combinational read ports have no enable");
      return en;
    }
  }

  /** Write port. Bit i of the enable writes data bits [i*granularity, (i+1)*granularity). */
  public final class WritePort {
    private final String domain;
    private final int granularity;
    private final Signal addr;
    private final Signal data;
    private final Signal en;

    private WritePort(String domain, int granularity, String prefix) {
      this.domain = domain;
      this.granularity = granularity;
      this.addr = new Signal(prefix + "_addr", Shape.unsigned(addrWidth));
      this.data = new Signal(prefix + "_data", shape);
      this.en = new Signal(prefix + "_en", Shape.unsigned(shape.getWidth() / granularity));
    }

    public String getDomain() { return domain; }
    public int getGranularity() { return granularity; }
    public Signal getAddr() { return addr; }
    public Signal getData() { return data; }
    public Signal getEn() { return en; }
  }

  private final String name;
  private final Shape shape;
  private final int depth;
  private final int addrWidth;
  private final List<BigInteger> init;
  private final List<Signal> rows;
  private final List<ReadPort> readPorts = new ArrayList<>();
  private final List<WritePort> writePorts = new ArrayList<>();

  public Memory(String name, Shape shape, int depth) { this(name, shape, depth, List.of()); }
  /**
   * @param init initial row contents; missing rows start at zero
   * @throws IllegalArgumentException if the depth is not positive or there are more initial values than rows
   * @throws ShapeException if an initial value does not fit the shape
   */
  public Memory(String name, Shape shape, int depth, List<? extends Number> init) {
    if (depth <= 0)
      throw new IllegalArgumentException("Memory depth must be positive, not " + depth);
    if (init.size() > depth)
      throw new IllegalArgumentException(String.format("Memory %s has %d rows but %d initial values", name, depth, init.size()));
    this.name = name;
    this.shape = shape;
    this.depth = depth;
    this.addrWidth = Math.max(1, Bits.clog2(depth));
    List<BigInteger> values = new ArrayList<>(depth);
    List<Signal> rowSignals = new ArrayList<>(depth);
    for (int i = 0; i < depth; ++i) {
      BigInteger value = i < init.size() ? toBigInteger(init.get(i)) : BigInteger.ZERO;
      if (!Bits.normalize(value, shape.getWidth(), shape.isSigned()).equals(value))
        throw new ShapeException(String.format("Initial value %s of row %d of memory %s cannot be represented as %s", value, i, name, shape));
      values.add(value);
      rowSignals.add(Signal.builder(name + "[" + i + "]", shape).reset(value).resetLess().build());
    }
    this.init = Collections.unmodifiableList(values);
    this.rows = Collections.unmodifiableList(rowSignals);
  }

  private static BigInteger toBigInteger(Number number) {
    return number instanceof BigInteger ? (BigInteger)number : BigInteger.valueOf(number.longValue());
  }

  public String getName() { return name; }
  public Shape getShape() { return shape; }
  public int getDepth() { return depth; }
  public List<BigInteger> getInit() { return init; }
  /** The storage signal of a row. Read-only memories elaborate to constants and do not use these. */
  public Signal getRow(int index) { return rows.get(index); }

  /** Adds an asynchronous (combinational) read port. */
  public ReadPort readPort() { return readPort(ClockDomain.COMB, false); }
  /**
   * Adds a read port.
   * @param domain the domain registering the read data, or {@link ClockDomain#COMB}
   * @param transparent for synchronous ports: whether a write to the read address at the same edge is visible
   */
  public ReadPort readPort(String domain, boolean transparent) {
    ReadPort port = new ReadPort(domain, transparent && !ClockDomain.COMB.equals(domain), name + "_r" + readPorts.size());
    readPorts.add(port);
    return port;
  }

  public WritePort writePort(String domain) { return writePort(domain, shape.getWidth()); }
  /**
   * Adds a write port.
   * @param granularity width of the independently enabled lanes; must divide the word width
   * @throws IllegalArgumentException for combinational domains or a granularity that does not divide the width
   */
  public WritePort writePort(String domain, int granularity) {
    if (ClockDomain.COMB.equals(domain))
      throw new IllegalArgumentException("Write ports must be synchronous");
    if (granularity <= 0 || shape.getWidth() % granularity != 0)
      throw new IllegalArgumentException(String.format("Write granularity %d must divide the word width %d", granularity, shape.getWidth()));
    WritePort port = new WritePort(domain, granularity, name + "_w" + writePorts.size());
    writePorts.add(port);
    return port;
  }

  @Override
  public Module elaborate() {
    Module m = new Module(name);
    List<Value> contents = new ArrayList<>(depth);
    for (int i = 0; i < depth; ++i)
      contents.add(writePorts.isEmpty() ? Const.of(init.get(i), shape) : rows.get(i));

    for (ReadPort port : readPorts) {
      if (ClockDomain.COMB.equals(port.domain))
        m.comb(Assign.of(port.data, Select.of(port.addr, contents)));
      else if (port.transparent) {
        // the latched address reads the contents after the edge's writes
        Signal latched = Signal.builder(port.addr.getName() + "_latched", port.addr.shape()).resetLess().build();
        m.when(port.en, body -> body.domain(port.domain, Assign.of(latched, port.addr)));
        m.comb(Assign.of(port.data, Select.of(latched, contents)));
      } else
        m.when(port.en, body -> body.domain(port.domain, Assign.of(port.data, Select.of(port.addr, contents))));
    }

    for (WritePort port : writePorts) {
      int lanes = port.en.width();
      for (int lane = 0; lane < lanes; ++lane) {
        int start = lane * port.granularity;
        int stop = start + port.granularity;
        m.when(Slice.bit(port.en, lane), body -> {
          Block.SwitchBuilder byAddr = body.switchOn(port.addr);
          for (int i = 0; i < depth; ++i) {
            Signal row = rows.get(i);
            byAddr.is(i, rowBody -> rowBody.domain(port.domain, Assign.of(Slice.of(row, start, stop), Slice.of(port.data, start, stop))));
          }
        });
      }
    }
    return m;
  }

  @Override
  public String toString() {
    return String.format("Memory(%s, %s x %d)", name, shape, depth);
  }
}
