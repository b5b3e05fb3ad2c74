package rtlcore.hdl;

import java.util.Optional;

/**
 * A named group of synchronous signals sharing a clock, an active edge and a reset discipline.
 * The name {@value #COMB} is reserved for combinational statements.
 */
public final class ClockDomain {
  /** Key of combinational statements in domain-keyed statement maps. */
  public static final String COMB = "comb";
  /** Name of the default synchronous domain. */
  public static final String SYNC = "sync";

  public enum Edge { POS, NEG }
  public enum ResetDiscipline { SYNC, ASYNC }

  private final String name;
  private final Signal clk;
  private final Optional<Signal> rst;
  private final Edge edge;
  private final ResetDiscipline resetDiscipline;
  private final boolean resetLessRequested;
  private final boolean local;

  public ClockDomain(String name) { this(builder(name)); }

  private ClockDomain(Builder builder) {
    if (builder.name == null || builder.name.isEmpty())
      throw new IllegalArgumentException("Clock domain name must not be empty");
    if (COMB.equals(builder.name))
      throw new IllegalArgumentException("Domain '" + COMB + "' may not be clocked");
    this.name = builder.name;
    this.clk = builder.clk != null ? builder.clk : new Signal(signalName(name, "clk"), Shape.unsigned(1));
    if (builder.resetLess)
      this.rst = Optional.ofNullable(builder.rst);
    else
      this.rst = Optional.of(builder.rst != null ? builder.rst : new Signal(signalName(name, "rst"), Shape.unsigned(1)));
    this.edge = builder.edge;
    this.resetDiscipline = builder.resetDiscipline;
    this.resetLessRequested = builder.resetLess;
    this.local = builder.local;
    if (clk.width() != 1)
      throw new ShapeException("Clock of domain '" + name + "' must be one bit wide");
    if (rst.isPresent() && rst.get().width() != 1)
      throw new ShapeException("Reset of domain '" + name + "' must be one bit wide");
  }

  private static String signalName(String domainName, String signalName) {
    return SYNC.equals(domainName) ? signalName : domainName + "_" + signalName;
  }

  public static Builder builder(String name) { return new Builder(name); }

  public static class Builder {
    private final String name;
    private Signal clk = null;
    private Signal rst = null;
    private Edge edge = Edge.POS;
    private ResetDiscipline resetDiscipline = ResetDiscipline.SYNC;
    private boolean resetLess = false;
    private boolean local = false;

    Builder(String name) { this.name = name; }

    /** Uses an existing signal as the clock instead of creating one. */
    public Builder clock(Signal clk) {
      this.clk = clk;
      return this;
    }
    /** Uses an existing signal as the reset instead of creating one. */
    public Builder reset(Signal rst) {
      this.rst = rst;
      return this;
    }
    public Builder edge(Edge edge) {
      this.edge = edge;
      return this;
    }
    public Builder asyncReset() {
      this.resetDiscipline = ResetDiscipline.ASYNC;
      return this;
    }
    public Builder resetLess() {
      this.resetLess = true;
      return this;
    }
    /** A local domain is only visible to the declaring module and its submodules. */
    public Builder local() {
      this.local = true;
      return this;
    }
    public ClockDomain build() { return new ClockDomain(this); }
  }

  /** Same clock, reset and discipline under a different name. */
  public ClockDomain renamed(String newName) {
    Builder builder = builder(newName).clock(clk).edge(edge);
    rst.ifPresent(builder::reset);
    if (isAsyncReset())
      builder.asyncReset();
    if (resetLessRequested)
      builder.resetLess();
    if (local)
      builder.local();
    return builder.build();
  }

  public String getName() { return name; }
  public Signal getClk() { return clk; }
  /** The reset signal; empty for reset-less domains. */
  public Optional<Signal> getRst() { return resetLessRequested ? Optional.empty() : rst; }
  public Edge getEdge() { return edge; }
  public ResetDiscipline getResetDiscipline() { return resetDiscipline; }
  public boolean isAsyncReset() { return resetDiscipline == ResetDiscipline.ASYNC; }
  public boolean isResetLess() { return resetLessRequested; }
  public boolean isLocal() { return local; }
  /**
   * True if the declaration asks for contradictory reset behavior: asynchronous reset without a reset signal,
   * or an explicit reset signal on a reset-less domain.
   */
  public boolean hasContradictoryReset() { return resetLessRequested && (isAsyncReset() || rst.isPresent()); }

  @Override
  public String toString() {
    return String.format("ClockDomain(%s, %s edge%s%s)", name, edge.name().toLowerCase(), isResetLess() ? ", reset-less" : "",
                         isAsyncReset() ? ", async reset" : "");
  }
}
