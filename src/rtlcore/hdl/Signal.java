package rtlcore.hdl;

import java.math.BigInteger;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import rtlcore.util.Bits;

/**
 * A named storage cell. Signals are driven either combinationally or by a synchronous domain,
 * which is decided by the statements that assign them. Signals compare by identity.
 */
public final class Signal extends Value {
  private static final AtomicLong nextId = new AtomicLong();

  private final long id;
  private final String name;
  private final Shape shape;
  private final BigInteger reset;
  private final Optional<String> domain;
  private final boolean resetLess;

  public Signal(String name, Shape shape) { this(builder(name, shape)); }
  public Signal(String name, Shape shape, long reset) { this(builder(name, shape).reset(reset)); }

  private Signal(Builder builder) {
    if (builder.name == null || builder.name.isEmpty())
      throw new IllegalArgumentException("Signal name must not be empty");
    if (!Bits.normalize(builder.reset, builder.shape.getWidth(), builder.shape.isSigned()).equals(builder.reset))
      throw new ShapeException("Reset value " + builder.reset + " of signal '" + builder.name + "' cannot be represented as " +
                               builder.shape);
    this.id = nextId.getAndIncrement();
    this.name = builder.name;
    this.shape = builder.shape;
    this.reset = builder.reset;
    this.domain = Optional.ofNullable(builder.domain);
    this.resetLess = builder.resetLess;
  }

  public static Builder builder(String name, Shape shape) { return new Builder(name, shape); }

  /** Builder for signals with optional attributes. */
  public static class Builder {
    private final String name;
    private final Shape shape;
    private BigInteger reset = BigInteger.ZERO;
    private String domain = null;
    private boolean resetLess = false;

    Builder(String name, Shape shape) {
      this.name = name;
      this.shape = shape;
    }
    public Builder reset(long reset) { return reset(BigInteger.valueOf(reset)); }
    public Builder reset(BigInteger reset) {
      this.reset = reset;
      return this;
    }
    /** Declares the only domain allowed to drive the signal. */
    public Builder domain(String domain) {
      this.domain = domain;
      return this;
    }
    /** Excludes the signal from domain resets; it is still initialized to its reset value once. */
    public Builder resetLess() {
      this.resetLess = true;
      return this;
    }
    public Signal build() { return new Signal(this); }
  }

  public long getId() { return id; }
  public String getName() { return name; }
  public BigInteger getReset() { return reset; }
  public Optional<String> getDomain() { return domain; }
  public boolean isResetLess() { return resetLess; }

  @Override
  public Shape shape() {
    return shape;
  }
  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitSignal(this);
  }
  @Override
  protected void collectReadSignals(Set<Signal> into) {
    into.add(this);
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj;
  }
  @Override
  public int hashCode() {
    return Long.hashCode(id);
  }
  @Override
  public String toString() {
    return "(sig " + name + ")";
  }
}
