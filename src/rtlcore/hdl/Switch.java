package rtlcore.hdl;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import rtlcore.util.Bits;

/**
 * Priority-ordered conditional branch. Cases are tested in order against the test value and the body of the
 * first matching case is executed. A case without patterns is the default case and always matches.
 */
public final class Switch extends Statement {

  /** One case: normalized bit patterns (most significant bit first, '-' for don't care) and a body. */
  public static final class Case {
    private final List<String> patterns;
    private final List<Statement> body;
    private final BigInteger[] masks;
    private final BigInteger[] values;

    Case(List<String> patterns, List<? extends Statement> body) {
      this.patterns = List.copyOf(patterns);
      this.body = List.copyOf(body);
      this.masks = new BigInteger[patterns.size()];
      this.values = new BigInteger[patterns.size()];
      for (int i = 0; i < patterns.size(); ++i) {
        String pattern = patterns.get(i);
        BigInteger mask = BigInteger.ZERO;
        BigInteger value = BigInteger.ZERO;
        for (int bit = 0; bit < pattern.length(); ++bit) {
          char c = pattern.charAt(pattern.length() - 1 - bit);
          if (c == '-')
            continue;
          mask = mask.setBit(bit);
          if (c == '1')
            value = value.setBit(bit);
        }
        masks[i] = mask;
        values[i] = value;
      }
    }

    public List<String> getPatterns() { return Collections.unmodifiableList(patterns); }
    public List<Statement> getBody() { return Collections.unmodifiableList(body); }
    public boolean isDefault() { return patterns.isEmpty(); }

    /**
     * Tests the raw (unsigned) bit pattern of the test value against this case.
     * @param testBits the test value reduced to its raw bits
     * @return true if any pattern matches, or if this is the default case
     */
    public boolean matches(BigInteger testBits) {
      if (patterns.isEmpty())
        return true;
      for (int i = 0; i < masks.length; ++i) {
        if (testBits.and(masks[i]).equals(values[i]))
          return true;
      }
      return false;
    }

    /** Same patterns, different body. */
    public Case withBody(List<? extends Statement> newBody) { return new Case(patterns, newBody); }

    @Override
    public boolean equals(Object obj) {
      if (this == obj)
        return true;
      if (obj == null || getClass() != obj.getClass())
        return false;
      Case other = (Case)obj;
      return patterns.equals(other.patterns) && body.equals(other.body);
    }
    @Override
    public int hashCode() {
      return Objects.hash(patterns, body);
    }
  }

  private final Value test;
  private final List<Case> cases;

  /**
   * @param test the value to match
   * @param cases ordered (patterns, body) pairs; an empty pattern list marks the default case.
   *        Patterns may be integers, constants, {@link ValueCastable} constants or bit strings of '0', '1' and '-'.
   * @throws ShapeException if a pattern does not fit the width of the test value
   */
  public Switch(Value test, List<? extends Map.Entry<? extends List<?>, ? extends List<? extends Statement>>> cases) {
    this.test = Objects.requireNonNull(test);
    List<Case> normalized = new ArrayList<>(cases.size());
    for (Map.Entry<? extends List<?>, ? extends List<? extends Statement>> entry : cases) {
      List<String> patterns = new ArrayList<>(entry.getKey().size());
      for (Object pattern : entry.getKey())
        patterns.add(normalizePattern(pattern, test.shape()));
      normalized.add(new Case(patterns, entry.getValue()));
    }
    this.cases = Collections.unmodifiableList(normalized);
  }

  private Switch(Value test, List<Case> cases, boolean normalized) {
    this.test = test;
    this.cases = Collections.unmodifiableList(new ArrayList<>(cases));
  }

  /** Creates a switch from already normalized cases, e.g. when rewriting an existing switch. */
  public static Switch fromCases(Value test, List<Case> cases) { return new Switch(test, cases, true); }

  /**
   * Converts a pattern to a bit string of exactly the width of the test shape.
   * @throws ShapeException if the pattern is malformed or cannot be represented
   */
  public static String normalizePattern(Object pattern, Shape testShape) {
    int width = testShape.getWidth();
    if (pattern instanceof String) {
      String bits = ((String)pattern).replaceAll("\\s", "");
      if (bits.length() != width)
        throw new ShapeException(String.format("Switch pattern '%s' must have the same width as the test value (%d)", pattern, width));
      for (char c : bits.toCharArray()) {
        if (c != '0' && c != '1' && c != '-')
          throw new ShapeException(String.format("Switch pattern '%s' must consist of 0, 1 and - (don't care) bits", pattern));
      }
      return bits;
    }
    Value value = Value.cast(pattern);
    if (!(value instanceof Const))
      throw new IllegalArgumentException("Switch pattern " + pattern + " must be constant");
    BigInteger literal = ((Const)value).getValue();
    if (!Bits.normalize(literal, width, testShape.isSigned()).equals(literal))
      throw new ShapeException(String.format("Switch pattern %s cannot be represented by test shape %s", literal, testShape));
    StringBuilder bits = new StringBuilder(Bits.raw(literal, width).toString(2));
    while (bits.length() < width)
      bits.insert(0, '0');
    return width == 0 ? "" : bits.toString();
  }

  public Value getTest() { return test; }
  public List<Case> getCases() { return cases; }

  @Override
  public <R> R accept(StatementVisitor<R> visitor) {
    return visitor.visitSwitch(this);
  }
  @Override
  protected void collectReadSignals(Set<Signal> into) {
    test.collectReadSignals(into);
    cases.forEach(c -> c.body.forEach(stmt -> stmt.collectReadSignals(into)));
  }
  @Override
  protected void collectWrittenSignals(Set<Signal> into) {
    cases.forEach(c -> c.body.forEach(stmt -> stmt.collectWrittenSignals(into)));
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Switch other = (Switch)obj;
    return test.equals(other.test) && cases.equals(other.cases);
  }
  @Override
  public int hashCode() {
    return Objects.hash(test, cases);
  }
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(switch ").append(test);
    for (Case c : cases) {
      if (c.isDefault())
        sb.append(" (default");
      else
        sb.append(" (case ").append(String.join("|", c.patterns));
      c.body.forEach(stmt -> sb.append(' ').append(stmt));
      sb.append(')');
    }
    return sb.append(')').toString();
  }
}
