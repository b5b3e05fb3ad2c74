package rtlcore.hdl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Construction context for statements. A block records, in program order, statements bound to domains and
 * control-flow constructs whose bodies are nested blocks. The context is passed explicitly to every body.
 *
 * When a module is elaborated, each domain's statements are extracted with {@link #lower(String)}:
 * control-flow constructs become {@link Switch} statements containing only that domain's statements.
 */
public class Block {
  private abstract static class Item {}

  private static final class StatementItem extends Item {
    final String domain;
    final Statement statement;
    StatementItem(String domain, Statement statement) {
      this.domain = domain;
      this.statement = statement;
    }
  }

  private static final class WhenItem extends Item {
    final List<Value> conditions = new ArrayList<>();
    final List<Block> bodies = new ArrayList<>();
    Block otherwise = null;
  }

  private static final class SwitchItem extends Item {
    final Value test;
    final List<List<String>> patterns = new ArrayList<>();
    final List<Boolean> neverMatches = new ArrayList<>();
    final List<Block> bodies = new ArrayList<>();
    SwitchItem(Value test) { this.test = test; }
  }

  private final List<Item> items = new ArrayList<>();

  /** Adds combinational statements. */
  public Block comb(Statement... statements) { return domain(ClockDomain.COMB, statements); }
  /** Adds statements to the default synchronous domain. */
  public Block sync(Statement... statements) { return domain(ClockDomain.SYNC, statements); }
  public Block domain(String domain, Statement... statements) { return domain(domain, Arrays.asList(statements)); }
  public Block domain(String domain, Collection<? extends Statement> statements) {
    if (domain == null || domain.isEmpty())
      throw new IllegalArgumentException("Domain name must not be empty");
    for (Statement statement : statements)
      items.add(new StatementItem(domain, statement));
    return this;
  }

  /** Continuation of an if/else-if/else chain. */
  public static final class When {
    private final WhenItem item;
    private When(WhenItem item) { this.item = item; }

    public When elseWhen(Object condition, Consumer<Block> body) {
      if (item.otherwise != null)
        throw new IllegalStateException("elseWhen after otherwise");
      item.conditions.add(Ops.bool(condition));
      item.bodies.add(build(body));
      return this;
    }
    public void otherwise(Consumer<Block> body) {
      if (item.otherwise != null)
        throw new IllegalStateException("otherwise may only be used once");
      item.otherwise = build(body);
    }
  }

  /** Continuation of a switch over one test value. */
  public static final class SwitchBuilder {
    private final SwitchItem item;
    private boolean hasDefault = false;
    private SwitchBuilder(SwitchItem item) { this.item = item; }

    public SwitchBuilder is(Object pattern, Consumer<Block> body) { return is(List.of(pattern), body); }
    /**
     * Adds a case matching any of the patterns. An empty list never matches.
     * @throws ShapeException if a pattern does not fit the test value
     */
    public SwitchBuilder is(List<?> patterns, Consumer<Block> body) {
      if (hasDefault)
        throw new IllegalStateException("case after the default case");
      List<String> normalized = new ArrayList<>();
      for (Object pattern : patterns)
        normalized.add(Switch.normalizePattern(pattern, item.test.shape()));
      // An empty pattern list never matches; the body is still recorded for the domain usage.
      item.patterns.add(normalized);
      item.neverMatches.add(normalized.isEmpty());
      item.bodies.add(build(body));
      return this;
    }
    public void orElse(Consumer<Block> body) {
      if (hasDefault)
        throw new IllegalStateException("orElse may only be used once");
      hasDefault = true;
      item.patterns.add(List.of());
      item.neverMatches.add(false);
      item.bodies.add(build(body));
    }
  }

  private static Block build(Consumer<Block> body) {
    Block block = new Block();
    body.accept(block);
    return block;
  }

  /** Starts an if/else-if/else chain. */
  public When when(Object condition, Consumer<Block> body) {
    WhenItem item = new WhenItem();
    item.conditions.add(Ops.bool(condition));
    item.bodies.add(build(body));
    items.add(item);
    return new When(item);
  }

  /** Starts a switch over a test value. */
  public SwitchBuilder switchOn(Object test) {
    SwitchItem item = new SwitchItem(Value.cast(test));
    items.add(item);
    return new SwitchBuilder(item);
  }

  /** All domains statements were added to, in first-use order. */
  public Set<String> usedDomains() {
    LinkedHashSet<String> result = new LinkedHashSet<>();
    collectDomains(result);
    return result;
  }

  private void collectDomains(Set<String> into) {
    for (Item item : items) {
      if (item instanceof StatementItem)
        into.add(((StatementItem)item).domain);
      else if (item instanceof WhenItem) {
        WhenItem when = (WhenItem)item;
        when.bodies.forEach(body -> body.collectDomains(into));
        if (when.otherwise != null)
          when.otherwise.collectDomains(into);
      } else
        ((SwitchItem)item).bodies.forEach(body -> body.collectDomains(into));
    }
  }

  /**
   * Extracts the statements of one domain in program order.
   * @param domain the domain name, or {@link ClockDomain#COMB}
   * @return the statement list; control-flow constructs without statements in this domain are omitted
   */
  public List<Statement> lower(String domain) {
    List<Statement> result = new ArrayList<>();
    for (Item item : items) {
      if (item instanceof StatementItem) {
        StatementItem stmtItem = (StatementItem)item;
        if (stmtItem.domain.equals(domain))
          result.add(stmtItem.statement);
      } else if (item instanceof WhenItem)
        lowerWhen((WhenItem)item, domain).ifPresent(result::add);
      else
        lowerSwitch((SwitchItem)item, domain).ifPresent(result::add);
    }
    return result;
  }

  private static Optional<Statement> lowerWhen(WhenItem item, String domain) {
    int n = item.conditions.size();
    Value test = n == 1 ? item.conditions.get(0) : new Cat(item.conditions);
    List<Switch.Case> cases = new ArrayList<>();
    boolean any = false;
    for (int i = 0; i < n; ++i) {
      char[] pattern = new char[n];
      Arrays.fill(pattern, '-');
      pattern[n - 1 - i] = '1';
      List<Statement> body = item.bodies.get(i).lower(domain);
      any |= !body.isEmpty();
      cases.add(new Switch.Case(List.of(new String(pattern)), body));
    }
    if (item.otherwise != null) {
      List<Statement> body = item.otherwise.lower(domain);
      any |= !body.isEmpty();
      cases.add(new Switch.Case(List.of(), body));
    }
    return any ? Optional.of(Switch.fromCases(test, cases)) : Optional.empty();
  }

  private static Optional<Statement> lowerSwitch(SwitchItem item, String domain) {
    List<Switch.Case> cases = new ArrayList<>();
    boolean any = false;
    for (int i = 0; i < item.bodies.size(); ++i) {
      List<Statement> body = item.bodies.get(i).lower(domain);
      any |= !body.isEmpty();
      if (item.neverMatches.get(i))
        continue;
      cases.add(new Switch.Case(item.patterns.get(i), body));
    }
    return any ? Optional.of(Switch.fromCases(item.test, cases)) : Optional.empty();
  }
}
