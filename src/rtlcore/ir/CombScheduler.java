package rtlcore.ir;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rtlcore.hdl.Assign;
import rtlcore.hdl.Cat;
import rtlcore.hdl.CombinationalLoopException;
import rtlcore.hdl.Const;
import rtlcore.hdl.Operator;
import rtlcore.hdl.Replicate;
import rtlcore.hdl.Signal;
import rtlcore.hdl.Slice;
import rtlcore.hdl.Statement;
import rtlcore.hdl.Switch;
import rtlcore.hdl.Value;

/**
 * Groups combinational statements into evaluation units and orders the units so that every unit comes
 * after the units producing the signals it reads.
 * Loops are detected on the individual bits of the assigned signals: a bit depends on the bits its source
 * expression reads and on the switch tests guarding its assignments, not on other targets of its unit.
 */
public class CombScheduler {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /**
   * Builds the units for a combinational statement list. Statements sharing a target signal, directly or
   * through other statements, end up in one unit.
   * Statements without targets (properties only) are not part of any unit.
   */
  static List<CombUnit> groupUnits(List<Statement> statements) {
    // Union-find over statement indices.
    int[] parent = new int[statements.size()];
    for (int i = 0; i < parent.length; ++i)
      parent[i] = i;
    Map<Signal, Integer> firstWriter = new HashMap<>();
    for (int i = 0; i < statements.size(); ++i) {
      for (Signal target : statements.get(i).writtenSignals()) {
        Integer other = firstWriter.putIfAbsent(target, i);
        if (other != null)
          union(parent, other, i);
      }
    }
    Map<Integer, List<Statement>> byRoot = new LinkedHashMap<>();
    for (int i = 0; i < statements.size(); ++i) {
      if (statements.get(i).writtenSignals().isEmpty())
        continue;
      byRoot.computeIfAbsent(find(parent, i), root -> new ArrayList<>()).add(statements.get(i));
    }
    List<CombUnit> units = new ArrayList<>(byRoot.size());
    byRoot.values().forEach(unitStatements -> units.add(new CombUnit(unitStatements)));
    return units;
  }

  private static int find(int[] parent, int i) {
    while (parent[i] != i) {
      parent[i] = parent[parent[i]];
      i = parent[i];
    }
    return i;
  }
  private static void union(int[] parent, int a, int b) {
    int rootA = find(parent, a);
    int rootB = find(parent, b);
    // Keep the earlier statement as root so units keep program order.
    if (rootA < rootB)
      parent[rootB] = rootA;
    else if (rootB < rootA)
      parent[rootA] = rootB;
  }

  /**
   * Dependency graph over the bits of combinationally assigned signals.
   * Node ids are consecutive per signal, in order of the first assignment.
   */
  static final class BitGraph {
    private final Map<Signal, Integer> base = new LinkedHashMap<>();
    private final Map<Signal, Statement> firstWriter = new HashMap<>();
    private final List<Signal> nodeSignal = new ArrayList<>();
    private final List<Set<Integer>> deps = new ArrayList<>();

    BitGraph(List<Statement> statements) {
      for (Statement statement : statements) {
        for (Signal target : statement.writtenSignals()) {
          if (base.containsKey(target))
            continue;
          base.put(target, nodeSignal.size());
          firstWriter.put(target, statement);
          for (int bit = 0; bit < target.width(); ++bit) {
            nodeSignal.add(target);
            deps.add(new TreeSet<>());
          }
        }
      }
      for (Statement statement : statements)
        addDependencies(statement, Set.of());
    }

    int size() { return nodeSignal.size(); }
    Signal signalOf(int node) { return nodeSignal.get(node); }
    /** Nodes the given node depends on, in ascending order. */
    Set<Integer> dependencies(int node) { return Collections.unmodifiableSet(deps.get(node)); }
    /** Node of a bit, or -1 if the signal is not assigned combinationally. */
    int node(Signal signal, int bit) {
      Integer first = base.get(signal);
      return first == null ? -1 : first + bit;
    }

    private void addDependencies(Statement statement, Set<Integer> guard) {
      if (statement instanceof Assign) {
        Assign assign = (Assign)statement;
        Value source = assign.getSource();
        List<Set<Integer>> sourceBits = bitSources(source);
        int offset = 0;
        for (Assign.TargetRange range : assign.getRanges()) {
          int first = base.get(range.signal()) + range.start();
          for (int bit = 0; bit < range.width(); ++bit, ++offset) {
            Set<Integer> nodeDeps = deps.get(first + bit);
            nodeDeps.addAll(guard);
            if (offset < sourceBits.size())
              nodeDeps.addAll(sourceBits.get(offset));
            else if (source.isSigned() && !sourceBits.isEmpty())
              nodeDeps.addAll(sourceBits.get(sourceBits.size() - 1));
          }
        }
      } else if (statement instanceof Switch) {
        Switch sw = (Switch)statement;
        Set<Integer> caseGuard = new HashSet<>(guard);
        bitSources(sw.getTest()).forEach(caseGuard::addAll);
        for (Switch.Case c : sw.getCases()) {
          for (Statement inner : c.getBody())
            addDependencies(inner, caseGuard);
        }
      }
    }

    /** For every bit of the value, the nodes it is computed from. */
    private List<Set<Integer>> bitSources(Value value) {
      List<Set<Integer>> result = new ArrayList<>(value.width());
      if (value instanceof Signal) {
        Signal signal = (Signal)value;
        for (int bit = 0; bit < signal.width(); ++bit) {
          int node = node(signal, bit);
          result.add(node < 0 ? Set.of() : Set.of(node));
        }
      } else if (value instanceof Const) {
        for (int bit = 0; bit < value.width(); ++bit)
          result.add(Set.of());
      } else if (value instanceof Slice) {
        Slice slice = (Slice)value;
        result.addAll(bitSources(slice.getValue()).subList(slice.getStart(), slice.getStop()));
      } else if (value instanceof Cat) {
        for (Value part : ((Cat)value).getParts())
          result.addAll(bitSources(part));
      } else if (value instanceof Replicate) {
        Replicate replicate = (Replicate)value;
        List<Set<Integer>> once = bitSources(replicate.getValue());
        for (int i = 0; i < replicate.getCount(); ++i)
          result.addAll(once);
      } else if (value instanceof Operator && (((Operator)value).getKind() == Operator.Kind.AS_SIGNED ||
                                               ((Operator)value).getKind() == Operator.Kind.AS_UNSIGNED)) {
        result.addAll(bitSources(((Operator)value).getOperand(0)));
      } else {
        Set<Integer> all = new TreeSet<>();
        if (value instanceof Operator) {
          for (Value operand : ((Operator)value).getOperands())
            bitSources(operand).forEach(all::addAll);
        } else {
          for (Signal signal : value.readSignals()) {
            for (int bit = 0; bit < signal.width(); ++bit) {
              int node = node(signal, bit);
              if (node >= 0)
                all.add(node);
            }
          }
        }
        Set<Integer> shared = Collections.unmodifiableSet(all);
        for (int bit = 0; bit < value.width(); ++bit)
          result.add(shared);
      }
      return result;
    }

    /**
     * Depth-first search over the bit dependencies.
     * @throws CombinationalLoopException on the first cycle found
     */
    void checkAcyclic() throws CombinationalLoopException {
      // dfs_status: 0 = unvisited, 1 = on stack, 2 = done
      int[] dfs_status = new int[size()];
      Deque<Integer> dfs_stack = new ArrayDeque<>();
      Deque<Iterator<Integer>> pendingDeps = new ArrayDeque<>();
      for (int start = 0; start < size(); ++start) {
        if (dfs_status[start] != 0)
          continue;
        dfs_stack.push(start);
        pendingDeps.push(deps.get(start).iterator());
        dfs_status[start] = 1;
        while (!dfs_stack.isEmpty()) {
          int node = dfs_stack.peek();
          Iterator<Integer> pending = pendingDeps.peek();
          if (pending.hasNext()) {
            int dep = pending.next();
            if (dfs_status[dep] == 2)
              continue;
            if (dfs_status[dep] == 1)
              throw loopError(dfs_stack, dep);
            dfs_stack.push(dep); // push
            pendingDeps.push(deps.get(dep).iterator());
            dfs_status[dep] = 1;
          } else {
            dfs_status[node] = 2;
            dfs_stack.pop(); // pop
            pendingDeps.pop();
          }
        }
      }
    }

    private CombinationalLoopException loopError(Deque<Integer> dfs_stack, int repeated) {
      // dfs_stack holds the innermost node first; the cycle runs from the repeated node to the top of the stack.
      List<Integer> nodes = new ArrayList<>();
      for (int node : dfs_stack) {
        if (node == repeated)
          break;
        nodes.add(node);
      }
      Collections.reverse(nodes);
      nodes.add(repeated);
      List<Signal> cycle = new ArrayList<>();
      for (int node : nodes) {
        Signal signal = signalOf(node);
        if (cycle.isEmpty() || !cycle.get(cycle.size() - 1).equals(signal))
          cycle.add(signal);
      }
      if (cycle.size() > 1 && cycle.get(0).equals(cycle.get(cycle.size() - 1)))
        cycle.remove(0);
      StringBuilder names = new StringBuilder();
      for (Signal signal : cycle)
        names.append(signal.getName()).append(" -> ");
      names.append(cycle.get(0).getName());
      String message = "Combinational loop through signals " + names;
      logger.error(message);
      return new CombinationalLoopException(message, cycle, firstWriter.get(signalOf(repeated)));
    }
  }

  /**
   * Orders the units topologically by a depth-first search over their dependencies.
   * Units can depend on each other without a loop between their bits; such units keep their relative
   * program order and are settled by re-evaluation.
   * @param units the units in program order
   * @param graph the bit dependencies of the units' statements
   * @return the units, producers before consumers
   */
  static List<CombUnit> order(List<CombUnit> units, BitGraph graph) {
    Map<Signal, Integer> unitOf = new HashMap<>();
    for (int i = 0; i < units.size(); ++i) {
      for (Signal target : units.get(i).getTargets())
        unitOf.put(target, i);
    }
    List<Set<Integer>> unitDeps = new ArrayList<>(units.size());
    for (int i = 0; i < units.size(); ++i)
      unitDeps.add(new TreeSet<>());
    for (int node = 0; node < graph.size(); ++node) {
      int unit = unitOf.get(graph.signalOf(node));
      for (int dep : graph.dependencies(node)) {
        int depUnit = unitOf.get(graph.signalOf(dep));
        if (depUnit != unit)
          unitDeps.get(unit).add(depUnit);
      }
    }

    // dfs_status: 0 = unvisited, 1 = on stack, 2 = done
    int[] dfs_status = new int[units.size()];
    List<CombUnit> sorted = new ArrayList<>(units.size());
    Deque<Integer> dfs_stack = new ArrayDeque<>();
    Deque<Iterator<Integer>> pendingDeps = new ArrayDeque<>();
    for (int start = 0; start < units.size(); ++start) {
      if (dfs_status[start] != 0)
        continue;
      dfs_stack.push(start);
      pendingDeps.push(unitDeps.get(start).iterator());
      dfs_status[start] = 1;
      while (!dfs_stack.isEmpty()) {
        int i = dfs_stack.peek();
        Iterator<Integer> pending = pendingDeps.peek();
        if (pending.hasNext()) {
          int dep = pending.next();
          if (dfs_status[dep] != 0)
            continue;
          dfs_stack.push(dep); // push
          pendingDeps.push(unitDeps.get(dep).iterator());
          dfs_status[dep] = 1;
        } else {
          dfs_status[i] = 2;
          sorted.add(units.get(i));
          dfs_stack.pop(); // pop
          pendingDeps.pop();
        }
      }
    }
    if (logger.isDebugEnabled())
      logger.debug("Combinational evaluation order: {}", sorted);
    return sorted;
  }

  /**
   * Groups and orders the combinational statements of a fragment.
   * @throws CombinationalLoopException if a bit depends on itself
   */
  public static List<CombUnit> schedule(List<Statement> combStatements) throws CombinationalLoopException {
    BitGraph graph = new BitGraph(combStatements);
    graph.checkAcyclic();
    return order(groupUnits(combStatements), graph);
  }
}
