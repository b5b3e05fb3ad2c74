package rtlcore.drc;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rtlcore.hdl.Assign;
import rtlcore.hdl.ClockDomain;
import rtlcore.hdl.DomainConflictException;
import rtlcore.hdl.DriverConflictException;
import rtlcore.hdl.ElaborationException;
import rtlcore.hdl.ResetDisciplineException;
import rtlcore.hdl.Signal;
import rtlcore.hdl.Statement;
import rtlcore.hdl.Switch;

/**
 * Design rule checks on a module hierarchy after domain resolution.
 * Every finding is logged; the first fatal one is kept and raised by {@link #throwIfFatal()}.
 */
public class DRC {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private boolean strictDriverCheck = true;
  private ElaborationException firstError = null;
  private final List<String> warnings = new ArrayList<>();

  /**
   * If disabled, two unconditional drivers of the same bits in one statement list are reported as a warning
   * instead of an error. Conflicts between modules are always fatal.
   */
  public void setStrictDriverCheck(boolean strictDriverCheck) { this.strictDriverCheck = strictDriverCheck; }

  public boolean hasFatalError() { return firstError != null; }
  /** Non-fatal findings, in detection order. */
  public List<String> getWarnings() { return Collections.unmodifiableList(warnings); }

  /** Throws the first fatal finding, if any. */
  public void throwIfFatal() throws ElaborationException {
    if (firstError != null)
      throw firstError;
  }

  private void report(ElaborationException error) {
    logger.error(error.getMessage());
    if (firstError == null)
      firstError = error;
  }

  /** Checks that no domain asks for contradictory reset behavior. */
  public void checkResetDisciplines(String module, Iterable<ClockDomain> domains) {
    for (ClockDomain domain : domains) {
      if (domain.hasContradictoryReset()) {
        String reason = domain.isAsyncReset() ? "asynchronous reset" : "an explicit reset signal";
        report(new ResetDisciplineException(
            String.format("Domain '%s' of module %s is declared reset-less but has %s", domain.getName(), module, reason),
            domain.getName()));
      }
    }
  }

  /**
   * Checks that each signal is driven from exactly one domain, and from its declared domain if it has one.
   */
  public void checkDomainBinding(List<DomainStatements> lists) {
    Map<Signal, DomainStatements> bindings = new HashMap<>();
    for (DomainStatements list : lists) {
      for (Statement statement : list.statements()) {
        for (Signal signal : statement.writtenSignals()) {
          DomainStatements existing = bindings.get(signal);
          if (existing == null) {
            bindings.put(signal, list);
            if (signal.getDomain().isPresent() && !signal.getDomain().get().equals(list.localDomain()) &&
                !signal.getDomain().get().equals(list.domain())) {
              report(new DomainConflictException(String.format("Signal '%s' belongs to domain '%s' but is driven from domain '%s' in module %s",
                                                               signal.getName(), signal.getDomain().get(), list.domain(),
                                                               list.module()),
                                                 List.of(signal), statement, list.domain()));
            }
          } else if (!existing.domain().equals(list.domain())) {
            report(new DomainConflictException(String.format("Signal '%s' is driven from domain '%s' (module %s) and domain '%s' (module %s)",
                                                             signal.getName(), existing.domain(), existing.module(), list.domain(),
                                                             list.module()),
                                               List.of(signal), statement, list.domain()));
          }
        }
      }
    }
  }

  /**
   * Checks for multiple drivers: overlapping assignments within one statement list, and the same bits
   * driven from two modules. Assignments in different cases of a switch and assignments nested below
   * another assignment to the same bits are not conflicts.
   */
  public void checkDrivers(List<DomainStatements> lists) {
    for (DomainStatements list : lists)
      checkStatementList(list.statements(), list);

    Map<Signal, Map<String, BitSet>> driversBySignal = new LinkedHashMap<>();
    for (DomainStatements list : lists) {
      for (Statement statement : list.statements()) {
        List<Assign> assigns = new ArrayList<>();
        collectAssigns(statement, assigns);
        for (Assign assign : assigns) {
          for (Assign.TargetRange range : assign.getRanges()) {
            Map<String, BitSet> byModule = driversBySignal.computeIfAbsent(range.signal(), s -> new LinkedHashMap<>());
            for (Map.Entry<String, BitSet> other : byModule.entrySet()) {
              if (other.getKey().equals(list.module()))
                continue;
              int bit = other.getValue().get(range.start(), range.start() + range.width()).nextSetBit(0);
              if (bit >= 0) {
                report(new DriverConflictException(String.format("Bit %d of signal '%s' is driven from module %s and module %s",
                                                                 range.start() + bit, range.signal().getName(), other.getKey(),
                                                                 list.module()),
                                                   range.signal(), range.start() + bit, assign, list.domain()));
              }
            }
            byModule.computeIfAbsent(list.module(), m -> new BitSet()).set(range.start(), range.start() + range.width());
          }
        }
      }
    }
  }

  private void checkStatementList(List<Statement> statements, DomainStatements context) {
    Map<Signal, BitSet> driven = new HashMap<>();
    for (Statement statement : statements) {
      if (statement instanceof Assign) {
        Assign assign = (Assign)statement;
        for (Assign.TargetRange range : assign.getRanges()) {
          BitSet bits = driven.computeIfAbsent(range.signal(), s -> new BitSet());
          int bit = bits.get(range.start(), range.start() + range.width()).nextSetBit(0);
          if (bit >= 0) {
            String message = String.format("Bit %d of signal '%s' has more than one driver in domain '%s' of module %s",
                                           range.start() + bit, range.signal().getName(), context.domain(), context.module());
            if (strictDriverCheck)
              report(new DriverConflictException(message, range.signal(), range.start() + bit, assign, context.domain()));
            else {
              logger.warn(message);
              warnings.add(message);
            }
          }
          bits.set(range.start(), range.start() + range.width());
        }
      } else if (statement instanceof Switch) {
        for (Switch.Case c : ((Switch)statement).getCases())
          checkStatementList(c.getBody(), context);
      }
    }
  }

  private static void collectAssigns(Statement statement, List<Assign> into) {
    if (statement instanceof Assign)
      into.add((Assign)statement);
    else if (statement instanceof Switch) {
      for (Switch.Case c : ((Switch)statement).getCases())
        c.getBody().forEach(s -> collectAssigns(s, into));
    }
  }
}
