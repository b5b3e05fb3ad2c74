package rtlcore.hdl;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Fatal design error found while elaborating a module tree. No fragment is produced.
 * Carries the signals and, where known, the statement and domain the error was found at.
 */
public class ElaborationException extends Exception {
  private static final long serialVersionUID = 1L;

  private final transient List<Signal> signals;
  private final transient Statement statement;
  private final String domain;

  public ElaborationException(String message, List<Signal> signals, Statement statement, String domain) {
    super(message);
    this.signals = signals == null ? List.of() : List.copyOf(signals);
    this.statement = statement;
    this.domain = domain;
  }

  /** The implicated signals, possibly empty. */
  public List<Signal> getSignals() { return Collections.unmodifiableList(signals); }
  public Optional<Statement> getStatement() { return Optional.ofNullable(statement); }
  public Optional<String> getDomain() { return Optional.ofNullable(domain); }
}
