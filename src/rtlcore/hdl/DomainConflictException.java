package rtlcore.hdl;

import java.util.List;

/**
 * A signal is driven from more than one domain, or a domain is used inconsistently
 * (used but not defined, defined twice in one scope).
 */
public class DomainConflictException extends ElaborationException {
  private static final long serialVersionUID = 1L;

  public DomainConflictException(String message, List<Signal> signals, Statement statement, String domain) {
    super(message, signals, statement, domain);
  }
}
