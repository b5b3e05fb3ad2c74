package rtlcore.hdl;

import java.util.List;

/** A domain declares contradictory reset behavior, or a reset-less domain's reset is referenced. */
public class ResetDisciplineException extends ElaborationException {
  private static final long serialVersionUID = 1L;

  public ResetDisciplineException(String message, String domain) { super(message, List.of(), null, domain); }
}
