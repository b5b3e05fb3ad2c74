package rtlcore.drc;

import java.util.List;
import rtlcore.hdl.Statement;

/**
 * The statements one module contributes to one domain, after domain references were resolved.
 * @param module hierarchical name of the contributing module
 * @param localDomain the domain name as used inside the module
 * @param domain the unique domain name in the fragment
 * @param statements the statements in program order
 */
public record DomainStatements(String module, String localDomain, String domain, List<Statement> statements) {
  public DomainStatements {
    statements = List.copyOf(statements);
  }
}
