package rtlcore.ir;

import rtlcore.hdl.ElaborationException;

/** Resolves domain names as seen from one module. */
@FunctionalInterface
public interface DomainScope {
  /**
   * @param name the domain name used inside the module
   * @throws ElaborationException if the domain is not defined and cannot be created
   */
  ResolvedDomain resolve(String name) throws ElaborationException;
}
