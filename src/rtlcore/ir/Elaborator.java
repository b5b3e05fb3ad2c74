package rtlcore.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rtlcore.drc.DRC;
import rtlcore.drc.DomainStatements;
import rtlcore.hdl.ClockDomain;
import rtlcore.hdl.DomainConflictException;
import rtlcore.hdl.Elaboratable;
import rtlcore.hdl.ElaborationException;
import rtlcore.hdl.Module;
import rtlcore.hdl.Signal;
import rtlcore.hdl.Statement;
import rtlcore.ui.RTLCoreConfig;

/**
 * Flattens a module hierarchy into a {@link Fragment}.
 *
 * Steps: build the module tree, propagate non-local domain declarations upwards, resolve every domain
 * reference by looking it up through the enclosing scopes (applying submodule renames), lower samples and
 * clock/reset references, run the design rule checks, and order the combinational logic.
 * Elaboration either returns a complete fragment or throws; the elaborator keeps no state between runs.
 */
public class Elaborator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final RTLCoreConfig config;

  public Elaborator() { this(new RTLCoreConfig()); }
  public Elaborator(RTLCoreConfig config) { this.config = config; }

  public Fragment elaborate(Elaboratable top) throws ElaborationException { return elaborate(top, List.of()); }

  /**
   * @param top the top-level design
   * @param ports signals the caller wants as ports; driven ones become outputs, the others inputs
   * @throws ElaborationException on the first design error found
   */
  public Fragment elaborate(Elaboratable top, List<Signal> ports) throws ElaborationException {
    return new Run(ports).elaborate(top);
  }

  /** One module instance in the hierarchy. */
  private static final class Node {
    final String path;
    final Module module;
    final Node parent;
    final Map<String, String> renames;
    final List<Node> children = new ArrayList<>();
    /** Domains visible by name in this module: its own and those exported by submodules. */
    final Map<String, ClockDomain> defined = new LinkedHashMap<>();
    /** Non-local domains visible to the parent, by the name used inside this module. */
    final Map<String, ClockDomain> exported = new LinkedHashMap<>();
    final Map<String, String> exportedBy = new HashMap<>();

    Node(String path, Module module, Node parent, Map<String, String> renames) {
      this.path = path;
      this.module = module;
      this.parent = parent;
      this.renames = renames;
    }
  }

  private final class Run {
    final List<Signal> requestedPorts;
    final DRC drc = new DRC();
    final List<String> diagnostics = new ArrayList<>();
    final Map<ClockDomain, String> uniqueNames = new IdentityHashMap<>();
    final Map<String, ClockDomain> fragmentDomains = new LinkedHashMap<>();
    final SampleRegisters registers = new SampleRegisters();
    Node root = null;

    Run(List<Signal> requestedPorts) {
      this.requestedPorts = requestedPorts;
      drc.setStrictDriverCheck(config.strict_driver_check);
    }

    Fragment elaborate(Elaboratable top) throws ElaborationException {
      root = buildHierarchy(top, null, null, Map.of(), Collections.newSetFromMap(new IdentityHashMap<>()));
      drc.throwIfFatal();
      propagateDomainsUp(root);

      List<DomainStatements> lists = new ArrayList<>();
      lowerStatements(root, lists);
      registers.getStatements().forEach((domain, statements) -> lists.add(new DomainStatements("$sample", domain, domain, statements)));

      drc.checkDomainBinding(lists);
      drc.checkDrivers(lists);
      drc.throwIfFatal();
      diagnostics.addAll(drc.getWarnings());

      Map<String, List<Statement>> statements = new LinkedHashMap<>();
      statements.put(ClockDomain.COMB, new ArrayList<>());
      Map<Signal, String> driverDomains = new LinkedHashMap<>();
      for (DomainStatements list : lists) {
        statements.computeIfAbsent(list.domain(), d -> new ArrayList<>()).addAll(list.statements());
        for (Statement statement : list.statements())
          statement.writtenSignals().forEach(signal -> driverDomains.put(signal, list.domain()));
      }
      if (statements.get(ClockDomain.COMB).isEmpty())
        statements.remove(ClockDomain.COMB);

      List<CombUnit> combUnits = CombScheduler.schedule(statements.getOrDefault(ClockDomain.COMB, List.of()));

      Set<Signal> signals = new LinkedHashSet<>();
      Set<Signal> domainSignals = new LinkedHashSet<>();
      for (ClockDomain domain : fragmentDomains.values()) {
        domainSignals.add(domain.getClk());
        domain.getRst().ifPresent(domainSignals::add);
      }
      signals.addAll(domainSignals);
      Set<Signal> readSignals = new LinkedHashSet<>();
      for (List<Statement> domainStatements : statements.values()) {
        for (Statement statement : domainStatements) {
          readSignals.addAll(statement.readSignals());
          signals.addAll(statement.readSignals());
          signals.addAll(statement.writtenSignals());
        }
      }
      signals.addAll(requestedPorts);

      Map<Signal, Fragment.Direction> ports = new LinkedHashMap<>();
      for (Signal signal : domainSignals) {
        if (!driverDomains.containsKey(signal))
          ports.put(signal, Fragment.Direction.IN);
      }
      for (Signal signal : readSignals) {
        if (!driverDomains.containsKey(signal))
          ports.put(signal, Fragment.Direction.IN);
      }
      for (Signal signal : requestedPorts) {
        if (!driverDomains.containsKey(signal))
          ports.put(signal, Fragment.Direction.IN);
      }
      for (Signal signal : requestedPorts) {
        if (driverDomains.containsKey(signal))
          ports.put(signal, Fragment.Direction.OUT);
      }

      Fragment fragment = new Fragment(ports, fragmentDomains, statements, signals, combUnits, driverDomains, diagnostics);
      logger.debug("Elaborated {}: {}", root.path, fragment);
      return fragment;
    }

    Node buildHierarchy(Elaboratable elaboratable, String name, Node parent, Map<String, String> renames, Set<Module> seen)
        throws ElaborationException {
      Module module = elaboratable.elaborate();
      if (module == null)
        throw new ElaborationException("elaborate() of " + elaboratable + " returned no module", List.of(), null, null);
      String path = parent == null ? module.getName() : parent.path + "." + name;
      if (!seen.add(module))
        throw new ElaborationException("Module " + module.getName() + " is instantiated more than once (again at " + path + ")", List.of(),
                                       null, null);
      Node node = new Node(path, module, parent, renames);
      drc.checkResetDisciplines(path, module.getDomains().values());
      for (Module.Submodule submodule : module.getSubmodules())
        node.children.add(buildHierarchy(submodule.elaboratable(), submodule.name(), node, submodule.renames(), seen));
      return node;
    }

    void propagateDomainsUp(Node node) throws DomainConflictException {
      for (Node child : node.children)
        propagateDomainsUp(child);
      Map<String, ClockDomain> own = node.module.getDomains();
      node.defined.putAll(own);
      own.forEach((name, domain) -> {
        if (!domain.isLocal()) {
          node.exported.put(name, domain);
          node.exportedBy.put(name, node.path);
        }
      });
      for (Node child : node.children) {
        for (Map.Entry<String, ClockDomain> entry : child.exported.entrySet()) {
          String outerName = child.renames.getOrDefault(entry.getKey(), entry.getKey());
          String definer = child.exportedBy.get(entry.getKey());
          if (own.containsKey(outerName)) {
            throw conflict(String.format("Domain '%s' is defined by module %s and by its submodule %s", outerName, node.path, definer),
                           outerName);
          }
          ClockDomain existing = node.exported.get(outerName);
          if (existing != null && existing != entry.getValue()) {
            throw conflict(String.format("Domain '%s' is defined by submodules %s and %s of module %s; rename the domain of one of them",
                                         outerName, node.exportedBy.get(outerName), definer, node.path),
                           outerName);
          }
          node.defined.put(outerName, entry.getValue());
          node.exported.put(outerName, entry.getValue());
          node.exportedBy.put(outerName, definer);
        }
      }
    }

    private DomainConflictException conflict(String message, String domain) {
      logger.error(message);
      return new DomainConflictException(message, List.of(), null, domain);
    }

    /** Looks a domain name up from a module, walking up the enclosing scopes. */
    ResolvedDomain resolve(Node node, String name) throws DomainConflictException {
      Node current = node;
      String currentName = name;
      while (true) {
        ClockDomain domain = current.defined.get(currentName);
        if (domain != null)
          return register(domain);
        if (current.parent == null)
          break;
        currentName = current.renames.getOrDefault(currentName, currentName);
        current = current.parent;
      }
      if (!config.create_missing_domains)
        throw conflict(String.format("Domain '%s' is used by module %s but not defined", currentName, node.path), currentName);
      ClockDomain created = new ClockDomain(currentName);
      root.defined.put(currentName, created);
      String note = String.format("Created missing domain '%s' (first used by module %s)", currentName, node.path);
      logger.debug(note);
      diagnostics.add(note);
      return register(created);
    }

    /** Assigns a fragment-wide unique name to a domain on first use. */
    private ResolvedDomain register(ClockDomain domain) {
      String uniqueName = uniqueNames.get(domain);
      if (uniqueName == null) {
        uniqueName = domain.getName();
        for (int i = 1; fragmentDomains.containsKey(uniqueName); ++i)
          uniqueName = domain.getName() + "$" + i;
        uniqueNames.put(domain, uniqueName);
        fragmentDomains.put(uniqueName, uniqueName.equals(domain.getName()) ? domain : domain.renamed(uniqueName));
        if (!uniqueName.equals(domain.getName()))
          logger.debug("Local domain '{}' renamed to '{}' in the fragment", domain.getName(), uniqueName);
      }
      return new ResolvedDomain(uniqueName, fragmentDomains.get(uniqueName));
    }

    void lowerStatements(Node node, List<DomainStatements> out) throws ElaborationException {
      DomainLowerer lowerer = new DomainLowerer(name -> resolve(node, name), registers);
      for (String domain : node.module.usedDomains()) {
        List<Statement> statements = lowerer.lower(node.module.lower(domain));
        if (statements.isEmpty())
          continue;
        String fragmentDomain = ClockDomain.COMB.equals(domain) ? ClockDomain.COMB : resolve(node, domain).name();
        out.add(new DomainStatements(node.path, domain, fragmentDomain, statements));
      }
      for (Node child : node.children)
        lowerStatements(child, out);
    }
  }
}
