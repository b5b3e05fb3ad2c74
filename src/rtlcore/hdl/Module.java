package rtlcore.hdl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A unit of hierarchy: statements per domain, locally declared clock domains and named submodules.
 * A module elaborates to itself.
 */
public class Module extends Block implements Elaboratable {

  /**
   * A child of a module.
   * @param name instance name, unique within the parent
   * @param elaboratable the child design
   * @param renames maps domain names used inside the child to domain names of the parent scope
   */
  public record Submodule(String name, Elaboratable elaboratable, Map<String, String> renames) {
    public Submodule {
      Objects.requireNonNull(elaboratable);
      renames = Collections.unmodifiableMap(new LinkedHashMap<>(renames));
    }
  }

  private final String name;
  private final LinkedHashMap<String, ClockDomain> domains = new LinkedHashMap<>();
  private final List<Submodule> submodules = new ArrayList<>();

  public Module(String name) { this.name = name; }
  public Module() { this("top"); }

  public String getName() { return name; }

  /**
   * Declares a clock domain in this module's scope.
   * @throws IllegalArgumentException if a domain with the same name is already declared here
   */
  public ClockDomain addDomain(ClockDomain domain) {
    if (domains.containsKey(domain.getName()))
      throw new IllegalArgumentException("Clock domain '" + domain.getName() + "' already exists in module " + name);
    domains.put(domain.getName(), domain);
    return domain;
  }

  public Module addSubmodule(String name, Elaboratable submodule) { return addSubmodule(name, submodule, Map.of()); }
  /**
   * Adds a named child. Domain names used inside the child are looked up in this module's scope after
   * applying the renames.
   * @throws IllegalArgumentException if the name is already taken by another submodule
   */
  public Module addSubmodule(String name, Elaboratable submodule, Map<String, String> renames) {
    for (Submodule existing : submodules) {
      if (existing.name().equals(name))
        throw new IllegalArgumentException("Submodule '" + name + "' already exists in module " + this.name);
    }
    for (String target : renames.values()) {
      if (ClockDomain.COMB.equals(target))
        throw new IllegalArgumentException("Cannot rename a clocked domain to '" + ClockDomain.COMB + "'");
    }
    submodules.add(new Submodule(name, submodule, renames));
    return this;
  }

  public Map<String, ClockDomain> getDomains() { return Collections.unmodifiableMap(domains); }
  public List<Submodule> getSubmodules() { return Collections.unmodifiableList(submodules); }

  @Override
  public Module elaborate() {
    return this;
  }

  @Override
  public String toString() {
    return "Module(" + name + ")";
  }
}
