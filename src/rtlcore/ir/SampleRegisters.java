package rtlcore.ir;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rtlcore.hdl.Assign;
import rtlcore.hdl.Signal;
import rtlcore.hdl.Statement;
import rtlcore.hdl.Value;

/**
 * Register chains created for sampled values. Each (domain, value) pair gets one chain, shared by all
 * samples of that value; the chain grows to the longest requested delay.
 */
public class SampleRegisters {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private record Key(String domain, Value value) {}

  private final Map<Key, List<Signal>> chains = new HashMap<>();
  private final Map<String, List<Statement>> statements = new LinkedHashMap<>();

  /**
   * Returns the register holding the value as it was the given number of edges ago.
   * @param value the sampled value, already free of domain references
   * @param domain the fragment name of the sampling domain
   * @param clocks delay in active edges, at least 1
   */
  public Signal get(Value value, String domain, int clocks) {
    List<Signal> chain = chains.computeIfAbsent(new Key(domain, value), key -> new ArrayList<>());
    while (chain.size() < clocks) {
      int stage = chain.size() + 1;
      Value input = stage == 1 ? value : chain.get(stage - 2);
      Signal.Builder builder = Signal.builder(registerName(value, stage), value.shape()).resetLess();
      if (value instanceof Signal)
        builder.reset(((Signal)value).getReset());
      Signal register = builder.build();
      chain.add(register);
      statements.computeIfAbsent(domain, d -> new ArrayList<>()).add(new Assign(register, input));
      logger.debug("Lowered sample of {} by {} edge(s) in domain '{}' to register {}", value, stage, domain, register.getName());
    }
    return chain.get(clocks - 1);
  }

  private static String registerName(Value value, int stage) {
    String base = value instanceof Signal ? ((Signal)value).getName() : "expr";
    return "$sample$" + base + "$" + stage;
  }

  /** The register update statements, keyed by fragment domain name. */
  public Map<String, List<Statement>> getStatements() { return statements; }
}
