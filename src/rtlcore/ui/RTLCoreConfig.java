package rtlcore.ui;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Data-Class to hold elaboration and simulation options.
 */
public class RTLCoreConfig {

  /** Settle iterations per timestamp before the design is considered unstable. */
  public int max_delta_cycles = 1000;
  public boolean create_missing_domains = true;
  public boolean report_initial_values = true;
  /** Clock period in ticks used when a clock is added without an explicit period. */
  public int default_clock_period = 2;
  public boolean strict_driver_check = true;

  /**
   * Reads a configuration from YAML. Keys not present keep their default value, unknown keys are an error.
   */
  public static RTLCoreConfig load(Reader yaml) {
    Yaml parser = new Yaml(new Constructor(RTLCoreConfig.class, new LoaderOptions()));
    RTLCoreConfig config = parser.load(yaml);
    // An empty document yields null.
    return config != null ? config : new RTLCoreConfig();
  }
  public static RTLCoreConfig load(String yaml) { return load(new StringReader(yaml)); }
  public static RTLCoreConfig loadFile(String path) throws IOException {
    try (InputStream in = new FileInputStream(path)) {
      Yaml parser = new Yaml(new Constructor(RTLCoreConfig.class, new LoaderOptions()));
      RTLCoreConfig config = parser.load(in);
      return config != null ? config : new RTLCoreConfig();
    }
  }

  @Override
  public String toString() {
    return String.format("max_delta_cycles=%d create_missing_domains=%b report_initial_values=%b default_clock_period=%d "
                             + "strict_driver_check=%b",
                         max_delta_cycles, create_missing_domains, report_initial_values, default_clock_period, strict_driver_check);
  }
}
