package rtlcore.ui;

import java.io.IOException;
import java.io.PrintStream;
import java.math.BigInteger;
import java.util.Map;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import org.yaml.snakeyaml.error.YAMLException;
import rtlcore.hdl.ElaborationException;
import rtlcore.hdl.Signal;
import rtlcore.ir.Elaborator;
import rtlcore.ir.Fragment;
import rtlcore.sim.SimulationException;
import rtlcore.sim.Simulator;
import rtlcore.sim.TraceRecorder;

public class RTLCoreCmd {
  // logging
  protected static Logger logger = null;

  // options for cmdline parser
  static Options options = new Options();

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelpAndExit(Options options) {
    helper.printHelp("rtlcorecmd - elaborate and simulate a bundled demo design", options);
    System.exit(-1);
  };

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stdout writing
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stdout")));
    // initialize logging and generate logger for current class
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    CommandLineParser parser = new DefaultParser();
    Map<String, Demo> demos = Demo.all();

    options.addOption(Option.builder("d")
                          .longOpt("design")
                          .argName("design name")
                          .hasArg()
                          .required(true)
                          .desc("Demo design to simulate. Must be one of: " + demos.keySet())
                          .build());
    options.addOption(Option.builder("t")
                          .longOpt("ticks")
                          .argName("ticks")
                          .hasArg()
                          .required(false)
                          .desc("Number of time ticks to simulate (default 20)")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML file with elaboration and simulation options")
                          .build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());

    //////////   collect options   //////////
    String designName = "";
    long ticks = 20;
    RTLCoreConfig config = new RTLCoreConfig();
    try {
      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      // print help if requested
      if (line.hasOption("h")) {
        printHelpAndExit(options);
      }

      designName = line.getOptionValue("d");
      if (line.hasOption("t"))
        ticks = Long.parseLong(line.getOptionValue("t"));

      // set verbosity of printing
      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);

      if (line.hasOption("c")) {
        try {
          config = RTLCoreConfig.loadFile(line.getOptionValue("c"));
          logger.debug("Loaded configuration: {}", config);
        } catch (IOException | YAMLException e) {
          logger.error("Configuration file could not be read: {}", e.getMessage());
          printHelpAndExit(options);
        }
      }
    } catch (ParseException | NumberFormatException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelpAndExit(options);
    }

    Demo demo = demos.get(designName);
    if (demo == null) {
      logger.error("Unknown design '{}'. Available designs: {}", designName, demos.keySet());
      printHelpAndExit(options);
      return;
    }
    logger.info("Simulating {}: {}", designName, demo.getDescription());

    boolean success = simulate(demo, ticks, config, System.out);
    System.exit(success ? 0 : 1);
  }

  /**
   * Elaborates and simulates a demo, printing the value-change trace.
   * @return false if elaboration or simulation failed
   */
  static boolean simulate(Demo demo, long ticks, RTLCoreConfig config, PrintStream out) {
    if (logger == null)
      logger = LogManager.getLogger();
    Fragment fragment;
    try {
      fragment = new Elaborator(config).elaborate(demo.getDesign(), demo.getPorts());
    } catch (ElaborationException e) {
      logger.fatal("Elaboration failed: {}", e.getMessage());
      return false;
    }
    fragment.getDiagnostics().forEach(note -> logger.info(note));

    TraceRecorder trace = new TraceRecorder();
    try (Simulator sim = new Simulator(fragment, config)) {
      sim.addListener(trace);
      demo.setUp(sim, fragment);
      sim.runFor(ticks);
      for (Map.Entry<Signal, BigInteger> entry : sim.snapshot().entrySet())
        logger.debug("final {} = {}", entry.getKey().getName(), entry.getValue());
    } catch (SimulationException e) {
      logger.fatal("Simulation failed: {}", e.getMessage());
      out.print(trace.toText());
      return false;
    }
    out.print(trace.toText());
    return true;
  }
}
