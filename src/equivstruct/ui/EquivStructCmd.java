package equivstruct.ui;

import equivstruct.EquivStruct;
import equivstruct.util.NetlistFormatException;
import java.io.IOException;
import java.util.Arrays;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;

public class EquivStructCmd {
  // logging
  protected static Logger logger = LogManager.getLogger();

  // options for cmdline parser
  static Options options = buildOptions();

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelpAndExit(Options options) {
    helper.printHelp("equivstruct - add $equiv cells for structurally equivalent gold/gate cells and merge duplicates", options);
    System.exit(-1);
  };

  static Options buildOptions() {
    Options options = new Options();
    options.addOption(Option.builder("i")
                          .longOpt("input")
                          .argName("netlist.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML netlist containing the gold and gate circuits and the initial $equiv cells")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("output")
                          .argName("netlist.yaml")
                          .hasArg()
                          .required(false)
                          .desc("File to write the modified netlist to; nothing is written if not set")
                          .build());
    options.addOption(Option.builder("m")
                          .longOpt("module")
                          .argName("module")
                          .hasArg()
                          .required(false)
                          .desc("Only process the given module (repeatable); all modules by default")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("cell")
                          .argName("cell")
                          .hasArg()
                          .required(false)
                          .desc("Only consider the given cell of the selected module (repeatable)")
                          .build());
    options.addOption(Option.builder("fwd")
                          .required(false)
                          .desc("By default this command performs forward sweeps until nothing can be merged by forward sweeps, "
                                + "then backward sweeps until forward sweeps are effective again. With this option set only forward "
                                + "sweeps are requested (see -nobwd)")
                          .build());
    options.addOption(Option.builder("nobwd").required(false).desc("Skip backward sweeps").build());
    options.addOption(Option.builder("icells")
                          .required(false)
                          .desc("By default, the internal RTL and gate cell types are ignored. Add this option to also process those cell "
                                + "types with this command")
                          .build());
    options.addOption(Option.builder("g")
                          .longOpt("gold-suffix")
                          .argName("suffix")
                          .hasArg()
                          .required(false)
                          .desc("Prefer cells with this name suffix as merge survivors (e.g. _gold; by default the first cell of a group survives)")
                          .build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());
    return options;
  }

  /**
   * Translates a parsed command line into a config object.
   * @param line the parsed command line
   * @return the config
   * @throws ParseException if no input file is given
   */
  static EquivStructConfig toConfig(CommandLine line) throws ParseException {
    EquivStructConfig cfg = new EquivStructConfig();
    if (!line.hasOption("i"))
      throw new ParseException("Missing required option: i");
    cfg.input_file = line.getOptionValue("i");
    cfg.output_file = line.getOptionValue("o", "");
    if (line.hasOption("m"))
      cfg.modules.addAll(Arrays.asList(line.getOptionValues("m")));
    if (line.hasOption("c")) {
      cfg.cells.addAll(Arrays.asList(line.getOptionValues("c")));
      if (cfg.modules.size() != 1)
        throw new ParseException("-c requires exactly one -m");
    }
    cfg.mode_fwd = line.hasOption("fwd");
    cfg.mode_icells = line.hasOption("icells");
    cfg.backward_phase = !line.hasOption("nobwd");
    cfg.gold_suffix = line.getOptionValue("g", cfg.gold_suffix);
    return cfg;
  }

  static Level toLogLevel(CommandLine line) {
    Level logLvl = Level.INFO;
    if (line.hasOption("q"))
      logLvl = Level.OFF;
    if (line.hasOption("v"))
      logLvl = Level.DEBUG;
    if (line.hasOption("vv"))
      logLvl = Level.TRACE;
    return logLvl;
  }

  /**
   * Sends all pass messages to stdout. The root level stays OFF until the verbosity options are known.
   */
  static void initLogging() {
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    AppenderComponentBuilder console =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    console.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    builder.add(console);
    builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stdout")));
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();
  }

  /**
   * Parses the arguments and applies the verbosity options.
   * @return the config, or null if only the help text was requested
   * @throws ParseException on unknown or inconsistent options
   */
  static EquivStructConfig parseArgs(String[] args) throws ParseException {
    CommandLine line = new DefaultParser().parse(options, args);
    if (line.hasOption("h"))
      return null;
    EquivStructConfig cfg = toConfig(line);
    Configurator.setAllLevels(LogManager.getRootLogger().getName(), toLogLevel(line));
    return cfg;
  }

  /**
   * Reads, processes and writes the netlist named by the config.
   * @return the exit status: 0 on success, 1 if the netlist could not be read or written
   */
  static int run(EquivStructConfig cfg) {
    try {
      new EquivStruct(cfg).run();
      return 0;
    } catch (IOException e) {
      logger.error("Cannot access netlist file: {}", e.getMessage());
    } catch (NetlistFormatException e) {
      logger.error("Cannot read netlist {} at '{}': {}", cfg.input_file, e.getLocation(), e.getMessage());
    }
    return 1;
  }

  // entrypoint
  public static void main(String[] args) {
    initLogging();

    EquivStructConfig cfg = null;
    try {
      cfg = parseArgs(args);
    } catch (ParseException exp) {
      System.err.println(exp.getMessage());
      printHelpAndExit(options);
      return;
    }
    if (cfg == null)
      printHelpAndExit(options);

    System.exit(run(cfg));
  }
}
