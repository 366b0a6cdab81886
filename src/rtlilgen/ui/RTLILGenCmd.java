package rtlilgen.ui;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import rtlilgen.backend.RTLIL;
import rtlilgen.frontend.Design;
import rtlilgen.frontend.DesignFormatException;
import rtlilgen.frontend.DesignYamlReader;

public class RTLILGenCmd {
  // logging
  protected static Logger logger = null;

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelp(Options options) {
    helper.printHelp("rtlilgen - convert a YAML design description to RTLIL", options);
  }

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stderr writing, stdout may carry the RTLIL output
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stderr", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_ERR);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.INFO).add(builder.newAppenderRef("Stderr")));
    Configurator.initialize(builder.build());

    System.exit(run(args, System.out));
  }

  static Options buildOptions() {
    Options options = new Options();
    options.addOption(Option.builder("d")
                          .longOpt("design")
                          .argName("design.yaml")
                          .hasArg()
                          .required(true)
                          .desc("YAML file describing the design to convert")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("output")
                          .argName("file.il")
                          .hasArg()
                          .required(false)
                          .desc("File to write the RTLIL to; stdout if not given")
                          .build());
    options.addOption(Option.builder("t")
                          .longOpt("top")
                          .argName("module name")
                          .hasArg()
                          .required(false)
                          .desc("Name of the top module, overrides the name in the design file")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML file with tool options (generator, top_name, emit_src)")
                          .build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());
    return options;
  }

  /**
   * Runs the tool.
   * @param args command line arguments
   * @param out destination of the RTLIL text if no output file is given
   * @return the process exit status: 0 on success, 1 if the design could not be converted, 2 on usage errors
   */
  public static int run(String[] args, PrintStream out) {
    logger = LogManager.getLogger();
    Options options = buildOptions();
    CommandLineParser parser = new DefaultParser();

    // help does not need the otherwise required options
    if (Arrays.asList(args).contains("-h") || Arrays.asList(args).contains("--help")) {
      printHelp(options);
      return 0;
    }

    //////////   collect options   //////////
    CommandLine line;
    try {
      // parse the command line arguments
      line = parser.parse(options, args);
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelp(options);
      return 2;
    }
    // set verbosity of printing
    Level logLvl = Level.INFO;
    if (line.hasOption("q"))
      logLvl = Level.OFF;
    if (line.hasOption("v"))
      logLvl = Level.DEBUG;
    if (line.hasOption("vv"))
      logLvl = Level.TRACE;
    Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);

    RTLILGenConfig cfg = new RTLILGenConfig();
    if (line.hasOption("c")) {
      try {
        cfg = parseConfig(new File(line.getOptionValue("c")));
      } catch (IOException | YAMLException e) {
        logger.error("Cannot read config file {}: {}", line.getOptionValue("c"), e.getMessage());
        return 1;
      }
    }

    //////////   read and convert the design   //////////
    Design design;
    try {
      design = new DesignYamlReader().read(new File(line.getOptionValue("d")));
    } catch (DesignFormatException e) {
      logger.error("Invalid design description: {}", e.getMessage());
      return 1;
    }
    String topName = line.hasOption("t") ? line.getOptionValue("t") : design.name();

    String rtlil;
    try {
      rtlil = RTLIL.convert(design.top(), topName, design.ports(), cfg);
    } catch (UnsupportedOperationException | IllegalArgumentException | IllegalStateException e) {
      logger.error("Conversion failed: {}", e.getMessage());
      logger.debug("Conversion failure details", e);
      return 1;
    }

    if (line.hasOption("o")) {
      File outFile = new File(line.getOptionValue("o"));
      try {
        Files.writeString(outFile.toPath(), rtlil, StandardCharsets.UTF_8);
      } catch (IOException e) {
        logger.error("Cannot write {}: {}", outFile, e.getMessage());
        return 1;
      }
      logger.info("Wrote RTLIL to {}", outFile);
    } else {
      out.print(rtlil);
      out.flush();
    }
    return 0;
  }

  /** Loads tool options; keys not present in the file keep their defaults. */
  public static RTLILGenConfig parseConfig(File configFile) throws IOException {
    try (InputStream in = new FileInputStream(configFile)) {
      RTLILGenConfig cfg = new Yaml().loadAs(in, RTLILGenConfig.class);
      return cfg != null ? cfg : new RTLILGenConfig();
    }
  }
}
