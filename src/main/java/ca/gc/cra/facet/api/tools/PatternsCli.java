package ca.gc.cra.facet.api.tools;

import ca.gc.cra.facet.api.CliArgsParser;
import ca.gc.cra.facet.api.CliInput;
import ca.gc.cra.facet.api.CliPrinter;
import ca.gc.cra.facet.api.ConfigCliUtils;
import ca.gc.cra.facet.api.ExitCode;
import ca.gc.cra.facet.application.patterns.CaptureRole;
import ca.gc.cra.facet.application.patterns.PatternCompilationException;
import ca.gc.cra.facet.application.patterns.PatternDefinition;
import ca.gc.cra.facet.application.patterns.PatternLibrary;
import ca.gc.cra.facet.application.patterns.PatternLibraryProvider;
import ca.gc.cra.facet.application.patterns.Tier;
import ca.gc.cra.facet.config.ExtractConfig;
import ca.gc.cra.facet.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLI that builds the pattern library and prints it tier by tier, followed by any rejected patterns.
 *
 * <p>Used to check custom pattern files before running {@code facet extract} with {@code --strict}.</p>
 */
public final class PatternsCli {
  private static final Logger log = LoggerFactory.getLogger(PatternsCli.class);
  private static final String SUMMARY_USAGE =
      "usage: patterns [config=PATH] [patterns=FILES] [categories=LIST] [--strict]";
  private static final String HELP_TEXT = """
      FACET pattern table

      Usage:
        patterns [patterns=config/patterns.yaml] [categories=money,date]

      Options:
        config=PATH           YAML configuration with common/extract sections
        patterns=FILES        Comma-separated custom pattern files
        categories=LIST       Only show patterns for these categories

      Flags:
        --strict              Exit with CONFIG_ERROR when any pattern is rejected
        --verbose             Enable verbose logging
        --help                Show this message
      """;

  private PatternsCli() {}

  /**
   * Prints the tier table.
   *
   * @param args raw CLI arguments supplied by the dispatcher
   * @return {@link ExitCode#SUCCESS}, or the failure that stopped the library from loading
   */
  public static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.strip());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for patterns tool");
    }

    Map<String, String> options;
    try {
      options = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      CliPrinter.println(ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ExtractConfig config;
    try {
      config = ConfigCliUtils.resolve(input, options, log::warn);
    } catch (IllegalArgumentException ex) {
      CliPrinter.println(ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    PatternLibrary library;
    try {
      library = new PatternLibraryProvider().load(config.patternFiles(), config.categories(), config.strict());
    } catch (PatternCompilationException ex) {
      CliPrinter.println(ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      CliPrinter.println(ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Failed to read pattern files {}", config.patternFiles(), ex);
      return ExitCode.IO_ERROR;
    }

    for (Tier tier : Tier.values()) {
      List<PatternDefinition> patterns = library.patternsIn(tier);
      CliPrinter.println("Tier " + tier.rank() + " " + tier.name() + " (" + patterns.size() + ")");
      if (patterns.isEmpty()) {
        CliPrinter.println("  (none)");
      }
      for (PatternDefinition pattern : patterns) {
        CliPrinter.println(formatPattern(pattern));
      }
    }
    List<PatternLibrary.Rejection> rejections = library.rejections();
    if (!rejections.isEmpty()) {
      CliPrinter.println("Rejected (" + rejections.size() + ")");
      for (PatternLibrary.Rejection rejection : rejections) {
        CliPrinter.println("  " + rejection.patternName() + ": " + rejection.reason());
      }
    }
    CliPrinter.println("\n" + library.size() + " pattern(s) active for " + config.categoriesText() + ".");
    return ExitCode.SUCCESS;
  }

  private static String formatPattern(PatternDefinition pattern) {
    EnumSet<CaptureRole> roles = EnumSet.noneOf(CaptureRole.class);
    roles.addAll(pattern.captureRoles().keySet());
    String roleText = roles.stream().map(Enum::name).collect(Collectors.joining(","));
    return String.format("  %-36s %-12s [%s]%s", pattern.name(), pattern.category(), roleText,
        pattern.guard() == null ? "" : " guarded");
  }
}
