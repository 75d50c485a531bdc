package ca.gc.cra.facet.api;

import ca.gc.cra.facet.api.tools.PatternsCli;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * FACET CLI dispatcher that routes to subcommands.
 *
 * @since FACET 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final Set<String> HELP_TOKENS = Set.of("--help", "-h", "help");
  private static final String SUMMARY_USAGE = "usage: facet <extract|patterns> [options]";
  private static final String HELP_TEXT = """
      FACET entity extraction

      Usage:
        facet <command> [options]

      Commands:
        extract     Extract dates, times, money, and measurements as NDJSON (extract --help for details)
        patterns    Print the pattern tier table and any rejected patterns

      Global flags:
        --help      Show this message
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  @SuppressFBWarnings(value = "DM_EXIT", justification = "CLI entry point reports its exit code to the shell.")
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first token names the subcommand
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    if (args == null || args.length == 0 || args[0] == null || args[0].isBlank()) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = args[0].trim().toLowerCase(Locale.ROOT);
    if (HELP_TOKENS.contains(command)) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    String[] delegateArgs = Arrays.copyOfRange(args, 1, args.length);
    return switch (command) {
      case "extract" -> ExtractCli.run(delegateArgs);
      case "patterns" -> PatternsCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
