package ca.gc.cra.pathtrace.api;

import ca.gc.cra.pathtrace.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PATHTRACE CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: pathtrace <trace|ingest|view> [options]";
  private static final String HELP_TEXT = """
      PATHTRACE command dispatcher

      Usage:
        pathtrace <command> [options]

      Commands:
        trace       Run traceroute against a target and append the run to its history file
        ingest      Parse previously captured traceroute output and append the run
        view        Report on a history file (info, hostnames, stats, table, map)

      Global flags:
        --help      Show this message (or <command> --help for command options)
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first token is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    if (args == null || args.length == 0) {
      log.error("Missing command");
      Console.line(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    Optional<CommandLine.Switch> leading = CommandLine.Switch.lookup(args[0]);
    if (leading.isPresent() && leading.get() == CommandLine.Switch.HELP) {
      Console.help(HELP_TEXT);
      return ExitCode.SUCCESS;
    }
    if (leading.isPresent() && leading.get() == CommandLine.Switch.VERBOSE) {
      LoggingConfigurator.enableVerboseLogging();
      return run(Arrays.copyOfRange(args, 1, args.length));
    }

    String command = args[0] == null ? "" : args[0].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(args, 1, args.length);

    return switch (command) {
      case "trace" -> TraceCli.run(delegateArgs);
      case "ingest" -> IngestCli.run(delegateArgs);
      case "view" -> ViewCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        Console.line(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
