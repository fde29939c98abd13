package ca.gc.cra.diagsink.api;

import ca.gc.cra.diagsink.logging.LoggingConfigurator;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * diagsink CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: diagsink <record|upload> [options]";
  private static final String HELP_TEXT = """
      diagsink command dispatcher

      Usage:
        diagsink <command> [options]

      Commands:
        record      Record latency events to rotating segments, upload on shutdown
        upload      Upload segments left in a directory by an earlier run

      Global flags:
        --help      Show this message
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
    CliInput input = CliInput.parse(args);
    Optional<String> command = input.command();
    if (input.help() && command.isEmpty()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (command.isEmpty()) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    return switch (command.get()) {
      case "record" -> RecordCli.run(input.commandArgs());
      case "upload" -> UploadCli.run(input.commandArgs());
      default -> {
        log.error("Unknown command: {}", command.get());
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
