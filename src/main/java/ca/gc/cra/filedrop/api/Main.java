package ca.gc.cra.filedrop.api;

import ca.gc.cra.filedrop.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * FILEDROP CLI dispatcher that routes to the {@code server} and {@code upload} subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: filedrop <server|upload> [options]";
  private static final String HELP_TEXT = """
      FILEDROP department file drop

      Usage:
        filedrop <command> [options]

      Commands:
        server      Accept uploads into the department directories (server --help for details)
        upload      Send one file to a server (upload --help for details)

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
    String[] raw = args == null ? new String[0] : args;
    int commandIndex = firstCommandIndex(raw);
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(raw);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    CliInput globals = CliInput.parse(Arrays.copyOfRange(raw, 0, commandIndex));
    if (globals.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (globals.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = raw[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(raw, commandIndex + 1, raw.length);
    return switch (command) {
      case "server" -> ServerCli.run(delegateArgs);
      case "upload" -> UploadCli.run(delegateArgs);
      case "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static int firstCommandIndex(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i] == null ? "" : args[i].trim();
      if (!arg.isEmpty() && !arg.startsWith("-") && !arg.contains("=")) {
        return i;
      }
    }
    return -1;
  }
}
