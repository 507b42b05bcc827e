package ca.gc.cra.ctscan.api;

import ca.gc.cra.ctscan.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ctscan CLI dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: ctscan report [options]";
  private static final String HELP_TEXT = """
      ctscan command dispatcher

      Usage:
        ctscan <command> [options]

      Commands:
        report      Scan a certificate log and write results to the certificate store
                    (report --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    String[] tokens = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < tokens.length; i++) {
      if (tokens[i] != null && !tokens[i].isBlank() && !tokens[i].trim().startsWith("-")) {
        commandIndex = i;
        break;
      }
    }
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(tokens);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    CliInput globals = CliInput.parse(Arrays.copyOfRange(tokens, 0, commandIndex));
    if (globals.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    String command = tokens[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(tokens, commandIndex + 1, tokens.length);
    switch (command) {
      case "report":
        return ReportCli.run(delegateArgs);
      case "help":
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      default:
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
    }
  }
}
