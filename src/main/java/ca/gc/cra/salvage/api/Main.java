package ca.gc.cra.salvage.api;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Salvage CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: salvage <validate|decide|repair|run> [options]";
  private static final String HELP_TEXT = """
      salvage: image artifact integrity classification and repair

      Usage:
        salvage <command> [options]

      Commands:
        validate    Check and classify recovered artifacts; writes validation_report.json
        decide      Recommend a batch repair strategy; writes decision_report.json
        repair      Repair eligible artifacts into repaired/; writes repair_report.json
        run         validate, decide and repair in one go

      Global flags:
        --help      Show this message (or <command> --help for details)
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

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token names the command
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    String[] safe = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < safe.length; i++) {
      String arg = safe[i] == null ? "" : safe[i].trim();
      if (!arg.isEmpty() && !arg.startsWith("-")) {
        commandIndex = i;
        break;
      }
    }
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(safe);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = safe[commandIndex].trim().toLowerCase(Locale.ROOT);
    if (command.equals("help")) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    // Flags given before the command (e.g. --verbose validate ...) still reach it.
    String[] delegateArgs = new String[safe.length - 1];
    System.arraycopy(safe, 0, delegateArgs, 0, commandIndex);
    System.arraycopy(safe, commandIndex + 1, delegateArgs, commandIndex, safe.length - commandIndex - 1);

    return switch (command) {
      case "validate" -> ValidateCli.run(delegateArgs);
      case "decide" -> DecideCli.run(delegateArgs);
      case "repair" -> RepairCli.run(delegateArgs);
      case "run" -> RunCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
