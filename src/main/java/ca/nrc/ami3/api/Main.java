package ca.nrc.ami3.api;

import ca.nrc.ami3.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * AMI3 CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: ami3 <run|inspect> [options]";
  private static final String HELP_TEXT = """
      AMI3 level-3 pipeline

      Usage:
        ami3 <command> [options]

      Commands:
        run       Process an association (run --help for details)
        inspect   Print an association grouped by role with its phase plan

      Global flags:
        --help    Show this message
        --verbose Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * <p>The first argument that is neither a flag nor {@code key=value} names the command; every other
   * argument, flags included, is forwarded to it.</p>
   *
   * @param args dispatcher arguments
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    String command = null;
    List<String> delegateArgs = new ArrayList<>();
    if (args != null) {
      for (String arg : args) {
        if (command == null && arg != null && isCommandToken(arg.trim())) {
          command = arg.trim().toLowerCase(Locale.ROOT);
        } else if (arg != null) {
          delegateArgs.add(arg);
        }
      }
    }

    CliInput input = CliInput.parse(delegateArgs.toArray(String[]::new));
    if (command == null) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String[] forwarded = delegateArgs.toArray(String[]::new);
    return switch (command) {
      case "run" -> RunCli.run(forwarded);
      case "inspect" -> InspectCli.run(forwarded);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static boolean isCommandToken(String arg) {
    return !arg.isEmpty() && !arg.startsWith("-") && !arg.contains("=") && !arg.equalsIgnoreCase("help");
  }
}
