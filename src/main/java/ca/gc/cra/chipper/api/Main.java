package ca.gc.cra.chipper.api;

import ca.gc.cra.chipper.logging.LoggingConfigurator;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chipper CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: chipper <emit|render> [options]";
  private static final String HELP_TEXT = """
      Chipper tag-routed logging

      Usage:
        chipper <command> [options]

      Commands:
        emit     Route a message through a logger definition (emit --help for details)
        render   Print the line a handler would write (render --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG diagnostics on stderr
        --quiet     Only report errors on stderr
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
   * @param args dispatcher arguments (first non-flag token is the subcommand)
   * @return exit code reported by the subcommand
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    List<String> options = input.options();
    String command = options.isEmpty() ? null : options.get(0).trim().toLowerCase(Locale.ROOT);

    if (input.help()) {
      CliPrinter.println(helpFor(command));
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    } else if (input.quiet()) {
      LoggingConfigurator.enableQuietLogging();
    }
    if (!input.unknownFlags().isEmpty()) {
      log.error("Unknown flag(s): {}", input.unknownFlags());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (command == null) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    List<String> delegateArgs = options.subList(1, options.size());
    return switch (command) {
      case "emit" -> EmitCli.run(delegateArgs);
      case "render" -> RenderCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String helpFor(String command) {
    String text;
    if ("emit".equals(command)) {
      text = EmitCli.HELP_TEXT;
    } else if ("render".equals(command)) {
      text = RenderCli.HELP_TEXT;
    } else {
      text = HELP_TEXT;
    }
    return text.stripTrailing();
  }
}
