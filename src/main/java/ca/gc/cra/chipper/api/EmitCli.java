package ca.gc.cra.chipper.api;

import ca.gc.cra.chipper.application.routing.TagLogger;
import ca.gc.cra.chipper.config.LoggerDefinition;
import ca.gc.cra.chipper.config.TagLoggerFactory;
import ca.gc.cra.chipper.domain.tag.TagSet;
import ca.gc.cra.chipper.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.chipper.infrastructure.target.LineSinks;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code chipper emit}: routes one message through a configured logger.
 *
 * @since 0.1.0
 */
final class EmitCli {
  private static final Logger log = LoggerFactory.getLogger(EmitCli.class);
  private static final Set<String> KEYS = Set.of(
      CommandSupport.CONFIG, CommandSupport.TAGS, CommandSupport.NAME, CommandSupport.MESSAGE);
  static final String SUMMARY_USAGE =
      "usage: chipper emit [config=PATH] [tags=a,b|name=a_b] message=TEXT";
  static final String HELP_TEXT = """
      chipper emit

      Usage:
        chipper emit [config=PATH] [tags=a,b|name=a_b] message=TEXT

      Options:
        config=PATH   YAML logger definition (default: no handlers, default handler on stdout)
        tags=a,b      Comma separated emission tags
        name=a_b      Tag name split on '_', e.g. general_info
        message=TEXT  Message to emit (required)

      Untagged messages are routed under the 'default' tag. Including 'trace' adds call-site details.
      """;

  private EmitCli() {}

  /**
   * Runs the command.
   *
   * @param args options after the {@code emit} token
   * @return exit status
   */
  static ExitCode run(List<String> args) {
    Map<String, String> options;
    TagSet tags;
    String message;
    try {
      options = CliArgsParser.toMap(args, KEYS);
      tags = CommandSupport.tags(options);
      message = CommandSupport.message(options);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    LoggerDefinition definition;
    try {
      definition = CommandSupport.definition(options);
    } catch (IOException ex) {
      log.error("Unable to read logger definition: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid logger definition: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      TagLogger logger = TagLoggerFactory.create(definition, metrics);
      logger.emit(message, tags);
      log.debug("Emitted message tagged {}", tags.orDefault());
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid logger definition: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while emitting", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      LineSinks.closeFiles();
    }
  }
}
