package ca.gc.cra.chipper.api;

import ca.gc.cra.chipper.application.routing.Handler;
import ca.gc.cra.chipper.application.routing.Target;
import ca.gc.cra.chipper.config.HandlerDefinition;
import ca.gc.cra.chipper.config.LoggerDefinition;
import ca.gc.cra.chipper.domain.emission.Emission;
import ca.gc.cra.chipper.domain.emission.TraceInfo;
import ca.gc.cra.chipper.domain.tag.TagSet;
import ca.gc.cra.chipper.infrastructure.time.SystemClockAdapter;
import java.io.IOException;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code chipper render}: prints the line a single handler would write, without touching its target.
 * <p>Useful when tuning templates. {@code time=} pins the timestamp so output is reproducible.</p>
 *
 * @since 0.1.0
 */
final class RenderCli {
  private static final Logger log = LoggerFactory.getLogger(RenderCli.class);
  private static final String HANDLER = "handler";
  private static final String TIME = "time";
  private static final Set<String> KEYS = Set.of(
      CommandSupport.CONFIG, CommandSupport.TAGS, CommandSupport.NAME, CommandSupport.MESSAGE, HANDLER, TIME);
  static final String SUMMARY_USAGE =
      "usage: chipper render [config=PATH] [handler=NAME] [tags=a,b|name=a_b] [time=ISO] message=TEXT";
  static final String HELP_TEXT = """
      chipper render

      Usage:
        chipper render [config=PATH] [handler=NAME] [tags=a,b|name=a_b] [time=ISO] message=TEXT

      Options:
        config=PATH   YAML logger definition (default: built-in defaults)
        handler=NAME  Handler to render with (default: default)
        tags=a,b      Comma separated emission tags
        name=a_b      Tag name split on '_'
        time=ISO      Timestamp such as 2024-03-05T14:07:09-05:00 (default: now)
        message=TEXT  Message to render (required)

      Exit status 1 when the handler does not subscribe to any of the tags.
      """;

  private RenderCli() {}

  static ExitCode run(List<String> args) {
    Map<String, String> options;
    TagSet tags;
    String message;
    Optional<ZonedDateTime> pinned;
    try {
      options = CliArgsParser.toMap(args, KEYS);
      tags = CommandSupport.tags(options).orDefault();
      message = CommandSupport.message(options);
      pinned = parseTime(options.get(TIME));
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

    String handlerName = options.getOrDefault(HANDLER, LoggerDefinition.DEFAULT_HANDLER_NAME).trim();
    Optional<HandlerDefinition> found = definition.handler(handlerName);
    if (found.isEmpty()) {
      log.error("No handler named '{}'", handlerName);
      return ExitCode.INVALID_ARGS;
    }
    HandlerDefinition handlerDefinition = found.get();
    boolean isDefault = LoggerDefinition.DEFAULT_HANDLER_NAME.equals(handlerDefinition.name());

    try {
      Handler handler = new Handler(
          handlerDefinition.name(), TagSet.of(handlerDefinition.tags()), handlerDefinition.formatter(), Target.none());
      TagSet shown = isDefault ? tags : tags.intersection(handler.subscription());
      if (shown.isEmpty()) {
        log.warn("Handler '{}' does not subscribe to any of {}", handlerName, tags);
        return ExitCode.NOT_MATCHED;
      }
      ZonedDateTime timestamp = pinned.isPresent() ? pinned.get() : clockFor(definition).now();
      TraceInfo trace = tags.requestsTrace() ? new TraceInfo("", -1, RenderCli.class.getSimpleName() + ".run", "")
          : null;
      CliPrinter.print(handler.renderLine(new Emission(message, shown, timestamp, trace)));
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Handler '{}' cannot render: {}", handlerName, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
  }

  private static SystemClockAdapter clockFor(LoggerDefinition definition) {
    return definition.zone() == null ? new SystemClockAdapter() : new SystemClockAdapter(definition.zone());
  }

  private static Optional<ZonedDateTime> parseTime(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(ZonedDateTime.parse(raw.trim()));
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException("time must be an ISO-8601 zoned date-time (was '" + raw + "')", ex);
    }
  }
}
