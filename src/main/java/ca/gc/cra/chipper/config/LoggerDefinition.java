package ca.gc.cra.chipper.config;

import ca.gc.cra.chipper.application.routing.DefaultRouting;
import ca.gc.cra.chipper.domain.format.FormatterConfig;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Complete declarative configuration of a logger.
 * <p><strong>Role:</strong> Configuration record produced by {@link YamlLoggerDefinitionLoader} or by code, consumed
 * by {@link TagLoggerFactory}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param handlers handlers in evaluation order
 * @param defaultTarget destinations of the default handler
 * @param defaultFormatter formatter of the default handler
 * @param routing when the default handler fires
 * @param zone zone used to render timestamps; {@code null} means the system default
 * @since 0.1.0
 */
public record LoggerDefinition(
    List<HandlerDefinition> handlers,
    TargetDefinition defaultTarget,
    FormatterConfig defaultFormatter,
    DefaultRouting routing,
    ZoneId zone) {

  /** Name given to the built-in default handler. */
  public static final String DEFAULT_HANDLER_NAME = "default";

  public LoggerDefinition {
    handlers = List.copyOf(Objects.requireNonNull(handlers, "handlers"));
    Objects.requireNonNull(defaultTarget, "defaultTarget");
    Objects.requireNonNull(defaultFormatter, "defaultFormatter");
    Objects.requireNonNull(routing, "routing");
  }

  /**
   * Returns the definition of a logger with no handlers and a stdout default handler.
   *
   * @return default definition
   */
  public static LoggerDefinition defaults() {
    return new LoggerDefinition(
        List.of(), TargetDefinition.stdoutOnly(), FormatterConfig.defaultHandler(), DefaultRouting.ALWAYS, null);
  }

  public Optional<ZoneId> zoneId() {
    return Optional.ofNullable(zone);
  }

  /**
   * Finds a handler definition by name, including {@value #DEFAULT_HANDLER_NAME} for the default handler.
   *
   * @param name handler name
   * @return matching definition
   */
  public Optional<HandlerDefinition> handler(String name) {
    if (DEFAULT_HANDLER_NAME.equals(name)) {
      return Optional.of(new HandlerDefinition(DEFAULT_HANDLER_NAME, List.of(), defaultTarget, defaultFormatter));
    }
    return handlers.stream().filter(h -> h.name().equals(name)).findFirst();
  }
}
