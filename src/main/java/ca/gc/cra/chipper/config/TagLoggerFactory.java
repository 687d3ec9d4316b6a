package ca.gc.cra.chipper.config;

import ca.gc.cra.chipper.application.port.ClockPort;
import ca.gc.cra.chipper.application.port.LineSink;
import ca.gc.cra.chipper.application.port.MetricsPort;
import ca.gc.cra.chipper.application.routing.Handler;
import ca.gc.cra.chipper.application.routing.TagLogger;
import ca.gc.cra.chipper.application.routing.Target;
import ca.gc.cra.chipper.domain.tag.TagSet;
import ca.gc.cra.chipper.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.chipper.infrastructure.target.LineSinks;
import ca.gc.cra.chipper.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.chipper.infrastructure.trace.StackWalkerTraceSource;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Composition root that turns a {@link LoggerDefinition} into a wired {@link TagLogger}.
 * <p><strong>Role:</strong> Adapter wiring; the only place that chooses concrete sinks, clock, trace source and
 * metrics.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve target definitions into shared {@link LineSinks} instances.</li>
 *   <li>Build and validate each handler, failing fast on template errors.</li>
 *   <li>Attach the system clock in the configured zone and stack-walking trace capture.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; invoked at startup.</p>
 *
 * @since 0.1.0
 */
public final class TagLoggerFactory {
  private static final Logger log = LoggerFactory.getLogger(TagLoggerFactory.class);

  private TagLoggerFactory() {
    // Utility
  }

  /**
   * Builds a logger with OpenTelemetry metrics (no-op unless an exporter is enabled).
   *
   * @param definition logger definition; must not be {@code null}
   * @return ready logger
   * @throws IllegalArgumentException if a handler name, tag or template is invalid
   */
  public static TagLogger create(LoggerDefinition definition) {
    return create(definition, new OpenTelemetryMetricsAdapter());
  }

  /**
   * Builds a logger reporting to the supplied metrics port.
   *
   * @param definition logger definition; must not be {@code null}
   * @param metrics metrics sink; {@code null} disables metrics
   * @return ready logger
   * @throws IllegalArgumentException if a handler name, tag or template is invalid
   */
  public static TagLogger create(LoggerDefinition definition, MetricsPort metrics) {
    Objects.requireNonNull(definition, "definition");
    ClockPort clock = definition.zoneId()
        .<ClockPort>map(SystemClockAdapter::new)
        .orElseGet(SystemClockAdapter::new);

    List<Handler> handlers = new ArrayList<>(definition.handlers().size());
    for (HandlerDefinition handler : definition.handlers()) {
      handlers.add(new Handler(
          handler.name(), TagSet.of(handler.tags()), handler.formatter(), target(handler.target())));
    }
    Handler defaultHandler = new Handler(
        LoggerDefinition.DEFAULT_HANDLER_NAME,
        TagSet.empty(),
        definition.defaultFormatter(),
        target(definition.defaultTarget()));

    TagLogger logger = TagLogger.builder()
        .handlers(handlers)
        .defaultHandler(defaultHandler)
        .routing(definition.routing())
        .clock(clock)
        .traceSource(new StackWalkerTraceSource())
        .metrics(metrics)
        .build();
    log.debug("Built tag logger with {} handler(s), default routing {}", handlers.size(), definition.routing());
    return logger;
  }

  /**
   * Builds the logger used when nothing was configured: no handlers and a stdout default handler.
   *
   * @return default logger
   */
  public static TagLogger defaultLogger() {
    return create(LoggerDefinition.defaults());
  }

  /**
   * Loads a YAML definition and builds the logger.
   *
   * @param path YAML file
   * @return ready logger
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the definition is invalid
   */
  public static TagLogger load(Path path) throws IOException {
    return create(YamlLoggerDefinitionLoader.load(path));
  }

  /**
   * Resolves a target definition into a target over shared sinks.
   *
   * @param definition declared destinations
   * @return target; {@link Target#none()} when nothing is declared
   */
  public static Target target(TargetDefinition definition) {
    Objects.requireNonNull(definition, "definition");
    if (definition.isEmpty()) {
      return Target.none();
    }
    List<LineSink> sinks = new ArrayList<>(3);
    if (!definition.filename().isEmpty()) {
      sinks.add(LineSinks.file(Path.of(definition.filename())));
    }
    if (definition.stdout()) {
      sinks.add(LineSinks.stdout());
    }
    if (definition.stderr()) {
      sinks.add(LineSinks.stderr());
    }
    return new Target(sinks);
  }
}
