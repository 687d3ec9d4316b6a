package ca.gc.cra.chipper.application.routing;

import ca.gc.cra.chipper.application.port.ClockPort;
import ca.gc.cra.chipper.application.port.MetricsPort;
import ca.gc.cra.chipper.application.port.TraceSource;
import ca.gc.cra.chipper.domain.emission.Emission;
import ca.gc.cra.chipper.domain.emission.TraceInfo;
import ca.gc.cra.chipper.domain.tag.TagSet;
import ca.gc.cra.chipper.logging.Logs;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Entry point that routes tagged emissions to subscribed handlers.
 * <p><strong>Why:</strong> Replaces a fixed severity ladder with free-form tags; every handler whose subscription
 * overlaps the emission's tags renders and writes its own line.</p>
 * <p><strong>Role:</strong> Application use case; long-lived and read-only after construction.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Normalize tags, synthesizing {@code default} for untagged emissions.</li>
 *   <li>Capture call-site details when the {@code trace} tag is present.</li>
 *   <li>Deliver to every matching handler, then to the default handler per {@link DefaultRouting}.</li>
 *   <li>Isolate per-handler failures so one broken sink never silences the others.</li>
 *   <li>Resolve tag names such as {@code general_info} into tag sets.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent emissions; handler state is immutable and sinks serialize
 * their own writes.</p>
 * <p><strong>Observability:</strong> Handler failures are logged at WARN through SLF4J and counted as
 * {@code chipper.handler.failed}; the number of successful writes per emission is observed as
 * {@code chipper.emit.fanout}.</p>
 *
 * @since 0.1.0
 * @see BoundTagLogger
 */
public final class TagLogger {
  private static final Logger log = LoggerFactory.getLogger(TagLogger.class);
  private static final int PREVIEW_BYTES = 256;

  /** Names of real operations that cannot be used as tag names. */
  public static final Set<String> RESERVED_NAMES =
      Set.of("log", "emit", "invoke", "bind", "tagged", "handlers");

  private final List<Handler> handlers;
  private final Handler defaultHandler;
  private final DefaultRouting routing;
  private final ClockPort clock;
  private final TraceSource traceSource;
  private final MetricsPort metrics;

  private TagLogger(Builder builder) {
    this.handlers = List.copyOf(builder.handlers);
    this.defaultHandler = builder.defaultHandler;
    this.routing = builder.routing;
    this.clock = builder.clock;
    this.traceSource = builder.traceSource;
    this.metrics = builder.metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Emits an untagged message; it is routed under the {@code default} tag.
   *
   * @param message message text
   */
  public void log(String message) {
    emit(message, TagSet.empty(), null);
  }

  /**
   * Emits a message with explicit tags.
   *
   * @param message message text
   * @param tags tag tokens in call order; none means {@code default}
   * @throws ca.gc.cra.chipper.domain.tag.InvalidTagException if a token is malformed
   */
  public void log(String message, String... tags) {
    emit(message, TagSet.of(tags), null);
  }

  /**
   * Emits a message with explicit tags and an exception. The exception's stack trace is appended after the message
   * only when the tags include {@code trace}.
   *
   * @param message message text
   * @param error exception to report; may be {@code null}
   * @param tags tag tokens in call order
   * @throws ca.gc.cra.chipper.domain.tag.InvalidTagException if a token is malformed
   */
  public void log(String message, Throwable error, String... tags) {
    emit(message, TagSet.of(tags), error);
  }

  /**
   * Emits a message with a prepared tag set.
   *
   * @param message message text
   * @param tags tags of the emission; empty means {@code default}
   */
  public void emit(String message, TagSet tags) {
    emit(message, tags, null);
  }

  /**
   * Core dispatch: matches, renders and writes.
   *
   * @param message message text; {@code null} renders as empty
   * @param tags tags of the emission; empty means {@code default}
   * @param error optional exception appended when tracing
   */
  public void emit(String message, TagSet tags, Throwable error) {
    Objects.requireNonNull(tags, "tags");
    TagSet effective = tags.orDefault();
    metrics.increment("chipper.emit.count");

    TraceInfo trace = null;
    if (effective.requestsTrace()) {
      trace = captureTrace();
      if (error != null) {
        trace = trace.withException(stackTrace(error));
      }
    }
    Emission emission = new Emission(message, effective, clock.now(), trace);

    List<TagSet> claimed = new ArrayList<>(handlers.size());
    int delivered = 0;
    for (Handler handler : handlers) {
      TagSet matched = effective.intersection(handler.subscription());
      if (matched.isEmpty()) {
        continue;
      }
      claimed.add(matched);
      if (deliver(handler, emission.withTags(matched), "chipper.handler.delivered")) {
        delivered++;
      }
    }

    switch (routing) {
      case ALWAYS -> {
        if (deliver(defaultHandler, emission, "chipper.default.delivered")) {
          delivered++;
        }
      }
      case UNMATCHED -> {
        TagSet remaining = effective.without(claimed);
        if (!remaining.isEmpty()
            && deliver(defaultHandler, emission.withTags(remaining), "chipper.default.delivered")) {
          delivered++;
        }
      }
      case DISABLED -> log.trace("Default handler disabled; skipped emission tagged {}", effective);
    }
    metrics.observe("chipper.emit.fanout", delivered);
  }

  /**
   * Emits using tags derived from a name such as {@code general_info}.
   *
   * @param name underscore-delimited tag name; must not equal a {@linkplain #RESERVED_NAMES reserved operation}
   * @param message message text
   * @throws IllegalArgumentException if the name is reserved or yields malformed tags
   */
  public void invoke(String name, String message) {
    emit(message, resolveName(name), null);
  }

  /**
   * Emits using tags derived from a name, attaching an exception.
   *
   * @param name underscore-delimited tag name
   * @param message message text
   * @param error optional exception appended when the name includes {@code trace}
   * @throws IllegalArgumentException if the name is reserved or yields malformed tags
   */
  public void invoke(String name, String message, Throwable error) {
    emit(message, resolveName(name), error);
  }

  /**
   * Returns a logger bound to the tags encoded in {@code name}.
   *
   * @param name underscore-delimited tag name
   * @return bound logger taking only the message
   * @throws IllegalArgumentException if the name is reserved or yields malformed tags
   */
  public BoundTagLogger tagged(String name) {
    return new BoundTagLogger(this, resolveName(name));
  }

  /**
   * Returns a logger bound to explicit tags.
   *
   * @param tags tag tokens
   * @return bound logger taking only the message
   * @throws ca.gc.cra.chipper.domain.tag.InvalidTagException if a token is malformed
   */
  public BoundTagLogger bind(String... tags) {
    return new BoundTagLogger(this, TagSet.of(tags));
  }

  /**
   * Resolves a tag name into a tag set.
   *
   * @param name underscore-delimited tag name; must not be {@code null}
   * @return derived tag set, possibly empty
   * @throws IllegalArgumentException if the name collides with a real operation
   */
  public static TagSet resolveName(String name) {
    Objects.requireNonNull(name, "name");
    if (RESERVED_NAMES.contains(name.toLowerCase(Locale.ROOT))) {
      throw new IllegalArgumentException("'" + name + "' is a logger operation, not a tag name");
    }
    return TagSet.fromName(name);
  }

  public List<Handler> handlers() {
    return handlers;
  }

  public Handler defaultHandler() {
    return defaultHandler;
  }

  public DefaultRouting routing() {
    return routing;
  }

  private boolean deliver(Handler handler, Emission emission, String deliveredMetric) {
    try {
      handler.deliver(emission);
      metrics.increment(deliveredMetric);
      return true;
    } catch (SinkWriteException ex) {
      metrics.increment("chipper.handler.failed");
      log.warn("Handler '{}' could not write emission {} ({}): {}",
          handler.name(), emission.tags(), Logs.truncate(emission.message(), PREVIEW_BYTES), ex.getMessage(), ex);
      return false;
    } catch (RuntimeException ex) {
      metrics.increment("chipper.handler.failed");
      log.warn("Handler '{}' failed to render emission {} ({})",
          handler.name(), emission.tags(), Logs.truncate(emission.message(), PREVIEW_BYTES), ex);
      return false;
    }
  }

  private TraceInfo captureTrace() {
    try {
      TraceInfo info = traceSource.capture();
      return info == null ? TraceInfo.unknown() : info;
    } catch (RuntimeException ex) {
      metrics.increment("chipper.trace.degraded");
      log.debug("Trace capture failed; rendering empty trace fields", ex);
      return TraceInfo.unknown();
    }
  }

  private static String stackTrace(Throwable error) {
    StringWriter buffer = new StringWriter(512);
    try (PrintWriter writer = new PrintWriter(buffer)) {
      error.printStackTrace(writer);
    }
    return buffer.toString().stripTrailing();
  }

  /**
   * Builder for {@link TagLogger}. Not thread-safe; build once at startup.
   */
  public static final class Builder {
    private final List<Handler> handlers = new ArrayList<>();
    private Handler defaultHandler;
    private DefaultRouting routing = DefaultRouting.ALWAYS;
    private ClockPort clock = ClockPort.SYSTEM;
    private TraceSource traceSource = TraceSource.NONE;
    private MetricsPort metrics = MetricsPort.NO_OP;

    private Builder() {}

    public Builder handler(Handler handler) {
      handlers.add(Objects.requireNonNull(handler, "handler"));
      return this;
    }

    public Builder handlers(List<Handler> values) {
      for (Handler handler : Objects.requireNonNull(values, "handlers")) {
        handler(handler);
      }
      return this;
    }

    public Builder defaultHandler(Handler handler) {
      this.defaultHandler = handler;
      return this;
    }

    public Builder routing(DefaultRouting value) {
      this.routing = Objects.requireNonNull(value, "routing");
      return this;
    }

    public Builder clock(ClockPort value) {
      this.clock = Objects.requireNonNull(value, "clock");
      return this;
    }

    public Builder traceSource(TraceSource value) {
      this.traceSource = Objects.requireNonNull(value, "traceSource");
      return this;
    }

    public Builder metrics(MetricsPort value) {
      this.metrics = value == null ? MetricsPort.NO_OP : value;
      return this;
    }

    /**
     * Builds the logger.
     *
     * @return immutable logger
     * @throws IllegalStateException if no default handler was supplied and routing is not {@link DefaultRouting#DISABLED}
     */
    public TagLogger build() {
      if (defaultHandler == null && routing != DefaultRouting.DISABLED) {
        throw new IllegalStateException("default handler required unless routing is DISABLED");
      }
      for (Handler handler : handlers) {
        if (handler.subscription().isEmpty()) {
          log.warn("Handler '{}' has an empty subscription and will never match", handler.name());
        }
      }
      return new TagLogger(this);
    }
  }
}
