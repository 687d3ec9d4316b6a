package ca.gc.cra.chipper.application.port;

/**
 * <strong>What:</strong> Port abstracting delivery metrics emission.
 * <p><strong>Why:</strong> Lets the logger count deliveries and isolated failures without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Application port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from emitting threads.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract ({@code chipper.emit.count},
 * {@code chipper.handler.delivered}, {@code chipper.handler.failed}, {@code chipper.default.delivered},
 * {@code chipper.trace.degraded}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value; semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
