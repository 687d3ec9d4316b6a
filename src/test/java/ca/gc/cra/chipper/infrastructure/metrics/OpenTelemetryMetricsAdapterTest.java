package ca.gc.cra.chipper.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementExportsCounterWithServiceResource() {
    adapter.increment("chipper.handler.delivered");
    adapter.increment("chipper.handler.delivered");
    adapter.increment("chipper.handler.failed");
    adapter.forceFlush();

    Collection<MetricData> metrics = reader.collectAllMetrics();
    MetricData delivered = find(metrics, "chipper.handler.delivered").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, delivered.getType());
    LongPointData point = delivered.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());

    MetricData failed = find(metrics, "chipper.handler.failed").orElseThrow();
    assertEquals(1L, failed.getLongSumData().getPoints().iterator().next().getValue());

    assertEquals("chipper", delivered.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", delivered.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeExportsHistogram() {
    adapter.observe("chipper.emit.fanout", 2);
    adapter.observe("chipper.emit.fanout", 4);

    MetricData fanout = find(reader.collectAllMetrics(), "chipper.emit.fanout").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, fanout.getType());
    HistogramPointData point = fanout.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(6.0, point.getSum());
  }

  @Test
  void adapterReportsActiveProvider() {
    assertFalse(adapter.isNoop());
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
