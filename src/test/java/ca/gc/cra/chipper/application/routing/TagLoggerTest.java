package ca.gc.cra.chipper.application.routing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.chipper.application.port.ClockPort;
import ca.gc.cra.chipper.application.port.MetricsPort;
import ca.gc.cra.chipper.application.port.TraceCaptureException;
import ca.gc.cra.chipper.application.port.TraceSource;
import ca.gc.cra.chipper.domain.emission.TraceInfo;
import ca.gc.cra.chipper.domain.format.FormatterConfig;
import ca.gc.cra.chipper.domain.tag.InvalidTagException;
import ca.gc.cra.chipper.domain.tag.TagSet;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class TagLoggerTest {
  private static final ZonedDateTime NOW = ZonedDateTime.of(2024, 3, 5, 14, 7, 9, 0, ZoneOffset.UTC);
  private static final ClockPort CLOCK = ClockPort.fixed(NOW);

  private final RecordingSink defaultSink = RecordingSink.named("default");
  private final RecordingMetrics metrics = new RecordingMetrics();

  @Test
  void untaggedMessageGoesToDefaultHandlerUnderDefaultTag() {
    TagLogger logger = builder().build();

    logger.log("Hello World");

    assertEquals(List.of("[DEFAULT] : Hello World\n"), defaultSink.lines());
    assertEquals(1L, metrics.counter("chipper.emit.count"));
    assertEquals(1L, metrics.counter("chipper.default.delivered"));
  }

  @Test
  void matchingHandlerAndDefaultHandlerBothWrite() {
    RecordingSink debugSink = RecordingSink.named("debug.log");
    TagLogger logger = builder()
        .handler(new Handler("debug", TagSet.of("debug"), FormatterConfig.defaults(), Target.of(debugSink)))
        .build();

    logger.log("x", "debug");

    assertEquals(List.of("[2024-03-05 14:07:09][DEBUG] : x\n"), debugSink.lines());
    assertEquals(List.of("[DEBUG] : x\n"), defaultSink.lines());
  }

  @Test
  void multiTagSubscriptionWritesOnceInEmissionOrder() {
    RecordingSink sqlSink = RecordingSink.named("sql");
    TagLogger logger = builder()
        .handler(new Handler("sql", TagSet.of("sql", "blog", "warning"), FormatterConfig.defaults(),
            Target.of(sqlSink)))
        .build();

    logger.log("slow query", "blog", "sql", "warning");

    assertEquals(List.of("[2024-03-05 14:07:09][BLOG,SQL,WARNING] : slow query\n"), sqlSink.lines());
  }

  @Test
  void handlerRendersOnlyTheTagsItMatched() {
    RecordingSink sqlSink = RecordingSink.named("sql");
    TagLogger logger = builder()
        .handler(new Handler("sql", TagSet.of("sql"), FormatterConfig.defaults(), Target.of(sqlSink)))
        .build();

    logger.log("rows", "audit", "sql");

    assertEquals(List.of("[2024-03-05 14:07:09][SQL] : rows\n"), sqlSink.lines());
    assertEquals(List.of("[AUDIT,SQL] : rows\n"), defaultSink.lines());
  }

  @Test
  void failingHandlerIsIsolatedAndReported() {
    RecordingSink healthy = RecordingSink.named("healthy");
    TagLogger logger = builder()
        .handler(new Handler("broken", TagSet.of("info"), FormatterConfig.defaults(),
            Target.of(RecordingSink.failing("readonly.log"))))
        .handler(new Handler("healthy", TagSet.of("info"), FormatterConfig.defaults(), Target.of(healthy)))
        .build();

    Logger diagnostics = (Logger) LoggerFactory.getLogger(TagLogger.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = diagnostics.isAdditive();
    diagnostics.setAdditive(false);
    appender.start();
    diagnostics.addAppender(appender);
    try {
      logger.log("still delivered", "info");
    } finally {
      diagnostics.detachAppender(appender);
      diagnostics.setAdditive(originalAdditive);
      appender.stop();
    }

    assertEquals(1, healthy.lines().size());
    assertEquals(1, defaultSink.lines().size());
    assertEquals(1L, metrics.counter("chipper.handler.failed"));
    assertEquals(2L, metrics.lastObservation("chipper.emit.fanout"));

    List<ILoggingEvent> warnings = appender.list.stream()
        .filter(event -> event.getLevel() == Level.WARN)
        .toList();
    assertEquals(1, warnings.size());
    String message = warnings.get(0).getFormattedMessage();
    assertTrue(message.contains("'broken'"));
    assertTrue(message.contains("still delivered"));
  }

  @Test
  void invokeIsEquivalentToExplicitTags() {
    TagLogger logger = builder().build();

    logger.invoke("general_info", "started");
    logger.log("started", "general", "info");

    List<String> lines = defaultSink.lines();
    assertEquals(2, lines.size());
    assertEquals(lines.get(0), lines.get(1));
    assertEquals("[GENERAL,INFO] : started\n", lines.get(0));
  }

  @Test
  void taggedAndBoundLoggersReuseTags() {
    TagLogger logger = builder().build();

    BoundTagLogger audit = logger.tagged("security_audit");
    audit.log("login");
    logger.bind("security", "audit").accept("logout");

    assertEquals(TagSet.of("security", "audit"), audit.tags());
    assertEquals(List.of("[SECURITY,AUDIT] : login\n", "[SECURITY,AUDIT] : logout\n"), defaultSink.lines());
  }

  @Test
  void reservedNamesAreRejected() {
    TagLogger logger = builder().build();

    assertThrows(IllegalArgumentException.class, () -> logger.invoke("emit", "m"));
    assertThrows(IllegalArgumentException.class, () -> logger.tagged("Handlers"));
    assertTrue(defaultSink.lines().isEmpty());
  }

  @Test
  void invalidTagAbortsEmissionBeforeAnyHandler() {
    TagLogger logger = builder().build();

    assertThrows(InvalidTagException.class, () -> logger.log("m", "two words"));
    assertTrue(defaultSink.lines().isEmpty());
    assertEquals(0L, metrics.counter("chipper.emit.count"));
  }

  @Test
  void unmatchedRoutingSendsOnlyUnclaimedTagsToDefault() {
    RecordingSink sqlSink = RecordingSink.named("sql");
    TagLogger logger = builder()
        .routing(DefaultRouting.UNMATCHED)
        .handler(new Handler("sql", TagSet.of("sql"), FormatterConfig.defaults(), Target.of(sqlSink)))
        .build();

    logger.log("claimed", "sql");
    logger.log("partly claimed", "sql", "audit");
    logger.log("unclaimed", "audit");

    assertEquals(2, sqlSink.lines().size());
    assertEquals(List.of("[AUDIT] : partly claimed\n", "[AUDIT] : unclaimed\n"), defaultSink.lines());
  }

  @Test
  void disabledRoutingNeedsNoDefaultHandler() {
    RecordingSink infoSink = RecordingSink.named("info");
    TagLogger logger = TagLogger.builder()
        .routing(DefaultRouting.DISABLED)
        .clock(CLOCK)
        .handler(new Handler("info", TagSet.of("info"), FormatterConfig.defaults(), Target.of(infoSink)))
        .build();

    logger.log("dropped");
    logger.log("kept", "info");

    assertEquals(List.of("[2024-03-05 14:07:09][INFO] : kept\n"), infoSink.lines());
  }

  @Test
  void missingDefaultHandlerFailsBuild() {
    assertThrows(IllegalStateException.class, () -> TagLogger.builder().build());
  }

  @Test
  void traceTagAddsCallSiteAndException() {
    TraceSource source = () -> new TraceInfo("Checkout.java", 88, "Checkout.pay", "");
    TagLogger logger = builder().traceSource(source).build();

    logger.log("payment failed", new IllegalStateException("card declined"), "error", "trace");

    String line = defaultSink.lines().get(0);
    assertTrue(line.startsWith("Checkout.java:88[ERROR,TRACE] : payment failed\n"
        + "java.lang.IllegalStateException: card declined\n"), line);
    assertTrue(line.contains("\tat "), line);
    assertTrue(line.endsWith("\n"));
  }

  @Test
  void exceptionIsIgnoredWithoutTraceTag() {
    TagLogger logger = builder().traceSource(() -> new TraceInfo("X.java", 1, "X.y", "")).build();

    logger.log("handled", new IllegalStateException("ignored"), "error");

    assertEquals(List.of("[ERROR] : handled\n"), defaultSink.lines());
  }

  @Test
  void traceCaptureFailureDegradesToEmptyTrace() {
    TraceSource failing = () -> {
      throw new TraceCaptureException("no stack", new IllegalStateException());
    };
    TagLogger logger = builder().traceSource(failing).build();

    logger.log("still logged", "trace");

    assertEquals(List.of("[TRACE] : still logged\n"), defaultSink.lines());
    assertEquals(1L, metrics.counter("chipper.trace.degraded"));
  }

  @Test
  void renderFailureIsIsolatedToItsHandler() {
    RecordingSink ok = RecordingSink.named("ok");
    FormatterConfig throwing = FormatterConfig.defaults().toBuilder()
        .tagTransform(tag -> {
          if (tag.equals("boom")) {
            throw new IllegalStateException("transform failed");
          }
          return tag;
        })
        .build();
    TagLogger logger = builder()
        .handler(new Handler("fragile", TagSet.of("boom"), throwing, Target.of(RecordingSink.named("never"))))
        .handler(new Handler("ok", TagSet.of("boom"), FormatterConfig.defaults(), Target.of(ok)))
        .build();

    logger.log("m", "boom");

    assertEquals(1, ok.lines().size());
    assertEquals(1L, metrics.counter("chipper.handler.failed"));
  }

  @Test
  void concurrentEmissionsKeepLinesIntact() throws Exception {
    TagLogger logger = builder().build();
    int threads = 8;
    int perThread = 200;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int t = 0; t < threads; t++) {
        int id = t;
        futures.add(pool.submit(() -> {
          start.await();
          for (int i = 0; i < perThread; i++) {
            logger.log("worker-" + id + "-" + i, "load");
          }
          return null;
        }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    List<String> lines = defaultSink.lines();
    assertEquals(threads * perThread, lines.size());
    for (String line : lines) {
      assertTrue(line.matches("\\[LOAD] : worker-\\d+-\\d+\n"), line);
    }
  }

  private TagLogger.Builder builder() {
    return TagLogger.builder()
        .defaultHandler(new Handler("default", TagSet.empty(), FormatterConfig.defaultHandler(),
            Target.of(defaultSink)))
        .clock(CLOCK)
        .metrics(metrics);
  }

  private static final class RecordingMetrics implements MetricsPort {
    private final Map<String, Long> counters = new HashMap<>();
    private final Map<String, Long> observations = new HashMap<>();

    @Override
    public synchronized void increment(String key) {
      counters.merge(key, 1L, Long::sum);
    }

    @Override
    public synchronized void observe(String key, long value) {
      observations.put(key, value);
    }

    synchronized long counter(String key) {
      return counters.getOrDefault(key, 0L);
    }

    synchronized long lastObservation(String key) {
      return observations.getOrDefault(key, -1L);
    }
  }
}
