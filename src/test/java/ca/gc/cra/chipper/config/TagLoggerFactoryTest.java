package ca.gc.cra.chipper.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.chipper.application.port.MetricsPort;
import ca.gc.cra.chipper.application.routing.DefaultRouting;
import ca.gc.cra.chipper.application.routing.TagLogger;
import ca.gc.cra.chipper.application.routing.Target;
import ca.gc.cra.chipper.domain.format.FormatterConfig;
import ca.gc.cra.chipper.domain.format.TemplateException;
import ca.gc.cra.chipper.infrastructure.target.LineSinks;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TagLoggerFactoryTest {
  @TempDir
  Path tempDir;

  @AfterEach
  void closeFiles() {
    LineSinks.closeFiles();
  }

  @Test
  void fileHandlerAndStdoutDefaultBothReceiveEmission() throws Exception {
    Path debugLog = tempDir.resolve("logs/debug.log");
    LoggerDefinition definition = new LoggerDefinition(
        List.of(new HandlerDefinition("debug", List.of("debug"), TargetDefinition.file(debugLog.toString()),
            FormatterConfig.defaults())),
        TargetDefinition.stdoutOnly(),
        FormatterConfig.defaultHandler(),
        DefaultRouting.ALWAYS,
        null);
    TagLogger logger = TagLoggerFactory.create(definition, MetricsPort.NO_OP);

    String stdout = captureStdout(() -> logger.log("x", "debug"));
    LineSinks.closeFiles();

    String fileContent = Files.readString(debugLog);
    assertTrue(fileContent.contains("[DEBUG]"), fileContent);
    assertTrue(fileContent.endsWith(" : x\n"), fileContent);
    assertEquals("[DEBUG] : x\n", stdout);
  }

  @Test
  void defaultLoggerPrintsHelloWorldUnderDefaultTag() {
    TagLogger logger = TagLoggerFactory.defaultLogger();

    String stdout = captureStdout(() -> logger.log("Hello World"));

    assertTrue(logger.handlers().isEmpty());
    assertEquals("[DEFAULT] : Hello World\n", stdout);
  }

  @Test
  void handlersSharingAFileShareOneSink() {
    String path = tempDir.resolve("shared.log").toString();
    LoggerDefinition definition = new LoggerDefinition(
        List.of(
            new HandlerDefinition("a", List.of("a"), TargetDefinition.file(path), FormatterConfig.defaults()),
            new HandlerDefinition("b", List.of("b"), TargetDefinition.file(path), FormatterConfig.defaults())),
        TargetDefinition.stdoutOnly(),
        FormatterConfig.defaultHandler(),
        DefaultRouting.DISABLED,
        null);

    TagLogger logger = TagLoggerFactory.create(definition, MetricsPort.NO_OP);

    assertSame(logger.handlers().get(0).target().sinks().get(0), logger.handlers().get(1).target().sinks().get(0));
  }

  @Test
  void concurrentHandlersSharingAFileWriteWholeLines() throws Exception {
    Path shared = tempDir.resolve("shared.log");
    FormatterConfig tagsOnly = FormatterConfig.defaults().toBuilder().template("{tags} ").build();
    LoggerDefinition definition = new LoggerDefinition(
        List.of(
            new HandlerDefinition("a", List.of("a"), TargetDefinition.file(shared.toString()), tagsOnly),
            new HandlerDefinition("b", List.of("b"), TargetDefinition.file(shared.toString()), tagsOnly)),
        TargetDefinition.stdoutOnly(),
        FormatterConfig.defaultHandler(),
        DefaultRouting.DISABLED,
        null);
    TagLogger logger = TagLoggerFactory.create(definition, MetricsPort.NO_OP);

    int threads = 8;
    int perThread = 250;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int t = 0; t < threads; t++) {
        int id = t;
        String tag = id % 2 == 0 ? "a" : "b";
        futures.add(pool.submit(() -> {
          start.await();
          for (int i = 0; i < perThread; i++) {
            logger.log("worker-" + id + "-" + i + "-" + "x".repeat(200), tag);
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
    LineSinks.closeFiles();

    List<String> lines = Files.readAllLines(shared);
    assertEquals(threads * perThread, lines.size());
    for (String line : lines) {
      assertTrue(line.matches("\\[(A|B)] worker-\\d+-\\d+-x{200}"), line);
    }
  }

  @Test
  void createCarriesRoutingAndFormatterIntoLogger() {
    FormatterConfig piped = FormatterConfig.defaults().toBuilder().tagDelimiter("|").build();
    LoggerDefinition definition = new LoggerDefinition(
        List.of(new HandlerDefinition("sql", List.of("sql"), TargetDefinition.stdoutOnly(), piped)),
        new TargetDefinition("", false, true),
        FormatterConfig.defaultHandler(),
        DefaultRouting.UNMATCHED,
        null);

    TagLogger logger = TagLoggerFactory.create(definition, MetricsPort.NO_OP);

    assertEquals(DefaultRouting.UNMATCHED, logger.routing());
    assertEquals(LoggerDefinition.DEFAULT_HANDLER_NAME, logger.defaultHandler().name());
    assertEquals(List.of(LineSinks.stderr()), logger.defaultHandler().target().sinks());
    assertEquals(FormatterConfig.defaultHandler(), logger.defaultHandler().formatterConfig());
    assertEquals("|", logger.handlers().get(0).formatterConfig().tagDelimiter());
  }

  @Test
  void targetResolvesEveryDeclaredDestination() {
    Target all = TagLoggerFactory.target(new TargetDefinition(tempDir.resolve("t.log").toString(), true, true));
    assertEquals(3, all.sinks().size());
    assertSame(LineSinks.stdout(), all.sinks().get(1));
    assertSame(LineSinks.stderr(), all.sinks().get(2));

    assertSame(Target.none(), TagLoggerFactory.target(new TargetDefinition("", false, false)));
  }

  @Test
  void invalidTemplateFailsAtConstruction() {
    LoggerDefinition definition = new LoggerDefinition(
        List.of(new HandlerDefinition("bad", List.of("x"), TargetDefinition.stdoutOnly(),
            FormatterConfig.defaults().toBuilder().template("{nope}").build())),
        TargetDefinition.stdoutOnly(),
        FormatterConfig.defaultHandler(),
        DefaultRouting.ALWAYS,
        null);

    assertThrows(TemplateException.class, () -> TagLoggerFactory.create(definition, MetricsPort.NO_OP));
  }

  @Test
  void loadBuildsLoggerFromYaml() throws Exception {
    Path yaml = tempDir.resolve("chipper.yaml");
    Path out = tempDir.resolve("sql.log");
    Files.writeString(yaml, """
        routing: disabled
        zone: UTC
        handlers:
          - name: sql
            tags: [sql]
            target:
              filename: "%s"
            formatter:
              template: "{tags} "
        """.formatted(out.toString().replace("\\", "/")));

    TagLogger logger = TagLoggerFactory.load(yaml);
    logger.log("select 1", "sql", "perf");
    LineSinks.closeFiles();

    assertEquals("[SQL] select 1\n", Files.readString(out));
  }

  private static String captureStdout(Runnable action) {
    PrintStream original = System.out;
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    System.setOut(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    try {
      action.run();
    } finally {
      System.setOut(original);
    }
    return buffer.toString(StandardCharsets.UTF_8);
  }
}
