package ca.gc.cra.chipper.application.routing;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.chipper.application.port.ClockPort;
import ca.gc.cra.chipper.domain.format.FormatterConfig;
import ca.gc.cra.chipper.domain.tag.TagSet;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;

class BoundTagLoggerTest {

  @Test
  void worksAsConsumerInStreams() {
    RecordingSink sink = RecordingSink.named("mem");
    TagLogger logger = TagLogger.builder()
        .defaultHandler(new Handler("default", TagSet.empty(), FormatterConfig.defaultHandler(), Target.of(sink)))
        .clock(ClockPort.fixed(ZonedDateTime.of(2024, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC)))
        .build();

    Stream.of("a", "b").forEach(logger.tagged("batch_item"));

    assertEquals(List.of("[BATCH,ITEM] : a\n", "[BATCH,ITEM] : b\n"), sink.lines());
  }

  @Test
  void emptyNameBindsToDefaultTag() {
    RecordingSink sink = RecordingSink.named("mem");
    TagLogger logger = TagLogger.builder()
        .defaultHandler(new Handler("default", TagSet.empty(), FormatterConfig.defaultHandler(), Target.of(sink)))
        .build();

    logger.tagged("__").log("plain");

    assertEquals(List.of("[DEFAULT] : plain\n"), sink.lines());
  }
}
