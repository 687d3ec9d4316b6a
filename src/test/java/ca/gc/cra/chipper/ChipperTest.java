package ca.gc.cra.chipper;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.chipper.application.port.MetricsPort;
import ca.gc.cra.chipper.application.routing.TagLogger;
import ca.gc.cra.chipper.config.LoggerDefinition;
import ca.gc.cra.chipper.config.TagLoggerFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChipperTest {

  @BeforeEach
  void clearBefore() {
    Chipper.resetForTesting();
  }

  @AfterEach
  void clearAfter() {
    Chipper.resetForTesting();
  }

  @Test
  void initializeInstallsSharedLogger() {
    TagLogger logger = TagLoggerFactory.create(LoggerDefinition.defaults(), MetricsPort.NO_OP);

    Chipper.initialize(logger);

    assertTrue(Chipper.isInitialized());
    assertSame(logger, Chipper.log());
  }

  @Test
  void secondInitializeIsRejected() {
    Chipper.initialize(TagLoggerFactory.create(LoggerDefinition.defaults(), MetricsPort.NO_OP));

    assertThrows(IllegalStateException.class,
        () -> Chipper.initialize(TagLoggerFactory.create(LoggerDefinition.defaults(), MetricsPort.NO_OP)));
  }

  @Test
  void firstUseInstallsDefaultLogger() {
    assertFalse(Chipper.isInitialized());

    TagLogger first = Chipper.log();

    assertNotNull(first);
    assertSame(first, Chipper.log());
    assertTrue(first.handlers().isEmpty());
    assertThrows(IllegalStateException.class,
        () -> Chipper.initialize(TagLoggerFactory.create(LoggerDefinition.defaults(), MetricsPort.NO_OP)));
  }
}
