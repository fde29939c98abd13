package ca.gc.cra.diagsink.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private Logger sinkLogger;
  private Logger rootLogger;
  private Level sinkLevel;
  private Level rootLevel;

  @BeforeEach
  void rememberLevels() {
    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    sinkLogger = context.getLogger(LoggingConfigurator.SINK_LOGGER);
    rootLogger = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    sinkLevel = sinkLogger.getLevel();
    rootLevel = rootLogger.getLevel();
  }

  @AfterEach
  void restoreLevels() {
    sinkLogger.setLevel(sinkLevel);
    rootLogger.setLevel(rootLevel);
  }

  @Test
  void verboseRaisesOnlySinkLoggers() {
    assertTrue(LoggingConfigurator.enableVerboseLogging());

    assertEquals(Level.DEBUG, sinkLogger.getLevel());
    assertEquals(rootLevel, rootLogger.getLevel());
    assertTrue(LoggerFactory.getLogger("ca.gc.cra.diagsink.application.sink.RotationMonitor").isDebugEnabled());
  }
}
