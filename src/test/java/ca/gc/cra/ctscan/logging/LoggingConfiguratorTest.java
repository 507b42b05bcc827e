package ca.gc.cra.ctscan.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

  @Test
  void verboseLoggingLowersRootToDebug() {
    Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    Level previous = root.getLevel();
    try {
      assertTrue(LoggingConfigurator.enableVerboseLogging());
      assertEquals(Level.DEBUG, root.getLevel());
    } finally {
      root.setLevel(previous);
    }
  }
}
