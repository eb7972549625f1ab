package exm.hcfa.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

import java.util.Enumeration;

import org.apache.log4j.Appender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.Test;

import exm.hcfa.common.exceptions.InvalidOptionException;

public class LoggingTest {

  @Test
  public void testEmittedOnce() {
    assertTrue(Logging.addEmitted(Level.WARN, "LoggingTest message"));
    assertFalse(Logging.addEmitted(Level.WARN, "LoggingTest message"));
    // Levels are tracked separately
    assertTrue(Logging.addEmitted(Level.INFO, "LoggingTest message"));
  }

  @Test
  public void testSetupLevels() {
    Logger logger = Logging.setupLogging("target/LoggingTest.hcfa.log",
                                         false);
    assertEquals(Level.DEBUG, logger.getLevel());
    logger = Logging.setupLogging("", false);
    assertEquals(Level.WARN, logger.getLevel());
    assertEquals("exm.hcfa", Logging.getHCFALogger().getName());
  }

  private static int fileAppenders(Logger logger) {
    int count = 0;
    Enumeration<?> appenders = logger.getAllAppenders();
    while (appenders.hasMoreElements()) {
      if (appenders.nextElement() instanceof FileAppender) {
        count++;
      }
    }
    return count;
  }

  @Test
  public void testRepeatedSetupReplacesFileAppender() {
    Logger logger = Logging.setupLogging("target/LoggingTest.first.log", true);
    Appender first = logger.getAppender(Logging.FILE_APPENDER_NAME);
    logger = Logging.setupLogging("target/LoggingTest.second.log", true);
    assertEquals(1, fileAppenders(logger));
    Appender second = logger.getAppender(Logging.FILE_APPENDER_NAME);
    assertNotSame(first, second);
    assertEquals("target/LoggingTest.second.log",
                 ((FileAppender)second).getFile());

    logger = Logging.setupLogging("", false);
    assertEquals(0, fileAppenders(logger));
  }

  @Test
  public void testSetupFromSettings() throws InvalidOptionException {
    try {
      Settings.set(Settings.LOG_FILE, "target/LoggingTest.settings.log");
      Settings.set(Settings.LOG_TRACE, "true");
      assertEquals(Level.TRACE, Logging.setupLogging().getLevel());
    } finally {
      Settings.reset(Settings.LOG_FILE);
      Settings.reset(Settings.LOG_TRACE);
    }
    assertEquals(Level.WARN, Logging.setupLogging().getLevel());
  }
}
