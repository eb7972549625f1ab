/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.hcfa.common;

import java.io.IOException;
import java.util.HashSet;

import org.apache.log4j.Appender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.hcfa.common.exceptions.HCFARuntimeError;
import exm.hcfa.common.exceptions.InvalidOptionException;

public class Logging {
  private static final String HCFA_LOGGER_NAME = "exm.hcfa";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /** Name of the file appender installed by setupLogging */
  public static final String FILE_APPENDER_NAME = "hcfa-file";

  /**
   * Messages already emitted, keyed by level and text.
   */
  private static final HashSet<String> emitted = new HashSet<String>();

  public static Logger getHCFALogger() {
    return Logger.getLogger(HCFA_LOGGER_NAME);
  }

  /**
   * Direct the analyzer log to a file.  Any file appender installed by an
   * earlier call is closed and removed first.
   * @param logfile path of log file, or empty string for no log file
   * @param trace if true, log at TRACE level, otherwise DEBUG
   * @return the analyzer logger
   */
  public static Logger setupLogging(String logfile, boolean trace) {
    Logger hcfaLogger = getHCFALogger();
    Appender previous = hcfaLogger.getAppender(FILE_APPENDER_NAME);
    if (previous != null) {
      hcfaLogger.removeAppender(previous);
      previous.close();
    }

    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender appender = new FileAppender(
                      new PatternLayout(LOG_PATTERN), logfile, false);
        appender.setName(FILE_APPENDER_NAME);
        hcfaLogger.addAppender(appender);
      } catch (IOException e) {
        throw new HCFARuntimeError("Could not open log file " + logfile +
                                   ": " + e.getMessage());
      }
      hcfaLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      hcfaLogger.setLevel(Level.WARN);
    }
    return hcfaLogger;
  }

  /**
   * Set up logging from the {@link Settings#LOG_FILE} and
   * {@link Settings#LOG_TRACE} settings
   * @throws InvalidOptionException
   */
  public static Logger setupLogging() throws InvalidOptionException {
    return setupLogging(Settings.get(Settings.LOG_FILE),
                        Settings.getBoolean(Settings.LOG_TRACE));
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg) {
    synchronized (emitted) {
      return emitted.add(level.toString() + ":" + msg);
    }
  }

  public static void uniqueWarn(String msg) {
    if (addEmitted(Level.WARN, msg)) {
      getHCFALogger().warn(msg);
    } else {
      getHCFALogger().debug("Duplicate Warning: " + msg);
    }
  }
}
