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
package exm.fortx.common;

import java.io.IOException;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

public class Logging {
  private static final String FORTX_LOGGER_NAME = "exm.fortx";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted.
   */
  private static final Set<String> emitted =
          Collections.synchronizedSet(new HashSet<String>());

  public static Logger getLogger() {
    return Logger.getLogger(FORTX_LOGGER_NAME);
  }

  /**
   * Configure the fortx logger.  Without a log file, only warnings and
   * above go to stderr.
   * @param logfile log file path, or empty/null for none
   * @param trace if true, log at TRACE level to the file
   * @return the configured logger
   */
  public static Logger setupLogging(String logfile, boolean trace) {
    Logger logger = getLogger();
    logger.removeAllAppenders();
    logger.setAdditivity(false);

    ConsoleAppender console = new ConsoleAppender(new PatternLayout(LOG_PATTERN),
                                                  ConsoleAppender.SYSTEM_ERR);
    console.setThreshold(Level.WARN);
    logger.addAppender(console);

    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender file = new FileAppender(
            new PatternLayout("%r %-5p %t %c{1} - %m%n"), logfile, false);
        logger.addAppender(file);
        logger.setLevel(trace ? Level.TRACE : Level.DEBUG);
      } catch (IOException e) {
        logger.warn("Could not open log file " + logfile + ": "
                    + e.getMessage());
        logger.setLevel(Level.WARN);
      }
    } else {
      logger.setLevel(Level.WARN);
    }
    return logger;
  }

  public static void uniqueWarn(Logger logger, String msg) {
    if (emitted.add(msg)) {
      logger.warn(msg);
    } else {
      logger.debug("Duplicate Warning: " + msg);
    }
  }
}
