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
package exm.yul.common;

import java.io.IOException;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.yul.common.exceptions.InvalidOptionException;

public class Logging {
  private static final String YOPT_LOGGER_NAME = "exm.yul";

  private static final String CONSOLE_PATTERN = "%-5p %m%n";
  private static final String FILE_PATTERN = "%d{HH:mm:ss,SSS} %-5p %c{1} %m%n";

  public static Logger getYoptLogger() {
    return Logger.getLogger(YOPT_LOGGER_NAME);
  }

  /**
   * Configure the optimiser logger for command line use: warnings go to
   * the console, everything at DEBUG (or TRACE) to logfile if given.
   * @param logfile log file name, empty or null for no file
   * @param trace log at TRACE level instead of DEBUG
   * @throws InvalidOptionException if the log file can't be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
                                        throws InvalidOptionException {
    Logger logger = getYoptLogger();
    logger.removeAllAppenders();
    logger.setAdditivity(false);

    ConsoleAppender console = new ConsoleAppender(
                new PatternLayout(CONSOLE_PATTERN), ConsoleAppender.SYSTEM_ERR);
    console.setThreshold(Level.WARN);
    logger.addAppender(console);

    if (logfile != null && logfile.length() > 0) {
      Layout layout = new PatternLayout(FILE_PATTERN);
      try {
        logger.addAppender(new FileAppender(layout, logfile, false));
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file " +
                                 logfile + ": " + e.getMessage());
      }
      logger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      logger.setLevel(trace ? Level.TRACE : Level.WARN);
      if (trace) {
        console.setThreshold(Level.TRACE);
      }
    }
    return logger;
  }
}
