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
package exm.scad.common;

import java.io.IOException;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.scad.common.exceptions.InvalidOptionException;

public class Logging
{
  private static final String SCAD_LOGGER_NAME = "exm.scad";

  private static final String LOG_PATTERN = "%-5p %c{1} %m%n";

  public static Logger getScadLogger()
  {
    return Logger.getLogger(SCAD_LOGGER_NAME);
  }

  /**
   * Send front end logging to logfile, if one is given.
   * @param logfile empty or null to leave the configured appenders alone
   * @param trace log everything, including conversion traces
   * @throws InvalidOptionException if the log file cannot be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
                                        throws InvalidOptionException
  {
    Logger scadLogger = getScadLogger();
    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender appender = new FileAppender(
                new PatternLayout(LOG_PATTERN), logfile, false);
        scadLogger.addAppender(appender);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file " +
                                         logfile + ": " + e.getMessage());
      }
      scadLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else if (trace) {
      scadLogger.setLevel(Level.TRACE);
    }
    // Even if logging is disabled, this must be valid:
    return scadLogger;
  }
}
