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
package exm.fnp.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import com.google.common.collect.Maps;

import exm.fnp.common.exceptions.FnRuntimeError;

public class Logging
{
  private static final String FNP_LOGGER_NAME = "exm.fnp";

  private static final String LOG_PATTERN = "%-5p %c{1} %m%n";

  /**
   * Messages already emitted.
   */
  static final Set<java.util.Map.Entry<Level, String>> emitted =
       new HashSet<java.util.Map.Entry<Level, String>>();

  public static Logger getFnpLogger()
  {
    return Logger.getLogger(FNP_LOGGER_NAME);
  }

  /**
   * Attach a file appender to the fnp logger if a log file was given.
   * @param logfile path of log file, or empty for no file logging
   * @param trace if true, log at TRACE level, otherwise DEBUG
   * @return the fnp logger
   */
  public static Logger setupLogging(String logfile, boolean trace)
  {
    Logger fnpLogger = getFnpLogger();
    if (StringUtils.isBlank(logfile)) {
      // Even if logging is disabled, this must be valid:
      return fnpLogger;
    }
    try {
      FileAppender appender = new FileAppender(new PatternLayout(LOG_PATTERN),
                                               logfile, false);
      fnpLogger.addAppender(appender);
    } catch (IOException e) {
      throw new FnRuntimeError("Could not open log file: " + logfile, e);
    }
    fnpLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    return fnpLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static synchronized boolean addEmitted(Level level, String msg)
  {
    return emitted.add(Maps.immutableEntry(level, msg));
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getFnpLogger().warn(msg);
    else
      getFnpLogger().debug("Duplicate Warning: " + msg);
  }
}
