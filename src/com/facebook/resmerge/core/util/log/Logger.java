/*
 * Copyright 2019-present Facebook, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License. You may obtain
 * a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package com.facebook.resmerge.core.util.log;

import java.util.IllegalFormatException;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import javax.annotation.Nullable;

/**
 * Wrapper around {@link java.util.logging.Logger} with printf-style messages. Messages are only
 * formatted when the corresponding level is enabled.
 *
 * <p>Level mapping: verbose is FINER, debug is FINE, info is INFO, warn is WARNING and error is
 * SEVERE.
 */
public class Logger {

  private final java.util.logging.Logger logger;

  private Logger(java.util.logging.Logger logger) {
    this.logger = logger;
  }

  public static Logger get(Class<?> cls) {
    return get(cls.getName());
  }

  public static Logger get(String name) {
    return new Logger(java.util.logging.Logger.getLogger(name));
  }

  public boolean isVerboseEnabled() {
    return logger.isLoggable(Level.FINER);
  }

  public boolean isDebugEnabled() {
    return logger.isLoggable(Level.FINE);
  }

  public void verbose(String format, Object... args) {
    log(Level.FINER, null, format, args);
  }

  public void verbose(Throwable exception, String format, Object... args) {
    log(Level.FINER, exception, format, args);
  }

  public void debug(String format, Object... args) {
    log(Level.FINE, null, format, args);
  }

  public void debug(Throwable exception, String format, Object... args) {
    log(Level.FINE, exception, format, args);
  }

  public void info(String format, Object... args) {
    log(Level.INFO, null, format, args);
  }

  public void info(Throwable exception, String format, Object... args) {
    log(Level.INFO, exception, format, args);
  }

  public void warn(String format, Object... args) {
    log(Level.WARNING, null, format, args);
  }

  public void warn(Throwable exception, String format, Object... args) {
    log(Level.WARNING, exception, format, args);
  }

  public void error(String format, Object... args) {
    log(Level.SEVERE, null, format, args);
  }

  public void error(Throwable exception, String format, Object... args) {
    log(Level.SEVERE, exception, format, args);
  }

  private void log(Level level, @Nullable Throwable exception, String format, Object[] args) {
    if (!logger.isLoggable(level)) {
      return;
    }

    String message;
    if (args.length == 0) {
      message = format;
    } else {
      try {
        message = String.format(format, args);
      } catch (IllegalFormatException e) {
        // Never fail the caller because of a bad log statement.
        logger.log(Level.WARNING, "Invalid format string: " + format, e);
        message = format;
      }
    }

    LogRecord record = new LogRecord(level, message);
    record.setLoggerName(logger.getName());
    record.setThrown(exception);
    logger.log(record);
  }
}
