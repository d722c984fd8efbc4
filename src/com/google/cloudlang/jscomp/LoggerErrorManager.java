/*
 * Copyright 2024 The Closure Compiler Authors.
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
 * limitations under the License.
 */

package com.google.cloudlang.jscomp;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * An error manager that also logs every diagnostic it collects. Errors go to {@link Level#SEVERE}
 * and warnings to {@link Level#WARNING}; diagnostics that are turned off are only collected.
 */
public class LoggerErrorManager extends BasicErrorManager {
  private final Logger logger;

  public LoggerErrorManager(Logger logger) {
    this.logger = checkNotNull(logger);
  }

  @Override
  public void println(CheckLevel level, JSError error) {
    Level logLevel = toLogLevel(level);
    if (logLevel != null) {
      logger.log(logLevel, error.format(level));
    }
  }

  @Override
  protected void printSummary() {
    int total = getErrorCount() + getWarningCount();
    if (total > 0) {
      logger.log(
          getErrorCount() > 0 ? Level.SEVERE : Level.WARNING,
          "{0} error(s), {1} warning(s)",
          new Object[] {getErrorCount(), getWarningCount()});
    }
  }

  static @Nullable Level toLogLevel(CheckLevel level) {
    return switch (level) {
      case ERROR -> Level.SEVERE;
      case WARNING -> Level.WARNING;
      case OFF -> null;
    };
  }
}
