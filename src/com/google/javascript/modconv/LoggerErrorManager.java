/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.javascript.modconv;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Collects conversion diagnostics and, on {@link #generateReport()}, writes them to a {@link
 * Logger}: errors at {@link Level#SEVERE}, warnings at {@link Level#WARNING}. The closing summary
 * counts them along with the files they came from.
 *
 * <p>This is what {@link GoogModuleConverter} reports to unless it is given another manager.
 */
public final class LoggerErrorManager extends BasicErrorManager {

  private final Logger logger;

  public LoggerErrorManager(Logger logger) {
    this.logger = logger;
  }

  @Override
  public void println(CheckLevel level, JSError error) {
    @Nullable Level logLevel = toLogLevel(level);
    if (logLevel != null) {
      logger.log(logLevel, error.format(level));
    }
  }

  @Override
  protected void printSummary() {
    int errors = getErrorCount();
    int warnings = getWarningCount();
    if (errors + warnings == 0) {
      logger.log(Level.INFO, "0 error(s), 0 warning(s)");
      return;
    }
    logger.log(
        errors > 0 ? Level.SEVERE : Level.WARNING,
        "{0} error(s), {1} warning(s) in {2} file(s)",
        new Object[] {errors, warnings, countFiles()});
  }

  private int countFiles() {
    Set<String> files = new LinkedHashSet<>();
    for (JSError error : getErrors()) {
      files.add(String.valueOf(error.sourceName()));
    }
    for (JSError error : getWarnings()) {
      files.add(String.valueOf(error.sourceName()));
    }
    return files.size();
  }

  private static @Nullable Level toLogLevel(CheckLevel level) {
    switch (level) {
      case ERROR:
        return Level.SEVERE;
      case WARNING:
        return Level.WARNING;
      default:
        return null;
    }
  }
}
