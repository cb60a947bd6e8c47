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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * An error manager that keeps every reported diagnostic sorted and generates a report when the
 * {@link #generateReport()} method is called.
 *
 * <p>This error manager does not produce any output, but subclasses override {@link
 * #println(CheckLevel, JSError)} and {@link #printSummary()} to generate custom output.
 */
public abstract class BasicErrorManager implements ErrorManager {

  private final TreeSet<ErrorWithLevel> messages = new TreeSet<>(new LeveledJSErrorComparator());
  private int originalErrorCount = 0;
  private int promotedErrorCount = 0;
  private int warningCount = 0;

  @Override
  public void report(CheckLevel level, JSError error) {
    if (!level.isOn()) {
      return;
    }
    ErrorWithLevel e = new ErrorWithLevel(error, level);
    if (messages.add(e)) {
      if (level == CheckLevel.ERROR) {
        if (error.type().level == CheckLevel.ERROR) {
          originalErrorCount++;
        } else {
          promotedErrorCount++;
        }
      } else if (level == CheckLevel.WARNING) {
        warningCount++;
      }
    }
  }

  @Override
  public boolean hasHaltingErrors() {
    return originalErrorCount != 0;
  }

  @Override
  public int getErrorCount() {
    return originalErrorCount + promotedErrorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public JSError[] getErrors() {
    return toArray(CheckLevel.ERROR);
  }

  @Override
  public JSError[] getWarnings() {
    return toArray(CheckLevel.WARNING);
  }

  @Override
  public void generateReport() {
    for (ErrorWithLevel message : ImmutableList.copyOf(messages)) {
      println(message.level, message.error);
    }
    printSummary();
  }

  /**
   * Print a message with a trailing new line. This method is called by the {@link
   * #generateReport()} method when generating messages.
   */
  public abstract void println(CheckLevel level, JSError error);

  /** Print the summary of the conversion - number of errors and warnings. */
  protected abstract void printSummary();

  private JSError[] toArray(CheckLevel level) {
    List<JSError> errors = new ArrayList<>(messages.size());
    for (ErrorWithLevel p : messages) {
      if (p.level == level) {
        errors.add(p.error);
      }
    }
    return errors.toArray(new JSError[0]);
  }

  /**
   * Orders diagnostics by level, warnings before errors, then by file name, line number, column
   * and description. Unknown positions sort before known ones.
   */
  static final class LeveledJSErrorComparator implements Comparator<ErrorWithLevel> {
    private static final Comparator<String> NULLS_FIRST =
        Comparator.nullsFirst(Comparator.<String>naturalOrder());

    @Override
    public int compare(ErrorWithLevel p1, ErrorWithLevel p2) {
      if (p1.level != p2.level) {
        return p2.level.compareTo(p1.level);
      }
      int sourceCompare = NULLS_FIRST.compare(p1.error.sourceName(), p2.error.sourceName());
      if (sourceCompare != 0) {
        return sourceCompare;
      }
      int linenoCompare = Integer.compare(p1.error.lineno(), p2.error.lineno());
      if (linenoCompare != 0) {
        return linenoCompare;
      }
      int charnoCompare = Integer.compare(p1.error.charno(), p2.error.charno());
      if (charnoCompare != 0) {
        return charnoCompare;
      }
      return p1.error.description().compareTo(p2.error.description());
    }
  }

  static final class ErrorWithLevel {
    final JSError error;
    final CheckLevel level;

    ErrorWithLevel(JSError error, CheckLevel level) {
      this.error = error;
      this.level = level;
    }

    @Override
    public int hashCode() {
      return Objects.hash(
          level, error.description(), error.sourceName(), error.lineno(), error.charno());
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof ErrorWithLevel)) {
        return false;
      }
      ErrorWithLevel e = (ErrorWithLevel) obj;
      return Objects.equals(level, e.level)
          && Objects.equals(error.description(), e.error.description())
          && Objects.equals(error.sourceName(), e.error.sourceName())
          && error.lineno() == e.error.lineno()
          && error.charno() == e.error.charno();
    }
  }
}
