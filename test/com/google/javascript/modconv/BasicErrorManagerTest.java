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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.javascript.modconv.BasicErrorManager.ErrorWithLevel;
import com.google.javascript.modconv.BasicErrorManager.LeveledJSErrorComparator;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link BasicErrorManager}. */
@RunWith(JUnit4.class)
public final class BasicErrorManagerTest {
  private static final String NULL_SOURCE = null;

  private final LeveledJSErrorComparator comparator = new LeveledJSErrorComparator();

  private static final DiagnosticType FOO_TYPE = DiagnosticType.error("TEST_FOO", "Foo");

  private static final DiagnosticType JOO_TYPE = DiagnosticType.error("TEST_JOO", "Joo");

  private static final DiagnosticType BAR_WARNING = DiagnosticType.warning("TEST_BAR", "Bar");

  @Test
  public void testOrderingSourceName() {
    JSError e1 = JSError.make(NULL_SOURCE, -1, -1, FOO_TYPE);
    JSError e2 = JSError.make("a.ts", -1, -1, FOO_TYPE);
    JSError e3 = JSError.make("b.ts", -1, -1, FOO_TYPE);

    assertSmaller(error(e1), error(e2));
    assertSmaller(error(e2), error(e3));
  }

  @Test
  public void testOrderingLineno() {
    JSError e1 = JSError.make(NULL_SOURCE, -1, -1, FOO_TYPE);
    JSError e2 = JSError.make(NULL_SOURCE, 8, -1, FOO_TYPE);
    JSError e3 = JSError.make(NULL_SOURCE, 56, -1, FOO_TYPE);

    assertSmaller(error(e1), error(e2));
    assertSmaller(error(e2), error(e3));
  }

  @Test
  public void testOrderingCheckLevel() {
    JSError e1 = JSError.make(NULL_SOURCE, -1, -1, FOO_TYPE);
    JSError e2 = JSError.make(NULL_SOURCE, -1, -1, FOO_TYPE);

    assertSmaller(warning(e1), error(e2));
  }

  @Test
  public void testOrderingCharno() {
    JSError e1 = JSError.make(NULL_SOURCE, 8, 7, FOO_TYPE);
    JSError e2 = JSError.make(NULL_SOURCE, 8, 5, FOO_TYPE);

    assertSmaller(error(e2), error(e1));
    // CheckLevel preempts charno comparison
    assertSmaller(warning(e1), error(e2));
  }

  @Test
  public void testOrderingDescription() {
    JSError e1 = JSError.make(NULL_SOURCE, -1, -1, FOO_TYPE);
    JSError e2 = JSError.make(NULL_SOURCE, -1, -1, JOO_TYPE);

    assertSmaller(error(e1), error(e2));
  }

  @Test
  public void testDeduplicatedErrors() {
    final List<JSError> printedErrors = new ArrayList<>();
    BasicErrorManager manager =
        new BasicErrorManager() {
          @Override
          public void println(CheckLevel level, JSError error) {
            printedErrors.add(error);
          }

          @Override
          protected void printSummary() {}
        };
    JSError e1 = JSError.make(NULL_SOURCE, -1, -1, FOO_TYPE);
    JSError e2 = JSError.make(NULL_SOURCE, -1, -1, FOO_TYPE);
    manager.report(CheckLevel.ERROR, e1);
    manager.report(CheckLevel.ERROR, e2);
    manager.generateReport();

    assertThat(printedErrors).hasSize(1);
    assertThat(manager.getErrorCount()).isEqualTo(1);
  }

  @Test
  public void testCounts() {
    BasicErrorManager manager = new RecordingErrorManager();
    JSError warning = JSError.make("a.ts", 1, 0, BAR_WARNING);
    JSError error = JSError.make("a.ts", 2, 0, FOO_TYPE);

    manager.report(CheckLevel.WARNING, warning);
    manager.report(CheckLevel.ERROR, error);
    manager.report(CheckLevel.OFF, JSError.make("a.ts", 3, 0, BAR_WARNING));

    assertThat(manager.getWarningCount()).isEqualTo(1);
    assertThat(manager.getErrorCount()).isEqualTo(1);
    assertThat(manager.hasHaltingErrors()).isTrue();
    assertThat(manager.getWarnings()).asList().containsExactly(warning);
    assertThat(manager.getErrors()).asList().containsExactly(error);
  }

  @Test
  public void testPromotedWarningIsNotHalting() {
    BasicErrorManager manager = new RecordingErrorManager();

    manager.report(CheckLevel.ERROR, JSError.make("a.ts", 1, 0, BAR_WARNING));

    assertThat(manager.getErrorCount()).isEqualTo(1);
    assertThat(manager.hasHaltingErrors()).isFalse();
  }

  // Printing the report may report more diagnostics; iterating the messages must not fail then.
  @Test
  public void testGenerateReportCausesMoreWarnings() {
    RecordingErrorManager manager =
        new RecordingErrorManager() {
          @Override
          public void println(CheckLevel level, JSError error) {
            if (error.type().equals(FOO_TYPE)) {
              this.report(CheckLevel.ERROR, JSError.make(NULL_SOURCE, -1, -1, JOO_TYPE));
            }
            super.println(level, error);
          }
        };
    manager.report(CheckLevel.ERROR, JSError.make(NULL_SOURCE, -1, -1, FOO_TYPE));
    manager.generateReport();

    assertThat(manager.printed).hasSize(1);
    assertThat(manager.getErrorCount()).isEqualTo(2);
  }

  private static class RecordingErrorManager extends BasicErrorManager {
    final List<JSError> printed = new ArrayList<>();

    @Override
    public void println(CheckLevel level, JSError error) {
      printed.add(error);
    }

    @Override
    protected void printSummary() {}
  }

  private static ErrorWithLevel error(JSError e) {
    return new ErrorWithLevel(e, CheckLevel.ERROR);
  }

  private static ErrorWithLevel warning(JSError e) {
    return new ErrorWithLevel(e, CheckLevel.WARNING);
  }

  private void assertSmaller(ErrorWithLevel p1, ErrorWithLevel p2) {
    int p1p2 = comparator.compare(p1, p2);
    assertWithMessage(Integer.toString(p1p2)).that(p1p2 < 0).isTrue();
    int p2p1 = comparator.compare(p2, p1);
    assertWithMessage(Integer.toString(p2p1)).that(p2p1 > 0).isTrue();
  }
}
