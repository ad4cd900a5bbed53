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

package com.google.tsdown.compiler;

import static com.google.common.truth.Truth.assertThat;

import com.google.tsdown.compiler.BasicErrorManager.ErrorWithLevel;
import com.google.tsdown.compiler.BasicErrorManager.LeveledJSErrorComparator;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link BasicErrorManager}. */
@RunWith(JUnit4.class)
public final class BasicErrorManagerTest {
  private final LeveledJSErrorComparator comparator = new LeveledJSErrorComparator();

  private static final DiagnosticType FOO_TYPE = DiagnosticType.error("TEST_FOO", "Foo");

  private static final DiagnosticType JOO_TYPE = DiagnosticType.error("TEST_JOO", "Joo {0}");

  @Test
  public void testOrderingSourceName() {
    JSError e1 = JSError.make(FOO_TYPE);
    JSError e2 = JSError.make("a.ts", -1, -1, FOO_TYPE);
    JSError e3 = JSError.make("b.ts", -1, -1, FOO_TYPE);

    assertSmaller(error(e1), error(e2));
    assertSmaller(error(e2), error(e3));
  }

  @Test
  public void testOrderingLineno() {
    JSError e1 = JSError.make("a.ts", 8, -1, FOO_TYPE);
    JSError e2 = JSError.make("a.ts", 56, -1, FOO_TYPE);

    assertSmaller(error(e1), error(e2));
  }

  @Test
  public void testOrderingCheckLevel() {
    JSError e1 = JSError.make("a.ts", 5, -1, FOO_TYPE);
    JSError e2 = JSError.make("a.ts", 5, -1, FOO_TYPE);

    assertSmaller(error(e1), warning(e2));
  }

  @Test
  public void testOrderingCharno() {
    JSError e1 = JSError.make("a.ts", 5, 1, FOO_TYPE);
    JSError e2 = JSError.make("a.ts", 5, 2, FOO_TYPE);

    assertSmaller(error(e1), error(e2));
    // The level is compared before the column.
    assertSmaller(error(e2), warning(e1));
  }

  @Test
  public void testOrderingDescription() {
    JSError e1 = JSError.make("a.ts", 5, 1, JOO_TYPE, "a");
    JSError e2 = JSError.make("a.ts", 5, 1, JOO_TYPE, "b");

    assertSmaller(error(e1), error(e2));
  }

  @Test
  public void testCountsAndDeduplicates() {
    BasicErrorManager manager = new BasicErrorManager();
    JSError error = JSError.make("a.ts", 1, 0, FOO_TYPE);
    manager.report(CheckLevel.ERROR, error);
    manager.report(CheckLevel.ERROR, error);
    manager.report(CheckLevel.WARNING, JSError.make("a.ts", 2, 0, JOO_TYPE, "x"));
    manager.report(CheckLevel.OFF, JSError.make("a.ts", 3, 0, JOO_TYPE, "y"));

    assertThat(manager.getErrorCount()).isEqualTo(1);
    assertThat(manager.getWarningCount()).isEqualTo(1);
    assertThat(manager.getErrors()).containsExactly(error);
    assertThat(manager.getWarnings().get(0).description()).isEqualTo("Joo x");
  }

  @Test
  public void testGenerateReportPrintsInOrder() {
    List<String> printed = new ArrayList<>();
    BasicErrorManager manager =
        new BasicErrorManager() {
          @Override
          public void println(CheckLevel level, JSError error) {
            printed.add(error.format(level));
          }
        };
    manager.report(CheckLevel.WARNING, JSError.make("b.ts", 1, 0, JOO_TYPE, "later"));
    manager.report(CheckLevel.ERROR, JSError.make("a.ts", 4, 2, FOO_TYPE));
    manager.generateReport();

    assertThat(printed)
        .containsExactly(
            "a.ts:4:2: ERROR - [TEST_FOO] Foo", "b.ts:1:0: WARNING - [TEST_JOO] Joo later")
        .inOrder();
  }

  private ErrorWithLevel error(JSError e) {
    return new ErrorWithLevel(e, CheckLevel.ERROR);
  }

  private ErrorWithLevel warning(JSError e) {
    return new ErrorWithLevel(e, CheckLevel.WARNING);
  }

  private void assertSmaller(ErrorWithLevel p1, ErrorWithLevel p2) {
    assertThat(comparator.compare(p1, p2)).isLessThan(0);
    assertThat(comparator.compare(p2, p1)).isGreaterThan(0);
  }
}
