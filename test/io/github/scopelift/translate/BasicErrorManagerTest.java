/*
 * Copyright 2026 The Scopelift Authors.
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
package io.github.scopelift.translate;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link BasicErrorManager} */
@RunWith(JUnit4.class)
public final class BasicErrorManagerTest {
  private static final DiagnosticType FOO_TYPE =
      DiagnosticType.error("TEST_FOO", "Foo description {0}");
  private static final DiagnosticType BAR_TYPE =
      DiagnosticType.warning("TEST_BAR", "Bar description");

  private final List<String> printed = new ArrayList<>();
  private BasicErrorManager manager;

  @Before
  public void setUp() {
    printed.clear();
    manager =
        new BasicErrorManager() {
          @Override
          protected void println(CheckLevel level, TranslationError error) {
            printed.add(error.format(level));
          }

          @Override
          protected void printSummary() {
            printed.add(getErrorCount() + "/" + getWarningCount());
          }
        };
  }

  private static TranslationError error(DiagnosticType type, String function, int lineno) {
    return new TranslationError(type, type.format("x"), function, lineno, null);
  }

  @Test
  public void testErrorsSortBeforeWarnings() {
    manager.report(CheckLevel.WARNING, TranslationError.make(BAR_TYPE));
    manager.report(CheckLevel.ERROR, TranslationError.make(FOO_TYPE, "a"));

    manager.generateReport();

    assertThat(printed)
        .containsExactly(
            "ERROR - [TEST_FOO] Foo description a", "WARNING - [TEST_BAR] Bar description", "1/1")
        .inOrder();
  }

  @Test
  public void testSortsByFunctionThenLine() {
    manager.report(CheckLevel.ERROR, error(FOO_TYPE, "g", 1));
    manager.report(CheckLevel.ERROR, error(FOO_TYPE, "f", 9));
    manager.report(CheckLevel.ERROR, error(FOO_TYPE, "f", 2));

    ImmutableList<TranslationError> errors = manager.getErrors();

    assertThat(errors).hasSize(3);
    assertThat(errors.get(0).lineno()).isEqualTo(2);
    assertThat(errors.get(1).lineno()).isEqualTo(9);
    assertThat(errors.get(2).functionName()).isEqualTo("g");
  }

  @Test
  public void testDuplicatesAreReportedOnce() {
    manager.report(CheckLevel.ERROR, TranslationError.make(FOO_TYPE, "a"));
    manager.report(CheckLevel.ERROR, TranslationError.make(FOO_TYPE, "a"));

    assertThat(manager.getErrorCount()).isEqualTo(1);
    assertThat(manager.hasErrors()).isTrue();
  }

  @Test
  public void testReportLevelOverridesDefault() {
    manager.report(CheckLevel.WARNING, TranslationError.make(FOO_TYPE, "a"));
    manager.report(CheckLevel.OFF, TranslationError.make(BAR_TYPE));

    assertThat(manager.getErrorCount()).isEqualTo(0);
    assertThat(manager.getWarningCount()).isEqualTo(1);
    assertThat(manager.hasErrors()).isFalse();
    assertThat(manager.getWarnings().get(0).getDefaultLevel()).isEqualTo(CheckLevel.ERROR);
  }
}
