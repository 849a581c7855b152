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

import com.google.common.collect.ImmutableList;

/** The error manager is in charge of storing, organizing and displaying errors and warnings. */
public interface ErrorManager {

  /**
   * Records {@code error} at {@code level}, which may differ from the error's default level. Errors
   * reported at {@link CheckLevel#OFF} are dropped.
   */
  void report(CheckLevel level, TranslationError error);

  /** Writes a report to an implementation-specific medium. */
  void generateReport();

  /** Gets the number of errors. */
  int getErrorCount();

  /** Gets the number of warnings. */
  int getWarningCount();

  /** Gets all the errors. */
  ImmutableList<TranslationError> getErrors();

  /** Gets all the warnings. */
  ImmutableList<TranslationError> getWarnings();

  /** Whether any error was reported. */
  default boolean hasErrors() {
    return getErrorCount() > 0;
  }
}
