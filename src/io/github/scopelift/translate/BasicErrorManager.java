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

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.util.Comparator;
import java.util.TreeSet;

/**
 * An error manager that collects diagnostics in memory and, when {@link #generateReport()} is
 * called, emits them sorted by level, function, line and description.
 *
 * <p>This error manager does not produce any output; subclasses override {@link
 * #println(CheckLevel, TranslationError)} and {@link #printSummary()}.
 */
public class BasicErrorManager implements ErrorManager {

  private final TreeSet<ErrorWithLevel> messages = new TreeSet<>(new LeveledErrorComparator());
  private int errorCount = 0;
  private int warningCount = 0;

  @Override
  public void report(CheckLevel level, TranslationError error) {
    if (!level.isOn()) {
      return;
    }
    if (messages.add(new ErrorWithLevel(error, level))) {
      if (level == CheckLevel.ERROR) {
        errorCount++;
      } else {
        warningCount++;
      }
    }
  }

  @Override
  public void generateReport() {
    for (ErrorWithLevel message : ImmutableList.copyOf(messages)) {
      println(message.level, message.error);
    }
    printSummary();
  }

  /** Prints one diagnostic. Called by {@link #generateReport()} in sorted order. */
  protected void println(CheckLevel level, TranslationError error) {}

  /** Prints the number of errors and warnings. */
  protected void printSummary() {}

  @Override
  public int getErrorCount() {
    return errorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<TranslationError> getErrors() {
    return toList(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<TranslationError> getWarnings() {
    return toList(CheckLevel.WARNING);
  }

  private ImmutableList<TranslationError> toList(CheckLevel level) {
    ImmutableList.Builder<TranslationError> errors = ImmutableList.builder();
    for (ErrorWithLevel p : messages) {
      if (p.level == level) {
        errors.add(p.error);
      }
    }
    return errors.build();
  }

  /**
   * Orders errors before warnings, then by function name (unnamed first), line number, key and
   * description.
   */
  static final class LeveledErrorComparator implements Comparator<ErrorWithLevel> {
    @Override
    public int compare(ErrorWithLevel p1, ErrorWithLevel p2) {
      return ComparisonChain.start()
          .compare(p1.level, p2.level)
          .compare(
              p1.error.functionName(),
              p2.error.functionName(),
              Ordering.<String>natural().nullsFirst())
          .compare(p1.error.lineno(), p2.error.lineno())
          .compare(p1.error.type(), p2.error.type())
          .compare(p1.error.description(), p2.error.description())
          .compare(
              p1.error.location(), p2.error.location(), Ordering.<String>natural().nullsFirst())
          .result();
    }
  }

  static final class ErrorWithLevel {
    final TranslationError error;
    final CheckLevel level;

    ErrorWithLevel(TranslationError error, CheckLevel level) {
      this.error = error;
      this.level = level;
    }
  }
}
