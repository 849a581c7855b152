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

/**
 * Serializes access to another {@link ErrorManager}. {@link TranslationDriver} hands one to all of
 * its workers when functions are translated on several threads.
 */
public class ThreadSafeDelegatingErrorManager implements ErrorManager {
  private final ErrorManager delegate;

  public ThreadSafeDelegatingErrorManager(ErrorManager delegate) {
    this.delegate = delegate;
  }

  @Override
  public synchronized void report(CheckLevel level, TranslationError error) {
    delegate.report(level, error);
  }

  @Override
  public synchronized void generateReport() {
    delegate.generateReport();
  }

  @Override
  public synchronized int getErrorCount() {
    return delegate.getErrorCount();
  }

  @Override
  public synchronized int getWarningCount() {
    return delegate.getWarningCount();
  }

  @Override
  public synchronized ImmutableList<TranslationError> getErrors() {
    return delegate.getErrors();
  }

  @Override
  public synchronized ImmutableList<TranslationError> getWarnings() {
    return delegate.getWarnings();
  }
}
