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

import static com.google.common.base.Preconditions.checkNotNull;

import io.github.scopelift.codemodel.ExpressionKind;

/**
 * Thrown when a function contains a write that cannot be given a declaration, for example an
 * assignment to an indexer inside a loop condition. No placement is guessed for such a function.
 */
public final class UnsupportedConstructException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ExpressionKind construct;
  private final transient StatementPath path;

  UnsupportedConstructException(ExpressionKind construct, StatementPath path) {
    super("Unsupported assignment target " + construct + " at " + path);
    this.construct = checkNotNull(construct);
    this.path = checkNotNull(path);
  }

  /** The kind of the unsupported assignment target. */
  public ExpressionKind getConstruct() {
    return construct;
  }

  /** The path of the statement containing the unsupported assignment. */
  public StatementPath getPath() {
    return path;
  }
}
