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

import static com.google.common.base.Preconditions.checkArgument;

import io.github.scopelift.codemodel.Statement;
import java.util.List;

/**
 * Reduces the write sites of one variable to the deepest statement they all share.
 *
 * <p>The paths are compared pairwise against the first one, which keeps a single bound: the
 * deepest index of the first path still common to every path seen so far. At each depth two paths
 * either diverged one level up (their statements sit in different blocks, e.g. the two branches of
 * an {@code if}), are siblings in the same block (the shared point is the current depth), or go
 * through the same statement (keep descending).
 */
final class CommonPathResolver {

  /** Returned when no statement is common to all write sites. */
  static final int NO_COMMON_ANCESTOR = -1;

  private final FunctionIndex index;

  CommonPathResolver(FunctionIndex index) {
    this.index = index;
  }

  /**
   * Returns an index into {@code paths.get(0)} naming the deepest statement every path goes
   * through or sits next to, or {@link #NO_COMMON_ANCESTOR}.
   */
  int resolve(List<StatementPath> paths) {
    checkArgument(!paths.isEmpty(), "no write sites");
    StatementPath first = paths.get(0);
    int bound = first.size() - 1;
    for (StatementPath other : paths.subList(1, paths.size())) {
      bound = narrow(first, other, bound);
      if (bound < 0) {
        return NO_COMMON_ANCESTOR;
      }
    }
    return bound;
  }

  private int narrow(StatementPath first, StatementPath other, int bound) {
    bound = Math.min(bound, Math.min(first.size(), other.size()) - 1);
    for (int i = 0; i <= bound; i++) {
      Statement a = first.get(i);
      Statement b = other.get(i);
      if (index.getParentBlock(a).getId() != index.getParentBlock(b).getId()) {
        return i - 1;
      }
      if (a.getId() != b.getId()) {
        return i;
      }
    }
    return bound;
  }
}
