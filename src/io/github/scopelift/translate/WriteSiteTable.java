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

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import java.util.Set;

/**
 * Collects, per variable name, the paths of the statements in which the variable is written.
 * Names and paths keep the order in which they were first recorded. Writes to globals are
 * dropped.
 */
final class WriteSiteTable {
  private final ImmutableSet<String> globals;
  private final ListMultimap<String, StatementPath> writeSites =
      MultimapBuilder.linkedHashKeys().arrayListValues().build();

  WriteSiteTable(Set<String> globals) {
    this.globals = ImmutableSet.copyOf(globals);
  }

  /** Records a write to {@code name} in the statement at the end of {@code path}. */
  void recordWrite(String name, StatementPath path) {
    if (globals.contains(name)) {
      return;
    }
    writeSites.put(name, path);
  }

  ImmutableListMultimap<String, StatementPath> build() {
    return ImmutableListMultimap.copyOf(writeSites);
  }
}
