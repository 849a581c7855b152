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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.github.scopelift.codemodel.Block;
import io.github.scopelift.codemodel.Statement;
import java.util.List;

/**
 * What {@link WriteSiteIndexer} learned about one function body: where each variable is written,
 * which block every visited statement belongs to, and where names are already declared.
 */
final class FunctionIndex {
  private final ImmutableListMultimap<String, StatementPath> writeSites;
  private final ImmutableMap<Integer, Block> parentBlocks;
  private final ImmutableListMultimap<String, StatementPath> declarationSites;

  FunctionIndex(
      ImmutableListMultimap<String, StatementPath> writeSites,
      ImmutableMap<Integer, Block> parentBlocks,
      ImmutableListMultimap<String, StatementPath> declarationSites) {
    this.writeSites = checkNotNull(writeSites);
    this.parentBlocks = checkNotNull(parentBlocks);
    this.declarationSites = checkNotNull(declarationSites);
  }

  /** Names with at least one recorded write, in order of first write. */
  ImmutableSet<String> getWrittenNames() {
    return writeSites.keySet();
  }

  /** The paths of the statements writing {@code name}, in traversal order. */
  ImmutableList<StatementPath> getWriteSites(String name) {
    return writeSites.get(name);
  }

  /** The paths of the declarations of {@code name} already in the body, in traversal order. */
  ImmutableList<StatementPath> getDeclarationSites(String name) {
    return declarationSites.get(name);
  }

  /**
   * Whether an existing declaration of {@code name} is in scope at every write of it, that is,
   * whether every write path passes through the block holding the declaration.
   */
  boolean isDeclaredAtEveryWrite(String name) {
    for (StatementPath declaration : declarationSites.get(name)) {
      if (enclosesAll(declaration, writeSites.get(name))) {
        return true;
      }
    }
    return false;
  }

  private boolean enclosesAll(StatementPath declaration, List<StatementPath> writes) {
    int depth = declaration.size() - 1;
    Block block = getParentBlock(declaration.getLast());
    for (StatementPath write : writes) {
      if (write.size() <= depth || getParentBlock(write.get(depth)) != block) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the block {@code statement} is a member of. Every statement on a recorded path has
   * one; a missing entry means the indexer skipped a statement it put on a path.
   */
  Block getParentBlock(Statement statement) {
    Block block = parentBlocks.get(statement.getId());
    checkState(block != null, "No parent block recorded for %s", statement.getLabel());
    return block;
  }
}
