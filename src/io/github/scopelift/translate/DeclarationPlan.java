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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import io.github.scopelift.codemodel.Block;
import io.github.scopelift.codemodel.Statement;
import org.jspecify.annotations.Nullable;

/**
 * Where each undeclared variable of a function gets its declaration. Computed from the unmodified
 * tree before anything is rewritten, so placements cannot interfere with each other.
 */
final class DeclarationPlan {

  /** How a declaration is introduced. */
  enum Kind {
    /** The plain assignment {@code target} is replaced by {@code declaration} in place. */
    SUBSTITUTE,
    /** {@code declaration} is inserted at the top of the function body. */
    HOIST_TO_TOP
  }

  /** The declaration decision for one variable. */
  record Placement(
      String name,
      Kind kind,
      Statement.VarDecl declaration,
      @Nullable Statement target,
      @Nullable Block targetBlock) {
    Placement {
      checkNotNull(name);
      checkNotNull(kind);
      checkNotNull(declaration);
      checkArgument(
          (kind == Kind.SUBSTITUTE) == (target != null && targetBlock != null),
          "target statement and block are required exactly for substitutions");
    }

    static Placement substitute(
        String name, Statement target, Block targetBlock, Statement.VarDecl declaration) {
      return new Placement(name, Kind.SUBSTITUTE, declaration, target, targetBlock);
    }

    static Placement hoistToTop(String name, Statement.VarDecl declaration) {
      return new Placement(name, Kind.HOIST_TO_TOP, declaration, null, null);
    }
  }

  private final ImmutableList<Placement> placements;

  DeclarationPlan(ImmutableList<Placement> placements) {
    this.placements = placements;
  }

  /** One placement per variable, in order of the variables' first writes. */
  ImmutableList<Placement> getPlacements() {
    return placements;
  }

  boolean isEmpty() {
    return placements.isEmpty();
  }
}
