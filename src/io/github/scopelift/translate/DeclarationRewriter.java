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

import static com.google.common.base.Preconditions.checkState;

import io.github.scopelift.codemodel.Block;
import io.github.scopelift.codemodel.Statement;
import java.util.HashSet;
import java.util.Set;

/**
 * Applies a {@link DeclarationPlan} to the function body it was computed from.
 *
 * <p>All substitutions are applied first, each locating its target by handle in the block it
 * belongs to. Bare declarations are then inserted at the top of the body, each at position zero,
 * so the last planned one ends up first.
 */
final class DeclarationRewriter {

  private DeclarationRewriter() {}

  /** Returns the number of declarations introduced. */
  static int rewrite(DeclarationPlan plan, Block body) {
    Set<Integer> substituted = new HashSet<>();
    for (DeclarationPlan.Placement placement : plan.getPlacements()) {
      if (placement.kind() == DeclarationPlan.Kind.SUBSTITUTE) {
        Statement target = placement.target();
        Block block = placement.targetBlock();
        checkState(substituted.add(target.getId()), "%s substituted twice", target.getLabel());
        int i = block.indexOf(target);
        checkState(i >= 0, "%s is no longer in its block", target.getLabel());
        block.set(i, placement.declaration());
      }
    }
    for (DeclarationPlan.Placement placement : plan.getPlacements()) {
      if (placement.kind() == DeclarationPlan.Kind.HOIST_TO_TOP) {
        body.addFirst(placement.declaration());
      }
    }
    return plan.getPlacements().size();
  }
}
