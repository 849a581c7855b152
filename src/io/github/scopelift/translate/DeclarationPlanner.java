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
import com.google.common.collect.ImmutableSet;
import io.github.scopelift.codemodel.Block;
import io.github.scopelift.codemodel.Expression;
import io.github.scopelift.codemodel.IR;
import io.github.scopelift.codemodel.Statement;
import java.util.Collection;
import java.util.Set;

/**
 * Decides, for every variable a function body writes without declaring, where its declaration
 * goes. Parameters, globals and names already declared in a block every write passes through are
 * left alone.
 */
final class DeclarationPlanner {
  private final ImmutableSet<String> globals;
  private final TranslatorOptions options;

  DeclarationPlanner(Set<String> globals, TranslatorOptions options) {
    this.globals = ImmutableSet.copyOf(globals);
    this.options = options;
  }

  DeclarationPlan plan(Collection<String> parameterNames, Block body)
      throws UnsupportedConstructException {
    ImmutableSet<String> parameters = ImmutableSet.copyOf(parameterNames);
    FunctionIndex index = WriteSiteIndexer.index(body, globals);
    CommonPathResolver resolver = new CommonPathResolver(index);

    ImmutableList.Builder<DeclarationPlan.Placement> placements = ImmutableList.builder();
    for (String name : index.getWrittenNames()) {
      if (parameters.contains(name) || index.isDeclaredAtEveryWrite(name)) {
        continue;
      }
      ImmutableList<StatementPath> writeSites = index.getWriteSites(name);
      int bound = resolver.resolve(writeSites);
      placements.add(place(name, writeSites.get(0), bound, index));
    }
    return new DeclarationPlan(placements.build());
  }

  private DeclarationPlan.Placement place(
      String name, StatementPath firstWrite, int bound, FunctionIndex index) {
    if (bound != CommonPathResolver.NO_COMMON_ANCESTOR) {
      Statement target = firstWrite.get(bound);
      if (target.isPlainAssignmentTo(name)) {
        Expression value = ((Statement.Assign) target).getValue();
        return DeclarationPlan.Placement.substitute(
            name, target, index.getParentBlock(target), declare(name, value));
      }
    }
    return DeclarationPlan.Placement.hoistToTop(
        name, IR.var(options.getNullableTypeName(), name));
  }

  /** A literal absent value gives no type to infer from, so it gets the explicit type. */
  private Statement.VarDecl declare(String name, Expression initializer) {
    String typeName =
        initializer.isNullLiteral() ? options.getNullableTypeName() : options.getInferredTypeName();
    return IR.var(typeName, name, initializer);
  }
}
