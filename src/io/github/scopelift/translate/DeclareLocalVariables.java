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

import com.google.common.collect.ImmutableSet;
import io.github.scopelift.codemodel.Block;
import io.github.scopelift.codemodel.FunctionDefinition;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Gives every variable a function writes without declaring an explicit declaration, placed as
 * deep in the statement tree as all of the variable's writes allow. For instance
 *
 * <pre>
 *   y = compute();
 *   if (c) { x = 1; } else { x = 2; }
 * </pre>
 *
 * becomes
 *
 * <pre>
 *   object x;
 *   var y = compute();
 *   if (c) { x = 1; } else { x = 2; }
 * </pre>
 *
 * <p>A variable whose writes share a single plain assignment gets that assignment turned into a
 * declaration. Anything else gets a bare declaration at the top of the body. Parameters and
 * globals are never declared.
 *
 * <p>If the body assigns to something other than a bare variable inside an expression, the pass
 * reports {@link #UNSUPPORTED_ASSIGNMENT_TARGET} and leaves the function unchanged.
 */
public final class DeclareLocalVariables implements FunctionPass {
  private static final Logger logger = Logger.getLogger(DeclareLocalVariables.class.getName());

  static final DiagnosticType UNSUPPORTED_ASSIGNMENT_TARGET =
      DiagnosticType.error(
          "SCOPELIFT_UNSUPPORTED_ASSIGNMENT_TARGET",
          "Cannot declare variables of a function assigning to {0} inside an expression");

  private static final String ANONYMOUS_FUNCTION = "<anonymous>";

  private final ImmutableSet<String> globals;
  private final TranslatorOptions options;
  private final ErrorManager errorManager;

  /**
   * @param globals names owned by the enclosing module; must not change while the pass runs
   */
  public DeclareLocalVariables(
      Set<String> globals, TranslatorOptions options, ErrorManager errorManager) {
    this.globals = ImmutableSet.copyOf(globals);
    this.options = options;
    this.errorManager = errorManager;
  }

  @Override
  public boolean process(FunctionDefinition function) {
    return process(function.getName(), function.getParameterNames(), function.getBody());
  }

  /**
   * Processes a function body given directly.
   *
   * @param parameterNames the names bound by the function signature
   * @param body the top-level statements of the function, rewritten in place
   * @return whether the body was changed
   */
  public boolean process(List<String> parameterNames, Block body) {
    return process(ANONYMOUS_FUNCTION, parameterNames, body);
  }

  private boolean process(String functionName, List<String> parameterNames, Block body) {
    DeclarationPlan plan;
    try {
      plan = new DeclarationPlanner(globals, options).plan(parameterNames, body);
    } catch (UnsupportedConstructException e) {
      reportUnsupported(functionName, e);
      return false;
    }
    if (plan.isEmpty()) {
      return false;
    }
    if (logger.isLoggable(Level.FINE)) {
      for (DeclarationPlan.Placement placement : plan.getPlacements()) {
        logger.fine(
            functionName + ": " + placement.kind() + " " + placement.declaration().toString());
      }
    }
    DeclarationRewriter.rewrite(plan, body);
    return true;
  }

  private void reportUnsupported(String functionName, UnsupportedConstructException e) {
    StatementPath path = e.getPath();
    TranslationError.Builder error =
        TranslationError.builder(UNSUPPORTED_ASSIGNMENT_TARGET, e.getConstruct().toString())
            .setFunctionName(functionName)
            .setLocation(path.toString());
    if (path.size() > 0) {
      error.setStatement(path.getLast());
    }
    errorManager.report(options.getUnsupportedConstructLevel(), error.build());
  }
}
