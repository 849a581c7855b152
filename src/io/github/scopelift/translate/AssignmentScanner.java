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
import io.github.scopelift.codemodel.Expression;

/**
 * Finds variables written by assignments nested inside expressions, such as the {@code x} in
 * {@code while ((x = next()) != null)}. Each such write is recorded against the path of the
 * statement evaluating the expression, exactly like a statement-level assignment.
 *
 * <p>Only assignments to bare variable names can be handled. Assigning to a field, an indexer or
 * a destructuring pattern inside an expression fails the whole function.
 */
final class AssignmentScanner {
  private final WriteSiteTable writeSites;

  AssignmentScanner(WriteSiteTable writeSites) {
    this.writeSites = writeSites;
  }

  /** Scans {@code expression}, evaluated by the statement at the end of {@code path}. */
  void scan(Expression expression, StatementPath path) throws UnsupportedConstructException {
    ImmutableList<Expression> children =
        switch (expression.getKind()) {
          case NAME, LITERAL, THIS, SUPER, TYPE_REFERENCE -> ImmutableList.of();
          case ASSIGN -> {
            Expression.Assign assign = (Expression.Assign) expression;
            recordAssignment(assign, path);
            yield ImmutableList.of(assign.getValue());
          }
          case CALL -> ((Expression.Call) expression).getArguments();
          case GET_FIELD -> ImmutableList.of(((Expression.GetField) expression).getBase());
          case AWAIT -> ImmutableList.of(((Expression.Await) expression).getValue());
          case UNARY -> ImmutableList.of(((Expression.Unary) expression).getOperand());
          case BINARY -> {
            Expression.Binary binary = (Expression.Binary) expression;
            yield ImmutableList.of(binary.getLeft(), binary.getRight());
          }
          case INDEX -> {
            Expression.Index index = (Expression.Index) expression;
            yield ImmutableList.of(index.getBase(), index.getIndex());
          }
          case TUPLE -> ((Expression.Tuple) expression).getElements();
          case ARRAY_LITERAL -> ((Expression.ArrayLiteral) expression).getElements();
          case CONDITIONAL -> {
            Expression.Conditional conditional = (Expression.Conditional) expression;
            yield ImmutableList.of(
                conditional.getCondition(), conditional.getWhenTrue(), conditional.getWhenFalse());
          }
          case CAST -> ImmutableList.of(((Expression.Cast) expression).getOperand());
          case NEW -> ((Expression.New) expression).getArguments();
          case NAMED_ARGUMENT ->
              ImmutableList.of(((Expression.NamedArgument) expression).getValue());
          // The body runs in its own scope; the defaults are evaluated here.
          case LAMBDA -> ImmutableList.copyOf(((Expression.Lambda) expression).getParameters());
          case PARAMETER -> {
            Expression defaultValue = ((Expression.Parameter) expression).getDefaultValue();
            yield defaultValue == null ? ImmutableList.of() : ImmutableList.of(defaultValue);
          }
        };
    for (Expression child : children) {
      scan(child, path);
    }
  }

  private void recordAssignment(Expression.Assign assign, StatementPath path)
      throws UnsupportedConstructException {
    Expression target = assign.getTarget();
    if (!target.isName()) {
      throw new UnsupportedConstructException(target.getKind(), path);
    }
    writeSites.recordWrite(((Expression.Name) target).getName(), path);
  }
}
