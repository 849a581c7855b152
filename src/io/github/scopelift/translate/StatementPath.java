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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import io.github.scopelift.codemodel.Statement;

/**
 * The chain of statements from the top of a function body down to one statement, inclusive. Each
 * entry is a member of one of the blocks owned by the entry before it.
 */
public final class StatementPath {
  private static final StatementPath ROOT = new StatementPath(ImmutableList.of());

  private final ImmutableList<Statement> statements;

  private StatementPath(ImmutableList<Statement> statements) {
    this.statements = statements;
  }

  /** The empty path, above the top-level statements of a function. */
  public static StatementPath root() {
    return ROOT;
  }

  /** Returns a new path one level deeper, ending at {@code statement}. */
  public StatementPath extend(Statement statement) {
    return new StatementPath(
        ImmutableList.<Statement>builderWithExpectedSize(statements.size() + 1)
            .addAll(statements)
            .add(statement)
            .build());
  }

  public int size() {
    return statements.size();
  }

  public Statement get(int index) {
    return statements.get(index);
  }

  /** The statement this path leads to. */
  public Statement getLast() {
    checkState(!statements.isEmpty(), "the root path has no statements");
    return Iterables.getLast(statements);
  }

  public ImmutableList<Statement> getStatements() {
    return statements;
  }

  @Override
  public String toString() {
    if (statements.isEmpty()) {
      return "<root>";
    }
    return Joiner.on(" > ").join(Iterables.transform(statements, Statement::getLabel));
  }
}
