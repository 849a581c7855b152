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
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import io.github.scopelift.codemodel.Block;
import io.github.scopelift.codemodel.Expression;
import io.github.scopelift.codemodel.Statement;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Walks a function body depth first, recording for every statement the block it belongs to and,
 * for every write to a variable, the path of the statement performing it.
 *
 * <p>Only the blocks of conditionals, loops and try statements are entered. The bodies of
 * scoped-resource statements and local functions are left alone, as are expressions of statements
 * other than loop tests, conditions and iteration sources.
 *
 * <p>All state lives in the instance created by {@link #index}, so independent function bodies
 * can be indexed concurrently.
 */
final class WriteSiteIndexer {
  private final WriteSiteTable writeSites;
  private final AssignmentScanner scanner;
  private final Map<Integer, Block> parentBlocks = new LinkedHashMap<>();
  private final ListMultimap<String, StatementPath> declarationSites =
      MultimapBuilder.linkedHashKeys().arrayListValues().build();

  private WriteSiteIndexer(Set<String> globals) {
    this.writeSites = new WriteSiteTable(globals);
    this.scanner = new AssignmentScanner(writeSites);
  }

  /**
   * Indexes the statements of {@code body}.
   *
   * @param globals names owned by the enclosing module; writes to them are not recorded
   * @throws UnsupportedConstructException if an expression assigns to something other than a
   *     bare variable
   */
  static FunctionIndex index(Block body, Set<String> globals)
      throws UnsupportedConstructException {
    WriteSiteIndexer indexer = new WriteSiteIndexer(globals);
    indexer.indexBlock(StatementPath.root(), body);
    return new FunctionIndex(
        indexer.writeSites.build(),
        ImmutableMap.copyOf(indexer.parentBlocks),
        ImmutableListMultimap.copyOf(indexer.declarationSites));
  }

  private void indexBlock(StatementPath basePath, Block block)
      throws UnsupportedConstructException {
    for (Statement statement : block) {
      StatementPath path = basePath.extend(statement);
      parentBlocks.put(statement.getId(), block);
      for (Block child : visit(statement, path)) {
        indexBlock(path, child);
      }
    }
  }

  /** Records what {@code statement} itself writes or declares and returns the blocks to enter. */
  private ImmutableList<Block> visit(Statement statement, StatementPath path)
      throws UnsupportedConstructException {
    return switch (statement.getKind()) {
      case ASSIGN -> {
        Expression target = ((Statement.Assign) statement).getTarget();
        if (target.isName()) {
          writeSites.recordWrite(((Expression.Name) target).getName(), path);
        }
        yield ImmutableList.of();
      }
      case IF -> {
        Statement.If n = (Statement.If) statement;
        scanner.scan(n.getCondition(), path);
        yield ImmutableList.of(n.getThenBlock(), n.getElseBlock());
      }
      case WHILE -> {
        Statement.While n = (Statement.While) statement;
        scanner.scan(n.getTest(), path);
        yield ImmutableList.of(n.getBody());
      }
      case DO_WHILE -> {
        Statement.DoWhile n = (Statement.DoWhile) statement;
        scanner.scan(n.getTest(), path);
        yield ImmutableList.of(n.getBody());
      }
      case FOREACH -> {
        Statement.Foreach n = (Statement.Foreach) statement;
        scanner.scan(n.getCollection(), path);
        yield ImmutableList.of(n.getBody());
      }
      case TRY -> {
        Statement.Try n = (Statement.Try) statement;
        ImmutableList.Builder<Block> blocks = ImmutableList.builder();
        blocks.add(n.getTryBlock());
        for (Statement.CatchClause clause : n.getCatchClauses()) {
          blocks.add(clause.getBody());
        }
        yield blocks.add(n.getFinallyBlock()).build();
      }
      case VAR_DECL -> {
        declarationSites.put(((Statement.VarDecl) statement).getName(), path);
        yield ImmutableList.of();
      }
      case LOCAL_FUNCTION -> {
        declarationSites.put(((Statement.LocalFunction) statement).getFunction().getName(), path);
        yield ImmutableList.of();
      }
      case BREAK, CONTINUE, RETURN, THROW, USING, COMMENT, EXPR_RESULT, YIELD -> ImmutableList.of();
    };
  }
}
