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
import com.google.common.collect.Sets;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.scopelift.codemodel.Block;
import io.github.scopelift.codemodel.FunctionDefinition;
import io.github.scopelift.codemodel.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/**
 * Runs {@link DeclareLocalVariables} over every function of a module.
 *
 * <p>Functions are independent trees: a function's pass never looks inside the local functions
 * it contains, and those are processed as functions of their own. That makes it safe to process
 * them on several threads. The globals set is frozen for the whole run and diagnostics go through
 * a {@link ThreadSafeDelegatingErrorManager}.
 */
public final class TranslationDriver {
  private static final Logger logger = Logger.getLogger(TranslationDriver.class.getName());

  /** What a run did. */
  public record Result(int functionCount, int changedFunctionCount, int errorCount) {}

  private final TranslatorOptions options;
  private final ErrorManager errorManager;

  public TranslationDriver(TranslatorOptions options, ErrorManager errorManager) {
    this.options = options;
    this.errorManager = errorManager;
  }

  /**
   * Declares the local variables of {@code functions}, and of the local functions they contain
   * when {@link TranslatorOptions#shouldProcessLocalFunctions()} is set.
   */
  public Result translate(List<FunctionDefinition> functions, Set<String> globals) {
    ImmutableSet<String> frozenGlobals = ImmutableSet.copyOf(globals);
    ImmutableList<FunctionDefinition> worklist = collectFunctions(functions);
    int errorsBefore = errorManager.getErrorCount();

    int changed;
    int numThreads = Math.min(options.getNumParallelThreads(), worklist.size());
    if (numThreads > 1) {
      ErrorManager reporter = new ThreadSafeDelegatingErrorManager(errorManager);
      FunctionPass pass = new DeclareLocalVariables(frozenGlobals, options, reporter);
      changed = processInParallel(pass, worklist, numThreads);
    } else {
      FunctionPass pass = new DeclareLocalVariables(frozenGlobals, options, errorManager);
      changed = 0;
      for (FunctionDefinition function : worklist) {
        if (pass.process(function)) {
          changed++;
        }
      }
    }

    Result result =
        new Result(worklist.size(), changed, errorManager.getErrorCount() - errorsBefore);
    logger.info(
        "Declared local variables in "
            + result.changedFunctionCount()
            + " of "
            + result.functionCount()
            + " function(s), "
            + result.errorCount()
            + " error(s)");
    return result;
  }

  private static int processInParallel(
      FunctionPass pass, ImmutableList<FunctionDefinition> worklist, int numThreads) {
    ListeningExecutorService executorService =
        MoreExecutors.listeningDecorator(
            Executors.newFixedThreadPool(
                numThreads,
                new ThreadFactoryBuilder()
                    .setNameFormat("scopelift-worker-%d")
                    .setDaemon(true) // Do not prevent the JVM from exiting.
                    .build()));
    List<ListenableFuture<Boolean>> futures = new ArrayList<>(worklist.size());
    for (FunctionDefinition function : worklist) {
      futures.add(executorService.submit(() -> pass.process(function)));
    }
    executorService.shutdown();

    List<Boolean> results;
    try {
      results = Futures.allAsList(futures).get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while translating functions", e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw new IllegalStateException(e.getCause());
    }
    int changed = 0;
    for (boolean result : results) {
      if (result) {
        changed++;
      }
    }
    return changed;
  }

  /**
   * Returns {@code functions} followed by the local functions nested in them, outermost first.
   * Each function appears once, however often it is listed or reached, so no two workers share a
   * body.
   */
  private ImmutableList<FunctionDefinition> collectFunctions(List<FunctionDefinition> functions) {
    Set<FunctionDefinition> seen = Sets.newIdentityHashSet();
    ImmutableList.Builder<FunctionDefinition> worklist = ImmutableList.builder();
    List<FunctionDefinition> pending = enqueue(functions, seen, worklist);
    if (options.shouldProcessLocalFunctions()) {
      while (!pending.isEmpty()) {
        List<FunctionDefinition> nested = new ArrayList<>();
        for (FunctionDefinition function : pending) {
          collectLocalFunctions(function.getBody(), nested);
        }
        pending = enqueue(nested, seen, worklist);
      }
    }
    return worklist.build();
  }

  /** Adds the functions not seen before to {@code worklist} and returns them. */
  private static List<FunctionDefinition> enqueue(
      List<FunctionDefinition> functions,
      Set<FunctionDefinition> seen,
      ImmutableList.Builder<FunctionDefinition> worklist) {
    List<FunctionDefinition> added = new ArrayList<>();
    for (FunctionDefinition function : functions) {
      if (seen.add(function)) {
        worklist.add(function);
        added.add(function);
      }
    }
    return added;
  }

  /** Finds local functions anywhere in {@code block}, without entering the functions found. */
  private static void collectLocalFunctions(Block block, List<FunctionDefinition> found) {
    for (Statement statement : block) {
      ImmutableList<Block> children =
          switch (statement.getKind()) {
            case LOCAL_FUNCTION -> {
              found.add(((Statement.LocalFunction) statement).getFunction());
              yield ImmutableList.of();
            }
            case IF -> {
              Statement.If n = (Statement.If) statement;
              yield ImmutableList.of(n.getThenBlock(), n.getElseBlock());
            }
            case WHILE -> ImmutableList.of(((Statement.While) statement).getBody());
            case DO_WHILE -> ImmutableList.of(((Statement.DoWhile) statement).getBody());
            case FOREACH -> ImmutableList.of(((Statement.Foreach) statement).getBody());
            case USING -> ImmutableList.of(((Statement.Using) statement).getBody());
            case TRY -> {
              Statement.Try n = (Statement.Try) statement;
              ImmutableList.Builder<Block> blocks = ImmutableList.builder();
              blocks.add(n.getTryBlock());
              for (Statement.CatchClause clause : n.getCatchClauses()) {
                blocks.add(clause.getBody());
              }
              yield blocks.add(n.getFinallyBlock()).build();
            }
            case ASSIGN, BREAK, CONTINUE, RETURN, THROW, VAR_DECL, COMMENT, EXPR_RESULT, YIELD ->
                ImmutableList.of();
          };
      for (Block child : children) {
        collectLocalFunctions(child, found);
      }
    }
  }
}
