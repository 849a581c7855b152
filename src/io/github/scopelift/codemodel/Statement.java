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
package io.github.scopelift.codemodel;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.jspecify.annotations.Nullable;

/**
 * A statement in a function body.
 *
 * <p>Each statement is assigned a unique integer handle when it is constructed. Analyses compare
 * statements by handle, never by structure: two {@code x = 1;} statements in different branches
 * are different statements.
 *
 * <p>Each {@link StatementKind} has exactly one nested subclass.
 */
public abstract class Statement {
  private static final AtomicInteger nextId = new AtomicInteger();

  private final int id;
  private final StatementKind kind;
  private int lineno = -1;

  Statement(StatementKind kind) {
    this.id = nextId.incrementAndGet();
    this.kind = checkNotNull(kind);
  }

  /** The unique handle of this statement. */
  public final int getId() {
    return id;
  }

  public final StatementKind getKind() {
    return kind;
  }

  /** The source line this statement came from, or -1 if unknown. */
  public final int getLineno() {
    return lineno;
  }

  public final void setLineno(int lineno) {
    this.lineno = lineno;
  }

  /**
   * Whether this is a plain {@code name = value} assignment to {@code name}, as opposed to a
   * compound assignment or an assignment to something other than a bare variable.
   */
  public final boolean isPlainAssignmentTo(String name) {
    if (kind != StatementKind.ASSIGN) {
      return false;
    }
    Assign assign = (Assign) this;
    return !assign.isCompound() && assign.getTarget().isName(name);
  }

  /** A short label for diagnostics, such as {@code if#12}. */
  public final String getLabel() {
    return kind.name().toLowerCase() + "#" + id;
  }

  /** {@code target = value;} or, with an operator, {@code target op= value;} */
  public static final class Assign extends Statement {
    private final Expression target;
    private final Expression.@Nullable Operator compoundOperator;
    private final Expression value;

    Assign(Expression target, Expression.@Nullable Operator compoundOperator, Expression value) {
      super(StatementKind.ASSIGN);
      this.target = checkNotNull(target);
      this.compoundOperator = compoundOperator;
      this.value = checkNotNull(value);
    }

    public Expression getTarget() {
      return target;
    }

    public Expression getValue() {
      return value;
    }

    public boolean isCompound() {
      return compoundOperator != null;
    }

    public Expression.@Nullable Operator getCompoundOperator() {
      return compoundOperator;
    }

    @Override
    public String toString() {
      String op = compoundOperator == null ? "=" : compoundOperator.getSymbol() + "=";
      return target + " " + op + " " + value + ";";
    }
  }

  /** {@code if (condition) { ... } else { ... }} */
  public static final class If extends Statement {
    private final Expression condition;
    private final Block thenBlock;
    private final Block elseBlock;

    If(Expression condition, Block thenBlock, Block elseBlock) {
      super(StatementKind.IF);
      this.condition = checkNotNull(condition);
      this.thenBlock = checkNotNull(thenBlock);
      this.elseBlock = checkNotNull(elseBlock);
    }

    public Expression getCondition() {
      return condition;
    }

    public Block getThenBlock() {
      return thenBlock;
    }

    public Block getElseBlock() {
      return elseBlock;
    }

    @Override
    public String toString() {
      String s = "if (" + condition + ") " + thenBlock.toBracedString();
      return elseBlock.isEmpty() ? s : s + " else " + elseBlock.toBracedString();
    }
  }

  /** A pre-test loop. */
  public static final class While extends Statement {
    private final Expression test;
    private final Block body;

    While(Expression test, Block body) {
      super(StatementKind.WHILE);
      this.test = checkNotNull(test);
      this.body = checkNotNull(body);
    }

    public Expression getTest() {
      return test;
    }

    public Block getBody() {
      return body;
    }

    @Override
    public String toString() {
      return "while (" + test + ") " + body.toBracedString();
    }
  }

  /** A post-test loop. */
  public static final class DoWhile extends Statement {
    private final Block body;
    private final Expression test;

    DoWhile(Block body, Expression test) {
      super(StatementKind.DO_WHILE);
      this.body = checkNotNull(body);
      this.test = checkNotNull(test);
    }

    public Block getBody() {
      return body;
    }

    public Expression getTest() {
      return test;
    }

    @Override
    public String toString() {
      return "do " + body.toBracedString() + " while (" + test + ");";
    }
  }

  /**
   * Iteration over a collection. The loop variable is bound by the loop itself in the target
   * language.
   */
  public static final class Foreach extends Statement {
    private final Expression variable;
    private final Expression collection;
    private final Block body;

    Foreach(Expression variable, Expression collection, Block body) {
      super(StatementKind.FOREACH);
      this.variable = checkNotNull(variable);
      this.collection = checkNotNull(collection);
      this.body = checkNotNull(body);
    }

    public Expression getVariable() {
      return variable;
    }

    public Expression getCollection() {
      return collection;
    }

    public Block getBody() {
      return body;
    }

    @Override
    public String toString() {
      return "foreach (" + variable + " in " + collection + ") " + body.toBracedString();
    }
  }

  /** One handler of a {@link Try}. */
  public static final class CatchClause {
    private final String typeName;
    private final @Nullable String variableName;
    private final Block body;

    CatchClause(String typeName, @Nullable String variableName, Block body) {
      this.typeName = checkNotNull(typeName);
      this.variableName = variableName;
      this.body = checkNotNull(body);
    }

    public String getTypeName() {
      return typeName;
    }

    public @Nullable String getVariableName() {
      return variableName;
    }

    public Block getBody() {
      return body;
    }

    @Override
    public String toString() {
      String binding = variableName == null ? typeName : typeName + " " + variableName;
      return "catch (" + binding + ") " + body.toBracedString();
    }
  }

  /** {@code try { ... } catch (...) { ... } finally { ... }} */
  public static final class Try extends Statement {
    private final Block tryBlock;
    private final ImmutableList<CatchClause> catchClauses;
    private final Block finallyBlock;

    Try(Block tryBlock, List<CatchClause> catchClauses, Block finallyBlock) {
      super(StatementKind.TRY);
      this.tryBlock = checkNotNull(tryBlock);
      this.catchClauses = ImmutableList.copyOf(catchClauses);
      this.finallyBlock = checkNotNull(finallyBlock);
    }

    public Block getTryBlock() {
      return tryBlock;
    }

    public ImmutableList<CatchClause> getCatchClauses() {
      return catchClauses;
    }

    public Block getFinallyBlock() {
      return finallyBlock;
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder("try ").append(tryBlock.toBracedString());
      for (CatchClause clause : catchClauses) {
        sb.append(' ').append(clause);
      }
      if (!finallyBlock.isEmpty()) {
        sb.append(" finally ").append(finallyBlock.toBracedString());
      }
      return sb.toString();
    }
  }

  /** {@code break;} */
  public static final class Break extends Statement {
    Break() {
      super(StatementKind.BREAK);
    }

    @Override
    public String toString() {
      return "break;";
    }
  }

  /** {@code continue;} */
  public static final class Continue extends Statement {
    Continue() {
      super(StatementKind.CONTINUE);
    }

    @Override
    public String toString() {
      return "continue;";
    }
  }

  /** {@code return;} or {@code return value;} */
  public static final class Return extends Statement {
    private final @Nullable Expression value;

    Return(@Nullable Expression value) {
      super(StatementKind.RETURN);
      this.value = value;
    }

    public @Nullable Expression getValue() {
      return value;
    }

    @Override
    public String toString() {
      return value == null ? "return;" : "return " + value + ";";
    }
  }

  /** {@code throw;} (rethrow) or {@code throw value;} */
  public static final class Throw extends Statement {
    private final @Nullable Expression value;

    Throw(@Nullable Expression value) {
      super(StatementKind.THROW);
      this.value = value;
    }

    public @Nullable Expression getValue() {
      return value;
    }

    @Override
    public String toString() {
      return value == null ? "throw;" : "throw " + value + ";";
    }
  }

  /** A scoped-resource statement, {@code using (resources) { ... }}. */
  public static final class Using extends Statement {
    private final ImmutableList<Expression> resources;
    private final Block body;

    Using(List<Expression> resources, Block body) {
      super(StatementKind.USING);
      checkArgument(!resources.isEmpty(), "using without resources");
      this.resources = ImmutableList.copyOf(resources);
      this.body = checkNotNull(body);
    }

    public ImmutableList<Expression> getResources() {
      return resources;
    }

    public Block getBody() {
      return body;
    }

    @Override
    public String toString() {
      return "using (" + Expression.join(resources) + ") " + body.toBracedString();
    }
  }

  /** An explicit declaration, {@code type name;} or {@code type name = initializer;}. */
  public static final class VarDecl extends Statement {
    private final String typeName;
    private final String name;
    private final @Nullable Expression initializer;

    VarDecl(String typeName, String name, @Nullable Expression initializer) {
      super(StatementKind.VAR_DECL);
      this.typeName = checkNotNull(typeName);
      checkArgument(!name.isEmpty(), "empty variable name");
      this.name = name;
      this.initializer = initializer;
    }

    public String getTypeName() {
      return typeName;
    }

    public String getName() {
      return name;
    }

    public @Nullable Expression getInitializer() {
      return initializer;
    }

    @Override
    public String toString() {
      String s = typeName + " " + name;
      return initializer == null ? s + ";" : s + " = " + initializer + ";";
    }
  }

  /** A function defined inside another function's body. */
  public static final class LocalFunction extends Statement {
    private final FunctionDefinition function;

    LocalFunction(FunctionDefinition function) {
      super(StatementKind.LOCAL_FUNCTION);
      this.function = checkNotNull(function);
    }

    public FunctionDefinition getFunction() {
      return function;
    }

    @Override
    public String toString() {
      return function.toString();
    }
  }

  /** A comment carried through to the output. */
  public static final class Comment extends Statement {
    private final String text;

    Comment(String text) {
      super(StatementKind.COMMENT);
      this.text = checkNotNull(text);
    }

    public String getText() {
      return text;
    }

    @Override
    public String toString() {
      return "/* " + text + " */";
    }
  }

  /** An expression evaluated for its side effects. */
  public static final class ExprResult extends Statement {
    private final Expression expression;

    ExprResult(Expression expression) {
      super(StatementKind.EXPR_RESULT);
      this.expression = checkNotNull(expression);
    }

    public Expression getExpression() {
      return expression;
    }

    @Override
    public String toString() {
      return expression + ";";
    }
  }

  /** {@code yield value;} */
  public static final class Yield extends Statement {
    private final Expression value;

    Yield(Expression value) {
      super(StatementKind.YIELD);
      this.value = checkNotNull(value);
    }

    public Expression getValue() {
      return value;
    }

    @Override
    public String toString() {
      return "yield " + value + ";";
    }
  }
}
