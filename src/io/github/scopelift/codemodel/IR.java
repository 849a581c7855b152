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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** A code model construction helper class. */
public final class IR {

  private IR() {}

  // Blocks and functions

  public static Block block(Statement... statements) {
    return new Block("block", ImmutableList.copyOf(statements));
  }

  public static Block body(Statement... statements) {
    return new Block("body", ImmutableList.copyOf(statements));
  }

  public static FunctionDefinition function(
      String name, List<Expression.Parameter> parameters, Block body) {
    return new FunctionDefinition(name, parameters, body);
  }

  public static FunctionDefinition function(String name, Block body) {
    return new FunctionDefinition(name, ImmutableList.of(), body);
  }

  // Statements

  public static Statement.Assign assign(String name, Expression value) {
    return new Statement.Assign(name(name), null, value);
  }

  public static Statement.Assign assign(Expression target, Expression value) {
    checkState(mayBeAssignmentTarget(target), target);
    return new Statement.Assign(target, null, value);
  }

  public static Statement.Assign compoundAssign(
      Expression target, Expression.Operator operator, Expression value) {
    checkState(mayBeAssignmentTarget(target), target);
    return new Statement.Assign(target, operator, value);
  }

  public static Statement.If ifStatement(Expression condition, Block thenBlock) {
    return new Statement.If(condition, thenBlock, new Block("else"));
  }

  public static Statement.If ifStatement(Expression condition, Block thenBlock, Block elseBlock) {
    checkState(thenBlock.getId() != elseBlock.getId(), "branches share a block");
    return new Statement.If(condition, thenBlock, elseBlock);
  }

  public static Statement.While whileLoop(Expression test, Block body) {
    return new Statement.While(test, body);
  }

  public static Statement.DoWhile doWhile(Block body, Expression test) {
    return new Statement.DoWhile(body, test);
  }

  public static Statement.Foreach foreach(Expression variable, Expression collection, Block body) {
    checkState(variable.isName() || variable.getKind() == ExpressionKind.TUPLE, variable);
    return new Statement.Foreach(variable, collection, body);
  }

  public static Statement.CatchClause catchClause(
      String typeName, @Nullable String variableName, Block body) {
    return new Statement.CatchClause(typeName, variableName, body);
  }

  public static Statement.Try tryCatch(Block tryBlock, Statement.CatchClause... catchClauses) {
    return new Statement.Try(tryBlock, ImmutableList.copyOf(catchClauses), new Block("finally"));
  }

  public static Statement.Try tryFinally(Block tryBlock, Block finallyBlock) {
    return new Statement.Try(tryBlock, ImmutableList.of(), finallyBlock);
  }

  public static Statement.Try tryCatchFinally(
      Block tryBlock, List<Statement.CatchClause> catchClauses, Block finallyBlock) {
    return new Statement.Try(tryBlock, catchClauses, finallyBlock);
  }

  public static Statement.Break breakStatement() {
    return new Statement.Break();
  }

  public static Statement.Continue continueStatement() {
    return new Statement.Continue();
  }

  public static Statement.Return returnStatement() {
    return new Statement.Return(null);
  }

  public static Statement.Return returnStatement(Expression value) {
    return new Statement.Return(value);
  }

  public static Statement.Throw throwStatement() {
    return new Statement.Throw(null);
  }

  public static Statement.Throw throwStatement(Expression value) {
    return new Statement.Throw(value);
  }

  public static Statement.Using using(Expression resource, Block body) {
    return new Statement.Using(ImmutableList.of(resource), body);
  }

  public static Statement.Using using(List<Expression> resources, Block body) {
    return new Statement.Using(resources, body);
  }

  public static Statement.VarDecl var(String typeName, String name) {
    return new Statement.VarDecl(typeName, name, null);
  }

  public static Statement.VarDecl var(
      String typeName, String name, @Nullable Expression initializer) {
    return new Statement.VarDecl(typeName, name, initializer);
  }

  public static Statement.LocalFunction localFunction(FunctionDefinition function) {
    return new Statement.LocalFunction(function);
  }

  public static Statement.Comment comment(String text) {
    return new Statement.Comment(text);
  }

  public static Statement.ExprResult exprResult(Expression expression) {
    return new Statement.ExprResult(expression);
  }

  public static Statement.Yield yield(Expression value) {
    return new Statement.Yield(value);
  }

  // Expressions

  public static Expression.Name name(String name) {
    return new Expression.Name(name);
  }

  public static Expression.Assign assignExpr(Expression target, Expression value) {
    checkState(mayBeAssignmentTarget(target), target);
    return new Expression.Assign(target, value);
  }

  public static Expression.Call call(Expression function, Expression... arguments) {
    return new Expression.Call(function, ImmutableList.copyOf(arguments));
  }

  public static Expression.Call call(String functionName, Expression... arguments) {
    return call(name(functionName), arguments);
  }

  public static Expression.GetField getField(Expression base, String field) {
    return new Expression.GetField(base, field);
  }

  public static Expression.Await await(Expression value) {
    return new Expression.Await(value);
  }

  public static Expression.Literal number(double value) {
    return (value == Math.rint(value) && Math.abs(value) < Integer.MAX_VALUE)
        ? new Expression.Literal((int) value)
        : new Expression.Literal(value);
  }

  public static Expression.Literal string(String value) {
    return new Expression.Literal(value);
  }

  public static Expression.Literal trueLiteral() {
    return new Expression.Literal(Boolean.TRUE);
  }

  public static Expression.Literal falseLiteral() {
    return new Expression.Literal(Boolean.FALSE);
  }

  /** The literal absent value. */
  public static Expression.Literal nullLiteral() {
    return new Expression.Literal(null);
  }

  public static Expression.Unary unary(Expression.Operator operator, Expression operand) {
    return new Expression.Unary(operator, operand);
  }

  public static Expression.Binary binary(
      Expression.Operator operator, Expression left, Expression right) {
    return new Expression.Binary(operator, left, right);
  }

  public static Expression.This thisRef() {
    return new Expression.This();
  }

  public static Expression.Super superRef() {
    return new Expression.Super();
  }

  public static Expression.TypeReference typeRef(String typeName) {
    return new Expression.TypeReference(typeName);
  }

  public static Expression.Index index(Expression base, Expression index) {
    return new Expression.Index(base, index);
  }

  public static Expression.Tuple tuple(Expression... elements) {
    return new Expression.Tuple(ImmutableList.copyOf(elements));
  }

  public static Expression.Conditional conditional(
      Expression condition, Expression whenTrue, Expression whenFalse) {
    return new Expression.Conditional(condition, whenTrue, whenFalse);
  }

  public static Expression.Cast cast(String typeName, Expression operand) {
    return new Expression.Cast(typeName, operand);
  }

  public static Expression.Lambda lambda(List<Expression.Parameter> parameters, Expression body) {
    return new Expression.Lambda(parameters, body);
  }

  public static Expression.New newObject(String typeName, Expression... arguments) {
    return new Expression.New(typeName, ImmutableList.copyOf(arguments));
  }

  public static Expression.ArrayLiteral arrayLiteral(Expression... elements) {
    return new Expression.ArrayLiteral(ImmutableList.copyOf(elements));
  }

  public static Expression.NamedArgument namedArgument(String name, Expression value) {
    return new Expression.NamedArgument(name, value);
  }

  public static Expression.Parameter param(String name) {
    return new Expression.Parameter(name, null);
  }

  public static Expression.Parameter param(String name, Expression defaultValue) {
    return new Expression.Parameter(name, defaultValue);
  }

  private static boolean mayBeAssignmentTarget(Expression target) {
    return switch (target.getKind()) {
      case NAME, GET_FIELD, INDEX, TUPLE -> true;
      default -> false;
    };
  }
}
