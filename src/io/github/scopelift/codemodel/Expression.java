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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * An expression in a function body. Expressions are immutable; only statements and blocks are
 * rewritten in place.
 *
 * <p>Each {@link ExpressionKind} has exactly one nested subclass.
 */
public abstract class Expression {

  private static final Joiner COMMA_JOINER = Joiner.on(", ");

  /** Operators of unary, binary and compound-assignment forms. */
  public enum Operator {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    FLOOR_DIV("//"),
    MOD("%"),
    POW("**"),
    BITAND("&"),
    BITOR("|"),
    BITXOR("^"),
    LSH("<<"),
    RSH(">>"),
    EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    IS("is"),
    IN("in"),
    AND("and"),
    OR("or"),
    NOT("not "),
    NEG("-"),
    POS("+"),
    BITNOT("~");

    private final String symbol;

    Operator(String symbol) {
      this.symbol = symbol;
    }

    public String getSymbol() {
      return symbol;
    }
  }

  private final ExpressionKind kind;

  Expression(ExpressionKind kind) {
    this.kind = checkNotNull(kind);
  }

  public final ExpressionKind getKind() {
    return kind;
  }

  public final boolean isName() {
    return kind == ExpressionKind.NAME;
  }

  /** Whether this is a reference to the variable {@code name}. */
  public final boolean isName(String name) {
    return isName() && ((Name) this).getName().equals(name);
  }

  /** Whether this is the literal absent value. */
  public final boolean isNullLiteral() {
    return kind == ExpressionKind.LITERAL && ((Literal) this).getValue() == null;
  }

  static String join(List<? extends Expression> expressions) {
    return COMMA_JOINER.join(expressions);
  }

  /** A reference to a variable. */
  public static final class Name extends Expression {
    private final String name;

    Name(String name) {
      super(ExpressionKind.NAME);
      checkArgument(!name.isEmpty(), "empty variable name");
      this.name = name;
    }

    public String getName() {
      return name;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** An assignment used as a value, such as {@code f(x = 3)}. */
  public static final class Assign extends Expression {
    private final Expression target;
    private final Expression value;

    Assign(Expression target, Expression value) {
      super(ExpressionKind.ASSIGN);
      this.target = checkNotNull(target);
      this.value = checkNotNull(value);
    }

    public Expression getTarget() {
      return target;
    }

    public Expression getValue() {
      return value;
    }

    @Override
    public String toString() {
      return "(" + target + " = " + value + ")";
    }
  }

  /** A call or application. */
  public static final class Call extends Expression {
    private final Expression function;
    private final ImmutableList<Expression> arguments;

    Call(Expression function, List<Expression> arguments) {
      super(ExpressionKind.CALL);
      this.function = checkNotNull(function);
      this.arguments = ImmutableList.copyOf(arguments);
    }

    public Expression getFunction() {
      return function;
    }

    public ImmutableList<Expression> getArguments() {
      return arguments;
    }

    @Override
    public String toString() {
      return function + "(" + join(arguments) + ")";
    }
  }

  /** A field access, {@code base.field}. */
  public static final class GetField extends Expression {
    private final Expression base;
    private final String field;

    GetField(Expression base, String field) {
      super(ExpressionKind.GET_FIELD);
      this.base = checkNotNull(base);
      this.field = checkNotNull(field);
    }

    public Expression getBase() {
      return base;
    }

    public String getField() {
      return field;
    }

    @Override
    public String toString() {
      return base + "." + field;
    }
  }

  /** {@code await value} */
  public static final class Await extends Expression {
    private final Expression value;

    Await(Expression value) {
      super(ExpressionKind.AWAIT);
      this.value = checkNotNull(value);
    }

    public Expression getValue() {
      return value;
    }

    @Override
    public String toString() {
      return "await " + value;
    }
  }

  /** A number, string or boolean literal, or the absent value when {@link #getValue} is null. */
  public static final class Literal extends Expression {
    private final @Nullable Object value;

    Literal(@Nullable Object value) {
      super(ExpressionKind.LITERAL);
      this.value = value;
    }

    public @Nullable Object getValue() {
      return value;
    }

    @Override
    public String toString() {
      if (value == null) {
        return "null";
      } else if (value instanceof String) {
        return "\"" + value + "\"";
      }
      return value.toString();
    }
  }

  /** A prefix operator applied to one operand. */
  public static final class Unary extends Expression {
    private final Operator operator;
    private final Expression operand;

    Unary(Operator operator, Expression operand) {
      super(ExpressionKind.UNARY);
      this.operator = checkNotNull(operator);
      this.operand = checkNotNull(operand);
    }

    public Operator getOperator() {
      return operator;
    }

    public Expression getOperand() {
      return operand;
    }

    @Override
    public String toString() {
      return operator.getSymbol() + operand;
    }
  }

  /** An infix operator applied to two operands. */
  public static final class Binary extends Expression {
    private final Operator operator;
    private final Expression left;
    private final Expression right;

    Binary(Operator operator, Expression left, Expression right) {
      super(ExpressionKind.BINARY);
      this.operator = checkNotNull(operator);
      this.left = checkNotNull(left);
      this.right = checkNotNull(right);
    }

    public Operator getOperator() {
      return operator;
    }

    public Expression getLeft() {
      return left;
    }

    public Expression getRight() {
      return right;
    }

    @Override
    public String toString() {
      return left + " " + operator.getSymbol() + " " + right;
    }
  }

  /** {@code this} */
  public static final class This extends Expression {
    This() {
      super(ExpressionKind.THIS);
    }

    @Override
    public String toString() {
      return "this";
    }
  }

  /** {@code super} */
  public static final class Super extends Expression {
    Super() {
      super(ExpressionKind.SUPER);
    }

    @Override
    public String toString() {
      return "super";
    }
  }

  /** A type used as a value, for example the receiver of a static call. */
  public static final class TypeReference extends Expression {
    private final String typeName;

    TypeReference(String typeName) {
      super(ExpressionKind.TYPE_REFERENCE);
      this.typeName = checkNotNull(typeName);
    }

    public String getTypeName() {
      return typeName;
    }

    @Override
    public String toString() {
      return typeName;
    }
  }

  /** {@code base[index]} */
  public static final class Index extends Expression {
    private final Expression base;
    private final Expression index;

    Index(Expression base, Expression index) {
      super(ExpressionKind.INDEX);
      this.base = checkNotNull(base);
      this.index = checkNotNull(index);
    }

    public Expression getBase() {
      return base;
    }

    public Expression getIndex() {
      return index;
    }

    @Override
    public String toString() {
      return base + "[" + index + "]";
    }
  }

  /** A tuple value, or a destructuring pattern when used as an assignment target. */
  public static final class Tuple extends Expression {
    private final ImmutableList<Expression> elements;

    Tuple(List<Expression> elements) {
      super(ExpressionKind.TUPLE);
      this.elements = ImmutableList.copyOf(elements);
    }

    public ImmutableList<Expression> getElements() {
      return elements;
    }

    @Override
    public String toString() {
      return "(" + join(elements) + ")";
    }
  }

  /** {@code condition ? whenTrue : whenFalse} */
  public static final class Conditional extends Expression {
    private final Expression condition;
    private final Expression whenTrue;
    private final Expression whenFalse;

    Conditional(Expression condition, Expression whenTrue, Expression whenFalse) {
      super(ExpressionKind.CONDITIONAL);
      this.condition = checkNotNull(condition);
      this.whenTrue = checkNotNull(whenTrue);
      this.whenFalse = checkNotNull(whenFalse);
    }

    public Expression getCondition() {
      return condition;
    }

    public Expression getWhenTrue() {
      return whenTrue;
    }

    public Expression getWhenFalse() {
      return whenFalse;
    }

    @Override
    public String toString() {
      return "(" + condition + " ? " + whenTrue + " : " + whenFalse + ")";
    }
  }

  /** {@code (type) operand} */
  public static final class Cast extends Expression {
    private final String typeName;
    private final Expression operand;

    Cast(String typeName, Expression operand) {
      super(ExpressionKind.CAST);
      this.typeName = checkNotNull(typeName);
      this.operand = checkNotNull(operand);
    }

    public String getTypeName() {
      return typeName;
    }

    public Expression getOperand() {
      return operand;
    }

    @Override
    public String toString() {
      return "(" + typeName + ") " + operand;
    }
  }

  /**
   * An anonymous function. Its body is a separate scope; only the parameter defaults are
   * evaluated where the lambda appears.
   */
  public static final class Lambda extends Expression {
    private final ImmutableList<Parameter> parameters;
    private final Expression body;

    Lambda(List<Parameter> parameters, Expression body) {
      super(ExpressionKind.LAMBDA);
      this.parameters = ImmutableList.copyOf(parameters);
      this.body = checkNotNull(body);
    }

    public ImmutableList<Parameter> getParameters() {
      return parameters;
    }

    public Expression getBody() {
      return body;
    }

    @Override
    public String toString() {
      return "(" + join(parameters) + ") => " + body;
    }
  }

  /** Object creation, {@code new Type(arguments)}. */
  public static final class New extends Expression {
    private final String typeName;
    private final ImmutableList<Expression> arguments;

    New(String typeName, List<Expression> arguments) {
      super(ExpressionKind.NEW);
      this.typeName = checkNotNull(typeName);
      this.arguments = ImmutableList.copyOf(arguments);
    }

    public String getTypeName() {
      return typeName;
    }

    public ImmutableList<Expression> getArguments() {
      return arguments;
    }

    @Override
    public String toString() {
      return "new " + typeName + "(" + join(arguments) + ")";
    }
  }

  /** {@code [a, b, c]} */
  public static final class ArrayLiteral extends Expression {
    private final ImmutableList<Expression> elements;

    ArrayLiteral(List<Expression> elements) {
      super(ExpressionKind.ARRAY_LITERAL);
      this.elements = ImmutableList.copyOf(elements);
    }

    public ImmutableList<Expression> getElements() {
      return elements;
    }

    @Override
    public String toString() {
      return "[" + join(elements) + "]";
    }
  }

  /** A keyword argument of a call, {@code name: value}. */
  public static final class NamedArgument extends Expression {
    private final String name;
    private final Expression value;

    NamedArgument(String name, Expression value) {
      super(ExpressionKind.NAMED_ARGUMENT);
      this.name = checkNotNull(name);
      this.value = checkNotNull(value);
    }

    public String getName() {
      return name;
    }

    public Expression getValue() {
      return value;
    }

    @Override
    public String toString() {
      return name + ": " + value;
    }
  }

  /** A formal parameter of a function or lambda, with an optional default value. */
  public static final class Parameter extends Expression {
    private final String name;
    private final @Nullable Expression defaultValue;

    Parameter(String name, @Nullable Expression defaultValue) {
      super(ExpressionKind.PARAMETER);
      checkArgument(!name.isEmpty(), "empty parameter name");
      this.name = name;
      this.defaultValue = defaultValue;
    }

    public String getName() {
      return name;
    }

    public @Nullable Expression getDefaultValue() {
      return defaultValue;
    }

    @Override
    public String toString() {
      return defaultValue == null ? name : name + " = " + defaultValue;
    }
  }
}
