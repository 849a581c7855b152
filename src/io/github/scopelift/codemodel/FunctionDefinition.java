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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** A function: its name, its formal parameters and its body. */
public final class FunctionDefinition {
  private final String name;
  private final ImmutableList<Expression.Parameter> parameters;
  private final Block body;

  FunctionDefinition(String name, List<Expression.Parameter> parameters, Block body) {
    this.name = checkNotNull(name);
    this.parameters = ImmutableList.copyOf(parameters);
    this.body = checkNotNull(body);
  }

  public String getName() {
    return name;
  }

  public ImmutableList<Expression.Parameter> getParameters() {
    return parameters;
  }

  public ImmutableList<String> getParameterNames() {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Expression.Parameter parameter : parameters) {
      names.add(parameter.getName());
    }
    return names.build();
  }

  /** The top-level statements of the function, mutated in place by rewriting passes. */
  public Block getBody() {
    return body;
  }

  @Override
  public String toString() {
    return "def " + name + "(" + Expression.join(parameters) + ") " + body.toBracedString();
  }
}
