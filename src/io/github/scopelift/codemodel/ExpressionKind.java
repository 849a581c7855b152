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

/** The closed set of expression kinds. */
public enum ExpressionKind {
  NAME,
  ASSIGN,
  CALL,
  GET_FIELD,
  AWAIT,
  LITERAL,
  UNARY,
  BINARY,
  THIS,
  SUPER,
  TYPE_REFERENCE,
  INDEX,
  TUPLE,
  CONDITIONAL,
  CAST,
  LAMBDA,
  NEW,
  ARRAY_LITERAL,
  NAMED_ARGUMENT,
  PARAMETER;
}
