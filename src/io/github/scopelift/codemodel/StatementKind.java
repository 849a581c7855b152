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

/** The closed set of statement kinds that can appear in a function body. */
public enum StatementKind {
  ASSIGN,
  IF,
  WHILE,
  DO_WHILE,
  FOREACH,
  TRY,
  BREAK,
  CONTINUE,
  RETURN,
  THROW,
  USING,
  VAR_DECL,
  LOCAL_FUNCTION,
  COMMENT,
  EXPR_RESULT,
  YIELD;
}
