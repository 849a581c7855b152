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

import io.github.scopelift.codemodel.FunctionDefinition;

/** A translation pass run over one function at a time. */
public interface FunctionPass {

  /**
   * Processes the function, modifying its body in place.
   *
   * @return whether the body was changed
   */
  boolean process(FunctionDefinition function);
}
