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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/** Options for the translation passes. */
public class TranslatorOptions {

  public static final String DEFAULT_NULLABLE_TYPE_NAME = "object";
  public static final String DEFAULT_INFERRED_TYPE_NAME = "var";

  /**
   * The explicit, null-capable type used when a variable is initialized with the absent value and
   * for bare declarations hoisted to the top of a function.
   */
  private String nullableTypeName = DEFAULT_NULLABLE_TYPE_NAME;

  public void setNullableTypeName(String typeName) {
    checkArgument(!typeName.isEmpty(), "empty type name");
    this.nullableTypeName = typeName;
  }

  public String getNullableTypeName() {
    return nullableTypeName;
  }

  /** The placeholder type that defers to the target language's type inference. */
  private String inferredTypeName = DEFAULT_INFERRED_TYPE_NAME;

  public void setInferredTypeName(String typeName) {
    checkArgument(!typeName.isEmpty(), "empty type name");
    this.inferredTypeName = typeName;
  }

  public String getInferredTypeName() {
    return inferredTypeName;
  }

  /** The level at which assignments to unsupported targets are reported. */
  private CheckLevel unsupportedConstructLevel = CheckLevel.ERROR;

  public void setUnsupportedConstructLevel(CheckLevel level) {
    this.unsupportedConstructLevel = checkNotNull(level);
  }

  public CheckLevel getUnsupportedConstructLevel() {
    return unsupportedConstructLevel;
  }

  /** Number of threads used to translate independent functions. */
  private int numParallelThreads = 1;

  public void setNumParallelThreads(int parallelism) {
    checkArgument(parallelism > 0, "parallelism must be positive: %s", parallelism);
    this.numParallelThreads = parallelism;
  }

  public int getNumParallelThreads() {
    return numParallelThreads;
  }

  /** Whether functions defined inside other functions are translated as well. */
  private boolean processLocalFunctions = true;

  public void setProcessLocalFunctions(boolean value) {
    this.processLocalFunctions = value;
  }

  public boolean shouldProcessLocalFunctions() {
    return processLocalFunctions;
  }
}
