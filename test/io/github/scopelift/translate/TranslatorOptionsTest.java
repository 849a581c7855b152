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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link TranslatorOptions} */
@RunWith(JUnit4.class)
public final class TranslatorOptionsTest {

  @Test
  public void testOptionDefaults() {
    TranslatorOptions options = new TranslatorOptions();

    assertThat(options.getNullableTypeName()).isEqualTo("object");
    assertThat(options.getInferredTypeName()).isEqualTo("var");
    assertThat(options.getUnsupportedConstructLevel()).isEqualTo(CheckLevel.ERROR);
    assertThat(options.getNumParallelThreads()).isEqualTo(1);
    assertThat(options.shouldProcessLocalFunctions()).isTrue();
    assertThrows(IllegalArgumentException.class, () -> options.setNumParallelThreads(0));
    assertThrows(IllegalArgumentException.class, () -> options.setInferredTypeName(""));
  }
}
