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

import io.github.scopelift.codemodel.IR;
import io.github.scopelift.codemodel.Statement;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link StatementPath} */
@RunWith(JUnit4.class)
public final class StatementPathTest {

  @Test
  public void testExtendLeavesOriginalUntouched() {
    Statement loop = IR.whileLoop(IR.name("t"), IR.block());
    Statement write = IR.assign("x", IR.number(1));
    StatementPath outer = StatementPath.root().extend(loop);
    StatementPath inner = outer.extend(write);

    assertThat(outer.size()).isEqualTo(1);
    assertThat(inner.getStatements()).containsExactly(loop, write).inOrder();
    assertThat(inner.getLast()).isSameInstanceAs(write);
    assertThat(inner.toString()).isEqualTo(loop.getLabel() + " > " + write.getLabel());
  }

  @Test
  public void testRoot() {
    assertThat(StatementPath.root().toString()).isEqualTo("<root>");
    assertThrows(IllegalStateException.class, () -> StatementPath.root().getLast());
  }
}
