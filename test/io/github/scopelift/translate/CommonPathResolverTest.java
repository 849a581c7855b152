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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.github.scopelift.codemodel.Block;
import io.github.scopelift.codemodel.Expression;
import io.github.scopelift.codemodel.IR;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link CommonPathResolver} */
@RunWith(JUnit4.class)
public final class CommonPathResolverTest {

  private FunctionIndex index;

  private int resolve(Block body, String name) throws UnsupportedConstructException {
    index = WriteSiteIndexer.index(body, ImmutableSet.of());
    return new CommonPathResolver(index).resolve(index.getWriteSites(name));
  }

  @Test
  public void testSingleWriteResolvesToItself() throws Exception {
    Block body =
        IR.body(
            IR.exprResult(IR.call("setup")),
            IR.ifStatement(IR.name("c"), IR.block(IR.assign("x", IR.number(1)))));

    assertThat(resolve(body, "x")).isEqualTo(1);
  }

  @Test
  public void testStraightLineWrite() throws Exception {
    assertThat(resolve(IR.body(IR.assign("y", IR.call("compute"))), "y")).isEqualTo(0);
  }

  @Test
  public void testSiblingsResolveToFirstSibling() throws Exception {
    Block body =
        IR.body(
            IR.ifStatement(
                IR.name("c"),
                IR.block(IR.assign("x", IR.number(1)), IR.assign("x", IR.number(2)))));

    assertThat(resolve(body, "x")).isEqualTo(1);
  }

  @Test
  public void testBranchesResolveToConditional() throws Exception {
    Block body =
        IR.body(
            IR.ifStatement(
                IR.name("c"),
                IR.block(IR.assign("x", IR.number(1))),
                IR.block(IR.assign("x", IR.number(2)))));

    assertThat(resolve(body, "x")).isEqualTo(0);
  }

  @Test
  public void testTryAndCatchResolveToTry() throws Exception {
    Block body =
        IR.body(
            IR.assign("unrelated", IR.number(0)),
            IR.tryCatch(
                IR.block(IR.assign("x", IR.call("load"))),
                IR.catchClause("Error", "e", IR.block(IR.assign("x", IR.nullLiteral())))));

    int bound = resolve(body, "x");
    assertThat(bound).isEqualTo(0);
    assertThat(index.getWriteSites("x").get(0).get(bound)).isSameInstanceAs(body.get(1));
  }

  @Test
  public void testSiblingLoopsResolveToFirstLoop() throws Exception {
    Block body =
        IR.body(
            IR.whileLoop(IR.name("a"), IR.block(IR.assign("x", IR.number(1)))),
            IR.whileLoop(IR.name("b"), IR.block(IR.assign("x", IR.number(2)))));

    int bound = resolve(body, "x");
    assertThat(bound).isEqualTo(0);
    assertThat(index.getWriteSites("x").get(0).get(bound)).isSameInstanceAs(body.get(0));
  }

  @Test
  public void testNestedSiblingLoops() throws Exception {
    Block thenBlock =
        IR.block(
            IR.whileLoop(IR.name("a"), IR.block(IR.assign("x", IR.number(1)))),
            IR.whileLoop(IR.name("b"), IR.block(IR.assign("x", IR.number(2)))));
    Block body = IR.body(IR.ifStatement(IR.name("c"), thenBlock));

    int bound = resolve(body, "x");
    assertThat(bound).isEqualTo(1);
    assertThat(index.getWriteSites("x").get(0).get(bound)).isSameInstanceAs(thenBlock.get(0));
  }

  @Test
  public void testConditionAndBodyWritesResolveToLoop() throws Exception {
    Block body =
        IR.body(
            IR.whileLoop(
                IR.assignExpr(IR.name("x"), IR.call("next")),
                IR.block(IR.assign("x", IR.number(0)))));

    assertThat(resolve(body, "x")).isEqualTo(0);
  }

  @Test
  public void testTwoWritesInOneStatementKeepTheBound() throws Exception {
    Block body =
        IR.body(
            IR.exprResult(IR.call("setup")),
            IR.ifStatement(
                IR.binary(
                    Expression.Operator.OR,
                    IR.assignExpr(IR.name("m"), IR.call("first")),
                    IR.assignExpr(IR.name("m"), IR.call("second"))),
                IR.block()));

    assertThat(resolve(body, "m")).isEqualTo(0);
    assertThat(index.getWriteSites("m")).hasSize(2);
  }

  @Test
  public void testBoundOnlyNarrows() throws Exception {
    Block inner = IR.block(IR.assign("x", IR.number(1)), IR.assign("x", IR.number(2)));
    Block body =
        IR.body(
            IR.ifStatement(IR.name("c"), inner),
            IR.whileLoop(IR.name("d"), IR.block(IR.assign("x", IR.number(3)))));

    // The first two writes share the then-block; the third only shares the body.
    assertThat(resolve(body, "x")).isEqualTo(0);
  }

  @Test
  public void testNoWriteSites() throws Exception {
    FunctionIndex empty = WriteSiteIndexer.index(IR.body(), ImmutableSet.of());
    assertThrows(
        IllegalArgumentException.class,
        () -> new CommonPathResolver(empty).resolve(ImmutableList.of()));
  }
}
