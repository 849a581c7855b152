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
import io.github.scopelift.codemodel.Block;
import io.github.scopelift.codemodel.IR;
import io.github.scopelift.codemodel.Statement;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link DeclarationRewriter} */
@RunWith(JUnit4.class)
public final class DeclarationRewriterTest {

  private static DeclarationPlan.Placement substitute(Statement.Assign target, Block block) {
    String name = target.getTarget().toString();
    return DeclarationPlan.Placement.substitute(
        name, target, block, IR.var("var", name, target.getValue()));
  }

  private static DeclarationPlan.Placement hoist(String name) {
    return DeclarationPlan.Placement.hoistToTop(name, IR.var("object", name));
  }

  @Test
  public void testSubstitutionFindsTargetByHandle() {
    Statement.Assign first = IR.assign("x", IR.number(1));
    Statement.Assign nested = IR.assign("y", IR.number(2));
    Block thenBlock = IR.block(IR.comment("keep"), nested);
    Block body = IR.body(first, IR.ifStatement(IR.name("c"), thenBlock));

    // Hoists are listed first but applied after every substitution.
    DeclarationPlan plan =
        new DeclarationPlan(
            ImmutableList.of(
                hoist("z"), substitute(first, body), hoist("w"), substitute(nested, thenBlock)));

    assertThat(DeclarationRewriter.rewrite(plan, body)).isEqualTo(4);
    assertThat(body.toString())
        .isEqualTo("object w; object z; var x = 1; if (c) { /* keep */ var y = 2; }");
  }

  @Test
  public void testEmptyPlanLeavesBodyAlone() {
    Block body = IR.body(IR.assign("x", IR.number(1)));

    assertThat(DeclarationRewriter.rewrite(new DeclarationPlan(ImmutableList.of()), body))
        .isEqualTo(0);
    assertThat(body.toString()).isEqualTo("x = 1;");
  }

  @Test
  public void testMissingTargetIsAnInternalError() {
    Statement.Assign detached = IR.assign("x", IR.number(1));
    Block body = IR.body(IR.assign("x", IR.number(1)));
    DeclarationPlan plan = new DeclarationPlan(ImmutableList.of(substitute(detached, body)));

    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> DeclarationRewriter.rewrite(plan, body));
    assertThat(e).hasMessageThat().contains(detached.getLabel());
  }

  @Test
  public void testDoubleSubstitutionIsAnInternalError() {
    Statement.Assign target = IR.assign("x", IR.number(1));
    Block body = IR.body(target);
    DeclarationPlan plan =
        new DeclarationPlan(ImmutableList.of(substitute(target, body), substitute(target, body)));

    assertThrows(IllegalStateException.class, () -> DeclarationRewriter.rewrite(plan, body));
  }

  @Test
  public void testPlacementRequiresTargetExactlyForSubstitutions() {
    Statement.VarDecl declaration = IR.var("object", "x");

    assertThrows(
        IllegalArgumentException.class,
        () ->
            new DeclarationPlan.Placement(
                "x", DeclarationPlan.Kind.SUBSTITUTE, declaration, null, null));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new DeclarationPlan.Placement(
                "x",
                DeclarationPlan.Kind.HOIST_TO_TOP,
                declaration,
                IR.assign("x", IR.number(1)),
                IR.body()));
  }
}
