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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.github.scopelift.codemodel.Block;
import io.github.scopelift.codemodel.FunctionDefinition;
import io.github.scopelift.codemodel.IR;
import io.github.scopelift.codemodel.Statement;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link TranslationDriver} */
@RunWith(JUnit4.class)
public final class TranslationDriverTest {

  private TranslatorOptions options;
  private BasicErrorManager errorManager;

  @Before
  public void setUp() {
    options = new TranslatorOptions();
    errorManager = new BasicErrorManager();
  }

  private TranslationDriver.Result translate(List<FunctionDefinition> functions) {
    return new TranslationDriver(options, errorManager).translate(functions, ImmutableSet.of("g"));
  }

  private static FunctionDefinition nestingFunction() {
    FunctionDefinition inner =
        IR.function(
            "inner",
            ImmutableList.of(IR.param("a")),
            IR.body(IR.assign("a", IR.number(1)), IR.assign("t", IR.number(2))));
    return IR.function(
        "outer",
        IR.body(
            IR.assign("x", IR.number(1)),
            IR.whileLoop(IR.name("more"), IR.block(IR.localFunction(inner)))));
  }

  private static FunctionDefinition innerFunction(FunctionDefinition outer) {
    Statement.While loop = (Statement.While) outer.getBody().get(1);
    return ((Statement.LocalFunction) loop.getBody().get(0)).getFunction();
  }

  @Test
  public void testProcessesEveryFunction() {
    FunctionDefinition f = IR.function("f", IR.body(IR.assign("x", IR.number(1))));
    FunctionDefinition h =
        IR.function("h", IR.body(IR.assign("g", IR.number(1)), IR.assign("y", IR.nullLiteral())));
    FunctionDefinition empty = IR.function("empty", IR.body());

    TranslationDriver.Result result = translate(ImmutableList.of(f, h, empty));

    assertThat(result).isEqualTo(new TranslationDriver.Result(3, 2, 0));
    assertThat(f.getBody().toString()).isEqualTo("var x = 1;");
    assertThat(h.getBody().toString()).isEqualTo("g = 1; object y = null;");
  }

  @Test
  public void testProcessesLocalFunctionsOnTheirOwn() {
    FunctionDefinition outer = nestingFunction();

    TranslationDriver.Result result = translate(ImmutableList.of(outer));

    assertThat(result).isEqualTo(new TranslationDriver.Result(2, 2, 0));
    assertThat(outer.getBody().toString())
        .isEqualTo("var x = 1; while (more) { def inner(a) { a = 1; var t = 2; } }");
  }

  @Test
  public void testFunctionListedAndNestedIsProcessedOnce() {
    FunctionDefinition outer = nestingFunction();
    FunctionDefinition inner = innerFunction(outer);

    TranslationDriver.Result result = translate(ImmutableList.of(outer, inner, outer));

    assertThat(result).isEqualTo(new TranslationDriver.Result(2, 2, 0));
    assertThat(inner.getBody().toString()).isEqualTo("a = 1; var t = 2;");
  }

  @Test
  public void testParallelRunProcessesSharedFunctionOnce() {
    options.setNumParallelThreads(4);
    FunctionDefinition outer = nestingFunction();
    FunctionDefinition inner = innerFunction(outer);

    TranslationDriver.Result result = translate(ImmutableList.of(inner, outer, inner));

    assertThat(result).isEqualTo(new TranslationDriver.Result(2, 2, 0));
    assertThat(outer.getBody().toString())
        .isEqualTo("var x = 1; while (more) { def inner(a) { a = 1; var t = 2; } }");
  }

  @Test
  public void testLocalFunctionsCanBeSkipped() {
    options.setProcessLocalFunctions(false);
    FunctionDefinition outer = nestingFunction();

    TranslationDriver.Result result = translate(ImmutableList.of(outer));

    assertThat(result).isEqualTo(new TranslationDriver.Result(1, 1, 0));
    assertThat(outer.getBody().toString())
        .isEqualTo("var x = 1; while (more) { def inner(a) { a = 1; t = 2; } }");
  }

  @Test
  public void testErrorsAreCountedPerRun() {
    FunctionDefinition bad =
        IR.function(
            "bad",
            IR.body(
                IR.ifStatement(
                    IR.assignExpr(IR.index(IR.name("cache"), IR.string("k")), IR.number(1)),
                    IR.block(IR.assign("x", IR.number(1))))));
    FunctionDefinition good = IR.function("good", IR.body(IR.assign("x", IR.number(1))));

    TranslationDriver.Result first = translate(ImmutableList.of(bad, good));
    TranslationDriver.Result second = translate(ImmutableList.of(good));

    assertThat(first).isEqualTo(new TranslationDriver.Result(2, 1, 1));
    assertThat(second).isEqualTo(new TranslationDriver.Result(1, 0, 0));
    assertThat(errorManager.getErrors()).hasSize(1);
    assertThat(errorManager.getErrors().get(0).functionName()).isEqualTo("bad");
  }

  @Test
  public void testParallelRun() {
    options.setNumParallelThreads(4);
    List<FunctionDefinition> functions = new ArrayList<>();
    for (int i = 0; i < 50; i++) {
      Block body =
          IR.body(
              IR.ifStatement(
                  IR.name("c"),
                  IR.block(IR.assign("v", IR.number(i))),
                  IR.block(IR.assign("v", IR.number(-i)))),
              IR.assign("w", IR.name("v")));
      functions.add(IR.function("f" + i, body));
    }
    functions.add(
        IR.function(
            "broken",
            IR.body(
                IR.whileLoop(
                    IR.assignExpr(IR.getField(IR.thisRef(), "state"), IR.call("next")),
                    IR.block()))));

    TranslationDriver.Result result = translate(functions);

    assertThat(result).isEqualTo(new TranslationDriver.Result(51, 50, 1));
    for (int i = 0; i < 50; i++) {
      String body = functions.get(i).getBody().toString();
      assertThat(body).startsWith("object v; if (c) {");
      assertThat(body).endsWith("var w = v;");
    }
    assertThat(errorManager.getErrors().get(0).functionName()).isEqualTo("broken");
  }
}
