/*
 * Copyright 2024 The Closure Compiler Authors.
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

package com.google.cloudlang.jscomp;

import static com.google.cloudlang.jscomp.KvStoreFixture.arrow;
import static com.google.cloudlang.jscomp.KvStoreFixture.constDecl;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.cloudlang.ast.IR;
import com.google.cloudlang.ast.Node;
import com.google.cloudlang.ast.Token;
import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ScopeAnalyzer}. */
@RunWith(JUnit4.class)
public final class ScopeAnalyzerTest {

  private CollectingErrorManager errorManager;
  private ScopeAnalyzer analyzer;

  @Before
  public void setUp() {
    errorManager = new CollectingErrorManager();
    analyzer = new ScopeAnalyzer(errorManager, "module.ts");
  }

  @Test
  public void testKvStoreModuleVars() throws Exception {
    AnalysisResult result = KvStoreFixture.analyzeKvStore();

    assertThat(result.getModuleVars())
        .containsExactly(
            ModuleVar.mutableState("store"),
            ModuleVar.function("put"),
            ModuleVar.function("get"),
            ModuleVar.mutableState("cache"),
            ModuleVar.function("cachedGet"),
            ModuleVar.function("handleRequest"))
        .inOrder();
  }

  @Test
  public void testKvStoreClosures() throws Exception {
    AnalysisResult result = KvStoreFixture.analyzeKvStore();

    assertThat(result.getClosures()).hasSize(4);

    ClosureInfo put = result.getClosure("put");
    assertThat(put.getFreeVars()).containsExactly("store");
    assertThat(put.getCapturesMutable()).containsExactly("store");
    assertThat(put.getCalledFunctions()).isEmpty();

    ClosureInfo get = result.getClosure("get");
    assertThat(get.getFreeVars()).containsExactly("store");
    assertThat(get.getCapturesMutable()).containsExactly("store");

    ClosureInfo cachedGet = result.getClosure("cachedGet");
    assertThat(cachedGet.getFreeVars()).containsExactly("cache", "get").inOrder();
    assertThat(cachedGet.getCapturesMutable()).containsExactly("cache");
    assertThat(cachedGet.getCalledFunctions()).containsExactly("get");

    ClosureInfo handleRequest = result.getClosure("handleRequest");
    assertThat(handleRequest.getFreeVars()).containsExactly("cachedGet", "put").inOrder();
    assertThat(handleRequest.getCalledFunctions()).containsExactly("cachedGet", "put").inOrder();
    assertThat(handleRequest.getCapturesMutable()).isEmpty();
  }

  @Test
  public void testKvStoreExports() throws Exception {
    AnalysisResult result = KvStoreFixture.analyzeKvStore();

    assertThat(result.getExports()).containsExactly("handleRequest");
    assertThat(result.isExported("handleRequest")).isTrue();
    assertThat(result.isExported("put")).isFalse();
  }

  @Test
  public void testNonProgramRootIsRejected() {
    Node root = IR.block(IR.returnNode());

    AnalysisException e = assertThrows(AnalysisException.class, () -> analyzer.analyze(root));
    assertThat(e.getError().type()).isEqualTo(ScopeAnalyzer.EXPECTED_PROGRAM_NODE);
    assertThat(e.getError().description()).isEqualTo("expected Program node");
  }

  @Test
  public void testEmptyProgram() throws Exception {
    AnalysisResult result = analyzer.analyze(IR.program());

    assertThat(result.getModuleVars()).isEmpty();
    assertThat(result.getClosures()).isEmpty();
    assertThat(result.getExports()).isEmpty();
  }

  @Test
  public void testMutableContainers() throws Exception {
    AnalysisResult result =
        analyzer.analyze(
            IR.program(
                constDecl("a", IR.newNode(IR.name("Set"))),
                constDecl("b", IR.newNode(IR.name("Array"), IR.number(3))),
                constDecl("c", IR.newNode(IR.name("Date"))),
                constDecl("d", IR.arraylit()),
                constDecl("e", IR.number(1))));

    assertThat(result.getModuleVar("a").isMutableState()).isTrue();
    assertThat(result.getModuleVar("b").isMutableState()).isTrue();
    assertThat(result.getModuleVar("c").isMutableState()).isFalse();
    assertThat(result.getModuleVar("d").isMutableState()).isFalse();
    assertThat(result.getModuleVar("e")).isEqualTo(ModuleVar.plain("e"));
  }

  @Test
  public void testDeclarationWithoutInitializer() throws Exception {
    AnalysisResult result =
        analyzer.analyze(IR.program(IR.declaration(IR.name("x"), Token.LET)));

    assertThat(result.getModuleVars()).containsExactly(ModuleVar.plain("x"));
  }

  @Test
  public void testFirstDeclarationWins() throws Exception {
    AnalysisResult result =
        analyzer.analyze(
            IR.program(
                constDecl("x", IR.newNode(IR.name("Map"))),
                IR.var(IR.name("x"), IR.number(0))));

    assertThat(result.getModuleVars()).containsExactly(ModuleVar.mutableState("x"));
  }

  @Test
  public void testRedeclaredFunctionIsAnalyzedOnce() throws Exception {
    AnalysisResult result =
        analyzer.analyze(
            IR.program(
                constDecl("store", IR.newNode(IR.name("Map"))),
                IR.var(IR.name("f"), arrow(IR.paramList(IR.name("k")), IR.name("store"))),
                IR.var(IR.name("f"), arrow(IR.paramList(IR.name("k")), IR.name("k")))));

    assertThat(result.getModuleVars())
        .containsExactly(ModuleVar.mutableState("store"), ModuleVar.function("f"))
        .inOrder();
    assertThat(result.getClosures()).hasSize(1);
    assertThat(result.getClosure("f").getCapturesMutable()).containsExactly("store");

    assertThat(errorManager.getErrorCount()).isEqualTo(0);
    assertThat(errorManager.getWarningCount()).isEqualTo(1);
    JSError warning = errorManager.getWarnings().get(0);
    assertThat(warning.type()).isEqualTo(ScopeAnalyzer.DUPLICATE_MODULE_BINDING);
    assertThat(warning.sourceName()).isEqualTo("module.ts");
    assertThat(warning.description())
        .isEqualTo("Module binding f is already declared, only its first declaration is analyzed");
  }

  @Test
  public void testFunctionRedeclaringValueIsNotAClosure() throws Exception {
    AnalysisResult result =
        analyzer.analyze(
            IR.program(
                IR.var(IR.name("f"), IR.number(1)),
                IR.var(IR.name("f"), arrow(IR.paramList(), IR.number(2)))));

    assertThat(result.getModuleVars()).containsExactly(ModuleVar.plain("f"));
    assertThat(result.getClosures()).isEmpty();
    assertThat(errorManager.getWarningCount()).isEqualTo(1);
  }

  @Test
  public void testDestructuringIsNotTracked() throws Exception {
    Node pattern = IR.objectPattern(IR.stringKey("a", IR.name("a")));
    AnalysisResult result =
        analyzer.analyze(IR.program(IR.constNode(pattern, IR.name("source"))));

    assertThat(result.getModuleVars()).isEmpty();
  }

  @Test
  public void testMultipleDeclaratorsAreVarsButNotClosures() throws Exception {
    Node f = arrow(IR.paramList(), IR.block());
    Node declaration =
        IR.declaration(
            Token.CONST,
            ImmutableList.of(
                IR.declarator(IR.name("f"), f), IR.declarator(IR.name("n"), IR.number(1))));

    AnalysisResult result = analyzer.analyze(IR.program(declaration));

    assertThat(result.getModuleVars())
        .containsExactly(ModuleVar.function("f"), ModuleVar.plain("n"))
        .inOrder();
    assertThat(result.getClosures()).isEmpty();
  }

  @Test
  public void testParametersShadowModuleVars() throws Exception {
    AnalysisResult result =
        analyzer.analyze(
            IR.program(
                constDecl("store", IR.newNode(IR.name("Map"))),
                constDecl(
                    "f",
                    arrow(
                        IR.paramList(IR.name("store")),
                        IR.block(IR.returnNode(IR.name("store")))))));

    ClosureInfo f = result.getClosure("f");
    assertThat(f.getFreeVars()).isEmpty();
    assertThat(f.getCapturesMutable()).isEmpty();
  }

  @Test
  public void testLocalsShadowModuleVars() throws Exception {
    AnalysisResult result =
        analyzer.analyze(
            IR.program(
                constDecl("store", IR.newNode(IR.name("Map"))),
                constDecl(
                    "f",
                    arrow(
                        IR.paramList(),
                        IR.block(
                            constDecl("store", IR.number(1)),
                            IR.returnNode(IR.name("store")))))));

    assertThat(result.getClosure("f").getFreeVars()).isEmpty();
  }

  @Test
  public void testLocalsInIfBranchesShadowModuleVars() throws Exception {
    AnalysisResult result =
        analyzer.analyze(
            IR.program(
                constDecl("a", IR.newNode(IR.name("Map"))),
                constDecl("b", IR.newNode(IR.name("Map"))),
                constDecl(
                    "f",
                    arrow(
                        IR.paramList(IR.name("c")),
                        IR.block(
                            IR.ifNode(
                                IR.name("c"),
                                IR.block(constDecl("a", IR.number(1))),
                                constDecl("b", IR.number(2))),
                            IR.returnNode(IR.add(IR.name("a"), IR.name("b"))))))));

    assertThat(result.getClosure("f").getFreeVars()).isEmpty();
  }

  @Test
  public void testLocalsInNestedIfAreNotFound() throws Exception {
    Node nested = IR.ifNode(IR.name("c"), IR.block(constDecl("a", IR.number(1))));
    AnalysisResult result =
        analyzer.analyze(
            IR.program(
                constDecl("a", IR.newNode(IR.name("Map"))),
                constDecl(
                    "f",
                    arrow(
                        IR.paramList(IR.name("c")),
                        IR.block(
                            IR.ifNode(IR.name("c"), IR.block(nested)),
                            IR.returnNode(IR.name("a")))))));

    assertThat(result.getClosure("f").getFreeVars()).containsExactly("a");
    assertThat(result.getClosure("f").getCapturesMutable()).containsExactly("a");
  }

  @Test
  public void testExpressionBody() throws Exception {
    AnalysisResult result =
        analyzer.analyze(
            IR.program(
                constDecl("counts", IR.newNode(IR.name("Map"))),
                constDecl(
                    "size",
                    arrow(IR.paramList(), IR.getprop(IR.name("counts"), "size")))));

    assertThat(result.getClosure("size").getCapturesMutable()).containsExactly("counts");
  }

  @Test
  public void testPropertyNamesAreNotReferences() throws Exception {
    AnalysisResult result =
        analyzer.analyze(
            IR.program(
                constDecl("store", IR.newNode(IR.name("Map"))),
                constDecl("other", IR.newNode(IR.name("Map"))),
                constDecl(
                    "f",
                    arrow(
                        IR.paramList(IR.name("o")),
                        IR.block(
                            IR.returnNode(
                                IR.add(
                                    IR.getprop(IR.name("o"), "store"),
                                    IR.getelem(IR.name("o"), IR.name("other")))))))));

    assertThat(result.getClosure("f").getFreeVars()).isEmpty();
  }

  @Test
  public void testNestedFunctionsAreOpaque() throws Exception {
    Node inner = arrow(IR.paramList(), IR.name("store"));
    AnalysisResult result =
        analyzer.analyze(
            IR.program(
                constDecl("store", IR.newNode(IR.name("Map"))),
                constDecl("f", arrow(IR.paramList(), IR.block(IR.returnNode(inner))))));

    assertThat(result.getClosure("f").getFreeVars()).isEmpty();
  }

  @Test
  public void testCallsOnlyCountModuleFunctions() throws Exception {
    AnalysisResult result =
        analyzer.analyze(
            IR.program(
                constDecl("g", arrow(IR.paramList(), IR.number(1))),
                constDecl("n", IR.number(2)),
                constDecl(
                    "f",
                    arrow(
                        IR.paramList(IR.name("cb")),
                        IR.block(
                            IR.exprResult(IR.call(IR.name("cb"))),
                            IR.exprResult(IR.call(IR.name("n"))),
                            IR.exprResult(IR.call(IR.getprop(IR.name("console"), "log"))),
                            IR.returnNode(IR.call(IR.name("g"))))))));

    ClosureInfo f = result.getClosure("f");
    assertThat(f.getCalledFunctions()).containsExactly("g");
    assertThat(f.getFreeVars()).containsExactly("n", "g").inOrder();
  }

  @Test
  public void testFunctionsPassedAsArgumentsAreReferencesNotCalls() throws Exception {
    AnalysisResult result =
        analyzer.analyze(
            IR.program(
                constDecl("g", arrow(IR.paramList(), IR.number(1))),
                constDecl(
                    "f",
                    arrow(
                        IR.paramList(IR.name("list")),
                        IR.call(IR.getprop(IR.name("list"), "map"), IR.name("g"))))));

    ClosureInfo f = result.getClosure("f");
    assertThat(f.getFreeVars()).containsExactly("g");
    assertThat(f.getCalledFunctions()).isEmpty();
  }

  @Test
  public void testObjectLiteralValuesAreReferences() throws Exception {
    AnalysisResult result =
        analyzer.analyze(
            IR.program(
                constDecl("seen", IR.newNode(IR.name("Set"))),
                constDecl(
                    "f",
                    arrow(
                        IR.paramList(),
                        IR.objectlit(IR.stringKey("seen", IR.name("seen")))))));

    assertThat(result.getClosure("f").getCapturesMutable()).containsExactly("seen");
  }

  @Test
  public void testExportsKeepLocalNames() throws Exception {
    AnalysisResult result =
        analyzer.analyze(
            IR.program(
                constDecl("a", arrow(IR.paramList(), IR.number(1))),
                constDecl("b", arrow(IR.paramList(), IR.number(2))),
                IR.exportSpecs(IR.exportSpec("a"), IR.exportSpec("b", "renamed"))));

    assertThat(result.getExports()).containsExactly("a", "b").inOrder();
  }

  private static class CollectingErrorManager extends BasicErrorManager {
    @Override
    public void println(CheckLevel level, JSError error) {}

    @Override
    protected void printSummary() {}
  }
}
