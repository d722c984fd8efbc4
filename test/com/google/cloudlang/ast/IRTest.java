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

package com.google.cloudlang.ast;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link IR}. */
@RunWith(JUnit4.class)
public final class IRTest {

  @Test
  public void testDeclarationKeepsInitializerUnderName() {
    Node n = IR.constNode(IR.name("x"), IR.number(1));

    assertThat(n.getToken()).isEqualTo(Token.CONST);
    Node declarator = n.getOnlyChild();
    assertThat(declarator.isName()).isTrue();
    assertThat(declarator.getOnlyChild().isNumber()).isTrue();
  }

  @Test
  public void testDestructuringDeclaration() {
    Node n = IR.let(IR.arrayPattern(IR.name("a"), IR.name("b")), IR.name("pair"));

    Node lhs = n.getOnlyChild();
    assertThat(lhs.isDestructuringLhs()).isTrue();
    assertThat(lhs.getFirstChild().getToken()).isEqualTo(Token.ARRAY_PATTERN);
    assertThat(lhs.getSecondChild().getString()).isEqualTo("pair");
  }

  @Test
  public void testDeclarationWithoutInitializer() {
    Node n = IR.declaration(IR.objectPattern(IR.stringKey("a", IR.name("a"))), Token.VAR);

    assertThat(n.getOnlyChild().isDestructuringLhs()).isTrue();
    assertThat(n.getOnlyChild().hasOneChild()).isTrue();
  }

  @Test
  public void testDeclarationNeedsDeclarators() {
    assertThrows(
        IllegalArgumentException.class, () -> IR.declaration(Token.LET, ImmutableList.of()));
  }

  @Test
  public void testDeclaratorRejectsSecondInitializer() {
    Node declarator = IR.declarator(IR.name("x"), IR.number(1));

    assertThrows(IllegalStateException.class, () -> IR.declarator(declarator, IR.number(2)));
  }

  @Test
  public void testArrowFunction() {
    Node f = IR.arrowFunction(IR.paramList(IR.name("a")), IR.name("a"));

    assertThat(f.isFunction()).isTrue();
    assertThat(f.getFirstChild().getString()).isEmpty();
    assertThat(f.getSecondChild().isParamList()).isTrue();
    assertThat(f.isAsyncFunction()).isFalse();
  }

  @Test
  public void testNameRejectsQualifiedNames() {
    assertThrows(IllegalStateException.class, () -> IR.name("a.b"));
  }

  @Test
  public void testProgramRejectsExpressions() {
    assertThrows(IllegalStateException.class, () -> IR.program(IR.name("x")));
    assertThrows(IllegalStateException.class, () -> IR.block(IR.number(1)));
  }

  @Test
  public void testBinaryOpRejectsUnaryToken() {
    assertThrows(
        IllegalStateException.class, () -> IR.binaryOp(Token.NOT, IR.name("a"), IR.name("b")));
    assertThrows(IllegalStateException.class, () -> IR.unaryOp(Token.ADD, IR.name("a")));
  }

  @Test
  public void testExportNames() {
    Node export = IR.exportNames("a", "b");

    assertThat(export.isExport()).isTrue();
    Node specs = export.getOnlyChild();
    assertThat(specs.isExportSpecs()).isTrue();
    assertThat(specs.getChildCount()).isEqualTo(2);
    Node spec = specs.getFirstChild();
    assertThat(spec.isExportSpec()).isTrue();
    assertThat(spec.getFirstChild().getString()).isEqualTo("a");
    assertThat(spec.getSecondChild().getString()).isEqualTo("a");
  }

  @Test
  public void testMayBeExpression() {
    assertThat(IR.mayBeExpression(IR.name("x"))).isTrue();
    assertThat(IR.mayBeExpression(IR.coalesce(IR.name("x"), IR.nullNode()))).isTrue();
    assertThat(IR.mayBeExpression(IR.unaryOp(Token.TYPEOF, IR.name("x")))).isTrue();
    assertThat(IR.mayBeExpression(IR.arrowFunction(IR.paramList(), IR.block()))).isTrue();
    assertThat(IR.mayBeExpression(IR.block())).isFalse();
    assertThat(IR.mayBeExpression(IR.paramList())).isFalse();
  }
}
