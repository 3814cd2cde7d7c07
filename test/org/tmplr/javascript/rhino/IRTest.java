/*
 * Copyright 2026 The Tmplr Authors.
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

package org.tmplr.javascript.rhino;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.tmplr.javascript.rhino.testing.NodeSubject.assertNode;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class IRTest {

  @Test
  public void testFunction() {
    Node fn = IR.function(IR.name("render"), IR.paramList("context"), IR.block());
    assertNode(fn).hasToken(Token.FUNCTION).hasChildCountThat().isEqualTo(3);
    assertNode(fn.getSecondChild().getOnlyChild()).hasStringThat().isEqualTo("context");

    Node anonymous = IR.function(IR.paramList(), IR.block());
    assertNode(anonymous.getFirstChild()).hasStringThat().isEmpty();
  }

  @Test
  public void testParamListRejectsAnonymousNames() {
    assertThrows(IllegalStateException.class, () -> IR.paramList(IR.name("")));
    assertThrows(IllegalStateException.class, () -> IR.paramList(IR.string("a")));
  }

  @Test
  public void testVar() {
    Node var = IR.var(IR.name("html"), IR.string(""));
    assertNode(var).hasChildCountThat().isEqualTo(1);
    assertNode(var.getFirstChild().getOnlyChild()).isEquivalentTo(IR.string(""));

    Node a = IR.declarator("a", IR.number(1));
    Node b = IR.name("b");
    Node multi = IR.var(ImmutableList.of(a, b));
    assertThat(multi.getFirstChild()).isSameInstanceAs(a);
    assertThat(multi.getLastChild()).isSameInstanceAs(b);
    assertNode(a.getOnlyChild()).isEquivalentTo(IR.number(1));

    assertThrows(IllegalStateException.class, () -> IR.var(ImmutableList.of()));
    assertThrows(IllegalStateException.class, () -> IR.var(IR.string("a")));
    assertThrows(IllegalStateException.class, () -> IR.var(IR.name("a"), IR.block()));
  }

  @Test
  public void testGetprop() {
    Node getprop = IR.getprop(IR.name("context"), "items", "length");
    assertNode(getprop)
        .isEquivalentTo(
            new Node(
                Token.GETPROP,
                new Node(Token.GETPROP, IR.name("context"), IR.string("items")),
                IR.string("length")));
  }

  @Test
  public void testNameMustNotBeQualified() {
    assertThrows(IllegalStateException.class, () -> IR.name("a.b"));
  }

  @Test
  public void testStatementPositions() {
    assertThrows(IllegalStateException.class, () -> IR.block(IR.name("x")));
    assertThrows(IllegalStateException.class, () -> IR.script(IR.returnNode()));
    assertThat(IR.block(IR.returnNode()).hasOneChild()).isTrue();
    assertThrows(
        IllegalStateException.class, () -> IR.ifNode(IR.name("x"), IR.exprResult(IR.name("y"))));
  }

  @Test
  public void testExpressionPositions() {
    assertThrows(IllegalStateException.class, () -> IR.exprResult(IR.block()));
    assertThrows(IllegalStateException.class, () -> IR.add(IR.name("a"), IR.empty()));
    assertThrows(IllegalStateException.class, () -> IR.assign(IR.string("a"), IR.number(1)));
    assertThrows(
        IllegalStateException.class, () -> IR.binaryOp(Token.NOT, IR.name("a"), IR.name("b")));
    assertThat(IR.mayBeExpression(IR.function(IR.paramList(), IR.block()))).isTrue();
    assertThat(IR.mayBeStatement(IR.function(IR.paramList(), IR.block()))).isTrue();
    assertThat(IR.mayBeExpression(IR.var(IR.name("a")))).isFalse();
  }

  @Test
  public void testFor() {
    Node loop =
        IR.forNode(
            IR.var(IR.name("i"), IR.number(0)),
            IR.lt(IR.name("i"), IR.number(3)),
            IR.inc(IR.name("i")),
            IR.block());
    assertNode(loop).hasToken(Token.FOR).hasChildCountThat().isEqualTo(4);

    Node forever = IR.forNode(IR.empty(), IR.empty(), IR.empty(), IR.block());
    assertNode(forever.getFirstChild()).hasToken(Token.EMPTY);
  }
}
