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

package org.tmplr.javascript.jscomp;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.tmplr.javascript.rhino.IR;
import org.tmplr.javascript.rhino.Node;

@RunWith(JUnit4.class)
public final class ScopeResolverTest {

  @Test
  public void testTopLevelNodeIsScopedToRoot() {
    Node x = IR.name("x");
    Node root = IR.script(IR.exprResult(IR.call(x)));
    assertThat(ScopeResolver.findScope(root, x)).isSameInstanceAs(root);
  }

  @Test
  public void testNodeInFunctionIsScopedToBody() {
    Node x = IR.name("x");
    Node body = IR.block(IR.returnNode(x));
    Node function = IR.function(IR.name("f"), IR.paramList("p"), body);
    Node root = IR.script(function);

    assertThat(ScopeResolver.findScope(root, x)).isSameInstanceAs(body);
    // Parameters belong to the function they are declared by.
    assertThat(ScopeResolver.findScope(root, function.getSecondChild().getFirstChild()))
        .isSameInstanceAs(body);
    // The function itself belongs to the enclosing scope.
    assertThat(ScopeResolver.findScope(root, function)).isSameInstanceAs(root);
  }

  @Test
  public void testInnermostFunctionWins() {
    Node x = IR.name("x");
    Node innerBody = IR.block(IR.returnNode(x));
    Node outerBody =
        IR.block(
            IR.block(IR.function(IR.name("inner"), IR.paramList(), innerBody)),
            IR.returnNode(IR.name("y")));
    Node root = IR.script(IR.function(IR.name("outer"), IR.paramList(), outerBody));

    assertThat(ScopeResolver.findScope(root, x)).isSameInstanceAs(innerBody);
    assertThat(ScopeResolver.findScope(root, outerBody.getLastChild()))
        .isSameInstanceAs(outerBody);
  }

  @Test
  public void testFunctionExpression() {
    Node x = IR.name("x");
    Node body = IR.block(IR.returnNode(x));
    Node root = IR.script(IR.var(IR.name("f"), IR.function(IR.paramList(), body)));
    assertThat(ScopeResolver.findScope(root, x)).isSameInstanceAs(body);
  }

  @Test
  public void testTargetNotInTree() {
    Node root = IR.script(IR.exprResult(IR.name("x")));
    Node stranger = IR.name("x");
    assertThat(ScopeResolver.findScope(root, stranger)).isNull();
    assertThrows(NullPointerException.class, () -> ScopeResolver.getScope(root, stranger));
  }
}
