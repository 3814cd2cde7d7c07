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

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.tmplr.javascript.rhino.IR;
import org.tmplr.javascript.rhino.Node;
import org.tmplr.javascript.rhino.Token;

@RunWith(JUnit4.class)
public final class RemoveUnusedVarDeclarationsTest extends CompilerTestCase {

  @Override
  protected CompilerPass getProcessor(Compiler compiler) {
    return new RemoveUnusedVarDeclarations(compiler);
  }

  private static Node function(String name, Node... body) {
    return IR.function(IR.name(name), IR.paramList(), IR.block(body));
  }

  private static Node var(String name, double value) {
    return IR.var(IR.name(name), IR.number(value));
  }

  private static Node emptyVar() {
    return new Node(Token.VAR);
  }

  @Test
  public void testRemoveUnusedDeclarator() {
    // var a = 1, b = 2; return a;
    test(
        IR.script(
            function(
                "f",
                IR.var(
                    ImmutableList.of(
                        IR.declarator("a", IR.number(1)), IR.declarator("b", IR.number(2)))),
                IR.returnNode(IR.name("a")))),
        IR.script(function("f", var("a", 1), IR.returnNode(IR.name("a")))));
  }

  @Test
  public void testEmptiedVarIsKept() {
    test(IR.script(function("f", var("a", 1))), IR.script(function("f", emptyVar())));
  }

  @Test
  public void testUsedDeclaratorIsKept() {
    testSame(IR.script(function("f", var("a", 1), IR.returnNode(IR.name("a")))));
    testSame(IR.script(function("f", IR.var(IR.name("a")), IR.returnNode(IR.name("a")))));
  }

  @Test
  public void testReferenceInNestedFunctionKeepsDeclarator() {
    // var a = 1; return function() { return a; };
    testSame(
        IR.script(
            function(
                "f",
                var("a", 1),
                IR.returnNode(
                    IR.function(IR.paramList(), IR.block(IR.returnNode(IR.name("a"))))))));
  }

  @Test
  public void testTopLevelDeclaratorUsedInFunction() {
    testSame(IR.script(var("a", 1), function("f", IR.returnNode(IR.name("a")))));
  }

  @Test
  public void testReferenceInOtherFunctionIsIgnored() {
    test(
        IR.script(function("f", var("a", 1)), function("g", IR.returnNode(IR.name("a")))),
        IR.script(function("f", emptyVar()), function("g", IR.returnNode(IR.name("a")))));
  }

  @Test
  public void testPropertyNameIsNotAReference() {
    // var a = 1; return b.a;
    test(
        IR.script(function("f", var("a", 1), IR.returnNode(IR.getprop(IR.name("b"), "a")))),
        IR.script(function("f", emptyVar(), IR.returnNode(IR.getprop(IR.name("b"), "a")))));
  }

  @Test
  public void testDeclaratorsReferencingEachOther() {
    // var a = 1, b = a; return b;
    testSame(
        IR.script(
            function(
                "f",
                IR.var(
                    ImmutableList.of(
                        IR.declarator("a", IR.number(1)), IR.declarator("b", IR.name("a")))),
                IR.returnNode(IR.name("b")))));
  }

  @Test
  public void testForLoopDeclarator() {
    // for (var i = 0; i < n; i++) {}
    testSame(
        IR.script(
            function(
                "f",
                IR.forNode(
                    var("i", 0),
                    IR.lt(IR.name("i"), IR.name("n")),
                    IR.inc(IR.name("i")),
                    IR.block()))));
  }
}
