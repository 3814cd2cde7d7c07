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

@RunWith(JUnit4.class)
public final class NormalizeFirstOutputStatementTest extends CompilerTestCase {

  @Override
  protected CompilerPass getProcessor(Compiler compiler) {
    return new NormalizeFirstOutputStatement(compiler);
  }

  private static Node render(Node... body) {
    return IR.script(IR.function(IR.name("render"), IR.paramList("context"), IR.block(body)));
  }

  /** var html; */
  private static Node declare() {
    return IR.var(IR.name("html"));
  }

  /** var html = init; */
  private static Node declare(Node init) {
    return IR.var(IR.name("html"), init);
  }

  private static Node output(Node value) {
    return IR.exprResult(IR.assignAdd(IR.name("html"), value));
  }

  private static Node assignOutput(Node value) {
    return IR.exprResult(IR.assign(IR.name("html"), value));
  }

  private static Node returnHtml() {
    return IR.returnNode(IR.name("html"));
  }

  @Test
  public void testNormalizeFirstOutput() {
    // var html; html += "a"; return html;
    test(
        render(declare(), output(IR.string("a")), returnHtml()),
        render(declare(), assignOutput(IR.string("a")), returnHtml()));
  }

  @Test
  public void testEmptyStringInitializerIsRemoved() {
    // var html = ""; html += "a"; return html;
    test(
        render(declare(IR.string("")), output(IR.string("a")), returnHtml()),
        render(declare(), assignOutput(IR.string("a")), returnHtml()));
  }

  @Test
  public void testOnlyFirstOutputIsRewritten() {
    test(
        render(declare(IR.string("")), output(IR.string("a")), output(IR.string("b"))),
        render(declare(), assignOutput(IR.string("a")), output(IR.string("b"))));
  }

  @Test
  public void testStatementsBeforeFirstOutput() {
    // var html = "", x = 1; log(x); html += x;
    test(
        render(
            IR.var(
                ImmutableList.of(
                    IR.declarator("html", IR.string("")), IR.declarator("x", IR.number(1)))),
            IR.exprResult(IR.call(IR.name("log"), IR.name("x"))),
            output(IR.name("x"))),
        render(
            IR.var(ImmutableList.of(IR.name("html"), IR.declarator("x", IR.number(1)))),
            IR.exprResult(IR.call(IR.name("log"), IR.name("x"))),
            assignOutput(IR.name("x"))));
  }

  @Test
  public void testIfBoundary() {
    // var html = ""; if (x) { html += "a"; } return html;
    testSame(
        render(
            declare(IR.string("")),
            IR.ifNode(IR.name("x"), IR.block(output(IR.string("a")))),
            returnHtml()));
  }

  @Test
  public void testBoundaryBeforeUnconditionalOutput() {
    // var html = ""; if (x) { y(); } html += "a";
    testSame(
        render(
            declare(IR.string("")),
            IR.ifNode(IR.name("x"), IR.block(IR.exprResult(IR.call(IR.name("y"))))),
            output(IR.string("a"))));
  }

  @Test
  public void testForBoundary() {
    testSame(
        render(
            declare(IR.string("")),
            IR.forNode(
                IR.empty(), IR.name("x"), IR.empty(), IR.block(output(IR.name("item")))),
            returnHtml()));
  }

  @Test
  public void testFunctionBoundary() {
    // var html = ""; helpers.each(items, function(item) { html += item; });
    testSame(
        render(
            declare(IR.string("")),
            IR.exprResult(
                IR.call(
                    IR.getprop(IR.name("helpers"), "each"),
                    IR.name("items"),
                    IR.function(IR.paramList("item"), IR.block(output(IR.name("item")))))),
            returnHtml()));
  }

  @Test
  public void testNonEmptyInitializerIsKept() {
    testSame(render(declare(IR.string("<ul>")), output(IR.string("a")), returnHtml()));
  }

  @Test
  public void testEarlierUseOfOutputVariable() {
    // var html = ""; log(html); html += "a";
    testSame(
        render(
            declare(IR.string("")),
            IR.exprResult(IR.call(IR.name("log"), IR.name("html"))),
            output(IR.string("a"))));
  }

  @Test
  public void testOutputAlreadyAssigned() {
    testSame(render(declare(), assignOutput(IR.string("a")), output(IR.string("b"))));
  }

  @Test
  public void testEachFunctionIsNormalized() {
    test(
        IR.script(
            IR.function(
                IR.name("a"),
                IR.paramList(),
                IR.block(declare(IR.string("")), output(IR.string("a")), returnHtml())),
            IR.function(
                IR.name("b"),
                IR.paramList(),
                IR.block(declare(IR.string("")), output(IR.string("b")), returnHtml()))),
        IR.script(
            IR.function(
                IR.name("a"),
                IR.paramList(),
                IR.block(declare(), assignOutput(IR.string("a")), returnHtml())),
            IR.function(
                IR.name("b"),
                IR.paramList(),
                IR.block(declare(), assignOutput(IR.string("b")), returnHtml()))));
  }
}
