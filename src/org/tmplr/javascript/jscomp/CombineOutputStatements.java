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
import org.jspecify.annotations.Nullable;
import org.tmplr.javascript.jscomp.NodeTraversal.AbstractPreOrderCallback;
import org.tmplr.javascript.jscomp.NodeTraversal.Control;
import org.tmplr.javascript.rhino.IR;
import org.tmplr.javascript.rhino.Node;

/**
 * Turns runs of consecutive output statements into one statement.
 *
 * <pre>
 *   html += a; html += b; x = 1; html += c;
 * </pre>
 *
 * becomes
 *
 * <pre>
 *   html += a + b; x = 1; html += c;
 * </pre>
 *
 * The combined value is a left-associated ADD chain. The template compiler only ever accumulates
 * strings, so {@code html += a + b} produces the same output as the two separate statements.
 */
final class CombineOutputStatements implements CompilerPass {
  private final AbstractCompiler compiler;
  private final String outputName;

  CombineOutputStatements(AbstractCompiler compiler) {
    this.compiler = compiler;
    this.outputName = compiler.getOptions().getOutputVariableName();
  }

  @Override
  public void process(Node root) {
    for (Node block : findBlocks(root)) {
      combineRuns(block);
    }
  }

  private void combineRuns(Node block) {
    Node runStart = null;
    for (Node statement = block.getFirstChild(); statement != null; ) {
      Node next = statement.getNext();
      if (!NodeUtil.isOutputAccumulation(statement, outputName)) {
        runStart = null;
      } else if (runStart == null) {
        runStart = statement;
      } else {
        appendToRun(runStart, statement);
      }
      statement = next;
    }
  }

  /** Moves the value of {@code statement} to the end of the run and removes the statement. */
  private void appendToRun(Node runStart, Node statement) {
    Node accumulation = runStart.getFirstChild();
    Node combined = accumulation.getLastChild().detach();
    Node value = statement.getFirstChild().getLastChild().detach();
    accumulation.addChildToBack(IR.add(combined, value));
    statement.detach();
    compiler.reportChangeToEnclosingScope(runStart);
  }

  private static ImmutableList<Node> findBlocks(Node root) {
    ImmutableList.Builder<Node> blocks = ImmutableList.builder();
    NodeTraversal.traverse(
        root,
        new AbstractPreOrderCallback() {
          @Override
          public Control enter(NodeTraversal t, Node n, @Nullable Node parent) {
            if (n.isBlock()) {
              blocks.add(n);
            }
            return Control.CONTINUE;
          }
        });
    return blocks.build();
  }
}
