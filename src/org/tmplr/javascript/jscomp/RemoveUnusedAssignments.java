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
import org.tmplr.javascript.rhino.Node;

/**
 * Removes statements of the form {@code x = value;} when {@code x} is not referenced anywhere else
 * in the scope of the statement.
 *
 * <p>The whole statement goes, including the value, so this is only correct for the side-effect
 * free values the template compiler generates. Compound assignments and assignments to properties
 * are never removed.
 */
final class RemoveUnusedAssignments implements CompilerPass {
  private final AbstractCompiler compiler;

  RemoveUnusedAssignments(AbstractCompiler compiler) {
    this.compiler = compiler;
  }

  @Override
  public void process(Node root) {
    for (Node statement : findUnusedAssignments(root)) {
      Node parent = statement.getParent();
      statement.detach();
      compiler.reportChangeToEnclosingScope(parent);
    }
  }

  /** Finds the EXPR_RESULTs holding assignments whose value is never read. */
  private static ImmutableList<Node> findUnusedAssignments(Node root) {
    ImmutableList.Builder<Node> unused = ImmutableList.builder();
    NodeTraversal.traverse(
        root,
        new AbstractPreOrderCallback() {
          @Override
          public Control enter(NodeTraversal t, Node n, @Nullable Node parent) {
            if (NodeUtil.isSimpleNameAssignment(n)) {
              Node target = n.getFirstChild().getFirstChild();
              Node scope = ScopeResolver.getScope(root, n);
              // The statement itself is skipped, so `x = x + 1;` doesn't keep itself alive.
              if (ReferenceFinder.findReferences(scope, target, n).isEmpty()) {
                unused.add(n);
              }
            }
            return Control.CONTINUE;
          }
        });
    return unused.build();
  }
}
