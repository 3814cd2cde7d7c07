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
 * Removes variable declarators that are never referenced in their scope.
 *
 * <pre>
 *   var a = 1, b = 2; return a;
 * </pre>
 *
 * becomes
 *
 * <pre>
 *   var a = 1; return a;
 * </pre>
 *
 * A VAR whose declarators are all removed is left in place, empty.
 */
final class RemoveUnusedVarDeclarations implements CompilerPass {
  private final AbstractCompiler compiler;

  RemoveUnusedVarDeclarations(AbstractCompiler compiler) {
    this.compiler = compiler;
  }

  @Override
  public void process(Node root) {
    for (Node declarator : findUnusedDeclarators(root)) {
      Node var = declarator.getParent();
      declarator.detach();
      compiler.reportChangeToEnclosingScope(var);
    }
  }

  private static ImmutableList<Node> findUnusedDeclarators(Node root) {
    ImmutableList.Builder<Node> unused = ImmutableList.builder();
    NodeTraversal.traverse(
        root,
        new AbstractPreOrderCallback() {
          @Override
          public Control enter(NodeTraversal t, Node n, @Nullable Node parent) {
            if (NodeUtil.isDeclarator(n)) {
              Node scope = ScopeResolver.getScope(root, n);
              if (!ReferenceFinder.hasOtherReferences(scope, n, null)) {
                unused.add(n);
              }
            }
            return Control.CONTINUE;
          }
        });
    return unused.build();
  }
}
