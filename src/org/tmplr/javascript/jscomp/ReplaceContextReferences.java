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

import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.tmplr.javascript.jscomp.NodeTraversal.AbstractPreOrderCallback;
import org.tmplr.javascript.jscomp.NodeTraversal.AbstractShallowCallback;
import org.tmplr.javascript.jscomp.NodeTraversal.Control;
import org.tmplr.javascript.rhino.IR;
import org.tmplr.javascript.rhino.Node;

/**
 * Replaces references to the render context inside generated closures with {@code this}.
 *
 * <pre>
 *   helpers.each(items, function (item) { return context.label + item; });
 * </pre>
 *
 * becomes
 *
 * <pre>
 *   helpers.each(items, function (item) { return this.label + item; });
 * </pre>
 *
 * <p>Function declarations and everything nested in them are not touched, and neither are
 * functions nested in a rewritten function expression, since they bind their own receiver. A
 * declared variable, parameter or function called {@code context} keeps its name.
 */
final class ReplaceContextReferences implements CompilerPass {
  private final AbstractCompiler compiler;
  private final String contextName;

  ReplaceContextReferences(AbstractCompiler compiler) {
    this.compiler = compiler;
    this.contextName = compiler.getOptions().getContextName();
  }

  @Override
  public void process(Node root) {
    List<Node> references = new ArrayList<>();
    NodeTraversal.traverse(
        root,
        new AbstractPreOrderCallback() {
          @Override
          public Control enter(NodeTraversal t, Node n, @Nullable Node parent) {
            if (!n.isFunction()) {
              return Control.CONTINUE;
            }
            if (NodeUtil.isFunctionExpression(n)) {
              collectContextReferences(n, references);
            }
            return Control.SKIP_CHILDREN;
          }
        });

    for (Node reference : references) {
      Node parent = reference.getParent();
      reference.replaceWith(IR.thisNode());
      compiler.reportChangeToEnclosingScope(parent);
    }
  }

  private void collectContextReferences(Node function, List<Node> references) {
    NodeTraversal.traverse(
        function,
        new AbstractShallowCallback() {
          @Override
          public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
            if (n.matchesName(contextName)
                && !NodeUtil.isDeclarator(n)
                && !NodeUtil.isFunctionBindingName(n)) {
              references.add(n);
            }
          }
        });
  }
}
