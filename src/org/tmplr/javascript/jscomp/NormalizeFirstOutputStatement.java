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
import org.tmplr.javascript.rhino.Token;

/**
 * If the first output statement is not in a branch, makes it a direct assignment ({@code =})
 * rather than {@code +=}, and removes the initial value from the output variable's declaration.
 *
 * <pre>
 *   var html = ""; html += "a"; return html;
 * </pre>
 *
 * becomes
 *
 * <pre>
 *   var html; html = "a"; return html;
 * </pre>
 *
 * <p>The scope of the declaration is scanned in document order. The scan ends without a rewrite at
 * the first FOR, IF or FUNCTION, since the first write may then be conditional, repeated, or
 * happen later. It also ends without a rewrite at any use of the output variable other than an
 * {@code html += value;} statement. A declaration initialized with anything but the empty string
 * is left alone, as its value is part of the output.
 */
final class NormalizeFirstOutputStatement implements CompilerPass {
  private final AbstractCompiler compiler;
  private final String outputName;

  NormalizeFirstOutputStatement(AbstractCompiler compiler) {
    this.compiler = compiler;
    this.outputName = compiler.getOptions().getOutputVariableName();
  }

  @Override
  public void process(Node root) {
    for (Node declarator : findOutputDeclarators(root)) {
      if (declarator.hasChildren() && !NodeUtil.isEmptyString(declarator.getFirstChild())) {
        continue;
      }
      Node scope = ScopeResolver.getScope(root, declarator);
      Node first = findFirstOutputStatement(scope, declarator);
      if (first != null) {
        first.getFirstChild().setToken(Token.ASSIGN);
        if (declarator.hasChildren()) {
          declarator.removeFirstChild();
        }
        compiler.reportChangeToEnclosingScope(first);
        compiler.reportChangeToEnclosingScope(declarator);
      }
    }
  }

  private ImmutableList<Node> findOutputDeclarators(Node root) {
    ImmutableList.Builder<Node> declarators = ImmutableList.builder();
    NodeTraversal.traverse(
        root,
        new AbstractPreOrderCallback() {
          @Override
          public Control enter(NodeTraversal t, Node n, @Nullable Node parent) {
            if (n.matchesName(outputName) && NodeUtil.isDeclarator(n)) {
              declarators.add(n);
            }
            return Control.CONTINUE;
          }
        });
    return declarators.build();
  }

  /**
   * Returns the first {@code html += value;} statement of the scope if it is reached before any
   * branch, loop, function or other use of the output variable, or null.
   */
  private @Nullable Node findFirstOutputStatement(Node scope, Node declarator) {
    FirstOutputFinder finder = new FirstOutputFinder(declarator);
    NodeTraversal.traverse(scope, finder);
    return finder.found;
  }

  private final class FirstOutputFinder extends AbstractPreOrderCallback {
    private final Node declarator;
    private @Nullable Node found;

    FirstOutputFinder(Node declarator) {
      this.declarator = declarator;
    }

    @Override
    public Control enter(NodeTraversal t, Node n, @Nullable Node parent) {
      switch (n.getToken()) {
        case FOR:
        case IF:
        case FUNCTION:
          return Control.STOP;
        case EXPR_RESULT:
          if (NodeUtil.isOutputAccumulation(n, outputName)) {
            found = n;
            return Control.STOP;
          }
          return Control.CONTINUE;
        case NAME:
          return n.matchesName(outputName) && n != declarator ? Control.STOP : Control.CONTINUE;
        default:
          return Control.CONTINUE;
      }
    }
  }
}
