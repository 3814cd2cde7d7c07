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

import static com.google.common.base.Preconditions.checkNotNull;

import org.jspecify.annotations.Nullable;
import org.tmplr.javascript.jscomp.NodeTraversal.AbstractPreOrderCallback;
import org.tmplr.javascript.jscomp.NodeTraversal.Control;
import org.tmplr.javascript.rhino.Node;

/**
 * Finds the lexical scope of a node: the body of the nearest enclosing function.
 *
 * <p>Scopes are purely syntactic. A node that is not inside any function is scoped to the
 * traversal root, which for a whole program is the SCRIPT.
 */
final class ScopeResolver {

  private ScopeResolver() {}

  /**
   * Walks {@code root} until {@code target} is reached.
   *
   * @return the body BLOCK of the innermost function enclosing {@code target}, {@code root} if no
   *     function encloses it, or null if {@code target} is not part of the tree
   */
  static @Nullable Node findScope(Node root, Node target) {
    ScopeFindingCallback cb = new ScopeFindingCallback(root, target);
    NodeTraversal.traverse(root, cb);
    return cb.scope;
  }

  /** Like {@link #findScope} but fails if {@code target} is not part of the tree. */
  static Node getScope(Node root, Node target) {
    return checkNotNull(findScope(root, target), "%s is not part of the tree", target);
  }

  private static final class ScopeFindingCallback extends AbstractPreOrderCallback {
    private final Node root;
    private final Node target;
    private @Nullable Node scope;

    ScopeFindingCallback(Node root, Node target) {
      this.root = root;
      this.target = target;
    }

    @Override
    public Control enter(NodeTraversal t, Node n, @Nullable Node parent) {
      if (n != target) {
        return Control.CONTINUE;
      }
      Node function = t.getEnclosingFunction();
      scope = function == null ? root : NodeUtil.getFunctionBody(function);
      return Control.STOP;
    }
  }
}
