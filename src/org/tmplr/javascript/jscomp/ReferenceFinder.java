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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.tmplr.javascript.jscomp.NodeTraversal.AbstractPreOrderCallback;
import org.tmplr.javascript.jscomp.NodeTraversal.Control;
import org.tmplr.javascript.rhino.Node;

/**
 * Collects the references to a variable within a scope.
 *
 * <p>A reference is any NAME node with the variable's name, except property names of a non-computed
 * member access. No attempt is made to resolve shadowing: a nested function declaring a variable
 * with the same name still contributes references.
 */
final class ReferenceFinder {

  private ReferenceFinder() {}

  /**
   * Returns the references to {@code identifier} within {@code scope}, in document order.
   *
   * @param scope the subtree to search
   * @param identifier the NAME whose name is looked up; it is returned too if it is inside {@code
   *     scope}
   * @param skip a node that is excluded from the search along with its subtree, or null
   */
  static ImmutableList<Node> findReferences(Node scope, Node identifier, @Nullable Node skip) {
    checkArgument(identifier.isName(), "Expected NAME but was %s", identifier);
    String name = identifier.getString();
    checkArgument(!name.isEmpty(), "Cannot find references to an anonymous name");

    ImmutableList.Builder<Node> references = ImmutableList.builder();
    NodeTraversal.builder()
        .setSkippedNode(skip)
        .setCallback(
            new AbstractPreOrderCallback() {
              @Override
              public Control enter(NodeTraversal t, Node n, @Nullable Node parent) {
                if (n.matchesName(name) && !NodeUtil.isPropertyName(n)) {
                  references.add(n);
                }
                return Control.CONTINUE;
              }
            })
        .traverse(scope);
    return references.build();
  }

  /** Whether {@code declaration} is referenced anywhere in {@code scope} except by itself. */
  static boolean hasOtherReferences(Node scope, Node declaration, @Nullable Node skip) {
    for (Node ref : findReferences(scope, declaration, skip)) {
      if (ref.getId() != declaration.getId()) {
        return true;
      }
    }
    return false;
  }
}
