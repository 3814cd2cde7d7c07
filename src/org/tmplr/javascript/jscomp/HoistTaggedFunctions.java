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
 * Hoists tagged function declarations (a {@code $} in the name by default) out of the functions
 * that declare them, to the top of the program. The template compiler tags the functions it
 * generates for partials, which then get defined once instead of on every render.
 *
 * <pre>
 *   function render(context) { { function partial$row(row) { ... } } ... }
 * </pre>
 *
 * becomes
 *
 * <pre>
 *   function partial$row(row) { ... }
 *   function render(context) { ... }
 * </pre>
 *
 * Hoisted functions keep their document order and their bodies are not touched, except that a
 * tagged function nested in another tagged function is hoisted too. Tagged functions that already
 * are top-level statements stay where they are.
 */
final class HoistTaggedFunctions implements CompilerPass {
  private final AbstractCompiler compiler;
  private final char marker;

  HoistTaggedFunctions(AbstractCompiler compiler) {
    this.compiler = compiler;
    this.marker = compiler.getOptions().getHoistMarker();
  }

  @Override
  public void process(Node root) {
    checkArgument(root.isScript(), "Functions can only be hoisted to a SCRIPT, not %s", root);
    ImmutableList<Node> tagged = findTaggedFunctionDeclarations(root);
    // Prepend in reverse so the hoisted functions end up in document order.
    for (Node function : tagged.reverse()) {
      compiler.reportChangeToEnclosingScope(function.getParent());
      root.addChildToFront(function.detach());
    }
    if (!tagged.isEmpty()) {
      compiler.reportChangeToEnclosingScope(root);
    }
  }

  private ImmutableList<Node> findTaggedFunctionDeclarations(Node root) {
    ImmutableList.Builder<Node> tagged = ImmutableList.builder();
    NodeTraversal.traverse(
        root,
        new AbstractPreOrderCallback() {
          @Override
          public Control enter(NodeTraversal t, Node n, @Nullable Node parent) {
            if (parent != root
                && NodeUtil.isFunctionDeclaration(n)
                && NodeUtil.getName(n).indexOf(marker) != -1) {
              tagged.add(n);
            }
            return Control.CONTINUE;
          }
        });
    return tagged.build();
  }
}
