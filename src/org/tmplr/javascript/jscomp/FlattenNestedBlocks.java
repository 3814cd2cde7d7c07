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

import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.tmplr.javascript.jscomp.NodeTraversal.AbstractPreOrderCallback;
import org.tmplr.javascript.jscomp.NodeTraversal.Control;
import org.tmplr.javascript.rhino.Node;

/**
 * Removes the pointless nested BLOCKs the template compiler wraps around generated statements.
 *
 * <pre>
 *   { a(); { b(); { c(); } } d(); }
 * </pre>
 *
 * becomes
 *
 * <pre>
 *   { a(); b(); c(); d(); }
 * </pre>
 *
 * Only a BLOCK whose parent is also a BLOCK is merged. Function bodies and the branches of IF and
 * FOR statements keep their BLOCK.
 */
final class FlattenNestedBlocks implements CompilerPass {
  private final AbstractCompiler compiler;

  FlattenNestedBlocks(AbstractCompiler compiler) {
    this.compiler = compiler;
  }

  @Override
  public void process(Node root) {
    List<Node> nestedBlocks;
    while (!(nestedBlocks = findNestedBlocks(root)).isEmpty()) {
      for (Node block : nestedBlocks) {
        mergeIntoParent(block);
      }
    }
  }

  /**
   * Merges a block into its current parent. The parent may have changed since the block was
   * found, when the block it was nested in got merged first, but it is always a BLOCK.
   */
  private void mergeIntoParent(Node block) {
    Node parent = block.getParent();
    checkState(parent != null && parent.isBlock(), "Not a nested block: %s", block);
    parent.addChildrenAfter(block.removeChildren(), block);
    block.detach();
    compiler.reportChangeToEnclosingScope(parent);
  }

  private static List<Node> findNestedBlocks(Node root) {
    List<Node> nestedBlocks = new ArrayList<>();
    NodeTraversal.traverse(
        root,
        new AbstractPreOrderCallback() {
          @Override
          public Control enter(NodeTraversal t, Node n, @Nullable Node parent) {
            if (n.isBlock() && parent != null && parent.isBlock()) {
              nestedBlocks.add(n);
            }
            return Control.CONTINUE;
          }
        });
    return nestedBlocks;
  }
}
