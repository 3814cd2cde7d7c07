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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;
import org.tmplr.javascript.rhino.Node;

/**
 * NodeTraversal allows an iteration through the nodes in the parse tree, and facilitates the
 * optimizations on the parse tree.
 *
 * <p>Each instance owns the ancestor stack of a single walk. Walks may be nested (a callback may
 * start a new traversal of some subtree) but never interleaved.
 */
public class NodeTraversal {

  private static final int NO_SKIPPED_NODE = -1;

  private final Callback callback;

  /** Id of the node that is never entered, or {@link #NO_SKIPPED_NODE}. */
  private final int skippedNodeId;

  /** Ancestors of the current node, innermost first. The current node is not included. */
  private final Deque<Node> ancestors = new ArrayDeque<>();

  /** Contains the current node */
  private @Nullable Node currentNode;

  private boolean stopped;

  /** What the traversal should do after {@link Callback#enter} returns. */
  public enum Control {
    /** Visit the children of the node, then the node itself in postorder. */
    CONTINUE,
    /** Don't visit the children; the node is not visited in postorder either. */
    SKIP_CHILDREN,
    /**
     * Don't visit the children nor any of the remaining siblings of the node. The traversal picks
     * up again with the postorder visit of the parent.
     */
    BREAK,
    /** Abort the whole traversal. No further callbacks are made. */
    STOP
  }

  /** Callback for tree-based traversals */
  public interface Callback {
    /**
     * Visits a node in preorder (before its children) and decides how the traversal continues.
     *
     * <p>Siblings are always visited left-to-right.
     *
     * <p>Implementations should not modify the parse tree; collect the nodes to change and change
     * them once the traversal has finished.
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node, or null for the traversal root.
     */
    Control enter(NodeTraversal t, Node n, @Nullable Node parent);

    /**
     * Visits a node in postorder (after its children). A node is visited in postorder iff {@link
     * #enter} returned {@link Control#CONTINUE} for it and the traversal was not stopped while
     * visiting its children.
     */
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** Abstract callback to visit all nodes in postorder. */
  public abstract static class AbstractPostOrderCallback implements Callback {
    @Override
    public final Control enter(NodeTraversal t, Node n, @Nullable Node parent) {
      return Control.CONTINUE;
    }
  }

  /** Abstract callback to visit all nodes in preorder. */
  public abstract static class AbstractPreOrderCallback implements Callback {
    @Override
    public final void visit(NodeTraversal t, Node n, @Nullable Node parent) {}
  }

  /**
   * Abstract callback to visit all nodes in postorder but not traverse into functions nested in
   * the traversal root. The root itself is traversed even if it is a function.
   */
  public abstract static class AbstractShallowCallback implements Callback {
    @Override
    public final Control enter(NodeTraversal t, Node n, @Nullable Node parent) {
      return n.isFunction() && t.getDepth() > 0 ? Control.SKIP_CHILDREN : Control.CONTINUE;
    }
  }

  /** Callback to visit all nodes in preorder, written as a lambda. */
  @FunctionalInterface
  public interface PreOrderCallbackInterface {
    Control enter(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** Traverses using the provided callback. */
  public static void traverse(Node root, Callback cb) {
    builder().setCallback(cb).traverse(root);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder */
  public static final class Builder {
    private @Nullable Callback callback;
    private @Nullable Node skippedNode;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setCallback(Callback x) {
      this.callback = x;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setCallback(PreOrderCallbackInterface x) {
      this.callback =
          new AbstractPreOrderCallback() {
            @Override
            public Control enter(NodeTraversal t, Node n, @Nullable Node parent) {
              return x.enter(t, n, parent);
            }
          };
      return this;
    }

    /**
     * Sets a node that is skipped when it is reached: neither callback is invoked for it and its
     * subtree is not visited.
     */
    @CanIgnoreReturnValue
    public Builder setSkippedNode(@Nullable Node x) {
      this.skippedNode = x;
      return this;
    }

    public NodeTraversal build() {
      return new NodeTraversal(this);
    }

    public void traverse(Node root) {
      this.build().traverse(root);
    }
  }

  private NodeTraversal(Builder builder) {
    this.callback = checkNotNull(builder.callback);
    this.skippedNodeId =
        builder.skippedNode == null ? NO_SKIPPED_NODE : builder.skippedNode.getId();
  }

  /** Traverses a parse tree recursively. A traversal instance can only be used once. */
  public void traverse(Node root) {
    checkState(currentNode == null && !stopped, "NodeTraversal instances are single use");
    try {
      traverseBranch(root, null);
    } catch (RuntimeException unexpected) {
      throwUnexpectedException(unexpected);
    }
  }

  /**
   * Traverses a branch.
   *
   * @return whether the remaining siblings of {@code n} must not be traversed
   */
  private boolean traverseBranch(Node n, @Nullable Node parent) {
    if (n.getId() == skippedNodeId) {
      return false;
    }

    currentNode = n;
    Control control = checkNotNull(callback.enter(this, n, parent), "Null control for %s", n);
    switch (control) {
      case STOP:
        stopped = true;
        return true;
      case BREAK:
        return true;
      case SKIP_CHILDREN:
        return false;
      case CONTINUE:
        break;
    }

    ancestors.push(n);
    for (Node child = n.getFirstChild(); child != null; ) {
      checkState(child.getParent() == n, "Malformed tree: %s is not a child of %s", child, n);
      // Read the next sibling first, so the current child may be detached by the callback.
      Node next = child.getNext();
      boolean skipSiblings = traverseBranch(child, n);
      if (stopped) {
        ancestors.pop();
        return true;
      }
      if (skipSiblings) {
        break;
      }
      child = next;
    }
    ancestors.pop();

    currentNode = n;
    callback.visit(this, n, parent);
    return false;
  }

  private void throwUnexpectedException(RuntimeException unexpectedException) {
    // If there's an unexpected exception, add the node that caused it.
    String message =
        unexpectedException.getMessage()
            + "\n"
            + formatNodeContext("Node", currentNode)
            + (currentNode == null ? "" : formatNodeContext("Parent", currentNode.getParent()));
    throw new IllegalStateException(message, unexpectedException);
  }

  private static String formatNodeContext(String label, @Nullable Node n) {
    if (n == null) {
      return "  " + label + ": NULL";
    }
    return "  " + label + "(" + n + "):\n" + n.toStringTree();
  }

  /** Returns the node currently being traversed. */
  public @Nullable Node getCurrentNode() {
    return currentNode;
  }

  /** Returns the parent of the current node, or null at the traversal root. */
  public @Nullable Node getParent() {
    return ancestors.peek();
  }

  /** Returns how many ancestors of the current node have been entered by this traversal. */
  public int getDepth() {
    return ancestors.size();
  }

  /** Returns the ancestors of the current node entered by this traversal, innermost first. */
  public ImmutableList<Node> getAncestors() {
    return ImmutableList.copyOf(ancestors);
  }

  /**
   * Returns the innermost FUNCTION that encloses the current node within this traversal, or null
   * if there is none. The current node itself is not considered.
   */
  public @Nullable Node getEnclosingFunction() {
    for (Node ancestor : ancestors) {
      if (ancestor.isFunction()) {
        return ancestor;
      }
    }
    return null;
  }

  /** Whether the traversal was aborted by {@link Control#STOP}. */
  public boolean isStopped() {
    return stopped;
  }
}
