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

package org.tmplr.javascript.rhino;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CheckReturnValue;
import java.io.IOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the root of the intermediate representation.
 *
 * <p>Children are kept in a doubly linked list: {@code first} points at the first child, each
 * child's {@code next} at its following sibling, and the first child's {@code previous} at the last
 * child so appending is O(1). The last child's {@code next} is always null.
 *
 * <p>Every node gets an id on construction that is unique for the lifetime of the JVM. Ids are
 * never copied by {@link #cloneNode()} and are ignored by {@link #isEquivalentTo(Node)}.
 */
public class Node {

  private static final AtomicInteger NEXT_ID = new AtomicInteger();

  private static final class StringNode extends Node {

    private String str;

    StringNode(Token token, String str) {
      super(token);
      this.str = checkNotNull(str);
    }

    @Override
    public String getString() {
      return str;
    }

    @Override
    public void setString(String str) {
      this.str = checkNotNull(str);
    }

    @Override
    Node createShallowClone() {
      return new StringNode(getToken(), str);
    }

    @Override
    boolean isPayloadEquivalentTo(Node node) {
      return str.equals(node.getString());
    }
  }

  private static final class NumberNode extends Node {

    private double number;

    NumberNode(double number) {
      super(Token.NUMBER);
      this.number = number;
    }

    @Override
    public double getDouble() {
      return number;
    }

    @Override
    public void setDouble(double d) {
      this.number = d;
    }

    @Override
    Node createShallowClone() {
      return new NumberNode(number);
    }

    @Override
    boolean isPayloadEquivalentTo(Node node) {
      return Double.compare(number, node.getDouble()) == 0;
    }
  }

  private final int id = NEXT_ID.incrementAndGet();

  private Token token;
  private @Nullable Node parent;
  private @Nullable Node first; // first child, a linked list
  private @Nullable Node next; // next sibling
  private @Nullable Node previous; // previous sibling, or the last sibling for a first child

  public Node(Token token) {
    this.token = checkNotNull(token);
  }

  public Node(Token token, Node child) {
    this(token);
    addChildToBack(child);
  }

  public Node(Token token, Node left, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(right);
  }

  public Node(Token token, Node left, Node mid, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(mid);
    addChildToBack(right);
  }

  public Node(Token token, Node left, Node mid, Node mid2, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(mid);
    addChildToBack(mid2);
    addChildToBack(right);
  }

  public static Node newString(String str) {
    return new StringNode(Token.STRINGLIT, str);
  }

  public static Node newString(Token token, String str) {
    checkArgument(token == Token.NAME || token == Token.STRINGLIT, "Not a string token: %s", token);
    return new StringNode(token, str);
  }

  public static Node newNumber(double number) {
    return new NumberNode(number);
  }

  /** Returns the id of this node, unique for the lifetime of the JVM. */
  public final int getId() {
    return id;
  }

  public final Token getToken() {
    return token;
  }

  public final void setToken(Token token) {
    // The payload lives in the subclass, so a node can't move between payload kinds.
    checkState(
        isStringToken(this.token) == isStringToken(token),
        "Cannot change %s into %s",
        this.token,
        token);
    checkState(
        (this.token == Token.NUMBER) == (token == Token.NUMBER),
        "Cannot change %s into %s",
        this.token,
        token);
    this.token = token;
  }

  private static boolean isStringToken(Token token) {
    return token == Token.NAME || token == Token.STRINGLIT;
  }

  /** Can only be called for NAME and STRINGLIT nodes. */
  public String getString() {
    throw new UnsupportedOperationException(this + " is not a string node");
  }

  /** Can only be called for NAME and STRINGLIT nodes. */
  public void setString(String str) {
    throw new UnsupportedOperationException(this + " is not a string node");
  }

  /** Can only be called for NUMBER nodes. */
  public double getDouble() {
    throw new UnsupportedOperationException(this + " is not a number node");
  }

  /** Can only be called for NUMBER nodes. */
  public void setDouble(double d) {
    throw new UnsupportedOperationException(this + " is not a number node");
  }

  // Children

  public final boolean hasChildren() {
    return first != null;
  }

  public final Node getOnlyChild() {
    checkState(hasOneChild(), "Expected exactly one child: %s", this);
    return first;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first == null ? null : first.next;
  }

  public final @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getPrevious() {
    return parent == null || this == parent.first ? null : previous;
  }

  /**
   * Gets the ith child, note that this is O(N) where N is the number of children.
   *
   * @param i The index
   * @return The ith child
   */
  public final Node getChildAtIndex(int i) {
    checkArgument(i >= 0, "Negative index %s", i);
    Node n = first;
    while (i > 0) {
      checkArgument(n != null, "Index out of bounds for %s", this);
      n = n.next;
      i--;
    }
    checkArgument(n != null, "Index out of bounds for %s", this);
    return n;
  }

  /**
   * Gets the index of a child, note that this is O(N) where N is the number of children.
   *
   * @return The index of the child, or -1 if {@code child} is not a child of this node
   */
  public final int getIndexOfChild(Node child) {
    Node n = first;
    int i = 0;
    while (n != null) {
      if (child == n) {
        return i;
      }
      n = n.next;
      i++;
    }
    return -1;
  }

  public final int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  public final boolean hasOneChild() {
    return first != null && first.next == null;
  }

  public final boolean hasTwoChildren() {
    return first != null && first.next != null && first.next == getLastChild();
  }

  public final boolean hasChild(Node child) {
    return child.parent == this;
  }

  public final void addChildToFront(Node child) {
    child.checkDetached();
    child.parent = this;
    if (first == null) {
      // NOTE: child.next remains null
      child.previous = child;
    } else {
      Node last = first.previous;
      child.previous = last;
      child.next = first;
      first.previous = child;
    }
    first = child;
  }

  public final void addChildToBack(Node child) {
    child.checkDetached();
    if (first == null) {
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      // NOTE: child.next remains null
      child.previous = last;
      first.previous = child;
    }
    child.parent = this;
  }

  /**
   * Add all children after 'node'. If 'node' is null, add them to the front of this node.
   *
   * @param children first of a list of sibling nodes who have no parent. Usually you would get
   *     this argument from a {@link #removeChildren()} call.
   */
  public final void addChildrenAfter(@Nullable Node children, @Nullable Node node) {
    if (children == null) {
      return; // removeChildren() returns null when there are none
    }
    checkArgument(node == null || node.parent == this, "%s is not a child of %s", node, this);
    // NOTE: If there is only one sibling, its previous pointer must point to itself.
    // Null indicates a fully detached node.
    checkNotNull(children.previous, children);

    for (Node child = children; child != null; child = child.next) {
      checkArgument(child.parent == null, "Cannot add already-owned child node: %s", child);
      child.parent = this;
    }

    Node lastSibling = children.previous;
    if (node == null) {
      if (first != null) {
        Node last = first.previous;
        children.previous = last;
        lastSibling.next = first;
        first.previous = lastSibling;
      }
      first = children;
      return;
    }

    Node nodeAfter = node.next;
    lastSibling.next = nodeAfter;
    if (nodeAfter == null) {
      first.previous = lastSibling;
    } else {
      nodeAfter.previous = lastSibling;
    }
    node.next = children;
    children.previous = node;
  }

  public final void addChildrenToFront(@Nullable Node children) {
    addChildrenAfter(children, null);
  }

  public final void addChildrenToBack(@Nullable Node children) {
    addChildrenAfter(children, getLastChild());
  }

  /** Inserts this detached node as the next sibling of {@code existing}. */
  public final void insertAfter(Node existing) {
    existing.checkAttached();
    this.checkDetached();

    final Node existingParent = existing.parent;
    final Node existingNext = existing.next;

    this.parent = existingParent;
    existing.next = this;
    this.previous = existing;

    if (existingNext == null) {
      existingParent.first.previous = this;
      // this.next remains null
    } else {
      existingNext.previous = this;
      this.next = existingNext;
    }
  }

  /** Inserts this detached node as the previous sibling of {@code existing}. */
  public final void insertBefore(Node existing) {
    existing.checkAttached();
    this.checkDetached();

    final Node existingParent = existing.parent;
    final Node existingPrevious = existing.previous;

    this.parent = existingParent;
    this.next = existing;
    existing.previous = this;

    this.previous = existingPrevious;
    if (existingPrevious.next == null) {
      existingParent.first = this;
      // existingPrevious.next remains null
    } else {
      existingPrevious.next = this;
    }
  }

  /** Swaps `replacement` and its subtree into the position of `this`. */
  public final void replaceWith(Node replacement) {
    this.checkAttached();
    replacement.checkDetached();

    final Node existingParent = this.parent;
    final Node existingNext = this.next;
    final Node existingPrevious = this.previous;

    // The sequence below also has to work when `this` is an only child, which can cause many of the
    // variables to point to the same object.

    this.parent = null;
    replacement.parent = existingParent;

    this.previous = null;
    replacement.previous = existingPrevious;
    if (existingPrevious.next == null) {
      existingParent.first = replacement;
    } else {
      existingPrevious.next = replacement;
    }

    if (existingNext == null) {
      existingParent.first.previous = replacement;
    } else {
      this.next = null;
      existingNext.previous = replacement;
      replacement.next = existingNext;
    }
  }

  /** Removes this node from its parent, but retains its subtree. */
  public final Node detach() {
    this.checkAttached();

    final Node existingParent = this.parent;
    final Node existingNext = this.next;
    final Node existingPrevious = this.previous;

    this.parent = null;

    if (existingNext == null) {
      existingParent.first.previous = existingPrevious;
    } else {
      this.next = null;
      existingNext.previous = existingPrevious;
    }

    this.previous = null;
    if (existingPrevious.next == null) {
      existingParent.first = existingNext;
    } else {
      existingPrevious.next = existingNext;
    }

    return this;
  }

  /**
   * Removes the first child of Node. Equivalent to: node.getFirstChild().detach().
   *
   * @return The removed Node.
   */
  public final @Nullable Node removeFirstChild() {
    Node child = first;
    if (child != null) {
      child.detach();
    }
    return child;
  }

  /**
   * Remove all children, but leave them linked to each other.
   *
   * @return The first child node
   */
  public final @Nullable Node removeChildren() {
    Node children = first;
    for (Node child = first; child != null; child = child.next) {
      child.parent = null;
    }
    first = null;
    return children;
  }

  private void checkAttached() {
    checkState(this.parent != null, "Has no parent: %s", this);
  }

  private void checkDetached() {
    checkState(this.parent == null, "Has parent: %s", this);
    checkState(this.next == null, "Has next: %s", this);
    checkState(this.previous == null, "Has previous: %s", this);
  }

  /** Returns the children of this node. Detaching the current child while iterating is legal. */
  public final Iterable<Node> children() {
    return () ->
        new Iterator<Node>() {
          private @Nullable Node current = first;

          @Override
          public boolean hasNext() {
            return current != null;
          }

          @Override
          public Node next() {
            if (current == null) {
              throw new NoSuchElementException();
            }
            Node result = current;
            current = current.next;
            return result;
          }
        };
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  public final boolean hasParent() {
    return parent != null;
  }

  public final @Nullable Node getGrandparent() {
    return parent == null ? null : parent.parent;
  }

  /** Returns whether this node is {@code node} or one of its descendants. */
  public final boolean isDescendantOf(Node node) {
    for (Node n = this; n != null; n = n.parent) {
      if (n == node) {
        return true;
      }
    }
    return false;
  }

  // Cloning and equivalence

  Node createShallowClone() {
    return new Node(token);
  }

  boolean isPayloadEquivalentTo(Node node) {
    return true;
  }

  /** Returns a detached copy of this node without its children. */
  @CheckReturnValue
  public final Node cloneNode() {
    return createShallowClone();
  }

  /** Returns a detached deep copy of this node. */
  @CheckReturnValue
  public final Node cloneTree() {
    Node result = createShallowClone();
    for (Node child = first; child != null; child = child.next) {
      result.addChildToBack(child.cloneTree());
    }
    return result;
  }

  /** Returns true if this node is structurally equivalent to another, ignoring node ids. */
  public final boolean isEquivalentTo(Node node) {
    if (token != node.token
        || this.getClass() != node.getClass()
        || getChildCount() != node.getChildCount()
        || !isPayloadEquivalentTo(node)) {
      return false;
    }
    for (Node n = first, n2 = node.first; n != null; n = n.next, n2 = n2.next) {
      if (!n.isEquivalentTo(n2)) {
        return false;
      }
    }
    return true;
  }

  // Predicates

  public final boolean isScript() {
    return token == Token.SCRIPT;
  }

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public final boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public final boolean isVar() {
    return token == Token.VAR;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isThis() {
    return token == Token.THIS;
  }

  public final boolean isExprResult() {
    return token == Token.EXPR_RESULT;
  }

  public final boolean isAssign() {
    return token == Token.ASSIGN;
  }

  public final boolean isAssignAdd() {
    return token == Token.ASSIGN_ADD;
  }

  public final boolean isAdd() {
    return token == Token.ADD;
  }

  public final boolean isGetProp() {
    return token == Token.GETPROP;
  }

  public final boolean isGetElem() {
    return token == Token.GETELEM;
  }

  public final boolean isCall() {
    return token == Token.CALL;
  }

  public final boolean isStringLit() {
    return token == Token.STRINGLIT;
  }

  public final boolean isNumber() {
    return token == Token.NUMBER;
  }

  public final boolean isFor() {
    return token == Token.FOR;
  }

  public final boolean isIf() {
    return token == Token.IF;
  }

  public final boolean isReturn() {
    return token == Token.RETURN;
  }

  public final boolean isEmpty() {
    return token == Token.EMPTY;
  }

  /** Returns whether this is a NAME node with the given name. */
  public final boolean matchesName(String name) {
    return token == Token.NAME && getString().equals(name);
  }

  // Printing

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (this instanceof StringNode) {
      sb.append(' ');
      sb.append(getString());
    } else if (this instanceof NumberNode) {
      sb.append(' ');
      double d = getDouble();
      if (d == (long) d) {
        sb.append((long) d);
      } else {
        sb.append(d);
      }
    } else if (token == Token.FUNCTION && first != null && first.isName()) {
      sb.append(' ');
      sb.append(first.getString());
    }
    return sb.toString();
  }

  @CheckReturnValue
  public final String toStringTree() {
    try {
      StringBuilder s = new StringBuilder();
      appendStringTree(s);
      return s.toString();
    } catch (IOException e) {
      throw new RuntimeException("Should not happen\n" + e);
    }
  }

  public final void appendStringTree(Appendable appendable) throws IOException {
    toStringTreeHelper(this, 0, appendable);
  }

  private static void toStringTreeHelper(Node n, int level, Appendable sb) throws IOException {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    sb.append(n.toString());
    sb.append('\n');
    for (Node cursor = n.first; cursor != null; cursor = cursor.next) {
      toStringTreeHelper(cursor, level + 1, sb);
    }
  }
}
