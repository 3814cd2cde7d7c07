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
import static com.google.common.base.Preconditions.checkState;

import org.tmplr.javascript.rhino.Node;

/** NodeUtil contains generally useful AST utilities. */
public final class NodeUtil {

  private NodeUtil() {}

  /** Returns whether {@code n} holds a list of statements: a SCRIPT or a BLOCK. */
  static boolean isStatementBlock(Node n) {
    return n.isScript() || n.isBlock();
  }

  /**
   * Is this node a function declaration? A function declaration is a function that is a direct
   * child of a statement list. Every other function is a function expression.
   */
  public static boolean isFunctionDeclaration(Node n) {
    Node parent = n.getParent();
    return n.isFunction() && parent != null && isStatementBlock(parent);
  }

  /** Is this node a function expression? See {@link #isFunctionDeclaration}. */
  public static boolean isFunctionExpression(Node n) {
    return n.isFunction() && !isFunctionDeclaration(n);
  }

  /** Gets the name of a function; empty for anonymous function expressions. */
  static String getName(Node function) {
    checkArgument(function.isFunction(), function);
    return function.getFirstChild().getString();
  }

  /** Gets the PARAM_LIST of a function. */
  static Node getFunctionParameters(Node function) {
    checkArgument(function.isFunction(), function);
    Node params = function.getSecondChild();
    checkState(params != null && params.isParamList(), "Malformed function: %s", function);
    return params;
  }

  /** Gets the body BLOCK of a function. */
  static Node getFunctionBody(Node function) {
    checkArgument(function.isFunction(), function);
    Node body = function.getLastChild();
    checkState(body != null && body.isBlock(), "Malformed function: %s", function);
    return body;
  }

  /** Is this NAME the declared name of a VAR, i.e. a variable declarator? */
  static boolean isDeclarator(Node n) {
    Node parent = n.getParent();
    return n.isName() && parent != null && parent.isVar();
  }

  /** Is this NAME a function parameter or the name of a function? */
  static boolean isFunctionBindingName(Node n) {
    Node parent = n.getParent();
    if (!n.isName() || parent == null) {
      return false;
    }
    return parent.isParamList() || (parent.isFunction() && n == parent.getFirstChild());
  }

  /**
   * Is this a statement of the form {@code name = value;} that assigns directly to a variable?
   */
  static boolean isSimpleNameAssignment(Node n) {
    if (!n.isExprResult()) {
      return false;
    }
    Node expr = n.getFirstChild();
    return expr.isAssign() && expr.getFirstChild().isName();
  }

  /**
   * Is this a statement of the form {@code outputName += value;} that accumulates into the output
   * variable?
   */
  static boolean isOutputAccumulation(Node n, String outputName) {
    if (!n.isExprResult()) {
      return false;
    }
    Node expr = n.getFirstChild();
    return expr.isAssignAdd() && expr.getFirstChild().matchesName(outputName);
  }

  /** Is this the string literal {@code ""}? */
  static boolean isEmptyString(Node n) {
    return n.isStringLit() && n.getString().isEmpty();
  }

  /**
   * Is this node a non-computed property name, such as {@code b} in {@code a.b}? Property names
   * are not variable references.
   */
  static boolean isPropertyName(Node n) {
    Node parent = n.getParent();
    return parent != null && parent.isGetProp() && n == parent.getLastChild();
  }
}
