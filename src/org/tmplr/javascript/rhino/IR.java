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

import static com.google.common.base.Preconditions.checkState;

import java.util.List;

/**
 * An AST construction helper class.
 *
 * <p>Every factory checks that its operands are in a legal position (statement, expression or
 * declaration) and fails fast otherwise, so trees built through {@code IR} always have the shape
 * the optimizer expects.
 */
public class IR {

  private IR() {}

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  public static Node script() {
    return new Node(Token.SCRIPT);
  }

  public static Node script(Node... stmts) {
    Node script = script();
    for (Node stmt : stmts) {
      checkState(mayBeStatementNoReturn(stmt), "Script cannot contain %s", stmt);
      script.addChildToBack(stmt);
    }
    return script;
  }

  public static Node script(List<Node> stmts) {
    return script(stmts.toArray(new Node[0]));
  }

  public static Node block() {
    return new Node(Token.BLOCK);
  }

  public static Node block(Node... stmts) {
    Node block = block();
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt);
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node block(List<Node> stmts) {
    return block(stmts.toArray(new Node[0]));
  }

  public static Node function(Node name, Node params, Node body) {
    checkState(name.isName(), name);
    checkState(params.isParamList(), params);
    checkState(body.isBlock(), body);
    return new Node(Token.FUNCTION, name, params, body);
  }

  /** Creates a function expression with an empty name. */
  public static Node function(Node params, Node body) {
    return function(IR.name(""), params, body);
  }

  public static Node paramList() {
    return new Node(Token.PARAM_LIST);
  }

  public static Node paramList(Node... params) {
    Node paramList = new Node(Token.PARAM_LIST);
    for (Node param : params) {
      checkState(param.isName() && !param.getString().isEmpty(), param);
      paramList.addChildToBack(param);
    }
    return paramList;
  }

  public static Node paramList(String... names) {
    Node paramList = new Node(Token.PARAM_LIST);
    for (String name : names) {
      paramList.addChildToBack(IR.name(name));
    }
    return paramList;
  }

  /** Creates a VAR with a single declarator, which may already carry its initial value. */
  public static Node var(Node lhs) {
    checkState(isDeclarator(lhs), lhs);
    return new Node(Token.VAR, lhs);
  }

  public static Node var(Node lhs, Node value) {
    checkState(lhs.isName() && !lhs.hasChildren(), lhs);
    checkState(mayBeExpression(value), value);
    lhs.addChildToBack(value);
    return var(lhs);
  }

  /** Creates a VAR with several declarators, e.g. {@code var a = 1, b;}. */
  public static Node var(List<Node> declarators) {
    checkState(!declarators.isEmpty());
    Node var = new Node(Token.VAR);
    for (Node n : declarators) {
      checkState(isDeclarator(n), n);
      var.addChildToBack(n);
    }
    return var;
  }

  /** Creates a declarator, the NAME child of a VAR, with an initial value. */
  public static Node declarator(String name, Node value) {
    checkState(mayBeExpression(value), value);
    Node lhs = IR.name(name);
    lhs.addChildToBack(value);
    return lhs;
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.RETURN, expr);
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_RESULT, expr);
  }

  public static Node ifNode(Node cond, Node then) {
    checkState(mayBeExpression(cond), cond);
    checkState(then.isBlock(), then);
    return new Node(Token.IF, cond, then);
  }

  public static Node ifNode(Node cond, Node then, Node elseNode) {
    checkState(mayBeExpression(cond), cond);
    checkState(then.isBlock(), then);
    checkState(elseNode.isBlock(), elseNode);
    return new Node(Token.IF, cond, then, elseNode);
  }

  public static Node forNode(Node init, Node cond, Node incr, Node body) {
    checkState(init.isVar() || mayBeExpressionOrEmpty(init), init);
    checkState(mayBeExpressionOrEmpty(cond), cond);
    checkState(mayBeExpressionOrEmpty(incr), incr);
    checkState(body.isBlock(), body);
    return new Node(Token.FOR, init, cond, incr, body);
  }

  public static Node call(Node target, Node... args) {
    checkState(mayBeExpression(target), target);
    Node call = new Node(Token.CALL, target);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node name(String name) {
    checkState(name.indexOf('.') == -1, "Invalid name '%s'. Did you mean to use getprop?", name);
    return Node.newString(Token.NAME, name);
  }

  public static Node getprop(Node target, String prop, String... moreProps) {
    checkState(mayBeExpression(target), target);
    Node result = new Node(Token.GETPROP, target, IR.string(prop));
    for (String moreProp : moreProps) {
      result = new Node(Token.GETPROP, result, IR.string(moreProp));
    }
    return result;
  }

  public static Node getelem(Node target, Node elem) {
    checkState(mayBeExpression(target), target);
    checkState(mayBeExpression(elem), elem);
    return new Node(Token.GETELEM, target, elem);
  }

  public static Node assign(Node target, Node expr) {
    checkState(isValidAssignmentTarget(target), target);
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.ASSIGN, target, expr);
  }

  public static Node assignAdd(Node target, Node expr) {
    checkState(isValidAssignmentTarget(target), target);
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.ASSIGN_ADD, target, expr);
  }

  public static Node not(Node expr) {
    return unaryOp(Token.NOT, expr);
  }

  public static Node inc(Node target) {
    checkState(isValidAssignmentTarget(target), target);
    return new Node(Token.INC, target);
  }

  public static Node dec(Node target) {
    checkState(isValidAssignmentTarget(target), target);
    return new Node(Token.DEC, target);
  }

  public static Node and(Node expr1, Node expr2) {
    return binaryOp(Token.AND, expr1, expr2);
  }

  public static Node or(Node expr1, Node expr2) {
    return binaryOp(Token.OR, expr1, expr2);
  }

  public static Node add(Node expr1, Node expr2) {
    return binaryOp(Token.ADD, expr1, expr2);
  }

  public static Node sub(Node expr1, Node expr2) {
    return binaryOp(Token.SUB, expr1, expr2);
  }

  public static Node mul(Node expr1, Node expr2) {
    return binaryOp(Token.MUL, expr1, expr2);
  }

  public static Node lt(Node expr1, Node expr2) {
    return binaryOp(Token.LT, expr1, expr2);
  }

  public static Node sheq(Node expr1, Node expr2) {
    return binaryOp(Token.SHEQ, expr1, expr2);
  }

  public static Node shne(Node expr1, Node expr2) {
    return binaryOp(Token.SHNE, expr1, expr2);
  }

  public static Node binaryOp(Token token, Node expr1, Node expr2) {
    checkState(token.isBinaryOperator(), token);
    checkState(mayBeExpression(expr1), expr1);
    checkState(mayBeExpression(expr2), expr2);
    return new Node(token, expr1, expr2);
  }

  private static Node unaryOp(Token token, Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(token, expr);
  }

  public static Node string(String s) {
    return Node.newString(s);
  }

  public static Node number(double d) {
    return Node.newNumber(d);
  }

  public static Node thisNode() {
    return new Node(Token.THIS);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node falseNode() {
    return new Node(Token.FALSE);
  }

  public static Node nullNode() {
    return new Node(Token.NULL);
  }

  // Helper methods

  private static boolean isDeclarator(Node n) {
    return n.isName()
        && !n.getString().isEmpty()
        && (!n.hasChildren() || (n.hasOneChild() && mayBeExpression(n.getFirstChild())));
  }

  private static boolean isValidAssignmentTarget(Node n) {
    return (n.isName() && !n.getString().isEmpty()) || n.isGetProp() || n.isGetElem();
  }

  private static boolean mayBeExpressionOrEmpty(Node n) {
    return n.isEmpty() || mayBeExpression(n);
  }

  // NOTE: some nodes are neither statements nor expression nodes:
  //   SCRIPT, PARAM_LIST

  private static boolean mayBeStatementNoReturn(Node n) {
    switch (n.getToken()) {
      case EMPTY:
      case FUNCTION:
        // EMPTY and FUNCTION are used both in expression and statement
        // contexts
        return true;

      case BLOCK:
      case EXPR_RESULT:
      case FOR:
      case IF:
      case VAR:
        return true;

      default:
        return false;
    }
  }

  /** Returns whether {@code n} may appear as a child of a BLOCK. */
  public static boolean mayBeStatement(Node n) {
    if (!mayBeStatementNoReturn(n)) {
      return n.isReturn();
    }
    return true;
  }

  /** Returns whether {@code n} may appear in an expression position. */
  public static boolean mayBeExpression(Node n) {
    switch (n.getToken()) {
      case FUNCTION:
        // FUNCTION is used both in expression and statement contexts.
        return true;

      case ADD:
      case SUB:
      case MUL:
      case LT:
      case LE:
      case GT:
      case GE:
      case SHEQ:
      case SHNE:
      case AND:
      case OR:
      case NOT:
      case INC:
      case DEC:
      case ASSIGN:
      case ASSIGN_ADD:
      case CALL:
      case GETPROP:
      case GETELEM:
      case NAME:
      case THIS:
      case STRINGLIT:
      case NUMBER:
      case TRUE:
      case FALSE:
      case NULL:
        return true;

      default:
        return false;
    }
  }
}
