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

import org.tmplr.javascript.rhino.Node;
import org.tmplr.javascript.rhino.Token;

/**
 * This class walks the AST and validates that the structure is the one the template compiler
 * generates and the optimizations expect.
 *
 * <p>Empty VARs are accepted since removing unused declarators may leave them behind.
 */
public final class AstValidator implements CompilerPass {

  /** Violation handler */
  public interface ViolationHandler {
    void handleViolation(String message, Node n);
  }

  private final ViolationHandler violationHandler;

  public AstValidator(ViolationHandler handler) {
    this.violationHandler = handler;
  }

  public AstValidator() {
    this(
        new ViolationHandler() {
          @Override
          public void handleViolation(String message, Node n) {
            throw new IllegalStateException(
                message
                    + ". Reference node:\n"
                    + n.toStringTree()
                    + "\n Parent node:\n"
                    + ((n.getParent() != null) ? n.getParent().toStringTree() : " no parent "));
          }
        });
  }

  @Override
  public void process(Node root) {
    validateScript(root);
  }

  public void validateScript(Node n) {
    validateNodeType(Token.SCRIPT, n);
    validateHasNoParent(n);
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      validateStatement(c, /* isInFunction= */ false);
    }
  }

  public void validateStatement(Node n, boolean isInFunction) {
    switch (n.getToken()) {
      case FUNCTION:
        validateFunction(n, /* isDeclaration= */ true);
        return;
      case BLOCK:
        validateBlock(n, isInFunction);
        return;
      case VAR:
        validateVar(n);
        return;
      case EXPR_RESULT:
        if (validateChildCount(n, 1)) {
          validateExpression(n.getFirstChild());
        }
        return;
      case FOR:
        validateFor(n, isInFunction);
        return;
      case IF:
        validateIf(n, isInFunction);
        return;
      case RETURN:
        if (!isInFunction) {
          violation("RETURN outside of a function", n);
        }
        validateMaximumChildCount(n, 1);
        if (n.hasChildren()) {
          validateExpression(n.getFirstChild());
        }
        return;
      case EMPTY:
        validateChildCount(n, 0);
        return;
      default:
        violation("Expected statement but was " + n.getToken() + ".", n);
    }
  }

  private void validateBlock(Node n, boolean isInFunction) {
    validateNodeType(Token.BLOCK, n);
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      validateStatement(c, isInFunction);
    }
  }

  private void validateFunction(Node n, boolean isDeclaration) {
    validateNodeType(Token.FUNCTION, n);
    if (!validateChildCount(n, 3)) {
      return;
    }
    Node name = n.getFirstChild();
    if (!name.isName()) {
      violation("Expected NAME but was " + name.getToken(), name);
    } else if (isDeclaration && name.getString().isEmpty()) {
      violation("Function declaration without a name", n);
    }
    validateChildCount(name, 0);

    Node params = n.getSecondChild();
    validateNodeType(Token.PARAM_LIST, params);
    for (Node param = params.getFirstChild(); param != null; param = param.getNext()) {
      validateName(param);
    }

    validateBlock(n.getLastChild(), /* isInFunction= */ true);
  }

  private void validateVar(Node n) {
    validateNodeType(Token.VAR, n);
    for (Node declarator = n.getFirstChild();
        declarator != null;
        declarator = declarator.getNext()) {
      if (!declarator.isName()) {
        violation("Expected NAME but was " + declarator.getToken(), declarator);
        continue;
      }
      if (declarator.getString().isEmpty()) {
        violation("Empty declarator name", declarator);
      }
      validateMaximumChildCount(declarator, 1);
      if (declarator.hasChildren()) {
        validateExpression(declarator.getFirstChild());
      }
    }
  }

  private void validateFor(Node n, boolean isInFunction) {
    validateNodeType(Token.FOR, n);
    if (!validateChildCount(n, 4)) {
      return;
    }
    Node init = n.getFirstChild();
    if (init.isVar()) {
      validateVar(init);
    } else {
      validateOptionalExpression(init);
    }
    validateOptionalExpression(n.getSecondChild());
    validateOptionalExpression(n.getChildAtIndex(2));
    validateBlock(n.getLastChild(), isInFunction);
  }

  private void validateIf(Node n, boolean isInFunction) {
    validateNodeType(Token.IF, n);
    int count = n.getChildCount();
    if (count != 2 && count != 3) {
      violation("Expected 2 or 3 children, but was " + count, n);
      return;
    }
    validateExpression(n.getFirstChild());
    validateBlock(n.getSecondChild(), isInFunction);
    if (count == 3) {
      validateBlock(n.getLastChild(), isInFunction);
    }
  }

  private void validateOptionalExpression(Node n) {
    if (n.isEmpty()) {
      validateChildCount(n, 0);
    } else {
      validateExpression(n);
    }
  }

  public void validateExpression(Node n) {
    switch (n.getToken()) {
      case NAME:
        validateName(n);
        return;
      case THIS:
      case TRUE:
      case FALSE:
      case NULL:
      case STRINGLIT:
      case NUMBER:
        validateChildCount(n, 0);
        return;
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
      case GETELEM:
        if (validateChildCount(n, 2)) {
          validateExpression(n.getFirstChild());
          validateExpression(n.getLastChild());
        }
        return;
      case NOT:
        if (validateChildCount(n, 1)) {
          validateExpression(n.getFirstChild());
        }
        return;
      case INC:
      case DEC:
        if (validateChildCount(n, 1)) {
          validateAssignmentTarget(n.getFirstChild());
        }
        return;
      case ASSIGN:
      case ASSIGN_ADD:
        if (validateChildCount(n, 2)) {
          validateAssignmentTarget(n.getFirstChild());
          validateExpression(n.getLastChild());
        }
        return;
      case GETPROP:
        if (validateChildCount(n, 2)) {
          validateExpression(n.getFirstChild());
          validateNodeType(Token.STRINGLIT, n.getLastChild());
        }
        return;
      case CALL:
        validateMinimumChildCount(n, 1);
        for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
          validateExpression(c);
        }
        return;
      case FUNCTION:
        validateFunction(n, /* isDeclaration= */ false);
        return;
      default:
        violation("Expected expression but was " + n.getToken() + ".", n);
    }
  }

  private void validateAssignmentTarget(Node n) {
    switch (n.getToken()) {
      case NAME:
        validateName(n);
        return;
      case GETPROP:
      case GETELEM:
        validateExpression(n);
        return;
      default:
        violation("Expected assignment target but was " + n.getToken() + ".", n);
    }
  }

  private void validateName(Node n) {
    if (!n.isName()) {
      violation("Expected NAME but was " + n.getToken(), n);
      return;
    }
    validateChildCount(n, 0);
    if (n.getString().isEmpty()) {
      violation("Empty name", n);
    }
  }

  private void violation(String message, Node n) {
    violationHandler.handleViolation(message, n);
  }

  private void validateNodeType(Token type, Node n) {
    if (n.getToken() != type) {
      violation("Expected " + type + " but was " + n.getToken(), n);
    }
  }

  private void validateHasNoParent(Node n) {
    if (n.getParent() != null) {
      violation("Expected a root node", n);
    }
  }

  /** Returns whether the child count matches, so callers can stop before reading missing kids. */
  private boolean validateChildCount(Node n, int expected) {
    int count = n.getChildCount();
    if (expected != count) {
      violation("Expected " + expected + " children, but was " + count, n);
      return false;
    }
    return true;
  }

  private void validateMinimumChildCount(Node n, int i) {
    if (n.getChildCount() < i) {
      violation("Expected at least " + i + " children, but was " + n.getChildCount(), n);
    }
  }

  private void validateMaximumChildCount(Node n, int i) {
    if (n.getChildCount() > i) {
      violation("Expected no more than " + i + " children, but was " + n.getChildCount(), n);
    }
  }
}
