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

/**
 * The node kinds of the render-function AST.
 *
 * <p>This is a closed set: the upstream template compiler only ever produces these kinds, and every
 * switch over a {@link Token} in the optimizer is expected to handle all of them or fall through to
 * an explicit default.
 */
public enum Token {
  SCRIPT, // program root
  BLOCK,

  FUNCTION, // declaration or expression, depending on the parent
  PARAM_LIST,
  RETURN,

  VAR,
  NAME,
  THIS,
  EXPR_RESULT,

  ASSIGN, // simple assignment  (=)
  ASSIGN_ADD, // +=

  ADD,
  SUB,
  MUL,
  LT,
  LE,
  GT,
  GE,
  SHEQ, // shallow equality (===)
  SHNE, // shallow inequality (!==)
  AND, // logical and (&&)
  OR, // logical or (||)
  NOT,
  INC, // increment (++)
  DEC, // decrement (--)

  GETPROP, // a.b
  GETELEM, // a[b]
  CALL,

  STRINGLIT,
  NUMBER,
  TRUE,
  FALSE,
  NULL,

  FOR, // for(;;) statement
  IF,

  EMPTY;

  /** Returns whether this token is a binary operator with two expression operands. */
  public boolean isBinaryOperator() {
    switch (this) {
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
        return true;
      default:
        return false;
    }
  }
}
