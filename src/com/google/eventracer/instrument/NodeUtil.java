/*
 * Copyright 2015 The Closure Compiler Authors.
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

package com.google.eventracer.instrument;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.eventracer.ast.Node;
import com.google.eventracer.ast.Token;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful AST utilities for the instrumentation passes. */
public final class NodeUtil {

  // Utility class; do not instantiate.
  private NodeUtil() {}

  /** Whether {@code n} is a VAR, LET or CONST. */
  static boolean isNameDeclaration(Node n) {
    return n.isVar() || n.isLet() || n.isConst();
  }

  /** Whether {@code n} is a plain or compound assignment. */
  static boolean isAssignmentOp(Node n) {
    return n.isAssign() || getOpFromAssignmentOp(n.getToken()) != null;
  }

  /** Returns the binary operator a compound assignment applies, or null for other tokens. */
  static @Nullable Token getOpFromAssignmentOp(Token token) {
    switch (token) {
      case ASSIGN_BITOR:
        return Token.BITOR;
      case ASSIGN_BITXOR:
        return Token.BITXOR;
      case ASSIGN_BITAND:
        return Token.BITAND;
      case ASSIGN_LSH:
        return Token.LSH;
      case ASSIGN_RSH:
        return Token.RSH;
      case ASSIGN_URSH:
        return Token.URSH;
      case ASSIGN_ADD:
        return Token.ADD;
      case ASSIGN_SUB:
        return Token.SUB;
      case ASSIGN_MUL:
        return Token.MUL;
      case ASSIGN_EXPONENT:
        return Token.EXPONENT;
      case ASSIGN_DIV:
        return Token.DIV;
      case ASSIGN_MOD:
        return Token.MOD;
      default:
        return null;
    }
  }

  /** Whether {@code n} is a GETPROP or GETELEM. */
  public static boolean isNormalGet(Node n) {
    return n.isGetProp() || n.isGetElem();
  }

  /**
   * Whether the key of a GETPROP or GETELEM is a string or number literal, which can be copied
   * instead of evaluated again.
   */
  public static boolean hasLiteralKey(Node get) {
    checkArgument(isNormalGet(get), get);
    Node key = get.getSecondChild();
    return key.isString() || key.isNumber();
  }

  /** Returns a detached copy of a literal key, carrying no node id. */
  static Node copyLiteralKey(Node key) {
    checkArgument(key.isString() || key.isNumber(), key);
    return key.isString() ? Node.newString(key.getString()) : Node.newNumber(key.getDouble());
  }

  public static Node getFunctionBody(Node fn) {
    checkArgument(fn.isFunction(), fn);
    return fn.getLastChild();
  }

  /** Returns the declared name of a function, or null if it is anonymous. */
  public static @Nullable String getFunctionName(Node fn) {
    checkArgument(fn.isFunction(), fn);
    String name = fn.getFirstChild().getString();
    return name.isEmpty() ? null : name;
  }

  /** Is this a function statement, that is a named function in a script or a block? */
  public static boolean isFunctionDeclaration(Node n) {
    if (!n.isFunction() || getFunctionName(n) == null) {
      return false;
    }
    Node parent = n.getParent();
    return parent != null && (parent.isScript() || parent.isBlock());
  }

  /**
   * Whether a call may be a direct call to eval. Rewriting the callee of such a call would turn it
   * into an indirect eval, which runs in the global scope.
   */
  public static boolean isPossiblyDirectEval(Node call) {
    checkArgument(call.isCall(), call);
    if (call.getBooleanProp(Node.Prop.DIRECT_EVAL)) {
      return true;
    }
    Node callee = call.getFirstChild();
    return callee.isName() && callee.getString().equals("eval");
  }

  /** Object, array and regular expression literals get a slot in the function's literal table. */
  public static boolean isMaterializedLiteral(Node n) {
    return n.isObjectLit() || n.isArrayLit() || n.isRegExp();
  }

  /** Whether a NAME node declares a binding rather than referencing one. */
  public static boolean isDeclarationName(Node n) {
    checkArgument(n.isName(), n);
    Node parent = n.getParent();
    if (parent == null) {
      return false;
    }
    switch (parent.getToken()) {
      case VAR:
      case LET:
      case CONST:
      case PARAM_LIST:
        return true;
      case FUNCTION:
      case CATCH:
        return parent.getFirstChild() == n;
      default:
        return false;
    }
  }
}
