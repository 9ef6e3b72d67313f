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

package com.google.eventracer.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.util.List;

/** An AST construction helper class. */
public final class IR {

  private IR() {}

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  public static Node function(Node name, Node params, Node body) {
    checkState(name.isName());
    checkState(params.isParamList());
    checkState(body.isBlock());
    return new Node(Token.FUNCTION, name, params, body);
  }

  public static Node paramList(Node... params) {
    Node paramList = new Node(Token.PARAM_LIST);
    for (Node param : params) {
      checkState(param.isName(), param);
      paramList.addChildToBack(param);
    }
    return paramList;
  }

  public static Node paramList(List<Node> params) {
    return paramList(params.toArray(new Node[0]));
  }

  public static Node block(Node... stmts) {
    Node block = new Node(Token.BLOCK);
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt.getToken());
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node block(List<Node> stmts) {
    return block(stmts.toArray(new Node[0]));
  }

  public static Node script(Node... stmts) {
    Node script = new Node(Token.SCRIPT);
    for (Node stmt : stmts) {
      checkState(mayBeStatementNoReturn(stmt), stmt);
      script.addChildToBack(stmt);
    }
    return script;
  }

  public static Node var(Node lhs) {
    return declaration(lhs, Token.VAR);
  }

  public static Node var(Node lhs, Node value) {
    return declaration(lhs, value, Token.VAR);
  }

  public static Node let(Node lhs, Node value) {
    return declaration(lhs, value, Token.LET);
  }

  public static Node declaration(Node lhs, Token type) {
    checkState(lhs.isName() && !lhs.hasChildren(), lhs);
    checkArgument(isDeclaration(type), type);
    return new Node(type, lhs);
  }

  public static Node declaration(Node lhs, Node value, Token type) {
    checkState(lhs.isName() && !lhs.hasChildren(), lhs);
    checkArgument(isDeclaration(type), type);
    checkState(mayBeExpression(value), "%s can't be an expression", value);
    lhs.addChildToBack(value);
    return new Node(type, lhs);
  }

  private static boolean isDeclaration(Token type) {
    return type == Token.VAR || type == Token.LET || type == Token.CONST;
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.RETURN, expr);
  }

  public static Node yield(Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.YIELD, expr);
  }

  public static Node throwNode(Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.THROW, expr);
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_RESULT, expr);
  }

  public static Node ifNode(Node cond, Node then) {
    checkState(mayBeExpression(cond));
    checkState(then.isBlock());
    return new Node(Token.IF, cond, then);
  }

  public static Node ifNode(Node cond, Node then, Node elseNode) {
    checkState(mayBeExpression(cond));
    checkState(then.isBlock());
    checkState(elseNode.isBlock());
    return new Node(Token.IF, cond, then, elseNode);
  }

  public static Node catchNode(Node name, Node body) {
    checkState(name.isName());
    checkState(body.isBlock());
    return new Node(Token.CATCH, name, body);
  }

  public static Node with(Node obj, Node body) {
    checkState(mayBeExpression(obj));
    checkState(body.isBlock());
    return new Node(Token.WITH, obj, body);
  }

  public static Node call(Node target, Node... args) {
    Node call = new Node(Token.CALL, target);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node newNode(Node target, Node... args) {
    Node newcall = new Node(Token.NEW, target);
    for (Node arg : args) {
      checkState(mayBeExpression(arg));
      newcall.addChildToBack(arg);
    }
    return newcall;
  }

  /** A call to the compiler runtime primitive {@code %name(args)}. */
  public static Node callRuntime(String name, Node... args) {
    checkState(!name.isEmpty());
    Node call = Node.newString(Token.CALL_RUNTIME, name);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node name(String name) {
    checkState(name.indexOf('.') == -1, "Invalid name '%s'", name);
    return Node.newString(Token.NAME, name);
  }

  public static Node getprop(Node target, String prop) {
    checkState(mayBeExpression(target));
    return new Node(Token.GETPROP, target, string(prop));
  }

  public static Node getelem(Node target, Node elem) {
    checkState(mayBeExpression(target));
    checkState(mayBeExpression(elem));
    return new Node(Token.GETELEM, target, elem);
  }

  public static Node delprop(Node target) {
    checkState(mayBeExpression(target));
    return new Node(Token.DELPROP, target);
  }

  public static Node assign(Node target, Node expr) {
    checkState(isAssignmentTarget(target), target);
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.ASSIGN, target, expr);
  }

  /** Builds {@code target op= expr} for one of the compound assignment tokens. */
  public static Node assignOp(Token op, Node target, Node expr) {
    checkArgument(isCompoundAssignment(op), op);
    checkState(isAssignmentTarget(target), target);
    checkState(mayBeExpression(expr), expr);
    return new Node(op, target, expr);
  }

  public static Node inc(Node target, boolean postfix) {
    checkState(isAssignmentTarget(target), target);
    Node n = new Node(Token.INC, target);
    n.setPostfix(postfix);
    return n;
  }

  public static Node dec(Node target, boolean postfix) {
    checkState(isAssignmentTarget(target), target);
    Node n = new Node(Token.DEC, target);
    n.setPostfix(postfix);
    return n;
  }

  public static Node binaryOp(Token token, Node expr1, Node expr2) {
    checkArgument(Token.arity(token) == 2, token);
    checkState(mayBeExpression(expr1));
    checkState(mayBeExpression(expr2));
    return new Node(token, expr1, expr2);
  }

  public static Node unaryOp(Token token, Node expr) {
    checkArgument(Token.arity(token) == 1, token);
    checkState(mayBeExpression(expr));
    return new Node(token, expr);
  }

  public static Node add(Node expr1, Node expr2) {
    return binaryOp(Token.ADD, expr1, expr2);
  }

  public static Node comma(Node expr1, Node expr2) {
    return binaryOp(Token.COMMA, expr1, expr2);
  }

  public static Node and(Node expr1, Node expr2) {
    return binaryOp(Token.AND, expr1, expr2);
  }

  public static Node or(Node expr1, Node expr2) {
    return binaryOp(Token.OR, expr1, expr2);
  }

  public static Node hook(Node cond, Node expr1, Node expr2) {
    checkState(mayBeExpression(cond));
    checkState(mayBeExpression(expr1));
    checkState(mayBeExpression(expr2));
    return new Node(Token.HOOK, cond, expr1, expr2);
  }

  public static Node typeof(Node expr) {
    return unaryOp(Token.TYPEOF, expr);
  }

  public static Node not(Node expr) {
    return unaryOp(Token.NOT, expr);
  }

  public static Node voidNode(Node expr) {
    return unaryOp(Token.VOID, expr);
  }

  /** Returns {@code void 0}, the canonical undefined value. */
  public static Node undefined() {
    return voidNode(number(0));
  }

  public static Node objectlit(Node... propdefs) {
    Node objectlit = new Node(Token.OBJECTLIT);
    for (Node propdef : propdefs) {
      checkState(propdef.isStringKey(), propdef);
      objectlit.addChildToBack(propdef);
    }
    return objectlit;
  }

  public static Node stringKey(String s, Node value) {
    checkState(mayBeExpression(value));
    Node stringKey = Node.newString(Token.STRING_KEY, s);
    stringKey.addChildToBack(value);
    return stringKey;
  }

  public static Node arraylit(Node... exprs) {
    Node arraylit = new Node(Token.ARRAYLIT);
    for (Node expr : exprs) {
      checkState(mayBeExpressionOrEmpty(expr), expr);
      arraylit.addChildToBack(expr);
    }
    return arraylit;
  }

  public static Node regexp(String pattern) {
    return Node.newString(Token.REGEXP, pattern);
  }

  public static Node string(String s) {
    return Node.newString(s);
  }

  public static Node number(double d) {
    checkState(!Double.isNaN(d), d);
    checkState(!Double.isInfinite(d), d);
    checkState(d >= 0 && !(d == 0 && 1 / d < 0), "Negative numbers must use NEG: %s", d);
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

  private static boolean isCompoundAssignment(Token op) {
    switch (op) {
      case ASSIGN_BITOR:
      case ASSIGN_BITXOR:
      case ASSIGN_BITAND:
      case ASSIGN_LSH:
      case ASSIGN_RSH:
      case ASSIGN_URSH:
      case ASSIGN_ADD:
      case ASSIGN_SUB:
      case ASSIGN_MUL:
      case ASSIGN_DIV:
      case ASSIGN_MOD:
      case ASSIGN_EXPONENT:
        return true;
      default:
        return false;
    }
  }

  private static boolean isAssignmentTarget(Node n) {
    return n.isName() || n.isGetProp() || n.isGetElem();
  }

  private static boolean mayBeExpressionOrEmpty(Node n) {
    return n.isEmpty() || mayBeExpression(n);
  }

  // NOTE: some nodes are neither statements nor expression nodes:
  //   SCRIPT, LABEL_NAME, PARAM_LIST, CASE, DEFAULT_CASE, CATCH, STRING_KEY

  private static boolean mayBeStatementNoReturn(Node n) {
    switch (n.getToken()) {
      case EMPTY:
      case FUNCTION:
        // EMPTY and FUNCTION are used both in expression and statement
        // contexts
        return true;

      case BLOCK:
      case BREAK:
      case CONST:
      case CONTINUE:
      case DEBUGGER:
      case DO:
      case EXPR_RESULT:
      case FOR:
      case FOR_IN:
      case FOR_OF:
      case IF:
      case LABEL:
      case LET:
      case SWITCH:
      case THROW:
      case TRY:
      case VAR:
      case WHILE:
      case WITH:
        return true;

      default:
        return false;
    }
  }

  /**
   * It isn't possible to always determine if a detached node is a expression, so make a best
   * guess.
   */
  public static boolean mayBeStatement(Node n) {
    return mayBeStatementNoReturn(n) || n.isReturn();
  }

  /**
   * It isn't possible to always determine if a detached node is a expression, so make a best
   * guess.
   */
  public static boolean mayBeExpression(Node n) {
    switch (n.getToken()) {
      case SCRIPT:
      case BLOCK:
      case EXPR_RESULT:
      case EMPTY:
      case VAR:
      case LET:
      case CONST:
      case PARAM_LIST:
      case IF:
      case WHILE:
      case DO:
      case FOR:
      case FOR_IN:
      case FOR_OF:
      case SWITCH:
      case CASE:
      case DEFAULT_CASE:
      case TRY:
      case CATCH:
      case WITH:
      case LABEL:
      case LABEL_NAME:
      case BREAK:
      case CONTINUE:
      case RETURN:
      case THROW:
      case DEBUGGER:
      case STRING_KEY:
        return false;
      default:
        return true;
    }
  }
}
