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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.CharMatcher;
import com.google.eventracer.ast.Node;
import com.google.eventracer.ast.Token;
import org.jspecify.annotations.Nullable;

/**
 * Prints a tree as compact source text, for diagnostics and for stating expected rewrites in tests.
 *
 * <p>The output has no optional whitespace. Every statement that takes a semicolon gets one, and
 * parentheses are added only where precedence requires them, or around a function that is
 * called or that starts a statement. Compiler runtime calls print as {@code %Name(args)}.
 */
public final class CodePrinter {

  private static final CharMatcher IDENTIFIER_START =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.anyOf("_$"))
          .precomputed();

  private static final CharMatcher IDENTIFIER_PART =
      IDENTIFIER_START.or(CharMatcher.inRange('0', '9')).precomputed();

  /** Precedence of member access, calls and primary expressions. */
  private static final int PRIMARY = 18;

  private enum Context {
    STATEMENT,
    START_OF_EXPR,
    IN_FOR_INIT_CLAUSE,
    OTHER
  }

  private final StringBuilder sb = new StringBuilder();

  private CodePrinter() {}

  /** Returns the compact source text of {@code n}. */
  public static String compact(Node n) {
    CodePrinter printer = new CodePrinter();
    if (isStatement(n)) {
      printer.add(n, Context.STATEMENT);
    } else {
      printer.addExpr(n, 0, Context.OTHER);
    }
    return printer.sb.toString();
  }

  static boolean isValidIdentifier(String s) {
    return !s.isEmpty()
        && IDENTIFIER_START.matches(s.charAt(0))
        && IDENTIFIER_PART.matchesAllOf(s);
  }

  // ==========================================================================
  // Output

  private void add(String str) {
    if (!str.isEmpty() && sb.length() > 0) {
      char last = sb.charAt(sb.length() - 1);
      char next = str.charAt(0);
      // Keep "a+ +b" and "a- -b" from merging into increments.
      if ((last == '+' || last == '-') && next == last) {
        sb.append(' ');
      }
    }
    sb.append(str);
  }

  private void addIdentifier(String name) {
    add(name);
  }

  private void addString(String value) {
    StringBuilder quoted = new StringBuilder(value.length() + 2).append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          quoted.append("\\\"");
          break;
        case '\\':
          quoted.append("\\\\");
          break;
        case '\n':
          quoted.append("\\n");
          break;
        case '\r':
          quoted.append("\\r");
          break;
        case '\t':
          quoted.append("\\t");
          break;
        default:
          if (c < 0x20) {
            quoted.append(String.format("\\x%02x", (int) c));
          } else {
            quoted.append(c);
          }
      }
    }
    add(quoted.append('"').toString());
  }

  private void addNumber(double x) {
    if (x == (long) x && Math.abs(x) < 1e21 && !(x == 0 && 1 / x < 0)) {
      add(Long.toString((long) x));
    } else {
      add(Double.toString(x));
    }
  }

  // ==========================================================================
  // Statements

  private static boolean isStatement(Node n) {
    switch (n.getToken()) {
      case SCRIPT:
      case BLOCK:
      case EXPR_RESULT:
      case VAR:
      case LET:
      case CONST:
      case EMPTY:
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
      case BREAK:
      case CONTINUE:
      case RETURN:
      case THROW:
      case DEBUGGER:
        return true;
      case FUNCTION:
        Node parent = n.getParent();
        return parent != null && (parent.isScript() || parent.isBlock());
      default:
        return false;
    }
  }

  private void addStatements(@Nullable Node first) {
    for (Node n = first; n != null; n = n.getNext()) {
      add(n, Context.STATEMENT);
    }
  }

  private void addBlock(Node block) {
    checkState(block.isBlock(), block);
    add("{");
    addStatements(block.getFirstChild());
    add("}");
  }

  /** Adds a statement that follows a keyword, separating it with a space unless it is a block. */
  private void addBodyAfterKeyword(String keyword, Node body) {
    add(keyword);
    if (!body.isBlock()) {
      add(" ");
    }
    add(body, Context.STATEMENT);
  }

  private void addDeclaration(Node n, String keyword, Context context) {
    add(keyword);
    add(" ");
    boolean first = true;
    for (Node name = n.getFirstChild(); name != null; name = name.getNext()) {
      if (!first) {
        add(",");
      }
      first = false;
      addIdentifier(name.getString());
      Node initializer = name.getFirstChild();
      if (initializer != null) {
        add("=");
        addExpr(initializer, 1, Context.OTHER);
      }
    }
    if (context != Context.IN_FOR_INIT_CLAUSE) {
      add(";");
    }
  }

  /** Adds the first clause of a for statement, which may be empty or a declaration. */
  private void addForInit(Node n) {
    if (n.isEmpty()) {
      return;
    }
    if (NodeUtil.isNameDeclaration(n)) {
      add(n, Context.IN_FOR_INIT_CLAUSE);
    } else {
      addExpr(n, 0, Context.OTHER);
    }
  }

  // ==========================================================================
  // Expressions

  private void addExpr(Node n, int minPrecedence, Context context) {
    boolean parens =
        precedence(n.getToken()) < minPrecedence
            || (context == Context.START_OF_EXPR && (n.isFunction() || n.isObjectLit()));
    if (parens) {
      add("(");
      add(n, Context.OTHER);
      add(")");
    } else {
      add(n, context);
    }
  }

  private void addArgs(@Nullable Node first) {
    add("(");
    for (Node arg = first; arg != null; arg = arg.getNext()) {
      if (arg != first) {
        add(",");
      }
      addExpr(arg, 1, Context.OTHER);
    }
    add(")");
  }

  private void addCallee(Node callee, Context context) {
    if (callee.isFunction()) {
      add("(");
      add(callee, Context.OTHER);
      add(")");
    } else {
      addExpr(callee, PRIMARY, context);
    }
  }

  /** Whether a member chain contains a call, which would bind to {@code new} if unparenthesized. */
  private static boolean hasCallInMemberChain(Node n) {
    while (NodeUtil.isNormalGet(n)) {
      n = n.getFirstChild();
    }
    return n.isCall() || n.isCallRuntime();
  }

  private void add(Node n, Context context) {
    Token type = n.getToken();
    Node first = n.getFirstChild();
    Node last = n.getLastChild();
    String binaryOp = binaryOpToStr(type);
    if (binaryOp != null) {
      checkState(n.hasTwoChildren(), "Bad binary operator %s: %s", binaryOp, n);
      int p = precedence(type);
      if (NodeUtil.isAssignmentOp(n) || type == Token.EXPONENT) {
        // Right-associative.
        addExpr(first, p + 1, context);
        add(binaryOp);
        addExpr(last, p, Context.OTHER);
      } else {
        addExpr(first, p, context);
        add(binaryOp);
        addExpr(last, p + 1, Context.OTHER);
      }
      return;
    }

    switch (type) {
      case SCRIPT:
        addStatements(first);
        break;
      case BLOCK:
        addBlock(n);
        break;
      case EXPR_RESULT:
        addExpr(first, 0, Context.START_OF_EXPR);
        add(";");
        break;
      case EMPTY:
        add(";");
        break;
      case VAR:
        addDeclaration(n, "var", context);
        break;
      case LET:
        addDeclaration(n, "let", context);
        break;
      case CONST:
        addDeclaration(n, "const", context);
        break;
      case IF:
        add("if(");
        addExpr(first, 0, Context.OTHER);
        add(")");
        add(first.getNext(), Context.STATEMENT);
        if (n.getChildCount() == 3) {
          addBodyAfterKeyword("else", last);
        }
        break;
      case WHILE:
        add("while(");
        addExpr(first, 0, Context.OTHER);
        add(")");
        add(last, Context.STATEMENT);
        break;
      case DO:
        addBodyAfterKeyword("do", first);
        add("while(");
        addExpr(last, 0, Context.OTHER);
        add(");");
        break;
      case FOR:
        add("for(");
        addForInit(first);
        add(";");
        if (!first.getNext().isEmpty()) {
          addExpr(first.getNext(), 0, Context.OTHER);
        }
        add(";");
        Node increment = first.getNext().getNext();
        if (!increment.isEmpty()) {
          addExpr(increment, 0, Context.OTHER);
        }
        add(")");
        add(last, Context.STATEMENT);
        break;
      case FOR_IN:
      case FOR_OF:
        add("for(");
        addForInit(first);
        add(type == Token.FOR_IN ? " in " : " of ");
        addExpr(first.getNext(), 0, Context.OTHER);
        add(")");
        add(last, Context.STATEMENT);
        break;
      case SWITCH:
        add("switch(");
        addExpr(first, 0, Context.OTHER);
        add("){");
        addStatements(first.getNext());
        add("}");
        break;
      case CASE:
        add("case ");
        addExpr(first, 0, Context.OTHER);
        add(":");
        addStatements(last.getFirstChild());
        break;
      case DEFAULT_CASE:
        add("default:");
        addStatements(first.getFirstChild());
        break;
      case TRY:
        add("try");
        addBlock(first);
        Node catchBlock = first.getNext();
        if (catchBlock.hasChildren()) {
          add(catchBlock.getFirstChild(), Context.STATEMENT);
        }
        if (n.getChildCount() == 3) {
          add("finally");
          addBlock(last);
        }
        break;
      case CATCH:
        add("catch(");
        addIdentifier(first.getString());
        add(")");
        addBlock(last);
        break;
      case WITH:
        add("with(");
        addExpr(first, 0, Context.OTHER);
        add(")");
        add(last, Context.STATEMENT);
        break;
      case LABEL:
        addIdentifier(first.getString());
        add(":");
        add(last, Context.STATEMENT);
        break;
      case BREAK:
      case CONTINUE:
        add(type == Token.BREAK ? "break" : "continue");
        if (first != null) {
          add(" ");
          addIdentifier(first.getString());
        }
        add(";");
        break;
      case RETURN:
        add("return");
        if (first != null) {
          add(" ");
          addExpr(first, 0, Context.OTHER);
        }
        add(";");
        break;
      case THROW:
        add("throw ");
        addExpr(first, 0, Context.OTHER);
        add(";");
        break;
      case DEBUGGER:
        add("debugger;");
        break;

      case FUNCTION:
        add("function");
        String name = first.getString();
        if (!name.isEmpty()) {
          add(" ");
          addIdentifier(name);
        }
        add(first.getNext(), Context.OTHER);
        addBlock(last);
        break;
      case PARAM_LIST:
        add("(");
        for (Node param = first; param != null; param = param.getNext()) {
          if (param != first) {
            add(",");
          }
          addIdentifier(param.getString());
        }
        add(")");
        break;

      case NAME:
      case LABEL_NAME:
        addIdentifier(n.getString());
        break;
      case STRINGLIT:
        addString(n.getString());
        break;
      case NUMBER:
        addNumber(n.getDouble());
        break;
      case NULL:
        add("null");
        break;
      case TRUE:
        add("true");
        break;
      case FALSE:
        add("false");
        break;
      case THIS:
        add("this");
        break;
      case REGEXP:
        add("/" + n.getString() + "/");
        break;
      case ARRAYLIT:
        add("[");
        for (Node element = first; element != null; element = element.getNext()) {
          if (element != first) {
            add(",");
          }
          if (!element.isEmpty()) {
            addExpr(element, 1, Context.OTHER);
          }
        }
        add("]");
        break;
      case OBJECTLIT:
        add("{");
        for (Node key = first; key != null; key = key.getNext()) {
          if (key != first) {
            add(",");
          }
          add(key, Context.OTHER);
        }
        add("}");
        break;
      case STRING_KEY:
        if (isValidIdentifier(n.getString())) {
          addIdentifier(n.getString());
        } else {
          addString(n.getString());
        }
        add(":");
        addExpr(first, 1, Context.OTHER);
        break;

      case GETPROP:
        if (first.isNumber()) {
          add("(");
          add(first, Context.OTHER);
          add(")");
        } else {
          addExpr(first, PRIMARY, context);
        }
        String property = last.getString();
        if (isValidIdentifier(property)) {
          add(".");
          addIdentifier(property);
        } else {
          add("[");
          addString(property);
          add("]");
        }
        break;
      case GETELEM:
        addExpr(first, PRIMARY, context);
        add("[");
        addExpr(last, 0, Context.OTHER);
        add("]");
        break;
      case CALL:
        addCallee(first, context);
        addArgs(first.getNext());
        break;
      case NEW:
        add("new ");
        if (hasCallInMemberChain(first) || precedence(first.getToken()) < PRIMARY) {
          add("(");
          add(first, Context.OTHER);
          add(")");
        } else {
          add(first, Context.OTHER);
        }
        addArgs(first.getNext());
        break;
      case CALL_RUNTIME:
        add("%");
        add(n.getString());
        addArgs(first);
        break;

      case NOT:
      case BITNOT:
      case POS:
      case NEG:
      case TYPEOF:
      case VOID:
      case DELPROP:
        add(unaryOpToStr(type));
        addExpr(first, precedence(type), Context.OTHER);
        break;
      case INC:
      case DEC:
        String op = type == Token.INC ? "++" : "--";
        if (n.isPostfix()) {
          addExpr(first, precedence(type), context);
          add(op);
        } else {
          add(op);
          addExpr(first, precedence(type), Context.OTHER);
        }
        break;
      case HOOK:
        addExpr(first, precedence(type) + 1, context);
        add("?");
        addExpr(first.getNext(), 1, Context.OTHER);
        add(":");
        addExpr(last, 1, Context.OTHER);
        break;
      case COMMA:
        addExpr(first, 0, context);
        add(",");
        addExpr(last, 0, Context.OTHER);
        break;
      case YIELD:
        add(n.isYieldAll() ? "yield*" : "yield");
        if (first != null) {
          add(" ");
          addExpr(first, precedence(type), Context.OTHER);
        }
        break;

      default:
        throw new IllegalStateException("Unexpected token " + type + ": " + n);
    }
  }

  private static String unaryOpToStr(Token type) {
    switch (type) {
      case NOT:
        return "!";
      case BITNOT:
        return "~";
      case POS:
        return "+";
      case NEG:
        return "-";
      case TYPEOF:
        return "typeof ";
      case VOID:
        return "void ";
      case DELPROP:
        return "delete ";
      default:
        throw new IllegalArgumentException("Not a unary operator: " + type);
    }
  }

  /** Returns the source text of a binary operator, or null if {@code type} is not one. */
  private static @Nullable String binaryOpToStr(Token type) {
    switch (type) {
      case BITOR:
        return "|";
      case BITXOR:
        return "^";
      case BITAND:
        return "&";
      case LSH:
        return "<<";
      case RSH:
        return ">>";
      case URSH:
        return ">>>";
      case ADD:
        return "+";
      case SUB:
        return "-";
      case MUL:
        return "*";
      case DIV:
        return "/";
      case MOD:
        return "%";
      case EXPONENT:
        return "**";
      case EQ:
        return "==";
      case NE:
        return "!=";
      case SHEQ:
        return "===";
      case SHNE:
        return "!==";
      case LT:
        return "<";
      case LE:
        return "<=";
      case GT:
        return ">";
      case GE:
        return ">=";
      case IN:
        return " in ";
      case INSTANCEOF:
        return " instanceof ";
      case OR:
        return "||";
      case AND:
        return "&&";
      case COALESCE:
        return "??";
      case ASSIGN:
        return "=";
      case ASSIGN_BITOR:
        return "|=";
      case ASSIGN_BITXOR:
        return "^=";
      case ASSIGN_BITAND:
        return "&=";
      case ASSIGN_LSH:
        return "<<=";
      case ASSIGN_RSH:
        return ">>=";
      case ASSIGN_URSH:
        return ">>>=";
      case ASSIGN_ADD:
        return "+=";
      case ASSIGN_SUB:
        return "-=";
      case ASSIGN_MUL:
        return "*=";
      case ASSIGN_DIV:
        return "/=";
      case ASSIGN_MOD:
        return "%=";
      case ASSIGN_EXPONENT:
        return "**=";
      default:
        return null;
    }
  }

  /**
   * The comma operator has the lowest precedence, 0, followed by the assignment operators ({@code
   * =}, {@code &=}, {@code +=}, etc.) which have precedence of 1, and so on.
   */
  static int precedence(Token type) {
    switch (type) {
      case COMMA:
        return 0;
      case ASSIGN:
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
        return 1;
      case YIELD:
        return 2;
      case HOOK:
        return 3; // ?: operator
      case OR:
        return 4;
      case AND:
        return 5;
      case COALESCE:
        return 6;
      case BITOR:
        return 7;
      case BITXOR:
        return 8;
      case BITAND:
        return 9;
      case EQ:
      case NE:
      case SHEQ:
      case SHNE:
        return 10;
      case LT:
      case GT:
      case LE:
      case GE:
      case INSTANCEOF:
      case IN:
        return 11;
      case LSH:
      case RSH:
      case URSH:
        return 12;
      case SUB:
      case ADD:
        return 13;
      case MUL:
      case MOD:
      case DIV:
        return 14;
      case EXPONENT:
        return 15;
      case NEW:
      case DELPROP:
      case TYPEOF:
      case VOID:
      case NOT:
      case BITNOT:
      case POS:
      case NEG:
        return 16; // Unary operators
      case INC:
      case DEC:
        return 17; // Update operators
      default:
        return PRIMARY;
    }
  }
}
