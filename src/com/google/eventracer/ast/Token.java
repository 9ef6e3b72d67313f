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

/**
 * The kinds of node in a resolved program tree.
 *
 * <p>The set is closed: every pass switches over it, so adding a kind means visiting every pass.
 */
public enum Token {
  // Structure
  SCRIPT,
  BLOCK,
  EXPR_RESULT,
  EMPTY,

  // Declarations
  VAR,
  LET,
  CONST,
  FUNCTION,
  PARAM_LIST,

  // Control flow
  IF,
  WHILE,
  DO,
  FOR, // for(;;) statement
  FOR_IN,
  FOR_OF,
  SWITCH,
  CASE,
  DEFAULT_CASE,
  TRY,
  CATCH,
  WITH,
  LABEL,
  LABEL_NAME,
  BREAK,
  CONTINUE,
  RETURN,
  THROW,
  DEBUGGER,

  // Leaves
  NAME,
  STRINGLIT,
  NUMBER,
  NULL,
  TRUE,
  FALSE,
  THIS,
  REGEXP,

  // Materialized literals
  ARRAYLIT, // array literal
  OBJECTLIT, // object literal
  STRING_KEY, // key: value inside an object literal

  // Property access
  GETPROP, // obj.name
  GETELEM, // obj[key]

  // Calls
  CALL,
  NEW,
  CALL_RUNTIME, // %Primitive(args), a call to a compiler runtime function

  // Unary operators
  NOT,
  BITNOT,
  POS,
  NEG,
  TYPEOF,
  VOID,
  DELPROP, // delete operator
  INC, // increment (++)
  DEC, // decrement (--)

  // Binary operators
  BITOR,
  BITXOR,
  BITAND,
  LSH,
  RSH,
  URSH,
  ADD,
  SUB,
  MUL,
  DIV,
  MOD,
  EXPONENT,

  // Comparisons
  EQ,
  NE,
  SHEQ, // shallow equality (===)
  SHNE, // shallow inequality (!==)
  LT,
  LE,
  GT,
  GE,
  IN,
  INSTANCEOF,

  // Logical and sequencing operators
  OR, // logical or (||)
  AND, // logical and (&&)
  COALESCE, // nullish coalesce (??)
  COMMA, // comma operator
  HOOK, // conditional (?:)

  // Assignments
  ASSIGN, // simple assignment  (=)
  ASSIGN_BITOR, // |=
  ASSIGN_BITXOR, // ^=
  ASSIGN_BITAND, // &=
  ASSIGN_LSH, // <<=
  ASSIGN_RSH, // >>=
  ASSIGN_URSH, // >>>=
  ASSIGN_ADD, // +=
  ASSIGN_SUB, // -=
  ASSIGN_MUL, // *=
  ASSIGN_DIV, // /=
  ASSIGN_MOD, // %=
  ASSIGN_EXPONENT, // **=

  // Generators
  YIELD;

  /** If the arity isn't always the same, this function returns -1 */
  public static int arity(Token token) {
    return switch (token) {
      case ARRAYLIT,
          BLOCK,
          BREAK,
          CALL,
          CALL_RUNTIME,
          CASE,
          CONST,
          CONTINUE,
          DEFAULT_CASE,
          IF,
          LET,
          NAME,
          NEW,
          OBJECTLIT,
          PARAM_LIST,
          RETURN,
          SCRIPT,
          SWITCH,
          TRY,
          VAR,
          YIELD ->
          -1;
      case DEBUGGER,
          EMPTY,
          FALSE,
          LABEL_NAME,
          NULL,
          NUMBER,
          REGEXP,
          STRINGLIT,
          THIS,
          TRUE ->
          0;
      case BITNOT,
          DEC,
          DELPROP,
          EXPR_RESULT,
          INC,
          NEG,
          NOT,
          POS,
          STRING_KEY,
          THROW,
          TYPEOF,
          VOID ->
          1;
      case ADD,
          AND,
          ASSIGN,
          ASSIGN_ADD,
          ASSIGN_BITAND,
          ASSIGN_BITOR,
          ASSIGN_BITXOR,
          ASSIGN_DIV,
          ASSIGN_EXPONENT,
          ASSIGN_LSH,
          ASSIGN_MOD,
          ASSIGN_MUL,
          ASSIGN_RSH,
          ASSIGN_SUB,
          ASSIGN_URSH,
          BITAND,
          BITOR,
          BITXOR,
          CATCH,
          COALESCE,
          COMMA,
          DIV,
          DO,
          EQ,
          EXPONENT,
          GE,
          GETELEM,
          GETPROP,
          GT,
          IN,
          INSTANCEOF,
          LABEL,
          LE,
          LSH,
          LT,
          MOD,
          MUL,
          NE,
          OR,
          RSH,
          SHEQ,
          SHNE,
          SUB,
          URSH,
          WHILE,
          WITH ->
          2;
      case FOR_IN, FOR_OF, FUNCTION, HOOK -> 3;
      case FOR -> 4;
    };
  }
}
