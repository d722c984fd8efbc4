/*
 * Copyright 2024 The Closure Compiler Authors.
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

package com.google.cloudlang.ast;

/**
 * The kinds of AST node understood by the decomposition compiler.
 *
 * <p>This is the ESTree subset emitted by the TypeScript front end, named the way the rest of the
 * compiler names them.
 */
public enum Token {
  PROGRAM,

  // Declarations. Children are declarators: a NAME (whose only child, if any, is the
  // initializer) or a DESTRUCTURING_LHS.
  VAR,
  LET,
  CONST,
  DESTRUCTURING_LHS,
  ARRAY_PATTERN,
  OBJECT_PATTERN,

  NAME,

  // Literals
  STRINGLIT,
  NUMBER,
  TRUE,
  FALSE,
  NULL,
  ARRAYLIT,
  OBJECTLIT,
  STRING_KEY, // object literal or object pattern key; the key is the node's string

  FUNCTION, // arrow function: NAME (always empty), PARAM_LIST, body
  PARAM_LIST,

  // Statements
  BLOCK,
  RETURN,
  IF,
  EXPR_RESULT,

  // Expressions
  CALL,
  NEW,
  GETPROP, // object.property; the property is the node's string
  GETELEM, // object[key]
  HOOK, // cond ? a : b
  AWAIT,
  NOT,
  NEG,
  TYPEOF,

  // Binary operators
  ADD,
  SUB,
  MUL,
  DIV,
  MOD,
  EQ,
  NE,
  SHEQ, // shallow equality (===)
  SHNE, // shallow inequality (!==)
  LT,
  LE,
  GT,
  GE,

  // Logical operators
  AND,
  OR,
  COALESCE, // ??

  // export { a, b as c };
  EXPORT,
  EXPORT_SPECS,
  EXPORT_SPEC; // local NAME, exported NAME

  /** If the arity isn't always the same, this function returns -1 */
  public static int arity(Token token) {
    return switch (token) {
      case PROGRAM,
          VAR,
          LET,
          CONST,
          DESTRUCTURING_LHS,
          ARRAY_PATTERN,
          OBJECT_PATTERN,
          NAME,
          ARRAYLIT,
          OBJECTLIT,
          PARAM_LIST,
          BLOCK,
          RETURN,
          IF,
          CALL,
          NEW,
          EXPORT_SPECS ->
          -1;
      case STRINGLIT, NUMBER, TRUE, FALSE, NULL -> 0;
      case STRING_KEY, EXPR_RESULT, GETPROP, AWAIT, NOT, NEG, TYPEOF, EXPORT -> 1;
      case GETELEM,
          ADD,
          SUB,
          MUL,
          DIV,
          MOD,
          EQ,
          NE,
          SHEQ,
          SHNE,
          LT,
          LE,
          GT,
          GE,
          AND,
          OR,
          COALESCE,
          EXPORT_SPEC ->
          2;
      case FUNCTION, HOOK -> 3;
    };
  }

  public boolean isNameDeclaration() {
    return this == VAR || this == LET || this == CONST;
  }

  public boolean isLiteralValue() {
    return switch (this) {
      case STRINGLIT, NUMBER, TRUE, FALSE, NULL -> true;
      default -> false;
    };
  }

  public boolean isBinaryOperator() {
    return switch (this) {
      case ADD, SUB, MUL, DIV, MOD, EQ, NE, SHEQ, SHNE, LT, LE, GT, GE -> true;
      default -> false;
    };
  }

  public boolean isLogicalOperator() {
    return this == AND || this == OR || this == COALESCE;
  }

  public boolean isUnaryOperator() {
    return this == NOT || this == NEG || this == TYPEOF;
  }
}
