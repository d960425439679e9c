/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.pydecompiler.ast;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Sub-types of {@link AstNode}, and the operators that appear as leaves of
 * operator nodes.
 *
 * <p>Precedence is only meaningful for operators and for the few node kinds
 * that bind tighter than any operator (call, attribute access, subscript).
 * Everything else has precedence -1, so an operand never needs parentheses
 * because of it.
 */
public enum Op {
  // modules
  MODULE,
  INTERACTIVE,
  EXPRESSION,

  // statements
  FUNCTION_DEF,
  CLASS_DEF,
  RETURN,
  DELETE,
  ASSIGN,
  AUG_ASSIGN,
  PRINT,
  FOR,
  WHILE,
  IF,
  WITH,
  RAISE,
  TRY_EXCEPT,
  TRY_FINALLY,
  ASSERT,
  IMPORT,
  IMPORT_FROM,
  EXEC,
  GLOBAL,
  EXPR,
  PASS,
  BREAK,
  CONTINUE,

  // expressions
  LAMBDA,
  IF_EXP,
  DICT,
  SET,
  LIST_COMP,
  SET_COMP,
  DICT_COMP,
  GENERATOR_EXP,
  YIELD,
  COMPARE(3),
  CALL(12),
  REPR,
  NUM,
  STR,
  ATTRIBUTE(12),
  SUBSCRIPT(12),
  NAME,
  LIST,
  TUPLE,

  // slices
  ELLIPSIS,
  SLICE,
  EXT_SLICE,
  INDEX,

  // boolean operators
  AND("and", 1, Kind.BOOLEAN),
  OR("or", 0, Kind.BOOLEAN),

  // binary operators
  ADD("+", 8, Kind.BINARY),
  SUB("-", 8, Kind.BINARY),
  MULT("*", 9, Kind.BINARY),
  DIV("/", 9, Kind.BINARY),
  FLOOR_DIV("//", 9, Kind.BINARY),
  MOD("%", 9, Kind.BINARY),
  POW("**", 11, Kind.BINARY, false),
  L_SHIFT("<<", 7, Kind.BINARY),
  R_SHIFT(">>", 7, Kind.BINARY),
  BIT_OR("|", 4, Kind.BINARY),
  BIT_XOR("^", 5, Kind.BINARY),
  BIT_AND("&", 6, Kind.BINARY),

  // unary operators; "not" carries its own trailing space
  INVERT("~", 10, Kind.UNARY),
  NOT("not ", 2, Kind.UNARY),
  U_ADD("+", 10, Kind.UNARY),
  U_SUB("-", 10, Kind.UNARY),

  // comparison operators
  EQ("==", 3, Kind.COMPARISON),
  NOT_EQ("!=", 3, Kind.COMPARISON),
  LT("<", 3, Kind.COMPARISON),
  LT_E("<=", 3, Kind.COMPARISON),
  GT(">", 3, Kind.COMPARISON),
  GT_E(">=", 3, Kind.COMPARISON),
  IS("is", 3, Kind.COMPARISON),
  IS_NOT("is not", 3, Kind.COMPARISON),
  IN("in", 3, Kind.COMPARISON),
  NOT_IN("not in", 3, Kind.COMPARISON),

  // miscellaneous
  COMPREHENSION,
  EXCEPT_HANDLER,
  ARGUMENTS,
  KEYWORD,
  ALIAS,

  // synthetic nodes, created while unparsing
  KEY_VALUE_PAIR,
  STAR_ARG,
  DOUBLE_STAR_ARG,
  KEYWORD_ARG,
  /** The argument list of a call. Lower precedence than anything, so that an
   * argument is never parenthesized because it sits inside a call. */
  CALL_ARGS;

  /** Operator text, e.g. "+" or "not in"; null if this is not an operator. */
  public final @Nullable String symbol;
  /** Binding strength; higher binds tighter. */
  public final int precedence;
  /** Whether a chain of this operator groups to the left. */
  public final boolean leftAssociative;
  /** Category of operator, or null. */
  public final @Nullable Kind kind;

  Op() {
    this(-1);
  }

  Op(int precedence) {
    this(null, precedence, null, true);
  }

  Op(String symbol, int precedence, Kind kind) {
    this(symbol, precedence, kind, true);
  }

  Op(@Nullable String symbol, int precedence, @Nullable Kind kind,
      boolean leftAssociative) {
    this.symbol = symbol;
    this.precedence = precedence;
    this.kind = kind;
    this.leftAssociative = leftAssociative;
  }

  /** Returns whether this is an operator of a given category. */
  public boolean is(Kind kind) {
    return this.kind == kind;
  }

  /** Category of operator. */
  public enum Kind {
    BOOLEAN,
    BINARY,
    UNARY,
    COMPARISON
  }
}

// End Op.java
