/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.tsdown.ast;

/**
 * The closed set of node kinds. Child layouts are noted where they are not obvious; optional
 * children are present as {@link #EMPTY} so that positions stay fixed.
 */
public enum Token {
  // Structure
  SCRIPT, // statements
  BLOCK, // statements
  EMPTY,

  // Statements
  EXPR_RESULT, // [expr]
  VAR, // [NAME | DESTRUCTURING_LHS]+ ; NAME has an optional initializer child
  LET,
  CONST,
  DESTRUCTURING_LHS, // [pattern, initializer?]
  FUNCTION, // [NAME | EMPTY, PARAM_LIST, BLOCK | expression body]
  PARAM_LIST, // [NAME | DEFAULT_VALUE | ITER_REST | pattern]*
  RETURN, // [expr?]
  THROW, // [expr]
  BREAK, // string: label or null
  CONTINUE, // string: label or null
  IF, // [cond, then, else?]
  WHILE, // [cond, body]
  DO, // [body, cond]
  FOR, // [init | EMPTY, cond | EMPTY, update | EMPTY, body]
  FOR_IN, // [target, object, body]
  FOR_OF, // [target, iterable, body]
  SWITCH, // [discriminant, (CASE | DEFAULT_CASE)*]
  CASE, // [test, statement*]
  DEFAULT_CASE, // [statement*]
  TRY, // [BLOCK, CATCH | EMPTY, BLOCK?]
  CATCH, // [binding | EMPTY, BLOCK]
  LABEL, // string: label; [statement]
  DEBUGGER,

  // Classes
  CLASS, // [NAME | EMPTY, superclass | EMPTY, CLASS_MEMBERS, DECORATOR*]
  CLASS_MEMBERS,
  MEMBER_FUNCTION_DEF, // string: name; [FUNCTION, DECORATOR*]
  GETTER_DEF, // string: name; [FUNCTION, DECORATOR*]
  SETTER_DEF, // string: name; [FUNCTION, DECORATOR*]
  MEMBER_FIELD_DEF, // string: name; [initializer | EMPTY, DECORATOR*]
  COMPUTED_PROP, // [key, value | FUNCTION | EMPTY, DECORATOR*]; flags tell method/getter/...
  DECORATOR, // [expr]
  SUPER,

  // Modules
  IMPORT, // [NAME | EMPTY, IMPORT_SPECS | IMPORT_STAR | EMPTY, STRINGLIT]
  IMPORT_SPECS,
  IMPORT_SPEC, // [imported NAME, local NAME]
  IMPORT_STAR, // string: local name
  EXPORT, // [declaration] or [expr] (DEFAULT) or [EXPORT_SPECS, STRINGLIT | EMPTY]
  EXPORT_SPECS,
  EXPORT_SPEC, // [local NAME, exported NAME]
  EXPORT_ALL, // string: namespace or null; [STRINGLIT]

  // TypeScript declarations
  INTERFACE,
  TYPE_ALIAS,
  DECLARE, // ambient declaration; its text is not kept
  ENUM, // [NAME, ENUM_MEMBER*]
  ENUM_MEMBER, // string: name; [initializer?]
  NAMESPACE, // string: name; [BLOCK]
  CAST, // [expr]; `as`, `<T>` and `satisfies`
  NON_NULL, // [expr]; postfix `!`

  // Literals
  NAME,
  NUMBER, // number; string: raw text, or an opcode comment on synthesized nodes
  STRINGLIT, // string: cooked value
  TEMPLATELIT, // [TEMPLATELIT_STRING, (expr, TEMPLATELIT_STRING)*]
  TEMPLATELIT_STRING, // string: raw text
  TAGGED_TEMPLATELIT, // [tag, TEMPLATELIT]
  REGEXP, // string: raw text
  TRUE,
  FALSE,
  NULL,
  THIS,
  ARRAYLIT, // [expr | EMPTY hole | ITER_SPREAD]*
  // [STRING_KEY | MEMBER_FUNCTION_DEF | GETTER_DEF | SETTER_DEF | COMPUTED_PROP | OBJECT_SPREAD]*
  OBJECTLIT,
  STRING_KEY, // string: key; [value]

  // Patterns
  ARRAY_PATTERN, // [target | EMPTY | DEFAULT_VALUE | ITER_REST]*
  OBJECT_PATTERN, // [STRING_KEY | COMPUTED_PROP | OBJECT_REST]*
  DEFAULT_VALUE, // [target, default]
  ITER_REST, // [target]
  OBJECT_REST, // [target]
  ITER_SPREAD, // [expr]
  OBJECT_SPREAD, // [expr]

  // Member access and calls
  GETPROP, // string: property; [object]
  GETELEM, // [object, key]
  CALL, // [callee, arg*]
  NEW, // [callee, arg*]

  // Unary
  NOT,
  BITNOT,
  POS,
  NEG,
  TYPEOF,
  VOID,
  DELPROP,
  INC, // POSTFIX flag for x++
  DEC,
  AWAIT,
  YIELD, // [expr?]; YIELD_STAR flag for yield*

  // Binary
  COMMA,
  OR,
  AND,
  COALESCE,
  BITOR,
  BITXOR,
  BITAND,
  EQ,
  NE,
  SHEQ,
  SHNE,
  LT,
  LE,
  GT,
  GE,
  INSTANCEOF,
  IN,
  LSH,
  RSH,
  URSH,
  ADD,
  SUB,
  MUL,
  DIV,
  MOD,
  EXPONENT,

  // Assignment
  ASSIGN,
  ASSIGN_BITOR,
  ASSIGN_BITXOR,
  ASSIGN_BITAND,
  ASSIGN_LSH,
  ASSIGN_RSH,
  ASSIGN_URSH,
  ASSIGN_ADD,
  ASSIGN_SUB,
  ASSIGN_MUL,
  ASSIGN_DIV,
  ASSIGN_MOD,
  ASSIGN_EXPONENT,
  ASSIGN_OR,
  ASSIGN_AND,
  ASSIGN_COALESCE,

  HOOK, // [cond, then, else]

  // Runtime helper text inserted verbatim; string: the text
  HELPER_TEXT;

  public boolean isAssign() {
    return this.compareTo(ASSIGN) >= 0 && this.compareTo(ASSIGN_COALESCE) <= 0;
  }

  public boolean isCompoundAssign() {
    return isAssign() && this != ASSIGN;
  }

  /** Whether this is a two-operand operator other than assignment. */
  public boolean isBinaryOperator() {
    return this.compareTo(COMMA) >= 0 && this.compareTo(EXPONENT) <= 0;
  }

  public boolean isUnaryOperator() {
    return this.compareTo(NOT) >= 0 && this.compareTo(DEC) <= 0;
  }

  public boolean isDeclaration() {
    return this == VAR || this == LET || this == CONST;
  }

  public boolean isLoop() {
    return this == WHILE || this == DO || this == FOR || this == FOR_IN || this == FOR_OF;
  }

  /** Returns the operator a compound assignment applies, e.g. ADD for ASSIGN_ADD. */
  public Token getAssignOpBinaryOp() {
    return switch (this) {
      case ASSIGN_BITOR -> BITOR;
      case ASSIGN_BITXOR -> BITXOR;
      case ASSIGN_BITAND -> BITAND;
      case ASSIGN_LSH -> LSH;
      case ASSIGN_RSH -> RSH;
      case ASSIGN_URSH -> URSH;
      case ASSIGN_ADD -> ADD;
      case ASSIGN_SUB -> SUB;
      case ASSIGN_MUL -> MUL;
      case ASSIGN_DIV -> DIV;
      case ASSIGN_MOD -> MOD;
      case ASSIGN_EXPONENT -> EXPONENT;
      case ASSIGN_OR -> OR;
      case ASSIGN_AND -> AND;
      case ASSIGN_COALESCE -> COALESCE;
      default -> throw new IllegalStateException("Not a compound assignment: " + this);
    };
  }
}
