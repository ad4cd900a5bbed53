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

package com.google.tsdown.parsing;

/**
 * Lexical token kinds. Words, keywords included, scan as {@link #IDENTIFIER}; the parser decides
 * what a word means in context, which keeps TypeScript's many contextual keywords simple.
 */
enum TokenType {
  END_OF_FILE("EOF"),
  IDENTIFIER("identifier"),
  NUMBER("number"),
  STRING("string"),
  REGULAR_EXPRESSION("regular expression"),
  NO_SUBSTITUTION_TEMPLATE("template"),
  TEMPLATE_HEAD("template"),
  TEMPLATE_MIDDLE("template"),
  TEMPLATE_TAIL("template"),

  OPEN_CURLY("{"),
  CLOSE_CURLY("}"),
  OPEN_PAREN("("),
  CLOSE_PAREN(")"),
  OPEN_SQUARE("["),
  CLOSE_SQUARE("]"),
  PERIOD("."),
  SPREAD("..."),
  SEMI_COLON(";"),
  COMMA(","),
  OPEN_ANGLE("<"),
  // The scanner emits '>' alone; the parser rescans it into the longer operators when needed.
  CLOSE_ANGLE(">"),
  LESS_EQUAL("<="),
  GREATER_EQUAL(">="),
  EQUAL_EQUAL("=="),
  NOT_EQUAL("!="),
  EQUAL_EQUAL_EQUAL("==="),
  NOT_EQUAL_EQUAL("!=="),
  PLUS("+"),
  MINUS("-"),
  STAR("*"),
  STAR_STAR("**"),
  SLASH("/"),
  PERCENT("%"),
  PLUS_PLUS("++"),
  MINUS_MINUS("--"),
  LEFT_SHIFT("<<"),
  RIGHT_SHIFT(">>"),
  UNSIGNED_RIGHT_SHIFT(">>>"),
  AMPERSAND("&"),
  BAR("|"),
  CARET("^"),
  BANG("!"),
  TILDE("~"),
  AND("&&"),
  OR("||"),
  QUESTION_QUESTION("??"),
  QUESTION("?"),
  QUESTION_DOT("?."),
  COLON(":"),
  EQUAL("="),
  PLUS_EQUAL("+="),
  MINUS_EQUAL("-="),
  STAR_EQUAL("*="),
  STAR_STAR_EQUAL("**="),
  SLASH_EQUAL("/="),
  PERCENT_EQUAL("%="),
  LEFT_SHIFT_EQUAL("<<="),
  RIGHT_SHIFT_EQUAL(">>="),
  UNSIGNED_RIGHT_SHIFT_EQUAL(">>>="),
  AMPERSAND_EQUAL("&="),
  BAR_EQUAL("|="),
  CARET_EQUAL("^="),
  AND_EQUAL("&&="),
  OR_EQUAL("||="),
  QUESTION_QUESTION_EQUAL("??="),
  ARROW("=>"),
  AT("@");

  private final String value;

  TokenType(String value) {
    this.value = value;
  }

  @Override
  public String toString() {
    return value;
  }
}
