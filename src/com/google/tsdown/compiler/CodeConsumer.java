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

package com.google.tsdown.compiler;

import org.jspecify.annotations.Nullable;

/**
 * Abstracted consumer of the CodeGenerator output.
 *
 * @see CodeGenerator
 * @see CodePrinter
 */
abstract class CodeConsumer {

  /**
   * Starts the source mapping of a node whose first character is the next one appended.
   *
   * @param originalOffset the source offset the node maps to, or -1 for no original position
   * @param name the identifier to record in the names table, or null
   */
  void startSourceMapping(int originalOffset, @Nullable String name) {}

  /** Retrieve the last character of the last string sent to append. */
  abstract char getLastChar();

  /**
   * Appends a string to the code, keeping track of the current line length.
   *
   * <p>NOTE: the string must be a complete token; partial strings or partial regexes will run the
   * risk of being split across lines. Newlines are only expected inside template literals and
   * raw text.
   */
  abstract void append(String str);

  /** Appends text that already carries its own line breaks, starting on a fresh line. */
  void appendRaw(String text) {
    startNewLine();
    append(text);
    if (!text.endsWith("\n")) {
      startNewLine();
    }
  }

  void addIdentifier(String identifier) {
    add(identifier);
  }

  void appendBlockStart() {
    append("{");
  }

  void appendBlockEnd() {
    append("}");
  }

  void startNewLine() {}

  void endLine() {}

  /** Indents the following lines one more level. */
  void indent() {}

  void outdent() {}

  void beginBlock() {
    appendBlockStart();
    endLine();
  }

  void endBlock() {
    appendBlockEnd();
  }

  /** Appends a block with no statements, such as an empty function body. */
  void appendEmptyBlock() {
    maybeInsertSpace();
    append("{ }");
  }

  void listSeparator() {
    add(",");
  }

  /** Indicates the end of a statement: adds the ';' and moves to the next line. */
  void endStatement() {
    append(";");
    endLine();
  }

  void beginCaseBody() {
    append(":");
  }

  void endCaseBody() {}

  void maybeInsertSpace() {}

  void add(String newcode) {
    if (newcode.isEmpty()) {
      return;
    }
    char c = newcode.charAt(0);
    char prev = getLastChar();
    if ((isWordChar(c) || c == '\\') && isWordChar(prev)) {
      append(" ");
    } else if (c == '/' && prev == '/') {
      append(" ");
    }
    append(newcode);
  }

  void appendOp(String op, boolean binOp) {
    append(op);
  }

  void addOp(String op, boolean binOp) {
    char first = op.charAt(0);
    char prev = getLastChar();

    if ((first == '+' || first == '-') && prev == first) {
      append(" ");
    } else if (Character.isLetter(first) && isWordChar(prev)) {
      append(" ");
    } else if (prev == '-' && first == '>') {
      append(" ");
    }

    appendOp(op, binOp);
  }

  void addNumber(double x) {
    char prev = getLastChar();
    if (x < 0 && prev == '-') {
      append(" ");
    }
    add(formatNumber(x));
  }

  /** Formats a number the way JavaScript's {@code Number.prototype.toString} does. */
  static String formatNumber(double x) {
    if (Double.isNaN(x)) {
      return "NaN";
    }
    if (Double.isInfinite(x)) {
      return x > 0 ? "Infinity" : "-Infinity";
    }
    if (x == 0) {
      return (1 / x < 0) ? "-0" : "0";
    }
    if ((long) x == x && Math.abs(x) < 1e21) {
      return Long.toString((long) x);
    }
    String s = Double.toString(x);
    int e = s.indexOf('E');
    if (e < 0) {
      return s.endsWith(".0") ? s.substring(0, s.length() - 2) : s;
    }
    String mantissa = s.substring(0, e);
    if (mantissa.endsWith(".0")) {
      mantissa = mantissa.substring(0, mantissa.length() - 2);
    }
    String exponent = s.substring(e + 1);
    return mantissa + "e" + (exponent.startsWith("-") ? exponent : "+" + exponent);
  }

  static boolean isWordChar(char ch) {
    return (ch == '_' || ch == '$' || Character.isLetterOrDigit(ch));
  }

  /** Called when we're at the end of a file. */
  void endFile() {}
}
