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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Converts source text into tokens. Scanning is a pure function of the start offset, so the parser
 * can back up by remembering a position. Slashes, template continuations and {@code >} runs are
 * context dependent and are rescanned on request.
 */
final class Scanner {

  /** A scanned token. {@code value} holds the word, the cooked string, or the raw literal text. */
  record ScannedToken(TokenType type, String value, int start, int end, boolean newlineBefore) {
    boolean is(TokenType t) {
      return type == t;
    }

    boolean isWord(String word) {
      return type == TokenType.IDENTIFIER && value.equals(word);
    }
  }

  private final String source;
  private int index;

  Scanner(String source) {
    this.source = source;
    this.index = source.startsWith("#!") ? skipToLineEnd(0) : 0;
  }

  private Scanner(String source, int index) {
    this.source = source;
    this.index = index;
  }

  int getPosition() {
    return index;
  }

  void setPosition(int position) {
    checkArgument(position >= 0 && position <= source.length());
    this.index = position;
  }

  String getSource() {
    return source;
  }

  private int skipToLineEnd(int i) {
    while (i < source.length() && !isLineTerminator(source.charAt(i))) {
      i++;
    }
    return i;
  }

  static boolean isLineTerminator(char c) {
    return c == '\n' || c == '\r' || c == 0x2028 || c == 0x2029;
  }

  private static boolean isWhitespace(char c) {
    return c == ' ' || c == '\t' || c == 0x0B || c == '\f' || c == 0xA0 || c == 0xFEFF
        || (c > 127 && Character.isSpaceChar(c) && !isLineTerminator(c));
  }

  static boolean isIdentifierStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '$' || c == '_'
        || (c > 127 && Character.isUnicodeIdentifierStart(c));
  }

  static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || (c >= '0' && c <= '9')
        || (c > 127 && Character.isUnicodeIdentifierPart(c));
  }

  private char peekChar(int offset) {
    int i = index + offset;
    return i < source.length() ? source.charAt(i) : '\0';
  }

  /** Skips whitespace and comments, returning whether a line terminator was crossed. */
  private boolean skipTrivia() {
    boolean newline = false;
    while (index < source.length()) {
      char c = source.charAt(index);
      if (isLineTerminator(c)) {
        newline = true;
        index++;
      } else if (isWhitespace(c)) {
        index++;
      } else if (c == '/' && peekChar(1) == '/') {
        index = skipToLineEnd(index);
      } else if (c == '/' && peekChar(1) == '*') {
        int close = source.indexOf("*/", index + 2);
        if (close < 0) {
          throw new ParseException("unterminated comment", index);
        }
        for (int i = index; i < close; i++) {
          if (isLineTerminator(source.charAt(i))) {
            newline = true;
          }
        }
        index = close + 2;
      } else {
        break;
      }
    }
    return newline;
  }

  /** Scans the next token, treating a slash as division. */
  ScannedToken next() {
    boolean newline = skipTrivia();
    int start = index;
    if (index >= source.length()) {
      return new ScannedToken(TokenType.END_OF_FILE, "", start, start, newline);
    }
    char c = source.charAt(index);
    if (isIdentifierStart(c) || c == '\\') {
      return token(TokenType.IDENTIFIER, scanIdentifier(), start, newline);
    }
    if ((c >= '0' && c <= '9') || (c == '.' && Character.isDigit(peekChar(1)))) {
      return token(TokenType.NUMBER, scanNumber(), start, newline);
    }
    switch (c) {
      case '"':
      case '\'':
        return token(TokenType.STRING, scanString(c), start, newline);
      case '`':
        index++;
        return scanTemplatePart(start, newline, true);
      case '#':
        throw new ParseException("private names are not supported", start);
      default:
        return token(scanPunctuator(), null, start, newline);
    }
  }

  private ScannedToken token(TokenType type, String value, int start, boolean newline) {
    return new ScannedToken(
        type, value != null ? value : source.substring(start, index), start, index, newline);
  }

  private String scanIdentifier() {
    StringBuilder sb = new StringBuilder();
    while (index < source.length()) {
      char c = source.charAt(index);
      if (c == '\\') {
        if (peekChar(1) != 'u') {
          throw new ParseException("invalid identifier escape", index);
        }
        index += 2;
        sb.appendCodePoint(scanUnicodeEscapeBody());
      } else if (isIdentifierPart(c)) {
        sb.append(c);
        index++;
      } else {
        break;
      }
    }
    return sb.toString();
  }

  private String scanNumber() {
    int start = index;
    char c = source.charAt(index);
    if (c == '0' && "xXoObB".indexOf(peekChar(1)) >= 0) {
      index += 2;
      while (index < source.length()
          && (Character.digit(source.charAt(index), 16) >= 0 || source.charAt(index) == '_')) {
        index++;
      }
    } else {
      scanDigits();
      if (peekChar(0) == '.') {
        index++;
        scanDigits();
      }
      if (peekChar(0) == 'e' || peekChar(0) == 'E') {
        index++;
        if (peekChar(0) == '+' || peekChar(0) == '-') {
          index++;
        }
        scanDigits();
      }
    }
    if (peekChar(0) == 'n') {
      throw new ParseException("BigInt literals are not supported", start);
    }
    if (isIdentifierStart(peekChar(0))) {
      throw new ParseException("identifier directly after number", index);
    }
    return source.substring(start, index);
  }

  private void scanDigits() {
    while (index < source.length()
        && (Character.isDigit(source.charAt(index)) || source.charAt(index) == '_')) {
      index++;
    }
  }

  /** Returns the numeric value of a number literal's raw text. */
  static double parseNumber(String raw, int offset) {
    String text = raw.replace("_", "");
    try {
      if (text.length() > 2 && text.charAt(0) == '0') {
        switch (text.charAt(1)) {
          case 'x':
          case 'X':
            return parseRadix(text.substring(2), 16);
          case 'o':
          case 'O':
            return parseRadix(text.substring(2), 8);
          case 'b':
          case 'B':
            return parseRadix(text.substring(2), 2);
          default:
            if (text.chars().allMatch(Character::isDigit) && text.chars().allMatch(d -> d < '8')) {
              return parseRadix(text.substring(1), 8);
            }
        }
      }
      return Double.parseDouble(text);
    } catch (NumberFormatException e) {
      throw new ParseException("malformed number " + raw, offset);
    }
  }

  private static double parseRadix(String digits, int radix) {
    double value = 0;
    for (int i = 0; i < digits.length(); i++) {
      int d = Character.digit(digits.charAt(i), radix);
      if (d < 0) {
        throw new NumberFormatException(digits);
      }
      value = value * radix + d;
    }
    return value;
  }

  private String scanString(char quote) {
    int start = index;
    index++;
    StringBuilder sb = new StringBuilder();
    while (true) {
      if (index >= source.length() || isLineTerminator(source.charAt(index))) {
        throw new ParseException("unterminated string literal", start);
      }
      char c = source.charAt(index);
      if (c == quote) {
        index++;
        return sb.toString();
      }
      if (c == '\\') {
        index++;
        scanEscape(sb);
      } else {
        sb.append(c);
        index++;
      }
    }
  }

  /** Appends the cooked value of the escape sequence after a backslash. */
  private void scanEscape(StringBuilder sb) {
    if (index >= source.length()) {
      throw new ParseException("unterminated escape", index);
    }
    char c = source.charAt(index++);
    switch (c) {
      case 'n' -> sb.append('\n');
      case 't' -> sb.append('\t');
      case 'r' -> sb.append('\r');
      case 'b' -> sb.append('\b');
      case 'f' -> sb.append('\f');
      case 'v' -> sb.append('\u000B');
      case '0' -> {
        if (Character.isDigit(peekChar(0))) {
          throw new ParseException("octal escapes are not supported", index);
        }
        sb.append('\0');
      }
      case 'x' -> {
        sb.append((char) parseHex(index, 2));
        index += 2;
      }
      case 'u' -> sb.appendCodePoint(scanUnicodeEscapeBody());
      case '\r' -> {
        if (peekChar(0) == '\n') {
          index++;
        }
      }
      case '\n', (char) 0x2028, (char) 0x2029 -> {}
      default -> sb.append(c);
    }
  }

  /** Scans the part of a unicode escape after {@code \\u}. */
  private int scanUnicodeEscapeBody() {
    if (peekChar(0) == '{') {
      int close = source.indexOf('}', index);
      if (close < 0) {
        throw new ParseException("unterminated unicode escape", index);
      }
      int value = parseHex(index + 1, close - index - 1);
      index = close + 1;
      return value;
    }
    int value = parseHex(index, 4);
    index += 4;
    return value;
  }

  private int parseHex(int start, int length) {
    if (length <= 0 || start + length > source.length()) {
      throw new ParseException("malformed escape", start);
    }
    int value = 0;
    for (int i = start; i < start + length; i++) {
      int d = Character.digit(source.charAt(i), 16);
      if (d < 0) {
        throw new ParseException("malformed escape", i);
      }
      value = value * 16 + d;
    }
    return value;
  }

  /**
   * Scans template characters up to the next substitution or the closing backtick. The token's
   * value is the raw text of the characters.
   */
  private ScannedToken scanTemplatePart(int start, boolean newline, boolean isHead) {
    int rawStart = index;
    while (true) {
      if (index >= source.length()) {
        throw new ParseException("unterminated template literal", start);
      }
      char c = source.charAt(index);
      if (c == '`') {
        String raw = source.substring(rawStart, index);
        index++;
        TokenType type =
            isHead ? TokenType.NO_SUBSTITUTION_TEMPLATE : TokenType.TEMPLATE_TAIL;
        return new ScannedToken(type, raw, start, index, newline);
      }
      if (c == '$' && peekChar(1) == '{') {
        String raw = source.substring(rawStart, index);
        index += 2;
        TokenType type = isHead ? TokenType.TEMPLATE_HEAD : TokenType.TEMPLATE_MIDDLE;
        return new ScannedToken(type, raw, start, index, newline);
      }
      index += c == '\\' ? 2 : 1;
    }
  }

  /** Rescans a '}' that closes a template substitution. */
  ScannedToken rescanTemplateContinuation(ScannedToken closeCurly) {
    checkArgument(closeCurly.is(TokenType.CLOSE_CURLY));
    index = closeCurly.start() + 1;
    return scanTemplatePart(closeCurly.start(), closeCurly.newlineBefore(), false);
  }

  /** Rescans a '/' or '/=' token as a regular expression literal. */
  ScannedToken rescanRegExp(ScannedToken slash) {
    int start = slash.start();
    index = start + 1;
    boolean inClass = false;
    while (true) {
      if (index >= source.length() || isLineTerminator(source.charAt(index))) {
        throw new ParseException("unterminated regular expression", start);
      }
      char c = source.charAt(index++);
      if (c == '\\') {
        index++;
      } else if (c == '[') {
        inClass = true;
      } else if (c == ']') {
        inClass = false;
      } else if (c == '/' && !inClass) {
        break;
      }
    }
    while (index < source.length() && isIdentifierPart(source.charAt(index))) {
      index++;
    }
    return new ScannedToken(
        TokenType.REGULAR_EXPRESSION,
        source.substring(start, index),
        start,
        index,
        slash.newlineBefore());
  }

  /** Rescans a '>' into the longest operator starting there. */
  ScannedToken rescanGreater(ScannedToken greater) {
    checkArgument(greater.is(TokenType.CLOSE_ANGLE));
    int start = greater.start();
    index = start + 1;
    TokenType type = TokenType.CLOSE_ANGLE;
    if (peekChar(0) == '>') {
      if (peekChar(1) == '>') {
        if (peekChar(2) == '=') {
          index += 3;
          type = TokenType.UNSIGNED_RIGHT_SHIFT_EQUAL;
        } else {
          index += 2;
          type = TokenType.UNSIGNED_RIGHT_SHIFT;
        }
      } else if (peekChar(1) == '=') {
        index += 2;
        type = TokenType.RIGHT_SHIFT_EQUAL;
      } else {
        index += 1;
        type = TokenType.RIGHT_SHIFT;
      }
    } else if (peekChar(0) == '=') {
      index += 1;
      type = TokenType.GREATER_EQUAL;
    }
    return new ScannedToken(
        type, source.substring(start, index), start, index, greater.newlineBefore());
  }

  private TokenType scanPunctuator() {
    char c = source.charAt(index);
    char c1 = peekChar(1);
    char c2 = peekChar(2);
    switch (c) {
      case '{':
        index++;
        return TokenType.OPEN_CURLY;
      case '}':
        index++;
        return TokenType.CLOSE_CURLY;
      case '(':
        index++;
        return TokenType.OPEN_PAREN;
      case ')':
        index++;
        return TokenType.CLOSE_PAREN;
      case '[':
        index++;
        return TokenType.OPEN_SQUARE;
      case ']':
        index++;
        return TokenType.CLOSE_SQUARE;
      case ';':
        index++;
        return TokenType.SEMI_COLON;
      case ',':
        index++;
        return TokenType.COMMA;
      case '~':
        index++;
        return TokenType.TILDE;
      case '@':
        index++;
        return TokenType.AT;
      case ':':
        index++;
        return TokenType.COLON;
      case '.':
        if (c1 == '.' && c2 == '.') {
          index += 3;
          return TokenType.SPREAD;
        }
        index++;
        return TokenType.PERIOD;
      case '>':
        index++;
        return TokenType.CLOSE_ANGLE;
      case '<':
        if (c1 == '<') {
          if (c2 == '=') {
            index += 3;
            return TokenType.LEFT_SHIFT_EQUAL;
          }
          index += 2;
          return TokenType.LEFT_SHIFT;
        }
        if (c1 == '=') {
          index += 2;
          return TokenType.LESS_EQUAL;
        }
        index++;
        return TokenType.OPEN_ANGLE;
      case '=':
        if (c1 == '=') {
          if (c2 == '=') {
            index += 3;
            return TokenType.EQUAL_EQUAL_EQUAL;
          }
          index += 2;
          return TokenType.EQUAL_EQUAL;
        }
        if (c1 == '>') {
          index += 2;
          return TokenType.ARROW;
        }
        index++;
        return TokenType.EQUAL;
      case '!':
        if (c1 == '=') {
          if (c2 == '=') {
            index += 3;
            return TokenType.NOT_EQUAL_EQUAL;
          }
          index += 2;
          return TokenType.NOT_EQUAL;
        }
        index++;
        return TokenType.BANG;
      case '+':
        return twoOrOne('+', TokenType.PLUS_PLUS, TokenType.PLUS_EQUAL, TokenType.PLUS);
      case '-':
        return twoOrOne('-', TokenType.MINUS_MINUS, TokenType.MINUS_EQUAL, TokenType.MINUS);
      case '*':
        if (c1 == '*') {
          if (c2 == '=') {
            index += 3;
            return TokenType.STAR_STAR_EQUAL;
          }
          index += 2;
          return TokenType.STAR_STAR;
        }
        return withEqual(TokenType.STAR_EQUAL, TokenType.STAR);
      case '/':
        return withEqual(TokenType.SLASH_EQUAL, TokenType.SLASH);
      case '%':
        return withEqual(TokenType.PERCENT_EQUAL, TokenType.PERCENT);
      case '^':
        return withEqual(TokenType.CARET_EQUAL, TokenType.CARET);
      case '&':
        if (c1 == '&') {
          return doubled(TokenType.AND_EQUAL, TokenType.AND);
        }
        return withEqual(TokenType.AMPERSAND_EQUAL, TokenType.AMPERSAND);
      case '|':
        if (c1 == '|') {
          return doubled(TokenType.OR_EQUAL, TokenType.OR);
        }
        return withEqual(TokenType.BAR_EQUAL, TokenType.BAR);
      case '?':
        if (c1 == '?') {
          return doubled(TokenType.QUESTION_QUESTION_EQUAL, TokenType.QUESTION_QUESTION);
        }
        if (c1 == '.' && !Character.isDigit(c2)) {
          index += 2;
          return TokenType.QUESTION_DOT;
        }
        index++;
        return TokenType.QUESTION;
      default:
        throw new ParseException("unexpected character '" + c + "'", index);
    }
  }

  private TokenType twoOrOne(char same, TokenType doubled, TokenType assign, TokenType single) {
    if (peekChar(1) == same) {
      index += 2;
      return doubled;
    }
    return withEqual(assign, single);
  }

  private TokenType withEqual(TokenType assign, TokenType single) {
    if (peekChar(1) == '=') {
      index += 2;
      return assign;
    }
    index++;
    return single;
  }

  private TokenType doubled(TokenType assign, TokenType pair) {
    if (peekChar(2) == '=') {
      index += 3;
      return assign;
    }
    index += 2;
    return pair;
  }

  /** Returns the cooked value of raw template text. */
  static String cookTemplateString(String raw) {
    Scanner scanner = new Scanner(raw, 0);
    StringBuilder sb = new StringBuilder();
    while (scanner.index < raw.length()) {
      char c = raw.charAt(scanner.index);
      if (c == '\\') {
        scanner.index++;
        scanner.scanEscape(sb);
      } else if (c == '\r') {
        // Line terminators normalize to \n in template values.
        sb.append('\n');
        scanner.index += scanner.peekChar(1) == '\n' ? 2 : 1;
      } else {
        sb.append(c);
        scanner.index++;
      }
    }
    return sb.toString();
  }
}
