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

import static com.google.common.truth.Truth.assertThat;

import com.google.tsdown.ast.NodeArena;
import com.google.tsdown.ast.SourceFile;
import com.google.tsdown.parsing.ParserRunner;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CodePrinterTest {

  private static String print(String code) {
    NodeArena arena = ParserRunner.parse(SourceFile.fromCode("input.ts", code));
    return new CodePrinter.Builder(new TransformRecord(arena)).build();
  }

  private static void assertPrintSame(String code) {
    assertThat(print(code).replaceAll("\\s+", " ").trim()).isEqualTo(code);
  }

  @Test
  public void testIndentation() {
    assertThat(print("function f(a){if(a){return 1;}}"))
        .isEqualTo("function f(a) {\n    if (a) {\n        return 1;\n    }\n}\n");
  }

  @Test
  public void testPrecedenceParentheses() {
    assertPrintSame("(a + b) * c;");
    assertPrintSame("a - (b - c);");
    assertPrintSame("(a, b) ? c : d;");
    assertPrintSame("x = (y, z);");
    assertPrintSame("(function () { })();");
  }

  @Test
  public void testArrowParametersAreParenthesized() {
    assertThat(print("x => x;").trim()).isEqualTo("(x) => x;");
  }

  @Test
  public void testNumbers() {
    assertPrintSame("f(1, 0x1F, 1.5, .5, 1e3);");
    assertThat(print("f(0b101, 0o17);").trim()).isEqualTo("f(5, 15);");
  }

  @Test
  public void testParsedStringsKeepTheirQuotes() {
    assertPrintSame("f('a', \"b\");");
  }

  @Test
  public void testTypesAreNotPrintedAfterStripping() {
    assertThat(print("let x = 1;").trim()).isEqualTo("let x = 1;");
  }

  @Test
  public void testFormatNumber() {
    assertThat(CodeConsumer.formatNumber(0)).isEqualTo("0");
    assertThat(CodeConsumer.formatNumber(-0.0)).isEqualTo("-0");
    assertThat(CodeConsumer.formatNumber(42)).isEqualTo("42");
    assertThat(CodeConsumer.formatNumber(0.25)).isEqualTo("0.25");
    assertThat(CodeConsumer.formatNumber(1e21)).isEqualTo("1e+21");
    assertThat(CodeConsumer.formatNumber(Double.NaN)).isEqualTo("NaN");
    assertThat(CodeConsumer.formatNumber(Double.NEGATIVE_INFINITY)).isEqualTo("-Infinity");
  }

  @Test
  public void testQuoteString() {
    assertThat(CodeGenerator.quoteString("a\"b", '"')).isEqualTo("\"a\\\"b\"");
    assertThat(CodeGenerator.quoteString("a'b", '"')).isEqualTo("\"a'b\"");
    assertThat(CodeGenerator.quoteString("\t\n\\", '"')).isEqualTo("\"\\t\\n\\\\\"");
    assertThat(CodeGenerator.quoteString("\0" + "1", '"')).isEqualTo("\"\\x001\"");
    assertThat(CodeGenerator.quoteString("\u0001", '"')).isEqualTo("\"\\x01\"");
  }
}
