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

import com.google.common.collect.ImmutableList;
import com.google.tsdown.ast.SourceFile;
import com.google.tsdown.compiler.CompilerOptions.LanguageMode;
import com.google.tsdown.sourcemap.OriginalMapping;
import com.google.tsdown.sourcemap.SourceMapConsumerV3;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CompilerTest {

  private CompilerOptions options;

  @Before
  public void setUp() {
    options = new CompilerOptions();
  }

  @Test
  public void testOutputName() {
    assertThat(Compiler.getOutputName("a/b.ts")).isEqualTo("a/b.js");
    assertThat(Compiler.getOutputName("x.d.ts")).isEqualTo("x.js");
    assertThat(Compiler.getOutputName("v.tsx")).isEqualTo("v.js");
    assertThat(Compiler.getOutputName("m.mts")).isEqualTo("m.mjs");
    assertThat(Compiler.getOutputName("c.cts")).isEqualTo("c.cjs");
    assertThat(Compiler.getOutputName("plain")).isEqualTo("plain.js");
  }

  @Test
  public void testParseError() {
    Result result = Compiler.compile(SourceFile.fromCode("bad.ts", "let x = 1;\nlet = ;"), options);

    assertThat(result.success).isFalse();
    assertThat(result.code).isNull();
    assertThat(result.errors).hasSize(1);
    JSError error = result.errors.get(0);
    assertThat(error.type()).isEqualTo(Compiler.PARSE_ERROR);
    assertThat(error.sourceName()).isEqualTo("bad.ts");
    assertThat(error.lineno()).isEqualTo(2);
  }

  @Test
  public void testConversionErrorSuppressesOutput() {
    Result result =
        Compiler.compile(SourceFile.fromCode("e.ts", "enum E { A = \"a\", B }"), options);

    assertThat(result.success).isFalse();
    assertThat(result.code).isNull();
    assertThat(result.errors.get(0).type())
        .isEqualTo(StripTypeScript.ENUM_MEMBER_NEEDS_INITIALIZER);
  }

  @Test
  public void testIncompleteLoweringIsAWarning() {
    options.setLanguageOut(LanguageMode.ECMASCRIPT_2017);
    Result result =
        Compiler.compile(
            SourceFile.fromCode("g.ts", "async function* g() { yield 1; }"), options);

    assertThat(result.success).isTrue();
    assertThat(result.code).contains("async function* g()");
    assertThat(result.warnings).hasSize(1);
    assertThat(result.warnings.get(0).type())
        .isEqualTo(TranspilationUtil.INCOMPLETE_LOWERING);
  }

  @Test
  public void testHelpersComeFirst() {
    Result result =
        Compiler.compile(
            SourceFile.fromCode("h.ts", "async function f() { await g(); }"), options);

    String code = result.code;
    assertThat(code.indexOf("var __awaiter")).isAtLeast(0);
    assertThat(code.indexOf("var __awaiter")).isLessThan(code.indexOf("var __generator"));
    assertThat(code.indexOf("var __generator")).isLessThan(code.indexOf("function f()"));
  }

  @Test
  public void testSourceMapComment() throws Exception {
    options.setIncludeSourceMap(true);
    Result result = Compiler.compile(SourceFile.fromCode("dir/input.ts", "let x = 1;"), options);

    assertThat(result.code).endsWith("//# sourceMappingURL=input.js.map");
    SourceMapConsumerV3 consumer = new SourceMapConsumerV3();
    consumer.parse(result.sourceMap);
    assertThat(consumer.getFile()).isEqualTo("input.js");
    assertThat(consumer.getOriginalSources()).containsExactly("input.ts");
    assertThat(consumer.getSourceContent(0)).isNull();
  }

  @Test
  public void testInlineSourceMapWithSources() {
    options.setInlineSourceMap(true);
    options.setEmbedSourcesContent(true);
    Result result = Compiler.compile(SourceFile.fromCode("input.ts", "let x = 1;"), options);

    assertThat(result.sourceMap).isNull();
    assertThat(result.code).contains("//# sourceMappingURL=data:application/json;base64,");
  }

  @Test
  public void testAwaitedValueMapsToItsSource() throws Exception {
    String input = "async function f(value) {\n  return await value;\n}\n";
    OriginalMapping mapping = findMapping(input, "/*yield*/, value", "value");

    assertThat(mapping.getLineNumber()).isEqualTo(1);
    assertThat(mapping.getColumnPosition()).isEqualTo("  return await value;".indexOf("value"));
  }

  @Test
  public void testAwaitInBinaryOperandMapsToItsSource() throws Exception {
    String input = "async function f() {\n  return 1 + await g();\n}\n";
    OriginalMapping mapping = findMapping(input, "/*yield*/, g()", "g()");

    assertThat(mapping.getLineNumber()).isEqualTo(1);
    assertThat(mapping.getColumnPosition()).isEqualTo("  return 1 + await g();".indexOf("g()"));
  }

  /**
   * Compiles {@code input} with a source map and resolves the position of {@code target} on the
   * first generated line containing {@code lineMarker}.
   */
  private OriginalMapping findMapping(String input, String lineMarker, String target)
      throws Exception {
    options.setIncludeSourceMap(true);
    Result result = Compiler.compile(SourceFile.fromCode("input.ts", input), options);
    SourceMapConsumerV3 consumer = new SourceMapConsumerV3();
    consumer.parse(result.sourceMap);

    String[] lines = result.code.split("\n", -1);
    for (int i = 0; i < lines.length; i++) {
      int marker = lines[i].indexOf(lineMarker);
      if (marker >= 0) {
        int column = lines[i].indexOf(target, marker);
        OriginalMapping mapping = consumer.getMappingForLine(i, column);
        assertThat(mapping).isNotNull();
        assertThat(mapping.getOriginalFile()).isEqualTo("input.ts");
        return mapping;
      }
    }
    throw new AssertionError("No line containing " + lineMarker + " in\n" + result.code);
  }

  @Test
  public void testCompileAllKeepsInputOrder() {
    ImmutableList.Builder<SourceFile> inputs = ImmutableList.builder();
    for (int i = 0; i < 8; i++) {
      inputs.add(SourceFile.fromCode("f" + i + ".ts", "let v" + i + " = " + i + ";"));
    }
    ImmutableList<Result> results = Compiler.compileAll(inputs.build(), options, 3);

    assertThat(results).hasSize(8);
    for (int i = 0; i < 8; i++) {
      assertThat(results.get(i).code).contains("var v" + i + " = " + i + ";");
    }
  }
}
