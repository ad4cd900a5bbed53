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
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.collect.ImmutableList;
import com.google.tsdown.ast.NodeArena;
import com.google.tsdown.ast.SourceFile;
import com.google.tsdown.compiler.CompilerOptions.LanguageMode;
import com.google.tsdown.compiler.CompilerOptions.ModuleKind;
import com.google.tsdown.parsing.ParserRunner;
import org.junit.Before;

/**
 * Base class for tests of the lowering passes. Inputs are parsed, lowered with
 * {@link TranspilationPasses} and printed; outputs are compared with runs of whitespace
 * collapsed, and without the text of the runtime helpers, which tests check separately.
 */
public abstract class TranspilationTestCase {

  protected static final String FILE_NAME = "input.ts";

  private CompilerOptions options;
  private Compiler lastCompiler;

  @Before
  public void setUpOptions() {
    options = new CompilerOptions();
    options.setLanguageOut(LanguageMode.ECMASCRIPT5);
    options.setModule(ModuleKind.COMMONJS);
  }

  protected CompilerOptions getOptions() {
    return options;
  }

  protected void setLanguageOut(LanguageMode mode) {
    options.setLanguageOut(mode);
  }

  protected void setModule(ModuleKind module) {
    options.setModule(module);
  }

  /** Lowers {@code input} and checks the printed output. */
  protected void test(String input, String expected) {
    Compiler compiler = lower(input);
    assertWithMessage("Unexpected errors: %s", compiler.getErrorManager().getErrors())
        .that(compiler.getErrorManager().getErrorCount())
        .isEqualTo(0);
    assertThat(normalize(print(compiler))).isEqualTo(normalize(expected));
  }

  /** Lowers {@code input}, checks that it reported nothing and returns the printed output. */
  protected String transpile(String input) {
    Compiler compiler = lower(input);
    assertWithMessage("Unexpected errors: %s", compiler.getErrorManager().getErrors())
        .that(compiler.getErrorManager().getErrorCount())
        .isEqualTo(0);
    return normalize(print(compiler));
  }

  /** Lowers {@code input} and checks that it prints as it was written. */
  protected void testSame(String input) {
    test(input, input);
  }

  /** Lowers {@code input} and checks that exactly one construct was left as it was. */
  protected void testIncompletelyLowered(String input, String reason) {
    Compiler compiler = lower(input);
    ImmutableList<TransformRecord.IncompleteLowering> markers =
        compiler.getRecord().getIncompleteLowerings();
    assertThat(markers).hasSize(1);
    assertThat(markers.get(0).reason()).isEqualTo(reason);
  }

  /** Lowers {@code input} and checks that it fails with {@code type}. */
  protected void testError(String input, DiagnosticType type) {
    Compiler compiler = lower(input);
    ImmutableList<JSError> errors = compiler.getErrorManager().getErrors();
    assertWithMessage("Expected one error, got %s", errors).that(errors).hasSize(1);
    assertThat(errors.get(0).type()).isEqualTo(type);
  }

  /** The helpers the last lowered input needed, in emission order. */
  protected ImmutableList<RuntimeHelper> getLastHelpers() {
    return lastCompiler.getRecord().getRequiredHelpers().asList();
  }

  protected Compiler lower(String input) {
    NodeArena arena = ParserRunner.parse(SourceFile.fromCode(FILE_NAME, input));
    Compiler compiler = new Compiler(arena, options, new BasicErrorManager());
    TranspilationPasses.process(compiler);
    lastCompiler = compiler;
    return compiler;
  }

  private static String print(Compiler compiler) {
    String code = new CodePrinter.Builder(compiler.getRecord()).build();
    for (RuntimeHelper helper : compiler.getRecord().getRequiredHelpers()) {
      code = code.replace(helper.getText(), "");
    }
    return code;
  }

  private static String normalize(String code) {
    return code.replaceAll("\\s+", " ").trim();
  }
}
