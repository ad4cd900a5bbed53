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

import com.google.tsdown.compiler.CompilerOptions.LanguageMode;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RewriteModulesTest extends TranspilationTestCase {

  private static final String PREAMBLE =
      "\"use strict\"; Object.defineProperty(exports, \"__esModule\", { value: true }); ";

  @Before
  public void setUp() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2022);
  }

  @Test
  public void testScriptIsUntouched() {
    testSame("let x = 1;");
  }

  @Test
  public void testNamedImport() {
    test(
        "import { bar } from \"./foo\"; bar(); let x = bar;",
        PREAMBLE + "var foo_1 = require(\"./foo\"); (0, foo_1.bar)(); let x = foo_1.bar;");
  }

  @Test
  public void testDefaultAndNamespaceImports() {
    test(
        "import d from \"./d\"; import * as ns from \"ns\"; f(d, ns.x);",
        PREAMBLE + "var d_1 = require(\"./d\"); var ns = require(\"ns\"); f(d_1.default, ns.x);");
  }

  @Test
  public void testSideEffectImport() {
    test("import \"./side\";", PREAMBLE + "require(\"./side\");");
  }

  @Test
  public void testShadowedImportIsNotRewritten() {
    test(
        "import { a } from \"./a\"; function f(a) { return a; }",
        PREAMBLE + "var a_1 = require(\"./a\"); function f(a) { return a; }");
  }

  @Test
  public void testExportedVariables() {
    test(
        "export const a = 1, b = 2; log(a);",
        PREAMBLE
            + "exports.b = exports.a = void 0;"
            + " exports.a = 1, exports.b = 2;"
            + " log(exports.a);");
  }

  @Test
  public void testExportedFunctionIsHoisted() {
    test("f(); export function g() {}", PREAMBLE + "exports.g = g; f(); function g() { }");
  }

  @Test
  public void testExportedClass() {
    test(
        "export class C {}",
        PREAMBLE + "exports.C = void 0; class C { } exports.C = C;");
  }

  @Test
  public void testExportDefaultExpression() {
    test("export default 42;", PREAMBLE + "exports.default = void 0; exports.default = 42;");
  }

  @Test
  public void testRenamedLocalExportIsAssignedOnce() {
    test(
        "let a = 1; export { a as b };",
        PREAMBLE + "exports.b = void 0; let a = 1; exports.b = a;");
  }

  @Test
  public void testLocalExportSpecsAreAssignedAfterDeclaration() {
    test(
        "let a = 1; a = 2; export { a as b };",
        PREAMBLE
            + "exports.b = void 0;"
            + " let a = 1; exports.b = a;"
            + " exports.b = a = 2;");
  }

  @Test
  public void testReexport() {
    test(
        "export { x as y } from \"./m\";",
        PREAMBLE
            + "exports.y = void 0;"
            + " var m_1 = require(\"./m\");"
            + " Object.defineProperty(exports, \"y\","
            + " { enumerable: true, get: function () { return m_1.x; } });");
  }

  @Test
  public void testExportStar() {
    test(
        "export * from \"./m\";",
        PREAMBLE + "__exportStar(require(\"./m\"), exports);");
    assertThat(getLastHelpers())
        .containsExactly(RuntimeHelper.CREATE_BINDING, RuntimeHelper.EXPORT_STAR)
        .inOrder();
  }

  @Test
  public void testTypeOnlyImportFileIsStillAModule() {
    test(
        "import type { T } from \"./t\"; let x: T;",
        PREAMBLE + "let x;");
  }

  @Test
  public void testModuleBaseName() {
    assertThat(RewriteModules.moduleBaseName("./foo-bar.js")).isEqualTo("foo_bar");
    assertThat(RewriteModules.moduleBaseName("@scope/pkg")).isEqualTo("pkg");
    assertThat(RewriteModules.moduleBaseName("./2d")).isEqualTo("_2d");
  }
}
