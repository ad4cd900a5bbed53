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

import com.google.tsdown.compiler.CompilerOptions.LanguageMode;
import com.google.tsdown.compiler.CompilerOptions.ModuleKind;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class StripTypeScriptTest extends TranspilationTestCase {

  @Before
  public void setUp() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2022);
    setModule(ModuleKind.ES2015);
  }

  @Test
  public void testTypeDeclarationsAreElided() {
    test(
        "interface I { x: number; } type T = string; let a: I = { x: 1 };",
        "let a = { x: 1 };");
  }

  @Test
  public void testAssertionsAreUnwrapped() {
    test(
        "let b = x as any; let c = <string>y; let d = z!;",
        "let b = x; let c = y; let d = z;");
  }

  @Test
  public void testAnnotationsAreDropped() {
    test("function f(a: number, b?: string): void {}", "function f(a, b) { }");
  }

  @Test
  public void testAmbientDeclarationsAreElided() {
    test("declare const x: number; declare function g(): void; let z = 1;", "let z = 1;");
  }

  @Test
  public void testParameterProperties() {
    test(
        "class A { constructor(private x: number, public y = 1) {} }",
        "class A { constructor(x, y = 1) { this.x = x; this.y = y; } }");
  }

  @Test
  public void testParameterPropertiesFollowSuperCall() {
    test(
        "class B extends A { constructor(readonly x: number) { super(); f(); } }",
        "class B extends A { constructor(x) { super(); this.x = x; f(); } }");
  }

  @Test
  public void testNumericEnum() {
    test(
        "enum E { A, B = 5, C }",
        "var E; (function (E) {"
            + " E[E[\"A\"] = 0] = \"A\";"
            + " E[E[\"B\"] = 5] = \"B\";"
            + " E[E[\"C\"] = 6] = \"C\";"
            + " })(E || (E = {}));");
  }

  @Test
  public void testStringEnum() {
    test(
        "enum S { A = \"a\" }",
        "var S; (function (S) { S[\"A\"] = \"a\"; })(S || (S = {}));");
  }

  @Test
  public void testConstantMemberExpressionsAreFolded() {
    test(
        "enum F { A = 1 << 2, B = A | 1, C = -B }",
        "var F; (function (F) {"
            + " F[F[\"A\"] = 4] = \"A\";"
            + " F[F[\"B\"] = 5] = \"B\";"
            + " F[F[\"C\"] = -5] = \"C\";"
            + " })(F || (F = {}));");
  }

  @Test
  public void testConstEnumMembersAreInlined() {
    test("const enum C { X = 1, Y = X + 1 } let y = C.Y;", "let y = 2 /* C.Y */;");
  }

  @Test
  public void testTypeOnlyImportsAreElided() {
    test(
        "import { T } from \"./t\"; import { v } from \"./v\"; let x: T = v;",
        "import { v } from \"./v\"; let x = v;");
  }

  @Test
  public void testEnumMemberWithoutInitializerAfterStringMember() {
    testError(
        "enum E { A = \"a\", B }", StripTypeScript.ENUM_MEMBER_NEEDS_INITIALIZER);
  }

  @Test
  public void testEnumValuesFromTypeOracleOverrideFolding() {
    getOptions()
        .setTypeOracle(
            new TypeOracle() {
              @Override
              public Object getEnumMemberValue(int memberId) {
                return 3.0;
              }
            });
    test(
        "enum E { A = 1, B = compute() }",
        "var E; (function (E) {"
            + " E[E[\"A\"] = 3] = \"A\";"
            + " E[E[\"B\"] = 3] = \"B\";"
            + " })(E || (E = {}));");
  }

  @Test
  public void testImportKindFromTypeOracle() {
    getOptions()
        .setTypeOracle(
            new TypeOracle() {
              @Override
              public Boolean isTypeOnlyImport(int importSpecId) {
                return true;
              }
            });
    test("import { v } from \"./v\"; let x = v;", "let x = v;");
  }

  @Test
  public void testNamespace() {
    test(
        "namespace N {"
            + " export const x = 1;"
            + " function f() { return x; }"
            + " export function g() { return f(); }"
            + " }",
        "var N; (function (N) {"
            + " N.x = 1;"
            + " function f() { return N.x; }"
            + " function g() { return f(); }"
            + " N.g = g;"
            + " })(N || (N = {}));");
  }

  @Test
  public void testDottedNamespaceIsNested() {
    test(
        "namespace A.B { export let y = 2; }",
        "var A; (function (A) {"
            + " var B; (function (B) { B.y = 2; })(B = A.B || (A.B = {}));"
            + " })(A || (A = {}));");
  }

  @Test
  public void testEnumExportedFromNamespace() {
    test(
        "namespace N { export enum E { A } }",
        "var N; (function (N) {"
            + " var E; (function (E) { E[E[\"A\"] = 0] = \"A\"; })(E = N.E || (N.E = {}));"
            + " })(N || (N = {}));");
  }

  @Test
  public void testMergedNamespaceIsDeclaredOnce() {
    test(
        "namespace M { export const a = 1; } namespace M { export const b = 2; }",
        "var M; (function (M) { M.a = 1; })(M || (M = {}));"
            + " (function (M) { M.b = 2; })(M || (M = {}));");
  }

  @Test
  public void testExportedNamespace() {
    test(
        "export namespace N { export const x = 1; }",
        "export var N; (function (N) { N.x = 1; })(N || (N = {}));");
  }

  @Test
  public void testNamespaceOfTypesIsElided() {
    test("namespace T { export interface I { a: number; } } let z = 1;", "let z = 1;");
  }

  @Test
  public void testAmbientModuleIsElided() {
    test("module \"m\" { export const q: number; } let z = 1;", "let z = 1;");
  }
}
