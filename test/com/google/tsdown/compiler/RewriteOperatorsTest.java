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
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RewriteOperatorsTest extends TranspilationTestCase {

  @Before
  public void setUp() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2019);
  }

  @Test
  public void testCoalesceOnName() {
    test("let x = a ?? b;", "let x = a !== null && a !== void 0 ? a : b;");
  }

  @Test
  public void testCoalesceStoresComplexOperand() {
    test("let y = f() ?? 1;", "var _a; let y = (_a = f()) !== null && _a !== void 0 ? _a : 1;");
  }

  @Test
  public void testCoalesceInFunctionDeclaresTemporaryThere() {
    test(
        "function g() { return f() ?? 1; }",
        "function g() { var _a; return (_a = f()) !== null && _a !== void 0 ? _a : 1; }");
  }

  @Test
  public void testOptionalProperty() {
    test("let z = a?.b;", "let z = a === null || a === void 0 ? void 0 : a.b;");
  }

  @Test
  public void testOptionalLinkGuardsRestOfChain() {
    test(
        "let w = a.b?.c.d;",
        "var _a; let w = (_a = a.b) === null || _a === void 0 ? void 0 : _a.c.d;");
  }

  @Test
  public void testOptionalCallKeepsThis() {
    test(
        "o.m?.(1);",
        "var _a; (_a = o.m) === null || _a === void 0 ? void 0 : _a.call(o, 1);");
  }

  @Test
  public void testOptionalDelete() {
    test("delete a?.b;", "a === null || a === void 0 ? true : delete a.b;");
  }

  @Test
  public void testLogicalAssignment() {
    test("a ||= b; c &&= d;", "a || (a = b); c && (c = d);");
  }

  @Test
  public void testCoalescingAssignment() {
    test("a ??= b;", "a !== null && a !== void 0 ? a : a = b;");
  }

  @Test
  public void testCoalescingAssignmentKeepsCoalesceAtEs2020() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2020);
    test("o.x ??= 1;", "o.x ?? (o.x = 1);");
  }

  @Test
  public void testLogicalAssignmentToComputedMember() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2020);
    test("f()[k()] ||= 1;", "var _a, _b; (_a = f())[_b = k()] || (_a[_b] = 1);");
  }

  @Test
  public void testExponent() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2015);
    test("let p = 2 ** 3; x **= 2;", "let p = Math.pow(2, 3); x = Math.pow(x, 2);");
  }

  @Test
  public void testOperatorsAreKeptAtEs2021() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2021);
    testSame("let x = a ?? b?.c; a ||= b;");
  }
}
