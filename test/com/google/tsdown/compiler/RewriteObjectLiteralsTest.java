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
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RewriteObjectLiteralsTest extends TranspilationTestCase {

  @Test
  public void testShorthandProperty() {
    test("var o = { a, b: 2 };", "var o = { a: a, b: 2 };");
  }

  @Test
  public void testMethod() {
    test("var o = { m() { return 1; } };", "var o = { m: function () { return 1; } };");
  }

  @Test
  public void testComputedProperties() {
    test(
        "var o = { a: 1, [k]: 2, b };",
        "var _a; var o = (_a = { a: 1 }, _a[k] = 2, _a.b = b, _a);");
  }

  @Test
  public void testComputedAccessor() {
    test(
        "var o = { [k]: 1, get v() { return 2; } };",
        "var _a; var o = (_a = {}, _a[k] = 1,"
            + " Object.defineProperty(_a, \"v\","
            + " { get: function () { return 2; }, enumerable: true, configurable: true }),"
            + " _a);");
  }

  @Test
  public void testSpread() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2017);
    test(
        "let o = { a: 1, ...b, c: 2 };",
        "let o = __assign(__assign({ a: 1 }, b), { c: 2 });");
    assertThat(getLastHelpers()).containsExactly(RuntimeHelper.ASSIGN);
  }

  @Test
  public void testLeadingSpread() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2017);
    test("let o = { ...b };", "let o = __assign({}, b);");
  }

  @Test
  public void testSpreadIsKeptAtEs2018() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2018);
    testSame("let o = { ...b, [k]: 1 };");
  }
}
