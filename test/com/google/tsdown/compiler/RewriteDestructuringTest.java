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
public final class RewriteDestructuringTest extends TranspilationTestCase {

  @Test
  public void testObjectPattern() {
    test("var { a, b } = obj;", "var a = obj.a, b = obj.b;");
  }

  @Test
  public void testArrayPatternWithHole() {
    test("var [x, , y] = arr;", "var x = arr[0], y = arr[2];");
  }

  @Test
  public void testComplexValueIsStored() {
    test("var [p, q] = f();", "var _a = f(), p = _a[0], q = _a[1];");
  }

  @Test
  public void testDefaultValue() {
    test("var { a = 1 } = f();", "var _a = f().a, a = _a === void 0 ? 1 : _a;");
  }

  @Test
  public void testObjectRest() {
    test("var { a, ...rest } = obj;", "var a = obj.a, rest = __rest(obj, [\"a\"]);");
    assertThat(getLastHelpers()).containsExactly(RuntimeHelper.REST);
  }

  @Test
  public void testArrayRest() {
    test("var [h, ...t] = xs;", "var h = xs[0], t = xs.slice(1);");
  }

  @Test
  public void testAssignment() {
    test("[a, b] = [b, a];", "var _a; _a = [b, a], a = _a[0], b = _a[1];");
  }

  @Test
  public void testAssignmentWhoseValueIsUsed() {
    test("x = { a } = o;", "x = (a = o.a, o);");
  }

  @Test
  public void testParameterPattern() {
    test(
        "function f({ a, b }) { return a + b; }",
        "function f(_a) { var a = _a.a, b = _a.b; return a + b; }");
  }

  @Test
  public void testParameterPatternWithDefault() {
    test(
        "function d({ a } = {}) { return a; }",
        "function d(_a) { var a = (_a === void 0 ? {} : _a).a; return a; }");
  }

  @Test
  public void testCatchPattern() {
    test(
        "try { f(); } catch ({ message }) { log(message); }",
        "try { f(); } catch (_a) { var message = _a.message; log(message); }");
  }

  @Test
  public void testOptionalCatchBinding() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2018);
    test("try { f(); } catch { g(); }", "try { f(); } catch (_a) { g(); }");
  }

  @Test
  public void testPatternsAreKeptAtEs2015() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2015);
    testSame("var { a, b: [c = 1] } = obj;");
  }
}
