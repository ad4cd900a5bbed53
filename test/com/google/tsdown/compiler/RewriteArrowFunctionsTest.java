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
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RewriteArrowFunctionsTest extends TranspilationTestCase {

  @Test
  public void testExpressionBody() {
    test("var g = (a) => a + 1;", "var g = function (a) { return a + 1; };");
  }

  @Test
  public void testCapturesThis() {
    test(
        "function f() { return () => this.x; }",
        "function f() { var _this = this; return function () { return _this.x; }; }");
  }

  @Test
  public void testCapturesArguments() {
    test(
        "function h() { return () => arguments[0]; }",
        "function h() {"
            + " var _arguments = arguments;"
            + " return function () { return _arguments[0]; };"
            + " }");
  }

  @Test
  public void testNestedArrowsShareCapture() {
    test(
        "function k() { return () => () => this; }",
        "function k() {"
            + " var _this = this;"
            + " return function () { return function () { return _this; }; };"
            + " }");
  }

  @Test
  public void testThisInNestedFunctionIsNotCaptured() {
    test(
        "var o = () => function () { return this; };",
        "var o = function () { return function () { return this; }; };");
  }

  @Test
  public void testArrowsAreKeptAtEs2015() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2015);
    testSame("let g = (a) => a + 1;");
  }
}
