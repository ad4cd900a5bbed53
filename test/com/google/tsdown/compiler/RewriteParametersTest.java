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
public final class RewriteParametersTest extends TranspilationTestCase {

  @Test
  public void testDefaultAndRest() {
    test(
        "function f(a, b = 1, ...rest) { return rest; }",
        "function f(a, b) {"
            + " if (b === void 0) { b = 1; }"
            + " var rest = [];"
            + " for (var _i = 2; _i < arguments.length; _i++) { rest[_i - 2] = arguments[_i]; }"
            + " return rest;"
            + " }");
  }

  @Test
  public void testRestOnly() {
    test(
        "function g(...xs) {}",
        "function g() {"
            + " var xs = [];"
            + " for (var _i = 0; _i < arguments.length; _i++) { xs[_i] = arguments[_i]; }"
            + " }");
  }

  @Test
  public void testDefaultsFollowDirectives() {
    test(
        "function h(a = 0) { \"use strict\"; return a; }",
        "function h(a) { \"use strict\"; if (a === void 0) { a = 0; } return a; }");
  }

  @Test
  public void testParametersAreKeptAtEs2015() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2015);
    testSame("function f(a, b = 1, ...rest) { }");
  }
}
