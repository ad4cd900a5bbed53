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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RewriteSpreadTest extends TranspilationTestCase {

  @Test
  public void testCallWithOnlySpread() {
    test("f(...a);", "f.apply(void 0, a);");
  }

  @Test
  public void testMethodCall() {
    test("o.f(a, ...b);", "o.f.apply(o, __spreadArray([a], b, false));");
    assertThat(getLastHelpers()).containsExactly(RuntimeHelper.SPREAD_ARRAY);
  }

  @Test
  public void testComplexReceiverIsEvaluatedOnce() {
    test("g().f(...b);", "var _a; (_a = g()).f.apply(_a, b);");
  }

  @Test
  public void testArrayLiteral() {
    test("var x = [a, ...b];", "var x = __spreadArray([a], b, true);");
  }

  @Test
  public void testArrayLiteralStartingWithSpread() {
    test("var x = [...b, c];", "var x = __spreadArray(__spreadArray([], b, true), [c], false);");
  }

  @Test
  public void testNew() {
    test(
        "new C(...args);",
        "new (C.bind.apply(C, __spreadArray([void 0], args, false)))();");
  }

  @Test
  public void testSpreadInOptionalCall() {
    testIncompletelyLowered("o?.f(...a);", "Spread in an optional call");
  }
}
