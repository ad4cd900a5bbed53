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
public final class RewriteForOfTest extends TranspilationTestCase {

  @Test
  public void testArrayLoop() {
    test(
        "for (const x of items) { use(x); }",
        "for (var _i = 0, items_1 = items; _i < items_1.length; _i++) {"
            + " var x = items_1[_i]; use(x); }");
  }

  @Test
  public void testComplexIterableAndStatementBody() {
    test(
        "for (var x of f()) g(x);",
        "for (var _i = 0, _a = f(); _i < _a.length; _i++) { var x = _a[_i]; g(x); }");
  }

  @Test
  public void testAssignmentTarget() {
    test(
        "for (x of xs) {}",
        "for (var _i = 0, xs_1 = xs; _i < xs_1.length; _i++) { x = xs_1[_i]; }");
  }

  @Test
  public void testDestructuringTarget() {
    test(
        "for (const [k, v] of pairs) { use(k, v); }",
        "for (var _i = 0, pairs_1 = pairs; _i < pairs_1.length; _i++) {"
            + " var _a = pairs_1[_i]; var k = _a[0], v = _a[1]; use(k, v); }");
  }

  @Test
  public void testSecondLoopGetsNewIndex() {
    test(
        "for (var a of xs) {} for (var b of ys) {}",
        "for (var _i = 0, xs_1 = xs; _i < xs_1.length; _i++) { var a = xs_1[_i]; }"
            + " for (var _i_1 = 0, ys_1 = ys; _i_1 < ys_1.length; _i_1++) { var b = ys_1[_i_1]; }");
  }

  @Test
  public void testForAwait() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2017);
    testIncompletelyLowered(
        "async function f() { for await (const x of y) {} }", "for await...of");
  }

  @Test
  public void testLoopIsKeptAtEs2015() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2015);
    testSame("for (const x of items) { use(x); }");
  }
}
