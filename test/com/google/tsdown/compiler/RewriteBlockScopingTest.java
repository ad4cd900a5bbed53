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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RewriteBlockScopingTest extends TranspilationTestCase {

  @Test
  public void testLetAndConstBecomeVar() {
    test("let a = 1; const b = 2;", "var a = 1; var b = 2;");
  }

  @Test
  public void testShadowingBindingIsRenamed() {
    test(
        "function f() { let x = 1; { let x = 2; g(x); } return x; }",
        "function f() { var x = 1; { var x_1 = 2; g(x_1); } return x; }");
  }

  @Test
  public void testBindingReferencedOutsideItsBlockIsRenamed() {
    test(
        "if (c) { let y = 1; g(y); } g(y);",
        "if (c) { var y_1 = 1; g(y_1); } g(y);");
  }

  @Test
  public void testLetInLoopIsReinitialized() {
    test("while (c) { let y; f(y); }", "while (c) { var y = void 0; f(y); }");
  }

  @Test
  public void testLoopVariableCapturedByClosure() {
    testIncompletelyLowered(
        "for (let i = 0; i < 3; i++) { fs.push(function () { return i; }); }",
        "A block-scoped loop variable captured by a closure");
  }

  @Test
  public void testLoopVariableNotCaptured() {
    test(
        "for (let i = 0; i < 3; i++) { f(i); }",
        "for (var i = 0; i < 3; i++) { f(i); }");
  }
}
