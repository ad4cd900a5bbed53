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
public final class RewriteClassesTest extends TranspilationTestCase {

  @Test
  public void testClassBecomesFunction() {
    test(
        "class A { constructor(x) { this.x = x; } m() { return 1; } }",
        "var A = (function () {"
            + " function A(x) { this.x = x; }"
            + " A.prototype.m = function () { return 1; };"
            + " return A;"
            + " })();");
  }

  @Test
  public void testDerivedClass() {
    test(
        "class B extends A { constructor() { super(1); this.y = 2; } }",
        "var B = (function (_super) {"
            + " __extends(B, _super);"
            + " function B() {"
            + " var _this = _super.call(this, 1) || this; _this.y = 2; return _this;"
            + " }"
            + " return B;"
            + " })(A);");
    assertThat(getLastHelpers()).containsExactly(RuntimeHelper.EXTENDS);
  }

  @Test
  public void testDerivedClassWithoutConstructor() {
    test(
        "class C extends A {}",
        "var C = (function (_super) {"
            + " __extends(C, _super);"
            + " function C() { return _super !== null && _super.apply(this, arguments) || this; }"
            + " return C;"
            + " })(A);");
  }

  @Test
  public void testSuperMethodCall() {
    test(
        "class B extends A { m() { return super.m(1); } }",
        "var B = (function (_super) {"
            + " __extends(B, _super);"
            + " function B() { return _super !== null && _super.apply(this, arguments) || this; }"
            + " B.prototype.m = function () { return _super.prototype.m.call(this, 1); };"
            + " return B;"
            + " })(A);");
  }

  @Test
  public void testAccessorsShareOneDefinition() {
    test(
        "class P { get v() { return 1; } set v(x) {} }",
        "var P = (function () {"
            + " function P() { }"
            + " Object.defineProperty(P.prototype, \"v\", {"
            + " get: function () { return 1; },"
            + " set: function (x) { },"
            + " enumerable: false,"
            + " configurable: true"
            + " });"
            + " return P;"
            + " })();");
  }

  @Test
  public void testStaticFieldInFunctionClass() {
    test(
        "class S { static a = 1; }",
        "var S = (function () { function S() { } S.a = 1; return S; })();");
  }

  @Test
  public void testFieldsMoveIntoConstructor() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2015);
    test(
        "class F { x = 1; static y = 2; }",
        "class F { constructor() { this.x = 1; } } F.y = 2;");
  }

  @Test
  public void testFieldsFollowParameterProperties() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2015);
    test(
        "class G { x = 1; constructor(private p: number) { f(); } }",
        "class G { constructor(p) { this.p = p; this.x = 1; f(); } }");
  }

  @Test
  public void testFieldsFollowParameterPropertiesInEs5() {
    test(
        "class G { x = 1; constructor(private p: number) { f(); } }",
        "var G = (function () {"
            + " function G(p) { this.p = p; this.x = 1; f(); }"
            + " return G;"
            + " })();");
  }

  @Test
  public void testClassExpressionWithStaticField() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2015);
    test(
        "let K = class { static z = 1; };",
        "var _a; let K = (_a = class { }, _a.z = 1, _a);");
  }

  @Test
  public void testFieldsAreKeptAtEs2022() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2022);
    testSame("class F { x = 1; }");
  }

  @Test
  public void testDecorators() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2022);
    test(
        "@dec class D { @m method() {} }",
        "let D = class D { method() { } };"
            + " __decorate([m], D.prototype, \"method\", null);"
            + " D = __decorate([dec], D);");
    assertThat(getLastHelpers()).containsExactly(RuntimeHelper.DECORATE);
  }
}
