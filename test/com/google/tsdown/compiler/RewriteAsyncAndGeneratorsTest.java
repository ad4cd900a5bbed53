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
public final class RewriteAsyncAndGeneratorsTest extends TranspilationTestCase {

  private static String awaiter(String hoisted, String generatorBody) {
    return "return __awaiter(this, void 0, void 0, function () {"
        + hoisted
        + " return __generator(this, function (_a) { "
        + generatorBody
        + " }); });";
  }

  @Test
  public void testSingleAwait() {
    test(
        "async function f() { await foo(); }",
        "function f() {"
            + awaiter(
                "",
                "switch (_a.label) {"
                    + " case 0: return [4 /*yield*/, foo()];"
                    + " case 1: _a.sent(); return [2 /*return*/];"
                    + " }")
            + " }");
    assertThat(getLastHelpers())
        .containsExactly(RuntimeHelper.AWAITER, RuntimeHelper.GENERATOR)
        .inOrder();
  }

  @Test
  public void testNoSuspensionNeedsNoSwitch() {
    test(
        "async function f() { return 1; }",
        "function f() {" + awaiter("", "return [2 /*return*/, 1];") + " }");
  }

  @Test
  public void testVariableAssignedFromAwait() {
    test(
        "async function f() { var x = await foo(); return x; }",
        "function f() {"
            + awaiter(
                " var x;",
                "switch (_a.label) {"
                    + " case 0: return [4 /*yield*/, foo()];"
                    + " case 1: x = _a.sent(); return [2 /*return*/, x];"
                    + " }")
            + " }");
  }

  @Test
  public void testOperandsBeforeAwaitAreStashed() {
    test(
        "async function f(a, b) { return a + await b; }",
        "function f(a, b) {"
            + awaiter(
                " var _b;",
                "switch (_a.label) {"
                    + " case 0: _b = a; return [4 /*yield*/, b];"
                    + " case 1: return [2 /*return*/, _b + _a.sent()];"
                    + " }")
            + " }");
  }

  @Test
  public void testTryFinally() {
    test(
        "async function f() { try { await foo(); } finally { await bar(); } }",
        "function f() {"
            + awaiter(
                "",
                "switch (_a.label) {"
                    + " case 0: _a.trys.push([0, , 2, 4]); return [4 /*yield*/, foo()];"
                    + " case 1: _a.sent(); return [3 /*break*/, 4];"
                    + " case 2: return [4 /*yield*/, bar()];"
                    + " case 3: _a.sent(); return [7 /*endfinally*/];"
                    + " case 4: return [2 /*return*/];"
                    + " }")
            + " }");
  }

  @Test
  public void testTryCatchRenamesTheCatchVariable() {
    test(
        "async function f() { try { await foo(); } catch (e) { log(e); } }",
        "function f() {"
            + awaiter(
                " var e_1;",
                "switch (_a.label) {"
                    + " case 0: _a.trys.push([0, 2, , 3]); return [4 /*yield*/, foo()];"
                    + " case 1: _a.sent(); return [3 /*break*/, 3];"
                    + " case 2: e_1 = _a.sent(); log(e_1); return [3 /*break*/, 3];"
                    + " case 3: return [2 /*return*/];"
                    + " }")
            + " }");
  }

  @Test
  public void testWhileLoop() {
    test(
        "async function f() { while (c) { await x; } }",
        "function f() {"
            + awaiter(
                "",
                "switch (_a.label) {"
                    + " case 0: if (!c) return [3 /*break*/, 2]; return [4 /*yield*/, x];"
                    + " case 1: _a.sent(); return [3 /*break*/, 0];"
                    + " case 2: return [2 /*return*/];"
                    + " }")
            + " }");
  }

  @Test
  public void testBreakOutOfFlattenedLoop() {
    test(
        "async function f() { while (c) { await x; if (d) break; } }",
        "function f() {"
            + awaiter(
                "",
                "switch (_a.label) {"
                    + " case 0: if (!c) return [3 /*break*/, 2]; return [4 /*yield*/, x];"
                    + " case 1: _a.sent(); if (d) return [3 /*break*/, 2];"
                    + " return [3 /*break*/, 0];"
                    + " case 2: return [2 /*return*/];"
                    + " }")
            + " }");
  }

  @Test
  public void testArgumentsIsAliased() {
    test(
        "async function f() { return arguments.length; }",
        "function f() {"
            + " return __awaiter(this, arguments, void 0, function () {"
            + " var _arguments = arguments;"
            + " return __generator(this, function (_a) {"
            + " return [2 /*return*/, _arguments.length];"
            + " }); }); }");
  }

  @Test
  public void testGenerator() {
    test(
        "function* g() { yield 1; yield 2; }",
        "function g() {"
            + " return __generator(this, function (_a) {"
            + " switch (_a.label) {"
            + " case 0: return [4 /*yield*/, 1];"
            + " case 1: _a.sent(); return [4 /*yield*/, 2];"
            + " case 2: _a.sent(); return [2 /*return*/];"
            + " } }); }");
    assertThat(getLastHelpers()).containsExactly(RuntimeHelper.GENERATOR);
  }

  @Test
  public void testDelegatingYield() {
    test(
        "function* g() { yield* other(); }",
        "function g() {"
            + " return __generator(this, function (_a) {"
            + " switch (_a.label) {"
            + " case 0: return [5 /*yield**/, __values(other())];"
            + " case 1: _a.sent(); return [2 /*return*/];"
            + " } }); }");
    assertThat(getLastHelpers())
        .containsExactly(RuntimeHelper.GENERATOR, RuntimeHelper.VALUES)
        .inOrder();
  }

  @Test
  public void testEachFunctionGetsItsOwnStateName() {
    test(
        "async function f() { return 1; } async function g() { return 2; }",
        "function f() {"
            + awaiter("", "return [2 /*return*/, 1];")
            + " } function g() {"
            + " return __awaiter(this, void 0, void 0, function () {"
            + " return __generator(this, function (_b) { return [2 /*return*/, 2]; }); }); }");
  }

  @Test
  public void testAwaitBecomesYieldForEs2015() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2015);
    test(
        "async function f() { await g(); }",
        "function f() {"
            + " return __awaiter(this, void 0, void 0, function* () { yield g(); }); }");
    assertThat(getLastHelpers()).containsExactly(RuntimeHelper.AWAITER);
  }

  @Test
  public void testAsyncArrowKeepsExpressionBodyForEs2015() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2015);
    test(
        "const f = async () => await g();",
        "const f = () => __awaiter(this, void 0, void 0, function* () {"
            + " return yield g(); });");
  }

  @Test
  public void testAsyncFunctionsAreKeptForEs2017() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2017);
    testSame("async function f() { await g(); }");
  }

  @Test
  public void testAsyncGeneratorIsIncompletelyLowered() {
    setLanguageOut(LanguageMode.ECMASCRIPT_2017);
    testIncompletelyLowered(
        "async function* f() { yield 1; }", "An async generator function");
  }

  @Test
  public void testAwaitInConditionalBranch() {
    test(
        "async function f(c, x, y) { return c ? await x : y; }",
        "function f(c, x, y) {"
            + awaiter(
                " var _b;",
                "switch (_a.label) {"
                    + " case 0: if (!c) return [3 /*break*/, 2]; return [4 /*yield*/, x];"
                    + " case 1: _b = _a.sent(); return [3 /*break*/, 3];"
                    + " case 2: _b = y; _a.label = 3;"
                    + " case 3: return [2 /*return*/, _b];"
                    + " }")
            + " }");
  }

  @Test
  public void testAwaitOnRightOfAnd() {
    test(
        "async function f(a, b) { return a && await b; }",
        "function f(a, b) {"
            + awaiter(
                " var _b;",
                "switch (_a.label) {"
                    + " case 0: _b = a; if (!_b) return [3 /*break*/, 2];"
                    + " return [4 /*yield*/, b];"
                    + " case 1: _b = _a.sent(); _a.label = 2;"
                    + " case 2: return [2 /*return*/, _b];"
                    + " }")
            + " }");
  }

  @Test
  public void testAwaitOnRightOfNullishCoalescing() {
    String code = transpile("async function f(a, b) { return a ?? await b; }");
    assertThat(code).contains("if (!(a !== null && a !== void 0)) return [3 /*break*/, 1];");
    assertThat(code).contains("case 1: return [4 /*yield*/, b];");
    assertThat(code).contains("return [2 /*return*/, _b];");
    assertThat(code).doesNotContain("await ");
  }

  @Test
  public void testAwaitInForHead() {
    test(
        "async function f() { for (var i = await a(); i < await b(); i += await c()) g(i); }",
        "function f() {"
            + awaiter(
                " var i, _b, _c;",
                "switch (_a.label) {"
                    + " case 0: return [4 /*yield*/, a()];"
                    + " case 1: i = _a.sent(); _a.label = 2;"
                    + " case 2: _b = i; return [4 /*yield*/, b()];"
                    + " case 3: if (!(_b < _a.sent())) return [3 /*break*/, 6]; g(i);"
                    + " _a.label = 4;"
                    + " case 4: _c = i; return [4 /*yield*/, c()];"
                    + " case 5: i = _c + _a.sent(); return [3 /*break*/, 2];"
                    + " case 6: return [2 /*return*/];"
                    + " }")
            + " }");
  }

  @Test
  public void testAwaitInSwitchDiscriminant() {
    test(
        "async function f() { switch (await g()) { case 1: return 2; } }",
        "function f() {"
            + awaiter(
                "",
                "switch (_a.label) {"
                    + " case 0: return [4 /*yield*/, g()];"
                    + " case 1: switch (_a.sent()) { case 1: return [3 /*break*/, 2]; }"
                    + " return [3 /*break*/, 3];"
                    + " case 2: return [2 /*return*/, 2];"
                    + " case 3: return [2 /*return*/];"
                    + " }")
            + " }");
  }

  @Test
  public void testAwaitInSwitchCaseBody() {
    test(
        "async function f(x) { switch (x) { case 1: await g(); break; default: h(); } }",
        "function f(x) {"
            + awaiter(
                "",
                "switch (_a.label) {"
                    + " case 0: switch (x) { case 1: return [3 /*break*/, 1]; }"
                    + " return [3 /*break*/, 3];"
                    + " case 1: return [4 /*yield*/, g()];"
                    + " case 2: _a.sent(); return [3 /*break*/, 4];"
                    + " case 3: h(); _a.label = 4;"
                    + " case 4: return [2 /*return*/];"
                    + " }")
            + " }");
  }

  @Test
  public void testAwaitInDefaultParameter() {
    String code = transpile("async function f(a = await g()) { return a; }");
    assertThat(code).startsWith("function f(a) {");
    assertThat(code).contains("if (!(a === void 0)) return [3 /*break*/, 2];");
    assertThat(code).contains("return [4 /*yield*/, g()]; case 1: a = _a.sent();");
    assertThat(code).doesNotContain("await ");
  }

  @Test
  public void testAwaitInComputedKey() {
    String code = transpile("async function f(v) { return { [await k()]: v }; }");
    assertThat(code).contains("return [4 /*yield*/, k()];");
    assertThat(code).containsMatch("_[a-z]\\.sent\\(\\)");
    assertThat(code).doesNotContain("await ");
    assertThat(code).doesNotContain("[await");
  }

  @Test
  public void testAwaitInCallSpread() {
    String code = transpile("async function f(xs) { g(...(await xs)); }");
    assertThat(code).contains("return [4 /*yield*/, xs];");
    assertThat(code).contains("_b = g;");
    assertThat(code).containsMatch("\\.call\\(_b, .*_a\\.sent\\(\\)\\);");
    assertThat(code).doesNotContain("await ");
  }

  @Test
  public void testAwaitInArraySpread() {
    String code = transpile("async function f(a, xs) { return [a, ...(await xs)]; }");
    assertThat(code).contains("return [4 /*yield*/, xs];");
    assertThat(code).contains("__spreadArray");
    assertThat(code).contains("_a.sent(), true)");
    assertThat(code).doesNotContain("await ");
  }

  @Test
  public void testAwaitInTaggedTemplate() {
    String code = transpile("async function f() { return tag`a${await b()}c`; }");
    assertThat(code).contains("__makeTemplateObject([\"a\", \"c\"], [\"a\", \"c\"])");
    assertThat(code).contains("return [4 /*yield*/, b()];");
    assertThat(code).containsMatch("return \\[2 /\\*return\\*/, .*_a\\.sent\\(\\)\\)\\];");
    assertThat(code).doesNotContain("await ");
  }

  @Test
  public void testReturnInsideTryFinally() {
    test(
        "async function f() { try { return await foo(); } finally { bar(); } }",
        "function f() {"
            + awaiter(
                "",
                "switch (_a.label) {"
                    + " case 0: _a.trys.push([0, , 2, 3]); return [4 /*yield*/, foo()];"
                    + " case 1: return [2 /*return*/, _a.sent()];"
                    + " case 2: { bar(); } return [7 /*endfinally*/];"
                    + " case 3: return [2 /*return*/];"
                    + " }")
            + " }");
  }

  @Test
  public void testLabeledBreakThroughFinally() {
    test(
        "async function f() {"
            + " outer: { try { await g(); break outer; } finally { h(); } i(); } }",
        "function f() {"
            + awaiter(
                "",
                "switch (_a.label) {"
                    + " case 0: _a.trys.push([0, , 2, 3]); return [4 /*yield*/, g()];"
                    + " case 1: _a.sent(); return [3 /*break*/, 4];"
                    + " case 2: { h(); } return [7 /*endfinally*/];"
                    + " case 3: i(); _a.label = 4;"
                    + " case 4: return [2 /*return*/];"
                    + " }")
            + " }");
  }

  @Test
  public void testSyncTryFinallyIsUnchanged() {
    testSame("function f() { try { g(); } finally { h(); } }");
    String once = transpile("function f() { try { return g(); } finally { h(); } }");
    assertThat(transpile(once)).isEqualTo(once);
  }
}
