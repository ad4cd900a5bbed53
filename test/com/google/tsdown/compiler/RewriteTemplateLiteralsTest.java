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
public final class RewriteTemplateLiteralsTest extends TranspilationTestCase {

  @Test
  public void testNoSubstitutions() {
    test("var s = `abc`;", "var s = \"abc\";");
  }

  @Test
  public void testSubstitutionsBecomeConcat() {
    test("var s = `a${b}c${d}`;", "var s = \"a\".concat(b, \"c\").concat(d);");
  }

  @Test
  public void testLeadingSubstitution() {
    test("var s = `${x}`;", "var s = \"\".concat(x);");
  }

  @Test
  public void testEscapesAreCooked() {
    test("var s = `a\\tb`;", "var s = \"a\\tb\";");
  }

  @Test
  public void testTaggedTemplate() {
    test(
        "tag`a${b}c`;",
        "var templateObject_1;"
            + " tag(templateObject_1 || (templateObject_1 ="
            + " __makeTemplateObject([\"a\", \"c\"], [\"a\", \"c\"])), b);");
    assertThat(getLastHelpers()).containsExactly(RuntimeHelper.MAKE_TEMPLATE_OBJECT);
  }

  @Test
  public void testTaggedTemplateWithInvalidEscape() {
    test(
        "tag`\\unicode`;",
        "var templateObject_1;"
            + " tag(templateObject_1 || (templateObject_1 ="
            + " __makeTemplateObject([void 0], [\"\\\\unicode\"])));");
  }
}
