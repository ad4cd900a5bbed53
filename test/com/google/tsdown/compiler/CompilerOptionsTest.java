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
import static org.junit.Assert.assertThrows;

import com.google.tsdown.compiler.CompilerOptions.LanguageMode;
import com.google.tsdown.compiler.CompilerOptions.ModuleKind;
import java.util.Properties;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CompilerOptionsTest {

  @Test
  public void testDefaults() {
    CompilerOptions options = new CompilerOptions();
    assertThat(options.getLanguageOut()).isEqualTo(LanguageMode.ECMASCRIPT5);
    assertThat(options.getModule()).isEqualTo(ModuleKind.COMMONJS);
    assertThat(options.shouldGenerateSourceMap()).isFalse();
    assertThat(options.getTypeOracle()).isSameInstanceAs(TypeOracle.EMPTY);
  }

  @Test
  public void testFromProperties() {
    Properties properties = new Properties();
    properties.setProperty("target", "es2017");
    properties.setProperty("module", "ESNext");
    properties.setProperty("inlineSourceMap", "true");
    properties.setProperty("inlineSources", "true");

    CompilerOptions options = CompilerOptions.fromProperties(properties);

    assertThat(options.getLanguageOut()).isEqualTo(LanguageMode.ECMASCRIPT_2017);
    assertThat(options.getModule()).isEqualTo(ModuleKind.ES2015);
    assertThat(options.getInlineSourceMap()).isTrue();
    assertThat(options.getIncludeSourceMap()).isFalse();
    assertThat(options.shouldGenerateSourceMap()).isTrue();
    assertThat(options.getEmbedSourcesContent()).isTrue();
  }

  @Test
  public void testFromPropertiesRejectsUnknownTarget() {
    Properties properties = new Properties();
    properties.setProperty("target", "es3");
    assertThrows(
        IllegalArgumentException.class, () -> CompilerOptions.fromProperties(properties));
  }

  @Test
  public void testLanguageModeFromString() {
    assertThat(LanguageMode.fromString("ES5")).isEqualTo(LanguageMode.ECMASCRIPT5);
    assertThat(LanguageMode.fromString("es6")).isEqualTo(LanguageMode.ECMASCRIPT_2015);
    assertThat(LanguageMode.fromString("ES2020")).isEqualTo(LanguageMode.ECMASCRIPT_2020);
    assertThat(LanguageMode.fromString("ECMASCRIPT_2022")).isEqualTo(LanguageMode.ECMASCRIPT_2022);
    assertThat(LanguageMode.fromString("esnext")).isEqualTo(LanguageMode.ECMASCRIPT_NEXT);
    assertThat(LanguageMode.fromString("es2099")).isNull();
  }

  @Test
  public void testNeedsLowering() {
    assertThat(LanguageMode.ECMASCRIPT5.needsLowering(LanguageMode.ECMASCRIPT_2015)).isTrue();
    assertThat(LanguageMode.ECMASCRIPT_2017.needsLowering(LanguageMode.ECMASCRIPT_2017))
        .isFalse();
    assertThat(LanguageMode.ECMASCRIPT_2019.isAtLeast(LanguageMode.ECMASCRIPT_2018)).isTrue();
  }

  @Test
  public void testModuleKindFromString() {
    assertThat(ModuleKind.fromString("CommonJS")).isEqualTo(ModuleKind.COMMONJS);
    assertThat(ModuleKind.fromString("none")).isEqualTo(ModuleKind.NONE);
    assertThat(ModuleKind.fromString("amd")).isNull();
  }
}
