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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Ascii;
import java.util.Properties;
import org.jspecify.annotations.Nullable;

/** Options for one compilation. */
public class CompilerOptions {

  private LanguageMode languageOut = LanguageMode.ECMASCRIPT5;
  private ModuleKind module = ModuleKind.COMMONJS;
  private boolean includeSourceMap = false;
  private boolean inlineSourceMap = false;
  private boolean embedSourcesContent = false;
  private @Nullable String sourceMapOutputPath = null;
  private boolean emitUseStrict = false;
  private String indent = "    ";
  private TypeOracle typeOracle = TypeOracle.EMPTY;

  public CompilerOptions() {}

  /**
   * Reads options from the keys a conformance harness uses: {@code target}, {@code module},
   * {@code sourceMap}, {@code inlineSourceMap} and {@code inlineSources}. Missing keys keep their
   * defaults.
   *
   * @throws IllegalArgumentException for an unknown target or module kind
   */
  public static CompilerOptions fromProperties(Properties properties) {
    CompilerOptions options = new CompilerOptions();
    String target = properties.getProperty("target");
    if (target != null) {
      LanguageMode mode = LanguageMode.fromString(target);
      if (mode == null) {
        throw new IllegalArgumentException("Unknown target: " + target);
      }
      options.setLanguageOut(mode);
    }
    String module = properties.getProperty("module");
    if (module != null) {
      ModuleKind kind = ModuleKind.fromString(module);
      if (kind == null) {
        throw new IllegalArgumentException("Unknown module kind: " + module);
      }
      options.setModule(kind);
    }
    options.setIncludeSourceMap(
        Boolean.parseBoolean(properties.getProperty("sourceMap", "false")));
    options.setInlineSourceMap(
        Boolean.parseBoolean(properties.getProperty("inlineSourceMap", "false")));
    options.setEmbedSourcesContent(
        Boolean.parseBoolean(properties.getProperty("inlineSources", "false")));
    return options;
  }

  public LanguageMode getLanguageOut() {
    return languageOut;
  }

  public void setLanguageOut(LanguageMode languageOut) {
    this.languageOut = checkNotNull(languageOut);
  }

  public ModuleKind getModule() {
    return module;
  }

  public void setModule(ModuleKind module) {
    this.module = checkNotNull(module);
  }

  /** Whether a source map is produced, either as a separate document or inline. */
  public boolean shouldGenerateSourceMap() {
    return includeSourceMap || inlineSourceMap;
  }

  public boolean getIncludeSourceMap() {
    return includeSourceMap;
  }

  public void setIncludeSourceMap(boolean includeSourceMap) {
    this.includeSourceMap = includeSourceMap;
  }

  public boolean getInlineSourceMap() {
    return inlineSourceMap;
  }

  /** Appends the map to the output as a base64 data URI instead of returning it separately. */
  public void setInlineSourceMap(boolean inlineSourceMap) {
    this.inlineSourceMap = inlineSourceMap;
  }

  public boolean getEmbedSourcesContent() {
    return embedSourcesContent;
  }

  public void setEmbedSourcesContent(boolean embedSourcesContent) {
    this.embedSourcesContent = embedSourcesContent;
  }

  public @Nullable String getSourceMapOutputPath() {
    return sourceMapOutputPath;
  }

  /** Sets the {@code file} field of the map. Defaults to the output name of the input. */
  public void setSourceMapOutputPath(@Nullable String sourceMapOutputPath) {
    this.sourceMapOutputPath = sourceMapOutputPath;
  }

  public boolean getEmitUseStrict() {
    return emitUseStrict;
  }

  public void setEmitUseStrict(boolean emitUseStrict) {
    this.emitUseStrict = emitUseStrict;
  }

  public String getIndent() {
    return indent;
  }

  public void setIndent(String indent) {
    this.indent = checkNotNull(indent);
  }

  public TypeOracle getTypeOracle() {
    return typeOracle;
  }

  public void setTypeOracle(TypeOracle typeOracle) {
    this.typeOracle = checkNotNull(typeOracle);
  }

  /** The dialect of JavaScript to emit. */
  public enum LanguageMode {
    ECMASCRIPT5,

    /** Adds classes, arrows, let/const, destructuring, spread, for-of and generators. */
    ECMASCRIPT_2015,

    /** Adds the exponent operator (**). */
    ECMASCRIPT_2016,

    /** Adds async/await. */
    ECMASCRIPT_2017,

    /** Adds object rest/spread and async iteration. */
    ECMASCRIPT_2018,

    /** Adds catch blocks with no error binding. */
    ECMASCRIPT_2019,

    /** Adds nullish coalescing and optional chaining. */
    ECMASCRIPT_2020,

    /** Adds logical assignment and numeric separators. */
    ECMASCRIPT_2021,

    /** Adds class fields. */
    ECMASCRIPT_2022,

    ECMASCRIPT_NEXT;

    /** Whether code emitted for this mode may use features standardized in {@code other}. */
    public boolean isAtLeast(LanguageMode other) {
      return compareTo(other) >= 0;
    }

    /** Whether a feature standardized in {@code featureMode} must be lowered for this mode. */
    public boolean needsLowering(LanguageMode featureMode) {
      return compareTo(featureMode) < 0;
    }

    /**
     * Parses {@code es5}, {@code es2015}, {@code ES6}, {@code esnext} and the enum names
     * themselves. Returns null for unknown names.
     */
    public static @Nullable LanguageMode fromString(String value) {
      String canonicalizedName =
          Ascii.toUpperCase(value.trim()).replaceFirst("^ES(?!CMASCRIPT)", "ECMASCRIPT");
      if (canonicalizedName.equals("ECMASCRIPT6")) {
        return ECMASCRIPT_2015;
      }
      if (canonicalizedName.equals("ECMASCRIPTNEXT")) {
        return ECMASCRIPT_NEXT;
      }
      if (canonicalizedName.matches("ECMASCRIPT20\\d\\d")) {
        canonicalizedName = "ECMASCRIPT_" + canonicalizedName.substring("ECMASCRIPT".length());
      }
      try {
        return LanguageMode.valueOf(canonicalizedName);
      } catch (IllegalArgumentException e) {
        return null; // unknown name.
      }
    }
  }

  /** The module format of the output. */
  public enum ModuleKind {
    /** Import and export declarations are left in place. */
    NONE,
    COMMONJS,
    /** Import and export declarations are left in place. */
    ES2015;

    public static @Nullable ModuleKind fromString(String value) {
      switch (Ascii.toLowerCase(value.trim())) {
        case "none":
          return NONE;
        case "commonjs":
          return COMMONJS;
        case "es2015":
        case "es6":
        case "esnext":
          return ES2015;
        default:
          return null;
      }
    }
  }
}
