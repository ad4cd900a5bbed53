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

import com.google.tsdown.ast.Node;
import com.google.tsdown.ast.SourceFile;
import com.google.tsdown.compiler.CompilerOptions.LanguageMode;

/** An abstract compiler, to help remove the circular dependency of passes on {@link Compiler}. */
public abstract class AbstractCompiler {

  public abstract CompilerOptions getOptions();

  public abstract SourceFile getSourceFile();

  /** The record the passes of the current file write into. */
  public abstract TransformRecord getRecord();

  public abstract UniqueNameGenerator getUniqueNameGenerator();

  public abstract ErrorManager getErrorManager();

  public abstract AstFactory createAstFactory();

  /** Reports an error at its default level. */
  public void report(JSError error) {
    getErrorManager().report(error.defaultLevel(), error);
  }

  /** Reports a diagnostic at the source position {@code n} was parsed from or stands in for. */
  public void report(Node n, DiagnosticType type, String... arguments) {
    SourceFile source = getSourceFile();
    int offset = NodeUtil.getOriginalOffset(getRecord(), n);
    if (offset < 0) {
      report(JSError.make(source.getName(), -1, -1, type, arguments));
    } else {
      report(
          JSError.make(
              source.getName(),
              source.getLineOfOffset(offset) + 1,
              source.getColumnOfOffset(offset),
              type,
              arguments));
    }
  }

  /** Whether a feature that became standard in {@code featureMode} has to be lowered. */
  public boolean needsLowering(LanguageMode featureMode) {
    return getOptions().getLanguageOut().needsLowering(featureMode);
  }
}
