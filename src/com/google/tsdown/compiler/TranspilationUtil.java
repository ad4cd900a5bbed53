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

/** Util functions for transpilation passes */
public final class TranspilationUtil {

  private TranspilationUtil() {} // prevent instantiation

  public static final DiagnosticType CANNOT_CONVERT =
      DiagnosticType.error("JSC_CANNOT_CONVERT", "This code cannot be transpiled. {0}");

  /** Reported for every construct a pass emitted without lowering it. */
  public static final DiagnosticType INCOMPLETE_LOWERING =
      DiagnosticType.warning(
          "JSC_INCOMPLETE_LOWERING", "{0} was emitted without being fully lowered.");

  static void cannotConvert(AbstractCompiler compiler, Node n, String message) {
    compiler.report(n, CANNOT_CONVERT, message);
  }

  /**
   * Leaves {@code n} as it is in the output and records why. Emission carries on; the driver
   * reports the construct as an {@link #INCOMPLETE_LOWERING} warning.
   */
  static void markIncompletelyLowered(AbstractCompiler compiler, Node n, String construct) {
    compiler.getRecord().markIncompletelyLowered(n, construct);
  }
}
