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

import com.google.common.collect.ImmutableList;

/** The error handler for one compilation. */
public interface ErrorManager {

  /**
   * Reports an error. The level may be different from {@link JSError#defaultLevel()}.
   *
   * @param level the reporting level
   * @param error the error to report
   */
  void report(CheckLevel level, JSError error);

  /** Writes a report to an implementation-specific medium. */
  void generateReport();

  int getErrorCount();

  int getWarningCount();

  ImmutableList<JSError> getErrors();

  ImmutableList<JSError> getWarnings();

  /** Whether errors have been reported that stop the file from being emitted. */
  default boolean hasHaltingErrors() {
    return getErrorCount() > 0;
  }
}
