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

import java.text.MessageFormat;

/** The type of a compile or analysis error. */
public final class DiagnosticType implements Comparable<DiagnosticType> {

  /** The error type's unique key, e.g. {@code JSC_PARSE_ERROR}. */
  public final String key;

  /** The {@link MessageFormat} pattern used to describe errors of this type. */
  public final String format;

  /** The default level reported for this type. */
  public final CheckLevel level;

  public static DiagnosticType error(String name, String descriptionFormat) {
    return make(name, CheckLevel.ERROR, descriptionFormat);
  }

  public static DiagnosticType warning(String name, String descriptionFormat) {
    return make(name, CheckLevel.WARNING, descriptionFormat);
  }

  public static DiagnosticType disabled(String name, String descriptionFormat) {
    return make(name, CheckLevel.OFF, descriptionFormat);
  }

  public static DiagnosticType make(String name, CheckLevel level, String descriptionFormat) {
    return new DiagnosticType(name, level, descriptionFormat);
  }

  private DiagnosticType(String key, CheckLevel level, String format) {
    this.key = key;
    this.level = level;
    this.format = format;
  }

  /** Formats a message for an error of this type, substituting {@code arguments}. */
  String format(String... arguments) {
    return new MessageFormat(format).format(arguments);
  }

  @Override
  public boolean equals(Object type) {
    return type instanceof DiagnosticType && ((DiagnosticType) type).key.equals(key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public int compareTo(DiagnosticType diagnosticType) {
    return key.compareTo(diagnosticType.key);
  }

  @Override
  public String toString() {
    return key + ": " + format;
  }
}
