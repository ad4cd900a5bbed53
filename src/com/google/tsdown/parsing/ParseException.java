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

package com.google.tsdown.parsing;

/** A syntax error, located by character offset. */
public final class ParseException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final int offset;

  public ParseException(String message, int offset) {
    super(message);
    this.offset = offset;
  }

  /** The character offset in the source at which the error was detected. */
  public int getOffset() {
    return offset;
  }
}
