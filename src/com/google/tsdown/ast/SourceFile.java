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

package com.google.tsdown.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.io.Files;
import com.google.common.primitives.Ints;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The text of one input file together with its line-start table, used to convert character
 * offsets into zero-based line/column positions.
 */
public final class SourceFile {
  private final String name;
  private final String code;
  private final int[] lineOffsets;

  private SourceFile(String name, String code) {
    this.name = checkNotNull(name);
    this.code = checkNotNull(code);
    this.lineOffsets = computeLineOffsets(code);
  }

  public static SourceFile fromCode(String name, String code) {
    return new SourceFile(name, code);
  }

  public static SourceFile fromFile(File file) throws IOException {
    return new SourceFile(file.getPath(), Files.asCharSource(file, StandardCharsets.UTF_8).read());
  }

  private static int[] computeLineOffsets(String code) {
    List<Integer> offsets = new ArrayList<>();
    offsets.add(0);
    for (int i = 0; i < code.length(); i++) {
      char c = code.charAt(i);
      if (c == '\r' && i + 1 < code.length() && code.charAt(i + 1) == '\n') {
        continue;
      }
      if (c == '\n' || c == '\r' || c == 0x2028 || c == 0x2029) {
        offsets.add(i + 1);
      }
    }
    return Ints.toArray(offsets);
  }

  public String getName() {
    return name;
  }

  public String getCode() {
    return code;
  }

  public int getLineCount() {
    return lineOffsets.length;
  }

  /** Returns the zero-based line containing {@code offset}. */
  public int getLineOfOffset(int offset) {
    checkArgument(offset >= 0 && offset <= code.length(), "offset %s out of range", offset);
    int search = Arrays.binarySearch(lineOffsets, offset);
    // A miss returns (-insertionPoint - 1); the line is the one before the insertion point.
    return search >= 0 ? search : -search - 2;
  }

  /** Returns the zero-based column of {@code offset} within its line. */
  public int getColumnOfOffset(int offset) {
    return offset - lineOffsets[getLineOfOffset(offset)];
  }

  /** Returns the offset at which the given zero-based line starts. */
  public int getLineOffset(int line) {
    checkArgument(line >= 0 && line < lineOffsets.length, "line %s out of range", line);
    return lineOffsets[line];
  }

  @Override
  public String toString() {
    return name;
  }
}
