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

package com.google.tsdown.sourcemap;

import com.google.auto.value.AutoValue;

/**
 * One correspondence between a generated position and, optionally, an original position.
 *
 * <p>Absent fields hold {@link #UNMAPPED}. An entry without a source index denotes generated text
 * with no traceable origin.
 */
@AutoValue
public abstract class Mapping {
  public static final int UNMAPPED = -1;

  public static Mapping unmapped(int generatedLine, int generatedColumn) {
    return create(generatedLine, generatedColumn, UNMAPPED, UNMAPPED, UNMAPPED, UNMAPPED);
  }

  public static Mapping create(
      int generatedLine,
      int generatedColumn,
      int sourceIndex,
      int originalLine,
      int originalColumn,
      int nameIndex) {
    return new AutoValue_Mapping(
        generatedLine, generatedColumn, sourceIndex, originalLine, originalColumn, nameIndex);
  }

  public abstract int getGeneratedLine();

  public abstract int getGeneratedColumn();

  public abstract int getSourceIndex();

  public abstract int getOriginalLine();

  public abstract int getOriginalColumn();

  public abstract int getNameIndex();

  public final boolean hasSource() {
    return getSourceIndex() != UNMAPPED;
  }

  public final boolean hasName() {
    return getNameIndex() != UNMAPPED;
  }

  public final FilePosition getGeneratedPosition() {
    return new FilePosition(getGeneratedLine(), getGeneratedColumn());
  }
}
