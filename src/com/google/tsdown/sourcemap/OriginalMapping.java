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
import java.util.Optional;

/** The original location a generated position resolves to. */
@AutoValue
public abstract class OriginalMapping {

  /** How the mapping was found. */
  public enum Precision {
    /** The generated position has its own entry. */
    EXACT,
    /** The closest preceding entry on the same generated line was used. */
    APPROXIMATE_LINE
  }

  public static Builder builder() {
    return new AutoValue_OriginalMapping.Builder();
  }

  /** The original source file. */
  public abstract String getOriginalFile();

  /** The zero-based line in the original file. */
  public abstract int getLineNumber();

  /** The zero-based column on the line. */
  public abstract int getColumnPosition();

  /** The original name of the identifier, if any. */
  public abstract Optional<String> getIdentifier();

  public abstract Precision getPrecision();

  /** Builder for {@link OriginalMapping}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setOriginalFile(String originalFile);

    public abstract Builder setLineNumber(int lineNumber);

    public abstract Builder setColumnPosition(int columnPosition);

    public abstract Builder setIdentifier(String identifier);

    public abstract Builder setPrecision(Precision precision);

    public abstract OriginalMapping build();
  }
}
