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

import org.jspecify.annotations.Nullable;

/**
 * Read-only type information supplied by a type solver, queried by node id. Every query may
 * answer "unknown", in which case lowering falls back to what it can compute syntactically.
 */
public interface TypeOracle {

  TypeOracle EMPTY = new TypeOracle() {};

  /**
   * Returns the constant value of the enum member with the given id, as a {@link Double} or a
   * {@link String}, or null when unknown.
   */
  default @Nullable Object getEnumMemberValue(int memberId) {
    return null;
  }

  /**
   * Whether the imported binding with the given id is only referenced in type positions. Null
   * when unknown, in which case an import is elided only if its binding is never referenced.
   */
  default @Nullable Boolean isTypeOnlyImport(int importSpecId) {
    return null;
  }
}
