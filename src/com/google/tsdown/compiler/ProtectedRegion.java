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

import com.google.auto.value.AutoValue;
import java.util.Optional;

/**
 * A {@code try} statement that contains a suspension point. The runtime consults the innermost
 * active region when code throws, returns or jumps, routing control through its catch and finally
 * blocks.
 */
@AutoValue
abstract class ProtectedRegion {

  static ProtectedRegion create(
      Label tryLabel,
      Optional<Label> catchLabel,
      Optional<Label> finallyLabel,
      Label endLabel) {
    return new AutoValue_ProtectedRegion(tryLabel, catchLabel, finallyLabel, endLabel);
  }

  abstract Label getTryLabel();

  abstract Optional<Label> getCatchLabel();

  abstract Optional<Label> getFinallyLabel();

  abstract Label getEndLabel();
}
