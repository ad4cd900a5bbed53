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

import static com.google.common.base.Preconditions.checkState;

/**
 * A position in a state machine that code can jump to. Labels are created before the code they
 * mark is laid out, and are bound to the number of a {@link StateBlock} when marked.
 */
final class Label {
  private int block = -1;

  void bind(int blockNumber) {
    checkState(block == -1, "label marked twice");
    this.block = blockNumber;
  }

  boolean isBound() {
    return block != -1;
  }

  /** The number of the block this label starts, which is also its {@code case} value. */
  int getBlockNumber() {
    checkState(isBound(), "label was never marked");
    return block;
  }

  @Override
  public String toString() {
    return isBound() ? "L" + block : "L?";
  }
}
