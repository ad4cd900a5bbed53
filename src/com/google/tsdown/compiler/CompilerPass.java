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

/**
 * Interface for classes that lower one group of language features.
 *
 * <p>Class has single function "process", which is passed the effective root of the tree. A
 * pass records its changes in the compiler's {@link TransformRecord}; the parsed tree itself is
 * never changed.
 */
public interface CompilerPass {

  /** Process the tree with root node root. */
  void process(Node root);
}
