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

import com.google.tsdown.ast.NodeArena;
import com.google.tsdown.ast.SourceFile;
import java.util.ArrayList;
import java.util.List;

/** Freezes a {@link ParseTree} into a {@link NodeArena}, assigning ids children first. */
final class IRFactory {
  private final NodeArena.Builder builder;

  private IRFactory(SourceFile sourceFile) {
    this.builder = NodeArena.builder(sourceFile);
  }

  static NodeArena transformTree(ParseTree root, SourceFile sourceFile) {
    IRFactory factory = new IRFactory(sourceFile);
    int rootId = factory.transform(root);
    return factory.builder.build(rootId);
  }

  private int transform(ParseTree tree) {
    List<Integer> children = new ArrayList<>(tree.children.size());
    for (ParseTree child : tree.children) {
      children.add(transform(child));
    }
    return builder.add(
        tree.token, tree.start, tree.end, children, tree.string, tree.number, tree.flags);
  }
}
