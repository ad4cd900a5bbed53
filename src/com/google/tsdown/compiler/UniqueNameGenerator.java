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
import com.google.tsdown.ast.NodeArena;
import com.google.tsdown.ast.Token;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Hands out identifiers that collide with nothing declared or referenced in a file. Names are
 * unique across the whole file, so a temporary can be referenced from nested functions without
 * being shadowed.
 */
public final class UniqueNameGenerator {
  private final Set<String> used = new HashSet<>();
  private final Map<String, String> sharedNames = new HashMap<>();
  private int tempIndex = 0;

  UniqueNameGenerator(NodeArena arena) {
    for (int id = 0; id < arena.size(); id++) {
      Node n = arena.getNode(id);
      if ((n.is(Token.NAME) || n.is(Token.IMPORT_STAR)) && n.getString() != null) {
        used.add(n.getString());
      }
    }
  }

  /** Returns a fresh temporary name: {@code _a} to {@code _z}, then {@code _0}, {@code _1}... */
  public String newTemporary() {
    while (true) {
      int index = tempIndex++;
      String name = index < 26 ? "_" + (char) ('a' + index) : "_" + (index - 26);
      if (used.add(name)) {
        return name;
      }
    }
  }

  /** Returns {@code base} if it is unused, otherwise {@code base_1}, {@code base_2}... */
  public String uniqueName(String base) {
    if (used.add(base)) {
      return base;
    }
    return numberedName(base);
  }

  /** Returns the first unused of {@code base_1}, {@code base_2}... */
  public String numberedName(String base) {
    for (int i = 1; ; i++) {
      String name = base + "_" + i;
      if (used.add(name)) {
        return name;
      }
    }
  }

  /**
   * Returns the same unique name for {@code base} every time it is called. Used for per-function
   * captures such as {@code _this}, where each function declares its own copy.
   */
  public String sharedName(String base) {
    return sharedNames.computeIfAbsent(base, this::uniqueName);
  }

  /** Whether {@code name} appears in the file or was handed out. */
  public boolean isUsed(String name) {
    return used.contains(name);
  }
}
