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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.tsdown.ast.Token;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Mutable tree built while parsing. Cover grammars (an array literal that turns out to be an
 * assignment pattern, for example) are resolved by retagging nodes in place before the tree is
 * frozen into a {@link com.google.tsdown.ast.NodeArena} by {@link IRFactory}.
 */
final class ParseTree {
  Token token;
  final int start;
  int end;
  @Nullable String string;
  double number;
  int flags;
  final List<ParseTree> children = new ArrayList<>();

  ParseTree(Token token, int start, int end) {
    this.token = token;
    this.start = start;
    this.end = end;
  }

  @CanIgnoreReturnValue
  ParseTree add(ParseTree child) {
    children.add(child);
    return this;
  }

  @CanIgnoreReturnValue
  ParseTree setString(String string) {
    this.string = string;
    return this;
  }

  @CanIgnoreReturnValue
  ParseTree addFlag(int flag) {
    this.flags |= flag;
    return this;
  }

  boolean hasFlag(int flag) {
    return (flags & flag) != 0;
  }

  boolean is(Token t) {
    return token == t;
  }

  ParseTree child(int index) {
    return children.get(index);
  }

  @Override
  public String toString() {
    return token + (string != null ? " " + string : "") + children;
  }
}
