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

import com.google.common.collect.ImmutableList;
import com.google.tsdown.ast.Node;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * One {@code case} of a state machine: statements executed in order, then exactly one terminal
 * control transfer. Conditional jumps are statements of the form {@code if (c) return [3, L];};
 * when not taken, execution continues in the same block.
 */
final class StateBlock {
  private final int number;
  private final List<Node> statements = new ArrayList<>();
  private @Nullable Terminal terminal;

  StateBlock(int number) {
    this.number = number;
  }

  int getNumber() {
    return number;
  }

  void addStatement(Node statement) {
    checkState(terminal == null, "block %s is already terminated", number);
    statements.add(statement);
  }

  void setTerminal(Terminal terminal) {
    checkState(this.terminal == null, "block %s is already terminated", number);
    this.terminal = terminal;
  }

  boolean isEmpty() {
    return statements.isEmpty() && terminal == null;
  }

  boolean isTerminated() {
    return terminal != null;
  }

  ImmutableList<Node> getStatements() {
    return ImmutableList.copyOf(statements);
  }

  Terminal getTerminal() {
    checkState(terminal != null, "block %s has no terminal", number);
    return terminal;
  }

  @Override
  public String toString() {
    return "case " + number + ": " + statements.size() + " statements, " + terminal;
  }
}
