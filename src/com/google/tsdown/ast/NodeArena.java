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

package com.google.tsdown.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Owns every parsed node of one source file. Ids are dense, assigned monotonically by the
 * {@link Builder}, and never reused. The arena is read-only once built.
 */
public final class NodeArena {
  private final SourceFile sourceFile;
  private final ImmutableList<Node> nodes;
  private final int rootId;

  private NodeArena(SourceFile sourceFile, ImmutableList<Node> nodes, int rootId) {
    this.sourceFile = sourceFile;
    this.nodes = nodes;
    this.rootId = rootId;
  }

  public static Builder builder(SourceFile sourceFile) {
    return new Builder(sourceFile);
  }

  public SourceFile getSourceFile() {
    return sourceFile;
  }

  public Node getRoot() {
    return nodes.get(rootId);
  }

  public Node getNode(int id) {
    checkElementIndex(id, nodes.size(), "node id");
    return nodes.get(id);
  }

  public boolean contains(int id) {
    return id >= 0 && id < nodes.size();
  }

  public int size() {
    return nodes.size();
  }

  public ImmutableList<Node> getChildren(Node parent) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (int childId : parent.getChildIds()) {
      result.add(nodes.get(childId));
    }
    return result.build();
  }

  /** Assembles an arena bottom-up: children are added before their parent. */
  public static final class Builder {
    private final SourceFile sourceFile;
    private final List<Node> nodes = new ArrayList<>();

    private Builder(SourceFile sourceFile) {
      this.sourceFile = checkNotNull(sourceFile);
    }

    /** Adds a node whose children were all added earlier, returning its id. */
    @CanIgnoreReturnValue
    public int add(
        Token token,
        int start,
        int end,
        List<Integer> children,
        @Nullable String string,
        double number,
        int flags) {
      int id = nodes.size();
      for (int child : children) {
        checkArgument(child >= 0 && child < id, "child %s of %s added out of order", child, token);
      }
      nodes.add(
          Node.parsed(
              id, token, start, end, ImmutableList.copyOf(children), string, number, flags));
      return id;
    }

    public Node get(int id) {
      return nodes.get(id);
    }

    public int size() {
      return nodes.size();
    }

    /**
     * Freezes the arena. Verifies that every node except the root has exactly one parent and that
     * every child span lies within its parent span.
     */
    public NodeArena build(int rootId) {
      checkElementIndex(rootId, nodes.size(), "root id");
      BitSet seen = new BitSet(nodes.size());
      for (Node parent : nodes) {
        for (int childId : parent.getChildIds()) {
          checkState(!seen.get(childId), "node %s has more than one parent", childId);
          seen.set(childId);
          Node child = nodes.get(childId);
          checkState(
              child.getStart() >= parent.getStart() && child.getEnd() <= parent.getEnd(),
              "span of %s is not contained in %s",
              child,
              parent);
        }
      }
      checkState(!seen.get(rootId), "root %s has a parent", rootId);
      return new NodeArena(sourceFile, ImmutableList.copyOf(nodes), rootId);
    }
  }
}
