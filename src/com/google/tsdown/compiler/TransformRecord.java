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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.SetMultimap;
import com.google.tsdown.ast.Node;
import com.google.tsdown.ast.NodeArena;
import com.google.tsdown.ast.SourceFile;
import com.google.tsdown.ast.Token;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The result of lowering one file: instructions for how each node is emitted, plus the nodes
 * synthesized while lowering. The arena itself is never modified.
 *
 * <p>Every node id, original or synthesized, may carry an ordered list of {@link EmitAction}s
 * describing how that node appears in whichever parent refers to it. Resolving the actions
 * recursively gives the <em>effective tree</em>, which is what later passes and the printer see.
 * A node that is not mentioned by any action is emitted as is.
 *
 * <p>Synthesized nodes get ids continuing past the arena size. A replacement never contains the
 * node it replaces: to wrap a node, wrap a {@link #copy} of it.
 */
public final class TransformRecord {

  /** The kind of an {@link EmitAction}. */
  public enum ActionKind {
    EMIT_AS_IS,
    REPLACE_WITH,
    INSERT_BEFORE,
    INSERT_AFTER,
    ELIDE
  }

  /**
   * One instruction for emitting a node. {@code target} is the id of the replacement or the
   * inserted node, and {@link Node#NO_ORIGIN} for the other kinds.
   */
  public record EmitAction(ActionKind kind, int target) {}

  private static final EmitAction EMIT_AS_IS = new EmitAction(ActionKind.EMIT_AS_IS, -1);
  private static final EmitAction ELIDE = new EmitAction(ActionKind.ELIDE, -1);

  /** A construct a pass could not lower; it is emitted as is. */
  public record IncompleteLowering(Node node, String reason) {}

  private final NodeArena arena;
  private final List<Node> synthesized = new ArrayList<>();
  private final ListMultimap<Integer, EmitAction> actions = ArrayListMultimap.create();
  private final List<IncompleteLowering> incompleteLowerings = new ArrayList<>();
  private final EnumSet<RuntimeHelper> helpers = EnumSet.noneOf(RuntimeHelper.class);
  private final SetMultimap<Integer, String> temporaries = LinkedHashMultimap.create();

  public TransformRecord(NodeArena arena) {
    this.arena = checkNotNull(arena);
  }

  public NodeArena getArena() {
    return arena;
  }

  public SourceFile getSourceFile() {
    return arena.getSourceFile();
  }

  /** Returns the node with the given id, original or synthesized. */
  public Node getNode(int id) {
    if (id < arena.size()) {
      return arena.getNode(id);
    }
    return synthesized.get(id - arena.size());
  }

  /** The total number of node ids allocated so far. */
  public int size() {
    return arena.size() + synthesized.size();
  }

  /** The effective root. The arena's root may itself be replaced, but never removed. */
  public Node getRoot() {
    ImmutableList.Builder<Node> roots = ImmutableList.builder();
    expand(arena.getRoot().getId(), roots, 0);
    ImmutableList<Node> result = roots.build();
    checkState(result.size() == 1, "root expands to %s", result);
    return result.get(0);
  }

  /** Returns the effective children of {@code parent}. */
  public ImmutableList<Node> getChildren(Node parent) {
    ImmutableList.Builder<Node> children = ImmutableList.builder();
    for (int id : parent.getChildIds()) {
      expand(id, children, 0);
    }
    return children.build();
  }

  /** Returns the effective child of {@code parent} at {@code index}. */
  public Node getChild(Node parent, int index) {
    return getChildren(parent).get(index);
  }

  public ImmutableList<EmitAction> getActions(Node node) {
    return ImmutableList.copyOf(actions.get(node.getId()));
  }

  /** Whether any action has been recorded for {@code node}. */
  public boolean isChanged(Node node) {
    return actions.containsKey(node.getId());
  }

  private void expand(int id, ImmutableList.Builder<Node> out, int depth) {
    checkState(depth < 10_000, "cyclic replacement through node %s", id);
    List<EmitAction> list = actions.get(id);
    if (list.isEmpty()) {
      out.add(getNode(id));
      return;
    }
    EmitAction core = EMIT_AS_IS;
    for (EmitAction action : list) {
      switch (action.kind()) {
        case INSERT_BEFORE -> expand(action.target(), out, depth + 1);
        case INSERT_AFTER -> {}
        default -> core = action;
      }
    }
    switch (core.kind()) {
      case EMIT_AS_IS -> out.add(getNode(id));
      case REPLACE_WITH -> expand(core.target(), out, depth + 1);
      default -> {}
    }
    for (EmitAction action : list) {
      if (action.kind() == ActionKind.INSERT_AFTER) {
        expand(action.target(), out, depth + 1);
      }
    }
  }

  // Synthesis.

  /**
   * Creates a node that stands in for {@code origin} when mapping output back to the source.
   * Children are referenced as they are, so they keep any actions recorded for them, except
   * insertions already present in {@code children}; see {@link #foldInsertions}.
   */
  public Node newNode(
      Token token,
      List<Node> children,
      @Nullable String string,
      double number,
      int flags,
      @Nullable Node origin) {
    foldInsertions(children);
    ImmutableList.Builder<Integer> childIds = ImmutableList.builder();
    for (Node child : children) {
      checkArgument(child.getId() < size(), "unknown node %s", child);
      childIds.add(child.getId());
    }
    Node node =
        Node.synthetic(
            size(),
            token,
            childIds.build(),
            string,
            number,
            flags,
            origin == null ? Node.NO_ORIGIN : origin.getId());
    synthesized.add(node);
    return node;
  }

  /**
   * Drops the insertions recorded on a node of {@code children} whose inserted nodes are
   * themselves in {@code children}. A list read from {@link #getChildren} already holds them,
   * so a parent rebuilt from it would otherwise emit them twice.
   */
  private void foldInsertions(List<Node> children) {
    Set<Integer> ids = new HashSet<>();
    for (Node child : children) {
      ids.add(child.getId());
    }
    for (Node child : children) {
      List<EmitAction> list = actions.get(child.getId());
      list.removeIf(
          action ->
              (action.kind() == ActionKind.INSERT_BEFORE
                      || action.kind() == ActionKind.INSERT_AFTER)
                  && isFoldedInto(action.target(), ids));
    }
  }

  private boolean isFoldedInto(int target, Set<Integer> ids) {
    ImmutableList.Builder<Node> expansion = ImmutableList.builder();
    expand(target, expansion, 0);
    ImmutableList<Node> nodes = expansion.build();
    if (nodes.isEmpty()) {
      return false;
    }
    for (Node node : nodes) {
      if (!ids.contains(node.getId())) {
        return false;
      }
    }
    return true;
  }

  /** Returns a shallow copy of {@code node} whose origin is {@code node}. */
  public Node copy(Node node) {
    Node copy =
        Node.synthetic(
            size(),
            node.getToken(),
            node.getChildIds(),
            node.getString(),
            node.getDouble(),
            node.getFlags(),
            node.getId());
    synthesized.add(copy);
    return copy;
  }

  /** Returns a copy of {@code node} with different children. */
  public Node withChildren(Node node, List<Node> children) {
    return newNode(
        node.getToken(), children, node.getString(), node.getDouble(), node.getFlags(), node);
  }

  /** Returns a copy of {@code node} with different flags and children. */
  public Node withFlags(Node node, int flags, List<Node> children) {
    return newNode(node.getToken(), children, node.getString(), node.getDouble(), flags, node);
  }

  /**
   * Copies the effective subtree rooted at {@code node}. Each copy's origin is the node it was
   * copied from. Use this when an expression has to be evaluated in two places.
   */
  public Node deepCopy(Node node) {
    ImmutableList<Node> children = getChildren(node);
    List<Node> copies = new ArrayList<>(children.size());
    for (Node child : children) {
      copies.add(deepCopy(child));
    }
    return withChildren(node, copies);
  }

  // Actions.

  /** Emits {@code replacement} wherever {@code node} was emitted. */
  public void replace(Node node, Node replacement) {
    checkArgument(node.getId() != replacement.getId(), "%s cannot replace itself", node);
    actions.put(node.getId(), new EmitAction(ActionKind.REPLACE_WITH, replacement.getId()));
  }

  /** Emits {@code inserted} before {@code anchor}, after anything inserted there earlier. */
  public void insertBefore(Node anchor, Node inserted) {
    checkArgument(anchor.getId() != inserted.getId());
    actions.put(anchor.getId(), new EmitAction(ActionKind.INSERT_BEFORE, inserted.getId()));
  }

  /** Emits {@code inserted} after {@code anchor}, after anything inserted there earlier. */
  public void insertAfter(Node anchor, Node inserted) {
    checkArgument(anchor.getId() != inserted.getId());
    actions.put(anchor.getId(), new EmitAction(ActionKind.INSERT_AFTER, inserted.getId()));
  }

  /** Inserts {@code nodes} after {@code anchor} in order. */
  public void insertAfter(Node anchor, List<Node> nodes) {
    for (Node node : nodes) {
      insertAfter(anchor, node);
    }
  }

  /** Inserts {@code nodes} before {@code anchor} in order. */
  public void insertBefore(Node anchor, List<Node> nodes) {
    for (Node node : nodes) {
      insertBefore(anchor, node);
    }
  }

  /** Drops {@code node} from the output. Only valid where its parent allows a variable count. */
  public void elide(Node node) {
    actions.put(node.getId(), ELIDE);
  }

  /** Cancels an earlier replacement or elision of {@code node}. */
  public void restore(Node node) {
    actions.put(node.getId(), EMIT_AS_IS);
  }

  // Side tables.

  /** Records that {@code node} is emitted without being fully lowered. */
  public void markIncompletelyLowered(Node node, String reason) {
    incompleteLowerings.add(new IncompleteLowering(node, reason));
  }

  public ImmutableList<IncompleteLowering> getIncompleteLowerings() {
    return ImmutableList.copyOf(incompleteLowerings);
  }

  /** Records that the output calls {@code helper}, and so needs its declaration. */
  public void requireHelper(RuntimeHelper helper) {
    helpers.add(helper);
    for (RuntimeHelper dependency : helper.getDependencies()) {
      requireHelper(dependency);
    }
  }

  /** The helpers the output needs, in emission order. */
  public ImmutableSet<RuntimeHelper> getRequiredHelpers() {
    return ImmutableSet.copyOf(helpers);
  }

  /**
   * Records a temporary that must be declared with {@code var} at the top of {@code scope}, a
   * FUNCTION or the SCRIPT.
   */
  public void declareTemporary(Node scope, String name) {
    checkArgument(scope.is(Token.FUNCTION) || scope.is(Token.SCRIPT), scope);
    temporaries.put(scope.getId(), name);
  }

  /** Temporaries declared for each scope id, in declaration order. */
  public ImmutableSetMultimap<Integer, String> getTemporaries() {
    return ImmutableSetMultimap.copyOf(temporaries);
  }
}
