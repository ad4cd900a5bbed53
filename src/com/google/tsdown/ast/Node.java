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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import org.jspecify.annotations.Nullable;

/**
 * An immutable syntax tree node. Children are referenced by id, never by pointer; a node is owned
 * by exactly one {@link NodeArena} or, when synthesized during lowering, by the transform record
 * that created it.
 *
 * <p>Parsed nodes carry the byte range {@code [start, end)} they were parsed from. Synthesized
 * nodes have no range ({@link #NO_POSITION}) and may name an {@link #getOrigin() origin}: the node
 * whose position they stand in for when mapping output back to source.
 */
@Immutable
public final class Node {

  public static final int NO_POSITION = -1;
  public static final int NO_ORIGIN = -1;

  // Flags.
  public static final int ASYNC = 1;
  public static final int GENERATOR = 1 << 1;
  public static final int ARROW = 1 << 2;
  public static final int STATIC = 1 << 3;
  public static final int POSTFIX = 1 << 4;
  public static final int YIELD_STAR = 1 << 5;
  public static final int SHORTHAND = 1 << 6;
  public static final int QUOTED = 1 << 7;
  /** `export default`. */
  public static final int DEFAULT = 1 << 8;
  /** Ambient declarations (`declare`), overload signatures and abstract members. */
  public static final int AMBIENT = 1 << 9;
  public static final int CONST_ENUM = 1 << 10;
  /** `import type`, `export type` and type-only specifiers. */
  public static final int TYPE_ONLY = 1 << 11;
  /** Constructor parameters declared with an accessibility or readonly modifier. */
  public static final int PARAM_PROPERTY = 1 << 12;
  public static final int FOR_AWAIT = 1 << 13;
  /** COMPUTED_PROP kinds. */
  public static final int COMPUTED_METHOD = 1 << 14;
  public static final int COMPUTED_GETTER = 1 << 15;
  public static final int COMPUTED_SETTER = 1 << 16;
  public static final int COMPUTED_FIELD = 1 << 17;
  /** Expression-bodied arrow functions. */
  public static final int EXPRESSION_BODY = 1 << 18;
  public static final int SINGLE_QUOTED = 1 << 19;
  /** A class field declared with {@code declare}; it has no runtime effect. */
  public static final int DECLARED_FIELD = 1 << 20;
  /** The link of an optional chain written with `?.`. */
  public static final int OPTIONAL_CHAIN_START = 1 << 21;
  /** Any GETPROP, GETELEM or CALL belonging to an optional chain. */
  public static final int IN_OPTIONAL_CHAIN = 1 << 22;

  private final int id;
  private final Token token;
  private final int start;
  private final int end;
  private final ImmutableList<Integer> children;
  private final @Nullable String string;
  private final double number;
  private final int flags;
  private final int origin;

  private Node(
      int id,
      Token token,
      int start,
      int end,
      ImmutableList<Integer> children,
      @Nullable String string,
      double number,
      int flags,
      int origin) {
    this.id = id;
    this.token = token;
    this.start = start;
    this.end = end;
    this.children = children;
    this.string = string;
    this.number = number;
    this.flags = flags;
    this.origin = origin;
  }

  /** Creates a node parsed from {@code [start, end)}. */
  public static Node parsed(
      int id,
      Token token,
      int start,
      int end,
      ImmutableList<Integer> children,
      @Nullable String string,
      double number,
      int flags) {
    checkArgument(start >= 0 && start <= end, "bad span [%s, %s) for %s", start, end, token);
    return new Node(id, token, start, end, children, string, number, flags, NO_ORIGIN);
  }

  /** Creates a node with no source range that inherits the position of {@code origin}. */
  public static Node synthetic(
      int id,
      Token token,
      ImmutableList<Integer> children,
      @Nullable String string,
      double number,
      int flags,
      int origin) {
    return new Node(
        id, token, NO_POSITION, NO_POSITION, children, string, number, flags, origin);
  }

  public int getId() {
    return id;
  }

  public Token getToken() {
    return token;
  }

  public boolean is(Token t) {
    return token == t;
  }

  public int getStart() {
    return start;
  }

  public int getEnd() {
    return end;
  }

  public boolean hasPosition() {
    return start != NO_POSITION;
  }

  /** The id of the node this one stands in for, or {@link #NO_ORIGIN}. */
  public int getOrigin() {
    return origin;
  }

  public ImmutableList<Integer> getChildIds() {
    return children;
  }

  public int getChildCount() {
    return children.size();
  }

  public int getChildId(int index) {
    return children.get(index);
  }

  public @Nullable String getString() {
    return string;
  }

  /** Returns the string payload, which must be present. */
  public String getNonNullString() {
    checkState(string != null, "%s has no string", this);
    return string;
  }

  public double getDouble() {
    return number;
  }

  public int getFlags() {
    return flags;
  }

  public boolean hasFlag(int flag) {
    return (flags & flag) != 0;
  }

  public boolean isAsync() {
    return hasFlag(ASYNC);
  }

  public boolean isGenerator() {
    return hasFlag(GENERATOR);
  }

  public boolean isArrow() {
    return hasFlag(ARROW);
  }

  public boolean isStatic() {
    return hasFlag(STATIC);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token).append('#').append(id);
    if (string != null) {
      sb.append(' ').append(string);
    }
    if (hasPosition()) {
      sb.append(" [").append(start).append(',').append(end).append(')');
    } else if (origin != NO_ORIGIN) {
      sb.append(" <from #").append(origin).append('>');
    }
    return sb.toString();
  }
}
