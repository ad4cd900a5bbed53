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
import com.google.tsdown.ast.Node;
import org.jspecify.annotations.Nullable;

/** The control transfer that ends a {@link StateBlock}. */
@AutoValue
abstract class Terminal {

  enum Kind {
    /** Continues with the next block. */
    FALLTHROUGH,
    /** {@code return [3, label]} */
    JUMP,
    /** {@code return [2, value]} */
    RETURN,
    /** {@code throw value} */
    THROW,
    /** {@code return [4, value]}: await or yield, resuming at the next block. */
    SUSPEND,
    /** {@code return [5, __values(value)]}: yield*, resuming at the next block. */
    DELEGATE,
    /** {@code return [7]}: the end of a finally block. */
    END_FINALLY
  }

  abstract Kind getKind();

  abstract @Nullable Label getTarget();

  abstract @Nullable Node getValue();

  /** The node the transfer stands for, used for source mapping. */
  abstract @Nullable Node getOrigin();

  private static Terminal create(
      Kind kind, @Nullable Label target, @Nullable Node value, @Nullable Node origin) {
    return new AutoValue_Terminal(kind, target, value, origin);
  }

  static Terminal fallthrough() {
    return create(Kind.FALLTHROUGH, null, null, null);
  }

  static Terminal jump(Label target, @Nullable Node origin) {
    return create(Kind.JUMP, target, null, origin);
  }

  static Terminal returnValue(@Nullable Node value, @Nullable Node origin) {
    return create(Kind.RETURN, null, value, origin);
  }

  static Terminal throwValue(Node value, @Nullable Node origin) {
    return create(Kind.THROW, null, value, origin);
  }

  static Terminal suspend(@Nullable Node value, @Nullable Node origin) {
    return create(Kind.SUSPEND, null, value, origin);
  }

  static Terminal delegate(Node value, @Nullable Node origin) {
    return create(Kind.DELEGATE, null, value, origin);
  }

  static Terminal endFinally() {
    return create(Kind.END_FINALLY, null, null, null);
  }

  /** Whether control resumes at the block after this one once the runtime calls back. */
  boolean resumesAtNextBlock() {
    return getKind() == Kind.SUSPEND || getKind() == Kind.DELEGATE;
  }
}
