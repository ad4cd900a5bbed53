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

package com.google.tsdown.sourcemap;

import static com.google.common.base.Preconditions.checkArgument;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * We encode our variable length numbers as base64 encoded strings with the least significant
 * digit coming first. Each base64 digit encodes a 5-bit value (0-31) and a continuation bit.
 * Signed values are represented by using the least significant bit of the first digit as the
 * sign bit.
 */
public final class Base64VLQ {
  private Base64VLQ() {}

  // A Base64 VLQ digit can represent 5 bits, so it is base-32.
  private static final int VLQ_BASE_SHIFT = 5;
  private static final int VLQ_BASE = 1 << VLQ_BASE_SHIFT;

  // A mask of bits for a VLQ digit (11111), 31 decimal.
  private static final int VLQ_BASE_MASK = VLQ_BASE - 1;

  // The continuation bit is the 6th bit.
  private static final int VLQ_CONTINUATION_BIT = VLQ_BASE;

  // 32 bits of payload plus the sign bit never need more than 7 digits.
  private static final int MAX_DIGITS = 7;

  /**
   * Converts from a two-complement value to a value where the sign bit is placed in the least
   * significant bit. For example, as decimals: 1 becomes 2 (10 binary), -1 becomes 3 (11 binary),
   * 2 becomes 4 (100 binary), -2 becomes 5 (101 binary).
   */
  private static long toVLQSigned(int value) {
    long v = value;
    return v < 0 ? ((-v) << 1) + 1 : v << 1;
  }

  /** The inverse of {@link #toVLQSigned}. */
  private static int fromVLQSigned(long value) {
    boolean negate = (value & 1) == 1;
    long magnitude = value >>> 1;
    return (int) (negate ? -magnitude : magnitude);
  }

  /** Writes a VLQ encoded value to the provided appendable. */
  public static void encode(Appendable out, int value) throws IOException {
    long vlq = toVLQSigned(value);
    do {
      int digit = (int) (vlq & VLQ_BASE_MASK);
      vlq >>>= VLQ_BASE_SHIFT;
      if (vlq > 0) {
        digit |= VLQ_CONTINUATION_BIT;
      }
      out.append(Base64.toBase64(digit));
    } while (vlq > 0);
  }

  /** Returns the VLQ encoding of a single value. */
  public static String encode(int value) {
    StringBuilder sb = new StringBuilder(MAX_DIGITS);
    try {
      encode(sb, value);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return sb.toString();
  }

  /**
   * A simple interface for advancing through a sequence of characters, that communicates that
   * advance back to the source.
   */
  public interface CharIterator {
    boolean hasNext();

    char next();
  }

  /**
   * Decodes the next value from the provided CharIterator.
   *
   * @throws IllegalArgumentException if the input ends inside a value or holds a character
   *     outside the base64 alphabet
   */
  public static int decode(CharIterator in) {
    long result = 0;
    boolean continuation;
    int shift = 0;
    int digits = 0;
    do {
      checkArgument(in.hasNext(), "VLQ value is truncated");
      checkArgument(++digits <= MAX_DIGITS, "VLQ value is too long");
      int digit = Base64.fromBase64(in.next());
      continuation = (digit & VLQ_CONTINUATION_BIT) != 0;
      digit &= VLQ_BASE_MASK;
      result = result + ((long) digit << shift);
      shift = shift + VLQ_BASE_SHIFT;
    } while (continuation);

    return fromVLQSigned(result);
  }

  /**
   * Decodes the value starting at {@code offset}.
   *
   * @return the value together with the number of characters it occupied
   */
  public static DecodedValue decode(CharSequence in, int offset) {
    StringCharIterator it = new StringCharIterator(in, offset);
    int value = decode(it);
    return new DecodedValue(value, it.position() - offset);
  }

  /** A decoded value and the number of characters consumed to produce it. */
  public record DecodedValue(int value, int length) {}

  /** A {@link CharIterator} over a character sequence. */
  static final class StringCharIterator implements CharIterator {
    private final CharSequence content;
    private final int length;
    private int current;

    StringCharIterator(CharSequence content, int start) {
      this.content = content;
      this.length = content.length();
      this.current = start;
    }

    @Override
    public char next() {
      return content.charAt(current++);
    }

    char peek() {
      return content.charAt(current);
    }

    @Override
    public boolean hasNext() {
      return current < length;
    }

    int position() {
      return current;
    }
  }
}
