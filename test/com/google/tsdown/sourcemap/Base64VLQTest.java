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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.tsdown.sourcemap.Base64VLQ.DecodedValue;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class Base64VLQTest {

  @Test
  public void testSmallValues() {
    for (int i = -(64 * 64 - 1); i < 64 * 64 - 1; i++) {
      testValue(i);
    }
  }

  @Test
  public void testPowersOfTwo() {
    int base = 1;
    for (int i = 0; i < 30; i++) {
      testValue(base - 1);
      testValue(base);
      testValue(-base);
      testValue(-base + 1);
      base *= 2;
    }
  }

  @Test
  public void testExtremes() {
    testValue(Integer.MAX_VALUE);
    testValue(Integer.MIN_VALUE);
    testValue(Integer.MIN_VALUE + 1);
  }

  @Test
  public void testKnownEncodings() {
    assertThat(Base64VLQ.encode(0)).isEqualTo("A");
    assertThat(Base64VLQ.encode(1)).isEqualTo("C");
    assertThat(Base64VLQ.encode(-1)).isEqualTo("D");
    assertThat(Base64VLQ.encode(15)).isEqualTo("e");
    assertThat(Base64VLQ.encode(16)).isEqualTo("gB");
    assertThat(Base64VLQ.encode(-16)).isEqualTo("hB");
    assertThat(Base64VLQ.encode(1000)).isEqualTo("w+B");
  }

  @Test
  public void testDecodeAtOffsetReportsLength() {
    String stream = "AAAA" + Base64VLQ.encode(-4096) + "C";
    DecodedValue decoded = Base64VLQ.decode(stream, 4);
    assertThat(decoded.value()).isEqualTo(-4096);
    assertThat(decoded.length()).isEqualTo(Base64VLQ.encode(-4096).length());
    assertThat(Base64VLQ.decode(stream, 4 + decoded.length()).value()).isEqualTo(1);
  }

  @Test
  public void testTruncatedInputIsRejected() {
    // 'g' carries the continuation bit.
    assertThrows(IllegalArgumentException.class, () -> Base64VLQ.decode("g", 0));
  }

  @Test
  public void testInvalidDigitIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Base64VLQ.decode("*", 0));
  }

  private static void testValue(int value) {
    String encoded = Base64VLQ.encode(value);
    DecodedValue decoded = Base64VLQ.decode(encoded, 0);
    assertThat(decoded.value()).isEqualTo(value);
    assertThat(decoded.length()).isEqualTo(encoded.length());
  }
}
