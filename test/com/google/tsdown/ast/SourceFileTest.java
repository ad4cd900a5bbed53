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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SourceFileTest {

  @Test
  public void testLineAndColumn() {
    SourceFile file = SourceFile.fromCode("a.ts", "ab\ncd\r\nef\rg");
    assertThat(file.getLineCount()).isEqualTo(4);
    assertThat(file.getLineOfOffset(0)).isEqualTo(0);
    assertThat(file.getLineOfOffset(2)).isEqualTo(0);
    assertThat(file.getLineOfOffset(3)).isEqualTo(1);
    assertThat(file.getColumnOfOffset(4)).isEqualTo(1);
    assertThat(file.getLineOfOffset(7)).isEqualTo(2);
    assertThat(file.getLineOfOffset(10)).isEqualTo(3);
    assertThat(file.getColumnOfOffset(10)).isEqualTo(0);
    assertThat(file.getLineOffset(2)).isEqualTo(7);
  }

  @Test
  public void testEndOfFileIsInRange() {
    SourceFile file = SourceFile.fromCode("a.ts", "x\n");
    assertThat(file.getLineOfOffset(2)).isEqualTo(1);
    assertThrows(IllegalArgumentException.class, () -> file.getLineOfOffset(3));
  }

  @Test
  public void testName() {
    assertThat(SourceFile.fromCode("dir/a.ts", "").toString()).isEqualTo("dir/a.ts");
  }
}
