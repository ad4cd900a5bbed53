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

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SourceMapConsumerV3Test {

  private static String map(String mappings) {
    JsonObject root = new JsonObject();
    root.addProperty("version", 3);
    root.addProperty("file", "out.js");
    JsonArray sources = new JsonArray();
    sources.add("a.ts");
    root.add("sources", sources);
    JsonArray names = new JsonArray();
    names.add("x");
    root.add("names", names);
    root.addProperty("mappings", mappings);
    return root.toString();
  }

  @Test
  public void testParsesRelativeFields() throws Exception {
    SourceMapConsumerV3 consumer = new SourceMapConsumerV3();
    // Second line: source column and name carry over from the first line.
    consumer.parse(map("AAAAA,EAAE;AACA"));
    assertThat(consumer.getFile()).isEqualTo("out.js");
    assertThat(consumer.getMappings())
        .containsExactly(
            Mapping.create(0, 0, 0, 0, 0, 0),
            Mapping.create(0, 2, 0, 0, 2, Mapping.UNMAPPED),
            Mapping.create(1, 0, 0, 1, 2, Mapping.UNMAPPED))
        .inOrder();
    assertThat(consumer.getMappingsForLine(1)).hasSize(1);
    assertThat(consumer.getMappingsForLine(7)).isEmpty();
  }

  @Test
  public void testRejectsWrongVersion() {
    SourceMapConsumerV3 consumer = new SourceMapConsumerV3();
    assertThrows(
        SourceMapParseException.class,
        () -> consumer.parse("{\"version\":2,\"sources\":[],\"names\":[],\"mappings\":\"\"}"));
  }

  @Test
  public void testRejectsMalformedJson() {
    SourceMapConsumerV3 consumer = new SourceMapConsumerV3();
    assertThrows(SourceMapParseException.class, () -> consumer.parse("{\"version\":"));
  }

  @Test
  public void testRejectsBadEntries() {
    assertThrows(SourceMapParseException.class, () -> new SourceMapConsumerV3().parse(map("AA")));
    assertThrows(
        SourceMapParseException.class, () -> new SourceMapConsumerV3().parse(map("ACAA")));
    assertThrows(SourceMapParseException.class, () -> new SourceMapConsumerV3().parse(map("g")));
    assertThrows(
        SourceMapParseException.class, () -> new SourceMapConsumerV3().parse(map("AAAAAA")));
  }
}
