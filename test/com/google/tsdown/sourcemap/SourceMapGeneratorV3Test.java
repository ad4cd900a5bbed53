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
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.io.BaseEncoding;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SourceMapGeneratorV3Test {

  private SourceMapGeneratorV3 generator;

  @Before
  public void setUp() {
    generator = new SourceMapGeneratorV3("output.js");
  }

  @Test
  public void testSimpleMappingsSerializeAndDecode() throws Exception {
    generator.addSource("input.ts");
    generator.addSimpleMapping(0, 0, 0, 0);
    generator.addSimpleMapping(0, 10, 0, 5);
    generator.addSimpleMapping(1, 0, 1, 0);

    String json = generator.toJson();
    JsonObject root = JsonParser.parseString(json).getAsJsonObject();
    assertThat(root.get("version").getAsInt()).isEqualTo(3);
    assertThat(root.get("file").getAsString()).isEqualTo("output.js");
    assertThat(root.getAsJsonArray("sources").size()).isEqualTo(1);
    assertThat(root.getAsJsonArray("sources").get(0).getAsString()).isEqualTo("input.ts");
    assertThat(root.has("sourcesContent")).isFalse();
    assertThat(root.get("mappings").getAsString()).isEqualTo("AAAA,UAAK;AACL");

    SourceMapConsumerV3 consumer = new SourceMapConsumerV3();
    consumer.parse(json);
    assertThat(consumer.getMappings())
        .containsExactly(
            Mapping.create(0, 0, 0, 0, 0, Mapping.UNMAPPED),
            Mapping.create(0, 10, 0, 0, 5, Mapping.UNMAPPED),
            Mapping.create(1, 0, 0, 1, 0, Mapping.UNMAPPED))
        .inOrder();
  }

  @Test
  public void testSourcesAndNamesAreInterned() {
    assertThat(generator.addSource("a.ts")).isEqualTo(0);
    assertThat(generator.addSource("b.ts")).isEqualTo(1);
    assertThat(generator.addSource("a.ts")).isEqualTo(0);
    assertThat(generator.addName("foo")).isEqualTo(0);
    assertThat(generator.addName("bar")).isEqualTo(1);
    assertThat(generator.addName(new String("foo"))).isEqualTo(0);
    assertThat(generator.getSources()).containsExactly("a.ts", "b.ts").inOrder();
    assertThat(generator.getNames()).containsExactly("foo", "bar").inOrder();
  }

  @Test
  public void testNamedAndUnmappedSegments() throws Exception {
    int source = generator.addSource("input.ts");
    int name = generator.addName("value");
    generator.addMapping(0, 0);
    generator.addMapping(0, 4, source, 2, 7, name);
    generator.addMapping(0, 9);
    generator.addMapping(3, 2, source, 2, 1);

    SourceMapConsumerV3 consumer = new SourceMapConsumerV3();
    consumer.parse(generator.toJson());
    assertThat(consumer.getMappings()).isEqualTo(generator.getMappings());
    assertThat(consumer.getNames()).containsExactly("value");

    OriginalMapping mapping = consumer.getMappingForLine(0, 6);
    assertThat(mapping.getOriginalFile()).isEqualTo("input.ts");
    assertThat(mapping.getLineNumber()).isEqualTo(2);
    assertThat(mapping.getColumnPosition()).isEqualTo(7);
    assertThat(mapping.getIdentifier()).hasValue("value");
    assertThat(mapping.getPrecision()).isEqualTo(OriginalMapping.Precision.APPROXIMATE_LINE);
    assertThat(consumer.getMappingForLine(0, 10)).isNull();
    assertThat(consumer.getMappingForLine(3, 2).getPrecision())
        .isEqualTo(OriginalMapping.Precision.EXACT);
  }

  @Test
  public void testSourcesContent() {
    generator.addSource("first.ts");
    generator.addSourceWithContent("second.ts", "let x = \"</script>\";\n");
    JsonObject root = JsonParser.parseString(generator.toJson()).getAsJsonObject();
    assertThat(root.getAsJsonArray("sourcesContent").get(0).isJsonNull()).isTrue();
    assertThat(root.getAsJsonArray("sourcesContent").get(1).getAsString())
        .isEqualTo("let x = \"</script>\";\n");
  }

  @Test
  public void testInlineComment() {
    generator.addSource("input.ts");
    generator.addSimpleMapping(0, 0, 0, 0);
    String comment = generator.toInlineComment();
    String prefix = "//# sourceMappingURL=data:application/json;base64,";
    assertThat(comment).startsWith(prefix);
    String decoded =
        new String(BaseEncoding.base64().decode(comment.substring(prefix.length())), UTF_8);
    assertThat(decoded).isEqualTo(generator.toJson());
  }

  @Test
  public void testEmptyLinesAreSeparated() {
    generator.addSource("input.ts");
    generator.addSimpleMapping(2, 4, 0, 0);
    assertThat(generator.encodeMappings()).isEqualTo(";;IAAA");
  }

  @Test
  public void testOutOfOrderMappingIsRejected() {
    generator.addSource("input.ts");
    generator.addSimpleMapping(1, 5, 0, 0);
    assertThrows(IllegalArgumentException.class, () -> generator.addSimpleMapping(1, 4, 0, 0));
    assertThrows(IllegalArgumentException.class, () -> generator.addSimpleMapping(0, 9, 0, 0));
  }

  @Test
  public void testUnregisteredIndexesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> generator.addMapping(0, 0, 0, 0, 0));
    generator.addSource("input.ts");
    assertThrows(
        IllegalArgumentException.class, () -> generator.addMapping(0, 0, 0, 0, 0, /* name= */ 3));
    assertThrows(IllegalArgumentException.class, () -> generator.addMapping(0, 0, 0, -1, 0));
  }
}
