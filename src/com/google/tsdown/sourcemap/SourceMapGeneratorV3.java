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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static com.google.tsdown.sourcemap.Mapping.UNMAPPED;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.io.BaseEncoding;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Collects source mappings for one generated file and serializes them as a version 3 source map.
 *
 * <p>Mappings are point entries added in generation order. The {@code sources} and {@code names}
 * tables are value-interned: the first reference assigns an index that later references reuse.
 * Each generator instance belongs to a single output file.
 */
public final class SourceMapGeneratorV3 {

  private static final String INLINE_PREFIX =
      "//# sourceMappingURL=data:application/json;base64,";

  private final String file;

  private final List<Mapping> mappings = new ArrayList<>();

  /** Source file paths to their index in the sources table. */
  private final LinkedHashMap<String, Integer> sourceFileMap = new LinkedHashMap<>();

  /** Parallel to {@link #sourceFileMap}; null where no content was registered. */
  private final List<@Nullable String> sourcesContent = new ArrayList<>();

  /** Identifier names to their index in the names table. */
  private final LinkedHashMap<String, Integer> originalNameMap = new LinkedHashMap<>();

  private @Nullable Mapping lastMapping;

  public SourceMapGeneratorV3(String file) {
    this.file = checkNotNull(file);
  }

  public String getFile() {
    return file;
  }

  /** Registers a source path, returning its index in the sources table. */
  @CanIgnoreReturnValue
  public int addSource(String path) {
    checkNotNull(path);
    Integer index = sourceFileMap.get(path);
    if (index != null) {
      return index;
    }
    int newIndex = sourceFileMap.size();
    sourceFileMap.put(path, newIndex);
    sourcesContent.add(null);
    return newIndex;
  }

  /** Registers a source path along with its exact text, emitted as {@code sourcesContent}. */
  @CanIgnoreReturnValue
  public int addSourceWithContent(String path, String content) {
    int index = addSource(path);
    sourcesContent.set(index, checkNotNull(content));
    return index;
  }

  /** Registers an identifier, returning its index in the names table. */
  @CanIgnoreReturnValue
  public int addName(String identifier) {
    checkNotNull(identifier);
    Integer index = originalNameMap.get(identifier);
    if (index != null) {
      return index;
    }
    int newIndex = originalNameMap.size();
    originalNameMap.put(identifier, newIndex);
    return newIndex;
  }

  /** Adds a segment of generated text with no original position. */
  public void addMapping(int generatedLine, int generatedColumn) {
    addMapping(generatedLine, generatedColumn, UNMAPPED, UNMAPPED, UNMAPPED, UNMAPPED);
  }

  /** Adds a mapping without a name. */
  public void addMapping(
      int generatedLine,
      int generatedColumn,
      int sourceIndex,
      int originalLine,
      int originalColumn) {
    addMapping(
        generatedLine, generatedColumn, sourceIndex, originalLine, originalColumn, UNMAPPED);
  }

  /**
   * Appends one correspondence entry. Entries must arrive in generation order. Source fields are
   * either all present or all {@link Mapping#UNMAPPED}; a name requires a source.
   *
   * @throws IllegalArgumentException if the entry is out of order, refers to an index that was
   *     never registered, or has a negative position
   */
  public void addMapping(
      int generatedLine,
      int generatedColumn,
      int sourceIndex,
      int originalLine,
      int originalColumn,
      int nameIndex) {
    checkArgument(
        generatedLine >= 0 && generatedColumn >= 0,
        "negative generated position %s:%s",
        generatedLine,
        generatedColumn);
    if (lastMapping != null) {
      checkArgument(
          generatedLine > lastMapping.getGeneratedLine()
              || (generatedLine == lastMapping.getGeneratedLine()
                  && generatedColumn >= lastMapping.getGeneratedColumn()),
          "mapping at %s:%s is out of generation order",
          generatedLine,
          generatedColumn);
    }
    if (sourceIndex == UNMAPPED) {
      checkArgument(
          originalLine == UNMAPPED && originalColumn == UNMAPPED && nameIndex == UNMAPPED,
          "an unmapped segment cannot carry original fields");
    } else {
      checkArgument(
          sourceIndex >= 0 && sourceIndex < sourceFileMap.size(),
          "unregistered source index %s",
          sourceIndex);
      checkArgument(
          originalLine >= 0 && originalColumn >= 0,
          "negative original position %s:%s",
          originalLine,
          originalColumn);
      checkArgument(
          nameIndex == UNMAPPED || (nameIndex >= 0 && nameIndex < originalNameMap.size()),
          "unregistered name index %s",
          nameIndex);
    }
    Mapping mapping =
        Mapping.create(
            generatedLine, generatedColumn, sourceIndex, originalLine, originalColumn, nameIndex);
    mappings.add(mapping);
    lastMapping = mapping;
  }

  /** Maps a generated position to a position in the first registered source. */
  public void addSimpleMapping(
      int generatedLine, int generatedColumn, int originalLine, int originalColumn) {
    checkState(!sourceFileMap.isEmpty(), "no source registered");
    addMapping(generatedLine, generatedColumn, 0, originalLine, originalColumn, UNMAPPED);
  }

  public ImmutableList<Mapping> getMappings() {
    return ImmutableList.copyOf(mappings);
  }

  public ImmutableList<String> getSources() {
    return ImmutableList.copyOf(sourceFileMap.keySet());
  }

  public ImmutableList<String> getNames() {
    return ImmutableList.copyOf(originalNameMap.keySet());
  }

  /** Writes the source map as a single-line JSON object. */
  public void appendTo(Appendable out) throws IOException {
    Writer writer = out instanceof Writer ? (Writer) out : new AppendableWriter(out);
    JsonWriter json = new JsonWriter(writer);
    json.setHtmlSafe(false);
    json.beginObject();
    json.name("version").value(3);
    json.name("file").value(file);
    json.name("sources");
    writeStrings(json, sourceFileMap);
    if (sourcesContent.stream().anyMatch(c -> c != null)) {
      json.name("sourcesContent");
      json.beginArray();
      for (String content : sourcesContent) {
        if (content == null) {
          json.nullValue();
        } else {
          json.value(content);
        }
      }
      json.endArray();
    }
    json.name("names");
    writeStrings(json, originalNameMap);
    json.name("mappings").value(encodeMappings());
    json.endObject();
    json.flush();
  }

  /** Returns the version 3 JSON document. */
  public String toJson() {
    StringWriter out = new StringWriter();
    try {
      appendTo(out);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return out.toString();
  }

  /** Returns a comment embedding {@link #toJson()} as a base64 data URI. */
  public String toInlineComment() {
    return INLINE_PREFIX + BaseEncoding.base64().encode(toJson().getBytes(UTF_8));
  }

  private static void writeStrings(JsonWriter json, Map<String, Integer> map) throws IOException {
    json.beginArray();
    for (String key : map.keySet()) {
      json.value(key);
    }
    json.endArray();
  }

  /** Encodes the mappings stream: {@code ;} between generated lines, {@code ,} within one. */
  String encodeMappings() {
    StringBuilder out = new StringBuilder();
    try {
      new LineMapper(out).appendLineMappings();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return out.toString();
  }

  private final class LineMapper {
    private final Appendable out;

    private int previousLine = 0;
    private int previousColumn = 0;
    private boolean lineHasEntries = false;

    // Previous values used for storing relative ids.
    private int previousSourceFileId;
    private int previousSourceLine;
    private int previousSourceColumn;
    private int previousNameId;

    LineMapper(Appendable out) {
      this.out = out;
    }

    void appendLineMappings() throws IOException {
      for (Mapping m : mappings) {
        while (previousLine < m.getGeneratedLine()) {
          out.append(';');
          previousLine++;
          previousColumn = 0;
          lineHasEntries = false;
        }
        if (lineHasEntries) {
          out.append(',');
        }
        writeEntry(m);
        lineHasEntries = true;
      }
    }

    /**
     * Writes an entry. The values are stored relative to the last seen values for each field and
     * encoded as Base64VLQs.
     */
    private void writeEntry(Mapping m) throws IOException {
      int column = m.getGeneratedColumn();
      Base64VLQ.encode(out, column - previousColumn);
      previousColumn = column;
      if (!m.hasSource()) {
        return;
      }
      Base64VLQ.encode(out, m.getSourceIndex() - previousSourceFileId);
      previousSourceFileId = m.getSourceIndex();

      Base64VLQ.encode(out, m.getOriginalLine() - previousSourceLine);
      previousSourceLine = m.getOriginalLine();

      Base64VLQ.encode(out, m.getOriginalColumn() - previousSourceColumn);
      previousSourceColumn = m.getOriginalColumn();

      if (m.hasName()) {
        Base64VLQ.encode(out, m.getNameIndex() - previousNameId);
        previousNameId = m.getNameIndex();
      }
    }
  }

  /** Adapts an {@link Appendable} for Gson's writer. */
  private static final class AppendableWriter extends Writer {
    private final Appendable out;

    AppendableWriter(Appendable out) {
      this.out = out;
    }

    @Override
    public void write(char[] buffer, int offset, int length) throws IOException {
      out.append(new String(buffer, offset, length));
    }

    @Override
    public void flush() {}

    @Override
    public void close() {}
  }
}
