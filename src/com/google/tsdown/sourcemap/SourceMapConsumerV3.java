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

import static com.google.tsdown.sourcemap.Mapping.UNMAPPED;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.tsdown.sourcemap.Base64VLQ.StringCharIterator;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Parses version 3 source maps and answers generated-to-original position queries. */
public final class SourceMapConsumerV3 {

  private String file = "";
  private ImmutableList<String> sources = ImmutableList.of();
  private ImmutableList<String> names = ImmutableList.of();
  private List<@Nullable String> sourcesContent = new ArrayList<>();
  private final List<Mapping> mappings = new ArrayList<>();
  // Slots hold an empty list for generated lines without entries.
  private final List<List<Mapping>> lines = new ArrayList<>();

  /** Parses the given contents containing a source map. */
  public void parse(String contents) throws SourceMapParseException {
    JsonObject sourceMapRoot;
    try {
      JsonElement root = JsonParser.parseString(contents);
      if (!root.isJsonObject()) {
        throw new SourceMapParseException("Source map is not a JSON object");
      }
      sourceMapRoot = root.getAsJsonObject();
    } catch (JsonParseException ex) {
      throw new SourceMapParseException("JSON parse exception: " + ex.getMessage(), ex);
    }
    parse(sourceMapRoot);
  }

  /** Parses an already decoded source map object. */
  public void parse(JsonObject sourceMapRoot) throws SourceMapParseException {
    try {
      JsonElement version = sourceMapRoot.get("version");
      if (version == null || version.getAsInt() != 3) {
        throw new SourceMapParseException("Unknown version: " + version);
      }
      if (sourceMapRoot.has("file")) {
        file = sourceMapRoot.get("file").getAsString();
      }
      if (sourceMapRoot.has("sections")) {
        throw new SourceMapParseException("Index maps are not supported");
      }
      sources = getStringList(sourceMapRoot, "sources");
      names = getStringList(sourceMapRoot, "names");
      sourcesContent = new ArrayList<>();
      if (sourceMapRoot.has("sourcesContent")) {
        for (JsonElement e : sourceMapRoot.getAsJsonArray("sourcesContent")) {
          sourcesContent.add(e.isJsonNull() ? null : e.getAsString());
        }
      }
      JsonElement lineMap = sourceMapRoot.get("mappings");
      if (lineMap == null) {
        throw new SourceMapParseException("Missing 'mappings' field");
      }
      mappings.clear();
      lines.clear();
      new MappingBuilder(lineMap.getAsString()).build();
    } catch (IllegalStateException | ClassCastException | UnsupportedOperationException ex) {
      throw new SourceMapParseException("Malformed source map: " + ex.getMessage(), ex);
    } catch (IllegalArgumentException ex) {
      throw new SourceMapParseException("Malformed mappings: " + ex.getMessage(), ex);
    }
  }

  private static ImmutableList<String> getStringList(JsonObject root, String field)
      throws SourceMapParseException {
    JsonArray array = root.getAsJsonArray(field);
    if (array == null) {
      throw new SourceMapParseException("Missing '" + field + "' field");
    }
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (JsonElement e : array) {
      result.add(e.getAsString());
    }
    return result.build();
  }

  public String getFile() {
    return file;
  }

  public ImmutableList<String> getOriginalSources() {
    return sources;
  }

  public ImmutableList<String> getNames() {
    return names;
  }

  /** Returns the embedded content of the given source, or null when none was embedded. */
  public @Nullable String getSourceContent(int sourceIndex) {
    return sourceIndex < sourcesContent.size() ? sourcesContent.get(sourceIndex) : null;
  }

  /** All decoded entries, in generation order. */
  public ImmutableList<Mapping> getMappings() {
    return ImmutableList.copyOf(mappings);
  }

  /** The decoded entries of one generated line. */
  public ImmutableList<Mapping> getMappingsForLine(int lineNumber) {
    if (lineNumber < 0 || lineNumber >= lines.size()) {
      return ImmutableList.of();
    }
    return ImmutableList.copyOf(lines.get(lineNumber));
  }

  /**
   * Resolves a generated position to the entry covering it: the entry starting at that column, or
   * else the closest entry before it on the same line.
   *
   * @return null when the position is not covered by a mapped entry
   */
  public @Nullable OriginalMapping getMappingForLine(int lineNumber, int column) {
    Mapping found = null;
    for (Mapping m : getMappingsForLine(lineNumber)) {
      if (m.getGeneratedColumn() > column) {
        break;
      }
      found = m;
    }
    if (found == null || !found.hasSource()) {
      return null;
    }
    OriginalMapping.Builder builder =
        OriginalMapping.builder()
            .setOriginalFile(sources.get(found.getSourceIndex()))
            .setLineNumber(found.getOriginalLine())
            .setColumnPosition(found.getOriginalColumn())
            .setPrecision(
                found.getGeneratedColumn() == column
                    ? OriginalMapping.Precision.EXACT
                    : OriginalMapping.Precision.APPROXIMATE_LINE);
    if (found.hasName()) {
      builder.setIdentifier(names.get(found.getNameIndex()));
    }
    return builder.build();
  }

  private final class MappingBuilder {
    private static final int MAX_ENTRY_VALUES = 5;
    private final StringCharIterator content;
    private int line = 0;
    private int previousCol = 0;
    private int previousSrcId = 0;
    private int previousSrcLine = 0;
    private int previousSrcColumn = 0;
    private int previousNameId = 0;

    MappingBuilder(String lineMap) {
      this.content = new StringCharIterator(lineMap, 0);
    }

    void build() throws SourceMapParseException {
      int[] temp = new int[MAX_ENTRY_VALUES];
      List<Mapping> entries = new ArrayList<>();
      while (content.hasNext()) {
        // ';' denotes a new line.
        if (tryConsumeToken(';')) {
          lines.add(entries);
          entries = new ArrayList<>();
          line++;
          previousCol = 0;
        } else {
          int entryValues = 0;
          while (!entryComplete()) {
            if (entryValues == MAX_ENTRY_VALUES) {
              throw new SourceMapParseException("Too many values in entry on line " + line);
            }
            temp[entryValues] = Base64VLQ.decode(content);
            entryValues++;
          }
          Mapping entry = decodeEntry(temp, entryValues);
          entries.add(entry);
          mappings.add(entry);

          // Consume the separating token, if there is one.
          tryConsumeToken(',');
        }
      }
      lines.add(entries);
    }

    /**
     * Decodes the next entry, using the previous encountered values to decode the relative
     * values. The first values, if present, are in the following order:
     *
     * <ol start="0">
     *   <li>the starting column in the current line of the generated file
     *   <li>the id of the original source file
     *   <li>the starting line in the original source
     *   <li>the starting column in the original source
     *   <li>the id of the original symbol name
     * </ol>
     */
    private Mapping decodeEntry(int[] vals, int entryValues) throws SourceMapParseException {
      switch (entryValues) {
        case 1:
          previousCol = vals[0] + previousCol;
          return Mapping.unmapped(line, previousCol);
        case 4:
        case 5:
          previousCol = vals[0] + previousCol;
          previousSrcId = vals[1] + previousSrcId;
          previousSrcLine = vals[2] + previousSrcLine;
          previousSrcColumn = vals[3] + previousSrcColumn;
          int nameId = UNMAPPED;
          if (entryValues == 5) {
            previousNameId = vals[4] + previousNameId;
            nameId = previousNameId;
            validateIndex(nameId, names.size(), "name");
          }
          validateIndex(previousSrcId, sources.size(), "source");
          if (previousSrcLine < 0 || previousSrcColumn < 0 || previousCol < 0) {
            throw new SourceMapParseException("Negative position on line " + line);
          }
          return Mapping.create(
              line, previousCol, previousSrcId, previousSrcLine, previousSrcColumn, nameId);
        default:
          throw new SourceMapParseException(
              "Unexpected number of values for entry: " + entryValues + " on line " + line);
      }
    }

    private void validateIndex(int index, int size, String table)
        throws SourceMapParseException {
      if (index < 0 || index >= size) {
        throw new SourceMapParseException(
            "Entry on line " + line + " refers to missing " + table + " " + index);
      }
    }

    private boolean tryConsumeToken(char token) {
      if (content.hasNext() && content.peek() == token) {
        // consume the comma
        content.next();
        return true;
      }
      return false;
    }

    private boolean entryComplete() {
      if (!content.hasNext()) {
        return true;
      }
      char c = content.peek();
      return c == ';' || c == ',';
    }
  }
}
