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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import com.google.tsdown.ast.Node;
import com.google.tsdown.ast.SourceFile;
import com.google.tsdown.sourcemap.Mapping;
import com.google.tsdown.sourcemap.SourceMapGeneratorV3;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** CodePrinter prints out JS code in the format tsc emits it. */
public final class CodePrinter {

  private CodePrinter() {}

  /** One position in the generated text and the source offset it maps to. */
  record PrintedMapping(int line, int column, int originalOffset, @Nullable String name) {
    boolean isMapped() {
      return originalOffset >= 0;
    }
  }

  /**
   * Prints code with one statement per line and nested blocks indented, tracking the generated
   * line and column so that every mapped node is recorded where its first character lands.
   */
  static final class PrettyCodePrinter extends CodeConsumer {
    private final StringBuilder code = new StringBuilder(1024);
    private final String indentUnit;
    private int indent = 0;
    private int lineIndex = 0;
    private int lineLength = 0;

    private final List<PrintedMapping> pending = new ArrayList<>();
    private final List<PrintedMapping> mappings = new ArrayList<>();

    PrettyCodePrinter(String indentUnit) {
      this.indentUnit = indentUnit;
    }

    String getCode() {
      return code.toString();
    }

    List<PrintedMapping> getMappings() {
      return mappings;
    }

    @Override
    char getLastChar() {
      return (code.length() > 0) ? code.charAt(code.length() - 1) : '\0';
    }

    @Override
    void startSourceMapping(int originalOffset, @Nullable String name) {
      pending.add(new PrintedMapping(-1, -1, originalOffset, name));
    }

    @Override
    void append(String str) {
      if (str.isEmpty()) {
        return;
      }
      if (lineLength == 0) {
        // Indentation is never the first character a mapping points at.
        String prefix = Strings.repeat(indentUnit, indent);
        code.append(prefix);
        lineLength = prefix.length();
      }
      if (!pending.isEmpty()) {
        int firstVisible = firstNonSpace(str);
        if (firstVisible >= 0) {
          flushPending(lineLength + firstVisible);
        }
      }
      code.append(str);
      int lastNewline = str.lastIndexOf('\n');
      if (lastNewline < 0) {
        lineLength += str.length();
      } else {
        for (int i = 0; i < str.length(); i++) {
          if (str.charAt(i) == '\n') {
            lineIndex++;
          }
        }
        lineLength = str.length() - lastNewline - 1;
      }
    }

    private static int firstNonSpace(String str) {
      for (int i = 0; i < str.length(); i++) {
        if (str.charAt(i) != ' ') {
          return i;
        }
      }
      return -1;
    }

    /**
     * Records the innermost mapped entry among those waiting at this position. An unmapped entry
     * is only kept when it ends a mapped segment on the same line.
     */
    private void flushPending(int column) {
      PrintedMapping chosen = null;
      for (PrintedMapping mapping : pending) {
        if (mapping.isMapped() || chosen == null || !chosen.isMapped()) {
          chosen = mapping;
        }
      }
      pending.clear();
      checkNotNull(chosen);
      if (!chosen.isMapped()) {
        PrintedMapping previous = mappings.isEmpty() ? null : mappings.get(mappings.size() - 1);
        if (previous == null || previous.line() != lineIndex || !previous.isMapped()) {
          return;
        }
      }
      mappings.add(new PrintedMapping(lineIndex, column, chosen.originalOffset(), chosen.name()));
    }

    @Override
    void startNewLine() {
      if (lineLength > 0) {
        code.append('\n');
        lineIndex++;
        lineLength = 0;
      }
    }

    @Override
    void endLine() {
      startNewLine();
    }

    @Override
    void indent() {
      indent++;
    }

    @Override
    void outdent() {
      indent--;
    }

    @Override
    void appendBlockStart() {
      maybeInsertSpace();
      append("{");
      indent++;
    }

    @Override
    void appendBlockEnd() {
      endLine();
      indent--;
      append("}");
    }

    @Override
    void appendEmptyBlock() {
      maybeInsertSpace();
      append("{ }");
    }

    @Override
    void listSeparator() {
      add(", ");
    }

    @Override
    void beginCaseBody() {
      super.beginCaseBody();
      indent++;
      endLine();
    }

    @Override
    void endCaseBody() {
      endLine();
      indent--;
    }

    @Override
    void appendOp(String op, boolean binOp) {
      if (binOp) {
        if (getLastChar() != ' ') {
          append(" ");
        }
        append(op);
        append(" ");
      } else {
        append(op);
      }
    }

    /** Adds a space unless the previous character already separates. */
    @Override
    void maybeInsertSpace() {
      char last = getLastChar();
      if (lineLength > 0 && last != ' ' && last != '(' && last != '[') {
        append(" ");
      }
    }

    @Override
    void endStatement() {
      append(";");
      endLine();
    }

    @Override
    void endFile() {
      pending.clear();
      startNewLine();
    }
  }

  /**
   * Builder for the printer. The tree and its transform record are printed as they will be
   * emitted; source positions are resolved through the record.
   */
  public static final class Builder {
    private final TransformRecord record;
    private Node root;
    private String indent = "    ";
    private @Nullable SourceMapGeneratorV3 sourceMap = null;
    private int sourceIndex = Mapping.UNMAPPED;

    public Builder(TransformRecord record) {
      this.record = record;
      this.root = record.getRoot();
    }

    /** Prints {@code node} instead of the record's root. */
    public Builder setRoot(Node node) {
      this.root = node;
      return this;
    }

    public Builder setIndent(String indent) {
      this.indent = indent;
      return this;
    }

    /**
     * Sets the generator the printed positions are recorded into, and the index under which the
     * record's source file was registered with it.
     */
    public Builder setSourceMap(SourceMapGeneratorV3 sourceMap, int sourceIndex) {
      this.sourceMap = sourceMap;
      this.sourceIndex = sourceIndex;
      return this;
    }

    /** Generates the code. */
    public String build() {
      PrettyCodePrinter printer = new PrettyCodePrinter(indent);
      CodeGenerator generator = new CodeGenerator(printer, record);
      generator.add(root);
      printer.endFile();
      if (sourceMap != null) {
        writeMappings(printer.getMappings(), sourceMap, sourceIndex, record.getSourceFile());
      }
      return printer.getCode();
    }

    private static void writeMappings(
        List<PrintedMapping> mappings,
        SourceMapGeneratorV3 sourceMap,
        int sourceIndex,
        SourceFile sourceFile) {
      for (PrintedMapping mapping : mappings) {
        if (!mapping.isMapped()) {
          sourceMap.addMapping(mapping.line(), mapping.column());
          continue;
        }
        int offset = mapping.originalOffset();
        int line = sourceFile.getLineOfOffset(offset);
        int column = sourceFile.getColumnOfOffset(offset);
        if (mapping.name() != null) {
          int nameIndex = sourceMap.addName(mapping.name());
          sourceMap.addMapping(
              mapping.line(), mapping.column(), sourceIndex, line, column, nameIndex);
        } else {
          sourceMap.addMapping(mapping.line(), mapping.column(), sourceIndex, line, column);
        }
      }
    }
  }
}
