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

package com.google.tsdown.parsing;

import com.google.tsdown.ast.NodeArena;
import com.google.tsdown.ast.SourceFile;
import java.util.logging.Logger;

/** Entry point to the parser. */
public final class ParserRunner {

  private static final Logger logger = Logger.getLogger(ParserRunner.class.getName());

  private ParserRunner() {}

  /**
   * Parses a TypeScript source file.
   *
   * @throws ParseException if the file is not syntactically valid
   */
  public static NodeArena parse(SourceFile sourceFile) {
    ParseTree tree = new Parser(sourceFile).parseScript();
    NodeArena arena = IRFactory.transformTree(tree, sourceFile);
    logger.fine(() -> "Parsed " + sourceFile.getName() + " into " + arena.size() + " nodes");
    return arena;
  }

  /** Returns the value a template literal's raw text evaluates to. */
  public static String cookTemplateString(String raw) {
    return Scanner.cookTemplateString(raw);
  }

  /** Whether {@code name} can be written as an identifier or a dotted property name. */
  public static boolean isIdentifierName(String name) {
    if (name.isEmpty() || !Scanner.isIdentifierStart(name.charAt(0))) {
      return false;
    }
    for (int i = 1; i < name.length(); i++) {
      if (!Scanner.isIdentifierPart(name.charAt(i))) {
        return false;
      }
    }
    return true;
  }
}
