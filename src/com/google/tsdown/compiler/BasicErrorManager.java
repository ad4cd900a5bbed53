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

import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.TreeSet;
import org.jspecify.annotations.Nullable;

/**
 * An error manager that sorts the errors and warnings reported to it by source position and
 * counts them. Subclasses decide how a report is printed by implementing {@link #println} and
 * {@link #printSummary}; this base implementation prints nothing.
 */
public class BasicErrorManager implements ErrorManager {

  private final TreeSet<ErrorWithLevel> messages = new TreeSet<>(new LeveledJSErrorComparator());
  private int errorCount = 0;
  private int warningCount = 0;

  @Override
  public void report(CheckLevel level, JSError error) {
    if (!level.isOn()) {
      return;
    }
    if (messages.add(new ErrorWithLevel(error, level))) {
      if (level == CheckLevel.ERROR) {
        errorCount++;
      } else {
        warningCount++;
      }
    }
  }

  @Override
  public void generateReport() {
    for (ErrorWithLevel message : messages) {
      println(message.level, message.error);
    }
    printSummary();
  }

  /** Prints a single error. */
  public void println(CheckLevel level, JSError error) {}

  /** Prints the summary after all errors. */
  protected void printSummary() {}

  @Override
  public int getErrorCount() {
    return errorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<JSError> getErrors() {
    return toList(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<JSError> getWarnings() {
    return toList(CheckLevel.WARNING);
  }

  private ImmutableList<JSError> toList(CheckLevel level) {
    ImmutableList.Builder<JSError> errors = ImmutableList.builder();
    for (ErrorWithLevel p : messages) {
      if (p.level == level) {
        errors.add(p.error);
      }
    }
    return errors.build();
  }

  /**
   * Orders errors by (file name, line number, level, character number, description). Errors
   * without a source name come first.
   */
  static final class LeveledJSErrorComparator implements Comparator<ErrorWithLevel> {
    @Override
    public int compare(ErrorWithLevel p1, ErrorWithLevel p2) {
      int result = compareNullable(p1.error.sourceName(), p2.error.sourceName());
      if (result != 0) {
        return result;
      }
      result = Integer.compare(p1.error.lineno(), p2.error.lineno());
      if (result != 0) {
        return result;
      }
      // Errors before warnings on the same line.
      result = p1.level.compareTo(p2.level);
      if (result != 0) {
        return result;
      }
      result = Integer.compare(p1.error.charno(), p2.error.charno());
      if (result != 0) {
        return result;
      }
      result = p1.error.type().compareTo(p2.error.type());
      if (result != 0) {
        return result;
      }
      return p1.error.description().compareTo(p2.error.description());
    }

    private static int compareNullable(@Nullable String a, @Nullable String b) {
      if (a == null) {
        return b == null ? 0 : -1;
      }
      return b == null ? 1 : a.compareTo(b);
    }
  }

  static final class ErrorWithLevel {
    final JSError error;
    final CheckLevel level;

    ErrorWithLevel(JSError error, CheckLevel level) {
      this.error = error;
      this.level = level;
    }
  }
}
