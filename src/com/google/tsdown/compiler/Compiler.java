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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.tsdown.ast.NodeArena;
import com.google.tsdown.ast.SourceFile;
import com.google.tsdown.compiler.TransformRecord.IncompleteLowering;
import com.google.tsdown.parsing.ParseException;
import com.google.tsdown.parsing.ParserRunner;
import com.google.tsdown.sourcemap.SourceMapGeneratorV3;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Compiles TypeScript files to JavaScript for the configured target. Each file is compiled on
 * its own: it gets its own arena, transform record, name generator and source map, so files can
 * be compiled in parallel.
 */
public class Compiler extends AbstractCompiler {
  private static final Logger logger = Logger.getLogger(Compiler.class.getName());

  public static final DiagnosticType PARSE_ERROR =
      DiagnosticType.error("JSC_PARSE_ERROR", "Parse error. {0}");

  private final SourceFile sourceFile;
  private final CompilerOptions options;
  private final ErrorManager errorManager;
  private final TransformRecord record;
  private final UniqueNameGenerator nameGenerator;

  @VisibleForTesting
  Compiler(NodeArena arena, CompilerOptions options, ErrorManager errorManager) {
    this.sourceFile = arena.getSourceFile();
    this.options = options;
    this.errorManager = errorManager;
    this.record = new TransformRecord(arena);
    this.nameGenerator = new UniqueNameGenerator(arena);
  }

  /**
   * Compiles one file. Syntax errors and constructs that cannot be converted are reported in the
   * result, which then has no output.
   *
   * @throws RuntimeException wrapping any internal error, naming the file
   */
  public static Result compile(SourceFile input, CompilerOptions options) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    ErrorManager errorManager = new LoggerErrorManager(logger);
    NodeArena arena;
    try {
      arena = ParserRunner.parse(input);
    } catch (ParseException e) {
      int offset = Math.min(e.getOffset(), input.getCode().length());
      errorManager.report(
          CheckLevel.ERROR,
          JSError.make(
              input.getName(),
              input.getLineOfOffset(offset) + 1,
              input.getColumnOfOffset(offset),
              PARSE_ERROR,
              e.getMessage()));
      errorManager.generateReport();
      return new Result(errorManager.getErrors(), errorManager.getWarnings(), null, null);
    }
    Compiler compiler = new Compiler(arena, options, errorManager);
    Result result;
    try {
      result = compiler.transpile();
    } catch (IllegalStateException | IllegalArgumentException | IndexOutOfBoundsException e) {
      throw new RuntimeException(
          "INTERNAL COMPILER ERROR.\nPlease report this problem.\n\n"
              + e.getMessage()
              + "\n  File: "
              + input.getName(),
          e);
    }
    logger.fine(() -> "Compiled " + input.getName() + " in " + stopwatch);
    return result;
  }

  /**
   * Compiles {@code inputs} on {@code threads} threads. Results are in input order.
   *
   * @throws RuntimeException if compiling any file fails with an internal error
   */
  public static ImmutableList<Result> compileAll(
      List<SourceFile> inputs, CompilerOptions options, int threads) {
    checkArgument(threads > 0, "threads must be positive: %s", threads);
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable, "tsdown-compiler");
          thread.setDaemon(true);
          return thread;
        };
    ThreadPoolExecutor poolExecutor =
        new ThreadPoolExecutor(
            threads,
            threads,
            Integer.MAX_VALUE,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<Runnable>(),
            threadFactory);
    ListeningExecutorService executorService = MoreExecutors.listeningDecorator(poolExecutor);
    List<ListenableFuture<Result>> futures = new ArrayList<>(inputs.size());
    for (SourceFile input : inputs) {
      futures.add(executorService.submit(() -> compile(input, options)));
    }
    poolExecutor.shutdown();
    try {
      return ImmutableList.copyOf(Futures.allAsList(futures).get());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException(e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw new RuntimeException(e.getCause());
    }
  }

  /** Returns the name of the JavaScript file emitted for {@code inputName}. */
  public static String getOutputName(String inputName) {
    if (inputName.endsWith(".d.ts")) {
      return inputName.substring(0, inputName.length() - ".d.ts".length()) + ".js";
    }
    if (inputName.endsWith(".mts")) {
      return inputName.substring(0, inputName.length() - ".mts".length()) + ".mjs";
    }
    if (inputName.endsWith(".cts")) {
      return inputName.substring(0, inputName.length() - ".cts".length()) + ".cjs";
    }
    for (String extension : ImmutableList.of(".tsx", ".ts")) {
      if (inputName.endsWith(extension)) {
        return inputName.substring(0, inputName.length() - extension.length()) + ".js";
      }
    }
    return inputName + ".js";
  }

  private Result transpile() {
    TranspilationPasses.process(this);
    for (IncompleteLowering marker : record.getIncompleteLowerings()) {
      report(marker.node(), TranspilationUtil.INCOMPLETE_LOWERING, marker.reason());
    }
    if (errorManager.hasHaltingErrors()) {
      errorManager.generateReport();
      return new Result(errorManager.getErrors(), errorManager.getWarnings(), null, null);
    }

    CodePrinter.Builder printer = new CodePrinter.Builder(record).setIndent(options.getIndent());
    SourceMapGeneratorV3 sourceMap = null;
    String outputName = getOutputName(sourceFile.getName());
    if (options.shouldGenerateSourceMap()) {
      String file =
          options.getSourceMapOutputPath() != null
              ? options.getSourceMapOutputPath()
              : getBaseName(outputName);
      sourceMap = new SourceMapGeneratorV3(file);
      int sourceIndex =
          options.getEmbedSourcesContent()
              ? sourceMap.addSourceWithContent(
                  getBaseName(sourceFile.getName()), sourceFile.getCode())
              : sourceMap.addSource(getBaseName(sourceFile.getName()));
      printer.setSourceMap(sourceMap, sourceIndex);
    }
    String code = printer.build();
    String sourceMapJson = null;
    if (sourceMap != null) {
      if (options.getInlineSourceMap()) {
        code += sourceMap.toInlineComment();
      } else {
        code += "//# sourceMappingURL=" + getBaseName(outputName) + ".map";
        sourceMapJson = sourceMap.toJson();
      }
    }
    errorManager.generateReport();
    return new Result(errorManager.getErrors(), errorManager.getWarnings(), code, sourceMapJson);
  }

  private static String getBaseName(String path) {
    int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
    return path.substring(slash + 1);
  }

  @Override
  public CompilerOptions getOptions() {
    return options;
  }

  @Override
  public SourceFile getSourceFile() {
    return sourceFile;
  }

  @Override
  public TransformRecord getRecord() {
    return record;
  }

  @Override
  public UniqueNameGenerator getUniqueNameGenerator() {
    return nameGenerator;
  }

  @Override
  public ErrorManager getErrorManager() {
    return errorManager;
  }

  @Override
  public AstFactory createAstFactory() {
    return new AstFactory(record);
  }
}
