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
import com.google.common.collect.SetMultimap;
import com.google.tsdown.ast.Node;
import com.google.tsdown.ast.NodeArena;
import com.google.tsdown.ast.Token;
import com.google.tsdown.compiler.CompilerOptions.LanguageMode;
import com.google.tsdown.compiler.CompilerOptions.ModuleKind;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Runs the lowering passes over one file, in an order where every pass sees the constructs
 * earlier passes produce already lowered, and then completes the output: temporaries are
 * declared, and the runtime helpers the passes called are added to the top of the file.
 */
public final class TranspilationPasses {
  private static final Logger logger = Logger.getLogger(TranspilationPasses.class.getName());

  private TranspilationPasses() {}

  /** A pass and the language level at which its feature is native. */
  private interface PassFactory {
    CompilerPass create(AbstractCompiler compiler);
  }

  private record PassConfig(String name, @Nullable LanguageMode nativeIn, PassFactory factory) {}

  private static final ImmutableList<PassConfig> PASSES =
      ImmutableList.of(
          new PassConfig("stripTypeScript", null, StripTypeScript::new),
          new PassConfig("rewriteModules", null, RewriteModules::new),
          new PassConfig("rewriteClasses", LanguageMode.ECMASCRIPT_NEXT, RewriteClasses::new),
          new PassConfig(
              "rewriteArrowFunctions", LanguageMode.ECMASCRIPT_2015, RewriteArrowFunctions::new),
          new PassConfig(
              "rewriteParameters", LanguageMode.ECMASCRIPT_2015, RewriteParameters::new),
          new PassConfig(
              "rewriteObjectLiterals", LanguageMode.ECMASCRIPT_2018, RewriteObjectLiterals::new),
          new PassConfig(
              "rewriteTemplateLiterals",
              LanguageMode.ECMASCRIPT_2015,
              RewriteTemplateLiterals::new),
          new PassConfig("rewriteSpread", LanguageMode.ECMASCRIPT_2015, RewriteSpread::new),
          new PassConfig(
              "rewriteDestructuring", LanguageMode.ECMASCRIPT_2019, RewriteDestructuring::new),
          new PassConfig("rewriteForOf", LanguageMode.ECMASCRIPT_2018, RewriteForOf::new),
          new PassConfig("rewriteOperators", LanguageMode.ECMASCRIPT_2021, RewriteOperators::new),
          new PassConfig(
              "rewriteBlockScoping", LanguageMode.ECMASCRIPT_2015, RewriteBlockScoping::new),
          new PassConfig(
              "rewriteAsyncAndGenerators",
              LanguageMode.ECMASCRIPT_2018,
              RewriteAsyncAndGenerators::new));

  /**
   * Lowers the file {@code compiler} is working on. All changes go to the compiler's transform
   * record; the arena is not modified.
   */
  public static void process(AbstractCompiler compiler) {
    CompilerOptions options = compiler.getOptions();
    TransformRecord record = compiler.getRecord();
    for (PassConfig config : PASSES) {
      if (!isEnabled(config, options)) {
        continue;
      }
      logger.fine(() -> "Running " + config.name() + " on " + compiler.getSourceFile().getName());
      config.factory().create(compiler).process(record.getRoot());
    }
    declareTemporaries(compiler);
    addFilePrologue(compiler);
  }

  /**
   * Lowers {@code arena} with errors collected in a {@link BasicErrorManager}, and returns the
   * record describing the output.
   */
  public static TransformRecord process(NodeArena arena, CompilerOptions options) {
    Compiler compiler = new Compiler(arena, options, new BasicErrorManager());
    process(compiler);
    return compiler.getRecord();
  }

  private static boolean isEnabled(PassConfig config, CompilerOptions options) {
    if (config.name().equals("rewriteModules")) {
      return options.getModule() == ModuleKind.COMMONJS;
    }
    return config.nativeIn() == null || options.getLanguageOut().needsLowering(config.nativeIn());
  }

  // Temporaries.

  /**
   * Declares {@code var _a, _b;} at the top of every function temporaries were requested for.
   * A function may have been replaced since, so requests made for any node the function stands
   * in for count too. The script's temporaries are declared by {@link #addFilePrologue}.
   */
  private static void declareTemporaries(AbstractCompiler compiler) {
    TransformRecord record = compiler.getRecord();
    SetMultimap<Integer, String> temporaries = record.getTemporaries();
    if (temporaries.isEmpty()) {
      return;
    }
    List<Node> functions = new ArrayList<>();
    NodeTraversal.traverse(
        compiler,
        record.getRoot(),
        new NodeTraversal.AbstractPostOrderCallback() {
          @Override
          public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
            if (n.is(Token.FUNCTION)) {
              functions.add(n);
            }
          }
        });
    AstFactory astFactory = compiler.createAstFactory();
    for (Node function : functions) {
      Set<String> names = getTemporaries(record, function);
      if (names.isEmpty()) {
        continue;
      }
      ImmutableList<Node> children = record.getChildren(function);
      Node body = children.get(2);
      Node declaration = createVar(astFactory, names);
      if (body.is(Token.BLOCK)) {
        NodeUtil.addStatementsAfterDirectives(record, body, ImmutableList.of(declaration));
      } else {
        Node block = astFactory.createBlock(declaration, astFactory.createReturn(body, body));
        record.replace(
            function,
            record.withFlags(
                function,
                function.getFlags() & ~Node.EXPRESSION_BODY,
                ImmutableList.of(children.get(0), children.get(1), block)));
      }
    }
  }

  /** The temporaries requested for {@code scope} or any node it was copied from. */
  private static Set<String> getTemporaries(TransformRecord record, Node scope) {
    Set<String> names = new LinkedHashSet<>();
    Node current = scope;
    while (true) {
      names.addAll(record.getTemporaries().get(current.getId()));
      if (current.getOrigin() == Node.NO_ORIGIN) {
        return names;
      }
      current = record.getNode(current.getOrigin());
    }
  }

  private static Node createVar(AstFactory astFactory, Set<String> names) {
    List<Node> declarators = new ArrayList<>();
    for (String name : names) {
      declarators.add(astFactory.createDeclarator(name, null, null));
    }
    return astFactory.createVar(declarators);
  }

  // Prologue.

  /**
   * Puts the top of the file in order: the source's directives, {@code "use strict"} when
   * needed, the runtime helpers, and the script's temporaries.
   */
  private static void addFilePrologue(AbstractCompiler compiler) {
    TransformRecord record = compiler.getRecord();
    AstFactory astFactory = compiler.createAstFactory();
    Node root = record.getRoot();
    ImmutableList<Node> statements = record.getChildren(root);
    int directiveCount = NodeUtil.getDirectiveCount(record, statements);

    List<Node> prologue = new ArrayList<>();
    if (needsUseStrict(compiler) && !hasUseStrict(record, statements.subList(0, directiveCount))) {
      prologue.add(astFactory.exprResult(astFactory.createString("use strict")));
    }
    for (RuntimeHelper helper : record.getRequiredHelpers()) {
      prologue.add(astFactory.createHelperText(helper));
    }
    Set<String> temporaries = getTemporaries(record, root);
    if (!temporaries.isEmpty()) {
      prologue.add(createVar(astFactory, temporaries));
    }
    if (prologue.isEmpty()) {
      return;
    }
    List<Node> newStatements = new ArrayList<>(statements.subList(0, directiveCount));
    newStatements.addAll(prologue);
    newStatements.addAll(statements.subList(directiveCount, statements.size()));
    record.replace(root, record.withChildren(root, newStatements));
  }

  private static boolean needsUseStrict(AbstractCompiler compiler) {
    if (compiler.getOptions().getEmitUseStrict()) {
      return true;
    }
    NodeArena arena = compiler.getRecord().getArena();
    return compiler.getOptions().getModule() == ModuleKind.COMMONJS
        && RewriteModules.isModule(arena.getChildren(arena.getRoot()));
  }

  private static boolean hasUseStrict(TransformRecord record, List<Node> directives) {
    for (Node directive : directives) {
      if ("use strict".equals(record.getChild(directive, 0).getString())) {
        return true;
      }
    }
    return false;
  }
}
