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
import com.google.tsdown.ast.Node;
import com.google.tsdown.ast.NodeArena;
import com.google.tsdown.ast.Token;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites ES module syntax into CommonJS: imports become {@code require} calls whose bindings
 * are read as properties of the module object, and exports become assignments to
 * {@code exports}.
 */
final class RewriteModules implements NodeTraversal.Callback, CompilerPass {
  private static final Logger logger = Logger.getLogger(RewriteModules.class.getName());

  /** Where an imported binding is read from: {@code moduleVar.property}. */
  private record ImportedBinding(String moduleVar, String property) {}

  private final AbstractCompiler compiler;
  private final TransformRecord record;
  private final AstFactory astFactory;
  private final UniqueNameGenerator nameGenerator;

  private final Map<String, ImportedBinding> importedBindings = new HashMap<>();

  /** Exported variables, which live only as properties of {@code exports}. */
  private final Set<String> exportedVars = new HashSet<>();

  /** Exported local bindings and the names they are exported under. */
  private final Map<String, String> localExports = new LinkedHashMap<>();

  /** Names assigned {@code void 0} at the top, in export order. */
  private final Set<String> exportedNames = new LinkedHashSet<>();

  /** Export assignments of function declarations, which are hoisted to the top. */
  private final List<Node> hoistedExports = new ArrayList<>();

  /** Names declared by the scopes enclosing the node being visited. */
  private final Deque<Set<String>> shadowingScopes = new ArrayDeque<>();

  RewriteModules(AbstractCompiler compiler) {
    this.compiler = compiler;
    this.record = compiler.getRecord();
    this.astFactory = compiler.createAstFactory();
    this.nameGenerator = compiler.getUniqueNameGenerator();
  }

  @Override
  public void process(Node root) {
    // A file whose imports were all type-only is still a module.
    NodeArena arena = record.getArena();
    if (!isModule(arena.getChildren(arena.getRoot()))) {
      return;
    }
    ImmutableList<Node> statements = record.getChildren(root);
    Map<String, Node> topLevelDeclarations = collectTopLevelDeclarations(statements);
    for (Node statement : statements) {
      switch (statement.getToken()) {
        case IMPORT:
          visitImport(statement);
          break;
        case EXPORT:
          visitExport(root, statement, topLevelDeclarations);
          break;
        case EXPORT_ALL:
          visitExportAll(statement);
          break;
        default:
          break;
      }
    }
    Node rewrittenRoot = record.getRoot();
    NodeTraversal.traverse(compiler, rewrittenRoot, this);
    addPreamble(rewrittenRoot);
    logger.fine(
        () ->
            "Rewrote module "
                + compiler.getSourceFile().getName()
                + " with "
                + exportedNames.size()
                + " exports");
  }

  static boolean isModule(List<Node> statements) {
    for (Node statement : statements) {
      if (statement.is(Token.IMPORT)
          || statement.is(Token.EXPORT)
          || statement.is(Token.EXPORT_ALL)) {
        return true;
      }
    }
    return false;
  }

  private Map<String, Node> collectTopLevelDeclarations(List<Node> statements) {
    Map<String, Node> declarations = new HashMap<>();
    for (Node statement : statements) {
      if (NodeUtil.isNameDeclaration(statement)) {
        for (Node name : NodeUtil.getDeclaredNames(record, statement)) {
          declarations.put(name.getNonNullString(), statement);
        }
      } else if (statement.is(Token.FUNCTION) || statement.is(Token.CLASS)) {
        Node name = record.getChild(statement, 0);
        if (name.is(Token.NAME)) {
          declarations.put(name.getNonNullString(), statement);
        }
      }
    }
    return declarations;
  }

  // Imports.

  private void visitImport(Node n) {
    ImmutableList<Node> children = record.getChildren(n);
    Node defaultName = children.get(0);
    Node bindings = children.get(1);
    Node moduleName = children.get(2);
    if (defaultName.is(Token.EMPTY) && bindings.is(Token.EMPTY)) {
      record.replace(n, astFactory.exprResult(createRequire(moduleName, n)));
      return;
    }
    String moduleVar;
    if (bindings.is(Token.IMPORT_STAR)) {
      moduleVar = bindings.getNonNullString();
    } else {
      moduleVar = nameGenerator.numberedName(moduleBaseName(moduleName.getNonNullString()));
    }
    if (defaultName.is(Token.NAME)) {
      importedBindings.put(
          defaultName.getNonNullString(), new ImportedBinding(moduleVar, "default"));
    }
    if (bindings.is(Token.IMPORT_SPECS)) {
      for (Node spec : record.getChildren(bindings)) {
        String imported = record.getChild(spec, 0).getNonNullString();
        String local = record.getChild(spec, 1).getNonNullString();
        importedBindings.put(local, new ImportedBinding(moduleVar, imported));
      }
    }
    record.replace(
        n, astFactory.createSingleVarNameDeclaration(moduleVar, createRequire(moduleName, n), n));
  }

  private Node createRequire(Node moduleName, Node origin) {
    return astFactory.createCall(
        astFactory.createName("require"), ImmutableList.of(moduleName), origin);
  }

  /** Derives a variable name from a module specifier: {@code "./foo-bar.js"} gives foo_bar. */
  static String moduleBaseName(String specifier) {
    String base = specifier.substring(specifier.lastIndexOf('/') + 1);
    int dot = base.lastIndexOf('.');
    if (dot > 0) {
      base = base.substring(0, dot);
    }
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < base.length(); i++) {
      char c = base.charAt(i);
      sb.append(CodeConsumer.isWordChar(c) && c < 0x80 ? c : '_');
    }
    if (sb.length() == 0) {
      return "module";
    }
    if (Character.isDigit(sb.charAt(0))) {
      sb.insert(0, '_');
    }
    return sb.toString();
  }

  // Exports.

  private void visitExport(Node root, Node n, Map<String, Node> topLevelDeclarations) {
    ImmutableList<Node> children = record.getChildren(n);
    Node declaration = children.get(0);
    if (n.hasFlag(Node.DEFAULT)) {
      visitExportDefault(n, declaration);
      return;
    }
    switch (declaration.getToken()) {
      case FUNCTION:
        {
          String name = record.getChild(declaration, 0).getNonNullString();
          record.replace(n, declaration);
          hoistedExports.add(createExportAssignment(name, astFactory.createName(name), n));
          break;
        }
      case CLASS:
        {
          String name = record.getChild(declaration, 0).getNonNullString();
          exportedNames.add(name);
          record.replace(n, declaration);
          record.insertAfter(n, createExportAssignment(name, astFactory.createName(name), n));
          break;
        }
      case VAR:
      case LET:
      case CONST:
        visitExportedDeclaration(root, n, declaration);
        break;
      case EXPORT_SPECS:
        if (children.get(1).is(Token.EMPTY)) {
          visitLocalExportSpecs(n, declaration, topLevelDeclarations);
        } else {
          visitReexportSpecs(n, declaration, children.get(1));
        }
        break;
      default:
        throw new IllegalStateException("Unexpected export: " + declaration);
    }
  }

  private void visitExportDefault(Node n, Node value) {
    if (value.is(Token.FUNCTION) || value.is(Token.CLASS)) {
      Node nameNode = record.getChild(value, 0);
      String name;
      Node declaration = value;
      if (nameNode.is(Token.NAME)) {
        name = nameNode.getNonNullString();
      } else {
        name = nameGenerator.numberedName("default");
        List<Node> children = new ArrayList<>(record.getChildren(value));
        children.set(0, astFactory.createName(name));
        declaration = record.withChildren(value, children);
      }
      record.replace(n, declaration);
      Node assignment = createExportAssignment("default", astFactory.createName(name), n);
      if (value.is(Token.FUNCTION)) {
        hoistedExports.add(assignment);
      } else {
        exportedNames.add("default");
        record.insertAfter(n, assignment);
      }
      return;
    }
    exportedNames.add("default");
    record.replace(n, createExportAssignment("default", value, n));
  }

  /**
   * {@code export const a = 1, b;} becomes {@code exports.a = 1;}. Destructured declarations
   * keep their local bindings and copy them to {@code exports} afterwards.
   */
  private void visitExportedDeclaration(Node root, Node n, Node declaration) {
    List<Node> statements = new ArrayList<>();
    List<Node> assignments = new ArrayList<>();
    for (Node declarator : record.getChildren(declaration)) {
      if (declarator.is(Token.NAME)) {
        String name = declarator.getNonNullString();
        exportedVars.add(name);
        exportedNames.add(name);
        Node value = NodeUtil.getDeclaratorValue(record, declarator);
        if (value != null) {
          assignments.add(
              astFactory.createAssign(createExportsAccess(name, declarator), value, declarator));
        }
        continue;
      }
      if (!assignments.isEmpty()) {
        statements.add(astFactory.exprResult(astFactory.createCommas(assignments)));
        assignments = new ArrayList<>();
      }
      statements.add(record.withChildren(declaration, ImmutableList.of(declarator)));
      for (Node name : NodeUtil.getDeclaredNames(record, declarator)) {
        String exported = name.getNonNullString();
        exportedNames.add(exported);
        localExports.put(exported, exported);
        statements.add(
            createExportAssignment(exported, astFactory.createName(exported, name), declarator));
      }
    }
    if (!assignments.isEmpty()) {
      statements.add(astFactory.exprResult(astFactory.createCommas(assignments)));
    }
    NodeUtil.replaceWithStatements(astFactory, root, n, statements);
  }

  private void visitLocalExportSpecs(
      Node n, Node specs, Map<String, Node> topLevelDeclarations) {
    List<Node> atExportSite = new ArrayList<>();
    for (Node spec : record.getChildren(specs)) {
      String local = record.getChild(spec, 0).getNonNullString();
      String exported = record.getChild(spec, 1).getNonNullString();
      ImportedBinding imported = importedBindings.get(local);
      if (imported != null) {
        exportedNames.add(exported);
        atExportSite.add(
            createReexport(exported, imported.moduleVar(), imported.property(), spec));
        continue;
      }
      Node declaration = topLevelDeclarations.get(local);
      Node assignment = createExportAssignment(exported, astFactory.createName(local), spec);
      if (declaration != null && declaration.is(Token.FUNCTION)) {
        hoistedExports.add(assignment);
        continue;
      }
      exportedNames.add(exported);
      localExports.put(local, exported);
      if (declaration != null) {
        record.insertAfter(declaration, assignment);
      } else {
        atExportSite.add(assignment);
      }
    }
    if (atExportSite.isEmpty()) {
      record.elide(n);
    } else {
      record.replace(n, atExportSite.get(0));
      record.insertAfter(n, atExportSite.subList(1, atExportSite.size()));
    }
  }

  /** {@code export { a as b } from "m"}. */
  private void visitReexportSpecs(Node n, Node specs, Node moduleName) {
    String moduleVar = nameGenerator.numberedName(moduleBaseName(moduleName.getNonNullString()));
    List<Node> statements = new ArrayList<>();
    statements.add(
        astFactory.createSingleVarNameDeclaration(moduleVar, createRequire(moduleName, n), n));
    for (Node spec : record.getChildren(specs)) {
      String local = record.getChild(spec, 0).getNonNullString();
      String exported = record.getChild(spec, 1).getNonNullString();
      exportedNames.add(exported);
      statements.add(createReexport(exported, moduleVar, local, spec));
    }
    record.replace(n, statements.get(0));
    record.insertAfter(n, statements.subList(1, statements.size()));
  }

  private void visitExportAll(Node n) {
    Node moduleName = record.getChild(n, 0);
    String namespace = n.getString();
    if (namespace != null) {
      exportedNames.add(namespace);
      record.replace(n, createExportAssignment(namespace, createRequire(moduleName, n), n));
    } else {
      record.replace(
          n,
          astFactory.exprResult(
              astFactory.createHelperCall(
                  RuntimeHelper.EXPORT_STAR,
                  createRequire(moduleName, n),
                  astFactory.createName("exports"))));
    }
  }

  /**
   * {@code Object.defineProperty(exports, "b", { enumerable: true, get: function () { return
   * m_1.a; } });}
   */
  private Node createReexport(String exported, String moduleVar, String property, Node origin) {
    Node getter =
        astFactory.createZeroArgFunction(
            null,
            astFactory.createBlock(
                astFactory.createReturn(
                    createPropertyAccess(astFactory.createName(moduleVar), property, origin))));
    Node descriptor =
        astFactory.createObjectLit(
            astFactory.createStringKey("enumerable", astFactory.createBoolean(true)),
            astFactory.createStringKey("get", getter));
    return astFactory.exprResult(
        astFactory.createCall(
            astFactory.createQName("Object.defineProperty"),
            ImmutableList.of(
                astFactory.createName("exports"), astFactory.createString(exported), descriptor),
            origin));
  }

  private Node createExportAssignment(String exported, Node value, @Nullable Node origin) {
    return astFactory.exprResult(
        astFactory.createAssign(createExportsAccess(exported, origin), value, origin));
  }

  private Node createExportsAccess(String exported, @Nullable Node origin) {
    return createPropertyAccess(astFactory.createName("exports"), exported, origin);
  }

  private Node createPropertyAccess(Node receiver, String property, @Nullable Node origin) {
    if (NodeUtil.isValidPropertyName(property)) {
      return astFactory.createGetProp(receiver, property, origin);
    }
    return astFactory.createGetElem(receiver, astFactory.createString(property), origin);
  }

  private void addPreamble(Node root) {
    List<Node> preamble = new ArrayList<>();
    Node esModule =
        astFactory.createObjectLit(
            astFactory.createStringKey("value", astFactory.createBoolean(true)));
    preamble.add(
        astFactory.exprResult(
            astFactory.createCall(
                astFactory.createQName("Object.defineProperty"),
                astFactory.createName("exports"),
                astFactory.createString("__esModule"),
                esModule)));
    if (!exportedNames.isEmpty()) {
      Node chain = astFactory.createUndefinedValue();
      for (String name : exportedNames) {
        chain = astFactory.createAssign(createExportsAccess(name, null), chain);
      }
      preamble.add(astFactory.exprResult(chain));
    }
    preamble.addAll(hoistedExports);

    ImmutableList<Node> statements = record.getChildren(root);
    int directives = NodeUtil.getDirectiveCount(record, statements);
    List<Node> newStatements = new ArrayList<>(statements.subList(0, directives));
    newStatements.addAll(preamble);
    newStatements.addAll(statements.subList(directives, statements.size()));
    record.replace(root, record.withChildren(root, newStatements));
  }

  // References.

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    if (createsScope(n, parent)) {
      shadowingScopes.push(NodeUtil.getScopeDeclaredNames(record, n));
    }
    return true;
  }

  private static boolean createsScope(Node n, @Nullable Node parent) {
    switch (n.getToken()) {
      case FUNCTION:
      case FOR:
      case FOR_IN:
      case FOR_OF:
      case CATCH:
        return true;
      case BLOCK:
        return parent != null && !parent.is(Token.FUNCTION);
      default:
        return false;
    }
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (createsScope(n, parent)) {
      shadowingScopes.pop();
    }
    switch (n.getToken()) {
      case NAME:
        if (parent != null && !isDeclarationName(n, parent)) {
          visitReference(n, parent);
        }
        break;
      case STRING_KEY:
        if (n.hasFlag(Node.SHORTHAND)) {
          Node value = record.getChild(n, 0);
          if (value.is(Token.NAME) && isRewritten(value.getNonNullString())) {
            record.replace(
                n, record.withFlags(n, n.getFlags() & ~Node.SHORTHAND, record.getChildren(n)));
          }
        }
        break;
      case ASSIGN:
        {
          Node target = record.getChild(n, 0);
          String exported =
              target.is(Token.NAME) && !isShadowed(target.getNonNullString())
                  ? localExports.get(target.getNonNullString())
                  : null;
          if (exported != null) {
            record.replace(
                n, astFactory.createAssign(createExportsAccess(exported, null), record.copy(n)));
          }
          break;
        }
      default:
        break;
    }
  }

  private boolean isRewritten(String name) {
    return !isShadowed(name)
        && (importedBindings.containsKey(name) || exportedVars.contains(name));
  }

  private boolean isShadowed(String name) {
    for (Set<String> scope : shadowingScopes) {
      if (scope.contains(name)) {
        return true;
      }
    }
    return false;
  }

  /** Whether {@code name} names a function or class being declared, not a reference. */
  private boolean isDeclarationName(Node name, Node parent) {
    return (parent.is(Token.FUNCTION) || parent.is(Token.CLASS))
        && record.getChild(parent, 0) == name;
  }

  private void visitReference(Node n, Node parent) {
    String name = n.getNonNullString();
    if (isShadowed(name)) {
      return;
    }
    ImportedBinding imported = importedBindings.get(name);
    Node replacement;
    if (imported != null) {
      replacement =
          createPropertyAccess(astFactory.createName(imported.moduleVar()), imported.property(), n);
      boolean isCallee =
          (parent.is(Token.CALL) || parent.is(Token.TAGGED_TEMPLATELIT))
              && record.getChild(parent, 0) == n;
      if (isCallee) {
        // Calls through the module object must not pass it as `this`.
        replacement = astFactory.createComma(astFactory.createNumber(0), replacement);
      }
    } else if (exportedVars.contains(name)) {
      replacement = createExportsAccess(name, n);
    } else {
      return;
    }
    record.replace(n, replacement);
  }
}
