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

import com.google.common.collect.ImmutableList;
import com.google.tsdown.ast.Node;
import com.google.tsdown.ast.Token;
import com.google.tsdown.parsing.ParserRunner;
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
 * Removes TypeScript-only syntax, leaving the JavaScript it annotates. Declarations that only
 * exist at the type level are elided, assertions are unwrapped, imports used only as types are
 * dropped, parameter properties become assignments, and enums and namespaces become the objects
 * they describe.
 */
final class StripTypeScript implements NodeTraversal.Callback, CompilerPass {
  private static final Logger logger = Logger.getLogger(StripTypeScript.class.getName());

  static final DiagnosticType ENUM_MEMBER_NEEDS_INITIALIZER =
      DiagnosticType.error(
          "JSC_ENUM_MEMBER_NEEDS_INITIALIZER", "Enum member must have initializer.");

  private final AbstractCompiler compiler;
  private final TransformRecord record;
  private final AstFactory astFactory;
  private final TypeOracle typeOracle;

  /** Names referenced as values anywhere in the file. */
  private final Set<String> valueReferences = new HashSet<>();

  /** Names of interfaces and type aliases declared in the file. */
  private final Set<String> typeNames = new HashSet<>();

  /** Folded member values of every enum in the file, by enum name. */
  private final Map<String, Map<String, Object>> enumValues = new HashMap<>();

  /** Folded values by ENUM_MEMBER id. */
  private final Map<Integer, Object> memberValues = new HashMap<>();

  private final Set<String> constEnums = new HashSet<>();

  /** Enums and namespaces whose {@code var} has been emitted, qualified by enclosing namespace. */
  private final Set<String> declaredContainers = new HashSet<>();

  /** Names of the namespaces being lowered, innermost first. */
  private final Deque<String> namespaces = new ArrayDeque<>();

  StripTypeScript(AbstractCompiler compiler) {
    this.compiler = compiler;
    this.record = compiler.getRecord();
    this.astFactory = compiler.createAstFactory();
    this.typeOracle = compiler.getOptions().getTypeOracle();
  }

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(compiler, root, new CollectNames());
    NodeTraversal.traverse(compiler, root, this);
    logger.fine(() -> "Stripped types from " + compiler.getSourceFile().getName());
  }

  /** Gathers the value references and type names that decide what can be elided. */
  private final class CollectNames extends NodeTraversal.AbstractPreOrderCallback {
    @Override
    public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      switch (n.getToken()) {
        case IMPORT:
          return false;
        case INTERFACE:
        case TYPE_ALIAS:
          typeNames.add(n.getNonNullString());
          return false;
        case NAME:
          valueReferences.add(n.getNonNullString());
          return true;
        case ENUM:
          constEnums.remove(record.getChild(n, 0).getNonNullString());
          if (n.hasFlag(Node.CONST_ENUM)) {
            constEnums.add(record.getChild(n, 0).getNonNullString());
          }
          foldEnum(n);
          return true;
        default:
          return true;
      }
    }
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    switch (n.getToken()) {
      case INTERFACE:
      case TYPE_ALIAS:
      case DECLARE:
        elideDeclaration(n, checkNotNull(parent));
        return false;
      case FUNCTION:
        if (n.hasFlag(Node.AMBIENT) && parent != null && !NodeUtil.isClassMember(parent)) {
          elideDeclaration(n, parent);
          return false;
        }
        return true;
      case MEMBER_FUNCTION_DEF:
      case GETTER_DEF:
      case SETTER_DEF:
      case MEMBER_FIELD_DEF:
      case COMPUTED_PROP:
        if (n.hasFlag(Node.AMBIENT) || n.hasFlag(Node.DECLARED_FIELD)) {
          record.elide(n);
          return false;
        }
        return true;
      case IMPORT:
        visitImport(n);
        return false;
      case ENUM:
        visitEnum(n, checkNotNull(parent));
        return false;
      case NAMESPACE:
        namespaces.push(n.getNonNullString());
        return true;
      default:
        return true;
    }
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    switch (n.getToken()) {
      case CAST:
      case NON_NULL:
        record.replace(n, record.getChild(n, 0));
        break;
      case EXPORT:
      case EXPORT_ALL:
        if (n.hasFlag(Node.TYPE_ONLY) || exportsTypeOnlyName(n)) {
          record.elide(n);
        } else if (n.is(Token.EXPORT)) {
          visitExportSpecs(n);
        }
        break;
      case FUNCTION:
        if (parent != null && isConstructor(parent)) {
          visitConstructor(n);
        }
        break;
      case GETPROP:
      case GETELEM:
        maybeInlineConstEnumMember(n);
        break;
      case NAMESPACE:
        visitNamespace(n, checkNotNull(parent));
        break;
      default:
        break;
    }
  }

  private void elideDeclaration(Node n, Node parent) {
    if (parent.is(Token.EXPORT)) {
      record.elide(parent);
    } else {
      record.elide(n);
    }
  }

  // Imports and exports.

  private void visitImport(Node n) {
    if (n.hasFlag(Node.TYPE_ONLY)) {
      record.elide(n);
      return;
    }
    ImmutableList<Node> children = record.getChildren(n);
    Node defaultName = children.get(0);
    Node bindings = children.get(1);
    if (defaultName.is(Token.EMPTY) && bindings.is(Token.EMPTY)) {
      // A side-effect import.
      return;
    }
    boolean keepDefault = !defaultName.is(Token.EMPTY) && isValueImport(defaultName, defaultName);
    if (!keepDefault && !defaultName.is(Token.EMPTY)) {
      record.replace(defaultName, astFactory.createEmpty());
    }
    boolean keepBindings = false;
    if (bindings.is(Token.IMPORT_STAR)) {
      keepBindings = isValueImport(bindings, bindings);
    } else if (bindings.is(Token.IMPORT_SPECS)) {
      for (Node spec : record.getChildren(bindings)) {
        Node local = record.getChild(spec, 1);
        if (!spec.hasFlag(Node.TYPE_ONLY) && isValueImport(spec, local)) {
          keepBindings = true;
        } else {
          record.elide(spec);
        }
      }
    }
    if (!keepBindings && !bindings.is(Token.EMPTY)) {
      record.replace(bindings, astFactory.createEmpty());
    }
    if (!keepDefault && !keepBindings) {
      record.elide(n);
    }
  }

  private boolean isValueImport(Node spec, Node local) {
    Boolean typeOnly = typeOracle.isTypeOnlyImport(spec.getId());
    if (typeOnly != null) {
      return !typeOnly;
    }
    String name = local.is(Token.IMPORT_STAR) ? local.getNonNullString() : local.getString();
    return valueReferences.contains(name);
  }

  private void visitExportSpecs(Node export) {
    Node specs = record.getChild(export, 0);
    if (!specs.is(Token.EXPORT_SPECS)) {
      return;
    }
    boolean reexport = !record.getChild(export, 1).is(Token.EMPTY);
    ImmutableList<Node> children = record.getChildren(specs);
    int kept = 0;
    for (Node spec : children) {
      String local = record.getChild(spec, 0).getNonNullString();
      if (spec.hasFlag(Node.TYPE_ONLY) || (!reexport && isTypeOnlyName(local))) {
        record.elide(spec);
      } else {
        kept++;
      }
    }
    if (kept == 0 && !children.isEmpty()) {
      record.elide(export);
    }
  }

  /** Whether {@code n} is {@code export default I} for an interface or type alias I. */
  private boolean exportsTypeOnlyName(Node n) {
    if (!n.is(Token.EXPORT) || !n.hasFlag(Node.DEFAULT)) {
      return false;
    }
    Node value = record.getChild(n, 0);
    return value.is(Token.NAME) && isTypeOnlyName(value.getNonNullString());
  }

  private boolean isTypeOnlyName(String name) {
    return typeNames.contains(name) || constEnums.contains(name);
  }

  // Parameter properties.

  private boolean isConstructor(Node member) {
    return member.is(Token.MEMBER_FUNCTION_DEF)
        && !member.isStatic()
        && "constructor".equals(member.getString());
  }

  /** Turns {@code constructor(private x)} into {@code constructor(x) { this.x = x; }}. */
  private void visitConstructor(Node function) {
    Node params = NodeUtil.getFunctionParameters(record, function);
    List<Node> assignments = new ArrayList<>();
    for (Node param : record.getChildren(params)) {
      if (!param.hasFlag(Node.PARAM_PROPERTY)) {
        continue;
      }
      Node name = param.is(Token.DEFAULT_VALUE) ? record.getChild(param, 0) : param;
      String propertyName = name.getNonNullString();
      Node assign =
          astFactory.createAssign(
              astFactory.createGetProp(astFactory.createThis(), propertyName, name),
              astFactory.createName(propertyName, name),
              param);
      assignments.add(astFactory.exprResult(assign));
    }
    if (assignments.isEmpty()) {
      return;
    }
    Node body = NodeUtil.getFunctionBody(record, function);
    ImmutableList<Node> statements = record.getChildren(body);
    Node superCall = findSuperCallStatement(statements);
    int directives = NodeUtil.getDirectiveCount(record, statements);
    if (superCall != null) {
      record.insertAfter(superCall, assignments);
    } else if (directives < statements.size()) {
      record.insertBefore(statements.get(directives), assignments);
    } else {
      List<Node> newBody = new ArrayList<>(statements);
      newBody.addAll(assignments);
      record.replace(body, record.withChildren(body, newBody));
    }
  }

  private @Nullable Node findSuperCallStatement(List<Node> statements) {
    for (Node statement : statements) {
      if (statement.is(Token.EXPR_RESULT)) {
        Node expr = record.getChild(statement, 0);
        if (expr.is(Token.CALL) && record.getChild(expr, 0).is(Token.SUPER)) {
          return statement;
        }
      }
    }
    return null;
  }

  // Enums.

  /**
   * Lowers an enum declaration into
   *
   * <pre>
   * var E;
   * (function (E) {
   *     E[E["A"] = 0] = "A";
   *     E["B"] = "b";
   * })(E || (E = {}));
   * </pre>
   *
   * Const enums are removed; their members are inlined where referenced.
   */
  private void visitEnum(Node n, Node parent) {
    if (n.hasFlag(Node.CONST_ENUM)) {
      elideDeclaration(n, parent);
      return;
    }
    ImmutableList<Node> children = record.getChildren(n);
    String enumName = children.get(0).getNonNullString();
    ImmutableList<Node> members = children.subList(1, children.size());
    Set<String> memberNames = new HashSet<>();
    for (Node member : members) {
      memberNames.add(member.getNonNullString());
    }
    List<Node> memberStatements = new ArrayList<>();
    for (Node member : members) {
      memberStatements.add(
          createMemberStatement(
              enumName, member, memberValues.get(member.getId()), memberNames));
    }
    replaceWithContainer(n, parent, children.get(0), memberStatements);
  }

  /**
   * Replaces an enum or namespace declaration with {@code var N;} and the function that fills
   * {@code N} in. A container exported from an enclosing namespace P is also stored as
   * {@code P.N}.
   */
  private void replaceWithContainer(Node n, Node parent, Node nameNode, List<Node> body) {
    String name = nameNode.getNonNullString();
    String enclosing = namespaces.peek();
    Node argument;
    if (parent.is(Token.EXPORT) && enclosing != null) {
      // N = P.N || (P.N = {})
      argument =
          astFactory.createAssign(
              astFactory.createName(name, nameNode),
              astFactory.createOr(
                  astFactory.createGetProp(astFactory.createName(enclosing), name, nameNode),
                  astFactory.createAssign(
                      astFactory.createGetProp(astFactory.createName(enclosing), name),
                      astFactory.createObjectLit())));
    } else {
      argument =
          astFactory.createOr(
              astFactory.createName(name, nameNode),
              astFactory.createAssign(astFactory.createName(name), astFactory.createObjectLit()));
    }
    Node iife =
        astFactory.createCall(
            astFactory.createFunction(
                null,
                astFactory.createParamList(
                    ImmutableList.of(astFactory.createName(name, nameNode))),
                astFactory.createBlock(body),
                0,
                n),
            ImmutableList.of(argument),
            n);
    Node iifeStatement = astFactory.exprResult(iife);
    boolean alreadyDeclared = !declaredContainers.add(String.join(".", namespaces) + ":" + name);
    Node declaration = astFactory.createSingleVarNameDeclaration(name, null, nameNode);
    if (parent.is(Token.EXPORT) && enclosing == null) {
      record.replace(n, declaration);
      record.insertAfter(parent, iifeStatement);
    } else if (parent.is(Token.EXPORT)) {
      if (alreadyDeclared) {
        record.replace(parent, iifeStatement);
      } else {
        record.replace(parent, declaration);
        record.insertAfter(parent, iifeStatement);
      }
    } else if (alreadyDeclared) {
      NodeUtil.replaceWithStatements(astFactory, parent, n, ImmutableList.of(iifeStatement));
    } else {
      NodeUtil.replaceWithStatements(
          astFactory, parent, n, ImmutableList.of(declaration, iifeStatement));
    }
  }

  /** Computes the values of an enum's members, in declaration order. */
  private void foldEnum(Node n) {
    ImmutableList<Node> children = record.getChildren(n);
    String enumName = children.get(0).getNonNullString();
    Map<String, Object> values = enumValues.computeIfAbsent(enumName, k -> new LinkedHashMap<>());
    Object previous = -1.0;
    for (Node member : children.subList(1, children.size())) {
      ImmutableList<Node> initializer = record.getChildren(member);
      Object value = typeOracle.getEnumMemberValue(member.getId());
      if (value == null && initializer.isEmpty()) {
        if (previous instanceof Double) {
          value = (Double) previous + 1;
        } else {
          compiler.report(member, ENUM_MEMBER_NEEDS_INITIALIZER);
        }
      } else if (value == null) {
        value = evaluate(initializer.get(0), values);
      }
      if (value != null) {
        values.put(member.getNonNullString(), value);
        memberValues.put(member.getId(), value);
      }
      previous = value;
    }
  }

  private Node createMemberStatement(
      String enumName, Node member, @Nullable Object value, Set<String> memberNames) {
    String memberName = member.getNonNullString();
    ImmutableList<Node> initializer = record.getChildren(member);
    Node key = astFactory.createString(memberName);
    Node target = astFactory.createGetElem(astFactory.createName(enumName), key, member);
    if (value instanceof String) {
      return astFactory.exprResult(
          astFactory.createAssign(target, astFactory.createString((String) value), member));
    }
    Node valueNode;
    if (value != null) {
      valueNode =
          astFactory.createNumber(
              (Double) value, initializer.isEmpty() ? member : initializer.get(0));
    } else if (!initializer.isEmpty()) {
      valueNode = initializer.get(0);
      qualifyMemberReferences(valueNode, enumName, memberNames);
    } else {
      valueNode = astFactory.createUndefinedValue();
    }
    // E[E["A"] = 0] = "A" maps the value back to the name.
    Node forward = astFactory.createAssign(target, valueNode);
    Node reverse =
        astFactory.createAssign(
            astFactory.createGetElem(astFactory.createName(enumName), forward),
            astFactory.createString(memberName),
            member);
    return astFactory.exprResult(reverse);
  }

  /** Rewrites references to members of the enum being declared into {@code E.member}. */
  private void qualifyMemberReferences(Node n, String enumName, Set<String> memberNames) {
    NodeTraversal.traverse(
        compiler,
        n,
        new NodeTraversal.AbstractPostOrderCallback() {
          @Override
          public void visit(NodeTraversal t, Node node, @Nullable Node parent) {
            if (node.is(Token.NAME) && memberNames.contains(node.getString())) {
              record.replace(
                  node,
                  astFactory.createGetProp(
                      astFactory.createName(enumName), node.getNonNullString(), node));
            }
          }
        });
  }

  // Namespaces.

  /**
   * Lowers a namespace whose body has been stripped already:
   *
   * <pre>
   * var N;
   * (function (N) {
   *     N.x = 1;
   *     function f() { return N.x; }
   *     N.f = f;
   * })(N || (N = {}));
   * </pre>
   *
   * Exported variables become properties of N, and references to them are qualified. A
   * namespace left with no statements only declared types, and is removed.
   */
  private void visitNamespace(Node n, Node parent) {
    String name = namespaces.pop();
    List<Node> statements = new ArrayList<>();
    Set<String> exportedVariables = new LinkedHashSet<>();
    for (Node statement : record.getChildren(record.getChild(n, 0))) {
      if (!statement.is(Token.EXPORT) || statement.hasFlag(Node.DEFAULT)) {
        statements.add(statement);
        continue;
      }
      Node declaration = record.getChild(statement, 0);
      switch (declaration.getToken()) {
        case VAR:
        case LET:
        case CONST:
          exportVariables(name, declaration, statements, exportedVariables);
          break;
        case FUNCTION:
        case CLASS:
          {
            Node declaredName = record.getChild(declaration, 0);
            statements.add(declaration);
            statements.add(
                astFactory.exprResult(
                    astFactory.createAssign(
                        astFactory.createGetProp(
                            astFactory.createName(name), declaredName.getNonNullString()),
                        astFactory.createName(declaredName.getNonNullString(), declaredName),
                        statement)));
            break;
          }
        default:
          TranspilationUtil.markIncompletelyLowered(
              compiler, statement, "An export list inside a namespace");
          statements.add(statement);
          break;
      }
    }
    if (statements.isEmpty()) {
      elideDeclaration(n, parent);
      return;
    }
    if (!exportedVariables.isEmpty()) {
      for (Node statement : statements) {
        qualifyExportedReferences(statement, name, exportedVariables);
      }
    }
    logger.fine(() -> "Lowered namespace " + name);
    replaceWithContainer(n, parent, astFactory.createName(name, n), statements);
  }

  /** Turns {@code export let x = 1, y;} inside namespace N into {@code N.x = 1;}. */
  private void exportVariables(
      String namespace, Node declaration, List<Node> statements, Set<String> exportedVariables) {
    List<Node> assignments = new ArrayList<>();
    for (Node declarator : record.getChildren(declaration)) {
      if (!declarator.is(Token.NAME)) {
        TranspilationUtil.markIncompletelyLowered(
            compiler, declarator, "A destructuring export inside a namespace");
        statements.add(declaration);
        return;
      }
    }
    for (Node declarator : record.getChildren(declaration)) {
      exportedVariables.add(declarator.getNonNullString());
      Node value = NodeUtil.getDeclaratorValue(record, declarator);
      if (value != null) {
        assignments.add(
            astFactory.createAssign(
                astFactory.createGetProp(
                    astFactory.createName(namespace), declarator.getNonNullString(), declarator),
                value,
                declarator));
      }
    }
    if (!assignments.isEmpty()) {
      statements.add(astFactory.exprResult(astFactory.createCommas(assignments)));
    }
  }

  /** Rewrites references to the namespace's exported variables into {@code N.x}. */
  private void qualifyExportedReferences(Node n, String namespace, Set<String> names) {
    Set<String> visible = names;
    if (n.is(Token.FUNCTION)) {
      visible = new HashSet<>(names);
      visible.removeAll(NodeUtil.getScopeDeclaredNames(record, n));
      if (visible.isEmpty()) {
        return;
      }
    }
    if (n.is(Token.NAME) && visible.contains(n.getString())) {
      record.replace(
          n,
          astFactory.createGetProp(
              astFactory.createName(namespace), n.getNonNullString(), n));
      return;
    }
    for (Node child : record.getChildren(n)) {
      qualifyExportedReferences(child, namespace, visible);
    }
  }

  /**
   * Folds a constant enum initializer. Returns a Double or a String, or null when the
   * expression is not constant.
   */
  private @Nullable Object evaluate(Node n, Map<String, Object> members) {
    ImmutableList<Node> children = record.getChildren(n);
    switch (n.getToken()) {
      case NUMBER:
        return n.getDouble();
      case STRINGLIT:
        return n.getNonNullString();
      case TEMPLATELIT:
        if (children.size() == 1) {
          return ParserRunner.cookTemplateString(children.get(0).getNonNullString());
        }
        return null;
      case CAST:
      case NON_NULL:
        return evaluate(children.get(0), members);
      case NAME:
        return members.get(n.getNonNullString());
      case GETPROP:
        {
          Node receiver = children.get(0);
          if (receiver.is(Token.NAME) && enumValues.containsKey(receiver.getString())) {
            return enumValues.get(receiver.getString()).get(n.getNonNullString());
          }
          return null;
        }
      case GETELEM:
        {
          Node receiver = children.get(0);
          Node key = children.get(1);
          if (receiver.is(Token.NAME)
              && key.is(Token.STRINGLIT)
              && enumValues.containsKey(receiver.getString())) {
            return enumValues.get(receiver.getString()).get(key.getNonNullString());
          }
          return null;
        }
      case POS:
      case NEG:
      case BITNOT:
        {
          Object operand = evaluate(children.get(0), members);
          if (!(operand instanceof Double)) {
            return null;
          }
          double value = (Double) operand;
          switch (n.getToken()) {
            case POS:
              return value;
            case NEG:
              return -value;
            default:
              return (double) ~toInt32(value);
          }
        }
      default:
        if (n.getToken().isBinaryOperator()) {
          Object left = evaluate(children.get(0), members);
          Object right = evaluate(children.get(1), members);
          if (left == null || right == null) {
            return null;
          }
          return evaluateBinary(n.getToken(), left, right);
        }
        return null;
    }
  }

  private static @Nullable Object evaluateBinary(Token op, Object left, Object right) {
    if (op == Token.ADD && (left instanceof String || right instanceof String)) {
      return stringValue(left) + stringValue(right);
    }
    if (!(left instanceof Double) || !(right instanceof Double)) {
      return null;
    }
    double l = (Double) left;
    double r = (Double) right;
    switch (op) {
      case ADD:
        return l + r;
      case SUB:
        return l - r;
      case MUL:
        return l * r;
      case DIV:
        return l / r;
      case MOD:
        return l % r;
      case EXPONENT:
        return Math.pow(l, r);
      case BITOR:
        return (double) (toInt32(l) | toInt32(r));
      case BITAND:
        return (double) (toInt32(l) & toInt32(r));
      case BITXOR:
        return (double) (toInt32(l) ^ toInt32(r));
      case LSH:
        return (double) (toInt32(l) << (toInt32(r) & 31));
      case RSH:
        return (double) (toInt32(l) >> (toInt32(r) & 31));
      case URSH:
        return (double) ((toInt32(l) & 0xffffffffL) >>> (toInt32(r) & 31));
      default:
        return null;
    }
  }

  private static String stringValue(Object value) {
    return value instanceof Double ? CodeConsumer.formatNumber((Double) value) : (String) value;
  }

  /** The ECMAScript ToInt32 conversion. */
  private static int toInt32(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return 0;
    }
    return (int) (long) value;
  }

  /** Replaces {@code E.A} with the value of the const enum member it names. */
  private void maybeInlineConstEnumMember(Node n) {
    ImmutableList<Node> children = record.getChildren(n);
    Node receiver = children.get(0);
    if (!receiver.is(Token.NAME) || !constEnums.contains(receiver.getString())) {
      return;
    }
    String memberName;
    if (n.is(Token.GETPROP)) {
      memberName = n.getNonNullString();
    } else if (children.get(1).is(Token.STRINGLIT)) {
      memberName = children.get(1).getNonNullString();
    } else {
      return;
    }
    Map<String, Object> members = enumValues.get(receiver.getString());
    Object value = members == null ? null : members.get(memberName);
    if (value instanceof String) {
      record.replace(n, astFactory.createString((String) value, n));
    } else if (value != null) {
      String comment = receiver.getString() + "." + memberName;
      record.replace(
          n,
          record.newNode(
              Token.NUMBER,
              ImmutableList.of(),
              CodeConsumer.formatNumber((Double) value) + " /* " + comment + " */",
              (Double) value,
              0,
              n));
    }
  }
}
