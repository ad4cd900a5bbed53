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
import com.google.tsdown.ast.Token;
import com.google.tsdown.compiler.CompilerOptions.LanguageMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Lowers the class features the output language lacks.
 *
 * <ul>
 *   <li>Below ES2022, field initializers move into the constructor and static fields are assigned
 *       after the class.
 *   <li>For ES5, a class becomes an immediately invoked function that defines the constructor,
 *       its prototype members and its static members.
 *   <li>Decorators become {@code __decorate} calls.
 * </ul>
 */
final class RewriteClasses implements NodeTraversal.Callback, CompilerPass {
  private static final Logger logger = Logger.getLogger(RewriteClasses.class.getName());

  private final AbstractCompiler compiler;
  private final TransformRecord record;
  private final AstFactory astFactory;
  private final UniqueNameGenerator nameGenerator;
  private final boolean rewriteFields;
  private final boolean rewriteToFunctions;
  private final boolean rewriteDecorators;
  private int classCount = 0;

  RewriteClasses(AbstractCompiler compiler) {
    this.compiler = compiler;
    this.record = compiler.getRecord();
    this.astFactory = compiler.createAstFactory();
    this.nameGenerator = compiler.getUniqueNameGenerator();
    this.rewriteToFunctions = compiler.needsLowering(LanguageMode.ECMASCRIPT_2015);
    this.rewriteFields = compiler.needsLowering(LanguageMode.ECMASCRIPT_2022);
    this.rewriteDecorators = compiler.needsLowering(LanguageMode.ECMASCRIPT_NEXT);
  }

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(compiler, root, this);
    logger.fine(() -> "Lowered " + classCount + " classes");
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    return true;
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (n.is(Token.CLASS) && parent != null) {
      visitClass(t, n, parent);
    }
  }

  /** The members of one class, sorted by how they are lowered. */
  private final class ClassMetadata {
    final Node classNode;
    final boolean isDeclaration;
    final @Nullable Node superClass;
    final Node members;
    @Nullable Node constructor;
    final List<Node> instanceFields = new ArrayList<>();
    final List<Node> staticFields = new ArrayList<>();
    /** Methods and accessors, in source order. */
    final List<Node> methods = new ArrayList<>();
    final List<Node> decoratedMembers = new ArrayList<>();
    final List<Node> classDecorators = new ArrayList<>();
    /** Computed keys evaluated once, ahead of the class body: temporary name to key. */
    final Map<String, Node> keyTemporaries = new LinkedHashMap<>();
    final Map<Node, String> keyTemporaryOfMember = new HashMap<>();
    @Nullable String name;

    ClassMetadata(Node classNode, Node parent) {
      this.classNode = classNode;
      ImmutableList<Node> children = record.getChildren(classNode);
      Node nameNode = children.get(0);
      this.isDeclaration = NodeUtil.isClassDeclaration(record, classNode, parent)
          || (parent.is(Token.EXPORT) && parent.hasFlag(Node.DEFAULT));
      this.name = nameNode.is(Token.NAME) ? nameNode.getNonNullString() : null;
      this.superClass = children.get(1).is(Token.EMPTY) ? null : children.get(1);
      this.members = children.get(2);
      for (Node child : children.subList(3, children.size())) {
        classDecorators.add(record.getChild(child, 0));
      }
      for (Node member : record.getChildren(members)) {
        if (isConstructor(member)) {
          constructor = member;
        } else if (NodeUtil.isField(member)) {
          (member.isStatic() ? staticFields : instanceFields).add(member);
        } else {
          methods.add(member);
        }
        if (!getDecorators(member).isEmpty()) {
          decoratedMembers.add(member);
        }
      }
    }

    boolean hasName() {
      return name != null;
    }

    /** Returns an expression for a member's computed key, reading its temporary if it has one. */
    Node getComputedKey(Node member) {
      Node key = record.getChild(member, 0);
      String temp = keyTemporaryOfMember.get(member);
      if (temp != null) {
        return astFactory.createName(temp, key);
      }
      return NodeUtil.isImmutableValue(key) ? record.deepCopy(key) : key;
    }

    /**
     * Stores a computed key in a temporary when it has side effects and is read more than once,
     * or away from the class body.
     */
    void maybeAddKeyTemporary(Node member) {
      if (!member.is(Token.COMPUTED_PROP)
          || NodeUtil.isImmutableValue(record.getChild(member, 0))
          || keyTemporaryOfMember.containsKey(member)) {
        return;
      }
      if ((NodeUtil.isField(member) && rewriteFields)
          || (rewriteDecorators && decoratedMembers.contains(member))) {
        String temp = nameGenerator.newTemporary();
        keyTemporaryOfMember.put(member, temp);
        keyTemporaries.put(temp, record.getChild(member, 0));
      }
    }
  }

  private static boolean isConstructor(Node member) {
    return member.is(Token.MEMBER_FUNCTION_DEF)
        && !member.isStatic()
        && "constructor".equals(member.getString());
  }

  private ImmutableList<Node> getDecorators(Node member) {
    ImmutableList.Builder<Node> decorators = ImmutableList.builder();
    for (Node child : record.getChildren(member)) {
      if (child.is(Token.DECORATOR)) {
        decorators.add(record.getChild(child, 0));
      }
    }
    return decorators.build();
  }

  private void visitClass(NodeTraversal t, Node n, Node parent) {
    ClassMetadata metadata = new ClassMetadata(n, parent);
    boolean hasDecorators =
        !metadata.classDecorators.isEmpty() || !metadata.decoratedMembers.isEmpty();
    boolean hasFields = !metadata.instanceFields.isEmpty() || !metadata.staticFields.isEmpty();
    if (rewriteToFunctions) {
      rewriteToFunction(metadata, parent);
    } else if ((rewriteFields && hasFields) || (rewriteDecorators && hasDecorators)) {
      rewriteMembers(t, metadata, parent);
    } else {
      return;
    }
    classCount++;
  }

  // Members of classes that stay classes.

  /**
   * Moves fields out of the class body and turns decorators into {@code __decorate} calls. The
   * statements that have to run once the class exists follow a declaration; a class expression
   * becomes a comma expression through a temporary.
   */
  private void rewriteMembers(NodeTraversal t, ClassMetadata metadata, Node parent) {
    Node n = metadata.classNode;
    if (!metadata.hasName() && metadata.isDeclaration) {
      metadata.name = nameGenerator.numberedName("default");
    }
    boolean decorateClass = rewriteDecorators && !metadata.classDecorators.isEmpty();
    String classRef;
    if (metadata.isDeclaration) {
      classRef = metadata.name;
    } else {
      classRef = nameGenerator.newTemporary();
      record.declareTemporary(t.getClosestHoistScope(), classRef);
    }

    List<Node> newMembers = new ArrayList<>();
    List<Node> fieldInitializers = new ArrayList<>();
    for (Node member : record.getChildren(metadata.members)) {
      metadata.maybeAddKeyTemporary(member);
      if (NodeUtil.isField(member) && rewriteFields) {
        if (!member.isStatic()) {
          Node initializer = createFieldInitializer(metadata, member, astFactory.createThis());
          if (initializer != null) {
            fieldInitializers.add(initializer);
          }
        }
        continue;
      }
      newMembers.add(rewriteDecorators ? withoutDecorators(metadata, member) : member);
    }

    if (!fieldInitializers.isEmpty()) {
      if (metadata.constructor == null) {
        newMembers.add(0, createConstructorMember(metadata, fieldInitializers));
      } else {
        Node body = NodeUtil.getFunctionBody(record, record.getChild(metadata.constructor, 0));
        List<Node> statements = new ArrayList<>(record.getChildren(body));
        statements.addAll(getFieldInsertionIndex(statements), fieldInitializers);
        record.replace(body, record.withChildren(body, statements));
      }
    }

    List<Node> after = new ArrayList<>();
    if (rewriteFields) {
      for (Node field : metadata.staticFields) {
        Node initializer =
            createFieldInitializer(metadata, field, astFactory.createName(classRef));
        if (initializer != null) {
          replaceThis(initializer, classRef);
          after.add(initializer);
        }
      }
    }
    if (rewriteDecorators) {
      after.addAll(createDecorations(metadata, classRef));
    }

    List<Node> classChildren = new ArrayList<>();
    classChildren.add(
        metadata.hasName()
            ? astFactory.createName(metadata.name, record.getChild(n, 0))
            : astFactory.createEmpty());
    classChildren.add(metadata.superClass == null ? astFactory.createEmpty() : metadata.superClass);
    classChildren.add(record.withChildren(metadata.members, newMembers));
    if (!rewriteDecorators) {
      ImmutableList<Node> children = record.getChildren(n);
      classChildren.addAll(children.subList(3, children.size()));
    }
    Node newClass = record.withChildren(n, classChildren);

    if (!metadata.isDeclaration) {
      List<Node> expressions = new ArrayList<>();
      for (Map.Entry<String, Node> entry : metadata.keyTemporaries.entrySet()) {
        record.declareTemporary(t.getClosestHoistScope(), entry.getKey());
        expressions.add(astFactory.createAssign(entry.getKey(), entry.getValue()));
      }
      if (after.isEmpty()) {
        expressions.add(newClass);
      } else {
        expressions.add(astFactory.createAssign(classRef, newClass));
        for (Node statement : after) {
          expressions.add(record.getChild(statement, 0));
        }
        expressions.add(astFactory.createName(classRef));
      }
      record.replace(n, astFactory.createCommas(expressions));
      return;
    }

    List<Node> keyDeclarations = new ArrayList<>();
    for (Map.Entry<String, Node> entry : metadata.keyTemporaries.entrySet()) {
      keyDeclarations.add(
          astFactory.createSingleVarNameDeclaration(entry.getKey(), entry.getValue()));
    }
    Node anchor = parent.is(Token.EXPORT) ? parent : n;
    if (decorateClass) {
      // A decorated class is rebound to what its decorators return.
      Node declaration =
          record.newNode(
              Token.LET,
              ImmutableList.of(astFactory.createDeclarator(metadata.name, newClass, n)),
              null,
              0,
              0,
              n);
      if (parent.is(Token.EXPORT) && parent.hasFlag(Node.DEFAULT)) {
        record.replace(parent, declaration);
        after.add(
            record.newNode(
                Token.EXPORT,
                ImmutableList.of(astFactory.createName(metadata.name)),
                null,
                0,
                Node.DEFAULT,
                parent));
      } else {
        record.replace(n, declaration);
      }
    } else {
      record.replace(n, newClass);
    }
    record.insertBefore(anchor, keyDeclarations);
    record.insertAfter(anchor, after);
  }

  private Node withoutDecorators(ClassMetadata metadata, Node member) {
    List<Node> children = new ArrayList<>();
    for (Node child : record.getChildren(member)) {
      if (!child.is(Token.DECORATOR)) {
        children.add(child);
      }
    }
    if (metadata.keyTemporaryOfMember.containsKey(member)) {
      children.set(0, metadata.getComputedKey(member));
    }
    return record.withChildren(member, children);
  }

  /** A constructor for a class without one, which only runs field initializers. */
  private Node createConstructorMember(ClassMetadata metadata, List<Node> fieldInitializers) {
    List<Node> statements = new ArrayList<>();
    if (metadata.superClass != null) {
      Node spread =
          record.newNode(
              Token.ITER_SPREAD,
              ImmutableList.of(astFactory.createName("arguments")),
              null,
              0,
              0,
              null);
      statements.add(
          astFactory.exprResult(
              astFactory.createCall(astFactory.createSuper(null), ImmutableList.of(spread))));
    }
    statements.addAll(fieldInitializers);
    Node function =
        astFactory.createFunction(
            null, astFactory.createParamList(), astFactory.createBlock(statements), 0);
    return astFactory.createMemberFunctionDef("constructor", function);
  }

  /**
   * Returns where field initializers go in a constructor body: after the super call and after
   * the assignments of parameter properties, or else after the directives.
   */
  private int getFieldInsertionIndex(List<Node> statements) {
    int index = NodeUtil.getDirectiveCount(record, statements);
    for (int i = 0; i < statements.size(); i++) {
      if (isSuperCallStatement(statements.get(i))) {
        index = i + 1;
        break;
      }
    }
    while (index < statements.size() && isParameterPropertyAssignment(statements.get(index))) {
      index++;
    }
    return index;
  }

  private boolean isSuperCallStatement(Node statement) {
    if (!statement.is(Token.EXPR_RESULT)) {
      return false;
    }
    Node expr = record.getChild(statement, 0);
    return expr.is(Token.CALL) && record.getChild(expr, 0).is(Token.SUPER);
  }

  private boolean isParameterPropertyAssignment(Node statement) {
    if (!statement.is(Token.EXPR_RESULT)) {
      return false;
    }
    Node expr = record.getChild(statement, 0);
    return expr.is(Token.ASSIGN)
        && expr.getOrigin() != Node.NO_ORIGIN
        && record.getNode(expr.getOrigin()).hasFlag(Node.PARAM_PROPERTY);
  }

  /** Returns {@code target.x = initializer;}, or null for a field without an initializer. */
  private @Nullable Node createFieldInitializer(
      ClassMetadata metadata, Node field, Node target) {
    Node value =
        field.is(Token.COMPUTED_PROP) ? record.getChild(field, 1) : record.getChild(field, 0);
    if (value.is(Token.EMPTY)) {
      return null;
    }
    Node access = createMemberAccess(metadata, target, field);
    return astFactory.exprResult(astFactory.createAssign(access, value, field));
  }

  /** Returns {@code target.name}, {@code target["name"]} or {@code target[key]}. */
  private Node createMemberAccess(ClassMetadata metadata, Node target, Node member) {
    if (member.is(Token.COMPUTED_PROP)) {
      return astFactory.createGetElem(target, metadata.getComputedKey(member), member);
    }
    String name = member.getNonNullString();
    if (member.hasFlag(Node.QUOTED) || !NodeUtil.isValidPropertyName(name)) {
      return astFactory.createGetElem(target, astFactory.createString(name), member);
    }
    return astFactory.createGetProp(target, name, member);
  }

  private Node createMemberKey(ClassMetadata metadata, Node member) {
    return member.is(Token.COMPUTED_PROP)
        ? metadata.getComputedKey(member)
        : astFactory.createString(member.getNonNullString(), member);
  }

  /**
   * Returns {@code __decorate([d], C.prototype, "m", null);} for each decorated member and
   * {@code C = __decorate([d], C);} for the class.
   */
  private List<Node> createDecorations(ClassMetadata metadata, String classRef) {
    List<Node> statements = new ArrayList<>();
    for (Node member : metadata.decoratedMembers) {
      Node target =
          member.isStatic()
              ? astFactory.createName(classRef)
              : astFactory.createPrototypeAccess(astFactory.createName(classRef));
      Node descriptor =
          NodeUtil.isField(member) ? astFactory.createUndefinedValue() : astFactory.createNull();
      Node call =
          astFactory.createHelperCall(
              RuntimeHelper.DECORATE,
              astFactory.createArraylit(getDecorators(member)),
              target,
              createMemberKey(metadata, member),
              descriptor);
      statements.add(astFactory.exprResult(call));
    }
    if (!metadata.classDecorators.isEmpty()) {
      Node call =
          astFactory.createHelperCall(
              RuntimeHelper.DECORATE,
              astFactory.createArraylit(metadata.classDecorators),
              astFactory.createName(classRef));
      statements.add(
          astFactory.exprResult(
              astFactory.createAssign(astFactory.createName(classRef), call, metadata.classNode)));
    }
    return statements;
  }

  // Classes that become functions.

  /**
   * Rewrites a class into
   *
   * <pre>
   * var C = (function (_super) {
   *     __extends(C, _super);
   *     function C() {
   *         var _this = _super.call(this) || this;
   *         _this.x = 1;
   *         return _this;
   *     }
   *     C.prototype.m = function () { };
   *     return C;
   * })(Base);
   * </pre>
   */
  private void rewriteToFunction(ClassMetadata metadata, Node parent) {
    Node n = metadata.classNode;
    if (!metadata.hasName()) {
      metadata.name =
          metadata.isDeclaration
              ? nameGenerator.numberedName("default")
              : nameGenerator.numberedName("class");
    }
    String className = metadata.name;
    String superName = metadata.superClass == null ? null : nameGenerator.sharedName("_super");

    for (Node member : record.getChildren(metadata.members)) {
      metadata.maybeAddKeyTemporary(member);
    }

    List<Node> body = new ArrayList<>();
    if (superName != null) {
      body.add(
          astFactory.exprResult(
              astFactory.createHelperCall(
                  RuntimeHelper.EXTENDS,
                  astFactory.createName(className),
                  astFactory.createName(superName))));
    }
    for (Map.Entry<String, Node> entry : metadata.keyTemporaries.entrySet()) {
      body.add(astFactory.createSingleVarNameDeclaration(entry.getKey(), entry.getValue()));
    }
    body.add(createConstructorFunction(metadata, superName));

    // Property name to the descriptor properties of its accessors, which share one
    // Object.defineProperty call at the position of the first.
    Map<String, List<Node>> accessorDescriptors = new HashMap<>();
    Map<Integer, Node> pendingDefinitions = new LinkedHashMap<>();
    Map<Integer, List<Node>> pendingDescriptors = new HashMap<>();
    for (Node member : metadata.methods) {
      Node target = astFactory.createName(className);
      if (!member.isStatic()) {
        target = astFactory.createPrototypeAccess(target);
      }
      Node function =
          member.is(Token.COMPUTED_PROP) ? record.getChild(member, 1) : record.getChild(member, 0);
      if (superName != null) {
        rewriteSuperReferences(function, superName, member.isStatic());
      }
      if (member.is(Token.MEMBER_FUNCTION_DEF) || member.hasFlag(Node.COMPUTED_METHOD)) {
        body.add(
            astFactory.exprResult(
                astFactory.createAssign(
                    createMemberAccess(metadata, target, member), function, member)));
        continue;
      }
      String accessorKind =
          member.is(Token.GETTER_DEF) || member.hasFlag(Node.COMPUTED_GETTER) ? "get" : "set";
      Node property = astFactory.createStringKey(accessorKind, function);
      String propertyKey =
          member.is(Token.COMPUTED_PROP)
              ? null
              : (member.isStatic() ? "static " : "") + member.getNonNullString();
      List<Node> descriptor = propertyKey == null ? null : accessorDescriptors.get(propertyKey);
      if (descriptor != null) {
        descriptor.add(property);
        continue;
      }
      descriptor = new ArrayList<>();
      descriptor.add(property);
      if (propertyKey != null) {
        accessorDescriptors.put(propertyKey, descriptor);
      }
      pendingDefinitions.put(body.size(), member);
      pendingDescriptors.put(body.size(), descriptor);
      // Filled in once every accessor of the property has been seen.
      body.add(astFactory.createEmpty());
    }
    for (Map.Entry<Integer, Node> entry : pendingDefinitions.entrySet()) {
      Node member = entry.getValue();
      Node target = astFactory.createName(className);
      if (!member.isStatic()) {
        target = astFactory.createPrototypeAccess(target);
      }
      List<Node> properties = new ArrayList<>(pendingDescriptors.get(entry.getKey()));
      properties.add(astFactory.createStringKey("enumerable", astFactory.createBoolean(false)));
      properties.add(astFactory.createStringKey("configurable", astFactory.createBoolean(true)));
      body.set(
          entry.getKey(),
          astFactory.exprResult(
              astFactory.createCall(
                  astFactory.createQName("Object.defineProperty"),
                  ImmutableList.of(
                      target,
                      createMemberKey(metadata, member),
                      astFactory.createObjectLit(properties)),
                  member)));
    }

    for (Node field : metadata.staticFields) {
      Node initializer =
          createFieldInitializer(metadata, field, astFactory.createName(className));
      if (initializer != null) {
        replaceThis(initializer, className);
        body.add(initializer);
      }
    }
    if (rewriteDecorators) {
      body.addAll(createDecorations(metadata, className));
    }
    body.add(astFactory.createReturn(astFactory.createName(className)));

    Node wrapper =
        astFactory.createFunction(
            null,
            superName == null
                ? astFactory.createParamList()
                : astFactory.createParamList(superName),
            astFactory.createBlock(body),
            0);
    Node iife =
        astFactory.createCall(
            wrapper,
            metadata.superClass == null
                ? ImmutableList.of()
                : ImmutableList.of(metadata.superClass),
            n);

    if (!metadata.isDeclaration) {
      record.replace(n, iife);
      return;
    }
    Node declaration = astFactory.createSingleVarNameDeclaration(className, iife, n);
    if (parent.is(Token.EXPORT) && parent.hasFlag(Node.DEFAULT)) {
      record.insertBefore(parent, declaration);
      record.replace(n, astFactory.createName(className));
    } else {
      record.replace(n, declaration);
    }
  }

  /** Builds {@code function C(params) { ... }} from the class's constructor and fields. */
  private Node createConstructorFunction(ClassMetadata metadata, @Nullable String superName) {
    Node params;
    List<Node> statements;
    Node origin;
    if (metadata.constructor != null) {
      Node function = record.getChild(metadata.constructor, 0);
      params = NodeUtil.getFunctionParameters(record, function);
      statements = new ArrayList<>(record.getChildren(NodeUtil.getFunctionBody(record, function)));
      origin = metadata.constructor;
      if (superName != null) {
        rewriteSuperReferences(function, superName, false);
      }
    } else {
      params = astFactory.createParamList();
      statements = new ArrayList<>();
      origin = metadata.classNode;
    }

    List<Node> fieldInitializers = new ArrayList<>();
    for (Node field : metadata.instanceFields) {
      Node initializer = createFieldInitializer(metadata, field, astFactory.createThis());
      if (initializer != null) {
        fieldInitializers.add(initializer);
      }
    }
    statements.addAll(getFieldInsertionIndex(statements), fieldInitializers);

    if (superName != null) {
      statements = rewriteDerivedConstructorBody(metadata, superName, statements);
    }
    Node function =
        astFactory.createFunction(
            metadata.name, params, astFactory.createBlock(statements), 0, origin);
    return function;
  }

  /**
   * In a derived constructor the instance is whatever the super constructor returns, so it is
   * held in {@code _this}:
   *
   * <pre>
   * var _this = _super.call(this, a) || this;
   * ...
   * return _this;
   * </pre>
   */
  private List<Node> rewriteDerivedConstructorBody(
      ClassMetadata metadata, String superName, List<Node> statements) {
    if (metadata.constructor == null && statements.isEmpty()) {
      return ImmutableList.of(astFactory.createReturn(createImplicitSuperCall(superName)));
    }
    String thisName = nameGenerator.sharedName("_this");
    for (Node statement : statements) {
      replaceThis(statement, thisName);
    }
    List<Node> result = new ArrayList<>();
    int superIndex = -1;
    for (int i = 0; i < statements.size(); i++) {
      if (isSuperCallStatement(statements.get(i))) {
        superIndex = i;
        break;
      }
    }
    if (metadata.constructor == null) {
      result.add(
          astFactory.createSingleVarNameDeclaration(thisName, createImplicitSuperCall(superName)));
      result.addAll(statements);
    } else if (superIndex >= 0) {
      Node statement = statements.get(superIndex);
      Node call = record.getChild(statement, 0);
      result.addAll(statements.subList(0, superIndex));
      result.add(
          astFactory.createSingleVarNameDeclaration(
              thisName, createSuperConstructorCall(superName, call), statement));
      result.addAll(statements.subList(superIndex + 1, statements.size()));
    } else {
      // super() is nested in an expression or a branch.
      result.add(astFactory.createSingleVarNameDeclaration(thisName, astFactory.createThis()));
      for (Node statement : statements) {
        rewriteNestedSuperCalls(statement, superName, thisName);
      }
      result.addAll(statements);
    }
    result.add(astFactory.createReturn(astFactory.createName(thisName)));
    return result;
  }

  /** {@code _super !== null && _super.apply(this, arguments) || this} */
  private Node createImplicitSuperCall(String superName) {
    Node apply =
        astFactory.createCall(
            astFactory.createGetProp(astFactory.createName(superName), "apply"),
            astFactory.createThis(),
            astFactory.createName("arguments"));
    return astFactory.createOr(
        astFactory.createAnd(
            astFactory.createShne(astFactory.createName(superName), astFactory.createNull()),
            apply),
        astFactory.createThis());
  }

  /** {@code _super.call(this, args) || this} */
  private Node createSuperConstructorCall(String superName, Node call) {
    ImmutableList<Node> children = record.getChildren(call);
    List<Node> args = new ArrayList<>();
    args.add(astFactory.createThis());
    args.addAll(children.subList(1, children.size()));
    Node superCall =
        astFactory.createCall(
            astFactory.createGetProp(astFactory.createName(superName, children.get(0)), "call"),
            args,
            call);
    return astFactory.createOr(superCall, astFactory.createThis());
  }

  private void rewriteNestedSuperCalls(Node n, String superName, String thisName) {
    if (n.is(Token.FUNCTION) && !n.isArrow()) {
      return;
    }
    for (Node child : record.getChildren(n)) {
      rewriteNestedSuperCalls(child, superName, thisName);
    }
    if (n.is(Token.CALL) && record.getChild(n, 0).is(Token.SUPER)) {
      record.replace(
          n,
          astFactory.createAssign(
              astFactory.createName(thisName), createSuperConstructorCall(superName, n), n));
    }
  }

  /**
   * Rewrites {@code super.m(a)} to {@code _super.prototype.m.call(this, a)} and other reads
   * through {@code super} to reads from the parent prototype, or from the parent constructor in
   * static methods.
   */
  private void rewriteSuperReferences(Node n, String superName, boolean isStatic) {
    ImmutableList<Node> children = record.getChildren(n);
    for (Node child : children) {
      if (!child.is(Token.FUNCTION) || child.isArrow()) {
        rewriteSuperReferences(child, superName, isStatic);
      }
    }
    switch (n.getToken()) {
      case GETPROP:
      case GETELEM:
        {
          Node receiver = children.get(0);
          if (receiver.is(Token.SUPER)) {
            Node target = astFactory.createName(superName, receiver);
            record.replace(receiver, isStatic ? target : astFactory.createPrototypeAccess(target));
          }
          break;
        }
      case CALL:
        {
          Node callee = children.get(0);
          if (isSuperPropertyAccess(callee)) {
            List<Node> args = new ArrayList<>();
            args.add(astFactory.createThis());
            args.addAll(children.subList(1, children.size()));
            record.replace(
                n,
                astFactory.createCall(
                    astFactory.createGetProp(record.copy(callee), "call"), args, n));
          }
          break;
        }
      default:
        break;
    }
  }

  /** Whether {@code n} was written as {@code super.x} or {@code super[x]}. */
  private boolean isSuperPropertyAccess(Node n) {
    return (n.is(Token.GETPROP) || n.is(Token.GETELEM))
        && record.getNode(n.getChildIds().get(0)).is(Token.SUPER);
  }

  /** Replaces {@code this} with {@code name}, not looking into functions that bind their own. */
  private void replaceThis(Node n, String name) {
    if (n.is(Token.THIS)) {
      record.replace(n, astFactory.createName(name, n));
      return;
    }
    if (n.is(Token.FUNCTION) && !n.isArrow()) {
      return;
    }
    for (Node child : record.getChildren(n)) {
      replaceThis(child, name);
    }
  }
}
