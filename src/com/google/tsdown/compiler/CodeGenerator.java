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
import com.google.tsdown.ast.SourceFile;
import com.google.tsdown.ast.Token;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * CodeGenerator generates codes from the effective tree of a {@link TransformRecord}, sending
 * the text to a {@link CodeConsumer}.
 */
final class CodeGenerator {

  private static final Pattern PLAIN_NUMBER =
      Pattern.compile(
          "(?:(?:0|[1-9][0-9]*)(?:\\.[0-9]*)?|\\.[0-9]+)(?:[eE][+-]?[0-9]+)?|0[xX][0-9a-fA-F]+");

  /** The syntactic position of the node being printed, for the cases where it matters. */
  enum Context {
    STATEMENT,
    /** Leftmost in an expression statement: function, class and object literals need parens. */
    START_OF_EXPR,
    /** Leftmost in an arrow's expression body: object literals need parens. */
    START_OF_ARROW_BODY,
    /** Inside the initializer of a for loop: {@code in} needs parens. */
    IN_FOR_INIT_CLAUSE,
    OTHER
  }

  private final CodeConsumer cc;
  private final TransformRecord record;
  private final SourceFile sourceFile;

  /** Source offsets of the mapped nodes currently being printed, innermost first. */
  private final Deque<Integer> mappedOffsets = new ArrayDeque<>();

  /** Whether the members being printed belong to a class body or an object literal. */
  private final Deque<Token> memberContainers = new ArrayDeque<>();

  CodeGenerator(CodeConsumer consumer, TransformRecord record) {
    this.cc = consumer;
    this.record = record;
    this.sourceFile = record.getSourceFile();
  }

  void add(Node n) {
    add(n, Context.OTHER);
  }

  private void add(Node n, Context context) {
    if (needsParensAtStart(n, context)) {
      cc.add("(");
      addInternal(n, Context.OTHER);
      cc.add(")");
    } else {
      addInternal(n, context);
    }
  }

  private static boolean needsParensAtStart(Node n, Context context) {
    switch (context) {
      case START_OF_EXPR:
        return n.is(Token.OBJECTLIT)
            || n.is(Token.CLASS)
            || (n.is(Token.FUNCTION) && !n.isArrow());
      case START_OF_ARROW_BODY:
        return n.is(Token.OBJECTLIT);
      default:
        return false;
    }
  }

  private void addInternal(Node n, Context context) {
    Token token = n.getToken();
    int offset = startSourceMapping(n, context);
    if (offset >= 0) {
      mappedOffsets.push(offset);
    }
    ImmutableList<Node> children = record.getChildren(n);
    Node first = children.isEmpty() ? null : children.get(0);
    Node last = children.isEmpty() ? null : children.get(children.size() - 1);

    switch (token) {
      case SCRIPT:
        for (Node child : children) {
          add(child, Context.STATEMENT);
          cc.endLine();
        }
        break;

      case BLOCK:
        addBlock(children);
        break;

      case EMPTY:
        if (context == Context.STATEMENT) {
          cc.endStatement();
        }
        break;

      case HELPER_TEXT:
        cc.appendRaw(n.getNonNullString());
        break;

      case EXPR_RESULT:
        if (first.is(Token.ASSIGN) && record.getChild(first, 0).is(Token.OBJECT_PATTERN)) {
          cc.add("(");
          addExpr(first, 0, Context.OTHER);
          cc.add(")");
        } else {
          addExpr(first, 0, Context.START_OF_EXPR);
        }
        cc.endStatement();
        break;

      case VAR:
      case LET:
      case CONST:
        addDeclaration(n, children, Context.OTHER);
        cc.endStatement();
        break;

      case NAME:
        cc.addIdentifier(n.getNonNullString());
        if (first != null) {
          cc.addOp("=", true);
          addExpr(first, 1, operandContext(context));
        }
        break;

      case DESTRUCTURING_LHS:
        add(first);
        if (children.size() > 1) {
          cc.addOp("=", true);
          addExpr(children.get(1), 1, operandContext(context));
        }
        break;

      case FUNCTION:
        addFunction(n, children);
        break;

      case PARAM_LIST:
        cc.add("(");
        addList(children);
        cc.add(")");
        break;

      case DEFAULT_VALUE:
        add(first);
        cc.addOp("=", true);
        addExpr(children.get(1), 1, Context.OTHER);
        break;

      case ITER_REST:
      case OBJECT_REST:
      case ITER_SPREAD:
      case OBJECT_SPREAD:
        cc.add("...");
        addExpr(first, 1, Context.OTHER);
        break;

      case RETURN:
        cc.add("return");
        if (first != null) {
          cc.add(" ");
          addExpr(first, 0, Context.OTHER);
        }
        cc.endStatement();
        break;

      case THROW:
        cc.add("throw ");
        addExpr(first, 0, Context.OTHER);
        cc.endStatement();
        break;

      case BREAK:
      case CONTINUE:
        cc.add(token == Token.BREAK ? "break" : "continue");
        if (n.getString() != null) {
          cc.add(" ");
          cc.addIdentifier(n.getString());
        }
        cc.endStatement();
        break;

      case DEBUGGER:
        cc.add("debugger");
        cc.endStatement();
        break;

      case IF:
        addIf(children);
        break;

      case WHILE:
        cc.add("while (");
        addExpr(first, 0, Context.OTHER);
        cc.add(")");
        addBody(children.get(1), false);
        break;

      case DO:
        cc.add("do");
        addBody(first, false);
        if (first.is(Token.BLOCK)) {
          cc.add(" ");
        } else {
          cc.endLine();
        }
        cc.add("while (");
        addExpr(children.get(1), 0, Context.OTHER);
        cc.add(")");
        cc.endStatement();
        break;

      case FOR:
        cc.add("for (");
        addForInit(first);
        cc.add(";");
        if (!children.get(1).is(Token.EMPTY)) {
          cc.add(" ");
          addExpr(children.get(1), 0, Context.OTHER);
        }
        cc.add(";");
        if (!children.get(2).is(Token.EMPTY)) {
          cc.add(" ");
          addExpr(children.get(2), 0, Context.OTHER);
        }
        cc.add(")");
        addBody(last, false);
        break;

      case FOR_IN:
      case FOR_OF:
        cc.add(n.hasFlag(Node.FOR_AWAIT) ? "for await (" : "for (");
        if (NodeUtil.isNameDeclaration(first)) {
          addDeclaration(first, record.getChildren(first), Context.IN_FOR_INIT_CLAUSE);
        } else {
          addExpr(first, 16, Context.OTHER);
        }
        cc.add(token == Token.FOR_IN ? " in " : " of ");
        addExpr(children.get(1), token == Token.FOR_IN ? 0 : 1, Context.OTHER);
        cc.add(")");
        addBody(last, false);
        break;

      case SWITCH:
        cc.add("switch (");
        addExpr(first, 0, Context.OTHER);
        cc.add(")");
        cc.beginBlock();
        for (Node caseNode : children.subList(1, children.size())) {
          add(caseNode, Context.OTHER);
        }
        cc.endBlock();
        break;

      case CASE:
      case DEFAULT_CASE:
        addCase(n, children);
        break;

      case TRY:
        cc.add("try");
        add(first, Context.STATEMENT);
        if (children.get(1).is(Token.CATCH)) {
          cc.endLine();
          add(children.get(1));
        }
        if (children.size() > 2) {
          cc.endLine();
          cc.add("finally");
          add(children.get(2), Context.STATEMENT);
        }
        break;

      case CATCH:
        cc.add("catch");
        if (!first.is(Token.EMPTY)) {
          cc.add(" (");
          add(first);
          cc.add(")");
        }
        add(children.get(1), Context.STATEMENT);
        break;

      case LABEL:
        cc.addIdentifier(n.getNonNullString());
        cc.add(": ");
        add(first, Context.STATEMENT);
        break;

      case CLASS:
        addClass(children);
        break;

      case MEMBER_FUNCTION_DEF:
      case GETTER_DEF:
      case SETTER_DEF:
      case MEMBER_FIELD_DEF:
      case COMPUTED_PROP:
        addMember(n, children);
        break;

      case DECORATOR:
        cc.add("@");
        addExpr(first, 17, Context.OTHER);
        break;

      case STRING_KEY:
        if (n.hasFlag(Node.SHORTHAND)) {
          add(first);
        } else {
          addPropertyKey(n);
          cc.add(": ");
          addExpr(first, 1, Context.OTHER);
        }
        break;

      case IMPORT:
        addImport(children);
        break;

      case IMPORT_SPECS:
      case EXPORT_SPECS:
        cc.add("{ ");
        addList(children);
        cc.add(" }");
        break;

      case IMPORT_SPEC:
      case EXPORT_SPEC:
        addModuleName(first);
        if (!first.getNonNullString().equals(children.get(1).getNonNullString())) {
          cc.add(" as ");
          addModuleName(children.get(1));
        }
        break;

      case IMPORT_STAR:
        cc.add("* as ");
        cc.addIdentifier(n.getNonNullString());
        break;

      case EXPORT:
        addExport(n, children);
        break;

      case EXPORT_ALL:
        cc.add("export * ");
        if (n.getString() != null) {
          cc.add("as ");
          cc.addIdentifier(n.getString());
          cc.add(" ");
        }
        cc.add("from ");
        add(first);
        cc.endStatement();
        break;

      case CAST:
      case NON_NULL:
        add(first, context);
        break;

      case NUMBER:
        addNumber(n);
        break;

      case STRINGLIT:
        cc.add(stringLiteralText(n));
        break;

      case TEMPLATELIT:
        cc.add("`");
        for (Node part : children) {
          if (part.is(Token.TEMPLATELIT_STRING)) {
            cc.append(part.getNonNullString());
          } else {
            cc.append("${");
            addExpr(part, 0, Context.OTHER);
            cc.append("}");
          }
        }
        cc.append("`");
        break;

      case TAGGED_TEMPLATELIT:
        addExpr(first, 17, leftContext(context));
        add(children.get(1));
        break;

      case REGEXP:
        cc.add(n.getNonNullString());
        break;

      case TRUE:
        cc.add("true");
        break;
      case FALSE:
        cc.add("false");
        break;
      case NULL:
        cc.add("null");
        break;
      case THIS:
        cc.add("this");
        break;
      case SUPER:
        cc.add("super");
        break;

      case ARRAYLIT:
      case ARRAY_PATTERN:
        cc.add("[");
        addList(children);
        if (last != null && last.is(Token.EMPTY)) {
          cc.add(",");
        }
        cc.add("]");
        break;

      case OBJECTLIT:
      case OBJECT_PATTERN:
        addObject(n, children);
        break;

      case GETPROP:
        addReceiver(n, first, context);
        if (first.is(Token.NUMBER) && isIntegerText(printedNumber(first))) {
          // `1.x` would scan as a number.
          cc.add(".");
        }
        cc.add(n.hasFlag(Node.OPTIONAL_CHAIN_START) ? "?." : ".");
        cc.addIdentifier(n.getNonNullString());
        break;

      case GETELEM:
        addReceiver(n, first, context);
        cc.add(n.hasFlag(Node.OPTIONAL_CHAIN_START) ? "?.[" : "[");
        addExpr(children.get(1), 0, Context.OTHER);
        cc.add("]");
        break;

      case CALL:
        if (first.is(Token.FUNCTION) && !first.isArrow()) {
          cc.add("(");
          add(first);
          cc.add(")");
        } else {
          addReceiver(n, first, context);
        }
        cc.add(n.hasFlag(Node.OPTIONAL_CHAIN_START) ? "?.(" : "(");
        addList(children.subList(1, children.size()));
        cc.add(")");
        break;

      case NEW:
        cc.add("new ");
        if (precedence(first) < 17 || containsCallInMemberChain(first)) {
          cc.add("(");
          add(first);
          cc.add(")");
        } else {
          addExpr(first, 17, Context.OTHER);
        }
        cc.add("(");
        addList(children.subList(1, children.size()));
        cc.add(")");
        break;

      case INC:
      case DEC:
        {
          String op = token == Token.INC ? "++" : "--";
          if (n.hasFlag(Node.POSTFIX)) {
            addExpr(first, 16, leftContext(context));
            cc.addOp(op, false);
          } else {
            cc.addOp(op, false);
            addExpr(first, 15, operandContext(context));
          }
          break;
        }

      case NOT:
      case BITNOT:
      case POS:
      case NEG:
        cc.addOp(opToken(token), false);
        addExpr(first, 15, operandContext(context));
        break;

      case TYPEOF:
      case VOID:
      case DELPROP:
      case AWAIT:
        cc.add(opToken(token));
        cc.add(" ");
        addExpr(first, 15, operandContext(context));
        break;

      case YIELD:
        cc.add(n.hasFlag(Node.YIELD_STAR) ? "yield*" : "yield");
        if (first != null) {
          cc.add(" ");
          addExpr(first, 1, operandContext(context));
        }
        break;

      case HOOK:
        addExpr(first, 3, leftContext(context));
        cc.addOp("?", true);
        addExpr(children.get(1), 1, operandContext(context));
        cc.addOp(":", true);
        addExpr(children.get(2), 1, operandContext(context));
        break;

      default:
        if (token.isAssign()) {
          addExpr(first, 16, leftContext(context));
          cc.addOp(opToken(token), true);
          addExpr(children.get(1), 1, operandContext(context));
        } else if (token.isBinaryOperator()) {
          addBinary(n, first, children.get(1), context);
        } else {
          throw new IllegalStateException("Unexpected node in output: " + n);
        }
    }

    if (offset >= 0) {
      mappedOffsets.pop();
    }
  }

  /**
   * Records where {@code n} starts in the output. A node with no source position of its own
   * maps through its origin; a statement with neither maps to its nearest mapped ancestor.
   * Returns the offset recorded, or -1.
   */
  private int startSourceMapping(Node n, Context context) {
    switch (n.getToken()) {
      case SCRIPT:
        return 0;
      case EMPTY:
      case CASE:
      case DEFAULT_CASE:
      case HELPER_TEXT:
      case CLASS_MEMBERS:
      case PARAM_LIST:
      case IMPORT_SPECS:
      case EXPORT_SPECS:
      case TEMPLATELIT_STRING:
      case CAST:
      case NON_NULL:
        return -1;
      default:
        break;
    }
    int offset = NodeUtil.getOriginalOffset(record, n);
    boolean isStatement = context == Context.STATEMENT || NodeUtil.isStatement(n.getToken());
    if (offset < 0 && isStatement && !mappedOffsets.isEmpty()) {
      offset = mappedOffsets.peek();
    }
    String name = n.is(Token.NAME) && offset >= 0 ? NodeUtil.getOriginalName(record, n) : null;
    cc.startSourceMapping(offset, name);
    return offset;
  }

  private void addExpr(Node n, int minPrecedence, Context context) {
    if (precedence(n) < minPrecedence
        || (n.is(Token.IN) && context == Context.IN_FOR_INIT_CLAUSE)) {
      cc.add("(");
      add(n, Context.OTHER);
      cc.add(")");
    } else {
      add(n, context);
    }
  }

  /** The context passed to the leftmost operand of an expression. */
  private static Context leftContext(Context context) {
    switch (context) {
      case START_OF_EXPR:
      case START_OF_ARROW_BODY:
      case IN_FOR_INIT_CLAUSE:
        return context;
      default:
        return Context.OTHER;
    }
  }

  /** The context passed to an operand that is not leftmost. */
  private static Context operandContext(Context context) {
    return context == Context.IN_FOR_INIT_CLAUSE ? context : Context.OTHER;
  }

  private void addBinary(Node n, Node left, Node right, Context context) {
    Token token = n.getToken();
    int p = precedence(n);
    int leftMin = p;
    int rightMin = p + 1;
    if (token == Token.EXPONENT) {
      leftMin = 16;
      rightMin = p;
    }
    if (token == Token.COALESCE) {
      // `??` may not be mixed with `||` or `&&` without parens.
      leftMin = mixesWithCoalesce(left) ? 19 : leftMin;
      rightMin = mixesWithCoalesce(right) ? 19 : rightMin;
    }
    addExpr(left, leftMin, leftContext(context));
    if (token == Token.COMMA) {
      cc.listSeparator();
    } else {
      cc.addOp(opToken(token), true);
    }
    addExpr(right, rightMin, operandContext(context));
  }

  private static boolean mixesWithCoalesce(Node n) {
    return n.is(Token.OR) || n.is(Token.AND);
  }

  /** Prints the object of a member access or the callee of a call. */
  private void addReceiver(Node parent, Node receiver, Context context) {
    boolean endsOptionalChain =
        receiver.hasFlag(Node.IN_OPTIONAL_CHAIN) && !parent.hasFlag(Node.IN_OPTIONAL_CHAIN);
    if (endsOptionalChain) {
      cc.add("(");
      add(receiver);
      cc.add(")");
    } else {
      addExpr(receiver, 17, leftContext(context));
    }
  }

  private boolean containsCallInMemberChain(Node n) {
    Node current = n;
    while (true) {
      switch (current.getToken()) {
        case CALL:
          return true;
        case GETPROP:
        case GETELEM:
        case TAGGED_TEMPLATELIT:
          current = record.getChild(current, 0);
          break;
        default:
          return false;
      }
    }
  }

  private void addList(ImmutableList<Node> nodes) {
    boolean first = true;
    for (Node n : nodes) {
      if (!first) {
        cc.listSeparator();
      }
      addExpr(n, 1, Context.OTHER);
      first = false;
    }
  }

  private void addBlock(ImmutableList<Node> statements) {
    if (statements.isEmpty()) {
      cc.appendEmptyBlock();
      return;
    }
    cc.beginBlock();
    for (Node statement : statements) {
      add(statement, Context.STATEMENT);
      cc.endLine();
    }
    cc.endBlock();
  }

  /**
   * Prints the body of a control statement: a block on the same line, anything else indented
   * on the next line.
   */
  private void addBody(Node body, boolean forceBlock) {
    if (body.is(Token.BLOCK)) {
      add(body, Context.STATEMENT);
    } else if (forceBlock) {
      cc.beginBlock();
      add(body, Context.STATEMENT);
      cc.endBlock();
    } else {
      cc.endLine();
      cc.indent();
      add(body, Context.STATEMENT);
      cc.endLine();
      cc.outdent();
    }
  }

  private void addIf(ImmutableList<Node> children) {
    Node thenBranch = children.get(1);
    boolean hasElse = children.size() > 2;
    cc.add("if (");
    addExpr(children.get(0), 0, Context.OTHER);
    cc.add(")");
    addBody(thenBranch, hasElse && endsWithDanglingIf(thenBranch));
    if (!hasElse) {
      return;
    }
    cc.endLine();
    cc.add("else");
    Node elseBranch = children.get(2);
    if (elseBranch.is(Token.IF)) {
      cc.add(" ");
      add(elseBranch, Context.STATEMENT);
    } else {
      addBody(elseBranch, false);
    }
  }

  /** Whether an {@code else} after {@code statement} would bind to an inner {@code if}. */
  private boolean endsWithDanglingIf(Node statement) {
    ImmutableList<Node> children = record.getChildren(statement);
    switch (statement.getToken()) {
      case IF:
        return children.size() < 3 || endsWithDanglingIf(children.get(2));
      case LABEL:
      case WHILE:
      case FOR:
      case FOR_IN:
      case FOR_OF:
        return endsWithDanglingIf(children.get(children.size() - 1));
      default:
        return false;
    }
  }

  private void addForInit(Node init) {
    if (init.is(Token.EMPTY)) {
      return;
    }
    if (NodeUtil.isNameDeclaration(init)) {
      addDeclaration(init, record.getChildren(init), Context.IN_FOR_INIT_CLAUSE);
    } else {
      addExpr(init, 0, Context.IN_FOR_INIT_CLAUSE);
    }
  }

  private void addDeclaration(Node n, ImmutableList<Node> declarators, Context context) {
    cc.add(n.is(Token.VAR) ? "var" : n.is(Token.LET) ? "let" : "const");
    cc.add(" ");
    boolean first = true;
    for (Node declarator : declarators) {
      if (!first) {
        cc.listSeparator();
      }
      add(declarator, context);
      first = false;
    }
  }

  private void addCase(Node n, ImmutableList<Node> children) {
    ImmutableList<Node> statements;
    if (n.is(Token.CASE)) {
      cc.add("case ");
      addExpr(children.get(0), 0, Context.OTHER);
      statements = children.subList(1, children.size());
    } else {
      cc.add("default");
      statements = children;
    }
    if (!n.hasPosition() && statements.size() == 1) {
      cc.add(": ");
      add(statements.get(0), Context.STATEMENT);
      cc.endLine();
      return;
    }
    cc.beginCaseBody();
    for (Node statement : statements) {
      add(statement, Context.STATEMENT);
      cc.endLine();
    }
    cc.endCaseBody();
  }

  private void addFunction(Node n, ImmutableList<Node> children) {
    Node name = children.get(0);
    Node params = children.get(1);
    Node body = children.get(2);
    if (n.isArrow()) {
      if (n.isAsync()) {
        cc.add("async ");
      }
      add(params);
      cc.add(" => ");
      if (body.is(Token.BLOCK)) {
        add(body, Context.STATEMENT);
      } else {
        addExpr(body, 1, Context.START_OF_ARROW_BODY);
      }
      return;
    }
    if (n.isAsync()) {
      cc.add("async ");
    }
    cc.add(n.isGenerator() ? "function*" : "function");
    cc.add(" ");
    if (name.is(Token.NAME)) {
      add(name);
    }
    add(params);
    add(body, Context.STATEMENT);
  }

  private void addClass(ImmutableList<Node> children) {
    for (Node decorator : children.subList(3, children.size())) {
      add(decorator);
      cc.endLine();
    }
    cc.add("class");
    if (children.get(0).is(Token.NAME)) {
      cc.add(" ");
      add(children.get(0));
    }
    Node superClass = children.get(1);
    if (!superClass.is(Token.EMPTY)) {
      cc.add(" extends ");
      addExpr(superClass, 17, Context.OTHER);
    }
    cc.beginBlock();
    memberContainers.push(Token.CLASS_MEMBERS);
    for (Node member : record.getChildren(children.get(2))) {
      add(member, Context.OTHER);
      cc.endLine();
    }
    memberContainers.pop();
    cc.endBlock();
  }

  /** Prints a class member, or a method, accessor or computed property of an object literal. */
  private void addMember(Node n, ImmutableList<Node> children) {
    boolean inClass = n.hasFlag(Node.STATIC) || isInClass();
    int valueIndex = n.is(Token.COMPUTED_PROP) ? 1 : 0;
    if (inClass) {
      for (Node decorator : children.subList(valueIndex + 1, children.size())) {
        add(decorator);
        cc.endLine();
      }
    }
    if (n.hasFlag(Node.STATIC)) {
      cc.add("static ");
    }
    Node value = children.get(valueIndex);
    boolean isField =
        n.is(Token.MEMBER_FIELD_DEF)
            || (n.is(Token.COMPUTED_PROP) && n.hasFlag(Node.COMPUTED_FIELD));
    boolean isPlainProperty =
        n.is(Token.COMPUTED_PROP)
            && !isField
            && !n.hasFlag(Node.COMPUTED_METHOD | Node.COMPUTED_GETTER | Node.COMPUTED_SETTER);

    if (isField || isPlainProperty) {
      addMemberKey(n, children);
      if (isPlainProperty) {
        cc.add(": ");
        addExpr(value, 1, Context.OTHER);
      } else {
        if (!value.is(Token.EMPTY)) {
          cc.addOp("=", true);
          addExpr(value, 1, Context.OTHER);
        }
        cc.endStatement();
      }
      return;
    }

    if (n.is(Token.GETTER_DEF) || n.hasFlag(Node.COMPUTED_GETTER)) {
      cc.add("get ");
    } else if (n.is(Token.SETTER_DEF) || n.hasFlag(Node.COMPUTED_SETTER)) {
      cc.add("set ");
    } else {
      if (value.isAsync()) {
        cc.add("async ");
      }
      if (value.isGenerator()) {
        cc.add("*");
      }
    }
    addMemberKey(n, children);
    ImmutableList<Node> function = record.getChildren(value);
    add(function.get(1));
    add(function.get(2), Context.STATEMENT);
  }

  private boolean isInClass() {
    return memberContainers.peek() == Token.CLASS_MEMBERS;
  }

  private void addMemberKey(Node n, ImmutableList<Node> children) {
    if (n.is(Token.COMPUTED_PROP)) {
      cc.add("[");
      addExpr(children.get(0), 1, Context.OTHER);
      cc.add("]");
    } else {
      addPropertyKey(n);
    }
  }

  private void addPropertyKey(Node n) {
    String key = n.getNonNullString();
    if (n.hasFlag(Node.QUOTED) || !(NodeUtil.isValidPropertyName(key) || isNumericKey(key))) {
      cc.add(quoteString(key, wasSingleQuoted(n) ? '\'' : '"'));
    } else {
      cc.addIdentifier(key);
    }
  }

  private static boolean isNumericKey(String key) {
    return PLAIN_NUMBER.matcher(key).matches();
  }

  private boolean wasSingleQuoted(Node n) {
    Node original = NodeUtil.getOriginalNode(record, n);
    if (original == null) {
      return false;
    }
    if (original.hasFlag(Node.SINGLE_QUOTED)) {
      return true;
    }
    String code = sourceFile.getCode();
    return original.getStart() < code.length() && code.charAt(original.getStart()) == '\'';
  }

  private void addObject(Node n, ImmutableList<Node> children) {
    if (children.isEmpty()) {
      cc.add("{}");
      return;
    }
    memberContainers.push(Token.OBJECTLIT);
    if (isMultiline(n, children)) {
      cc.beginBlock();
      for (int i = 0; i < children.size(); i++) {
        add(children.get(i), Context.OTHER);
        if (i < children.size() - 1) {
          cc.add(",");
        }
        cc.endLine();
      }
      cc.endBlock();
    } else {
      cc.add("{ ");
      addList(children);
      cc.add(" }");
    }
    memberContainers.pop();
  }

  /**
   * Object literals keep the shape they had in the source. Synthesized ones are laid out one
   * property per line when they hold functions.
   */
  private boolean isMultiline(Node n, ImmutableList<Node> children) {
    Node original = NodeUtil.getOriginalNode(record, n);
    if (original != null && (original.is(Token.OBJECTLIT) || original.is(Token.OBJECT_PATTERN))) {
      return sourceFile.getCode().substring(original.getStart(), original.getEnd()).indexOf('\n')
          >= 0;
    }
    for (Node child : children) {
      if (!child.is(Token.STRING_KEY)) {
        return true;
      }
      Node value = record.getChild(child, 0);
      if (value.is(Token.FUNCTION) && !value.isArrow()) {
        return true;
      }
    }
    return false;
  }

  private void addImport(ImmutableList<Node> children) {
    Node defaultName = children.get(0);
    Node bindings = children.get(1);
    cc.add("import ");
    if (!defaultName.is(Token.EMPTY)) {
      add(defaultName);
    }
    if (!bindings.is(Token.EMPTY)) {
      if (!defaultName.is(Token.EMPTY)) {
        cc.listSeparator();
      }
      add(bindings);
    }
    if (!defaultName.is(Token.EMPTY) || !bindings.is(Token.EMPTY)) {
      cc.add(" from ");
    }
    add(children.get(2));
    cc.endStatement();
  }

  private void addExport(Node n, ImmutableList<Node> children) {
    Node first = children.get(0);
    cc.add("export ");
    if (n.hasFlag(Node.DEFAULT)) {
      cc.add("default ");
      if (first.is(Token.FUNCTION) || first.is(Token.CLASS)) {
        add(first);
      } else {
        addExpr(first, 1, Context.OTHER);
        cc.endStatement();
      }
      return;
    }
    if (first.is(Token.EXPORT_SPECS)) {
      add(first);
      if (!children.get(1).is(Token.EMPTY)) {
        cc.add(" from ");
        add(children.get(1));
      }
      cc.endStatement();
      return;
    }
    add(first, Context.STATEMENT);
  }

  private void addModuleName(Node name) {
    if (name.hasFlag(Node.QUOTED)) {
      cc.add(quoteString(name.getNonNullString(), '"'));
    } else {
      add(name);
    }
  }

  private void addNumber(Node n) {
    String text = numberText(n);
    if (text != null) {
      cc.add(text);
    } else {
      cc.addNumber(n.getDouble());
    }
  }

  private static String printedNumber(Node n) {
    String text = numberText(n);
    return text != null ? text : CodeConsumer.formatNumber(n.getDouble());
  }

  /**
   * Returns how a number is written when its text can be kept: literal text in a plain decimal
   * or hex form, or an annotated constant. Returns null when the value must be formatted.
   */
  private static @Nullable String numberText(Node n) {
    String text = n.getString();
    if (text == null) {
      return null;
    }
    if (text.contains("/*") || PLAIN_NUMBER.matcher(text).matches()) {
      return text;
    }
    return null;
  }

  private static boolean isIntegerText(String text) {
    if (text.isEmpty()) {
      return false;
    }
    for (int i = 0; i < text.length(); i++) {
      if (!Character.isDigit(text.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  /** Parsed strings keep their source text; synthesized ones are double-quoted. */
  private String stringLiteralText(Node n) {
    Node original = NodeUtil.getOriginalNode(record, n);
    if (original != null
        && original.is(Token.STRINGLIT)
        && original.getNonNullString().equals(n.getString())) {
      return sourceFile.getCode().substring(original.getStart(), original.getEnd());
    }
    return quoteString(n.getNonNullString(), '"');
  }

  static String quoteString(String s, char quote) {
    StringBuilder sb = new StringBuilder(s.length() + 2);
    sb.append(quote);
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '\0':
          sb.append(
              i + 1 < s.length() && Character.isDigit(s.charAt(i + 1)) ? "\\x00" : "\\0");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        case '\u000B':
          sb.append("\\v");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case 0x2028:
          sb.append("\\u2028");
          break;
        case 0x2029:
          sb.append("\\u2029");
          break;
        default:
          if (c == quote) {
            sb.append('\\').append(c);
          } else if (c < 0x20 || c == 0x7f) {
            sb.append(String.format("\\x%02X", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    sb.append(quote);
    return sb.toString();
  }

  /** Binding power of {@code n} as an operand; higher binds tighter. */
  private int precedence(Node n) {
    switch (n.getToken()) {
      case COMMA:
        return 0;
      case YIELD:
        return 1;
      case FUNCTION:
        return n.isArrow() ? 1 : 18;
      case HOOK:
        return 2;
      case COALESCE:
        return 3;
      case OR:
        return 4;
      case AND:
        return 5;
      case BITOR:
        return 6;
      case BITXOR:
        return 7;
      case BITAND:
        return 8;
      case EQ:
      case NE:
      case SHEQ:
      case SHNE:
        return 9;
      case LT:
      case LE:
      case GT:
      case GE:
      case INSTANCEOF:
      case IN:
        return 10;
      case LSH:
      case RSH:
      case URSH:
        return 11;
      case ADD:
      case SUB:
        return 12;
      case MUL:
      case DIV:
      case MOD:
        return 13;
      case EXPONENT:
        return 14;
      case NOT:
      case BITNOT:
      case POS:
      case NEG:
      case TYPEOF:
      case VOID:
      case DELPROP:
      case AWAIT:
        return 15;
      case INC:
      case DEC:
        return n.hasFlag(Node.POSTFIX) ? 16 : 15;
      case CALL:
      case GETPROP:
      case GETELEM:
      case NEW:
      case TAGGED_TEMPLATELIT:
        return 17;
      case NUMBER:
        {
          double value = n.getDouble();
          boolean negative = value < 0 || (value == 0 && 1 / value < 0);
          return negative && numberText(n) == null ? 15 : 18;
        }
      case CAST:
      case NON_NULL:
        return precedence(record.getChild(n, 0));
      default:
        return n.getToken().isAssign() ? 1 : 18;
    }
  }

  private static String opToken(Token token) {
    switch (token) {
      case NOT:
        return "!";
      case BITNOT:
        return "~";
      case POS:
        return "+";
      case NEG:
        return "-";
      case TYPEOF:
        return "typeof";
      case VOID:
        return "void";
      case DELPROP:
        return "delete";
      case AWAIT:
        return "await";
      case OR:
        return "||";
      case AND:
        return "&&";
      case COALESCE:
        return "??";
      case BITOR:
        return "|";
      case BITXOR:
        return "^";
      case BITAND:
        return "&";
      case EQ:
        return "==";
      case NE:
        return "!=";
      case SHEQ:
        return "===";
      case SHNE:
        return "!==";
      case LT:
        return "<";
      case LE:
        return "<=";
      case GT:
        return ">";
      case GE:
        return ">=";
      case INSTANCEOF:
        return "instanceof";
      case IN:
        return "in";
      case LSH:
        return "<<";
      case RSH:
        return ">>";
      case URSH:
        return ">>>";
      case ADD:
        return "+";
      case SUB:
        return "-";
      case MUL:
        return "*";
      case DIV:
        return "/";
      case MOD:
        return "%";
      case EXPONENT:
        return "**";
      case ASSIGN:
        return "=";
      default:
        if (token.isCompoundAssign()) {
          return opToken(token.getAssignOpBinaryOp()) + "=";
        }
        throw new IllegalStateException("Not an operator: " + token);
    }
  }
}
