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
import com.google.tsdown.parsing.ParseException;
import com.google.tsdown.parsing.ParserRunner;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Converts template literals to string concatenation and tagged templates to calls of the tag
 * with a cached template object.
 *
 * <pre>
 * `a${b}c${d}`  becomes  "a".concat(b, "c").concat(d)
 * tag`a${b}`    becomes  tag(templateObject_1 || (templateObject_1 =
 *                              __makeTemplateObject(["a", ""], ["a", ""])), b)
 * </pre>
 */
final class RewriteTemplateLiterals extends NodeTraversal.AbstractPostOrderCallback
    implements CompilerPass {
  private final AbstractCompiler compiler;
  private final TransformRecord record;
  private final AstFactory astFactory;
  private final UniqueNameGenerator nameGenerator;

  RewriteTemplateLiterals(AbstractCompiler compiler) {
    this.compiler = compiler;
    this.record = compiler.getRecord();
    this.astFactory = compiler.createAstFactory();
    this.nameGenerator = compiler.getUniqueNameGenerator();
  }

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(compiler, root, this);
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (n.is(Token.TAGGED_TEMPLATELIT)) {
      visitTaggedTemplateLiteral(t, n);
    } else if (n.is(Token.TEMPLATELIT)
        && (parent == null || !parent.is(Token.TAGGED_TEMPLATELIT))) {
      visitTemplateLiteral(n);
    }
  }

  private void visitTemplateLiteral(Node n) {
    ImmutableList<Node> children = record.getChildren(n);
    Node result = createString(children.get(0));
    // Each substitution is concatenated together with the text following it.
    for (int i = 1; i < children.size(); i += 2) {
      List<Node> args = new ArrayList<>();
      args.add(children.get(i));
      Node text = children.get(i + 1);
      if (!cook(text).isEmpty()) {
        args.add(createString(text));
      }
      result = astFactory.createCall(astFactory.createGetProp(result, "concat"), args, text);
    }
    record.replace(n, result);
  }

  private Node createString(Node templateString) {
    return astFactory.createString(cook(templateString), templateString);
  }

  private static String cook(Node templateString) {
    return ParserRunner.cookTemplateString(templateString.getNonNullString());
  }

  private void visitTaggedTemplateLiteral(NodeTraversal t, Node n) {
    Node tag = record.getChild(n, 0);
    ImmutableList<Node> parts = record.getChildren(record.getChild(n, 1));
    List<Node> cooked = new ArrayList<>();
    List<Node> raw = new ArrayList<>();
    List<Node> substitutions = new ArrayList<>();
    for (int i = 0; i < parts.size(); i++) {
      Node part = parts.get(i);
      if (i % 2 == 1) {
        substitutions.add(part);
        continue;
      }
      String rawText = part.getNonNullString().replace("\r\n", "\n").replace('\r', '\n');
      raw.add(astFactory.createString(rawText));
      try {
        cooked.add(astFactory.createString(cook(part), part));
      } catch (ParseException e) {
        // Tagged templates allow invalid escapes; their cooked value is undefined.
        cooked.add(astFactory.createUndefinedValue());
      }
    }
    String cacheName = nameGenerator.numberedName("templateObject");
    record.declareTemporary(record.getRoot(), cacheName);
    Node templateObject =
        astFactory.createOr(
            astFactory.createName(cacheName),
            astFactory.createAssign(
                astFactory.createName(cacheName),
                astFactory.createHelperCall(
                    RuntimeHelper.MAKE_TEMPLATE_OBJECT,
                    astFactory.createArraylit(cooked),
                    astFactory.createArraylit(raw))));
    List<Node> args = new ArrayList<>();
    args.add(templateObject);
    args.addAll(substitutions);
    record.replace(n, astFactory.createCall(tag, args, n));
  }
}
