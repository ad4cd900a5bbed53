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
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A function body flattened into numbered blocks for the {@code __generator} runtime. Block
 * {@code n} becomes {@code case n} of a {@code switch (_a.label)}; the runtime keeps {@code
 * _a.label} pointing at the block to run next.
 */
final class StateDescriptor {
  static final int OP_RETURN = 2;
  static final int OP_BREAK = 3;
  static final int OP_YIELD = 4;
  static final int OP_YIELD_STAR = 5;
  static final int OP_END_FINALLY = 7;

  /** A number in the output that stands for a label, filled in once blocks are numbered. */
  record LabelReference(Label label, Node placeholder) {}

  private final ImmutableList<StateBlock> blocks;
  private final ImmutableList<ProtectedRegion> regions;
  private final ImmutableList<String> hoistedNames;
  private final ImmutableList<Node> hoistedFunctions;
  private final ImmutableList<LabelReference> labelReferences;

  StateDescriptor(
      List<StateBlock> blocks,
      List<ProtectedRegion> regions,
      List<String> hoistedNames,
      List<Node> hoistedFunctions,
      List<LabelReference> labelReferences) {
    this.blocks = ImmutableList.copyOf(blocks);
    this.regions = ImmutableList.copyOf(regions);
    this.hoistedNames = ImmutableList.copyOf(hoistedNames);
    this.hoistedFunctions = ImmutableList.copyOf(hoistedFunctions);
    this.labelReferences = ImmutableList.copyOf(labelReferences);
  }

  ImmutableList<StateBlock> getBlocks() {
    return blocks;
  }

  /** The try statements with suspension points, outermost first. */
  ImmutableList<ProtectedRegion> getRegions() {
    return regions;
  }

  /** Variables declared anywhere in the body, and temporaries, to be declared outside it. */
  ImmutableList<String> getHoistedNames() {
    return hoistedNames;
  }

  /** Function declarations of the body, to be declared outside it. */
  ImmutableList<Node> getHoistedFunctions() {
    return hoistedFunctions;
  }

  /** Whether the body suspends or jumps, and so needs a {@code switch} to resume. */
  boolean needsDispatch() {
    return blocks.size() > 1 || !regions.isEmpty();
  }

  /**
   * Returns the statements of the function passed to {@code __generator}, whose parameter is
   * {@code stateName}.
   */
  ImmutableList<Node> createGeneratorBody(AstFactory astFactory, String stateName) {
    TransformRecord record = astFactory.getRecord();
    for (LabelReference reference : labelReferences) {
      record.replace(
          reference.placeholder(), astFactory.createNumber(reference.label().getBlockNumber()));
    }
    if (!needsDispatch()) {
      StateBlock block = blocks.get(0);
      return ImmutableList.<Node>builder()
          .addAll(block.getStatements())
          .add(createTerminal(astFactory, stateName, block))
          .build();
    }
    List<Node> children = new ArrayList<>();
    children.add(astFactory.createGetProp(astFactory.createName(stateName), "label"));
    for (StateBlock block : blocks) {
      List<Node> caseChildren = new ArrayList<>();
      caseChildren.add(astFactory.createNumber(block.getNumber()));
      caseChildren.addAll(block.getStatements());
      caseChildren.add(createTerminal(astFactory, stateName, block));
      children.add(record.newNode(Token.CASE, caseChildren, null, 0, 0, null));
    }
    return ImmutableList.of(record.newNode(Token.SWITCH, children, null, 0, 0, null));
  }

  private static Node createTerminal(AstFactory astFactory, String stateName, StateBlock block) {
    Terminal terminal = block.getTerminal();
    Node origin = terminal.getOrigin();
    switch (terminal.getKind()) {
      case FALLTHROUGH:
        return astFactory.exprResult(
            astFactory.createAssign(
                astFactory.createGetProp(astFactory.createName(stateName), "label"),
                astFactory.createNumber(block.getNumber() + 1)));
      case JUMP:
        return createInstruction(
            astFactory,
            OP_BREAK,
            "break",
            astFactory.createNumber(checkNotNull(terminal.getTarget()).getBlockNumber()),
            origin);
      case RETURN:
        return createInstruction(astFactory, OP_RETURN, "return", terminal.getValue(), origin);
      case THROW:
        return astFactory.createThrow(checkNotNull(terminal.getValue()), origin);
      case SUSPEND:
        return createInstruction(astFactory, OP_YIELD, "yield", terminal.getValue(), origin);
      case DELEGATE:
        return createInstruction(
            astFactory,
            OP_YIELD_STAR,
            "yield*",
            astFactory.createHelperCall(
                RuntimeHelper.VALUES, checkNotNull(terminal.getValue())),
            origin);
      case END_FINALLY:
        return createInstruction(astFactory, OP_END_FINALLY, "endfinally", null, origin);
    }
    throw new AssertionError(terminal.getKind());
  }

  /** Returns {@code return [opcode, operand];}. */
  static Node createInstruction(
      AstFactory astFactory,
      int opcode,
      String name,
      @Nullable Node operand,
      @Nullable Node origin) {
    Node instruction =
        operand == null
            ? astFactory.createArraylit(astFactory.createOpcode(opcode, name))
            : astFactory.createArraylit(astFactory.createOpcode(opcode, name), operand);
    return astFactory.createReturn(instruction, origin);
  }
}
