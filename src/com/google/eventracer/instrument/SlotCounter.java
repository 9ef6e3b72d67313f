/*
 * Copyright 2015 The Closure Compiler Authors.
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

package com.google.eventracer.instrument;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableMap;
import com.google.eventracer.ast.Node;
import com.google.eventracer.ast.Var;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Re-derives the per-function bookkeeping that a rewrite invalidates.
 *
 * <p>Visits the SCRIPT and every FUNCTION, synthesized closures included, in pre-order. Within each
 * function it numbers the materialized literals from zero, hands every node that needs runtime
 * feedback a contiguous range of slots, and counts the nodes. A FUNCTION node is counted in its
 * enclosing function; everything below it belongs to the function itself. Slot and literal numbers
 * are positional, so this must run over the tree exactly as the rewriter left it.
 */
public final class SlotCounter implements CompilerPass {

  /** Running totals of the function being counted. */
  private static final class FunctionState {
    int literalCount;
    int feedbackSlotCount;
    int nodeCount;
  }

  private final List<Node> units = new ArrayList<>();
  private @Nullable Node currentNode;

  @Override
  public void process(Node root) {
    checkArgument(root.isScript(), root);
    checkState(units.isEmpty(), "SlotCounter instances are single-use");
    countUnit(root);
    currentNode = null;
  }

  @Override
  public @Nullable Node getCurrentNode() {
    return currentNode;
  }

  /** Returns the counts of every function visited, keyed by SCRIPT or FUNCTION in pre-order. */
  public ImmutableMap<Node, FunctionCounts> getFunctionCounts() {
    ImmutableMap.Builder<Node, FunctionCounts> builder = ImmutableMap.builder();
    for (Node unit : units) {
      builder.put(unit, (FunctionCounts) unit.getProp(Node.Prop.FUNCTION_COUNTS));
    }
    return builder.buildOrThrow();
  }

  private void countUnit(Node unit) {
    units.add(unit);
    FunctionState state = new FunctionState();
    for (Node child = unit.getFirstChild(); child != null; child = child.getNext()) {
      count(child, state);
    }
    unit.putProp(
        Node.Prop.FUNCTION_COUNTS,
        FunctionCounts.create(state.literalCount, state.feedbackSlotCount, state.nodeCount));
  }

  private void count(Node n, FunctionState state) {
    currentNode = n;
    state.nodeCount++;
    if (n.isFunction()) {
      countUnit(n);
      return;
    }

    if (NodeUtil.isMaterializedLiteral(n)) {
      n.setLiteralIndex(state.literalCount++);
    }
    int slots = feedbackSlotsOf(n);
    if (slots > 0) {
      n.setFirstFeedbackSlot(state.feedbackSlotCount);
      state.feedbackSlotCount += slots;
    } else {
      // Clear a slot left over from before the rewrite.
      n.putProp(Node.Prop.FEEDBACK_SLOT, null);
    }

    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      count(child, state);
    }
  }

  /** Returns the number of feedback slots the runtime keeps for {@code n}. */
  static int feedbackSlotsOf(Node n) {
    switch (n.getToken()) {
      case NAME:
        return isFeedbackName(n) ? 1 : 0;
      case GETPROP:
      case GETELEM:
      case CALL:
      case FOR_IN:
        return 1;
      case NEW:
        // Call target and allocation site.
        return 2;
      case YIELD:
        return n.isYieldAll() ? 3 : 0;
      default:
        return 0;
    }
  }

  /** A reference that is looked up through the global object or dynamically. */
  private static boolean isFeedbackName(Node name) {
    if (NodeUtil.isDeclarationName(name)) {
      return false;
    }
    Var var = name.getVar();
    return var == null || var.isGlobalOrDynamic();
  }
}
