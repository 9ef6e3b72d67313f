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

package com.google.eventracer.ast;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeTest {

  @Test
  public void testChildLinks() {
    Node a = IR.name("a");
    Node b = IR.name("b");
    Node c = IR.name("c");
    Node call = IR.call(IR.name("f"), a, b, c);

    assertThat(call.getChildCount()).isEqualTo(4);
    assertThat(call.getSecondChild()).isSameInstanceAs(a);
    assertThat(call.getLastChild()).isSameInstanceAs(c);
    assertThat(b.getPrevious()).isSameInstanceAs(a);
    assertThat(c.getNext()).isNull();
    assertThat(b.getParent()).isSameInstanceAs(call);
  }

  @Test
  public void testReplaceWith() {
    Node a = IR.name("a");
    Node b = IR.name("b");
    Node c = IR.name("c");
    Node call = IR.call(IR.name("f"), a, b, c);
    Node replacement = IR.number(1);

    b.replaceWith(replacement);

    assertThat(b.getParent()).isNull();
    assertThat(b.getNext()).isNull();
    assertThat(call.getChildAtIndex(2)).isSameInstanceAs(replacement);
    assertThat(a.getNext()).isSameInstanceAs(replacement);
    assertThat(replacement.getNext()).isSameInstanceAs(c);
    assertThat(c.getPrevious()).isSameInstanceAs(replacement);
  }

  @Test
  public void testReplaceOnlyChild() {
    Node name = IR.name("a");
    Node expr = IR.exprResult(name);
    Node replacement = IR.number(2);

    name.replaceWith(replacement);

    assertThat(expr.getOnlyChild()).isSameInstanceAs(replacement);
    assertThat(expr.getLastChild()).isSameInstanceAs(replacement);
  }

  @Test
  public void testReplaceAttachedNodeFails() {
    Node a = IR.name("a");
    Node b = IR.name("b");
    IR.exprResult(b);
    IR.exprResult(a);

    assertThrows(IllegalStateException.class, () -> a.replaceWith(b));
  }

  @Test
  public void testDetach() {
    Node a = IR.name("a");
    Node b = IR.name("b");
    Node comma = IR.comma(a, b);

    a.detach();

    assertThat(comma.getFirstChild()).isSameInstanceAs(b);
    assertThat(comma.hasOneChild()).isTrue();
    assertThat(a.getParent()).isNull();
  }

  @Test
  public void testRemoveFirstChildOfLeaf() {
    assertThat(IR.name("a").removeFirstChild()).isNull();
  }

  @Test
  public void testAddChildToFrontAndBack() {
    Node block = IR.block();
    Node middle = IR.empty();
    block.addChildToBack(middle);
    Node first = IR.empty();
    block.addChildToFront(first);
    Node last = IR.empty();
    block.addChildToBack(last);

    assertThat(block.getChildCount()).isEqualTo(3);
    assertThat(block.getFirstChild()).isSameInstanceAs(first);
    assertThat(block.getSecondChild()).isSameInstanceAs(middle);
    assertThat(block.getLastChild()).isSameInstanceAs(last);
  }

  @Test
  public void testProps() {
    Node n = IR.name("a");
    assertThat(n.getBooleanProp(Node.Prop.DO_NOT_INSTRUMENT)).isFalse();

    n.putBooleanProp(Node.Prop.DO_NOT_INSTRUMENT, true);
    assertThat(n.getBooleanProp(Node.Prop.DO_NOT_INSTRUMENT)).isTrue();

    n.putBooleanProp(Node.Prop.DO_NOT_INSTRUMENT, false);
    assertThat(n.getBooleanProp(Node.Prop.DO_NOT_INSTRUMENT)).isFalse();
    assertThat(n.getProp(Node.Prop.DO_NOT_INSTRUMENT)).isNull();
  }

  @Test
  public void testFunctionId() {
    Node fn = IR.function(IR.name("f"), IR.paramList(), IR.block());
    assertThat(fn.hasFunctionId()).isFalse();
    assertThat(fn.getFunctionId()).isEqualTo(-1);

    fn.setFunctionId(3);
    assertThat(fn.hasFunctionId()).isTrue();
    assertThat(fn.getFunctionId()).isEqualTo(3);
  }

  @Test
  public void testFunctionIdOnlyOnUnits() {
    assertThrows(IllegalStateException.class, () -> IR.name("a").setFunctionId(1));
  }

  @Test
  public void testLiteralIndexAndFeedbackSlot() {
    Node obj = IR.objectlit();
    assertThat(obj.getLiteralIndex()).isEqualTo(-1);
    assertThat(obj.getFirstFeedbackSlot()).isEqualTo(-1);

    obj.setLiteralIndex(0);
    obj.setFirstFeedbackSlot(4);
    assertThat(obj.getLiteralIndex()).isEqualTo(0);
    assertThat(obj.getFirstFeedbackSlot()).isEqualTo(4);

    assertThrows(IllegalArgumentException.class, () -> obj.setLiteralIndex(-2));
  }

  @Test
  public void testNodeIdValidation() {
    Node n = IR.name("a");
    assertThat(n.getNodeId()).isEqualTo(Node.NO_POSITION);
    n.setNodeId(0);
    assertThat(n.getNodeId()).isEqualTo(0);
    assertThrows(IllegalArgumentException.class, () -> n.setNodeId(-5));
  }

  @Test
  public void testVarOnlyOnNames() {
    Scope global = Scope.createGlobal(IR.script());
    Var var = global.declare("g", null, StorageClass.GLOBAL, -1);
    Node name = IR.name("g");
    name.setVar(var);
    assertThat(name.getVar()).isSameInstanceAs(var);

    assertThrows(IllegalStateException.class, () -> IR.thisNode().setVar(var));
  }

  @Test
  public void testSrcrefIfMissing() {
    Node original = IR.name("a").setSourcePosition(12);
    Node placed = IR.name("b").setSourcePosition(3);
    Node fresh = IR.name("c");

    fresh.srcrefIfMissing(original);
    placed.srcrefIfMissing(original);

    assertThat(fresh.getSourcePosition()).isEqualTo(12);
    assertThat(placed.getSourcePosition()).isEqualTo(3);
  }

  @Test
  public void testCloneTree() {
    Node original = IR.exprResult(IR.inc(IR.getprop(IR.name("o"), "k"), true));
    original.getFirstChild().setNodeId(7);

    Node clone = original.cloneTree();

    assertThat(clone.isEquivalentTo(original)).isTrue();
    assertThat(clone.getFirstChild().isPostfix()).isTrue();
    assertThat(clone.getFirstChild().getNodeId()).isEqualTo(Node.NO_POSITION);
    assertThat(clone.getFirstChild()).isNotSameInstanceAs(original.getFirstChild());
  }

  @Test
  public void testEquivalenceDistinguishesPostfix() {
    Node pre = IR.inc(IR.name("a"), false);
    Node post = IR.inc(IR.name("a"), true);
    assertThat(pre.isEquivalentTo(post)).isFalse();
  }

  @Test
  public void testToString() {
    Node n = IR.name("a");
    n.setSourcePosition(4);
    n.setNodeId(2);
    assertThat(n.toString()).isEqualTo("NAME a @4 [id: 2]");
    assertThat(n.toString(false, false)).isEqualTo("NAME a");
  }

  @Test
  public void testToStringTree() {
    Node n = IR.exprResult(IR.name("a"));
    assertThat(n.toStringTree()).isEqualTo("EXPR_RESULT\n    NAME a\n");
  }

  @Test
  public void testYieldAllOnlyOnYield() {
    Node yield = IR.yield(IR.name("a"));
    yield.setYieldAll(true);
    assertThat(yield.isYieldAll()).isTrue();
    assertThrows(IllegalStateException.class, () -> IR.name("a").setYieldAll(true));
  }
}
