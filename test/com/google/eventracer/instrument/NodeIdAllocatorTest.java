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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.eventracer.ast.IR;
import com.google.eventracer.ast.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeIdAllocatorTest {

  @Test
  public void testIdsAreConsecutive() {
    NodeIdAllocator ids = new NodeIdAllocator(10);
    assertThat(ids.peek()).isEqualTo(10);
    assertThat(ids.next()).isEqualTo(10);
    assertThat(ids.next()).isEqualTo(11);
    assertThat(ids.peek()).isEqualTo(12);
  }

  @Test
  public void testStamp() {
    NodeIdAllocator ids = new NodeIdAllocator(0);
    Node n = ids.stamp(IR.name("a"));
    assertThat(n.getNodeId()).isEqualTo(0);
    assertThat(ids.stamp(IR.name("b")).getNodeId()).isEqualTo(1);
  }

  @Test
  public void testAfterStartsPastTheLargestId() {
    Node a = IR.name("a");
    Node b = IR.name("b");
    Node script = IR.script(IR.exprResult(IR.comma(a, b)));
    b.setNodeId(41);
    a.setNodeId(7);

    assertThat(NodeIdAllocator.after(script).peek()).isEqualTo(42);
  }

  @Test
  public void testAfterUnnumberedTreeStartsAtZero() {
    assertThat(NodeIdAllocator.after(IR.script()).peek()).isEqualTo(0);
  }

  @Test
  public void testNestedScopes() {
    NodeIdAllocator ids = new NodeIdAllocator(5);
    ids.enterScope();
    ids.next();
    ids.enterScope();
    ids.next();
    ids.next();
    assertThat(ids.getDepth()).isEqualTo(2);
    NodeIdRange inner = ids.exitScope();
    ids.next();
    NodeIdRange outer = ids.exitScope();

    assertThat(inner).isEqualTo(NodeIdRange.create(6, 8));
    assertThat(outer).isEqualTo(NodeIdRange.create(5, 9));
    assertThat(outer.encloses(inner)).isTrue();
    assertThat(ids.getDepth()).isEqualTo(0);
  }

  @Test
  public void testEmptyScope() {
    NodeIdAllocator ids = new NodeIdAllocator(3);
    ids.enterScope();
    NodeIdRange range = ids.exitScope();
    assertThat(range.size()).isEqualTo(0);
    assertThat(range.contains(3)).isFalse();
  }

  @Test
  public void testUnbalancedExitFails() {
    assertThrows(IllegalStateException.class, () -> new NodeIdAllocator(0).exitScope());
  }

  @Test
  public void testNegativeStartFails() {
    assertThrows(IllegalArgumentException.class, () -> new NodeIdAllocator(-1));
  }

  @Test
  public void testRanges() {
    NodeIdRange range = NodeIdRange.create(2, 5);
    assertThat(range.contains(2)).isTrue();
    assertThat(range.contains(5)).isFalse();
    assertThat(range.isDisjointFrom(NodeIdRange.create(5, 9))).isTrue();
    assertThat(range.isDisjointFrom(NodeIdRange.create(4, 9))).isFalse();
    assertThat(range.toString()).isEqualTo("[2, 5)");
    assertThrows(IllegalArgumentException.class, () -> NodeIdRange.create(5, 2));
  }
}
