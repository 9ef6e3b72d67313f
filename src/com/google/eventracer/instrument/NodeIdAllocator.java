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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.eventracer.ast.Node;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Hands out ids for synthesized nodes.
 *
 * <p>Numbering is a single monotonic sequence. Entering a function, original or synthesized, pushes
 * the current position; leaving it pops the position and yields the range the function consumed.
 * Numbering then resumes in the enclosing function after that range, so a nested range is carved
 * out of the enclosing function's sequence at the point of nesting and sibling ranges never
 * overlap.
 */
public final class NodeIdAllocator {

  private final Deque<Integer> starts = new ArrayDeque<>();
  private int nextId;

  public NodeIdAllocator(int firstId) {
    checkArgument(firstId >= 0, firstId);
    this.nextId = firstId;
  }

  /** Returns an allocator starting one past the largest id already present under {@code root}. */
  public static NodeIdAllocator after(Node root) {
    return new NodeIdAllocator(maxNodeId(root) + 1);
  }

  private static int maxNodeId(Node n) {
    int max = n.getNodeId();
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      max = Math.max(max, maxNodeId(child));
    }
    return max;
  }

  /** Consumes and returns the next id. */
  public int next() {
    checkState(nextId < Integer.MAX_VALUE, "Node id space exhausted");
    return nextId++;
  }

  /** Returns the id the next call to {@link #next} will return, without consuming it. */
  public int peek() {
    return nextId;
  }

  /** Stamps {@code n} with the next id. */
  @CanIgnoreReturnValue
  public Node stamp(Node n) {
    n.setNodeId(next());
    return n;
  }

  public void enterScope() {
    starts.push(nextId);
  }

  /** Leaves the innermost scope and returns the ids it consumed. */
  public NodeIdRange exitScope() {
    checkState(!starts.isEmpty(), "exitScope without matching enterScope");
    return NodeIdRange.create(starts.pop(), nextId);
  }

  public int getDepth() {
    return starts.size();
  }
}
