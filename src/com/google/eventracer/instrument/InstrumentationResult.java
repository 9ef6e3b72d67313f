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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.google.eventracer.ast.Node;

/** What one run of {@link EventRacerInstrumentation} produced. */
@AutoValue
public abstract class InstrumentationResult {

  /** The rewritten SCRIPT, which is the root that was passed in. */
  public abstract Node root();

  /**
   * Counts per SCRIPT or FUNCTION, in pre-order. Empty when slot counting is disabled.
   */
  public abstract ImmutableMap<Node, FunctionCounts> functionCounts();

  /** Node-id ranges per SCRIPT or FUNCTION, original or synthesized, ordered by start. */
  public abstract ImmutableMap<Node, NodeIdRange> nodeIdRanges();

  public abstract int hookCallCount();

  public abstract int closureCount();

  static InstrumentationResult create(
      Node root,
      ImmutableMap<Node, FunctionCounts> functionCounts,
      ImmutableMap<Node, NodeIdRange> nodeIdRanges,
      int hookCallCount,
      int closureCount) {
    return new AutoValue_InstrumentationResult(
        root, functionCounts, nodeIdRanges, hookCallCount, closureCount);
  }
}
