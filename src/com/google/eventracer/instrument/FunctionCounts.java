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

import com.google.auto.value.AutoValue;

/**
 * Per-function totals derived by {@link SlotCounter} and consumed by code generation: the size of
 * the function's literal table, the number of feedback slots it needs and its node count.
 */
@AutoValue
public abstract class FunctionCounts {

  public abstract int literalCount();

  public abstract int feedbackSlotCount();

  public abstract int nodeCount();

  public static FunctionCounts create(int literalCount, int feedbackSlotCount, int nodeCount) {
    checkArgument(literalCount >= 0, literalCount);
    checkArgument(feedbackSlotCount >= 0, feedbackSlotCount);
    checkArgument(nodeCount >= 0, nodeCount);
    return new AutoValue_FunctionCounts(literalCount, feedbackSlotCount, nodeCount);
  }
}
