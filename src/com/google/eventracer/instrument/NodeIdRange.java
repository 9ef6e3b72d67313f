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

/** A half-open range {@code [start, end)} of node ids handed out inside one function. */
@AutoValue
public abstract class NodeIdRange {

  public abstract int start();

  public abstract int end();

  public static NodeIdRange create(int start, int end) {
    checkArgument(start >= 0, "Negative start %s", start);
    checkArgument(start <= end, "Range [%s, %s) is reversed", start, end);
    return new AutoValue_NodeIdRange(start, end);
  }

  public final int size() {
    return end() - start();
  }

  public final boolean contains(int id) {
    return start() <= id && id < end();
  }

  /** Whether {@code other} lies entirely within this range. */
  public final boolean encloses(NodeIdRange other) {
    return start() <= other.start() && other.end() <= end();
  }

  public final boolean isDisjointFrom(NodeIdRange other) {
    return end() <= other.start() || other.end() <= start();
  }

  @Override
  public final String toString() {
    return "[" + start() + ", " + end() + ")";
  }
}
