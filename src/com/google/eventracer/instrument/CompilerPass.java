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

import com.google.eventracer.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * Interface for classes that transform a resolved program tree.
 *
 * <p>Class has single function "process", which is passed the SCRIPT root of the resolved tree.
 */
public interface CompilerPass {

  /**
   * Process the tree rooted at root. Can modify the contents of each Node tree.
   *
   * @param root the SCRIPT node of a compilation unit
   */
  void process(Node root);

  /** Returns the node being processed, so a failure can be reported against it. */
  default @Nullable Node getCurrentNode() {
    return null;
  }
}
