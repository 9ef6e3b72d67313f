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

/** Where the resolver allocated a variable. */
public enum StorageClass {
  /** Unresolved, looked up by name at runtime (eval, with, or a missing declaration). */
  DYNAMIC,
  /** A property of the global object. */
  GLOBAL,
  /** A slot in a heap-allocated function context, reachable from inner closures. */
  CONTEXT_SLOT,
  /** A register or stack slot that lives only as long as one activation. */
  STACK_SLOT,
  /** A formal parameter of the enclosing function. */
  PARAMETER;

  /** Whether accesses are bound to a single activation record and so cannot be raced on. */
  public boolean isActivationLocal() {
    return this == STACK_SLOT || this == PARAMETER;
  }
}
