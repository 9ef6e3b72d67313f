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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import org.jspecify.annotations.Nullable;

/** Used by {@code Scope} to store information about variables. */
public final class Var {

  private final String name;

  private final @Nullable Node nameNode;

  private final Scope scope;

  private final StorageClass storage;

  /**
   * The slot index allocated by the resolver. For parameters it is the argument position, for
   * context and stack slots the slot number. It is -1 for dynamic and global variables.
   */
  private final int index;

  private final boolean compilerIntroduced;

  Var(
      String name,
      @Nullable Node nameNode,
      Scope scope,
      StorageClass storage,
      int index,
      boolean compilerIntroduced) {
    checkArgument(index >= -1, index);
    this.name = checkNotNull(name);
    this.nameNode = nameNode;
    this.scope = checkNotNull(scope);
    this.storage = checkNotNull(storage);
    this.index = index;
    this.compilerIntroduced = compilerIntroduced;
  }

  public String getName() {
    return name;
  }

  /** Returns the declaring NAME node, or null for implicit and compiler-introduced variables. */
  public @Nullable Node getNameNode() {
    return nameNode;
  }

  public Scope getScope() {
    return scope;
  }

  public StorageClass getStorage() {
    return storage;
  }

  public int getIndex() {
    return index;
  }

  /** Whether the variable was introduced by the compiler rather than declared in source. */
  public boolean isCompilerIntroduced() {
    return compilerIntroduced;
  }

  public boolean isContextSlot() {
    return storage == StorageClass.CONTEXT_SLOT;
  }

  public boolean isGlobalOrDynamic() {
    return storage == StorageClass.GLOBAL || storage == StorageClass.DYNAMIC;
  }

  /**
   * A variable is potentially shared if it was declared in source and its storage outlives a
   * single activation.
   */
  public boolean isPotentiallyShared() {
    return !compilerIntroduced && !storage.isActivationLocal();
  }

  @Override
  public String toString() {
    return "Var " + name + "{" + storage + (index >= 0 ? ":" + index : "") + "}";
  }
}
