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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A lexical scope produced by the resolver, or synthesized by a pass that creates new functions.
 *
 * <p>Scopes form a tree mirroring the nesting of their root nodes. The parent link is a plain back
 * reference; each scope owns its declarations and lists its child scopes in creation order.
 */
public final class Scope {

  private final ScopeKind kind;
  private final @Nullable Scope parent;
  private final Map<String, Var> vars = new LinkedHashMap<>();
  private final List<Scope> children = new ArrayList<>();
  private @Nullable Node rootNode;
  private boolean strict;
  private boolean forceContext;
  private int startPosition = Node.NO_POSITION;
  private int endPosition = Node.NO_POSITION;

  private Scope(ScopeKind kind, @Nullable Scope parent) {
    this.kind = checkNotNull(kind);
    this.parent = parent;
  }

  /** Creates the global scope of a compilation unit. */
  public static Scope createGlobal(Node root) {
    checkArgument(root.isScript(), root);
    Scope scope = new Scope(ScopeKind.GLOBAL, null);
    scope.setRootNode(root);
    return scope;
  }

  /** Creates a scope nested in {@code parent} and registers it as the parent's last child. */
  public static Scope create(Scope parent, ScopeKind kind) {
    checkNotNull(parent);
    checkArgument(kind != ScopeKind.GLOBAL, "Only the root scope can be global");
    Scope scope = new Scope(kind, parent);
    parent.children.add(scope);
    return scope;
  }

  public ScopeKind getKind() {
    return kind;
  }

  public @Nullable Scope getParent() {
    return parent;
  }

  public ImmutableList<Scope> getChildren() {
    return ImmutableList.copyOf(children);
  }

  /** Returns the node this scope is attached to, or null while a synthesized scope is built. */
  public @Nullable Node getRootNode() {
    return rootNode;
  }

  /** Attaches this scope to {@code root}, and records it on the node. */
  public void setRootNode(Node root) {
    checkState(rootNode == null, "Scope already attached to %s", rootNode);
    this.rootNode = root;
    root.setScope(this);
  }

  public boolean isGlobal() {
    return kind == ScopeKind.GLOBAL;
  }

  public boolean isFunctionScope() {
    return kind == ScopeKind.FUNCTION;
  }

  public int getDepth() {
    return parent == null ? 0 : parent.getDepth() + 1;
  }

  /** Whether code in this scope runs in strict mode, either declared here or inherited. */
  public boolean isStrict() {
    return strict || (parent != null && parent.isStrict());
  }

  public void setStrict(boolean strict) {
    this.strict = strict;
  }

  /** Requires a context for this scope even if it declares no context slots. */
  public void setForceContext(boolean forceContext) {
    this.forceContext = forceContext;
  }

  public int getStartPosition() {
    return startPosition;
  }

  public int getEndPosition() {
    return endPosition;
  }

  public void setSourceRange(int start, int end) {
    checkArgument(start <= end, "start %s after end %s", start, end);
    this.startPosition = start;
    this.endPosition = end;
  }

  /**
   * Whether entering this scope allocates a context. WITH and CATCH scopes always do. Other scopes
   * do when they declare a context slot or the resolver requires one.
   */
  public boolean needsContext() {
    if (forceContext || kind == ScopeKind.WITH || kind == ScopeKind.CATCH) {
      return true;
    }
    for (Var v : vars.values()) {
      if (v.isContextSlot()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the number of contexts between this scope and {@code target}, counting this scope but
   * not {@code target}. {@code target} must enclose this scope or be this scope.
   */
  public int contextChainLength(Scope target) {
    int n = 0;
    for (Scope s = this; s != target; s = s.parent) {
      checkState(s != null, "%s does not enclose %s", target, this);
      if (s.needsContext()) {
        n++;
      }
    }
    return n;
  }

  /** Returns the nearest enclosing function or global scope, which is where vars are hoisted. */
  public Scope getClosureScope() {
    Scope s = this;
    while (s.kind != ScopeKind.FUNCTION && s.kind != ScopeKind.GLOBAL) {
      s = s.parent;
    }
    return s;
  }

  @CanIgnoreReturnValue
  public Var declare(String name, @Nullable Node nameNode, StorageClass storage, int index) {
    return declare(name, nameNode, storage, index, false);
  }

  /** Declares a variable that does not appear in source, such as a synthesized parameter. */
  @CanIgnoreReturnValue
  public Var declareCompilerIntroduced(String name, StorageClass storage, int index) {
    return declare(name, null, storage, index, true);
  }

  private Var declare(
      String name,
      @Nullable Node nameNode,
      StorageClass storage,
      int index,
      boolean compilerIntroduced) {
    checkState(!vars.containsKey(name), "%s already declared in %s", name, this);
    Var var = new Var(name, nameNode, this, storage, index, compilerIntroduced);
    vars.put(name, var);
    return var;
  }

  public @Nullable Var getOwnSlot(String name) {
    return vars.get(name);
  }

  /** Looks up {@code name} in this scope and then in the enclosing scopes. */
  public @Nullable Var getVar(String name) {
    for (Scope s = this; s != null; s = s.parent) {
      Var var = s.vars.get(name);
      if (var != null) {
        return var;
      }
    }
    return null;
  }

  /** Returns the declarations of this scope in declaration order. */
  public Iterable<Var> getVarIterable() {
    return vars.values();
  }

  public int getVarCount() {
    return vars.size();
  }

  @Override
  public String toString() {
    return "Scope@" + kind + (rootNode == null ? "" : "(" + rootNode.getToken() + ")");
  }
}
