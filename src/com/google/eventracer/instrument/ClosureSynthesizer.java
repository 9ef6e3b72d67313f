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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.eventracer.ast.Node;
import com.google.eventracer.ast.Scope;
import com.google.eventracer.ast.ScopeKind;
import com.google.eventracer.ast.StorageClass;
import com.google.eventracer.ast.Var;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the immediately invoked function expressions the rewriter uses to evaluate each operand
 * of an instrumented access exactly once.
 *
 * <p>The closure receives every value it needs as a parameter, so building it never makes an outer
 * variable captured. A typical use:
 *
 * <pre>
 *   Closure closure = synthesizer.begin(outerScope, site);
 *   Var obj = closure.declareParameter(OBJ);
 *   ... build the body from closure.ref(obj) ...
 *   Node fn = closure.finish(body);
 *   Node call = factory.createFreeCall(fn, originalObj);
 * </pre>
 */
final class ClosureSynthesizer {

  static final String OBJ = "$obj";
  static final String KEY = "$key";
  static final String VALUE = "$value";
  static final String ARG_PREFIX = "$a";

  private final SyntheticAstFactory factory;
  private final Map<Node, NodeIdRange> ranges = new LinkedHashMap<>();
  private int closureCount;

  ClosureSynthesizer(SyntheticAstFactory factory) {
    this.factory = checkNotNull(factory);
  }

  static String argumentName(int i) {
    checkArgument(i >= 0, i);
    return ARG_PREFIX + i;
  }

  /** Returns the number of closures built so far. */
  int getClosureCount() {
    return closureCount;
  }

  /** Returns the id ranges of the closures built so far, keyed by FUNCTION node. */
  Map<Node, NodeIdRange> getRanges() {
    return ranges;
  }

  /**
   * Starts a closure nested in {@code outer}. Node ids handed out until {@link Closure#finish}
   * belong to the closure.
   *
   * @param site the node being rewritten; its source position marks the closure's scope
   */
  Closure begin(Scope outer, Node site) {
    factory.getIdAllocator().enterScope();
    Scope scope = Scope.create(outer, ScopeKind.FUNCTION);
    int position = site.getSourcePosition();
    if (position != Node.NO_POSITION) {
      scope.setSourceRange(position, position + 1);
    }
    return new Closure(scope, site);
  }

  /** A closure under construction. */
  final class Closure {
    private final Scope scope;
    private final Node site;
    private final List<Var> parameters = new ArrayList<>();
    private int stackSlots;
    private boolean finished;

    private Closure(Scope scope, Node site) {
      this.scope = scope;
      this.site = site;
    }

    Scope getScope() {
      return scope;
    }

    /** Declares the next parameter, allocated to the next argument position. */
    Var declareParameter(String name) {
      checkState(!finished);
      Var var = scope.declareCompilerIntroduced(name, StorageClass.PARAMETER, parameters.size());
      parameters.add(var);
      return var;
    }

    /** Declares a block-scoped local, allocated to a stack slot. */
    Var declareLocal(String name) {
      checkState(!finished);
      return scope.declareCompilerIntroduced(name, StorageClass.STACK_SLOT, stackSlots++);
    }

    /** Creates a fresh reference to a parameter or local of this closure. */
    Node ref(Var var) {
      checkArgument(var.getScope() == scope, "%s is not declared in %s", var, scope);
      return factory.createName(var);
    }

    /** Completes the closure with {@code statements} as its body and returns the FUNCTION. */
    Node finish(List<Node> statements) {
      checkState(!finished, "Closure already finished");
      finished = true;
      ImmutableList.Builder<Node> params = ImmutableList.builder();
      for (Var parameter : parameters) {
        params.add(factory.createName(parameter));
      }
      Node paramList = factory.createParamList(params.build());
      Node body = factory.createBlock(statements);
      NodeIdRange range = factory.getIdAllocator().exitScope();

      // The FUNCTION node itself is numbered in the enclosing function.
      Node fn = factory.createFunction(paramList, body);
      fn.srcrefIfMissing(site);
      fn.putBooleanProp(Node.Prop.SYNTHETIC, true);
      fn.putProp(Node.Prop.NODE_ID_RANGE, range);
      scope.setRootNode(fn);
      ranges.put(fn, range);
      closureCount++;
      return fn;
    }
  }
}
