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

import com.google.eventracer.ast.IR;
import com.google.eventracer.ast.Node;
import com.google.eventracer.ast.Scope;
import com.google.eventracer.ast.StorageClass;
import com.google.eventracer.ast.Token;
import com.google.eventracer.ast.Var;
import java.util.List;

/**
 * Creates the nodes the instrumentation adds to a tree.
 *
 * <p>Every node created here is stamped with the next id from the shared {@link NodeIdAllocator},
 * so the ids of synthesized nodes are unique within the compilation unit and contiguous within the
 * function being built. Nodes passed in as children keep the ids they already have.
 */
final class SyntheticAstFactory {

  /** Runtime primitive returning the context {@code n} levels up the context chain. */
  static final String GET_CONTEXT_N = "GetContextN";

  private final NodeIdAllocator ids;
  private final Scope globalScope;
  private final String hookPrefix;
  private int hookCallCount;

  SyntheticAstFactory(NodeIdAllocator ids, Scope globalScope, String hookPrefix) {
    checkArgument(globalScope.isGlobal(), globalScope);
    this.ids = checkNotNull(ids);
    this.globalScope = globalScope;
    this.hookPrefix = checkNotNull(hookPrefix);
  }

  NodeIdAllocator getIdAllocator() {
    return ids;
  }

  /** Returns the number of hook calls created so far. */
  int getHookCallCount() {
    return hookCallCount;
  }

  private Node stamp(Node n) {
    return ids.stamp(n);
  }

  /**
   * Creates a call to a logging hook. The callee is a reference to a compiler-introduced dynamic
   * global, which is never instrumented itself.
   */
  Node createHookCall(InstrumentationHook hook, Node... args) {
    checkState(
        args.length == hook.getArity(),
        "%s takes %s arguments, got %s",
        hook,
        hook.getArity(),
        args.length);
    Node call = createFreeCall(createHookReference(hook), args);
    hookCallCount++;
    return call;
  }

  private Node createHookReference(InstrumentationHook hook) {
    String identifier = hook.getIdentifier(hookPrefix);
    Var var = globalScope.getOwnSlot(identifier);
    if (var == null) {
      var = globalScope.declareCompilerIntroduced(identifier, StorageClass.DYNAMIC, -1);
    }
    return createName(var);
  }

  /** Creates a reference to {@code var} that the rewriter will not instrument. */
  Node createName(Var var) {
    Node name = stamp(IR.name(var.getName()));
    name.setVar(var);
    name.putBooleanProp(Node.Prop.DO_NOT_INSTRUMENT, true);
    return name;
  }

  /**
   * Creates another reference to the variable {@code original} names, bound the same way. An
   * unbound name stays unbound.
   */
  Node createNameLike(Node original) {
    checkArgument(original.isName(), original);
    Node name = stamp(IR.name(original.getString()));
    if (original.getVar() != null) {
      name.setVar(original.getVar());
    }
    name.putBooleanProp(Node.Prop.DO_NOT_INSTRUMENT, true);
    return name.srcref(original);
  }

  Node createString(String value) {
    return stamp(IR.string(value));
  }

  /** Creates a number literal; a negative value is written as a NEG of its magnitude. */
  Node createNumber(double value) {
    if (value < 0) {
      return stamp(IR.unaryOp(Token.NEG, createNumber(-value)));
    }
    return stamp(IR.number(value));
  }

  Node createNull() {
    return stamp(IR.nullNode());
  }

  /** Creates {@code void 0}. */
  Node createUndefinedValue() {
    return stamp(IR.voidNode(createNumber(0)));
  }

  /** Creates a copy of a string or number key; copying a literal has no side effects. */
  Node createCopyOfKey(Node key) {
    return stamp(NodeUtil.copyLiteralKey(key).srcref(key));
  }

  /** Creates {@code %GetContextN(depth)}. */
  Node createContextLookup(int depth) {
    checkArgument(depth >= 0, depth);
    return stamp(IR.callRuntime(GET_CONTEXT_N, createNumber(depth)));
  }

  /** Creates a GETPROP if {@code key} is a string literal, and a GETELEM otherwise. */
  Node createGet(Node receiver, Node key) {
    if (key.isString()) {
      return stamp(new Node(Token.GETPROP, receiver, key));
    }
    return stamp(IR.getelem(receiver, key));
  }

  Node createFreeCall(Node callee, Node... args) {
    Node call = stamp(IR.call(callee, args));
    call.putBooleanProp(Node.Prop.FREE_CALL, true);
    return call;
  }

  /** Creates a call whose receiver is the object of {@code callee}, a GETPROP or GETELEM. */
  Node createMethodCall(Node callee, List<Node> args) {
    checkArgument(NodeUtil.isNormalGet(callee), callee);
    return stamp(IR.call(callee, args.toArray(new Node[0])));
  }

  Node createAssign(Node target, Node value) {
    return stamp(IR.assign(target, value));
  }

  Node createBinaryOp(Token op, Node left, Node right) {
    return stamp(IR.binaryOp(op, left, right));
  }

  /** Creates {@code +value}, converting an operand the way {@code ++} and {@code --} do. */
  Node createToNumber(Node value) {
    return stamp(IR.unaryOp(Token.POS, value));
  }

  Node createDelProp(Node target) {
    return stamp(IR.delprop(target));
  }

  Node createReturn(Node value) {
    return stamp(IR.returnNode(value));
  }

  Node createExprResult(Node expr) {
    return stamp(IR.exprResult(expr));
  }

  /** Creates {@code let name = value;} declaring {@code var}. */
  Node createSingleLetDeclaration(Var var, Node value) {
    Node name = createName(var);
    return stamp(IR.let(name, value));
  }

  Node createParamList(List<Node> params) {
    return stamp(IR.paramList(params));
  }

  Node createBlock(List<Node> statements) {
    return stamp(IR.block(statements));
  }

  /** Creates an anonymous function expression. */
  Node createFunction(Node params, Node body) {
    Node name = stamp(IR.name(""));
    return stamp(IR.function(name, params, body));
  }
}
