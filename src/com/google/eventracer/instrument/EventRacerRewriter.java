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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.eventracer.ast.IR;
import com.google.eventracer.ast.Node;
import com.google.eventracer.ast.Scope;
import com.google.eventracer.ast.Token;
import com.google.eventracer.ast.Var;
import com.google.eventracer.instrument.AccessSite.Operation;
import com.google.eventracer.instrument.AccessSite.Target;
import com.google.eventracer.instrument.ClosureSynthesizer.Closure;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Routes every access to potentially shared state through a logging hook, so a race detector can
 * observe it at runtime.
 *
 * <p>Shared state is a global or unresolved variable, a variable captured in a function context,
 * or an object property. The rewritten code keeps the evaluation order of the original and
 * evaluates each operand exactly once. Where an operand has to be both passed to a hook and used
 * in the real access, the access is moved into an immediately invoked closure that receives the
 * operand as a parameter:
 *
 * <pre>
 *   obj.key   =>  (function($obj) { return ER_readProp($obj, "key", $obj.key); })(obj)
 *   arr[idx]  =>  ER_readPropIdx(arr, idx)
 *   g = e     =>  g = ER_write("g", e)
 * </pre>
 *
 * <p>Every function also logs its entry and each of its exits. The pass runs after scope
 * resolution and relies on the {@link Scope} and {@link Var} annotations of the tree.
 */
public final class EventRacerRewriter implements CompilerPass {

  /** Runtime primitive that declares and initializes a global variable. */
  static final String INITIALIZE_VAR_GLOBAL = "InitializeVarGlobal";

  /** How the rewriter treats each kind of node. */
  private enum Rule {
    /** Rewrite the children only. */
    CHILDREN,
    /** Leave the node and its children alone. */
    NONE,
    /** Rewrite the children within the scope the node introduces, if any. */
    SCOPED,
    WITH,
    CATCH,
    FOR_IN_OR_OF,
    FUNCTION,
    NAME,
    DECLARATION,
    PROPERTY_READ,
    CALL,
    CALL_RUNTIME,
    DELETE,
    TYPEOF,
    UPDATE,
    ASSIGN,
    RETURN
  }

  private static Rule ruleFor(Token token) {
    return switch (token) {
      case SCRIPT -> throw new IllegalStateException("Nested SCRIPT");
      case BLOCK -> Rule.SCOPED;
      case WITH -> Rule.WITH;
      case CATCH -> Rule.CATCH;
      case FOR_IN, FOR_OF -> Rule.FOR_IN_OR_OF;
      case FUNCTION -> Rule.FUNCTION;
      case NAME -> Rule.NAME;
      case VAR, LET, CONST -> Rule.DECLARATION;
      case GETPROP, GETELEM -> Rule.PROPERTY_READ;
      case CALL -> Rule.CALL;
      case CALL_RUNTIME -> Rule.CALL_RUNTIME;
      case DELPROP -> Rule.DELETE;
      case TYPEOF -> Rule.TYPEOF;
      case INC, DEC -> Rule.UPDATE;
      case ASSIGN,
          ASSIGN_BITOR,
          ASSIGN_BITXOR,
          ASSIGN_BITAND,
          ASSIGN_LSH,
          ASSIGN_RSH,
          ASSIGN_URSH,
          ASSIGN_ADD,
          ASSIGN_SUB,
          ASSIGN_MUL,
          ASSIGN_DIV,
          ASSIGN_MOD,
          ASSIGN_EXPONENT ->
          Rule.ASSIGN;
      case RETURN -> Rule.RETURN;
      case PARAM_LIST,
          LABEL_NAME,
          BREAK,
          CONTINUE,
          DEBUGGER,
          EMPTY,
          STRINGLIT,
          NUMBER,
          NULL,
          TRUE,
          FALSE,
          THIS,
          REGEXP ->
          Rule.NONE;
      case EXPR_RESULT,
          IF,
          WHILE,
          DO,
          FOR,
          SWITCH,
          CASE,
          DEFAULT_CASE,
          TRY,
          LABEL,
          THROW,
          ARRAYLIT,
          OBJECTLIT,
          STRING_KEY,
          NEW,
          NOT,
          BITNOT,
          POS,
          NEG,
          VOID,
          BITOR,
          BITXOR,
          BITAND,
          LSH,
          RSH,
          URSH,
          ADD,
          SUB,
          MUL,
          DIV,
          MOD,
          EXPONENT,
          EQ,
          NE,
          SHEQ,
          SHNE,
          LT,
          LE,
          GT,
          GE,
          IN,
          INSTANCEOF,
          OR,
          AND,
          COALESCE,
          COMMA,
          HOOK,
          YIELD ->
          Rule.CHILDREN;
    };
  }

  private final InstrumentationOptions options;
  private final HookSelector selector = new HookSelector();
  private final Map<Node, NodeIdRange> functionRanges = new LinkedHashMap<>();

  private @Nullable SyntheticAstFactory factory;
  private @Nullable ClosureSynthesizer closures;
  private @Nullable Scope currentScope;
  private @Nullable Node currentNode;
  private int nextFunctionId;

  public EventRacerRewriter(InstrumentationOptions options) {
    this.options = checkNotNull(options);
  }

  @Override
  public void process(Node root) {
    checkArgument(root.isScript(), root);
    Scope globalScope = root.getScope();
    checkState(
        globalScope != null && globalScope.isGlobal(), "%s has no global scope", root);
    checkState(factory == null, "EventRacerRewriter instances are single-use");

    Integer firstNodeId = options.getFirstNodeId();
    NodeIdAllocator ids =
        firstNodeId != null ? new NodeIdAllocator(firstNodeId) : NodeIdAllocator.after(root);
    factory = new SyntheticAstFactory(ids, globalScope, options.getHookPrefix());
    closures = new ClosureSynthesizer(factory);
    nextFunctionId = options.getFirstFunctionId();
    currentScope = globalScope;
    currentNode = root;
    visitScript(root);
    currentNode = null;
  }

  @Override
  public @Nullable Node getCurrentNode() {
    return currentNode;
  }

  /** Returns the number of hook calls the rewrite emitted. */
  public int getHookCallCount() {
    return factory == null ? 0 : factory.getHookCallCount();
  }

  /** Returns the number of closures the rewrite synthesized. */
  public int getClosureCount() {
    return closures == null ? 0 : closures.getClosureCount();
  }

  /**
   * Returns the node-id range of every function of the rewritten tree, original or synthesized,
   * ordered by where the range starts. An enclosing range comes before the ranges it contains.
   */
  public ImmutableMap<Node, NodeIdRange> getNodeIdRanges() {
    List<Map.Entry<Node, NodeIdRange>> entries = new ArrayList<>(functionRanges.entrySet());
    if (closures != null) {
      entries.addAll(closures.getRanges().entrySet());
    }
    entries.sort(
        Comparator.comparingInt((Map.Entry<Node, NodeIdRange> e) -> e.getValue().start())
            .thenComparing(e -> -e.getValue().end()));
    return ImmutableMap.copyOf(entries);
  }

  // ==========================================================================
  // Compilation units

  private void visitScript(Node script) {
    assignFunctionId(script);
    NodeIdAllocator ids = factory.getIdAllocator();
    ids.enterScope();
    visitChildren(script);

    boolean logEntryExit = options.getInstrumentScriptEntryExit();
    addPrologue(script, script, null, logEntryExit);
    if (logEntryExit) {
      // A script cannot return, so its exit is logged by a trailing statement.
      script.addChildToBack(
          factory.createExprResult(createExitCall(factory.createUndefinedValue())));
    }
    recordRange(script, ids.exitScope());
  }

  private Node visitFunction(Node fn) {
    assignFunctionId(fn);
    Scope functionScope = fn.getScope();
    checkState(functionScope != null, "Function without scope: %s", fn);
    Scope savedScope = currentScope;
    currentScope = functionScope;
    NodeIdAllocator ids = factory.getIdAllocator();
    ids.enterScope();

    Node body = NodeUtil.getFunctionBody(fn);
    visitChildren(body);

    boolean logEntryExit = options.getInstrumentFunctionEntryExit();
    addPrologue(fn, body, NodeUtil.getFunctionName(fn), logEntryExit);
    if (logEntryExit) {
      Node last = body.getLastChild();
      if (last == null || !last.isReturn()) {
        // It is fine if this turns out to be dead code.
        body.addChildToBack(
            factory.createReturn(createExitCall(factory.createUndefinedValue())).srcref(fn));
      }
    }

    recordRange(fn, ids.exitScope());
    currentScope = savedScope;
    return fn;
  }

  private void assignFunctionId(Node unit) {
    if (!unit.hasFunctionId()) {
      unit.setFunctionId(nextFunctionId++);
    }
  }

  private void recordRange(Node unit, NodeIdRange range) {
    unit.putProp(Node.Prop.NODE_ID_RANGE, range);
    functionRanges.put(unit, range);
  }

  /**
   * Inserts the entry log and one {@code writeFunc} per function declared in {@code body} at the
   * start of {@code body}.
   *
   * <p>The declarations are those hoisted to the unit: statements of the body itself and, in sloppy
   * code, declarations nested in blocks. They are logged in source order, not reversed as repeated
   * insertion at the front would leave them.
   */
  private void addPrologue(Node unit, Node body, @Nullable String name, boolean logEntry) {
    List<Node> prologue = new ArrayList<>();
    if (logEntry) {
      Node nameArg = name != null ? factory.createString(name) : factory.createNull();
      Node call =
          factory.createHookCall(
              selector.select(AccessSite.enterFunction()),
              nameArg,
              factory.createNumber(options.getUnitId()),
              factory.createNumber(unit.getFunctionId()));
      prologue.add(factory.createExprResult(call.srcref(unit)).srcref(unit));
    }
    List<Node> declarations = new ArrayList<>();
    collectFunctionDeclarations(body, !isStrict(), declarations);
    for (Node declaration : declarations) {
      Node call =
          factory.createHookCall(
              selector.select(AccessSite.write(Target.NAMED_GLOBAL, isStrict(), true)),
              factory.createString(NodeUtil.getFunctionName(declaration)),
              factory.createNull(),
              factory.createNumber(declaration.getFunctionId()));
      prologue.add(factory.createExprResult(call.srcref(declaration)).srcref(declaration));
    }
    for (Node statement : Lists.reverse(prologue)) {
      body.addChildToFront(statement);
    }
  }

  /**
   * Adds the function declarations among the children of {@code n}, in source order. Nested
   * functions are not entered; they log their own declarations.
   */
  private static void collectFunctionDeclarations(
      Node n, boolean includeBlocks, List<Node> declarations) {
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      if (NodeUtil.isFunctionDeclaration(child)) {
        declarations.add(child);
      } else if (includeBlocks && !child.isFunction()) {
        collectFunctionDeclarations(child, true, declarations);
      }
    }
  }

  private Node createExitCall(Node value) {
    return factory.createHookCall(selector.select(AccessSite.exitFunction()), value);
  }

  // ==========================================================================
  // Dispatch

  /**
   * Rewrites {@code n} and returns the node that occupies its position afterwards, which is
   * {@code n} unless it was replaced.
   */
  private Node visit(Node n) {
    currentNode = n;
    return switch (ruleFor(n.getToken())) {
      case CHILDREN -> visitChildren(n);
      case NONE -> n;
      case SCOPED -> visitScoped(n);
      case WITH -> visitWith(n);
      case CATCH -> visitCatch(n);
      case FOR_IN_OR_OF -> visitForInOrOf(n);
      case FUNCTION -> visitFunction(n);
      case NAME -> visitName(n);
      case DECLARATION -> visitDeclaration(n);
      case PROPERTY_READ -> visitPropertyRead(n);
      case CALL -> visitCall(n);
      case CALL_RUNTIME -> visitCallRuntime(n);
      case DELETE -> visitDelete(n);
      case TYPEOF -> visitTypeof(n);
      case UPDATE -> visitUpdate(n);
      case ASSIGN -> visitAssign(n);
      case RETURN -> visitReturn(n);
    };
  }

  private Node visitChildren(Node n) {
    visitSiblings(n.getFirstChild());
    return n;
  }

  /** Rewrites {@code first} and every sibling after it. */
  private void visitSiblings(@Nullable Node first) {
    for (Node child = first; child != null; ) {
      // Capture the sibling first; visiting may replace the child.
      Node next = child.getNext();
      visit(child);
      child = next;
    }
  }

  private Node visitScoped(Node n) {
    Scope scope = n.getScope();
    if (scope == null) {
      return visitChildren(n);
    }
    Scope savedScope = currentScope;
    currentScope = scope;
    visitChildren(n);
    currentScope = savedScope;
    return n;
  }

  private Node visitWith(Node n) {
    // The object is evaluated before the with context is pushed.
    visit(n.getFirstChild());
    Scope savedScope = currentScope;
    if (n.getScope() != null) {
      currentScope = n.getScope();
    }
    visit(n.getLastChild());
    currentScope = savedScope;
    return n;
  }

  private Node visitCatch(Node n) {
    // The catch parameter is a declaration; only the body is rewritten.
    Scope savedScope = currentScope;
    if (n.getScope() != null) {
      currentScope = n.getScope();
    }
    visit(n.getSecondChild());
    currentScope = savedScope;
    return n;
  }

  private Node visitForInOrOf(Node n) {
    // The iteration target is assigned by the loop itself and is not instrumented.
    visitSiblings(n.getSecondChild());
    return n;
  }

  private Node visitReturn(Node n) {
    visitChildren(n);
    if (options.getInstrumentFunctionEntryExit()) {
      Node value = n.hasChildren() ? n.removeFirstChild() : factory.createUndefinedValue();
      n.addChildToBack(createExitCall(value).srcref(n));
    }
    return n;
  }

  // ==========================================================================
  // Variables

  private boolean isStrict() {
    return currentScope.isStrict();
  }

  /**
   * Whether a NAME refers to state that may be shared: a user variable that does not live in a
   * single activation. An unresolved name is looked up dynamically and so is shared.
   */
  private static boolean isPotentiallyShared(Node name) {
    if (name.getBooleanProp(Node.Prop.DO_NOT_INSTRUMENT)) {
      return false;
    }
    Var var = name.getVar();
    return var == null || var.isPotentiallyShared();
  }

  private static boolean isGlobalOrDynamic(Node name) {
    Var var = name.getVar();
    return var == null || var.isGlobalOrDynamic();
  }

  private Node visitName(Node n) {
    if (!isPotentiallyShared(n)) {
      return n;
    }
    Node placeholder = swapOut(n);
    return replace(placeholder, createVariableLog(n, n, Operation.READ), n);
  }

  /**
   * Logs a read or write of the variable {@code name} and returns {@code value}:
   *
   * <pre>
   *   global or dynamic:  ER_read("v", value)  or  ER_write("v", value)
   *   context slot:       ER_readProp(%GetContextN(depth), "v", value)  or  ER_writeProp(...)
   * </pre>
   *
   * A function literal written to a variable also passes its function id.
   */
  private Node createVariableLog(Node name, Node value, Operation operation) {
    checkArgument(operation == Operation.READ || operation == Operation.WRITE, operation);
    boolean storesFunction = operation == Operation.WRITE && value.isFunction();
    Node location;
    Target target;
    if (isGlobalOrDynamic(name)) {
      target = Target.NAMED_GLOBAL;
      location = null;
    } else {
      Var var = name.getVar();
      checkState(var.isContextSlot(), "Unexpected storage for shared %s", var);
      target = Target.CONTEXT_SLOT;
      location = factory.createContextLookup(currentScope.contextChainLength(var.getScope()));
    }

    AccessSite site =
        operation == Operation.READ
            ? AccessSite.read(target)
            : AccessSite.write(target, isStrict(), storesFunction);
    List<Node> args = new ArrayList<>(4);
    if (location != null) {
      args.add(location);
    }
    args.add(factory.createString(name.getString()).srcref(name));
    args.add(value);
    if (storesFunction) {
      args.add(createFunctionIdOf(value));
    }
    return createHookCall(selector.select(site), args).srcref(name);
  }

  private Node createFunctionIdOf(Node fn) {
    checkState(fn.hasFunctionId(), "Function literal without id: %s", fn);
    return factory.createNumber(fn.getFunctionId());
  }

  private Node createHookCall(InstrumentationHook hook, List<Node> args) {
    return factory.createHookCall(hook, args.toArray(new Node[0]));
  }

  private Node visitDeclaration(Node n) {
    for (Node name = n.getFirstChild(); name != null; name = name.getNext()) {
      Node initializer = name.getFirstChild();
      if (initializer == null) {
        continue;
      }
      initializer = visit(initializer);
      if (isPotentiallyShared(name)) {
        // Initializing a shared variable is a write.
        Node placeholder = swapOut(initializer);
        replace(placeholder, createVariableLog(name, initializer, Operation.WRITE), initializer);
      }
    }
    return n;
  }

  private Node visitCallRuntime(Node n) {
    visitChildren(n);
    if (!n.getString().equals(INITIALIZE_VAR_GLOBAL)) {
      return n;
    }
    // Global variable initialization is a write that is not represented as an assignment:
    //   %InitializeVarGlobal("v", strict, value)
    //   => %InitializeVarGlobal("v", strict, ER_write("v", value))
    checkState(n.getChildCount() == 3, "Malformed %s", n);
    Node nameArg = n.getFirstChild();
    checkState(nameArg.isString(), "Malformed %s", n);
    Node value = n.getLastChild();
    Node placeholder = swapOut(value);
    boolean storesFunction = value.isFunction();
    InstrumentationHook hook =
        selector.select(AccessSite.write(Target.NAMED_GLOBAL, isStrict(), storesFunction));
    List<Node> args = new ArrayList<>(3);
    args.add(factory.createCopyOfKey(nameArg));
    args.add(value);
    if (storesFunction) {
      args.add(createFunctionIdOf(value));
    }
    replace(placeholder, createHookCall(hook, args), value);
    return n;
  }

  private Node visitTypeof(Node n) {
    Node operand = n.getFirstChild();
    if (operand.isName() && isPotentiallyShared(operand)) {
      // typeof of an unresolvable name is "undefined" rather than an error, so the name is logged
      // around the typeof instead of being read on its own:
      //   typeof v  =>  ER_read("v", typeof v)
      Node placeholder = swapOut(n);
      return replace(placeholder, createVariableLog(operand, n, Operation.READ), n);
    }
    return visitChildren(n);
  }

  // ==========================================================================
  // Properties

  /** Rewrites the object and key of a GETPROP or GETELEM, but not the access itself. */
  private void visitObjectAndKey(Node get) {
    checkArgument(NodeUtil.isNormalGet(get), get);
    visit(get.getFirstChild());
    visit(get.getSecondChild());
  }

  private Node visitPropertyRead(Node n) {
    visitObjectAndKey(n);
    boolean literalKey = NodeUtil.hasLiteralKey(n);
    Node placeholder = swapOut(n);
    Node obj = n.removeFirstChild();
    Node key = n.removeFirstChild();

    if (!literalKey) {
      //   arr[idx]  =>  ER_readPropIdx(arr, idx)
      InstrumentationHook hook = selector.select(AccessSite.read(Target.COMPUTED_PROPERTY));
      return replace(placeholder, factory.createHookCall(hook, obj, key), n);
    }

    //   obj.key
    //   => (function($obj) { return ER_readProp($obj, "key", $obj.key); })(obj)
    Closure closure = closures.begin(currentScope, n);
    Var objParam = closure.declareParameter(ClosureSynthesizer.OBJ);
    Node read =
        factory.createHookCall(
            selector.select(AccessSite.read(Target.PROPERTY)),
            closure.ref(objParam),
            factory.createCopyOfKey(key),
            factory.createGet(closure.ref(objParam), factory.createCopyOfKey(key)));
    Node fn = closure.finish(ImmutableList.of(factory.createReturn(read)));
    return replace(placeholder, factory.createFreeCall(fn, obj), n);
  }

  private Node visitCall(Node n) {
    Node callee = n.getFirstChild();
    if (NodeUtil.isNormalGet(callee)) {
      return visitPropertyCall(n);
    }
    // A direct eval becomes an indirect one if its callee is rewritten, which changes the scope
    // the code runs in.
    if (!NodeUtil.isPossiblyDirectEval(n)) {
      callee = visit(callee);
    }
    visitSiblings(callee.getNext());
    return n;
  }

  /**
   * Rewrites a method call so the receiver, key and arguments are each evaluated once, in order,
   * before the property read is logged and the method is called with the right receiver:
   *
   * <pre>
   *   o[k](e0, ..., en)
   *   => (function($obj, $key, $a0, ..., $an) {
   *        ER_readProp($obj, $key, $obj[$key]);
   *        return $obj[$key]($a0, ..., $an);
   *      })(o, k, e0, ..., en)
   * </pre>
   *
   * A literal key is copied into the closure instead of being passed as {@code $key}.
   */
  private Node visitPropertyCall(Node n) {
    Node callee = n.getFirstChild();
    visitObjectAndKey(callee);
    visitSiblings(callee.getNext());

    boolean literalKey = NodeUtil.hasLiteralKey(callee);
    Node placeholder = swapOut(n);
    callee = n.removeFirstChild();
    Node obj = callee.removeFirstChild();
    Node key = callee.removeFirstChild();
    List<Node> args = new ArrayList<>();
    while (n.hasChildren()) {
      args.add(n.removeFirstChild());
    }

    Closure closure = closures.begin(currentScope, callee);
    Var objParam = closure.declareParameter(ClosureSynthesizer.OBJ);
    Var keyParam = literalKey ? null : closure.declareParameter(ClosureSynthesizer.KEY);
    List<Var> argParams = new ArrayList<>(args.size());
    for (int i = 0; i < args.size(); i++) {
      argParams.add(closure.declareParameter(ClosureSynthesizer.argumentName(i)));
    }

    Node read =
        factory.createHookCall(
            selector.select(AccessSite.read(Target.PROPERTY)),
            closure.ref(objParam),
            keyRef(closure, key, keyParam),
            factory.createGet(closure.ref(objParam), keyRef(closure, key, keyParam)));
    List<Node> forwarded = new ArrayList<>(argParams.size());
    for (Var argParam : argParams) {
      forwarded.add(closure.ref(argParam));
    }
    Node call =
        factory.createMethodCall(
            factory.createGet(closure.ref(objParam), keyRef(closure, key, keyParam)), forwarded);
    Node fn =
        closure.finish(
            ImmutableList.of(factory.createExprResult(read), factory.createReturn(call)));

    List<Node> outerArgs = new ArrayList<>(args.size() + 2);
    outerArgs.add(obj);
    if (!literalKey) {
      outerArgs.add(key);
    }
    outerArgs.addAll(args);
    return replace(placeholder, factory.createFreeCall(fn, outerArgs.toArray(new Node[0])), n);
  }

  /** Returns a copy of a literal key, or a reference to the closure's {@code $key} parameter. */
  private Node keyRef(Closure closure, Node key, @Nullable Var keyParam) {
    return keyParam == null ? factory.createCopyOfKey(key) : closure.ref(keyParam);
  }

  private Node visitDelete(Node n) {
    Node target = n.getFirstChild();
    if (NodeUtil.isNormalGet(target)) {
      return visitPropertyDelete(n);
    }
    if (target.isName() && isPotentiallyShared(target) && isGlobalOrDynamic(target)) {
      //   delete v
      //   => (function() { ER_delete("v"); return delete v; })()
      Node placeholder = swapOut(n);
      Closure closure = closures.begin(currentScope, n);
      Node log =
          factory.createHookCall(
              selector.select(AccessSite.delete(Target.NAMED_GLOBAL, isStrict())),
              factory.createString(target.getString()).srcref(target));
      Node fn =
          closure.finish(
              ImmutableList.of(factory.createExprResult(log), factory.createReturn(n)));
      return replace(placeholder, factory.createFreeCall(fn), n);
    }
    // Deleting a context or stack variable only yields false; it is not logged.
    return visitChildren(n);
  }

  private Node visitPropertyDelete(Node n) {
    Node get = n.getFirstChild();
    visitObjectAndKey(get);
    boolean literalKey = NodeUtil.hasLiteralKey(get);
    Node placeholder = swapOut(n);
    Node obj = get.removeFirstChild();
    Node key = get.removeFirstChild();

    if (!literalKey) {
      //   delete obj[key]  =>  ER_deletePropIdx(obj, key)
      InstrumentationHook hook =
          selector.select(AccessSite.delete(Target.COMPUTED_PROPERTY, isStrict()));
      return replace(placeholder, factory.createHookCall(hook, obj, key), n);
    }

    //   delete obj.key
    //   => (function($obj) { ER_deleteProp($obj, "key"); return delete $obj.key; })(obj)
    Closure closure = closures.begin(currentScope, n);
    Var objParam = closure.declareParameter(ClosureSynthesizer.OBJ);
    Node log =
        factory.createHookCall(
            selector.select(AccessSite.delete(Target.PROPERTY, isStrict())),
            closure.ref(objParam),
            factory.createCopyOfKey(key));
    Node delete =
        factory.createDelProp(
            factory.createGet(closure.ref(objParam), factory.createCopyOfKey(key)));
    Node fn =
        closure.finish(
            ImmutableList.of(factory.createExprResult(log), factory.createReturn(delete)));
    return replace(placeholder, factory.createFreeCall(fn, obj), n);
  }

  // ==========================================================================
  // Writes

  private static Operation updateOperation(Node n) {
    if (n.isInc()) {
      return n.isPostfix() ? Operation.POST_INC : Operation.PRE_INC;
    }
    return n.isPostfix() ? Operation.POST_DEC : Operation.PRE_DEC;
  }

  /** Builds {@code oldValue + 1} or {@code oldValue - 1}. */
  private Node createUpdatedValue(Node n, Node oldValue) {
    return factory.createBinaryOp(
        n.isInc() ? Token.ADD : Token.SUB, oldValue, factory.createNumber(1));
  }

  private Node visitUpdate(Node n) {
    Node target = n.getFirstChild();
    if (target.isName()) {
      return visitNameUpdate(n);
    }
    checkState(
        NodeUtil.isNormalGet(target), "Unexpected %s target: %s", n.getToken(), target);
    visitObjectAndKey(target);

    boolean literalKey = NodeUtil.hasLiteralKey(target);
    Node placeholder = swapOut(n);
    Node get = n.removeFirstChild();
    Node obj = get.removeFirstChild();
    Node key = get.removeFirstChild();

    if (!literalKey) {
      //   obj[key]++  =>  ER_postIncProp(obj, key)
      InstrumentationHook hook =
          selector.select(
              AccessSite.update(updateOperation(n), Target.COMPUTED_PROPERTY, isStrict()));
      return replace(placeholder, factory.createHookCall(hook, obj, key), n);
    }

    InstrumentationHook writeProp =
        selector.select(AccessSite.write(Target.PROPERTY, isStrict(), false));
    Closure closure = closures.begin(currentScope, get);
    Var objParam = closure.declareParameter(ClosureSynthesizer.OBJ);
    List<Node> body = new ArrayList<>(3);
    if (!n.isPostfix()) {
      //   ++obj.key
      //   => (function($obj) {
      //        return $obj.key = ER_writeProp($obj, "key", +$obj.key + 1);
      //      })(obj)
      Node newValue =
          createUpdatedValue(
              n,
              factory.createToNumber(
                  factory.createGet(closure.ref(objParam), factory.createCopyOfKey(key))));
      Node write =
          factory.createHookCall(
              writeProp, closure.ref(objParam), factory.createCopyOfKey(key), newValue);
      body.add(
          factory.createReturn(
              factory.createAssign(
                  factory.createGet(closure.ref(objParam), factory.createCopyOfKey(key)), write)));
    } else {
      //   obj.key++
      //   => (function($obj) {
      //        let $value = +$obj.key;
      //        $obj.key = ER_writeProp($obj, "key", $value + 1);
      //        return $value;
      //      })(obj)
      Var oldValue = closure.declareLocal(ClosureSynthesizer.VALUE);
      body.add(
          factory.createSingleLetDeclaration(
              oldValue,
              factory.createToNumber(
                  factory.createGet(closure.ref(objParam), factory.createCopyOfKey(key)))));
      Node write =
          factory.createHookCall(
              writeProp,
              closure.ref(objParam),
              factory.createCopyOfKey(key),
              createUpdatedValue(n, closure.ref(oldValue)));
      body.add(
          factory.createExprResult(
              factory.createAssign(
                  factory.createGet(closure.ref(objParam), factory.createCopyOfKey(key)), write)));
      body.add(factory.createReturn(closure.ref(oldValue)));
    }
    Node fn = closure.finish(body);
    return replace(placeholder, factory.createFreeCall(fn, obj), n);
  }

  private Node visitNameUpdate(Node n) {
    Node target = n.getFirstChild();
    if (!isPotentiallyShared(target)) {
      return n;
    }
    Node placeholder = swapOut(n);
    target = n.removeFirstChild();

    if (!n.isPostfix()) {
      //   ++v  =>  v = ER_write("v", +v + 1)
      Node newValue =
          createUpdatedValue(n, factory.createToNumber(factory.createNameLike(target)));
      Node assign =
          factory.createAssign(target, createVariableLog(target, newValue, Operation.WRITE));
      return replace(placeholder, assign, n);
    }

    //   v++
    //   => (function() { let $value = +v; v = ER_write("v", $value + 1); return $value; })()
    Closure closure = closures.begin(currentScope, target);
    Var oldValue = closure.declareLocal(ClosureSynthesizer.VALUE);
    Node init =
        factory.createSingleLetDeclaration(
            oldValue, factory.createToNumber(factory.createNameLike(target)));
    Node write =
        factory.createAssign(
            target,
            createVariableLog(
                target, createUpdatedValue(n, closure.ref(oldValue)), Operation.WRITE));
    Node fn =
        closure.finish(
            ImmutableList.of(
                init,
                factory.createExprResult(write),
                factory.createReturn(closure.ref(oldValue))));
    return replace(placeholder, factory.createFreeCall(fn), n);
  }

  private Node visitAssign(Node n) {
    Node target = n.getFirstChild();
    checkState(
        target.isName() || NodeUtil.isNormalGet(target),
        "Unexpected assignment target: %s",
        target);
    // The target is never rewritten as a read; only its object and key are, ahead of the value.
    if (!target.isName()) {
      visitObjectAndKey(target);
    }
    visit(n.getSecondChild());
    Token binaryOp = NodeUtil.getOpFromAssignmentOp(n.getToken());
    boolean compound = binaryOp != null;

    if (target.isName()) {
      if (!isPotentiallyShared(target)) {
        return n;
      }
      //   v = e   =>  v = ER_write("v", e)
      //   v += e  =>  v = ER_write("v", v + e)
      Node placeholder = swapOut(n);
      target = n.removeFirstChild();
      Node value = n.removeFirstChild();
      Node newValue =
          compound
              ? factory.createBinaryOp(binaryOp, factory.createNameLike(target), value)
              : value;
      Node assign =
          factory.createAssign(target, createVariableLog(target, newValue, Operation.WRITE));
      return replace(placeholder, assign, n);
    }

    boolean literalKey = NodeUtil.hasLiteralKey(target);
    Node placeholder = swapOut(n);
    Node get = n.removeFirstChild();
    Node value = n.removeFirstChild();
    Node obj = get.removeFirstChild();
    Node key = get.removeFirstChild();
    boolean storesFunction = !compound && value.isFunction();

    if (literalKey) {
      //   obj.key = e
      //   => (function($obj, $value) {
      //        return $obj.key = ER_writeProp($obj, "key", $value);
      //      })(obj, e)
      //   obj.key += e
      //   => (function($obj, $value) {
      //        return $obj.key = ER_writeProp($obj, "key", $obj.key + $value);
      //      })(obj, e)
      Closure closure = closures.begin(currentScope, get);
      Var objParam = closure.declareParameter(ClosureSynthesizer.OBJ);
      Var valueParam = closure.declareParameter(ClosureSynthesizer.VALUE);
      AccessSite site =
          compound
              ? AccessSite.compoundWrite(Target.PROPERTY, isStrict())
              : AccessSite.write(Target.PROPERTY, isStrict(), storesFunction);
      List<Node> args = new ArrayList<>(4);
      args.add(closure.ref(objParam));
      args.add(factory.createCopyOfKey(key));
      if (compound) {
        args.add(
            factory.createBinaryOp(
                binaryOp,
                factory.createGet(closure.ref(objParam), factory.createCopyOfKey(key)),
                closure.ref(valueParam)));
      } else {
        args.add(closure.ref(valueParam));
      }
      if (storesFunction) {
        args.add(createFunctionIdOf(value));
      }
      Node write = createHookCall(selector.select(site), args);
      Node fn =
          closure.finish(
              ImmutableList.of(
                  factory.createReturn(
                      factory.createAssign(
                          factory.createGet(closure.ref(objParam), factory.createCopyOfKey(key)),
                          write))));
      return replace(placeholder, factory.createFreeCall(fn, obj, value), n);
    }

    if (compound) {
      //   arr[idx] += e
      //   => (function($obj, $key, $value) {
      //        return $obj[$key] = ER_writeProp($obj, $key, $obj[$key] + $value);
      //      })(arr, idx, e)
      Closure closure = closures.begin(currentScope, get);
      Var objParam = closure.declareParameter(ClosureSynthesizer.OBJ);
      Var keyParam = closure.declareParameter(ClosureSynthesizer.KEY);
      Var valueParam = closure.declareParameter(ClosureSynthesizer.VALUE);
      Node newValue =
          factory.createBinaryOp(
              binaryOp,
              factory.createGet(closure.ref(objParam), closure.ref(keyParam)),
              closure.ref(valueParam));
      Node write =
          factory.createHookCall(
              selector.select(AccessSite.compoundWrite(Target.COMPUTED_PROPERTY, isStrict())),
              closure.ref(objParam),
              closure.ref(keyParam),
              newValue);
      Node fn =
          closure.finish(
              ImmutableList.of(
                  factory.createReturn(
                      factory.createAssign(
                          factory.createGet(closure.ref(objParam), closure.ref(keyParam)),
                          write))));
      return replace(placeholder, factory.createFreeCall(fn, obj, key, value), n);
    }

    //   arr[idx] = e  =>  ER_writePropIdx(arr, idx, e)
    List<Node> args = new ArrayList<>(4);
    args.add(obj);
    args.add(key);
    args.add(value);
    if (storesFunction) {
      args.add(createFunctionIdOf(value));
    }
    InstrumentationHook hook =
        selector.select(AccessSite.write(Target.COMPUTED_PROPERTY, isStrict(), storesFunction));
    return replace(placeholder, createHookCall(hook, args), n);
  }

  // ==========================================================================
  // Tree surgery

  /**
   * Replaces {@code n} with a placeholder so it can be taken apart while the replacement is built.
   */
  private static Node swapOut(Node n) {
    Node placeholder = IR.empty();
    n.replaceWith(placeholder);
    return placeholder;
  }

  /**
   * Puts {@code replacement} where the placeholder is, giving it the source position of {@code
   * original}.
   */
  private Node replace(Node placeholder, Node replacement, Node original) {
    replacement.srcrefIfMissing(original);
    placeholder.replaceWith(replacement);
    currentNode = replacement;
    return replacement;
  }
}
