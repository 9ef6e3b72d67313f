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

import com.google.common.base.Ascii;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the root of the intermediate representation.
 *
 * <p>Children are kept in a doubly linked sibling list: {@code first.previous} is the last child,
 * while {@code last.next} is null. A node owns its children exclusively; a node can only be added
 * to a new parent once it has been detached from the old one.
 */
public class Node {

  /** Sentinel for "no source position" and "no node id". */
  public static final int NO_POSITION = -1;

  public enum Prop {
    // Whether incrdecr is pre (false) or post (true)
    INCRDECR,
    // The presence of the "use strict" directive on this node.
    USE_STRICT,
    // ES5 distinguishes between direct and indirect calls to eval.
    DIRECT_EVAL,
    // A CALL without an explicit "this" value.
    FREE_CALL,
    // Set if a yield is a "yield all"
    YIELD_ALL,
    // References inserted by the instrumentation; never instrumented again.
    DO_NOT_INSTRUMENT,
    // A FUNCTION created by the instrumentation to pin down evaluation order.
    SYNTHETIC,
    // The Scope rooted at this node, attached by the resolver.
    SCOPE,
    // The Var a NAME node is bound to, attached by the resolver.
    VAR,
    // Identifier of a FUNCTION or SCRIPT unit, as an Integer.
    FUNCTION_ID,
    // Index of a materialized literal within its function, as an Integer.
    LITERAL_INDEX,
    // First feedback slot allocated to this node, as an Integer.
    FEEDBACK_SLOT,
    // Range of node ids handed out inside a function during a rewrite.
    NODE_ID_RANGE,
    // Per-function literal, feedback slot and node totals.
    FUNCTION_COUNTS
  }

  // Avoid cloning "values" repeatedly in hot code, we save it off now.
  private static final Prop[] PROP_VALUES = Prop.values();

  private static final class NumberNode extends Node {
    private double number;

    NumberNode(double number) {
      super(Token.NUMBER);
      this.number = number;
    }

    @Override
    boolean isEquivalentToShallow(Node node) {
      return super.isEquivalentToShallow(node)
          && Double.compare(number, ((NumberNode) node).number) == 0;
    }
  }

  private static final class StringNode extends Node {
    private String str;

    StringNode(Token token, String str) {
      super(token);
      this.str = checkNotNull(str);
    }

    @Override
    boolean isEquivalentToShallow(Node node) {
      return super.isEquivalentToShallow(node) && str.equals(((StringNode) node).str);
    }
  }

  private abstract static class PropListItem {
    final @Nullable PropListItem next;
    final byte propType;

    PropListItem(byte propType, @Nullable PropListItem next) {
      this.propType = propType;
      this.next = next;
    }

    public abstract int getIntValue();

    public abstract Object getObjectValue();

    public abstract PropListItem chain(@Nullable PropListItem next);
  }

  // A base class for Object storing props
  private static final class ObjectPropListItem extends PropListItem {
    private final Object objectValue;

    ObjectPropListItem(byte propType, Object objectValue, @Nullable PropListItem next) {
      super(propType, next);
      this.objectValue = checkNotNull(objectValue);
    }

    @Override
    public int getIntValue() {
      throw new UnsupportedOperationException();
    }

    @Override
    public Object getObjectValue() {
      return objectValue;
    }

    @Override
    public String toString() {
      return String.valueOf(objectValue);
    }

    @Override
    public PropListItem chain(@Nullable PropListItem next) {
      return new ObjectPropListItem(propType, objectValue, next);
    }
  }

  // A base class for int storing props
  private static final class IntPropListItem extends PropListItem {
    final int intValue;

    IntPropListItem(byte propType, int intValue, @Nullable PropListItem next) {
      super(propType, next);
      this.intValue = intValue;
      checkState(this.intValue != 0);
    }

    @Override
    public int getIntValue() {
      return intValue;
    }

    @Override
    public Object getObjectValue() {
      throw new UnsupportedOperationException();
    }

    @Override
    public String toString() {
      return String.valueOf(intValue);
    }

    @Override
    public PropListItem chain(@Nullable PropListItem next) {
      return new IntPropListItem(propType, intValue, next);
    }
  }

  public Node(Token token) {
    this.token = token;
  }

  public Node(Token token, Node child) {
    this(token);
    addChildToBack(child);
  }

  public Node(Token token, Node left, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(right);
  }

  public Node(Token token, Node left, Node mid, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(mid);
    addChildToBack(right);
  }

  public static Node newNumber(double number) {
    return new NumberNode(number);
  }

  public static Node newString(String str) {
    return new StringNode(Token.STRINGLIT, str);
  }

  public static Node newString(Token token, String str) {
    return new StringNode(token, str);
  }

  public final Token getToken() {
    return token;
  }

  public final boolean hasChildren() {
    return first != null;
  }

  public final Node getOnlyChild() {
    checkState(hasOneChild(), this);
    return first;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first.next;
  }

  public final @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getPrevious() {
    return this == parent.first ? null : previous;
  }

  /**
   * Gets the ith child, note that this is O(N) where N is the number of children.
   *
   * @param i The index
   * @return The ith child
   */
  public final Node getChildAtIndex(int i) {
    Node n = first;
    while (i > 0) {
      n = n.next;
      i--;
    }
    return n;
  }

  public final void addChildToFront(Node child) {
    child.checkDetached();
    child.parent = this;
    child.next = first;
    if (first == null) {
      // NOTE: child.next remains null
      child.previous = child;
    } else {
      Node last = first.previous;
      // NOTE: last.next remains null
      child.previous = last;
      first.previous = child;
    }
    first = child;
  }

  public final void addChildToBack(Node child) {
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    checkArgument(child.next == null);
    checkArgument(child.previous == null);

    if (first == null) {
      // NOTE: child.next remains null
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      // NOTE: child.next remains null
      child.previous = last;
      first.previous = child;
    }

    child.parent = this;
  }

  /** Swaps `replacement` and its subtree into the position of `this`. */
  public final void replaceWith(Node replacement) {
    this.checkAttached();
    replacement.checkDetached();

    final Node existingParent = this.parent;
    final Node existingNext = this.next;
    final Node existingPrevious = this.previous;

    // The sequence below also has to work when `this` is an only child, which can cause many of the
    // variables to point to the same object.

    this.parent = null;
    replacement.parent = existingParent;

    this.previous = null;
    if (existingPrevious == this) {
      // `this` was an only child.
      replacement.previous = replacement;
      existingParent.first = replacement;
    } else {
      replacement.previous = existingPrevious;
      if (existingPrevious.next == null) {
        existingParent.first = replacement;
        // existingPrevious.next remains null
      } else {
        // existingParent.first is unchanged;
        existingPrevious.next = replacement;
      }
    }

    if (existingNext == null) {
      // this.next remains null;
      existingParent.first.previous = replacement;
      // replacement.next remains null
    } else {
      this.next = null;
      existingNext.previous = replacement;
      replacement.next = existingNext;
    }
  }

  /** Removes this node from its parent, but retains its subtree. */
  @CanIgnoreReturnValue
  public final Node detach() {
    this.checkAttached();

    final Node existingParent = this.parent;
    final Node existingNext = this.next;
    final Node existingPrevious = this.previous;

    // The sequence below also has to work when `this` is an only child or has a single sibling,
    // which can cause many of the variables to point to the same object.

    this.parent = null;

    if (existingNext == null) {
      // this.next remains null;
      existingParent.first.previous = existingPrevious;
    } else {
      this.next = null;
      existingNext.previous = existingPrevious;
    }

    this.previous = null;
    if (existingPrevious.next == null) {
      existingParent.first = existingNext;
      // existingPrevious.next remains null
    } else {
      // existingParent.first is unchanged;
      existingPrevious.next = existingNext;
    }

    return this;
  }

  private void checkAttached() {
    checkState(this.parent != null, "Has no parent: %s", this);
  }

  private void checkDetached() {
    checkState(this.parent == null, "Has parent: %s", this);
    checkState(this.next == null, "Has next: %s", this);
    checkState(this.previous == null, "Has previous: %s", this);
  }

  /**
   * Removes the first child of Node. Equivalent to: node.getFirstChild().detach();
   *
   * @return The removed Node.
   */
  public final @Nullable Node removeFirstChild() {
    Node child = first;
    if (child != null) {
      child.detach();
    }
    return child;
  }

  // ==========================================================================
  // Properties

  private @Nullable PropListItem lookupProperty(Prop prop) {
    byte propType = (byte) prop.ordinal();
    PropListItem x = propListHead;
    while (x != null && propType != x.propType) {
      x = x.next;
    }
    return x;
  }

  /**
   * @param item The item to inspect
   * @param prop The property to look for
   * @return The replacement list if the property was removed, or 'item' otherwise.
   */
  private static @Nullable PropListItem rebuildListWithoutProp(
      @Nullable PropListItem item, Prop prop) {
    if (item == null) {
      return null;
    } else if (item.propType == prop.ordinal()) {
      return item.next;
    } else {
      PropListItem result = rebuildListWithoutProp(item.next, prop);
      return (result == item.next) ? item : item.chain(result);
    }
  }

  public final @Nullable Object getProp(Prop propType) {
    PropListItem item = lookupProperty(propType);
    if (item == null) {
      return null;
    }
    return item.getObjectValue();
  }

  public final boolean getBooleanProp(Prop propType) {
    return getIntProp(propType) != 0;
  }

  /** Returns the integer value for the property, or 0 if the property is not defined. */
  private int getIntProp(Prop propType) {
    PropListItem item = lookupProperty(propType);
    if (item == null) {
      return 0;
    }
    return item.getIntValue();
  }

  public final void putProp(Prop prop, @Nullable Object value) {
    this.propListHead = rebuildListWithoutProp(this.propListHead, prop);
    if (value != null) {
      this.propListHead = new ObjectPropListItem((byte) prop.ordinal(), value, this.propListHead);
    }
  }

  public final void putBooleanProp(Prop propType, boolean value) {
    putIntProp(propType, value ? 1 : 0);
  }

  private void putIntProp(Prop prop, int value) {
    this.propListHead = rebuildListWithoutProp(this.propListHead, prop);
    if (value != 0) {
      this.propListHead = new IntPropListItem((byte) prop.ordinal(), value, this.propListHead);
    }
  }

  /** Returns an Integer-valued property, or {@code defaultValue} when it is absent. */
  private int getIntegerObjectProp(Prop prop, int defaultValue) {
    Object value = getProp(prop);
    return value == null ? defaultValue : (Integer) value;
  }

  public final double getDouble() {
    return ((NumberNode) this).number;
  }

  public final String getString() {
    return ((StringNode) this).str;
  }

  // ==========================================================================
  // Resolver and pass annotations

  public final @Nullable Scope getScope() {
    return (Scope) getProp(Prop.SCOPE);
  }

  public final void setScope(@Nullable Scope scope) {
    putProp(Prop.SCOPE, scope);
  }

  public final @Nullable Var getVar() {
    return (Var) getProp(Prop.VAR);
  }

  public final void setVar(@Nullable Var var) {
    checkState(isName(), this);
    putProp(Prop.VAR, var);
  }

  public final int getNodeId() {
    return nodeId;
  }

  public final void setNodeId(int nodeId) {
    checkArgument(nodeId >= 0 || nodeId == NO_POSITION, nodeId);
    this.nodeId = nodeId;
  }

  /** Returns the function id of a FUNCTION or SCRIPT node, or -1 if none has been assigned. */
  public final int getFunctionId() {
    return getIntegerObjectProp(Prop.FUNCTION_ID, -1);
  }

  public final void setFunctionId(int functionId) {
    checkState(isFunction() || isScript(), this);
    putProp(Prop.FUNCTION_ID, functionId);
  }

  public final boolean hasFunctionId() {
    return getProp(Prop.FUNCTION_ID) != null;
  }

  /** Returns the literal index of a materialized literal, or -1 if none has been assigned. */
  public final int getLiteralIndex() {
    return getIntegerObjectProp(Prop.LITERAL_INDEX, -1);
  }

  public final void setLiteralIndex(int index) {
    checkArgument(index >= 0, index);
    putProp(Prop.LITERAL_INDEX, index);
  }

  /** Returns the first feedback slot of this node, or -1 if it has none. */
  public final int getFirstFeedbackSlot() {
    return getIntegerObjectProp(Prop.FEEDBACK_SLOT, -1);
  }

  public final void setFirstFeedbackSlot(int slot) {
    checkArgument(slot >= 0, slot);
    putProp(Prop.FEEDBACK_SLOT, slot);
  }

  public final void setUseStrict(boolean x) {
    putBooleanProp(Prop.USE_STRICT, x);
  }

  public final boolean isUseStrict() {
    return getBooleanProp(Prop.USE_STRICT);
  }

  public final void setYieldAll(boolean yieldAll) {
    checkState(isYield(), this);
    putBooleanProp(Prop.YIELD_ALL, yieldAll);
  }

  public final boolean isYieldAll() {
    return getBooleanProp(Prop.YIELD_ALL);
  }

  /** Marks an INC or DEC node as postfix ({@code x++}) rather than prefix ({@code ++x}). */
  public final void setPostfix(boolean postfix) {
    checkState(isInc() || isDec(), this);
    putBooleanProp(Prop.INCRDECR, postfix);
  }

  public final boolean isPostfix() {
    return getBooleanProp(Prop.INCRDECR);
  }

  public final boolean isSynthetic() {
    return getBooleanProp(Prop.SYNTHETIC);
  }

  // ==========================================================================
  // Source position management

  /** Returns the source offset of this node, or {@link #NO_POSITION}. */
  public final int getSourcePosition() {
    return sourcePosition;
  }

  @CanIgnoreReturnValue
  public final Node setSourcePosition(int position) {
    checkArgument(position >= 0 || position == NO_POSITION, position);
    this.sourcePosition = position;
    return this;
  }

  /** Copies the source position of {@code other} onto this node. */
  @CanIgnoreReturnValue
  public final Node srcref(Node other) {
    this.sourcePosition = other.sourcePosition;
    return this;
  }

  /** Copies the source position of {@code other} onto this node, unless it already has one. */
  @CanIgnoreReturnValue
  public final Node srcrefIfMissing(Node other) {
    if (this.sourcePosition == NO_POSITION) {
      this.sourcePosition = other.sourcePosition;
    }
    return this;
  }

  // ==========================================================================
  // Tree shape

  public final @Nullable Node getParent() {
    return parent;
  }

  public final boolean hasOneChild() {
    return first != null && first.next == null;
  }

  public final boolean hasTwoChildren() {
    return first != null && first.next != null && first.next == getLastChild();
  }

  public final int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  // ==========================================================================
  // Equivalence and cloning

  /** Returns true if this node is equivalent semantically to another including its children. */
  public final boolean isEquivalentTo(Node node) {
    if (!isEquivalentToShallow(node)) {
      return false;
    }
    Node n = first;
    Node n2 = node.first;
    while (n != null) {
      if (n2 == null || !n.isEquivalentTo(n2)) {
        return false;
      }
      n = n.next;
      n2 = n2.next;
    }
    return n2 == null;
  }

  boolean isEquivalentToShallow(Node node) {
    return node != null
        && token == node.token
        && getClass() == node.getClass()
        && isPostfix() == node.isPostfix()
        && getChildCount() == node.getChildCount();
  }

  /** Returns a detached copy of this node with no children. The node id is not copied. */
  public final Node cloneNode() {
    Node result;
    if (this instanceof NumberNode) {
      result = newNumber(getDouble());
    } else if (this instanceof StringNode) {
      result = newString(token, getString());
    } else {
      result = new Node(token);
    }
    result.propListHead = this.propListHead;
    result.sourcePosition = this.sourcePosition;
    return result;
  }

  /** Returns a detached deep copy of this subtree. Node ids are not copied. */
  public final Node cloneTree() {
    Node result = cloneNode();
    for (Node n2 = first; n2 != null; n2 = n2.next) {
      result.addChildToBack(n2.cloneTree());
    }
    return result;
  }

  // ==========================================================================
  // Printing

  @Override
  public final String toString() {
    return toString(true, true);
  }

  public final String toString(boolean printSource, boolean printAnnotations) {
    StringBuilder sb = new StringBuilder();
    toString(sb, printSource, printAnnotations);
    return sb.toString();
  }

  private void toString(StringBuilder sb, boolean printSource, boolean printAnnotations) {
    sb.append(token);
    if (this instanceof StringNode) {
      sb.append(' ');
      sb.append(getString());
    } else if (token == Token.FUNCTION) {
      sb.append(' ');
      if (first == null || first.token != Token.NAME) {
        sb.append("<invalid>");
      } else {
        sb.append(first.getString());
      }
    } else if (token == Token.NUMBER) {
      sb.append(' ');
      sb.append(getDouble());
    }
    if (printSource && sourcePosition != NO_POSITION) {
      sb.append(" @");
      sb.append(sourcePosition);
    }
    if (printAnnotations) {
      if (nodeId != NO_POSITION) {
        sb.append(" [id: ");
        sb.append(nodeId);
        sb.append(']');
      }
      for (Prop type : PROP_VALUES) {
        PropListItem x = lookupProperty(type);
        if (x == null || type == Prop.SCOPE || type == Prop.VAR) {
          continue;
        }
        sb.append(" [");
        sb.append(Ascii.toLowerCase(String.valueOf(type)));
        sb.append(": ");
        sb.append(x);
        sb.append(']');
      }
    }
  }

  @CheckReturnValue
  public final String toStringTree() {
    StringBuilder s = new StringBuilder();
    toStringTreeHelper(this, 0, s);
    return s.toString();
  }

  private static void toStringTreeHelper(Node n, int level, StringBuilder sb) {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    sb.append(n);
    sb.append('\n');
    for (Node cursor = n.first; cursor != null; cursor = cursor.next) {
      toStringTreeHelper(cursor, level + 1, sb);
    }
  }

  // ==========================================================================
  // Fields

  private final Token token; // Type of the token of the node; NAME for example
  private @Nullable Node next; // next sibling, a linked list
  private @Nullable Node previous; // previous sibling, a circular linked list
  private @Nullable Node first; // first element of a linked list of children
  private @Nullable Node parent;
  // We get the last child as first.previous. But last.next is null, not first.

  /** Character offset of the source text this node was produced from. */
  private int sourcePosition = NO_POSITION;

  /** Id of this node within the compilation unit, or NO_POSITION before one is allocated. */
  private int nodeId = NO_POSITION;

  /**
   * Linked list of properties. Since vast majority of nodes would have no more than 2 properties,
   * linked list saves memory and provides fast lookup.
   */
  private @Nullable PropListItem propListHead;

  // ==========================================================================
  // Token predicates

  public final boolean isArrayLit() {
    return this.token == Token.ARRAYLIT;
  }

  public final boolean isAssign() {
    return this.token == Token.ASSIGN;
  }

  public final boolean isBlock() {
    return this.token == Token.BLOCK;
  }

  public final boolean isCall() {
    return this.token == Token.CALL;
  }

  public final boolean isCallRuntime() {
    return this.token == Token.CALL_RUNTIME;
  }

  public final boolean isConst() {
    return this.token == Token.CONST;
  }

  public final boolean isDec() {
    return this.token == Token.DEC;
  }

  public final boolean isEmpty() {
    return this.token == Token.EMPTY;
  }

  public final boolean isForIn() {
    return this.token == Token.FOR_IN;
  }

  public final boolean isFunction() {
    return this.token == Token.FUNCTION;
  }

  public final boolean isGetElem() {
    return this.token == Token.GETELEM;
  }

  public final boolean isGetProp() {
    return this.token == Token.GETPROP;
  }

  public final boolean isInc() {
    return this.token == Token.INC;
  }

  public final boolean isLet() {
    return this.token == Token.LET;
  }

  public final boolean isName() {
    return this.token == Token.NAME;
  }

  public final boolean isNew() {
    return this.token == Token.NEW;
  }

  public final boolean isNull() {
    return this.token == Token.NULL;
  }

  public final boolean isNumber() {
    return this.token == Token.NUMBER;
  }

  public final boolean isObjectLit() {
    return this.token == Token.OBJECTLIT;
  }

  public final boolean isParamList() {
    return this.token == Token.PARAM_LIST;
  }

  public final boolean isRegExp() {
    return this.token == Token.REGEXP;
  }

  public final boolean isReturn() {
    return this.token == Token.RETURN;
  }

  public final boolean isScript() {
    return this.token == Token.SCRIPT;
  }

  public final boolean isString() {
    return this.token == Token.STRINGLIT;
  }

  public final boolean isStringKey() {
    return this.token == Token.STRING_KEY;
  }

  public final boolean isVar() {
    return this.token == Token.VAR;
  }

  public final boolean isYield() {
    return this.token == Token.YIELD;
  }

  @Override
  public final boolean equals(Object o) {
    return this == o;
  }

  @Override
  public final int hashCode() {
    return Objects.hashCode(System.identityHashCode(this));
  }
}
