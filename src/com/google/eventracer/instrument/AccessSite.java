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
 * Describes one access the rewriter wants to log: what is done, to what kind of location, and in
 * which mode. {@link HookSelector} maps a site to exactly one {@link InstrumentationHook}.
 */
@AutoValue
public abstract class AccessSite {

  /** The operation performed at the site. */
  public enum Operation {
    READ,
    WRITE,
    DELETE,
    PRE_INC,
    PRE_DEC,
    POST_INC,
    POST_DEC,
    ENTER_FUNCTION,
    EXIT_FUNCTION
  }

  /** The kind of location accessed. */
  public enum Target {
    /** A variable living on the global object or looked up by name. */
    NAMED_GLOBAL,
    /** A variable allocated in a function context. */
    CONTEXT_SLOT,
    /** A property whose key is available to the hook as a literal or a closure parameter. */
    PROPERTY,
    /** A property whose key is an arbitrary expression evaluated as a hook argument. */
    COMPUTED_PROPERTY,
    /** No location; used for function entry and exit. */
    NONE
  }

  public abstract Operation operation();

  public abstract Target target();

  public abstract boolean strict();

  /** Whether a write combines the old value with an operand, as in {@code x += e}. */
  public abstract boolean compound();

  /** Whether a simple write stores a function literal. */
  public abstract boolean functionValue();

  public static AccessSite read(Target target) {
    return create(Operation.READ, target, false, false, false);
  }

  public static AccessSite write(Target target, boolean strict, boolean functionValue) {
    return create(Operation.WRITE, target, strict, false, functionValue);
  }

  public static AccessSite compoundWrite(Target target, boolean strict) {
    return create(Operation.WRITE, target, strict, true, false);
  }

  public static AccessSite delete(Target target, boolean strict) {
    return create(Operation.DELETE, target, strict, false, false);
  }

  public static AccessSite update(Operation operation, Target target, boolean strict) {
    checkArgument(
        operation == Operation.PRE_INC
            || operation == Operation.PRE_DEC
            || operation == Operation.POST_INC
            || operation == Operation.POST_DEC,
        operation);
    return create(operation, target, strict, false, false);
  }

  public static AccessSite enterFunction() {
    return create(Operation.ENTER_FUNCTION, Target.NONE, false, false, false);
  }

  public static AccessSite exitFunction() {
    return create(Operation.EXIT_FUNCTION, Target.NONE, false, false, false);
  }

  static AccessSite create(
      Operation operation,
      Target target,
      boolean strict,
      boolean compound,
      boolean functionValue) {
    checkArgument(!(compound && functionValue), "A compound write never stores a function");
    checkArgument(
        (target == Target.NONE)
            == (operation == Operation.ENTER_FUNCTION || operation == Operation.EXIT_FUNCTION),
        "%s cannot access %s",
        operation,
        target);
    return new AutoValue_AccessSite(operation, target, strict, compound, functionValue);
  }
}
