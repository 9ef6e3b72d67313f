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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import com.google.eventracer.instrument.AccessSite.Operation;
import com.google.eventracer.instrument.AccessSite.Target;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * The catalog of logging functions the rewritten code calls. Each entry knows the name the runtime
 * exports it under (after the configured prefix), how many arguments it takes, and the access
 * sites it is chosen for.
 */
public enum InstrumentationHook {
  // (name, value)
  READ("read", 2, s -> is(s, Operation.READ, Target.NAMED_GLOBAL)),
  // (context or object, key, value)
  READ_PROP("readProp", 3, s -> s.operation() == Operation.READ && isNamedKey(s)),
  // (obj, key), performs the read
  READ_PROP_IDX("readPropIdx", 2, s -> is(s, Operation.READ, Target.COMPUTED_PROPERTY)),

  // (name, value)
  WRITE("write", 2, s -> is(s, Operation.WRITE, Target.NAMED_GLOBAL) && !s.functionValue()),
  // (name, value or null, functionId)
  WRITE_FUNC("writeFunc", 3, s -> is(s, Operation.WRITE, Target.NAMED_GLOBAL) && s.functionValue()),
  // (context or object, key, value)
  WRITE_PROP(
      "writeProp",
      3,
      s ->
          s.operation() == Operation.WRITE
              && !s.functionValue()
              && (isNamedKey(s) || (s.target() == Target.COMPUTED_PROPERTY && s.compound()))),
  // (context or object, key, value, functionId)
  WRITE_PROP_FUNC(
      "writePropFunc",
      4,
      s -> s.operation() == Operation.WRITE && s.functionValue() && isNamedKey(s)),
  // (obj, key, value), performs the write
  WRITE_PROP_IDX("writePropIdx", 3, s -> isIndexedWrite(s, false, false)),
  WRITE_PROP_IDX_STRICT("writePropIdxStrict", 3, s -> isIndexedWrite(s, true, false)),
  // (obj, key, value, functionId), performs the write
  WRITE_PROP_IDX_FUNC("writePropIdxFunc", 4, s -> isIndexedWrite(s, false, true)),
  WRITE_PROP_IDX_FUNC_STRICT("writePropIdxFuncStrict", 4, s -> isIndexedWrite(s, true, true)),

  // (name)
  DELETE("delete", 1, s -> is(s, Operation.DELETE, Target.NAMED_GLOBAL)),
  // (obj, key)
  DELETE_PROP("deleteProp", 2, s -> is(s, Operation.DELETE, Target.PROPERTY)),
  // (obj, key), performs the delete
  DELETE_PROP_IDX(
      "deletePropIdx", 2, s -> is(s, Operation.DELETE, Target.COMPUTED_PROPERTY) && !s.strict()),
  DELETE_PROP_IDX_STRICT(
      "deletePropIdxStrict",
      2,
      s -> is(s, Operation.DELETE, Target.COMPUTED_PROPERTY) && s.strict()),

  // (obj, key), each performs the update and returns the value of the expression
  PRE_INC_PROP("preIncProp", 2, s -> isIndexedUpdate(s, Operation.PRE_INC, false)),
  PRE_INC_PROP_STRICT("preIncPropStrict", 2, s -> isIndexedUpdate(s, Operation.PRE_INC, true)),
  PRE_DEC_PROP("preDecProp", 2, s -> isIndexedUpdate(s, Operation.PRE_DEC, false)),
  PRE_DEC_PROP_STRICT("preDecPropStrict", 2, s -> isIndexedUpdate(s, Operation.PRE_DEC, true)),
  POST_INC_PROP("postIncProp", 2, s -> isIndexedUpdate(s, Operation.POST_INC, false)),
  POST_INC_PROP_STRICT("postIncPropStrict", 2, s -> isIndexedUpdate(s, Operation.POST_INC, true)),
  POST_DEC_PROP("postDecProp", 2, s -> isIndexedUpdate(s, Operation.POST_DEC, false)),
  POST_DEC_PROP_STRICT("postDecPropStrict", 2, s -> isIndexedUpdate(s, Operation.POST_DEC, true)),

  // (name or null, unitId, functionId)
  ENTER_FUNCTION("enterFunction", 3, s -> s.operation() == Operation.ENTER_FUNCTION),
  // (return value)
  EXIT_FUNCTION("exitFunction", 1, s -> s.operation() == Operation.EXIT_FUNCTION);

  private static final ImmutableMap<String, InstrumentationHook> BY_NAME;

  static {
    ImmutableMap.Builder<String, InstrumentationHook> builder = ImmutableMap.builder();
    for (InstrumentationHook hook : values()) {
      builder.put(hook.name, hook);
    }
    BY_NAME = builder.buildOrThrow();
  }

  private final String name;
  private final int arity;
  private final Predicate<AccessSite> selector;

  InstrumentationHook(String name, int arity, Predicate<AccessSite> selector) {
    this.name = name;
    this.arity = arity;
    this.selector = selector;
  }

  /** Returns the unprefixed name of the hook, for example {@code readProp}. */
  public String getName() {
    return name;
  }

  /** Returns the identifier emitted in the rewritten code, for example {@code ER_readProp}. */
  public String getIdentifier(String prefix) {
    return prefix + name;
  }

  public int getArity() {
    return arity;
  }

  boolean isSelectedFor(AccessSite site) {
    return selector.test(site);
  }

  /** Returns the hook emitted as {@code identifier} under {@code prefix}, or null if none is. */
  public static @Nullable InstrumentationHook forIdentifier(String prefix, String identifier) {
    checkNotNull(prefix);
    if (!identifier.startsWith(prefix)) {
      return null;
    }
    return BY_NAME.get(identifier.substring(prefix.length()));
  }

  private static boolean is(AccessSite site, Operation operation, Target target) {
    return site.operation() == operation && site.target() == target;
  }

  private static boolean isNamedKey(AccessSite site) {
    return site.target() == Target.CONTEXT_SLOT || site.target() == Target.PROPERTY;
  }

  private static boolean isIndexedWrite(AccessSite site, boolean strict, boolean functionValue) {
    return is(site, Operation.WRITE, Target.COMPUTED_PROPERTY)
        && !site.compound()
        && site.strict() == strict
        && site.functionValue() == functionValue;
  }

  private static boolean isIndexedUpdate(AccessSite site, Operation operation, boolean strict) {
    return is(site, operation, Target.COMPUTED_PROPERTY) && site.strict() == strict;
  }
}
