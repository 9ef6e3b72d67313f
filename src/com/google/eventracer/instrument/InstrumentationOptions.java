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

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.errorprone.annotations.FormatMethod;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/** Instrumentation options */
public class InstrumentationOptions implements Serializable {

  private static final long serialVersionUID = 1L;

  public static final String DEFAULT_HOOK_PREFIX = "ER_";

  /** Unit id logged when the embedding compiler does not supply one. */
  public static final int NO_UNIT_ID = -1;

  private static final CharMatcher IDENTIFIER_START =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.anyOf("_$"))
          .precomputed();

  private static final CharMatcher IDENTIFIER_PART =
      IDENTIFIER_START.or(CharMatcher.inRange('0', '9')).precomputed();

  /** Prefix of the identifiers of the logging functions, e.g. {@code ER_} in {@code ER_read}. */
  private String hookPrefix = DEFAULT_HOOK_PREFIX;

  /** Id of the script the tree was parsed from, passed to every enterFunction call. */
  private int unitId = NO_UNIT_ID;

  /** First id handed to a function that the resolver did not number. */
  private int firstFunctionId = 0;

  /** First id for synthesized nodes; when null, one past the largest id in the input tree. */
  private @Nullable Integer firstNodeId = null;

  private boolean instrumentFunctionEntryExit = true;

  private boolean instrumentScriptEntryExit = true;

  /** Recompute literal indices and feedback slots after rewriting. */
  private boolean countSlots = true;

  public InstrumentationOptions() {}

  public String getHookPrefix() {
    return hookPrefix;
  }

  public void setHookPrefix(String hookPrefix) {
    this.hookPrefix = checkNotNull(hookPrefix);
  }

  public int getUnitId() {
    return unitId;
  }

  public void setUnitId(int unitId) {
    this.unitId = unitId;
  }

  public int getFirstFunctionId() {
    return firstFunctionId;
  }

  public void setFirstFunctionId(int firstFunctionId) {
    this.firstFunctionId = firstFunctionId;
  }

  public @Nullable Integer getFirstNodeId() {
    return firstNodeId;
  }

  public void setFirstNodeId(@Nullable Integer firstNodeId) {
    this.firstNodeId = firstNodeId;
  }

  public boolean getInstrumentFunctionEntryExit() {
    return instrumentFunctionEntryExit;
  }

  public void setInstrumentFunctionEntryExit(boolean instrumentFunctionEntryExit) {
    this.instrumentFunctionEntryExit = instrumentFunctionEntryExit;
  }

  public boolean getInstrumentScriptEntryExit() {
    return instrumentScriptEntryExit;
  }

  public void setInstrumentScriptEntryExit(boolean instrumentScriptEntryExit) {
    this.instrumentScriptEntryExit = instrumentScriptEntryExit;
  }

  public boolean getCountSlots() {
    return countSlots;
  }

  public void setCountSlots(boolean countSlots) {
    this.countSlots = countSlots;
  }

  /**
   * Checks that the options are usable together.
   *
   * @throws InvalidOptionsException if they are not
   */
  public void validate() {
    if (hookPrefix.isEmpty()) {
      throw new InvalidOptionsException("The hook prefix must not be empty.");
    }
    if (!IDENTIFIER_START.matches(hookPrefix.charAt(0))
        || !IDENTIFIER_PART.matchesAllOf(hookPrefix)) {
      throw new InvalidOptionsException(
          "The hook prefix \"%s\" does not start a valid identifier.", hookPrefix);
    }
    if (unitId < NO_UNIT_ID) {
      throw new InvalidOptionsException("Invalid unit id %s.", unitId);
    }
    if (firstFunctionId < 0) {
      throw new InvalidOptionsException("The first function id must not be negative.");
    }
    if (firstNodeId != null && firstNodeId < 0) {
      throw new InvalidOptionsException("The first node id must not be negative.");
    }
  }

  /** Exception to indicate incompatible options in the InstrumentationOptions. */
  public static class InvalidOptionsException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    @FormatMethod
    InvalidOptionsException(String message, Object... args) {
      super(Strings.lenientFormat(message, args));
    }
  }
}
