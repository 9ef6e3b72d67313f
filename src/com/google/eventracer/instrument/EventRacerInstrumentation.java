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

import com.google.common.collect.ImmutableMap;
import com.google.eventracer.ast.Node;
import com.google.eventracer.instrument.InstrumentationOptions.InvalidOptionsException;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Runs the race-detection instrumentation over one compilation unit: the {@link
 * EventRacerRewriter} followed, if enabled, by the {@link SlotCounter}.
 *
 * <p>A failure inside a pass is an internal error. It is rethrown as a {@code RuntimeException}
 * naming the pass and the node being processed, and the compilation is expected to abort.
 */
public final class EventRacerInstrumentation {

  private static final Logger logger = Logger.getLogger(EventRacerInstrumentation.class.getName());

  static final String REWRITER_PASS = "eventRacerRewriter";
  static final String SLOT_COUNTER_PASS = "slotCounter";

  private final InstrumentationOptions options;

  public EventRacerInstrumentation(InstrumentationOptions options) {
    this.options = checkNotNull(options);
  }

  /**
   * Instruments the resolved tree rooted at {@code root} in place.
   *
   * @throws InvalidOptionsException if the options are inconsistent
   */
  public InstrumentationResult process(Node root) {
    checkArgument(root.isScript(), "Expected a SCRIPT, got %s", root);
    try {
      options.validate();
    } catch (InvalidOptionsException e) {
      logger.warning("Invalid instrumentation options: " + e.getMessage());
      throw e;
    }

    EventRacerRewriter rewriter = new EventRacerRewriter(options);
    runPass(REWRITER_PASS, rewriter, root);

    ImmutableMap<Node, FunctionCounts> counts = ImmutableMap.of();
    if (options.getCountSlots()) {
      SlotCounter counter = new SlotCounter();
      runPass(SLOT_COUNTER_PASS, counter, root);
      counts = counter.getFunctionCounts();
    }

    InstrumentationResult result =
        InstrumentationResult.create(
            root,
            counts,
            rewriter.getNodeIdRanges(),
            rewriter.getHookCallCount(),
            rewriter.getClosureCount());
    logger.fine(
        "Emitted "
            + result.hookCallCount()
            + " hook calls, synthesized "
            + result.closureCount()
            + " closures, counted "
            + result.functionCounts().size()
            + " functions");
    return result;
  }

  private static void runPass(String name, CompilerPass pass, Node root) {
    logger.fine("Running pass " + name);
    try {
      pass.process(root);
    } catch (Error | Exception e) {
      throw internalError(name, pass.getCurrentNode(), e);
    }
  }

  private static RuntimeException internalError(
      String passName, @Nullable Node current, Throwable cause) {
    String message =
        passName
            + ": "
            + cause.getMessage()
            + "\n"
            + formatNodeContext("Node", current)
            + (current == null ? "" : "\n" + formatNodeContext("Parent", current.getParent()));
    return new RuntimeException(
        "INTERNAL COMPILER ERROR.\nPlease report this problem.\n\n" + message, cause);
  }

  private static String formatNodeContext(String label, @Nullable Node n) {
    if (n == null) {
      return "  " + label + ": NULL";
    }
    return "  " + label + "(" + n.toString(false, false) + "): " + formatNodePosition(n);
  }

  private static String formatNodePosition(Node n) {
    int position = n.getSourcePosition();
    return position == Node.NO_POSITION ? "unknown position" : "@" + position;
  }
}
