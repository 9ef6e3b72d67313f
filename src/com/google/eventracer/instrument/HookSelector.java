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

import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;

/**
 * Chooses the logging function for an access site. The choice is a pure function of the site:
 * plain or property target, literal or computed key, strict or sloppy mode, simple or compound
 * write, and whether a function literal is stored.
 */
public final class HookSelector {

  private static final ImmutableList<InstrumentationHook> CATALOG =
      ImmutableList.copyOf(InstrumentationHook.values());

  public InstrumentationHook select(AccessSite site) {
    ImmutableList<InstrumentationHook> matches =
        CATALOG.stream().filter(hook -> hook.isSelectedFor(site)).collect(toImmutableList());
    checkState(!matches.isEmpty(), "No instrumentation hook for %s", site);
    checkState(matches.size() == 1, "Ambiguous instrumentation hooks %s for %s", matches, site);
    return matches.get(0);
  }
}
