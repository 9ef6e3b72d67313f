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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.eventracer.instrument.AccessSite.Operation;
import com.google.eventracer.instrument.AccessSite.Target;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class HookSelectorTest {

  private final HookSelector selector = new HookSelector();

  private InstrumentationHook select(AccessSite site) {
    return selector.select(site);
  }

  @Test
  public void testReads() {
    assertThat(select(AccessSite.read(Target.NAMED_GLOBAL))).isEqualTo(InstrumentationHook.READ);
    assertThat(select(AccessSite.read(Target.CONTEXT_SLOT)))
        .isEqualTo(InstrumentationHook.READ_PROP);
    assertThat(select(AccessSite.read(Target.PROPERTY))).isEqualTo(InstrumentationHook.READ_PROP);
    assertThat(select(AccessSite.read(Target.COMPUTED_PROPERTY)))
        .isEqualTo(InstrumentationHook.READ_PROP_IDX);
  }

  @Test
  public void testNamedWrites() {
    assertThat(select(AccessSite.write(Target.NAMED_GLOBAL, false, false)))
        .isEqualTo(InstrumentationHook.WRITE);
    assertThat(select(AccessSite.write(Target.NAMED_GLOBAL, true, true)))
        .isEqualTo(InstrumentationHook.WRITE_FUNC);
    assertThat(select(AccessSite.compoundWrite(Target.NAMED_GLOBAL, true)))
        .isEqualTo(InstrumentationHook.WRITE);
    assertThat(select(AccessSite.write(Target.CONTEXT_SLOT, false, false)))
        .isEqualTo(InstrumentationHook.WRITE_PROP);
    assertThat(select(AccessSite.write(Target.CONTEXT_SLOT, false, true)))
        .isEqualTo(InstrumentationHook.WRITE_PROP_FUNC);
    assertThat(select(AccessSite.write(Target.PROPERTY, true, false)))
        .isEqualTo(InstrumentationHook.WRITE_PROP);
    assertThat(select(AccessSite.write(Target.PROPERTY, false, true)))
        .isEqualTo(InstrumentationHook.WRITE_PROP_FUNC);
  }

  @Test
  public void testIndexedWritesDependOnModeAndValue() {
    assertThat(select(AccessSite.write(Target.COMPUTED_PROPERTY, false, false)))
        .isEqualTo(InstrumentationHook.WRITE_PROP_IDX);
    assertThat(select(AccessSite.write(Target.COMPUTED_PROPERTY, true, false)))
        .isEqualTo(InstrumentationHook.WRITE_PROP_IDX_STRICT);
    assertThat(select(AccessSite.write(Target.COMPUTED_PROPERTY, false, true)))
        .isEqualTo(InstrumentationHook.WRITE_PROP_IDX_FUNC);
    assertThat(select(AccessSite.write(Target.COMPUTED_PROPERTY, true, true)))
        .isEqualTo(InstrumentationHook.WRITE_PROP_IDX_FUNC_STRICT);
  }

  @Test
  public void testCompoundIndexedWriteIsLoggedAfterTheFact() {
    assertThat(select(AccessSite.compoundWrite(Target.COMPUTED_PROPERTY, false)))
        .isEqualTo(InstrumentationHook.WRITE_PROP);
    assertThat(select(AccessSite.compoundWrite(Target.COMPUTED_PROPERTY, true)))
        .isEqualTo(InstrumentationHook.WRITE_PROP);
  }

  @Test
  public void testDeletes() {
    assertThat(select(AccessSite.delete(Target.NAMED_GLOBAL, false)))
        .isEqualTo(InstrumentationHook.DELETE);
    assertThat(select(AccessSite.delete(Target.PROPERTY, true)))
        .isEqualTo(InstrumentationHook.DELETE_PROP);
    assertThat(select(AccessSite.delete(Target.COMPUTED_PROPERTY, false)))
        .isEqualTo(InstrumentationHook.DELETE_PROP_IDX);
    assertThat(select(AccessSite.delete(Target.COMPUTED_PROPERTY, true)))
        .isEqualTo(InstrumentationHook.DELETE_PROP_IDX_STRICT);
  }

  @Test
  public void testUpdates() {
    assertThat(select(AccessSite.update(Operation.PRE_INC, Target.COMPUTED_PROPERTY, false)))
        .isEqualTo(InstrumentationHook.PRE_INC_PROP);
    assertThat(select(AccessSite.update(Operation.PRE_DEC, Target.COMPUTED_PROPERTY, true)))
        .isEqualTo(InstrumentationHook.PRE_DEC_PROP_STRICT);
    assertThat(select(AccessSite.update(Operation.POST_INC, Target.COMPUTED_PROPERTY, true)))
        .isEqualTo(InstrumentationHook.POST_INC_PROP_STRICT);
    assertThat(select(AccessSite.update(Operation.POST_DEC, Target.COMPUTED_PROPERTY, false)))
        .isEqualTo(InstrumentationHook.POST_DEC_PROP);
  }

  @Test
  public void testFunctionEntryAndExit() {
    assertThat(select(AccessSite.enterFunction())).isEqualTo(InstrumentationHook.ENTER_FUNCTION);
    assertThat(select(AccessSite.exitFunction())).isEqualTo(InstrumentationHook.EXIT_FUNCTION);
  }

  @Test
  public void testUnsupportedSiteFails() {
    // Only computed updates are logged; other updates are expanded into a read and a write.
    assertThrows(
        IllegalStateException.class,
        () -> select(AccessSite.update(Operation.POST_INC, Target.PROPERTY, false)));
  }

  @Test
  public void testCompoundFunctionWriteIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> AccessSite.create(Operation.WRITE, Target.PROPERTY, false, true, true));
  }

  /** Every site the rewriter can produce maps to exactly one hook, and every hook is used. */
  @Test
  public void testSelectionIsTotalOverRewriterSites() {
    List<AccessSite> sites = new ArrayList<>();
    for (Target target : EnumSet.complementOf(EnumSet.of(Target.NONE))) {
      sites.add(AccessSite.read(target));
      for (boolean strict : new boolean[] {false, true}) {
        sites.add(AccessSite.write(target, strict, false));
        sites.add(AccessSite.write(target, strict, true));
        sites.add(AccessSite.compoundWrite(target, strict));
        if (target != Target.CONTEXT_SLOT) {
          sites.add(AccessSite.delete(target, strict));
        }
      }
    }
    for (boolean strict : new boolean[] {false, true}) {
      for (Operation op :
          EnumSet.of(
              Operation.PRE_INC, Operation.PRE_DEC, Operation.POST_INC, Operation.POST_DEC)) {
        sites.add(AccessSite.update(op, Target.COMPUTED_PROPERTY, strict));
      }
    }
    sites.add(AccessSite.enterFunction());
    sites.add(AccessSite.exitFunction());

    Set<InstrumentationHook> used = EnumSet.noneOf(InstrumentationHook.class);
    for (AccessSite site : sites) {
      used.add(select(site));
    }
    assertThat(used).containsExactlyElementsIn(EnumSet.allOf(InstrumentationHook.class));
  }

  @Test
  public void testHookIdentifiers() {
    assertThat(InstrumentationHook.READ_PROP.getIdentifier("ER_")).isEqualTo("ER_readProp");
    assertThat(InstrumentationHook.forIdentifier("ER_", "ER_writePropIdxFuncStrict"))
        .isEqualTo(InstrumentationHook.WRITE_PROP_IDX_FUNC_STRICT);
    assertThat(InstrumentationHook.forIdentifier("ER_", "readProp")).isNull();
    assertThat(InstrumentationHook.forIdentifier("ER_", "ER_unknown")).isNull();
  }

  @Test
  public void testArity() {
    assertThat(InstrumentationHook.DELETE.getArity()).isEqualTo(1);
    assertThat(InstrumentationHook.READ.getArity()).isEqualTo(2);
    assertThat(InstrumentationHook.ENTER_FUNCTION.getArity()).isEqualTo(3);
    assertThat(InstrumentationHook.WRITE_PROP_IDX_FUNC.getArity()).isEqualTo(4);
  }
}
