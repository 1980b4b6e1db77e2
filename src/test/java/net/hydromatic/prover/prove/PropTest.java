/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.prover.prove;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import net.hydromatic.prover.explore.Explorer;
import net.hydromatic.prover.util.ProverException;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test void testLookup() {
    assertThat(Prop.lookup("maxSteps"), sameInstance(Prop.MAX_STEPS));
    assertThat(Prop.lookup("MAX_STEPS"), sameInstance(Prop.MAX_STEPS));
    final ProverException e =
        assertThrows(ProverException.class, () -> Prop.lookup("maxFoo"));
    assertThat(e.getMessage(), is("property maxFoo not found"));
  }

  @Test void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.MAX_STEPS.intValue(map), is(10_000));
    assertThat(Prop.MAX_BRANCHES.intValue(map), is(1_000));
    assertThat(Prop.PARALLELISM.intValue(map), is(1));
    assertThat(Prop.EXHAUSTIVE.booleanValue(map), is(false));
    assertThat(Prop.CONTROL_CELL.stringValue(map), is("k"));
    assertThat(Prop.SOLVER.enumValue(map, Prop.Solver.class),
        is(Prop.Solver.LINEAR));
    assertThat(
        Prop.SEARCH_ORDER.enumValue(map, Explorer.SearchOrder.class),
        is(Explorer.SearchOrder.BREADTH_FIRST));
  }

  @Test void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.MAX_DEPTH.set(map, 7);
    assertThat(Prop.MAX_DEPTH.intValue(map), is(7));
    Prop.SEARCH_ORDER.setLenient(map, "depth_first");
    assertThat(Prop.SEARCH_ORDER.get(map),
        is(Explorer.SearchOrder.DEPTH_FIRST));
    Prop.SOLVER.setLenient(map, "z3");
    assertThat(Prop.SOLVER.get(map), is(Prop.Solver.Z3));

    final ProverException e =
        assertThrows(ProverException.class, () ->
            Prop.SEARCH_ORDER.setLenient(map, "sideways"));
    assertThat(e.getMessage(),
        is("value must be one of: 'BREADTH_FIRST', 'DEPTH_FIRST'"));
    final ProverException e2 =
        assertThrows(ProverException.class, () ->
            Prop.MAX_STEPS.set(map, "many"));
    assertThat(e2.getMessage(),
        is("value for property maxSteps must have type Integer"));
    final ProverException e3 =
        assertThrows(ProverException.class, () ->
            Prop.MAX_STEPS.set(map, null));
    assertThat(e3.getMessage(), is("property is required"));
    assertThrows(IllegalArgumentException.class, () ->
        Prop.MAX_STEPS.booleanValue(map));
  }
}

// End PropTest.java
