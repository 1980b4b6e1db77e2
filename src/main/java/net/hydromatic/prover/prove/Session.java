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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.prover.explore.Explorer;
import net.hydromatic.prover.lemma.LemmaSet;
import net.hydromatic.prover.lemma.Simplifier;
import net.hydromatic.prover.rule.Rewriter;
import net.hydromatic.prover.rule.RuleDatabase;
import net.hydromatic.prover.solver.Oracle;
import net.hydromatic.prover.solver.Oracles;
import net.hydromatic.prover.term.Bag;
import net.hydromatic.prover.util.Tracer;
import net.hydromatic.prover.util.Tracers;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Proof session.
 *
 * <p>A session combines a rule database with the selection of modules
 * that are active: their step rules drive execution, and their lemmas form
 * the one lemma set in force. Selecting modules is the only way to enable
 * optional facts, so the lemmas a proof relied on can be audited from the
 * session.
 */
public class Session {
  public final RuleDatabase database;
  /** Names of the active modules. */
  public final ImmutableList<String> moduleNames;
  /** Property values. */
  public final Map<Prop, Object> props;

  private Tracer tracer = Tracers.nullTracer();
  private @Nullable Oracle oracle;

  /** Creates a Session.
   *
   * <p>The {@code props} parameter, that becomes the property map, is used
   * as is, not copied.
   *
   * @param database    Rule database
   * @param moduleNames Names of active modules
   * @param props       Map that contains property values */
  public Session(
      RuleDatabase database,
      List<String> moduleNames,
      Map<Prop, Object> props) {
    this.database = requireNonNull(database);
    this.moduleNames = ImmutableList.copyOf(moduleNames);
    this.props = requireNonNull(props);
    moduleNames.forEach(database::module);
  }

  /** Creates a Session with default properties. */
  public static Session create(RuleDatabase database, String... moduleNames) {
    return new Session(database, ImmutableList.copyOf(moduleNames),
        new LinkedHashMap<>());
  }

  /** Sets a property. */
  @CanIgnoreReturnValue
  public Session set(Prop prop, Object value) {
    prop.setLenient(props, value);
    return this;
  }

  /** Sets the tracer. */
  @CanIgnoreReturnValue
  public Session withTracer(Tracer tracer) {
    this.tracer = requireNonNull(tracer);
    return this;
  }

  /** Sets the oracle; if not set, the session creates one according to
   * {@link Prop#SOLVER}. */
  @CanIgnoreReturnValue
  public Session withOracle(Oracle oracle) {
    this.oracle = requireNonNull(oracle);
    return this;
  }

  /** Returns the lemmas in force. */
  public LemmaSet lemmas() {
    return LemmaSet.of(database, moduleNames);
  }

  /** Creates an oracle for one proof attempt. */
  public Oracle oracle() {
    Oracle o = oracle;
    if (o == null) {
      final int timeout = Prop.SOLVER_TIMEOUT_MILLIS.intValue(props);
      switch (Prop.SOLVER.enumValue(props, Prop.Solver.class)) {
        case Z3:
          o = Oracles.z3(timeout);
          break;
        default:
          o = Oracles.linear(timeout);
      }
    }
    final int cacheSize = Prop.CACHE_SIZE.intValue(props);
    return cacheSize > 0 ? Oracles.cache(o, cacheSize) : o;
  }

  /** Creates a prover. Each prover has its own oracle cache. */
  public Prover prover() {
    final Oracle oracle = oracle();
    final Simplifier simplifier = simplifier(oracle);
    return new Prover(database, rewriter(simplifier, oracle), simplifier,
        oracle, options(), Prop.PARALLELISM.intValue(props), tracer);
  }

  /** Proves a claim. */
  public Verdict prove(Claim claim) {
    return prover().prove(claim);
  }

  /** Proves claims together. */
  public ImmutableMap<String, Verdict> proveAll(List<Claim> claims) {
    return prover().proveAll(claims);
  }

  /** Runs a concrete configuration to completion. */
  public Bag run(Bag configuration) {
    final Oracle oracle = oracle();
    final Simplifier simplifier = simplifier(oracle);
    final Explorer explorer =
        new Explorer(rewriter(simplifier, oracle),
            MoreExecutors.newDirectExecutorService(), options(), tracer);
    return explorer.run(configuration);
  }

  private Simplifier simplifier(Oracle oracle) {
    return new Simplifier(lemmas(), oracle,
        Prop.MAX_SIMPLIFY_PASSES.intValue(props));
  }

  private Rewriter rewriter(Simplifier simplifier, Oracle oracle) {
    return new Rewriter(database, moduleNames, simplifier, oracle,
        Prop.CONTROL_CELL.stringValue(props), tracer);
  }

  private Explorer.Options options() {
    return new Explorer.Options(Prop.CONTROL_CELL.stringValue(props),
        Prop.SEARCH_ORDER.enumValue(props, Explorer.SearchOrder.class),
        Prop.PARALLELISM.intValue(props),
        Prop.MAX_STEPS.intValue(props),
        Prop.MAX_BRANCHES.intValue(props),
        Prop.MAX_DEPTH.intValue(props),
        Prop.EXHAUSTIVE.booleanValue(props));
  }
}

// End Session.java
