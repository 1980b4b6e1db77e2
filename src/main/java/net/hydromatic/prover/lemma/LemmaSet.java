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
package net.hydromatic.prover.lemma;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import net.hydromatic.prover.rule.Rule;
import net.hydromatic.prover.rule.RuleDatabase;
import net.hydromatic.prover.term.Apply;

/**
 * The set of lemmas in force for one proof attempt.
 *
 * <p>Lemmas are trusted: the engine does not check them against the
 * semantics, and an unsound lemma can make an invalid claim appear proved.
 * Activating a module is the only way to bring its lemmas into force, so the
 * set of trusted facts behind every verdict is explicit.
 */
public final class LemmaSet {
  public static final LemmaSet EMPTY =
      new LemmaSet(ImmutableSet.of(), ImmutableList.of());

  /** Names of the modules the lemmas came from. */
  public final ImmutableSet<String> moduleNames;
  public final ImmutableList<Rule> lemmas;
  private final ImmutableListMultimap<String, Rule> byOp;

  private LemmaSet(
      ImmutableSet<String> moduleNames, ImmutableList<Rule> lemmas) {
    this.moduleNames = moduleNames;
    this.lemmas = lemmas;
    final ImmutableListMultimap.Builder<String, Rule> b =
        ImmutableListMultimap.builder();
    for (Rule lemma : lemmas) {
      b.put(((Apply) lemma.lhs).op, lemma);
    }
    this.byOp = b.build();
  }

  /** Creates the lemma set of the given modules of a database. */
  public static LemmaSet of(
      RuleDatabase database, Collection<String> moduleNames) {
    return new LemmaSet(ImmutableSet.copyOf(moduleNames),
        database.rules(moduleNames, Rule.Kind.LEMMA));
  }

  @Override
  public String toString() {
    return "lemmas" + moduleNames;
  }

  public boolean isEmpty() {
    return lemmas.isEmpty();
  }

  /** Returns the lemmas whose left-hand side applies a given operator. */
  public ImmutableList<Rule> lemmas(String op) {
    return byOp.get(op);
  }
}

// End LemmaSet.java
