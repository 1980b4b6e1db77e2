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
package net.hydromatic.prover.rule;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Named collection of rules.
 *
 * <p>A session activates modules by name; activating a module makes its
 * step rules available to the rewriter and its lemmas available to the
 * simplifier.
 */
public final class RuleModule {
  public final String name;
  public final ImmutableList<Rule> rules;

  public RuleModule(String name, List<Rule> rules) {
    this.name = requireNonNull(name, "name");
    this.rules = ImmutableList.copyOf(rules);
  }

  @Override
  public String toString() {
    return "module " + name + " (" + rules.size() + " rules)";
  }

  /** Returns the rules of a given kind. */
  public ImmutableList<Rule> rules(Rule.Kind kind) {
    final ImmutableList.Builder<Rule> b = ImmutableList.builder();
    for (Rule rule : rules) {
      if (rule.kind == kind) {
        b.add(rule);
      }
    }
    return b.build();
  }
}

// End RuleModule.java
