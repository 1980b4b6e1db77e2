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
package net.hydromatic.prover.term;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Map from variables to terms.
 *
 * <p>Applying a substitution replaces each bound variable by its term in a
 * single pass; the replacement is not itself substituted again. A frame
 * variable bound to a {@link Seq} is spliced into the enclosing sequence,
 * and a map frame bound to a {@link MapTerm} is merged into the enclosing
 * map.
 */
public final class Substitution {
  public static final Substitution EMPTY = new Substitution(ImmutableMap.of());

  public final ImmutableMap<Var, Term> map;

  private Substitution(ImmutableMap<Var, Term> map) {
    this.map = requireNonNull(map);
  }

  /** Creates a substitution. */
  public static Substitution of(Map<Var, ? extends Term> map) {
    return map.isEmpty() ? EMPTY : new Substitution(ImmutableMap.copyOf(map));
  }

  @Override
  public int hashCode() {
    return map.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj
        || obj instanceof Substitution && map.equals(((Substitution) obj).map);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder("[");
    ImmutableSortedMap.copyOf(map)
        .forEach(
            (var, term) -> {
              if (buf.length() > 1) {
                buf.append(", ");
              }
              term.unparse(buf).append('/').append(var.name);
            });
    return buf.append(']').toString();
  }

  public @Nullable Term get(Var var) {
    return map.get(var);
  }

  public boolean isEmpty() {
    return map.isEmpty();
  }

  /** Returns a substitution with one more binding. */
  public Substitution plus(Var var, Term term) {
    final ImmutableMap.Builder<Var, Term> b = ImmutableMap.builder();
    map.forEach(
        (v, t) -> {
          if (!v.equals(var)) {
            b.put(v, t);
          }
        });
    return new Substitution(b.put(var, term).build());
  }

  /** Applies this substitution to a term. */
  public Term apply(Term term) {
    if (map.isEmpty()) {
      return term;
    }
    return term.accept(
        new TermShuttle() {
          @Override
          public Term visit(Var var) {
            return map.getOrDefault(var, var);
          }
        });
  }
}

// End Substitution.java
