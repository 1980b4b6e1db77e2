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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.math.BigInteger;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Finite mapping from terms to terms, optionally extended by a frame
 * variable that stands for further, unknown entries.
 *
 * <p>Equality ignores the order in which entries were added. A map whose
 * keys and values are integer literals is also the concrete representation
 * of a byte-map; absent keys denote 0, and zero entries are not stored.
 *
 * <p>Printed as "0 |-&gt; V 1 |-&gt; W REST"; the empty map prints as
 * ".Map".
 */
public final class MapTerm extends Term {
  /** Orders keys by their printed form, for deterministic output. */
  public static final Comparator<Term> KEY_ORDERING =
      Ordering.<String>natural().onResultOf(MapTerm::keyString);

  public final ImmutableMap<Term, Term> entries;
  public final @Nullable Var frame;

  MapTerm(Map<? extends Term, ? extends Term> entries, @Nullable Var frame) {
    super(Kind.MAP);
    this.entries = canonize(entries, frame);
    this.frame = frame;
    checkArgument(frame == null || frame.isFrame(), "not a frame: %s", frame);
  }

  /** Removes the zero entries of a concrete integer map, so that a byte-map
   * has one representation whether a zero byte is absent or explicit. */
  private static ImmutableMap<Term, Term> canonize(
      Map<? extends Term, ? extends Term> entries, @Nullable Var frame) {
    if (frame != null || !isConcreteIntegerMap(entries)) {
      return ImmutableMap.copyOf(entries);
    }
    final ImmutableMap.Builder<Term, Term> b = ImmutableMap.builder();
    entries.forEach(
        (k, v) -> {
          if (((BigInteger) ((Literal) v).value).signum() != 0) {
            b.put(k, v);
          }
        });
    return b.build();
  }

  private static boolean isConcreteIntegerMap(
      Map<? extends Term, ? extends Term> entries) {
    for (Map.Entry<? extends Term, ? extends Term> e : entries.entrySet()) {
      if (!e.getKey().isInteger() || !e.getValue().isInteger()) {
        return false;
      }
    }
    return true;
  }

  private static String keyString(Term term) {
    // pad integers so that 10 sorts after 9
    if (term.isInteger()) {
      final String s = term.toString();
      return s.startsWith("-")
          ? "0" + s
          : "1" + "0".repeat(Math.max(0, 20 - s.length())) + s;
    }
    return "2" + term;
  }

  @Override
  public int hashCode() {
    return Objects.hash(entries, frame);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof MapTerm
            && entries.equals(((MapTerm) obj).entries)
            && Objects.equals(frame, ((MapTerm) obj).frame);
  }

  @Override
  public StringBuilder unparse(StringBuilder buf) {
    if (entries.isEmpty() && frame == null) {
      return buf.append(".Map");
    }
    int i = 0;
    for (Term key : sortedKeys()) {
      if (i++ > 0) {
        buf.append(' ');
      }
      key.unparse(buf).append(" |-> ");
      entries.get(key).unparse(buf);
    }
    if (frame != null) {
      if (i > 0) {
        buf.append(' ');
      }
      frame.unparse(buf);
    }
    return buf;
  }

  /** Returns the keys in deterministic order. */
  public ImmutableList<Term> sortedKeys() {
    return ImmutableList.sortedCopyOf(KEY_ORDERING, entries.keySet());
  }

  @Override
  public Term accept(TermShuttle shuttle) {
    return shuttle.visit(this);
  }

  @Override
  void collectVariables(Set<Var> variables) {
    for (Term key : sortedKeys()) {
      key.collectVariables(variables);
      entries.get(key).collectVariables(variables);
    }
    if (frame != null) {
      variables.add(frame);
    }
  }

  /** Returns the value for a key, or null. */
  public @Nullable Term get(Term key) {
    return entries.get(key);
  }

  /** Returns a copy of this map with one entry added or replaced. */
  public MapTerm put(Term key, Term value) {
    final ImmutableMap.Builder<Term, Term> b = ImmutableMap.builder();
    entries.forEach(
        (k, v) -> {
          if (!k.equals(key)) {
            b.put(k, v);
          }
        });
    b.put(key, value);
    return new MapTerm(b.build(), frame);
  }

  /** Returns whether every key and value is a literal, and there is no
   * frame. */
  public boolean isConcrete() {
    if (frame != null) {
      return false;
    }
    for (Map.Entry<Term, Term> e : entries.entrySet()) {
      if (!(e.getKey() instanceof Literal)
          || !(e.getValue() instanceof Literal)) {
        return false;
      }
    }
    return true;
  }
}

// End MapTerm.java
