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
import static net.hydromatic.prover.term.TermBuilder.terms;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * One-way matcher of patterns against subject terms.
 *
 * <p>Variables in the pattern bind to sub-terms of the subject; variables in
 * the subject are symbols, and are only ever matched, never bound. Matching
 * backtracks over the choices that a pattern leaves open (which map entry a
 * non-ground key selects, which cell instance a multiplicity cell selects)
 * and explores them in a fixed order, so the result is deterministic.
 *
 * <p>A {@link #DEFERRING deferring} matcher does not fail when a pattern
 * variable's binding and the subject differ only in a way that the
 * background theory might reconcile, such as {@code A +Int 0} versus
 * {@code A}; it records an equality constraint instead, to be discharged by
 * a solver.
 */
public class PatternMatcher {
  /** Matcher that fails on any structural difference. */
  public static final PatternMatcher STRICT = new PatternMatcher(false);

  /** Matcher that turns differences between symbolic terms into
   * constraints. */
  public static final PatternMatcher DEFERRING = new PatternMatcher(true);

  private final boolean deferring;

  private PatternMatcher(boolean deferring) {
    this.deferring = deferring;
  }

  /** Returns all matches of a pattern against a subject, in deterministic
   * order. */
  public List<Match> matchAll(
      Term pattern, Term subject, Substitution initial) {
    final List<Match> list = new ArrayList<>();
    match(pattern, subject, State.of(initial),
        state -> {
          list.add(state.toMatch());
          return false;
        });
    return list;
  }

  public List<Match> matchAll(Term pattern, Term subject) {
    return matchAll(pattern, subject, Substitution.EMPTY);
  }

  /** Returns the first match of a pattern against a subject, or null. */
  public @Nullable Match match(Term pattern, Term subject,
      Substitution initial) {
    final List<Match> list = new ArrayList<>(1);
    match(pattern, subject, State.of(initial),
        state -> {
          list.add(state.toMatch());
          return true;
        });
    return list.isEmpty() ? null : list.get(0);
  }

  public @Nullable Match match(Term pattern, Term subject) {
    return match(pattern, subject, Substitution.EMPTY);
  }

  /** Matches a pattern against a subject, calling {@code k} for each
   * match. Returns true if {@code k} asked to stop. */
  private boolean match(Term p, Term s, State st, Predicate<State> k) {
    if (p instanceof Var) {
      final Var v = (Var) p;
      if (isFrameVar(s) && !v.isFrame()) {
        // a frame stands for any number of elements, not exactly one
        return false;
      }
      if (v.isWildcard()) {
        return k.test(st);
      }
      final Term bound = st.subst.get(v);
      if (bound != null) {
        return unify(bound, s, st, k);
      }
      return k.test(st.bind(v, s));
    }
    if (isFrameVar(s) && p.kind != Term.Kind.SEQ) {
      return false;
    }
    switch (p.kind) {
      case LITERAL:
        if (p.equals(s)) {
          return k.test(st);
        }
        return defer(p, s, st, k);

      case APPLY:
        final Apply pa = (Apply) p;
        if (s instanceof Apply) {
          final Apply sa = (Apply) s;
          if (pa.op.equals(sa.op) && pa.args.size() == sa.args.size()) {
            if (matchList(pa.args, sa.args, 0, st, k)) {
              return true;
            }
            if (pa.builtIn == null) {
              return false;
            }
          }
        }
        if (pa.builtIn != null && st.isBound(pa)) {
          return defer(st.subst.apply(pa), s, st, k);
        }
        return false;

      case SEQ:
        return matchSeq((Seq) p, asSeq(s), st, k);

      case MAP:
        if (!(s instanceof MapTerm)) {
          return false;
        }
        return matchMap((MapTerm) p, (MapTerm) s, st, k);

      case CELL:
        if (!(s instanceof Cell) || !((Cell) p).name.equals(((Cell) s).name)) {
          return false;
        }
        return matchContent((Cell) p, (Cell) s, ImmutableList.of(),
            ImmutableList.of(), st, k);

      case BAG:
        if (!(s instanceof Bag)) {
          return false;
        }
        return matchBag((Bag) p, (Bag) s, ImmutableList.of(),
            ImmutableList.of(), st, k);

      default:
        throw new AssertionError(p.kind);
    }
  }

  private boolean matchList(
      List<Term> ps, List<Term> ss, int i, State st, Predicate<State> k) {
    if (i == ps.size()) {
      return k.test(st);
    }
    return match(ps.get(i), ss.get(i), st,
        st2 -> matchList(ps, ss, i + 1, st2, k));
  }

  private boolean matchSeq(Seq p, Seq s, State st, Predicate<State> k) {
    final int f = p.frameIndex();
    if (f < 0) {
      if (p.size() != s.size()) {
        return false;
      }
      return matchList(p.elements, s.elements, 0, st, k);
    }
    final int suffix = p.size() - f - 1;
    final int middle = s.size() - f - suffix;
    if (middle < 0) {
      return false;
    }
    final List<Term> ps = new ArrayList<>(p.elements);
    final List<Term> ss = new ArrayList<>(s.elements);
    ps.remove(f);
    final List<Term> rest = ss.subList(f, f + middle);
    final Seq restSeq = terms.seq(ImmutableList.copyOf(rest));
    rest.clear();
    final Var frame = (Var) p.elements.get(f);
    return matchList(ps, ss, 0, st,
        st2 -> match(frame, restSeq, st2, k));
  }

  private boolean matchMap(MapTerm p, MapTerm s, State st, Predicate<State> k) {
    final Map<Term, Term> remaining = new LinkedHashMap<>();
    for (Term key : s.sortedKeys()) {
      remaining.put(key, s.entries.get(key));
    }
    return matchEntries(p, p.sortedKeys(), remaining, s.frame, st, k);
  }

  private boolean matchEntries(
      MapTerm p,
      List<Term> keys,
      Map<Term, Term> remaining,
      @Nullable Var subjectFrame,
      State st,
      Predicate<State> k) {
    if (keys.isEmpty()) {
      if (p.frame == null) {
        return remaining.isEmpty()
            && subjectFrame == null
            && k.test(st);
      }
      return match(p.frame, terms.map(remaining, subjectFrame), st, k);
    }

    // Prefer a key whose variables are all bound; it selects a single
    // entry.
    int i = 0;
    for (int j = 0; j < keys.size(); j++) {
      if (st.isBound(keys.get(j))) {
        i = j;
        break;
      }
    }
    final Term pKey = keys.get(i);
    final Term pValue = requireNonNull(p.entries.get(pKey));
    final List<Term> keys2 = new ArrayList<>(keys);
    keys2.remove(i);

    if (st.isBound(pKey)) {
      final Term sKey = st.subst.apply(pKey);
      final Term sValue = remaining.get(sKey);
      if (sValue == null) {
        return false;
      }
      final Map<Term, Term> remaining2 = new LinkedHashMap<>(remaining);
      remaining2.remove(sKey);
      return match(pValue, sValue, st,
          st2 -> matchEntries(p, keys2, remaining2, subjectFrame, st2, k));
    }
    for (Map.Entry<Term, Term> e : remaining.entrySet()) {
      final Map<Term, Term> remaining2 = new LinkedHashMap<>(remaining);
      remaining2.remove(e.getKey());
      final boolean stop =
          match(pKey, e.getKey(), st,
              st2 -> match(pValue, e.getValue(), st2,
                  st3 -> matchEntries(p, keys2, remaining2, subjectFrame,
                      st3, k)));
      if (stop) {
        return true;
      }
    }
    return false;
  }

  private boolean matchBag(
      Bag p,
      Bag s,
      ImmutableList<Integer> pPath,
      ImmutableList<Integer> sPath,
      State st,
      Predicate<State> k) {
    return matchCells(p, s, 0, new boolean[s.cells.size()], pPath, sPath, st,
        k);
  }

  private boolean matchCells(
      Bag p,
      Bag s,
      int i,
      boolean[] used,
      ImmutableList<Integer> pPath,
      ImmutableList<Integer> sPath,
      State st,
      Predicate<State> k) {
    if (i == p.cells.size()) {
      return k.test(st);
    }
    final Cell pCell = p.cells.get(i);
    for (int j = 0; j < s.cells.size(); j++) {
      final Cell sCell = s.cells.get(j);
      if (used[j] || !sCell.name.equals(pCell.name)) {
        continue;
      }
      final ImmutableList<Integer> pPath2 = append(pPath, i);
      final ImmutableList<Integer> sPath2 = append(sPath, j);
      used[j] = true;
      final State st2 = st.bindCell(pPath2, sPath2);
      final boolean stop =
          matchContent(pCell, sCell, pPath2, sPath2, st2,
              st3 -> matchCells(p, s, i + 1, used, pPath, sPath, st3, k));
      used[j] = false;
      if (stop) {
        return true;
      }
    }
    return false;
  }

  private boolean matchContent(
      Cell p,
      Cell s,
      ImmutableList<Integer> pPath,
      ImmutableList<Integer> sPath,
      State st,
      Predicate<State> k) {
    if (p.content instanceof Bag) {
      if (!(s.content instanceof Bag)) {
        return false;
      }
      return matchBag((Bag) p.content, (Bag) s.content, pPath, sPath, st, k);
    }
    return match(p.content, s.content, st, k);
  }

  /** Compares two subject terms; a variable's existing binding and the
   * term it is being matched against. */
  private boolean unify(Term a, Term b, State st, Predicate<State> k) {
    final Term a2 = unwrap(a);
    final Term b2 = unwrap(b);
    if (a2.equals(b2)) {
      return k.test(st);
    }
    if (a2.kind == b2.kind) {
      switch (a2.kind) {
        case APPLY:
          final Apply aa = (Apply) a2;
          final Apply ba = (Apply) b2;
          if (aa.builtIn == null
              && aa.op.equals(ba.op)
              && aa.args.size() == ba.args.size()) {
            return unifyList(aa.args, ba.args, 0, st, k);
          }
          break;
        case SEQ:
          if (((Seq) a2).size() == ((Seq) b2).size()) {
            return unifyList(((Seq) a2).elements, ((Seq) b2).elements, 0, st,
                k);
          }
          return false;
        case MAP:
          final MapTerm am = (MapTerm) a2;
          final MapTerm bm = (MapTerm) b2;
          if (am.entries.keySet().equals(bm.entries.keySet())
              && Objects.equals(am.frame, bm.frame)) {
            final List<Term> keys = am.sortedKeys();
            final List<Term> as = new ArrayList<>();
            final List<Term> bs = new ArrayList<>();
            for (Term key : keys) {
              as.add(am.entries.get(key));
              bs.add(bm.entries.get(key));
            }
            return unifyList(as, bs, 0, st, k);
          }
          return false;
        case CELL:
          if (((Cell) a2).name.equals(((Cell) b2).name)) {
            return unify(((Cell) a2).content, ((Cell) b2).content, st, k);
          }
          return false;
        default:
          break;
      }
    }
    return defer(a2, b2, st, k);
  }

  private boolean unifyList(
      List<Term> as, List<Term> bs, int i, State st, Predicate<State> k) {
    if (i == as.size()) {
      return k.test(st);
    }
    return unify(as.get(i), bs.get(i), st,
        st2 -> unifyList(as, bs, i + 1, st2, k));
  }

  /** If deferring, and one of the terms is symbolic, continues with an
   * equality constraint between them; otherwise fails. */
  private boolean defer(Term a, Term b, State st, Predicate<State> k) {
    if (!deferring
        || isFrameVar(a)
        || isFrameVar(b)
        || !(isSymbolic(a) || isSymbolic(b))
        || !isScalar(a)
        || !isScalar(b)) {
      return false;
    }
    final Term constraint =
        isIntTyped(a) || isIntTyped(b)
            ? terms.eqInt(a, b)
            : terms.eq(a, b);
    return k.test(st.constrain(constraint));
  }

  private static boolean isFrameVar(Term t) {
    return t instanceof Var && ((Var) t).isFrame();
  }

  /** Whether a term's value is not determined by its structure: a
   * non-frame variable or an application of a built-in function. */
  private static boolean isSymbolic(Term t) {
    return t instanceof Var && !((Var) t).isFrame()
        || t instanceof Apply && ((Apply) t).builtIn != null;
  }

  private static boolean isScalar(Term t) {
    return t instanceof Var || t instanceof Literal || t instanceof Apply;
  }

  /** Whether a term denotes an integer. */
  public static boolean isIntTyped(Term t) {
    if (t.isInteger()) {
      return true;
    }
    if (t instanceof Apply) {
      final Op op = ((Apply) t).builtIn;
      return op != null && op.type == Op.Type.INT;
    }
    return false;
  }

  /** Reduces a sequence or map that consists of only a frame to that
   * frame. */
  private static Term unwrap(Term t) {
    if (t instanceof Seq
        && ((Seq) t).size() == 1
        && isFrameVar(((Seq) t).elements.get(0))) {
      return ((Seq) t).elements.get(0);
    }
    if (t instanceof MapTerm
        && ((MapTerm) t).entries.isEmpty()
        && ((MapTerm) t).frame != null) {
      return requireNonNull(((MapTerm) t).frame);
    }
    return t;
  }

  private static Seq asSeq(Term t) {
    return t instanceof Seq ? (Seq) t : terms.seq(t);
  }

  private static ImmutableList<Integer> append(
      ImmutableList<Integer> list, int i) {
    return ImmutableList.<Integer>builder().addAll(list).add(i).build();
  }

  /** Intermediate state of a match. */
  private static class State {
    final Substitution subst;
    final ImmutableList<Term> constraints;
    final ImmutableMap<ImmutableList<Integer>, ImmutableList<Integer>> cells;

    State(
        Substitution subst,
        ImmutableList<Term> constraints,
        ImmutableMap<ImmutableList<Integer>, ImmutableList<Integer>> cells) {
      this.subst = subst;
      this.constraints = constraints;
      this.cells = cells;
    }

    static State of(Substitution subst) {
      return new State(subst, ImmutableList.of(), ImmutableMap.of());
    }

    State bind(Var v, Term t) {
      return new State(subst.plus(v, t), constraints, cells);
    }

    State constrain(Term constraint) {
      return new State(subst,
          ImmutableList.<Term>builder().addAll(constraints).add(constraint)
              .build(),
          cells);
    }

    State bindCell(ImmutableList<Integer> pPath, ImmutableList<Integer> sPath) {
      return new State(subst, constraints,
          ImmutableMap.<ImmutableList<Integer>, ImmutableList<Integer>>
              builder().putAll(cells).put(pPath, sPath).build());
    }

    /** Whether every variable in a pattern term is bound. */
    boolean isBound(Term pattern) {
      for (Var v : pattern.variables()) {
        if (subst.get(v) == null) {
          return false;
        }
      }
      return true;
    }

    Match toMatch() {
      return new Match(subst, constraints, cells);
    }
  }

  /** Result of a successful match. */
  public static class Match {
    /** Bindings of the pattern's variables. */
    public final Substitution subst;
    /** Equalities that must hold for the match to be valid; empty unless
     * the matcher is deferring. */
    public final ImmutableList<Term> constraints;
    /** For each pattern cell, identified by its path of indexes through
     * nested bags, the path of the subject cell it matched. */
    public final ImmutableMap<ImmutableList<Integer>, ImmutableList<Integer>>
        cells;

    Match(
        Substitution subst,
        ImmutableList<Term> constraints,
        ImmutableMap<ImmutableList<Integer>, ImmutableList<Integer>> cells) {
      this.subst = requireNonNull(subst);
      this.constraints = requireNonNull(constraints);
      this.cells = requireNonNull(cells);
    }

    @Override
    public String toString() {
      return constraints.isEmpty()
          ? subst.toString()
          : subst + " if " + terms.and(constraints);
    }
  }
}

// End PatternMatcher.java
