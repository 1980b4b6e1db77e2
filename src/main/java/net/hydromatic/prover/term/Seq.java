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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Set;

/**
 * Ordered sequence of terms, such as a control sequence or a value stack.
 *
 * <p>An element may be a {@link Var#isFrame() frame} variable, which stands
 * for a sub-sequence of unknown length. A pattern may contain at most one
 * frame.
 *
 * <p>Printed as "a ~&gt; b ~&gt; REST"; the empty sequence prints as ".".
 */
public final class Seq extends Term {
  public final ImmutableList<Term> elements;

  Seq(List<? extends Term> elements) {
    super(Kind.SEQ);
    final ImmutableList.Builder<Term> b = ImmutableList.builder();
    for (Term element : elements) {
      if (element instanceof Seq) {
        // flatten: "a ~> (b ~> c)" is "a ~> b ~> c"
        b.addAll(((Seq) element).elements);
      } else {
        b.add(element);
      }
    }
    this.elements = b.build();
  }

  @Override
  public int hashCode() {
    return elements.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Seq && elements.equals(((Seq) obj).elements);
  }

  @Override
  public StringBuilder unparse(StringBuilder buf) {
    if (elements.isEmpty()) {
      return buf.append('.');
    }
    for (int i = 0; i < elements.size(); i++) {
      if (i > 0) {
        buf.append(" ~> ");
      }
      elements.get(i).unparse(buf);
    }
    return buf;
  }

  @Override
  public Term accept(TermShuttle shuttle) {
    return shuttle.visit(this);
  }

  @Override
  void collectVariables(Set<Var> variables) {
    elements.forEach(e -> e.collectVariables(variables));
  }

  public boolean isEmpty() {
    return elements.isEmpty();
  }

  public int size() {
    return elements.size();
  }

  /**
   * Returns whether this sequence has no items other than frame variables;
   * that is, whether nothing concrete remains to be done.
   */
  public boolean isExhausted() {
    for (Term element : elements) {
      if (!(element instanceof Var && ((Var) element).isFrame())) {
        return false;
      }
    }
    return true;
  }

  /** Returns the index of the first frame variable, or -1. */
  public int frameIndex() {
    for (int i = 0; i < elements.size(); i++) {
      final Term element = elements.get(i);
      if (element instanceof Var && ((Var) element).isFrame()) {
        return i;
      }
    }
    return -1;
  }
}

// End Seq.java
