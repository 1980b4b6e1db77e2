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

import java.util.Objects;
import java.util.Set;

/**
 * Named region of a configuration.
 *
 * <p>The content is a term: a {@link Seq} for a control sequence or stack, a
 * {@link MapTerm} for locals, a byte-map term for memory, or a {@link Bag}
 * of sub-cells for a nested group such as a memory instance.
 */
public final class Cell extends Term {
  public final String name;
  public final Term content;

  Cell(String name, Term content) {
    super(Kind.CELL);
    this.name = requireNonNull(name, "name");
    this.content = requireNonNull(content, "content");
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, content);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Cell
            && name.equals(((Cell) obj).name)
            && content.equals(((Cell) obj).content);
  }

  @Override
  public StringBuilder unparse(StringBuilder buf) {
    buf.append('<').append(name).append("> ");
    return content.unparse(buf).append(" </").append(name).append('>');
  }

  @Override
  public Term accept(TermShuttle shuttle) {
    return shuttle.visit(this);
  }

  @Override
  void collectVariables(Set<Var> variables) {
    content.collectVariables(variables);
  }

  /** Returns a cell with the same name and different content. */
  public Cell withContent(Term content) {
    if (content.equals(this.content)) {
      return this;
    }
    return new Cell(name, content);
  }
}

// End Cell.java
