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
package net.hydromatic.optim.bind;

import static java.util.Objects.requireNonNull;

import net.hydromatic.optim.solver.SolutionContext;
import net.hydromatic.optim.solver.Symbol;
import net.hydromatic.optim.type.DenseArray;
import net.hydromatic.optim.type.Role;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Converts a symbol tree into a solution tree, replacing each symbol with
 * its value at the solution.
 *
 * <p>Every value has rank 2 and the shape of its symbol; in particular, a
 * column vector stays a column. Reading values does not change the state of
 * the solver. */
public class SolutionExtractor extends StructShuttle {
  private final SolutionContext solution;
  private final Tracer tracer;

  /** Creates a SolutionExtractor.
   *
   * @param solution Result of a successful solve
   * @param tracer Receives each value that is read, or null to not report
   *   values */
  public SolutionExtractor(SolutionContext solution, @Nullable Tracer tracer) {
    this.solution = requireNonNull(solution, "solution");
    this.tracer = tracer == null ? Tracers.empty() : tracer;
  }

  /** Extracts the solution tree that corresponds to a symbol tree. */
  public Object extract(Object symbolTree) {
    return visit(symbolTree, Path.ROOT);
  }

  @Override protected DenseArray visitLeaf(Role role, @Nullable Object value,
      Path path) {
    if (value == null) {
      throw new MissingValueException(path);
    }
    if (!(value instanceof Symbol)) {
      throw new StructureMismatchException(path, "a symbol", value);
    }
    final Symbol symbol = (Symbol) value;
    final DenseArray array = solution.valueOf(symbol).reshape(symbol.shape());
    tracer.onValue(path, array);
    return array;
  }
}

// End SolutionExtractor.java
