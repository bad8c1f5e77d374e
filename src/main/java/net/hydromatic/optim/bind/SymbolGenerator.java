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

import net.hydromatic.optim.solver.NlpSolver;
import net.hydromatic.optim.solver.Symbol;
import net.hydromatic.optim.type.DenseArray;
import net.hydromatic.optim.type.Role;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Converts a declared tree into a symbol tree.
 *
 * <p>Each storage leaf's declared array determines the shape of a symbol that
 * the solver creates; the array's values are not used. A rank-1 array of
 * length N becomes an (N, 1) symbol. The resulting tree has the same
 * structure as the declared tree, and the declared tree is not modified. */
public class SymbolGenerator extends StructShuttle {
  private final NlpSolver solver;
  private final Tracer tracer;

  public SymbolGenerator(NlpSolver solver, Tracer tracer) {
    this.solver = requireNonNull(solver, "solver");
    this.tracer = requireNonNull(tracer, "tracer");
  }

  /** Generates a symbol tree from a {@link net.hydromatic.optim.type.Struct}
   * or a list of them. */
  public Object generate(Object structure) {
    return visit(structure, Path.ROOT);
  }

  @Override protected Symbol visitLeaf(Role role, @Nullable Object value,
      Path path) {
    if (value == null) {
      throw new MissingValueException(path);
    }
    if (!(value instanceof DenseArray)) {
      throw new StructureMismatchException(path, "a numeric array", value);
    }
    final DenseArray array = (DenseArray) value;
    if (!array.isMatrixLike()) {
      throw new UnsupportedRankException(path, array.rank());
    }
    final Symbol symbol = solver.create(role, array.toShape());
    tracer.onSymbol(path, symbol);
    return symbol;
  }
}

// End SymbolGenerator.java
