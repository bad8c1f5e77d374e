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

import java.util.List;
import java.util.Locale;
import net.hydromatic.optim.solver.NlpSolver;
import net.hydromatic.optim.solver.Symbol;
import net.hydromatic.optim.type.DenseArray;
import net.hydromatic.optim.type.Field;
import net.hydromatic.optim.type.FieldKind;
import net.hydromatic.optim.type.Role;
import net.hydromatic.optim.type.Shape;
import net.hydromatic.optim.type.Struct;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Walks a guess tree in step with a symbol tree, checks that the two agree,
 * and assigns each guessed value to its symbol.
 *
 * <p>A guess may be partial: a null field or list element is skipped. Where a
 * value is present it must agree with the symbol tree: lists must have the
 * same length, and arrays must have the shape of their symbol (a rank-1 array
 * counts as a column).
 *
 * <p>Variables receive their value as an initial guess, parameters as their
 * value. Leaves are assigned in traversal order, so if a walk fails, the
 * leaves before the point of failure have been assigned and those after it
 * have not. */
public class GuessInjector {
  private final NlpSolver solver;
  private final Tracer tracer;

  public GuessInjector(NlpSolver solver, Tracer tracer) {
    this.solver = requireNonNull(solver, "solver");
    this.tracer = requireNonNull(tracer, "tracer");
  }

  /** Assigns the values in a guess tree to the symbols of a symbol tree. */
  public void inject(Object guess, Object symbolTree) {
    inject(guess, symbolTree, Path.ROOT);
  }

  /** Assigns a guess sub-tree to the symbol sub-tree at the same path. */
  public void inject(@Nullable Object guess, @Nullable Object symbols,
      Path path) {
    if (guess == null) {
      return;
    }
    if (guess instanceof List) {
      final List<?> guessList = (List<?>) guess;
      if (!(symbols instanceof List)) {
        throw new StructureMismatchException(path, "a record", guess);
      }
      final List<?> symbolList = (List<?>) symbols;
      if (symbolList.size() != guessList.size()) {
        throw new LengthMismatchException(path, symbolList.size(),
            guessList.size());
      }
      for (int i = 0; i < guessList.size(); i++) {
        inject(guessList.get(i), symbolList.get(i), path.index(i));
      }
      return;
    }
    if (!(guess instanceof Struct)) {
      throw new StructureMismatchException(path,
          "a record or a list of records", guess);
    }
    if (!(symbols instanceof Struct)) {
      throw new StructureMismatchException(path,
          symbols instanceof List ? "a list" : "nothing", guess);
    }
    injectStruct((Struct) guess, (Struct) symbols, path);
  }

  private void injectStruct(Struct guess, Struct symbols, Path path) {
    for (int i = 0; i < guess.type.fieldCount(); i++) {
      final Field field = guess.type.fields.get(i);
      final Object value = guess.get(i);
      if (value == null || field.kind == FieldKind.PLAIN) {
        continue;
      }
      final Path fieldPath = path.field(field.name);
      final Field target = symbols.type.field(field.name);
      if (target == null) {
        throw new UnknownFieldException(fieldPath);
      }
      final Object symbolValue = symbols.get(field.name);
      if (field.kind.storage) {
        if (!target.kind.storage) {
          throw new StructureMismatchException(fieldPath,
              describe(target), value);
        }
        injectLeaves(target.role(), value, symbolValue, fieldPath);
      } else {
        if (!target.kind.isComposite()) {
          throw new StructureMismatchException(fieldPath,
              describe(target), value);
        }
        inject(value, symbolValue, fieldPath);
      }
    }
  }

  private void injectLeaves(Role role, Object guess,
      @Nullable Object symbols, Path path) {
    if (symbols instanceof List) {
      if (!(guess instanceof List)) {
        throw new StructureMismatchException(path, "a list of numeric arrays",
            guess);
      }
      final List<?> guessList = (List<?>) guess;
      final List<?> symbolList = (List<?>) symbols;
      if (symbolList.size() != guessList.size()) {
        throw new LengthMismatchException(path, symbolList.size(),
            guessList.size());
      }
      for (int i = 0; i < symbolList.size(); i++) {
        final Object element = guessList.get(i);
        final Object symbol = symbolList.get(i);
        if (!(symbol instanceof Symbol)) {
          throw new StructureMismatchException(path.index(i), "a symbol",
              symbol);
        }
        if (element != null) {
          assign(role, (Symbol) symbol, element, path.index(i));
        }
      }
      return;
    }
    if (!(symbols instanceof Symbol)) {
      throw new StructureMismatchException(path, "a symbol", symbols);
    }
    if (guess instanceof List) {
      throw new StructureMismatchException(path, "a numeric array", guess);
    }
    assign(role, (Symbol) symbols, guess, path);
  }

  /** Describes what a guess for a field should look like. */
  private static String describe(Field field) {
    return "a value for " + field.kind.name().toLowerCase(Locale.ROOT)
        + " field";
  }

  private void assign(Role role, Symbol symbol, Object guess, Path path) {
    if (!(guess instanceof DenseArray)) {
      throw new StructureMismatchException(path, "a numeric array", guess);
    }
    final DenseArray array = (DenseArray) guess;
    if (!array.isMatrixLike()) {
      throw new ShapeMismatchException(path, symbol.shape(), array.dims());
    }
    final Shape shape = array.toShape();
    if (!shape.equals(symbol.shape())) {
      throw new ShapeMismatchException(path, symbol.shape(), array.dims());
    }
    final DenseArray value = array.reshape(shape);
    solver.assign(role, symbol, value);
    tracer.onGuess(path, symbol, value);
  }
}

// End GuessInjector.java
