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
package net.hydromatic.optim;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.optim.solver.Expr;
import net.hydromatic.optim.solver.NlpSolver;
import net.hydromatic.optim.solver.ProblemType;
import net.hydromatic.optim.solver.SolutionContext;
import net.hydromatic.optim.solver.Symbol;
import net.hydromatic.optim.type.DenseArray;
import net.hydromatic.optim.type.Role;
import net.hydromatic.optim.type.Shape;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Solver for tests.
 *
 * <p>Does not optimize anything. Its "solution" gives each variable its
 * initial value (zero if it has none) and each parameter its value, so a test
 * can predict every value that is read back. Like many real solvers, it
 * returns column vectors as rank-1 arrays and 1x1 values as scalars.
 *
 * <p>Every call is recorded in {@link #log}. */
public class FakeSolver implements NlpSolver {
  public final ProblemType problemType;
  public final List<String> log = new ArrayList<>();
  public final List<Expr> constraints = new ArrayList<>();
  private final List<FakeSymbol> symbols = new ArrayList<>();
  private final Map<FakeSymbol, DenseArray> values = new HashMap<>();
  private @Nullable Expr objective;
  private @Nullable RuntimeException failure;
  public int solveCount;

  public FakeSolver(ProblemType problemType) {
    this.problemType = requireNonNull(problemType);
  }

  public FakeSolver() {
    this(ProblemType.NLP);
  }

  /** Makes the next {@link #solve()} throw. */
  public FakeSolver failWith(RuntimeException e) {
    this.failure = e;
    return this;
  }

  /** Returns the symbols created so far, in order of creation. */
  public List<FakeSymbol> symbols() {
    return symbols;
  }

  /** Returns the value assigned to a symbol, or null. */
  public @Nullable DenseArray assigned(Symbol symbol) {
    return values.get(symbol);
  }

  /** Returns an expression whose value is the sum of the squares of the
   * elements of a symbol. */
  public Expr sumOfSquares(Symbol symbol) {
    return new FakeExpr() {
      @Override double eval(Map<FakeSymbol, DenseArray> env) {
        double sum = 0;
        for (double d : env.get((FakeSymbol) symbol).data()) {
          sum += d * d;
        }
        return sum;
      }

      @Override public String toString() {
        return "sumsq(" + symbol + ")";
      }
    };
  }

  /** Returns a constant expression. */
  public Expr constant(double value) {
    return new FakeExpr() {
      @Override double eval(Map<FakeSymbol, DenseArray> env) {
        return value;
      }

      @Override public String toString() {
        return Double.toString(value);
      }
    };
  }

  @Override public void configure(String innerSolver,
      Map<String, Object> pluginOptions, Map<String, Object> solverOptions) {
    log.add("configure " + innerSolver + " " + pluginOptions + " "
        + solverOptions);
  }

  @Override public Symbol variable(Shape shape) {
    return newSymbol(Role.VARIABLE, shape);
  }

  @Override public Symbol parameter(Shape shape) {
    return newSymbol(Role.PARAMETER, shape);
  }

  private Symbol newSymbol(Role role, Shape shape) {
    final String prefix = role == Role.VARIABLE ? "v" : "p";
    final FakeSymbol symbol =
        new FakeSymbol(prefix + symbols.size(), shape, role);
    symbols.add(symbol);
    log.add(role == Role.VARIABLE
        ? "variable " + shape
        : "parameter " + shape);
    return symbol;
  }

  @Override public void setInitial(Symbol symbol, DenseArray value) {
    if (symbol.role() != Role.VARIABLE) {
      throw new IllegalArgumentException("not a variable: " + symbol);
    }
    values.put((FakeSymbol) symbol, value);
    log.add("setInitial " + symbol + " " + value);
  }

  @Override public void setValue(Symbol symbol, DenseArray value) {
    if (symbol.role() != Role.PARAMETER) {
      throw new IllegalArgumentException("not a parameter: " + symbol);
    }
    values.put((FakeSymbol) symbol, value);
    log.add("setValue " + symbol + " " + value);
  }

  @Override public Expr zero() {
    return constant(0d);
  }

  @Override public void minimize(Expr cost) {
    this.objective = cost;
    log.add("minimize " + cost);
  }

  @Override public void subjectTo(Expr constraint) {
    constraints.add(constraint);
    log.add("subjectTo " + constraint);
  }

  @Override public SolutionContext solve() {
    ++solveCount;
    log.add("solve");
    if (failure != null) {
      final RuntimeException e = failure;
      failure = null;
      throw e;
    }
    requireNonNull(objective, "objective");
    final Map<FakeSymbol, DenseArray> env = new LinkedHashMap<>();
    for (FakeSymbol symbol : symbols) {
      final DenseArray value = values.get(symbol);
      env.put(symbol, value != null ? value : DenseArray.zeros(symbol.shape));
    }
    final Map<FakeSymbol, DenseArray> snapshot = ImmutableMap.copyOf(env);
    return expr -> {
      if (expr instanceof FakeSymbol) {
        return vectorize(snapshot.get(expr));
      }
      return DenseArray.scalar(((FakeExpr) expr).eval(snapshot));
    };
  }

  /** Converts a column to a rank-1 array and a 1x1 array to a scalar. */
  private static DenseArray vectorize(DenseArray array) {
    if (array.size() == 1) {
      return DenseArray.scalar(array.get(0));
    }
    if (array.rank() == 2 && array.dims()[1] == 1) {
      return DenseArray.vector(array.data());
    }
    return array;
  }

  /** Expression that can be evaluated given values for symbols. */
  abstract static class FakeExpr implements Expr {
    abstract double eval(Map<FakeSymbol, DenseArray> env);

    @Override public Expr plus(Expr other) {
      final FakeExpr left = this;
      final FakeExpr right = (FakeExpr) other;
      return new FakeExpr() {
        @Override double eval(Map<FakeSymbol, DenseArray> env) {
          return left.eval(env) + right.eval(env);
        }

        @Override public String toString() {
          return left + " + " + right;
        }
      };
    }
  }

  /** Symbol created by a {@link FakeSolver}. */
  public static class FakeSymbol extends FakeExpr implements Symbol {
    final String name;
    final Shape shape;
    final Role role;

    FakeSymbol(String name, Shape shape, Role role) {
      this.name = name;
      this.shape = shape;
      this.role = role;
    }

    @Override public Shape shape() {
      return shape;
    }

    @Override public Role role() {
      return role;
    }

    @Override double eval(Map<FakeSymbol, DenseArray> env) {
      double sum = 0;
      for (double d : env.get(this).data()) {
        sum += d;
      }
      return sum;
    }

    @Override public String toString() {
      return name;
    }
  }
}

// End FakeSolver.java
