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
package net.hydromatic.optim.solver;

import java.util.Map;
import net.hydromatic.optim.type.DenseArray;
import net.hydromatic.optim.type.Role;
import net.hydromatic.optim.type.Shape;

/** Nonlinear-programming solver.
 *
 * <p>The binding layer drives the solver through this interface only: it
 * creates symbols, sets initial guesses and parameter values, states the
 * problem, solves it, and reads values back. How the problem is solved is
 * entirely up to the implementation.
 *
 * <p>An instance is owned by a single session and is not thread-safe. */
public interface NlpSolver {
  /** Sets which inner solver to use, and its options. Called once when the
   * owning session is created, and again whenever its options change. */
  void configure(String innerSolver, Map<String, Object> pluginOptions,
      Map<String, Object> solverOptions);

  /** Creates a decision variable. */
  Symbol variable(Shape shape);

  /** Creates a parameter. */
  Symbol parameter(Shape shape);

  /** Sets the initial value of a variable, a hint for the iterative search. */
  void setInitial(Symbol symbol, DenseArray value);

  /** Sets the value of a parameter. */
  void setValue(Symbol symbol, DenseArray value);

  /** Returns the expression zero, the initial value of an accumulated cost. */
  Expr zero();

  /** Sets the objective to minimize. */
  void minimize(Expr cost);

  /** Adds a constraint. */
  void subjectTo(Expr constraint);

  /** Solves the problem.
   *
   * <p>Throws if the solver does not converge; the exception is not wrapped
   * by callers. */
  SolutionContext solve();

  /** Creates a symbol of a given role. */
  default Symbol create(Role role, Shape shape) {
    switch (role) {
      case VARIABLE:
        return variable(shape);
      case PARAMETER:
        return parameter(shape);
      default:
        throw new AssertionError(role);
    }
  }

  /** Assigns a value to a symbol: the initial value of a variable, or the
   * value of a parameter. */
  default void assign(Role role, Symbol symbol, DenseArray value) {
    switch (role) {
      case VARIABLE:
        setInitial(symbol, value);
        break;
      case PARAMETER:
        setValue(symbol, value);
        break;
      default:
        throw new AssertionError(role);
    }
  }

  /** Creates solvers. */
  interface Factory {
    NlpSolver create(ProblemType problemType);
  }
}

// End NlpSolver.java
