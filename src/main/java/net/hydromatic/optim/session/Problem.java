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
package net.hydromatic.optim.session;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.optim.solver.Expr;
import net.hydromatic.optim.solver.NlpSolver;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Optimization problem, as seen by the code that defines it.
 *
 * <p>A Problem is registered with exactly one {@link OptimizationSession};
 * expressions added to it go to the session's cost and constraints. */
public class Problem {
  private final OptimizationSession session;

  /** Creates a Problem and registers it with a session. */
  public Problem(OptimizationSession session) {
    this.session = requireNonNull(session, "session");
    session.registerProblem(this);
  }

  /** Creates a session, generates symbols for a structure, and returns the
   * problem registered with the session.
   *
   * @param factory Creates the solver
   * @param structure A {@link net.hydromatic.optim.type.Struct}, or a list of
   *   them, whose storage leaves become symbols
   * @param map Property values; used as is, not copied */
  public static Problem create(NlpSolver.Factory factory, Object structure,
      Map<Prop, Object> map) {
    final OptimizationSession session =
        new OptimizationSession(factory, map, ImmutableMap.of(),
            ImmutableMap.of());
    session.generate(structure);
    return new Problem(session);
  }

  public OptimizationSession session() {
    return session;
  }

  /** Returns the symbol tree that the problem is stated over. */
  public @Nullable Object variables() {
    return session.getOptimizationObjects();
  }

  /** Adds an expression to the problem, as a constraint or as a cost term,
   * or ignores it. */
  public void addExpression(ExpressionType type, Expr expr) {
    switch (type) {
      case SKIP:
        break;
      case SUBJECT_TO:
        session.addConstraint(expr);
        break;
      case MINIMIZE:
        session.addCost(expr);
        break;
      default:
        throw new AssertionError(type);
    }
  }

  /** Adds several expressions of the same type. */
  public void addExpressions(ExpressionType type, Iterable<Expr> exprs) {
    for (Expr expr : exprs) {
      addExpression(type, expr);
    }
  }

  public void addCost(Expr expr) {
    addExpression(ExpressionType.MINIMIZE, expr);
  }

  public void addConstraint(Expr expr) {
    addExpression(ExpressionType.SUBJECT_TO, expr);
  }

  public Solution solve() {
    return session.solve();
  }
}

// End Problem.java
