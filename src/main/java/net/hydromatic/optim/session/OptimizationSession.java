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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;
import net.hydromatic.optim.bind.BindException;
import net.hydromatic.optim.bind.GuessInjector;
import net.hydromatic.optim.bind.Path;
import net.hydromatic.optim.bind.SolutionExtractor;
import net.hydromatic.optim.bind.SymbolGenerator;
import net.hydromatic.optim.bind.Tracer;
import net.hydromatic.optim.bind.Tracers;
import net.hydromatic.optim.solver.Expr;
import net.hydromatic.optim.solver.NlpSolver;
import net.hydromatic.optim.solver.ProblemType;
import net.hydromatic.optim.solver.SolutionContext;
import net.hydromatic.optim.type.Struct;
import net.hydromatic.optim.util.OptimException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Binds a tree of optimization quantities to a solver.
 *
 * <p>A session owns one solver and, once {@link #generate} has been called,
 * one symbol tree. Its life cycle is:
 *
 * <ol>
 *   <li>{@link #generate} creates symbols for every storage leaf of a
 *       {@link Struct} (or list of them), and makes the resulting symbol tree
 *       current;
 *   <li>{@link #setInitialGuess} assigns initial values to variables and
 *       values to parameters; it may be called any number of times;
 *   <li>{@link #addCost} and {@link #addConstraint} state the problem;
 *   <li>{@link #solve} solves it and returns a {@link Solution}, whose values
 *       tree has the same structure as the symbol tree.
 * </ol>
 *
 * <p>A session must be used from one thread only. */
public class OptimizationSession {
  /** Property values. */
  public final Map<Prop, Object> map;

  private final NlpSolver solver;
  private String innerSolver;
  private Map<String, Object> pluginOptions;
  private Map<String, Object> solverOptions;
  private Tracer tracer = Tracers.empty();

  private @Nullable Object symbolTree;
  private @Nullable Expr cost;
  private @Nullable Problem problem;
  private @Nullable Solution solution;

  /** Creates an OptimizationSession.
   *
   * <p>The {@code map} parameter, that becomes the property map, is used as is,
   * not copied.
   *
   * @param factory Creates the solver
   * @param map Map that contains property values
   * @param pluginOptions Options for the solver plugin
   * @param solverOptions Options for the inner solver */
  public OptimizationSession(NlpSolver.Factory factory, Map<Prop, Object> map,
      Map<String, Object> pluginOptions, Map<String, Object> solverOptions) {
    this.map = requireNonNull(map, "map");
    this.innerSolver = Prop.INNER_SOLVER.stringValue(map);
    this.pluginOptions = ImmutableMap.copyOf(pluginOptions);
    this.solverOptions = ImmutableMap.copyOf(solverOptions);
    this.solver =
        factory.create(Prop.PROBLEM_TYPE.enumValue(map, ProblemType.class));
    configure();
  }

  /** Creates an OptimizationSession with default properties and options. */
  public OptimizationSession(NlpSolver.Factory factory) {
    this(factory, new LinkedHashMap<>(), ImmutableMap.of(), ImmutableMap.of());
  }

  private void configure() {
    solver.configure(innerSolver, pluginOptions, solverOptions);
  }

  /** Returns the solver. Callers use it to build the expressions that they
   * pass to {@link #addCost} and {@link #addConstraint}. */
  public NlpSolver solver() {
    return solver;
  }

  public Tracer tracer() {
    return tracer;
  }

  public OptimizationSession withTracer(Tracer tracer) {
    this.tracer = requireNonNull(tracer, "tracer");
    return this;
  }

  /** Changes the inner solver and its options. A null argument leaves the
   * corresponding setting as it is. The solver is re-configured. */
  public void setSolverOptions(@Nullable String innerSolver,
      @Nullable Map<String, Object> solverOptions,
      @Nullable Map<String, Object> pluginOptions) {
    if (innerSolver != null) {
      Prop.INNER_SOLVER.set(map, innerSolver);
      this.innerSolver = innerSolver;
    }
    if (solverOptions != null) {
      this.solverOptions = ImmutableMap.copyOf(solverOptions);
    }
    if (pluginOptions != null) {
      this.pluginOptions = ImmutableMap.copyOf(pluginOptions);
    }
    configure();
  }

  public String innerSolver() {
    return innerSolver;
  }

  public Map<String, Object> solverOptions() {
    return solverOptions;
  }

  public Map<String, Object> pluginOptions() {
    return pluginOptions;
  }

  /** Creates a symbol for each storage leaf of a structure, and makes the
   * resulting symbol tree the current one.
   *
   * <p>The structure is a {@link Struct} or a list whose elements are,
   * recursively, Structs or lists; it is not modified. Any previous symbol
   * tree and solution are discarded. */
  public Object generate(Object structure) {
    final Object symbols =
        traced(() -> new SymbolGenerator(solver, tracer).generate(structure));
    this.symbolTree = symbols;
    this.solution = null;
    return symbols;
  }

  /** Returns the current symbol tree, or null if {@link #generate} has not
   * been called. */
  public @Nullable Object getOptimizationObjects() {
    return symbolTree;
  }

  /** Assigns the values of a guess tree to the corresponding symbols. */
  public void setInitialGuess(Object guess) {
    traced(() -> {
      new GuessInjector(solver, tracer).inject(guess, symbolTree, Path.ROOT);
      return guess;
    });
  }

  /** Adds a term to the cost. */
  public void addCost(Expr expr) {
    requireNonNull(expr, "expr");
    cost = cost == null ? expr : cost.plus(expr);
  }

  /** Adds a constraint. It is passed to the solver immediately. */
  public void addConstraint(Expr expr) {
    solver.subjectTo(requireNonNull(expr, "expr"));
  }

  /** Returns the accumulated cost, or null if no cost has been added. */
  public @Nullable Expr costFunction() {
    return cost;
  }

  public void registerProblem(Problem problem) {
    this.problem = requireNonNull(problem, "problem");
  }

  /** Returns the registered problem.
   *
   * @throws ProblemNotRegisteredException if none has been registered */
  public Problem getProblem() {
    if (problem == null) {
      throw report(new ProblemNotRegisteredException());
    }
    return problem;
  }

  /** Minimizes the accumulated cost subject to the constraints.
   *
   * <p>If the solver fails, its exception is propagated and the session has
   * no solution. */
  public Solution solve() {
    this.solution = null;
    final Expr objective = cost != null ? cost : solver.zero();
    solver.minimize(objective);
    final SolutionContext context = solver.solve();
    final double costValue = context.valueOf(objective).get(0);
    final @Nullable Tracer valueTracer =
        Prop.TRACE_VALUES.booleanValue(map) ? tracer : null;
    final Object values = symbolTree == null
        ? null
        : traced(() ->
            new SolutionExtractor(context, valueTracer).extract(symbolTree));
    final Solution solution = new Solution(values, costValue);
    this.solution = solution;
    tracer.onSolve(costValue);
    return solution;
  }

  /** Returns the solution tree of the last solve.
   *
   * @throws SolutionNotAvailableException if the session has not been solved
   *   since symbols were last generated */
  public Object getValues() {
    if (solution == null || solution.values() == null) {
      throw report(new SolutionNotAvailableException());
    }
    return solution.values();
  }

  /** Returns the cost at the solution of the last solve.
   *
   * @throws SolutionNotAvailableException if the session has not been solved
   *   since symbols were last generated */
  public double getCostValue() {
    if (solution == null) {
      throw report(new SolutionNotAvailableException());
    }
    return solution.cost();
  }

  /** Returns the last solution, or null. */
  public @Nullable Solution solution() {
    return solution;
  }

  /** Runs a tree walk, reporting any binding error to the tracer before it
   * is thrown. */
  private <T> T traced(Supplier<T> walk) {
    try {
      return walk.get();
    } catch (BindException e) {
      tracer.onException(e);
      throw e;
    }
  }

  /** Reports an exception to the tracer, and returns it so that the caller
   * can throw it. */
  private <E extends RuntimeException & OptimException> E report(E e) {
    tracer.onException(e);
    return e;
  }
}

// End OptimizationSession.java
