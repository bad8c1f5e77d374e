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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import net.hydromatic.optim.solver.Symbol;
import net.hydromatic.optim.type.DenseArray;
import net.hydromatic.optim.util.OptimException;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action when a symbol is
   * created, then calls the underlying tracer. */
  public static Tracer withOnSymbol(Tracer tracer,
      BiConsumer<Path, Symbol> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onSymbol(Path path, Symbol symbol) {
        consumer.accept(path, symbol);
        super.onSymbol(path, symbol);
      }
    };
  }

  /** Returns a tracer that performs the given action when a guess is
   * assigned, then calls the underlying tracer. */
  public static Tracer withOnGuess(Tracer tracer,
      BiConsumer<Path, DenseArray> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onGuess(Path path, Symbol symbol,
          DenseArray value) {
        consumer.accept(path, value);
        super.onGuess(path, symbol, value);
      }
    };
  }

  /** Returns a tracer that performs the given action when a value is read
   * back, then calls the underlying tracer. */
  public static Tracer withOnValue(Tracer tracer,
      BiConsumer<Path, DenseArray> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onValue(Path path, DenseArray value) {
        consumer.accept(path, value);
        super.onValue(path, value);
      }
    };
  }

  public static Tracer withOnSolve(Tracer tracer, DoubleConsumer consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onSolve(double cost) {
        consumer.accept(cost);
        super.onSolve(cost);
      }
    };
  }

  public static Tracer withOnException(Tracer tracer,
      Consumer<OptimException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onException(OptimException e) {
        consumer.accept(e);
        super.onException(e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onSymbol(Path path, Symbol symbol) {
    }

    @Override public void onGuess(Path path, Symbol symbol,
        DenseArray value) {
    }

    @Override public void onValue(Path path, DenseArray value) {
    }

    @Override public void onSolve(double cost) {
    }

    @Override public void onException(OptimException e) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onSymbol(Path path, Symbol symbol) {
      tracer.onSymbol(path, symbol);
    }

    @Override public void onGuess(Path path, Symbol symbol,
        DenseArray value) {
      tracer.onGuess(path, symbol, value);
    }

    @Override public void onValue(Path path, DenseArray value) {
      tracer.onValue(path, value);
    }

    @Override public void onSolve(double cost) {
      tracer.onSolve(cost);
    }

    @Override public void onException(OptimException e) {
      tracer.onException(e);
    }
  }
}

// End Tracers.java
