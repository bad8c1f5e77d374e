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

import static net.hydromatic.optim.Matchers.isSymbol;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.optim.FakeSolver;
import net.hydromatic.optim.type.DenseArray;
import net.hydromatic.optim.type.Role;
import net.hydromatic.optim.type.Struct;
import net.hydromatic.optim.type.StructType;
import org.junit.jupiter.api.Test;

/** Tests for {@link SymbolGenerator}. */
public class SymbolGeneratorTest {
  static final StructType POINT =
      StructType.builder("Point")
          .variable("position")
          .parameter("mass")
          .plain("name")
          .build();

  static final StructType LEG =
      StructType.builder("Leg").variable("force").build();

  static final StructType ROBOT =
      StructType.builder("Robot")
          .composite("base")
          .compositeList("legs")
          .parameterList("gains")
          .plain("model")
          .build();

  private final FakeSolver solver = new FakeSolver();

  private SymbolGenerator generator() {
    return new SymbolGenerator(solver, Tracers.empty());
  }

  @Test
  void testSingleVariable() {
    final StructType type = StructType.builder("A").variable("x").build();
    final Struct a = Struct.of(type, DenseArray.column(0, 0, 0));
    final Struct symbols = (Struct) generator().generate(a);
    assertThat(symbols.get("x"), isSymbol(Role.VARIABLE, 3, 1));
    assertThat(solver.log, contains("variable (3, 1)"));
  }

  @Test
  void testRolesAndPlainFields() {
    final Struct p =
        Struct.builder(POINT)
            .set("position", DenseArray.vector(1, 2, 3))
            .set("mass", DenseArray.scalar(4))
            .set("name", "tip")
            .build();
    final Struct symbols = (Struct) generator().generate(p);
    assertThat(symbols.get("position"), isSymbol(Role.VARIABLE, 3, 1));
    assertThat(symbols.get("mass"), isSymbol(Role.PARAMETER, 1, 1));
    assertThat(symbols.get("name"), is("tip"));
    assertThat(symbols.type, sameInstance(POINT));
    assertThat(solver.log, contains("variable (3, 1)", "parameter (1, 1)"));
  }

  /** A storage list yields one symbol per element, each with its own
   * shape, in order. */
  @Test
  void testStorageList() {
    final StructType type =
        StructType.builder("B").parameterList("weights").build();
    final Struct b =
        Struct.of(type,
            List.of(DenseArray.zeros(2, 1), DenseArray.zeros(2, 1),
                DenseArray.zeros(1, 4)));
    final Struct symbols = (Struct) generator().generate(b);
    final List<?> weights = (List<?>) symbols.get("weights");
    assertThat(weights, hasSize(3));
    assertThat(weights.get(0), isSymbol(Role.PARAMETER, 2, 1));
    assertThat(weights.get(1), isSymbol(Role.PARAMETER, 2, 1));
    assertThat(weights.get(2), isSymbol(Role.PARAMETER, 1, 4));
    assertThat(weights.get(0), hasToString("p0"));
    assertThat(weights.get(2), hasToString("p2"));
  }

  @Test
  void testNestedComposite() {
    final Struct robot = robot(3);
    final Struct symbols = (Struct) generator().generate(robot);
    final Struct base = (Struct) symbols.get("base");
    assertThat(base.get("position"), isSymbol(Role.VARIABLE, 3, 1));
    final List<?> legs = (List<?>) symbols.get("legs");
    assertThat(legs, hasSize(3));
    for (Object leg : legs) {
      assertThat(leg, instanceOf(Struct.class));
      assertThat(((Struct) leg).get("force"), isSymbol(Role.VARIABLE, 1, 1));
    }
    assertThat((List<?>) symbols.get("gains"), hasSize(2));
    assertThat(symbols.get("model"), is("quadruped"));
    assertThat(solver.symbols(), hasSize(1 + 1 + 3 + 2));
  }

  /** Generating symbols never modifies the declared structure. */
  @Test
  void testDoesNotMutate() {
    final Struct robot = robot(2);
    final Struct copy = robot(2);
    assertThat(robot, is(copy));
    final Object symbols = generator().generate(robot);
    assertThat(robot, is(copy));
    assertThat(symbols, instanceOf(Struct.class));
    assertThat(((Struct) robot.get("base")).get("position"),
        is(DenseArray.vector(0, 0, 0)));
  }

  @Test
  void testListInput() {
    final List<Object> input = new ArrayList<>();
    input.add(robot(1));
    input.add(List.of(robot(2), robot(0)));
    final List<?> symbols = (List<?>) generator().generate(input);
    assertThat(symbols, hasSize(2));
    final Struct first = (Struct) symbols.get(0);
    assertThat((List<?>) first.get("legs"), hasSize(1));
    final List<?> nested = (List<?>) symbols.get(1);
    assertThat((List<?>) ((Struct) nested.get(0)).get("legs"), hasSize(2));
    assertThat((List<?>) ((Struct) nested.get(1)).get("legs"), hasSize(0));
  }

  /** A composite field that is null has nothing to generate, and stays
   * null. */
  @Test
  void testNullComposite() {
    final Struct robot =
        Struct.builder(ROBOT)
            .set("gains", List.of())
            .build();
    final Struct symbols = (Struct) generator().generate(robot);
    assertThat(symbols.get("base"), nullValue());
    assertThat(symbols.get("legs"), nullValue());
    assertThat((List<?>) symbols.get("gains"), hasSize(0));
    assertThat(solver.symbols(), hasSize(0));
  }

  @Test
  void testMissingValue() {
    final Struct p = Struct.builder(POINT).set("mass", DenseArray.scalar(1))
        .build();
    final MissingValueException e =
        assertThrows(MissingValueException.class,
            () -> generator().generate(p));
    assertThat(e.path(), hasToString("position"));
    assertThat(e.getMessage(),
        is("Field position is tagged as storage, but it is null"));
  }

  @Test
  void testMissingValueInList() {
    final Struct robot =
        Struct.builder(ROBOT)
            .set("legs",
                List.of(Struct.of(LEG, DenseArray.scalar(0)),
                    Struct.of(LEG, (Object) null)))
            .set("gains", List.of())
            .build();
    final MissingValueException e =
        assertThrows(MissingValueException.class,
            () -> generator().generate(robot));
    assertThat(e.path(), hasToString("legs[1].force"));
  }

  @Test
  void testMissingStorageList() {
    final Struct robot = Struct.builder(ROBOT).build();
    final MissingValueException e =
        assertThrows(MissingValueException.class,
            () -> generator().generate(robot));
    assertThat(e.path(), hasToString("gains"));
  }

  @Test
  void testUnsupportedRank() {
    final Struct p =
        Struct.builder(POINT)
            .set("position", DenseArray.zeros(2, 2, 2))
            .set("mass", DenseArray.scalar(1))
            .build();
    final UnsupportedRankException e =
        assertThrows(UnsupportedRankException.class,
            () -> generator().generate(p));
    assertThat(e.rank, is(3));
    assertThat(e.path(), hasToString("position"));
  }

  @Test
  void testWrongKindOfValue() {
    final Struct p =
        Struct.builder(POINT)
            .set("position", List.of(DenseArray.zeros(3)))
            .set("mass", DenseArray.scalar(1))
            .build();
    assertThrows(StructureMismatchException.class,
        () -> generator().generate(p));

    final Struct p2 =
        Struct.builder(POINT)
            .set("position", "not an array")
            .set("mass", DenseArray.scalar(1))
            .build();
    assertThrows(StructureMismatchException.class,
        () -> generator().generate(p2));

    final Struct robot =
        Struct.builder(ROBOT)
            .set("base", DenseArray.zeros(3))
            .set("gains", List.of())
            .build();
    final StructureMismatchException e =
        assertThrows(StructureMismatchException.class,
            () -> generator().generate(robot));
    assertThat(e.getMessage(),
        is("Expected a record at base, but got DenseArray"));

    assertThrows(StructureMismatchException.class,
        () -> generator().generate(DenseArray.zeros(1)));
  }

  @Test
  void testTracer() {
    final List<String> events = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnSymbol(Tracers.empty(),
            (path, symbol) -> events.add(path + ": " + symbol.shape()));
    new SymbolGenerator(solver, tracer).generate(robot(2));
    assertThat(events,
        contains("base.position: (3, 1)", "base.mass: (1, 1)",
            "legs[0].force: (1, 1)", "legs[1].force: (1, 1)",
            "gains[0]: (2, 1)", "gains[1]: (2, 1)"));
  }

  /** Creates a robot with a given number of legs. */
  static Struct robot(int legCount) {
    final List<Struct> legs = new ArrayList<>();
    for (int i = 0; i < legCount; i++) {
      legs.add(Struct.of(LEG, DenseArray.scalar(0)));
    }
    return Struct.builder(ROBOT)
        .set("base",
            Struct.of(POINT, DenseArray.vector(0, 0, 0), DenseArray.scalar(1),
                "base"))
        .set("legs", legs)
        .set("gains", List.of(DenseArray.zeros(2, 1), DenseArray.zeros(2, 1)))
        .set("model", "quadruped")
        .build();
  }
}

// End SymbolGeneratorTest.java
