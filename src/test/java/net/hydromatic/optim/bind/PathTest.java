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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.core.Is.is;

import org.junit.jupiter.api.Test;

/** Tests for {@link Path}. */
public class PathTest {
  @Test
  void testToString() {
    assertThat(Path.ROOT, hasToString(""));
    assertThat(Path.ROOT.isRoot(), is(true));
    assertThat(Path.ROOT.field("legs").index(2).field("force"),
        hasToString("legs[2].force"));
    assertThat(Path.ROOT.index(0).index(1).field("x"),
        hasToString("[0][1].x"));
    assertThat(Path.ROOT.field("a").field("b").isRoot(), is(false));
  }

  @Test
  void testEquals() {
    final Path p = Path.ROOT.field("legs").index(2);
    assertThat(p, is(Path.ROOT.field("legs").index(2)));
    assertThat(p.hashCode(), is(Path.ROOT.field("legs").index(2).hashCode()));
    assertThat(p, not(is(Path.ROOT.field("legs").index(3))));
    assertThat(Path.ROOT.field("a"), not(is(Path.ROOT.index(0))));
  }
}

// End PathTest.java
