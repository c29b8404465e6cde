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
package net.hydromatic.quarry.solve;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.startsWith;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Budget} and {@link Prop}. */
public class BudgetTest {
  @Test void testParse() {
    assertThat(Budget.parse("1000"), hasToString("1000 nodes"));
    assertThat(Budget.parse("500ms"), hasToString("500ms"));
    assertThat(Budget.parse(" 30S "), hasToString("30000ms"));
    assertThat(Budget.parse("0"), hasToString("unlimited"));

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Budget.parse("abc"));
    assertThat(e.getMessage(),
        is("invalid budget 'abc'; expected a node count, or a duration such"
            + " as 500ms or 30s"));
    final IllegalArgumentException e2 =
        assertThrows(IllegalArgumentException.class,
            () -> Budget.parse("-5"));
    assertThat(e2.getMessage(), is("budget must not be negative"));
  }

  @Test void testExhausted() {
    final Budget nodes = Budget.ofNodes(10);
    assertThat(nodes.isExhausted(10, 1_000_000), is(false));
    assertThat(nodes.isExhausted(11, 0), is(true));

    final Budget millis = Budget.ofMillis(100);
    assertThat(millis.isExhausted(1_000_000, 100), is(false));
    assertThat(millis.isExhausted(0, 101), is(true));

    assertThat(Budget.unlimited().isExhausted(Long.MAX_VALUE, Long.MAX_VALUE),
        is(false));
  }

  @Test void testApply() {
    final Map<Prop, Object> map = new HashMap<>();
    Budget.parse("2s").apply(map);
    assertThat(Prop.TIMEOUT_MILLIS.longValue(map), is(2_000L));
    assertThat(Prop.NODE_BUDGET.longValue(map), is(0L));
    assertThat(Budget.of(map), hasToString("2000ms"));
  }

  @Test void testProp() {
    assertThat(Prop.lookup("nodeBudget"), is(Prop.NODE_BUDGET));
    assertThat(Prop.lookup("NODE_BUDGET"), is(Prop.NODE_BUDGET));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.NODE_BUDGET));

    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.PARALLELISM.intValue(map), is(1));
    assertThat(Prop.SYMMETRY_BREAKING.booleanValue(map), is(true));
    Prop.PARALLELISM.setLenient(map, " 4 ");
    Prop.SYMMETRY_BREAKING.setLenient(map, "FALSE");
    assertThat(Prop.PARALLELISM.intValue(map), is(4));
    assertThat(Prop.SYMMETRY_BREAKING.booleanValue(map), is(false));

    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.REVALIDATE.setLenient(map, "maybe"));
    assertThat(e.getMessage(),
        is("value for property revalidate must be true or false: maybe"));
    e = assertThrows(IllegalArgumentException.class,
        () -> Prop.PARALLELISM.longValue(map));
    assertThat(e.getMessage(), startsWith("invalid type"));
    e = assertThrows(IllegalArgumentException.class,
        () -> Prop.lookup("speed"));
    assertThat(e.getMessage(), is("property speed not found"));
  }
}

// End BudgetTest.java
