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
package net.hydromatic.quarry.instance;

import static net.hydromatic.quarry.Matchers.isTuples;
import static net.hydromatic.quarry.TestModels.atoms;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import net.hydromatic.quarry.TestModels;
import net.hydromatic.quarry.scope.ScopeException;
import org.junit.jupiter.api.Test;

/** Tests for {@link TupleSet} and {@link Bound}. */
public class TupleSetTest {
  private final AtomPool pool = TestModels.petsStore().pool();

  /** Returns "{Animal$0->Food$0, Rex$0->Food$1, Rex$0->Food$2}". */
  private TupleSet eats() {
    return TupleSet.of(pool, 2,
        Arrays.asList(tuple("Animal$0", "Food$0"), tuple("Rex$0", "Food$1"),
            tuple("Rex$0", "Food$2")));
  }

  private Tuple tuple(String... names) {
    final Atom[] atoms = new Atom[names.length];
    for (int i = 0; i < names.length; i++) {
      atoms[i] = pool.atom(names[i]);
    }
    return Tuple.of(atoms);
  }

  @Test void testIndex() {
    final TupleSet eats = eats();
    assertThat(eats,
        isTuples("{Animal$0->Food$0, Rex$0->Food$1, Rex$0->Food$2}"));
    assertThat(eats.size(), is(3));
    assertThat(eats.bits(), hasToString("{3, 16, 17}"));
    assertThat(eats.index(2, 4), is(16));
    assertThat(eats.atoms(17)[1], is(5));
    assertThat(eats.tuple(16), hasToString("Rex$0->Food$1"));
    assertThat(eats.contains(tuple("Rex$0", "Food$2")), is(true));
    assertThat(eats.contains(tuple("Animal$1", "Food$2")), is(false));
    assertThat(eats.column(0), hasToString("{0, 2}"));
    assertThat(eats.column(1), hasToString("{3, 4, 5}"));
  }

  @Test void testSetOperations() {
    final TupleSet a = atoms(pool, 0, 1);
    final TupleSet b = atoms(pool, 1, 2);
    assertThat(a.union(b), isTuples("{Animal$0, Animal$1, Rex$0}"));
    assertThat(a.intersection(b), isTuples("{Animal$1}"));
    assertThat(a.difference(b), isTuples("{Animal$0}"));
    assertThat(a.containsAll(a.intersection(b)), is(true));
    assertThat(a.containsAll(b), is(false));
    assertThat(TupleSet.empty(pool, 1), isTuples("{}"));

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> a.union(eats()));
    assertThat(e.getMessage(), is("arity mismatch: 1 vs 2"));
  }

  @Test void testRelationalOperations() {
    final TupleSet eats = eats();
    final TupleSet rex = atoms(pool, 2);
    assertThat(rex.join(eats), isTuples("{Food$1, Food$2}"));
    assertThat(eats.join(atoms(pool, 3, 4)), isTuples("{Animal$0, Rex$0}"));
    assertThat(eats.transpose(),
        isTuples("{Food$0->Animal$0, Food$1->Rex$0, Food$2->Rex$0}"));
    assertThat(eats.domainRestrict(atoms(pool, 0, 1)),
        isTuples("{Animal$0->Food$0}"));
    assertThat(eats.rangeRestrict(atoms(pool, 4)),
        isTuples("{Rex$0->Food$1}"));
    assertThat(atoms(pool, 1).product(atoms(pool, 5)),
        isTuples("{Animal$1->Food$2}"));
    assertThat(eats.product(rex).arity, is(3));
    assertThat(TupleSet.iden(atoms(pool, 0, 1)),
        isTuples("{Animal$0->Animal$0, Animal$1->Animal$1}"));
  }

  @Test void testClosure() {
    final TupleSet chain =
        TupleSet.of(pool, 2,
            Arrays.asList(tuple("Animal$0", "Animal$1"),
                tuple("Animal$1", "Rex$0")));
    assertThat(chain.closure(),
        isTuples("{Animal$0->Animal$1, Animal$0->Rex$0,"
            + " Animal$1->Rex$0}"));
    final TupleSet cycle = chain.union(
        TupleSet.of(pool, 2, Arrays.asList(tuple("Rex$0", "Animal$0"))));
    assertThat(cycle.closure().size(), is(9));
  }

  /** Tests that exchanging two atoms renames them in every column. */
  @Test void testSwap() {
    final TupleSet eats = eats();
    assertThat(eats.swap(0, 1),
        isTuples("{Animal$1->Food$0, Rex$0->Food$1, Rex$0->Food$2}"));
    assertThat(eats.swap(4, 5), is(eats));
    assertThat(eats.swap(3, 4),
        isTuples("{Animal$0->Food$1, Rex$0->Food$0, Rex$0->Food$2}"));
  }

  @Test void testCapacity() {
    assertThat(TupleSet.checkCapacity(pool, 3), is(216));
    final ScopeException e = assertThrows(ScopeException.class,
        () -> TupleSet.checkCapacity(pool, 12));
    assertThat(e.getMessage(),
        is("universe of 6 atoms is too large for relations of arity 12"));
  }

  /** Tests that operations on bounds keep every possible value within the
   * result. */
  @Test void testBound() {
    final Bound animals = Bound.of(atoms(pool, 2), atoms(pool, 0, 1, 2));
    final Bound cats = Bound.of(TupleSet.empty(pool, 1), atoms(pool, 0, 1));
    assertThat(animals.isExact(), is(false));
    assertThat(animals, hasToString("[{Rex$0}, {Animal$0, Animal$1, Rex$0}]"));
    assertThat(animals.difference(cats),
        hasToString("[{Rex$0}, {Animal$0, Animal$1, Rex$0}]"));
    assertThat(animals.intersection(cats),
        hasToString("[{}, {Animal$0, Animal$1}]"));
    assertThat(Bound.exact(atoms(pool, 3)), hasToString("{Food$0}"));
    assertThat(Bound.exact(atoms(pool, 3)).isExact(), is(true));
    assertThat(animals.swap(1, 2),
        hasToString("[{Animal$1}, {Animal$0, Animal$1, Rex$0}]"));

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Bound.of(atoms(pool, 3), atoms(pool, 4)));
    assertThat(e.getMessage(),
        is("lower bound {Food$0} is not within upper bound {Food$1}"));
  }
}

// End TupleSetTest.java
