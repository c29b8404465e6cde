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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.quarry.TestModels;
import net.hydromatic.quarry.model.Model;
import net.hydromatic.quarry.model.Signature;
import net.hydromatic.quarry.scope.ScopeManager;
import net.hydromatic.quarry.scope.ScopeSpec;
import org.junit.jupiter.api.Test;

/** Tests for {@link AtomPool}. */
public class AtomPoolTest {
  private static AtomPool allocate(Model model, String scope) {
    return AtomPool.allocate(model,
        ScopeManager.resolve(ScopeSpec.parse(scope), model));
  }

  /** Tests that a sub-signature with no bound shares its parent's atoms,
   * and that a bounded sub-signature has atoms of its own. */
  @Test void testPets() {
    final Model model = TestModels.pets();
    final AtomPool pool = allocate(model, "3");
    assertThat(pool,
        hasToString("[Animal$0, Animal$1, Rex$0, Food$0, Food$1, Food$2]"));
    assertThat(pool.size(), is(6));
    final Signature animal = model.signature("Animal");
    final Signature dog = model.signature("Dog");
    final Signature cat = model.signature("Cat");
    final Signature rex = model.signature("Rex");
    final Signature food = model.signature("Food");
    assertThat(pool.upper(animal), hasToString("{0, 1, 2}"));
    assertThat(pool.upper(dog), hasToString("{0, 1, 2}"));
    assertThat(pool.upper(cat), hasToString("{0, 1}"));
    assertThat(pool.upper(rex), hasToString("{2}"));
    assertThat(pool.upper(food), hasToString("{3, 4, 5}"));
    assertThat(pool.lower(animal), hasToString("{2}"));
    assertThat(pool.lower(dog), hasToString("{2}"));
    assertThat(pool.lower(cat), hasToString("{}"));
    assertThat(pool.lower(food), hasToString("{}"));
    assertThat(pool.count(dog), is(3));
    assertThat(pool.atoms(cat), hasToString("[Animal$0, Animal$1]"));
    assertThat(pool.atom("Rex$0").index, is(2));
    assertThat(pool.atom(3).signature, is(food));
  }

  @Test void testBoundedChildren() {
    final Model model = TestModels.pets();
    final AtomPool pool = allocate(model, "4 but exactly 2 Dog, 1 Cat");
    // Animal has no unbounded child, so keeps no atoms of its own
    assertThat(pool,
        hasToString("[Dog$0, Rex$0, Cat$0, Food$0, Food$1, Food$2,"
            + " Food$3]"));
    final Signature dog = model.signature("Dog");
    assertThat(pool.upper(dog), hasToString("{0, 1}"));
    assertThat(pool.lower(dog), hasToString("{0, 1}"));
    assertThat(pool.lower(model.signature("Animal")),
        hasToString("{0, 1}"));
    assertThat(pool.upper(model.signature("Animal")),
        hasToString("{0, 1, 2}"));
  }

  @Test void testUnknownAtom() {
    final AtomPool pool = allocate(TestModels.pets(), "3");
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> pool.atom("Bird$0"));
    assertThat(e.getMessage(), is("no atom 'Bird$0'"));
  }
}

// End AtomPoolTest.java
