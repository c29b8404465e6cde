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
package net.hydromatic.quarry;

import static net.hydromatic.quarry.ast.AstBuilder.ast;

import net.hydromatic.quarry.ast.Ast;
import net.hydromatic.quarry.instance.AtomPool;
import net.hydromatic.quarry.instance.Instance;
import net.hydromatic.quarry.instance.RelationStore;
import net.hydromatic.quarry.instance.TupleSet;
import net.hydromatic.quarry.model.Field;
import net.hydromatic.quarry.model.Model;
import net.hydromatic.quarry.model.Multiplicity;
import net.hydromatic.quarry.model.Signature;
import net.hydromatic.quarry.scope.ScopeManager;
import net.hydromatic.quarry.scope.ScopeSpec;
import net.hydromatic.quarry.scope.ScopeTable;
import net.hydromatic.quarry.scope.Translator;
import org.apache.calcite.util.ImmutableBitSet;

/** Small models for use in tests. */
public abstract class TestModels {
  private TestModels() {}

  /**
   * Returns a model of pets.
   *
   * <pre>
   * abstract sig Animal { eats: set Food }
   * sig Dog extends Animal {}
   * sig Cat extends Animal {}
   * one sig Rex extends Dog {}
   * sig Food {}
   * </pre>
   */
  public static Model pets() {
    final Model.Builder b = Model.builder("pets");
    final Signature animal = b.abstractSig("Animal", null);
    final Signature dog = b.sig("Dog", animal);
    final Signature cat = b.sig("Cat", animal);
    final Signature rex = b.oneSig("Rex", dog);
    final Signature food = b.sig("Food");
    final Field eats = b.field(animal, "eats", Multiplicity.SET, food);
    final Ast.Variable c = ast.var("c");
    b.pred("rexIsDog", rex.expr().in(dog.expr()));
    b.pred("catsEat",
        ast.some(ast.decl(c, cat.expr()), c.join(eats.expr()).some()));
    b.pred("dogsAreCats", dog.expr().in(cat.expr()));
    b.check("RexIsDog", "rexIsDog", "3");
    b.check("DogsAreCats", "dogsAreCats", "3");
    b.run("CatsEat", "catsEat", "3");
    return b.build();
  }

  /**
   * Returns the initial store of {@link #pets()} in scope 3.
   *
   * <p>The atoms are Animal$0, Animal$1, Rex$0, Food$0, Food$1, Food$2.
   */
  public static RelationStore petsStore() {
    final Model model = pets();
    final ScopeTable scope = ScopeManager.resolve(ScopeSpec.of(3), model);
    return Translator.translate(model, scope, ast.trueFormula(), "goal")
        .store;
  }

  /**
   * Returns an instance of {@link #pets()} in scope 3.
   *
   * <pre>
   * Cat: Animal$0
   * Dog: Animal$1
   * Rex: Rex$0
   * Food: Food$0, Food$1
   * eats: Animal$0->Food$0, Rex$0->Food$1
   * </pre>
   */
  public static Instance petsInstance() {
    final RelationStore store = petsStore();
    final AtomPool pool = store.pool();
    return store.assign("Animal", atoms(pool, 0, 1, 2))
        .assign("Dog", atoms(pool, 1, 2))
        .assign("Cat", atoms(pool, 0))
        .assign("Rex", atoms(pool, 2))
        .assign("Food", atoms(pool, 3, 4))
        .assign("eats",
            TupleSet.of(pool, 2, ImmutableBitSet.of(0 * 6 + 3, 2 * 6 + 4)))
        .toInstance();
  }

  /** Creates a unary tuple set from atom indexes. */
  public static TupleSet atoms(AtomPool pool, int... atoms) {
    return TupleSet.ofAtoms(pool, ImmutableBitSet.of(atoms));
  }

  /**
   * Returns a model of acyclic linked lists.
   *
   * <pre>
   * sig Node { next: lone Node }
   * fact acyclic { no n: Node | n in n.^next }
   * </pre>
   */
  public static Model list() {
    final Model.Builder b = Model.builder("list");
    final Signature node = b.sig("Node");
    final Field next = b.field(node, "next", Multiplicity.LONE, node);
    final Ast.Variable n = ast.var("n");
    b.fact("acyclic",
        ast.no(ast.decl(n, node.expr()),
            n.in(n.join(next.expr().closure()))));
    b.pred("nonEmpty", next.expr().some());
    b.pred("cyclic",
        ast.some(ast.decl(n, node.expr()),
            n.in(n.join(next.expr().closure()))));
    b.pred("noSelfLoop",
        ast.all(ast.decl(n, node.expr()), n.in(n.join(next.expr())).not()));
    b.pred("oneHead",
        ast.lone(ast.decl(n, node.expr()), next.expr().join(n).no()));
    b.run("NonEmpty", "nonEmpty", "3");
    b.run("Cyclic", "cyclic", "3", 0);
    b.check("NoSelfLoop", "noSelfLoop", "3");
    b.check("OneHead", "oneHead", "3");
    return b.build();
  }
}

// End TestModels.java
