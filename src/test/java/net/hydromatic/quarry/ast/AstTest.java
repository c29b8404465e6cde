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
package net.hydromatic.quarry.ast;

import static net.hydromatic.quarry.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.quarry.model.ModelException;
import org.junit.jupiter.api.Test;

/** Tests for {@link Ast} and {@link AstBuilder}. */
public class AstTest {
  private final Ast.Relation a = ast.relation("a", 1);
  private final Ast.Relation b = ast.relation("b", 1);
  private final Ast.Relation c = ast.relation("c", 1);
  private final Ast.Relation r = ast.relation("r", 2);
  private final Ast.Relation s = ast.relation("s", 2);

  /** Tests that expressions are printed with only the parentheses that
   * precedence requires. */
  @Test void testUnparseExpr() {
    assertThat(a.join(r), hasToString("a.r"));
    assertThat(a.union(b).union(c), hasToString("a + b + c"));
    assertThat(a.union(b.union(c)), hasToString("a + (b + c)"));
    assertThat(a.union(b).intersection(c), hasToString("(a + b) & c"));
    assertThat(a.union(b.intersection(c)), hasToString("a + b & c"));
    assertThat(a.union(b).join(r), hasToString("(a + b).r"));
    assertThat(a.join(r.union(s)), hasToString("a.(r + s)"));
    assertThat(a.product(b), hasToString("a->b"));
    assertThat(r.transpose(), hasToString("~r"));
    assertThat(r.join(s).closure(), hasToString("^(r.s)"));
    assertThat(r.closure().join(s), hasToString("^r.s"));
    assertThat(r.domainRestrict(a), hasToString("a <: r"));
    assertThat(r.rangeRestrict(b), hasToString("r :> b"));
    assertThat(ast.univ().difference(a), hasToString("univ - a"));
    assertThat(ast.none(2), hasToString("none"));
  }

  @Test void testUnparseFormula() {
    final Ast.Formula p = a.in(b);
    final Ast.Formula q = b.in(c);
    final Ast.Formula f = a.eq(c);
    assertThat(p.and(q), hasToString("a in b && b in c"));
    assertThat(p.and(q).or(f), hasToString("a in b && b in c || a = c"));
    assertThat(p.or(q).and(f), hasToString("(a in b || b in c) && a = c"));
    assertThat(p.and(q).not(), hasToString("!(a in b && b in c)"));
    assertThat(p.implies(q).implies(f),
        hasToString("(a in b => b in c) => a = c"));
    assertThat(p.implies(q.implies(f)),
        hasToString("a in b => b in c => a = c"));
    assertThat(p.iff(q), hasToString("a in b <=> b in c"));
    assertThat(a.join(r).some(), hasToString("some a.r"));
    assertThat(ast.trueFormula(), hasToString("true"));
    assertThat(ast.falseFormula(), hasToString("false"));
  }

  @Test void testUnparseQuantified() {
    final Ast.Variable x = ast.var("x");
    final Ast.Variable y = ast.var("y");
    final Ast.Formula all =
        ast.all(ast.decl(x, a), ast.decl(y, x.join(r)), y.in(b));
    assertThat(all, hasToString("all x: a, y: x.r | y in b"));
    assertThat(all.and(a.no()),
        hasToString("(all x: a, y: x.r | y in b) && no a"));
    assertThat(ast.predCall("p", ImmutableList.of(a, x)),
        hasToString("p[a, x]"));
    assertThat(ast.funCall("f", 2, ImmutableList.of(a)).join(b),
        hasToString("f[a].b"));
  }

  /** Tests that nested conjunctions are flattened. */
  @Test void testFlatten() {
    final Ast.Formula p = a.in(b);
    final Ast.Formula q = b.in(c);
    final Ast.Formula f = ast.and(p.and(q), a.some(), ast.trueFormula());
    assertThat(((Ast.NaryFormula) f).formulas, hasSize(3));
    assertThat(f, hasToString("a in b && b in c && some a"));
    final Ast.Formula g = ast.or(p.or(q), p.and(q));
    assertThat(((Ast.NaryFormula) g).formulas, hasSize(3));
  }

  @Test void testArity() {
    assertThat(a.product(r).arity, is(3));
    assertThat(a.product(r).join(r).arity, is(3));
    assertThat(a.join(r).arity, is(1));
    assertThat(r.join(s).arity, is(2));
    assertThat(ast.iden().arity, is(2));
  }

  @Test void testArityErrors() {
    ModelException e = assertThrows(ModelException.class, () -> a.join(b));
    assertThat(e.getMessage(), is("join of 'a' and 'b' has arity 0"));

    e = assertThrows(ModelException.class, () -> a.union(r));
    assertThat(e.getMessage(),
        is("arity mismatch in '+': 'a' has arity 1, 'r' has arity 2"));

    e = assertThrows(ModelException.class, () -> a.in(r));
    assertThat(e.getMessage(),
        is("arity mismatch in 'in': 'a' has arity 1, 'r' has arity 2"));

    e = assertThrows(ModelException.class, () -> a.closure());
    assertThat(e.getMessage(),
        is("closure requires a binary relation, but 'a' has arity 1"));

    e = assertThrows(ModelException.class,
        () -> ast.decl(ast.var("x"), r));
    assertThat(e.getMessage(),
        is("declaration of 'x' requires a set, but 'r' has arity 2"));

    e = assertThrows(ModelException.class, () -> r.domainRestrict(s));
    assertThat(e.getMessage(),
        is("domain restriction requires a set, but 's' has arity 2"));

    assertThrows(IllegalArgumentException.class,
        () -> ast.relation("z", 0));
    assertThrows(IllegalArgumentException.class,
        () -> ast.multiplicity(Quantifier.ALL, a));
  }

  @Test void testRelationFinder() {
    final Ast.Variable x = ast.var("x");
    final Ast.Formula f =
        ast.all(ast.decl(x, b), x.join(r).in(c).or(a.no()));
    final RelationFinder finder = RelationFinder.of(f);
    assertThat(finder.relations, contains(b, r, c, a));
    assertThat(finder.usesUniverse, is(false));

    assertThat(RelationFinder.of(a.in(ast.univ())).usesUniverse, is(true));
    assertThat(RelationFinder.of(a.in(ast.none(1))).usesUniverse, is(false));
  }
}

// End AstTest.java
