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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;

/**
 * Partial knowledge of a relation's value: the tuples that are definitely in
 * it ({@link #lower}) and the tuples that may be in it ({@link #upper}).
 *
 * <p>The operations combine bounds so that, for any values of the operands
 * within their bounds, the value of the result is within the result's bound.
 * When both operands are exact, so is the result.
 */
public final class Bound {
  public final TupleSet lower;
  public final TupleSet upper;

  private Bound(TupleSet lower, TupleSet upper) {
    this.lower = requireNonNull(lower, "lower");
    this.upper = requireNonNull(upper, "upper");
  }

  /** Creates a bound; {@code lower} must be a subset of {@code upper}. */
  public static Bound of(TupleSet lower, TupleSet upper) {
    checkArgument(upper.containsAll(lower),
        "lower bound %s is not within upper bound %s", lower, upper);
    return new Bound(lower, upper);
  }

  /** Creates a bound whose value is known. */
  public static Bound exact(TupleSet value) {
    return new Bound(value, value);
  }

  @Override
  public String toString() {
    return isExact() ? lower.toString() : "[" + lower + ", " + upper + "]";
  }

  @Override
  public int hashCode() {
    return Objects.hash(lower, upper);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Bound
            && lower.equals(((Bound) o).lower)
            && upper.equals(((Bound) o).upper);
  }

  public int arity() {
    return lower.arity;
  }

  /** Returns whether the value is known. */
  public boolean isExact() {
    return lower == upper || lower.equals(upper);
  }

  public Bound union(Bound b) {
    return new Bound(lower.union(b.lower), upper.union(b.upper));
  }

  public Bound intersection(Bound b) {
    return new Bound(lower.intersection(b.lower),
        upper.intersection(b.upper));
  }

  /** Returns the difference; a tuple is definitely in "a - b" only if it is
   * definitely in a and cannot be in b. */
  public Bound difference(Bound b) {
    return new Bound(lower.difference(b.upper), upper.difference(b.lower));
  }

  public Bound join(Bound b) {
    return new Bound(lower.join(b.lower), upper.join(b.upper));
  }

  public Bound product(Bound b) {
    return new Bound(lower.product(b.lower), upper.product(b.upper));
  }

  public Bound transpose() {
    return new Bound(lower.transpose(), upper.transpose());
  }

  public Bound closure() {
    return new Bound(lower.closure(), upper.closure());
  }

  /** Returns "s &lt;: this". */
  public Bound domainRestrict(Bound s) {
    return new Bound(lower.domainRestrict(s.lower),
        upper.domainRestrict(s.upper));
  }

  /** Returns "this :&gt; s". */
  public Bound rangeRestrict(Bound s) {
    return new Bound(lower.rangeRestrict(s.lower),
        upper.rangeRestrict(s.upper));
  }

  /** Returns this bound with two atoms exchanged. */
  public Bound swap(int a, int b) {
    return new Bound(lower.swap(a, b), upper.swap(a, b));
  }
}

// End Bound.java
