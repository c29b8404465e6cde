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

import net.hydromatic.quarry.instance.TupleSet;
import net.hydromatic.quarry.solve.Verdict;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

/** Matchers for use in Quarry tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches a verdict by kind. */
  public static Matcher<Verdict> isVerdict(Verdict.Kind kind) {
    return new TypeSafeMatcher<Verdict>() {
      @Override protected boolean matchesSafely(Verdict verdict) {
        return verdict.kind == kind;
      }

      @Override public void describeTo(Description description) {
        description.appendText("verdict " + kind);
      }

      @Override protected void describeMismatchSafely(Verdict verdict,
          Description description) {
        description.appendText("was " + verdict);
      }
    };
  }

  /** Matches a tuple set by its string representation, for example
   * "{Node$1->Node$0, Node$2->Node$1}". */
  public static Matcher<TupleSet> isTuples(String expected) {
    return new CustomTypeSafeMatcher<TupleSet>("tuples " + expected) {
      @Override protected boolean matchesSafely(TupleSet tupleSet) {
        return tupleSet.toString().equals(expected);
      }
    };
  }
}

// End Matchers.java
