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
package net.hydromatic.quarry.eval;

/**
 * Truth value of a formula over a partially decided relation store.
 *
 * <p>{@link #UNKNOWN} means that the formula is true in some refinements of
 * the store and false in others; the search must decide more relations
 * before the formula's value is known. The connectives follow Kleene's
 * strong three-valued logic.
 */
public enum Truth {
  TRUE,
  FALSE,
  UNKNOWN;

  public static Truth of(boolean b) {
    return b ? TRUE : FALSE;
  }

  public Truth not() {
    switch (this) {
      case TRUE:
        return FALSE;
      case FALSE:
        return TRUE;
      default:
        return UNKNOWN;
    }
  }

  public Truth and(Truth t) {
    if (this == FALSE || t == FALSE) {
      return FALSE;
    }
    if (this == TRUE && t == TRUE) {
      return TRUE;
    }
    return UNKNOWN;
  }

  public Truth or(Truth t) {
    if (this == TRUE || t == TRUE) {
      return TRUE;
    }
    if (this == FALSE && t == FALSE) {
      return FALSE;
    }
    return UNKNOWN;
  }

  public Truth implies(Truth t) {
    return not().or(t);
  }

  public Truth iff(Truth t) {
    if (this == UNKNOWN || t == UNKNOWN) {
      return UNKNOWN;
    }
    return of(this == t);
  }
}

// End Truth.java
