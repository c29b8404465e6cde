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

/** Counters of a search. */
public class Statistics {
  /** Number of choices applied. */
  public final long nodes;
  /** Number of choices that contradicted a constraint. */
  public final long backtracks;
  public final long elapsedMillis;

  public Statistics(long nodes, long backtracks, long elapsedMillis) {
    this.nodes = nodes;
    this.backtracks = backtracks;
    this.elapsedMillis = elapsedMillis;
  }

  @Override
  public String toString() {
    return "nodes=" + nodes + ", backtracks=" + backtracks
        + ", time=" + elapsedMillis + "ms";
  }
}

// End Statistics.java
