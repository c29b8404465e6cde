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

import static java.util.Objects.requireNonNull;

import net.hydromatic.quarry.util.QuarryException;

/**
 * The search produced an instance that does not satisfy the constraints it
 * was asked to satisfy. Indicates a bug in the engine, never in the model.
 */
public class InvariantViolationException extends RuntimeException
    implements QuarryException {
  private final String constraint;
  private final String state;

  public InvariantViolationException(String message, String constraint,
      String state) {
    super(message);
    this.constraint = requireNonNull(constraint, "constraint");
    this.state = requireNonNull(state, "state");
  }

  /** Returns the constraint that the instance violates. */
  public String constraint() {
    return constraint;
  }

  /** Returns the bounds of every relation when the violation was
   * detected. */
  public String state() {
    return state;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Internal error: ")
        .append(getMessage())
        .append(": ")
        .append(constraint)
        .append('\n')
        .append(state);
  }
}

// End InvariantViolationException.java
