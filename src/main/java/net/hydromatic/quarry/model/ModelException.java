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
package net.hydromatic.quarry.model;

import net.hydromatic.quarry.util.QuarryException;

/**
 * A model is malformed: an arity mismatch, an undeclared relation, an unknown
 * or recursive predicate, or a tuple whose atoms are outside its relation's
 * signatures.
 */
public class ModelException extends RuntimeException
    implements QuarryException {
  public ModelException(String message) {
    super(message);
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Model error: ").append(getMessage());
  }
}

// End ModelException.java
