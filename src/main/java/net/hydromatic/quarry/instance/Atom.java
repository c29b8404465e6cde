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

import static java.util.Objects.requireNonNull;

import net.hydromatic.quarry.model.Signature;

/**
 * Indivisible, opaque individual in the universe of an analysis.
 *
 * <p>Two atoms are equal only if they are the same object. An atom's
 * {@link #signature} is the signature that it was allocated for; the
 * signature it belongs to in an instance may be a descendant.
 */
public final class Atom {
  /** Position in the {@link AtomPool}. */
  public final int index;
  public final String name;
  public final Signature signature;

  Atom(int index, String name, Signature signature) {
    this.index = index;
    this.name = requireNonNull(name, "name");
    this.signature = requireNonNull(signature, "signature");
  }

  @Override
  public String toString() {
    return name;
  }
}

// End Atom.java
