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
package net.hydromatic.quarry.models;

import com.google.common.collect.ImmutableMap;
import java.util.Set;
import java.util.function.Supplier;
import net.hydromatic.quarry.model.Model;
import net.hydromatic.quarry.model.ModelException;

/** Built-in models, by name. */
public class ModelCatalog {
  private static final ImmutableMap<String, Supplier<Model>> MODELS =
      ImmutableMap.of(RosSecurityModel.NAME, RosSecurityModel::create);

  private ModelCatalog() {}

  /** Returns the names of the built-in models. */
  public static Set<String> names() {
    return MODELS.keySet();
  }

  /** Creates the model with a given name.
   *
   * @throws ModelException if there is no such model */
  public static Model create(String name) {
    final Supplier<Model> supplier = MODELS.get(name);
    if (supplier == null) {
      throw new ModelException("unknown model '" + name + "'; available: "
          + MODELS.keySet());
    }
    return supplier.get();
  }
}

// End ModelCatalog.java
