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

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Visitor that collects the relations that an expression or formula
 * references.
 *
 * <p>"univ" and "iden" reference every atom, and hence every top-level
 * signature; {@link #usesUniverse} records whether they occur.
 */
public class RelationFinder extends Visitor {
  public final Set<Ast.Relation> relations = new LinkedHashSet<>();
  public boolean usesUniverse;

  /** Returns a finder that has visited a node. */
  public static RelationFinder of(Ast.Node node) {
    final RelationFinder finder = new RelationFinder();
    node.accept(finder);
    return finder;
  }

  @Override
  protected void visit(Ast.Relation relation) {
    relations.add(relation);
  }

  @Override
  protected void visit(Ast.ConstantExpr constantExpr) {
    if (constantExpr.op != Op.NONE) {
      usesUniverse = true;
    }
  }
}

// End RelationFinder.java
