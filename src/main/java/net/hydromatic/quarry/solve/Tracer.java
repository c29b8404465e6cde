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

import net.hydromatic.quarry.instance.Instance;
import net.hydromatic.quarry.model.Command;
import net.hydromatic.quarry.scope.ScopeTable;
import net.hydromatic.quarry.util.QuarryException;

/** Called on various events during the analysis of a model. */
public interface Tracer {
  /** Called when a command starts. */
  void onCommand(Command command);

  /** Called when the scope of a command has been resolved. */
  void onScope(Command command, ScopeTable scope);

  /** Called every few thousand search nodes. May be called from a worker
   * thread. */
  void onProgress(Statistics statistics);

  /** Called when the search finds an instance. */
  void onSolution(Instance instance);

  /** Called when a command has finished. */
  void onVerdict(Verdict verdict);

  /**
   * Called with the exception thrown while analyzing a command. Returns
   * whether a handler was found.
   */
  boolean onException(QuarryException e);
}

// End Tracer.java
