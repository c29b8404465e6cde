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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.quarry.instance.Instance;
import net.hydromatic.quarry.model.Command;
import net.hydromatic.quarry.scope.ScopeTable;
import net.hydromatic.quarry.util.QuarryException;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action when a command starts,
   * then calls the underlying tracer. */
  public static Tracer withOnCommand(Tracer tracer,
      Consumer<Command> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onCommand(Command command) {
        consumer.accept(command);
        super.onCommand(command);
      }
    };
  }

  /** Returns a tracer that performs the given action on a resolved scope,
   * then calls the underlying tracer. */
  public static Tracer withOnScope(Tracer tracer,
      BiConsumer<Command, ScopeTable> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onScope(Command command, ScopeTable scope) {
        consumer.accept(command, scope);
        super.onScope(command, scope);
      }
    };
  }

  public static Tracer withOnProgress(Tracer tracer,
      Consumer<Statistics> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onProgress(Statistics statistics) {
        consumer.accept(statistics);
        super.onProgress(statistics);
      }
    };
  }

  /** Returns a tracer that performs the given action on each instance that
   * the search finds, then calls the underlying tracer. */
  public static Tracer withOnSolution(Tracer tracer,
      Consumer<Instance> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onSolution(Instance instance) {
        consumer.accept(instance);
        super.onSolution(instance);
      }
    };
  }

  public static Tracer withOnVerdict(Tracer tracer,
      Consumer<Verdict> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onVerdict(Verdict verdict) {
        consumer.accept(verdict);
        super.onVerdict(verdict);
      }
    };
  }

  public static Tracer withOnException(Tracer tracer,
      Consumer<QuarryException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public boolean onException(QuarryException e) {
        consumer.accept(e);
        super.onException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onCommand(Command command) {
    }

    @Override public void onScope(Command command, ScopeTable scope) {
    }

    @Override public void onProgress(Statistics statistics) {
    }

    @Override public void onSolution(Instance instance) {
    }

    @Override public void onVerdict(Verdict verdict) {
    }

    @Override public boolean onException(QuarryException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onCommand(Command command) {
      tracer.onCommand(command);
    }

    @Override public void onScope(Command command, ScopeTable scope) {
      tracer.onScope(command, scope);
    }

    @Override public void onProgress(Statistics statistics) {
      tracer.onProgress(statistics);
    }

    @Override public void onSolution(Instance instance) {
      tracer.onSolution(instance);
    }

    @Override public void onVerdict(Verdict verdict) {
      tracer.onVerdict(verdict);
    }

    @Override public boolean onException(QuarryException e) {
      return tracer.onException(e);
    }
  }
}

// End Tracers.java
