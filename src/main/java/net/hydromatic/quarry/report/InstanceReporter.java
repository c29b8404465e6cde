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
package net.hydromatic.quarry.report;

import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.quarry.instance.Atom;
import net.hydromatic.quarry.instance.Instance;
import net.hydromatic.quarry.instance.Tuple;
import net.hydromatic.quarry.instance.TupleSet;
import net.hydromatic.quarry.model.Field;
import net.hydromatic.quarry.model.Model;
import net.hydromatic.quarry.model.Signature;
import net.hydromatic.quarry.solve.Prop;
import net.hydromatic.quarry.solve.Verdict;

/**
 * Renders verdicts and instances as text.
 *
 * <p>An instance is rendered as its atoms, grouped by most specific
 * signature; then the tuples of each field, grouped by owner signature;
 * then, for each ordered signature, a trace that lists, at each step, the
 * atoms that fields whose last column is that signature relate to the
 * step.
 *
 * <p>For example,
 *
 * <pre>{@code
 * Trace of Time:
 *   Time$0: at: Publish$0 (topic=CmdVel$0, message=Data$0, caller=Joystick$0)
 *   Time$1: at: Callback$0 (topic=CmdVel$0, message=Data$0, callee=Wheel$0)
 *   Time$2: history: Wheel$0->Data$0
 * }</pre>
 */
public class InstanceReporter {
  private static final Joiner COMMA = Joiner.on(", ");

  private final int traceLength;

  public InstanceReporter(Map<Prop, Object> props) {
    this.traceLength = Prop.TRACE_LENGTH.intValue(props);
  }

  /** Renders a verdict, and its instance if it has one. */
  public String report(Verdict verdict) {
    final StringBuilder b = new StringBuilder();
    b.append("Command ").append(verdict.command).append('\n')
        .append("Verdict: ").append(verdict.kind).append('\n')
        .append("  ").append(verdict.message).append('\n')
        .append("Scope: ").append(verdict.scope).append('\n')
        .append("Statistics: ").append(verdict.statistics).append('\n');
    if (!verdict.witnesses.isEmpty()) {
      b.append("Witnesses:\n");
      for (List<Atom> witness : verdict.witnesses) {
        b.append("  ").append(witness).append('\n');
      }
    }
    if (verdict.instance != null) {
      describe(b, verdict.instance);
    }
    return b.toString();
  }

  /** Renders an instance. */
  public String describe(Instance instance) {
    return describe(new StringBuilder(), instance).toString();
  }

  private StringBuilder describe(StringBuilder b, Instance instance) {
    final Model model = instance.model();
    b.append("Atoms:\n");
    for (Signature signature : model.signatures) {
      final List<Atom> atoms = new ArrayList<>();
      for (Atom atom : instance.atoms(signature)) {
        if (instance.signatureOf(atom) == signature) {
          atoms.add(atom);
        }
      }
      if (!atoms.isEmpty()) {
        b.append("  ").append(signature.name).append(": ");
        COMMA.appendTo(b, atoms);
        b.append('\n');
      }
    }
    b.append("Fields:\n");
    Signature owner = null;
    for (Field field : model.fields) {
      if (field.owner != owner) {
        owner = field.owner;
        b.append("  ").append(owner.name).append('\n');
      }
      b.append("    ").append(field.name).append(": ");
      final TupleSet tuples = instance.tuples(field.relation);
      if (tuples.isEmpty()) {
        b.append("{}");
      } else {
        COMMA.appendTo(b, tuples);
      }
      b.append('\n');
    }
    for (Signature signature : model.orderings.keySet()) {
      trace(b, instance, signature);
    }
    return b;
  }

  private void trace(StringBuilder b, Instance instance,
      Signature signature) {
    final Model model = instance.model();
    b.append("Trace of ").append(signature.name).append(":\n");
    int steps = 0;
    for (Atom step : instance.atoms(signature)) {
      if (traceLength >= 0 && steps++ >= traceLength) {
        b.append("  ...\n");
        break;
      }
      b.append("  ").append(step);
      boolean first = true;
      for (Field field : model.fields) {
        if (field.target() != signature) {
          continue;
        }
        final List<Tuple> prefixes = new ArrayList<>();
        for (Tuple tuple : instance.tuples(field.relation)) {
          if (tuple.atom(tuple.arity() - 1) == step) {
            prefixes.add(Tuple.of(tuple.atoms.subList(0, tuple.arity() - 1)));
          }
        }
        if (prefixes.isEmpty()) {
          continue;
        }
        b.append(first ? ": " : "; ").append(field.name).append(": ");
        first = false;
        for (int i = 0; i < prefixes.size(); i++) {
          if (i > 0) {
            b.append(", ");
          }
          final Tuple prefix = prefixes.get(i);
          b.append(prefix);
          if (prefix.arity() == 1) {
            attributes(b, instance, prefix.atom(0));
          }
        }
      }
      b.append('\n');
    }
  }

  /** Appends the values of the binary fields of an atom whose target is
   * not ordered, such as "(topic=CmdVel$0, message=Data$1)". */
  private static void attributes(StringBuilder b, Instance instance,
      Atom atom) {
    final Model model = instance.model();
    final int start = b.length();
    for (Field field : model.fields) {
      if (field.arity() != 2 || model.ordering(field.target()) != null) {
        continue;
      }
      final List<Atom> values = new ArrayList<>();
      for (Tuple tuple : instance.tuples(field.relation)) {
        if (tuple.atom(0) == atom) {
          values.add(tuple.atom(1));
        }
      }
      if (values.isEmpty()) {
        continue;
      }
      b.append(b.length() == start ? " (" : ", ")
          .append(field.name).append('=');
      if (values.size() == 1) {
        b.append(values.get(0));
      } else {
        b.append('{');
        COMMA.appendTo(b, values);
        b.append('}');
      }
    }
    if (b.length() > start) {
      b.append(')');
    }
  }
}

// End InstanceReporter.java
