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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.quarry.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.quarry.ast.Ast;
import net.hydromatic.quarry.ast.Quantifier;
import net.hydromatic.quarry.scope.ScopeSpec;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Abstract model: signatures, fields, facts, predicates, functions and
 * commands.
 *
 * <p>A model is immutable, and is created using a {@link Builder}, which
 * validates it.
 */
public class Model {
  public final String name;
  /** Signatures, in declaration order; a parent precedes its children. */
  public final ImmutableList<Signature> signatures;
  /** Fields, in declaration order. */
  public final ImmutableList<Field> fields;
  public final ImmutableMap<Signature, Ordering> orderings;
  public final ImmutableMap<String, Ast.Formula> facts;
  public final ImmutableMap<String, Predicate> predicates;
  public final ImmutableMap<String, Function> functions;
  public final ImmutableMap<String, Command> commands;

  /** Every relation, with its column signatures: signature extents first,
   * then fields, then ordering relations. */
  private final ImmutableMap<Ast.Relation, ImmutableList<Signature>> columns;
  private final ImmutableMap<String, Ast.Relation> relationsByName;

  private Model(String name, ImmutableList<Signature> signatures,
      ImmutableList<Field> fields, ImmutableMap<Signature, Ordering> orderings,
      ImmutableMap<String, Ast.Formula> facts,
      ImmutableMap<String, Predicate> predicates,
      ImmutableMap<String, Function> functions,
      ImmutableMap<String, Command> commands) {
    this.name = requireNonNull(name, "name");
    this.signatures = requireNonNull(signatures, "signatures");
    this.fields = requireNonNull(fields, "fields");
    this.orderings = requireNonNull(orderings, "orderings");
    this.facts = requireNonNull(facts, "facts");
    this.predicates = requireNonNull(predicates, "predicates");
    this.functions = requireNonNull(functions, "functions");
    this.commands = requireNonNull(commands, "commands");

    final ImmutableMap.Builder<Ast.Relation, ImmutableList<Signature>> b =
        ImmutableMap.builder();
    signatures.forEach(s -> b.put(s.relation, ImmutableList.of(s)));
    fields.forEach(f -> b.put(f.relation, f.columns));
    orderings.values().forEach(o -> {
      b.put(o.first, ImmutableList.of(o.signature));
      b.put(o.last, ImmutableList.of(o.signature));
      b.put(o.next, ImmutableList.of(o.signature, o.signature));
      b.put(o.nexts, ImmutableList.of(o.signature, o.signature));
    });
    this.columns = b.build();
    final ImmutableMap.Builder<String, Ast.Relation> b2 =
        ImmutableMap.builder();
    columns.keySet().forEach(r -> b2.put(r.name, r));
    this.relationsByName = b2.build();
  }

  /** Creates a builder. */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  @Override
  public String toString() {
    return name;
  }

  /** Returns every relation, in the order: signature extents, fields,
   * ordering relations. */
  public ImmutableList<Ast.Relation> relations() {
    return columns.keySet().asList();
  }

  /** Looks up a relation by name; throws if not found. */
  public Ast.Relation relation(String name) {
    final Ast.Relation relation = relationsByName.get(name);
    if (relation == null) {
      throw new ModelException("relation '" + name
          + "' is not declared in model '" + this.name + "'");
    }
    return relation;
  }

  /** Returns the column signatures of a relation; throws if the relation is
   * not in this model. */
  public ImmutableList<Signature> columns(Ast.Relation relation) {
    final ImmutableList<Signature> list = columns.get(relation);
    if (list == null) {
      throw new ModelException("relation '" + relation.name
          + "' is not declared in model '" + name + "'");
    }
    return list;
  }

  /** Returns the column signatures of a relation, or null. */
  @Nullable ImmutableList<Signature> columnsOpt(Ast.Relation relation) {
    return columns.get(relation);
  }

  /** Looks up a signature by name; throws if not found. */
  public Signature signature(String name) {
    for (Signature signature : signatures) {
      if (signature.name.equals(name)) {
        return signature;
      }
    }
    throw new ModelException("signature '" + name
        + "' is not declared in model '" + this.name + "'");
  }

  /** Returns the signature whose extent is a given relation, or null. */
  public @Nullable Signature signatureOf(Ast.Relation relation) {
    for (Signature signature : signatures) {
      if (signature.relation == relation) {
        return signature;
      }
    }
    return null;
  }

  /** Returns the field that is a given relation, or null. */
  public @Nullable Field fieldOf(Ast.Relation relation) {
    for (Field field : fields) {
      if (field.relation == relation) {
        return field;
      }
    }
    return null;
  }

  /** Returns the signatures that have no parent. */
  public List<Signature> topLevelSignatures() {
    final List<Signature> list = new ArrayList<>();
    signatures.forEach(s -> {
      if (s.isTopLevel()) {
        list.add(s);
      }
    });
    return list;
  }

  /** Returns the direct children of a signature, in declaration order. */
  public List<Signature> children(Signature parent) {
    final List<Signature> list = new ArrayList<>();
    signatures.forEach(s -> {
      if (s.parent == parent) {
        list.add(s);
      }
    });
    return list;
  }

  /** Returns the ordering of a signature, or null. */
  public @Nullable Ordering ordering(Signature signature) {
    return orderings.get(signature);
  }

  /** Looks up a command by name; throws if not found. */
  public Command command(String name) {
    final Command command = commands.get(name);
    if (command == null) {
      throw new ModelException("command '" + name
          + "' is not declared in model '" + this.name + "'");
    }
    return command;
  }

  /** Returns a formula with every predicate and function call inlined. */
  public Ast.Formula expand(Ast.Formula formula) {
    return Expander.create(this).expand(formula);
  }

  /**
   * Returns the formula that a command analyzes, expanded.
   *
   * <p>For "run", parameters of the predicate are existentially
   * quantified.
   */
  public Ast.Formula goal(Command command) {
    final Predicate predicate = predicates.get(command.target);
    if (predicate == null) {
      throw new ModelException("command '" + command.name
          + "' refers to unknown predicate '" + command.target + "'");
    }
    if (predicate.params.isEmpty()) {
      return expand(predicate.body);
    }
    return expand(
        ast.quantified(Quantifier.SOME, predicate.params, predicate.body));
  }

  /** Builder for a {@link Model}. */
  public static class Builder {
    private final String name;
    private final List<Signature> signatures = new ArrayList<>();
    private final List<Field> fields = new ArrayList<>();
    private final Map<Signature, Ordering> orderings = new LinkedHashMap<>();
    private final Map<String, Ast.Formula> facts = new LinkedHashMap<>();
    private final Map<String, Predicate> predicates = new LinkedHashMap<>();
    private final Map<String, Function> functions = new LinkedHashMap<>();
    private final Map<String, Command> commands = new LinkedHashMap<>();
    private final Map<String, Object> relationNames = new LinkedHashMap<>();

    Builder(String name) {
      this.name = requireNonNull(name, "name");
    }

    /** Declares a top-level signature. */
    public Signature sig(String name) {
      return sig(name, null, false, Multiplicity.SET);
    }

    /** Declares a signature that extends {@code parent}. */
    public Signature sig(String name, Signature parent) {
      return sig(name, parent, false, Multiplicity.SET);
    }

    /** Declares an abstract signature. */
    public Signature abstractSig(String name, @Nullable Signature parent) {
      return sig(name, parent, true, Multiplicity.SET);
    }

    /** Declares a signature that has exactly one atom. */
    public Signature oneSig(String name, @Nullable Signature parent) {
      return sig(name, parent, false, Multiplicity.ONE);
    }

    /** Declares a signature. */
    public Signature sig(String name, @Nullable Signature parent,
        boolean isAbstract, Multiplicity multiplicity) {
      if (parent != null && !signatures.contains(parent)) {
        throw new ModelException("parent '" + parent + "' of signature '"
            + name + "' is not declared in model '" + this.name + "'");
      }
      claim(name, "signature");
      final Signature signature =
          new Signature(name, parent, isAbstract, multiplicity,
              ast.relation(name, 1), signatures.size());
      signatures.add(signature);
      return signature;
    }

    /** Declares that a signature is totally ordered, and returns its
     * ordering relations. */
    public Ordering ordered(Signature signature) {
      checkDeclared(signature);
      if (!signature.isTopLevel() || signature.isAbstract) {
        throw new ModelException("ordered signature '" + signature
            + "' must be top-level and not abstract");
      }
      if (orderings.containsKey(signature)) {
        throw new ModelException("signature '" + signature
            + "' is already ordered");
      }
      final String n = signature.name;
      final Ordering ordering =
          new Ordering(signature, ast.relation(n + "/first", 1),
              ast.relation(n + "/last", 1), ast.relation(n + "/next", 2),
              ast.relation(n + "/nexts", 2));
      ordering.relations().forEach(r -> claim(r.name, "relation"));
      orderings.put(signature, ordering);
      return ordering;
    }

    /** Declares a field of a signature. */
    public Field field(Signature owner, String name,
        Multiplicity multiplicity, Signature... columns) {
      checkArgument(columns.length > 0, "field must have a column");
      if (multiplicity == Multiplicity.SOME) {
        throw new ModelException("field '" + name
            + "' may not have multiplicity 'some'");
      }
      checkDeclared(owner);
      for (Signature column : columns) {
        checkDeclared(column);
      }
      claim(name, "field");
      final ImmutableList<Signature> list =
          ImmutableList.<Signature>builder().add(owner).add(columns).build();
      final Field field =
          new Field(name, list, multiplicity,
              ast.relation(name, list.size()));
      fields.add(field);
      return field;
    }

    /** Adds a named fact. */
    public Builder fact(String name, Ast.Formula formula) {
      put(facts, name, formula, "fact");
      return this;
    }

    /** Declares a predicate. */
    public Predicate pred(String name, Ast.Formula body,
        Ast.Decl... params) {
      final Predicate predicate =
          new Predicate(name, ImmutableList.copyOf(params), body);
      put(predicates, name, predicate, "predicate");
      return predicate;
    }

    /** Declares a function. */
    public Function fun(String name, Ast.Expr body, Ast.Decl... params) {
      final Function function =
          new Function(name, ImmutableList.copyOf(params), body);
      put(functions, name, function, "function");
      return function;
    }

    /** Adds a command that checks an assertion. */
    public Builder check(String name, String assertion, String scope) {
      return command(name, Command.Kind.CHECK, assertion, scope, null);
    }

    /** Adds a command that checks an assertion, with an expectation. */
    public Builder check(String name, String assertion, String scope,
        int expect) {
      return command(name, Command.Kind.CHECK, assertion, scope, expect);
    }

    /** Adds a command that runs a predicate. */
    public Builder run(String name, String predicate, String scope) {
      return command(name, Command.Kind.RUN, predicate, scope, null);
    }

    /** Adds a command that runs a predicate, with an expectation. */
    public Builder run(String name, String predicate, String scope,
        int expect) {
      return command(name, Command.Kind.RUN, predicate, scope, expect);
    }

    private Builder command(String name, Command.Kind kind, String target,
        String scope, @Nullable Integer expect) {
      final Command command =
          new Command(name, kind, target, ScopeSpec.parse(scope), expect);
      put(commands, name, command, "command");
      return this;
    }

    private void checkDeclared(Signature signature) {
      if (!signatures.contains(signature)) {
        throw new ModelException("signature '" + signature
            + "' is not declared in model '" + this.name + "'");
      }
    }

    /** Reserves a relation name. */
    private void claim(String name, String kind) {
      if (relationNames.put(name, kind) != null) {
        throw new ModelException("duplicate " + kind + " '" + name + "'");
      }
    }

    private static <V> void put(Map<String, V> map, String name, V v,
        String kind) {
      if (map.put(name, v) != null) {
        throw new ModelException("duplicate " + kind + " '" + name + "'");
      }
    }

    /** Validates and creates the model. */
    public Model build() {
      final Model model =
          new Model(name, ImmutableList.copyOf(signatures),
              ImmutableList.copyOf(fields), ImmutableMap.copyOf(orderings),
              ImmutableMap.copyOf(facts), ImmutableMap.copyOf(predicates),
              ImmutableMap.copyOf(functions), ImmutableMap.copyOf(commands));
      final TypeChecker typeChecker = new TypeChecker(model);
      final Expander expander = Expander.create(model);
      model.facts.forEach((factName, fact) ->
          typeChecker.check(expander.expand(fact), ImmutableList.of()));
      model.predicates.values().forEach(p ->
          typeChecker.check(expander.expand(p.body), p.params));
      model.functions.values().forEach(f ->
          typeChecker.check(expander.expand(f.body), f.params));
      for (Command command : model.commands.values()) {
        final Predicate predicate = model.predicates.get(command.target);
        if (predicate == null) {
          throw new ModelException("command '" + command.name
              + "' refers to unknown predicate '" + command.target + "'");
        }
        if (command.kind == Command.Kind.CHECK
            && !predicate.params.isEmpty()) {
          throw new ModelException("command '" + command.name
              + "' checks '" + command.target
              + "', which has parameters; an assertion must have none");
        }
      }
      return model;
    }
  }
}

// End Model.java
