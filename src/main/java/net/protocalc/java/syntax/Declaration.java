// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.protocalc.java.syntax;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Base class for top-level declarations of a model. As with {@link Command}, the set of
 * declarations is closed and every subclass is nested here.
 */
public abstract class Declaration extends Node {

  /** Kind of the declaration, for use in a switch/case. */
  public enum Kind {
    ATTACK,
    ATTACKER_GRANT,
    CONSTANT,
    EQUATION,
    FUNCTION,
    GRANT,
    INSTANCE,
    LEMMA,
    PROCESS,
    SYSCALL,
    TYPE,
  }

  private final Kind kind;
  private final String name;

  Declaration(Location location, Kind kind, String name) {
    super(location);
    this.kind = kind;
    this.name = Preconditions.checkNotNull(name);
  }

  public final Kind kind() {
    return kind;
  }

  /**
   * Returns the name of the declared entity. Anonymous declarations (equations and grants) return
   * a descriptive name used in error messages.
   */
  public final String getName() {
    return name;
  }

  /** {@code function name/arity}. */
  public static final class Function extends Declaration {
    private final int arity;

    private Function(Location location, String name, int arity) {
      super(location, Kind.FUNCTION, name);
      this.arity = arity;
    }

    public int getArity() {
      return arity;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code equation lhs = rhs}. Identifiers that are not declared symbols are variables. */
  public static final class Equation extends Declaration {
    private final Expression lhs;
    private final Expression rhs;

    private Equation(Location location, Expression lhs, Expression rhs) {
      super(location, Kind.EQUATION, "equation " + lhs + " = " + rhs);
      this.lhs = lhs;
      this.rhs = rhs;
    }

    public Expression getLHS() {
      return lhs;
    }

    public Expression getRHS() {
      return rhs;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code type name kind}. */
  public static final class Type extends Declaration {
    private final TypeKind typeKind;

    private Type(Location location, String name, TypeKind typeKind) {
      super(location, Kind.TYPE, name);
      this.typeKind = typeKind;
    }

    public TypeKind getTypeKind() {
      return typeKind;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code allow subject [object] [op, ...]}. */
  public static final class Grant extends Declaration {
    private final String subject;
    @Nullable private final String object;
    private final ImmutableList<String> operations;

    private Grant(
        Location location,
        String subject,
        @Nullable String object,
        ImmutableList<String> operations) {
      super(
          location,
          Kind.GRANT,
          "allow " + subject + (object != null ? " " + object : "") + " " + operations);
      this.subject = subject;
      this.object = object;
      this.operations = operations;
    }

    public String getSubject() {
      return subject;
    }

    /** Returns the object type, or null for operations not addressed to a channel or file. */
    @Nullable
    public String getObject() {
      return object;
    }

    public ImmutableList<String> getOperations() {
      return operations;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code allow attack subject [attack, ...]}. */
  public static final class AttackerGrant extends Declaration {
    private final String subject;
    private final ImmutableList<String> operations;

    private AttackerGrant(Location location, String subject, ImmutableList<String> operations) {
      super(location, Kind.ATTACKER_GRANT, "allow attack " + subject + " " + operations);
      this.subject = subject;
      this.operations = operations;
    }

    public String getSubject() {
      return subject;
    }

    public ImmutableList<String> getOperations() {
      return operations;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code syscall name(params) body}. */
  public static final class Syscall extends Declaration {
    private final ImmutableList<Identifier> parameters;
    private final Command body;

    private Syscall(
        Location location, String name, ImmutableList<Identifier> parameters, Command body) {
      super(location, Kind.SYSCALL, name);
      this.parameters = parameters;
      this.body = body;
    }

    public ImmutableList<Identifier> getParameters() {
      return parameters;
    }

    public Command getBody() {
      return body;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * {@code attack name on target(params) body} (active) or {@code passive attack name(params)
   * body}.
   */
  public static final class Attack extends Declaration {
    @Nullable private final String target;
    private final ImmutableList<Identifier> parameters;
    private final Command body;

    private Attack(
        Location location,
        String name,
        @Nullable String target,
        ImmutableList<Identifier> parameters,
        Command body) {
      super(location, Kind.ATTACK, name);
      this.target = target;
      this.parameters = parameters;
      this.body = body;
    }

    /** Returns the name of the overridden syscall, or null for a passive attack. */
    @Nullable
    public String getTarget() {
      return target;
    }

    public boolean isActive() {
      return target != null;
    }

    public ImmutableList<Identifier> getParameters() {
      return parameters;
    }

    public Command getBody() {
      return body;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code const [fresh] name}. */
  public static final class Constant extends Declaration {
    private final boolean fresh;

    private Constant(Location location, String name, boolean fresh) {
      super(location, Kind.CONSTANT, name);
      this.fresh = fresh;
    }

    public boolean isFresh() {
      return fresh;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code channel name: type} or {@code file name: type = content}. */
  public static final class Instance extends Declaration {
    private final String typeName;
    @Nullable private final Expression content;

    private Instance(
        Location location, String name, String typeName, @Nullable Expression content) {
      super(location, Kind.INSTANCE, name);
      this.typeName = typeName;
      this.content = content;
    }

    public String getTypeName() {
      return typeName;
    }

    /** Returns the initial content of a file instance, or null. */
    @Nullable
    public Expression getContent() {
      return content;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  /** A formal parameter {@code name: type} of a process template. */
  public static final class Parameter extends Node {
    private final Identifier identifier;
    private final String typeName;

    private Parameter(Location location, Identifier identifier, String typeName) {
      super(location);
      this.identifier = identifier;
      this.typeName = typeName;
    }

    public String getName() {
      return identifier.getName();
    }

    public Identifier getIdentifier() {
      return identifier;
    }

    public String getTypeName() {
      return typeName;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(identifier);
    }

    @Override
    public String toString() {
      return identifier + ": " + typeName;
    }
  }

  /** {@code process name(params): type { var ...; main ... }}. */
  public static final class Process extends Declaration {
    private final String typeName;
    private final ImmutableList<Parameter> parameters;
    private final ImmutableList<Command.Bind> variables;
    private final Command main;

    private Process(
        Location location,
        String name,
        String typeName,
        ImmutableList<Parameter> parameters,
        ImmutableList<Command.Bind> variables,
        Command main) {
      super(location, Kind.PROCESS, name);
      this.typeName = typeName;
      this.parameters = parameters;
      this.variables = variables;
      this.main = main;
    }

    public String getTypeName() {
      return typeName;
    }

    public ImmutableList<Parameter> getParameters() {
      return parameters;
    }

    /** Returns the local {@code var} bindings, evaluated in order before {@code main}. */
    public ImmutableList<Command.Bind> getVariables() {
      return variables;
    }

    public Command getMain() {
      return main;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  /** The quantifier kind of a lemma. */
  public enum LemmaKind {
    EXISTS_TRACE,
    ALL_TRACES,
    REACHABLE,
    CORRESPONDS;

    @Override
    public String toString() {
      return super.toString().toLowerCase().replace('_', '-');
    }
  }

  /**
   * {@code lemma name: kind ...}. EXISTS_TRACE and ALL_TRACES lemmas carry a formula; REACHABLE
   * lemmas a non-empty list of events; CORRESPONDS lemmas a premise and a conclusion event.
   */
  public static final class Lemma extends Declaration {
    private final LemmaKind lemmaKind;
    @Nullable private final LemmaFormula formula;
    private final ImmutableList<CallExpression> events;

    private Lemma(
        Location location,
        String name,
        LemmaKind lemmaKind,
        @Nullable LemmaFormula formula,
        ImmutableList<CallExpression> events) {
      super(location, Kind.LEMMA, name);
      this.lemmaKind = lemmaKind;
      this.formula = formula;
      this.events = events;
    }

    public LemmaKind getLemmaKind() {
      return lemmaKind;
    }

    /** Returns the formula of an EXISTS_TRACE or ALL_TRACES lemma, or null. */
    @Nullable
    public LemmaFormula getFormula() {
      return formula;
    }

    /**
     * Returns the events of a REACHABLE lemma, or the premise and conclusion (in that order) of a
     * CORRESPONDS lemma.
     */
    public ImmutableList<CallExpression> getEvents() {
      return events;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public String toString() {
      if (formula != null) {
        return "lemma " + getName() + ": " + lemmaKind + " " + formula;
      }
      return "lemma "
          + getName()
          + ": "
          + lemmaKind
          + " "
          + Joiner.on(lemmaKind == LemmaKind.CORRESPONDS ? " ~> " : ", ").join(events);
    }
  }

  // ==== Factories ====

  public static Function function(Location loc, String name, int arity) {
    return new Function(loc, name, arity);
  }

  public static Equation equation(Location loc, Expression lhs, Expression rhs) {
    return new Equation(loc, lhs, rhs);
  }

  public static Type type(Location loc, String name, TypeKind kind) {
    return new Type(loc, name, kind);
  }

  public static Grant grant(
      Location loc, String subject, @Nullable String object, List<String> operations) {
    return new Grant(loc, subject, object, ImmutableList.copyOf(operations));
  }

  public static AttackerGrant attackerGrant(Location loc, String subject, List<String> operations) {
    return new AttackerGrant(loc, subject, ImmutableList.copyOf(operations));
  }

  public static Syscall syscall(Location loc, String name, List<String> params, Command body) {
    return new Syscall(loc, name, identifiers(loc, params), body);
  }

  public static Attack activeAttack(
      Location loc, String name, String target, List<String> params, Command body) {
    return new Attack(loc, name, Preconditions.checkNotNull(target), identifiers(loc, params), body);
  }

  public static Attack passiveAttack(Location loc, String name, List<String> params, Command body) {
    return new Attack(loc, name, null, identifiers(loc, params), body);
  }

  public static Constant constant(Location loc, String name, boolean fresh) {
    return new Constant(loc, name, fresh);
  }

  public static Instance instance(
      Location loc, String name, String typeName, @Nullable Expression content) {
    return new Instance(loc, name, typeName, content);
  }

  public static Parameter parameter(Location loc, String name, String typeName) {
    return new Parameter(loc, Identifier.of(loc, name), typeName);
  }

  public static Process process(
      Location loc,
      String name,
      String typeName,
      List<Parameter> params,
      List<Command.Bind> variables,
      Command main) {
    return new Process(
        loc,
        name,
        typeName,
        ImmutableList.copyOf(params),
        ImmutableList.copyOf(variables),
        main);
  }

  public static Lemma formulaLemma(
      Location loc, String name, LemmaKind kind, LemmaFormula formula) {
    Preconditions.checkArgument(
        kind == LemmaKind.EXISTS_TRACE || kind == LemmaKind.ALL_TRACES, "bad kind %s", kind);
    return new Lemma(loc, name, kind, formula, ImmutableList.of());
  }

  public static Lemma reachable(Location loc, String name, List<CallExpression> events) {
    Preconditions.checkArgument(!events.isEmpty(), "reachable lemma needs events");
    return new Lemma(loc, name, LemmaKind.REACHABLE, null, ImmutableList.copyOf(events));
  }

  public static Lemma corresponds(
      Location loc, String name, CallExpression premise, CallExpression conclusion) {
    return new Lemma(
        loc, name, LemmaKind.CORRESPONDS, null, ImmutableList.of(premise, conclusion));
  }

  private static ImmutableList<Identifier> identifiers(Location loc, List<String> names) {
    ImmutableList.Builder<Identifier> ids = ImmutableList.builderWithExpectedSize(names.size());
    for (String name : names) {
      ids.add(Identifier.of(loc, name));
    }
    return ids.build();
  }
}
