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

package net.protocalc.java.ir;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.protocalc.java.syntax.Command.StoreOpKind;
import net.protocalc.java.syntax.Location;
import net.protocalc.java.theory.Term;

/**
 * A Transition is the payload of one node of a {@link TransitionGraph}: a single step of a
 * process. The set of transitions is closed; each subclass is nested here.
 */
public abstract class Transition {

  /** Kind of the transition, for use in a switch/case. */
  public enum Kind {
    ALTERNATIVES,
    BIND,
    EMIT,
    END,
    FRESH,
    GUARD,
    JOIN,
    START,
    STORE,
  }

  private final Kind kind;

  private Transition(Kind kind) {
    this.kind = kind;
  }

  public final Kind kind() {
    return kind;
  }

  /** The entry point of a process. */
  public static final class Start extends Transition {
    private final String process;

    private Start(String process) {
      super(Kind.START);
      this.process = process;
    }

    public String getProcess() {
      return process;
    }

    @Override
    public String toString() {
      return "start " + process;
    }
  }

  /** Normal termination of a process. A node with no successors that is not END is a dead end. */
  public static final class End extends Transition {
    private End() {
      super(Kind.END);
    }

    @Override
    public String toString() {
      return "end";
    }
  }

  /** A no-op control-flow merge point, such as a loop head or the return point of a call. */
  public static final class Join extends Transition {
    private final String label;

    private Join(String label) {
      super(Kind.JOIN);
      this.label = label;
    }

    public String getLabel() {
      return label;
    }

    @Override
    public String toString() {
      return "join " + label;
    }
  }

  /** Binds a variable to the value of a term. */
  public static final class Bind extends Transition {
    private final Term.Variable variable;
    private final Term value;

    private Bind(Term.Variable variable, Term value) {
      super(Kind.BIND);
      this.variable = variable;
      this.value = value;
    }

    public Term.Variable getVariable() {
      return variable;
    }

    public Term getValue() {
      return value;
    }

    @Override
    public String toString() {
      return variable + " := " + value;
    }
  }

  /**
   * Binds a variable to a freshly generated nonce. Each Fresh transition is a distinct generation
   * act; its nonce id is unique within the compiled system.
   */
  public static final class Fresh extends Transition {
    private final Term.Variable variable;
    private final Term.Nonce nonce;

    private Fresh(Term.Variable variable, Term.Nonce nonce) {
      super(Kind.FRESH);
      this.variable = variable;
      this.nonce = nonce;
    }

    public Term.Variable getVariable() {
      return variable;
    }

    public Term.Nonce getNonce() {
      return nonce;
    }

    @Override
    public String toString() {
      return "new " + variable + " = " + nonce;
    }
  }

  /**
   * Continues only if every condition holds. The conditions of a branch arm include the negations
   * of the conditions of every earlier arm, so that arms are taken in declaration order.
   */
  public static final class Guard extends Transition {
    private final String label;
    private final ImmutableList<Condition> conditions;

    private Guard(String label, ImmutableList<Condition> conditions) {
      super(Kind.GUARD);
      this.label = label;
      this.conditions = conditions;
    }

    public String getLabel() {
      return label;
    }

    /** Returns the conjunction of conditions; empty means the guard always holds. */
    public ImmutableList<Condition> getConditions() {
      return conditions;
    }

    @Override
    public String toString() {
      return "guard " + label + " [" + Joiner.on(", ").join(conditions) + "]";
    }
  }

  /**
   * An operation on the store of a channel or file instance. For INSERT and REMOVE the term is a
   * fact; for CONSUME and READ it is a pattern whose listed variables are bound by the match.
   */
  public static final class StoreOp extends Transition {
    private final StoreOpKind op;
    private final String instance;
    private final Term term;
    private final ImmutableSet<String> bound;
    private final Location location;

    private StoreOp(
        StoreOpKind op,
        String instance,
        Term term,
        ImmutableSet<String> bound,
        Location location) {
      super(Kind.STORE);
      this.op = op;
      this.instance = instance;
      this.term = term;
      this.bound = bound;
      this.location = location;
    }

    public StoreOpKind getOp() {
      return op;
    }

    public String getInstance() {
      return instance;
    }

    public Term getTerm() {
      return term;
    }

    /** Returns the variables bound by a consuming or reading match. */
    public ImmutableSet<String> getBoundVariables() {
      return bound;
    }

    /** Returns the location of the source command. */
    public Location getLocation() {
      return location;
    }

    @Override
    public String toString() {
      return op + " " + instance + " " + term;
    }
  }

  /** Records an event. The ordinal increases along every path of a process. */
  public static final class Emit extends Transition {
    private final Term.Application event;
    private final int ordinal;

    private Emit(Term.Application event, int ordinal) {
      super(Kind.EMIT);
      this.event = event;
      this.ordinal = ordinal;
    }

    public Term.Application getEvent() {
      return event;
    }

    public String getTag() {
      return event.getSymbol().getName();
    }

    public int getOrdinal() {
      return ordinal;
    }

    @Override
    public String toString() {
      return "event#" + ordinal + " " + event;
    }
  }

  /** The origin of one continuation of an attacker-controlled call site. */
  public enum AlternativeKind {
    /** The unmodified syscall body. */
    NORMAL,
    /** The replacement body of an active attack. */
    ATTACK;

    @Override
    public String toString() {
      return super.toString().toLowerCase();
    }
  }

  /** A tagged continuation of an {@link Alternatives} transition. */
  public static final class Alternative {
    private final AlternativeKind kind;
    private final String name;

    private Alternative(AlternativeKind kind, String name) {
      this.kind = kind;
      this.name = name;
    }

    public static Alternative normal(String syscall) {
      return new Alternative(AlternativeKind.NORMAL, syscall);
    }

    public static Alternative attack(String attack) {
      return new Alternative(AlternativeKind.ATTACK, attack);
    }

    public AlternativeKind getKind() {
      return kind;
    }

    /** Returns the syscall name for NORMAL, the attack name for ATTACK. */
    public String getName() {
      return name;
    }

    @Override
    public String toString() {
      return kind + ":" + name;
    }
  }

  /**
   * A nondeterministic choice, resolved by the attacker, between the continuations of a call site.
   * The i-th successor of the node is the entry of the i-th alternative.
   */
  public static final class Alternatives extends Transition {
    private final String callee;
    private final ImmutableList<Alternative> alternatives;

    private Alternatives(String callee, ImmutableList<Alternative> alternatives) {
      super(Kind.ALTERNATIVES);
      Preconditions.checkArgument(alternatives.size() >= 2, "fewer than two alternatives");
      this.callee = callee;
      this.alternatives = alternatives;
    }

    public String getCallee() {
      return callee;
    }

    public ImmutableList<Alternative> getAlternatives() {
      return alternatives;
    }

    @Override
    public String toString() {
      return "choose " + callee + " " + alternatives;
    }
  }

  // ==== Factories ====

  public static Start start(String process) {
    return new Start(process);
  }

  public static End end() {
    return new End();
  }

  public static Join join(String label) {
    return new Join(label);
  }

  public static Bind bind(Term.Variable variable, Term value) {
    return new Bind(variable, value);
  }

  public static Fresh fresh(Term.Variable variable, Term.Nonce nonce) {
    return new Fresh(variable, nonce);
  }

  public static Guard guard(String label, Iterable<Condition> conditions) {
    return new Guard(label, ImmutableList.copyOf(conditions));
  }

  public static StoreOp storeOp(
      StoreOpKind op, String instance, Term term, Iterable<String> bound, Location location) {
    return new StoreOp(op, instance, term, ImmutableSet.copyOf(bound), location);
  }

  public static Emit emit(Term.Application event, int ordinal) {
    return new Emit(event, ordinal);
  }

  public static Alternatives alternatives(String callee, Iterable<Alternative> alternatives) {
    return new Alternatives(callee, ImmutableList.copyOf(alternatives));
  }
}
