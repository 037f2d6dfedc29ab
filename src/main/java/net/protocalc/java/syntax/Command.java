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
 * Base class for all command nodes. The set of commands is closed: every subclass is nested here
 * and identified by its {@link Kind}.
 */
public abstract class Command extends Node {

  /** Kind of the command, for use in a switch/case. */
  public enum Kind {
    BIND,
    BRANCH,
    CALL,
    EMIT,
    NEW,
    REPEAT,
    RETURN,
    SEQUENCE,
    SKIP,
    STORE,
  }

  private final Kind kind;

  Command(Location location, Kind kind) {
    super(location);
    this.kind = kind;
  }

  public final Kind kind() {
    return kind;
  }

  /**
   * {@code var := expr}. Binds {@code var} for the remainder of the enclosing block. A variable may
   * be bound only once per block, but an inner block may shadow it.
   */
  public static final class Bind extends Command {
    private final Identifier variable;
    private final Expression value;

    private Bind(Location location, Identifier variable, Expression value) {
      super(location, Kind.BIND);
      this.variable = variable;
      this.value = value;
    }

    public Identifier getVariable() {
      return variable;
    }

    public Expression getValue() {
      return value;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public String toString() {
      return variable + " := " + value;
    }
  }

  /** A block: commands executed in order. */
  public static final class Sequence extends Command {
    private final ImmutableList<Command> commands;

    private Sequence(Location location, ImmutableList<Command> commands) {
      super(location, Kind.SEQUENCE);
      this.commands = commands;
    }

    public ImmutableList<Command> getCommands() {
      return commands;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public String toString() {
      return "{" + Joiner.on("; ").join(commands) + "}";
    }
  }

  /**
   * A guarded arm {@code [g1, g2, ...] -> command} of a branch or until clause. An empty guard
   * list always holds.
   */
  public static final class Arm extends Node {
    private final ImmutableList<Guard> guards;
    private final Command body;

    private Arm(Location location, ImmutableList<Guard> guards, Command body) {
      super(location);
      this.guards = guards;
      this.body = body;
    }

    public ImmutableList<Guard> getGuards() {
      return guards;
    }

    public Command getBody() {
      return body;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public String toString() {
      return "[" + Joiner.on(", ").join(guards) + "] -> " + body;
    }
  }

  /**
   * {@code case arm1 | arm2 | ... end}: the first arm (in declaration order) whose guards hold is
   * taken. If none holds, the process is stuck.
   */
  public static final class Branch extends Command {
    private final ImmutableList<Arm> arms;

    private Branch(Location location, ImmutableList<Arm> arms) {
      super(location, Kind.BRANCH);
      this.arms = arms;
    }

    public ImmutableList<Arm> getArms() {
      return arms;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public String toString() {
      return "case " + Joiner.on(" | ").join(arms) + " end";
    }
  }

  /**
   * {@code repeat body until arm1 | arm2 | ... end}: after each iteration the until arms are tested
   * in order; the first that holds exits the loop by running its command.
   */
  public static final class Repeat extends Command {
    private final Command body;
    private final ImmutableList<Arm> until;

    private Repeat(Location location, Command body, ImmutableList<Arm> until) {
      super(location, Kind.REPEAT);
      this.body = body;
      this.until = until;
    }

    public Command getBody() {
      return body;
    }

    public ImmutableList<Arm> getUntil() {
      return until;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public String toString() {
      return "repeat " + body + " until " + Joiner.on(" | ").join(until) + " end";
    }
  }

  /** {@code new var}: binds {@code var} to a globally fresh nonce. */
  public static final class New extends Command {
    private final Identifier variable;

    private New(Location location, Identifier variable) {
      super(location, Kind.NEW);
      this.variable = variable;
    }

    public Identifier getVariable() {
      return variable;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public String toString() {
      return "new " + variable;
    }
  }

  /** A syscall or attack invocation whose result, if any, is discarded. */
  public static final class Call extends Command {
    private final CallExpression call;

    private Call(Location location, CallExpression call) {
      super(location, Kind.CALL);
      this.call = call;
    }

    public CallExpression getCall() {
      return call;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public String toString() {
      return call.toString();
    }
  }

  /** {@code event Tag(args)}: records an event at this control point. */
  public static final class Emit extends Command {
    private final CallExpression event;

    private Emit(Location location, CallExpression event) {
      super(location, Kind.EMIT);
      this.event = event;
    }

    public CallExpression getEvent() {
      return event;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public String toString() {
      return "event " + event;
    }
  }

  /** The operations on a channel or file store. */
  public enum StoreOpKind {
    /** Add a fact. */
    INSERT,
    /** Remove an exact occurrence of a fact. */
    REMOVE,
    /** Select a fact matching a pattern, bind its variables, and remove it. */
    CONSUME,
    /** Match a pattern against a fact without removing it. */
    READ;

    @Override
    public String toString() {
      return super.toString().toLowerCase();
    }
  }

  /**
   * {@code insert/remove/consume/read instance term}. For CONSUME and READ the term is a pattern
   * whose unbound identifiers are bound by the match.
   */
  public static final class StoreOp extends Command {
    private final StoreOpKind op;
    private final Identifier instance;
    private final Expression term;

    private StoreOp(Location location, StoreOpKind op, Identifier instance, Expression term) {
      super(location, Kind.STORE);
      this.op = op;
      this.instance = instance;
      this.term = term;
    }

    public StoreOpKind getOp() {
      return op;
    }

    /** Returns the identifier of the instance (or formal parameter denoting an instance). */
    public Identifier getInstance() {
      return instance;
    }

    public Expression getTerm() {
      return term;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public String toString() {
      return op + " " + instance + " " + term;
    }
  }

  /** {@code return expr}: yields the result of a syscall or attack body. */
  public static final class Return extends Command {
    @Nullable private final Expression value;

    private Return(Location location, @Nullable Expression value) {
      super(location, Kind.RETURN);
      this.value = value;
    }

    @Nullable
    public Expression getValue() {
      return value;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public String toString() {
      return value == null ? "return" : "return " + value;
    }
  }

  /** {@code skip}: does nothing. */
  public static final class Skip extends Command {
    private Skip(Location location) {
      super(location, Kind.SKIP);
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public String toString() {
      return "skip";
    }
  }

  // ==== Factories ====

  public static Bind bind(Location loc, String variable, Expression value) {
    return new Bind(loc, Identifier.of(loc, variable), value);
  }

  public static Sequence sequence(Location loc, List<Command> commands) {
    return new Sequence(loc, ImmutableList.copyOf(commands));
  }

  public static Sequence sequence(Location loc, Command... commands) {
    return new Sequence(loc, ImmutableList.copyOf(commands));
  }

  public static Arm arm(Location loc, List<Guard> guards, Command body) {
    return new Arm(loc, ImmutableList.copyOf(guards), body);
  }

  public static Branch branch(Location loc, List<Arm> arms) {
    Preconditions.checkArgument(!arms.isEmpty(), "branch needs at least one arm");
    return new Branch(loc, ImmutableList.copyOf(arms));
  }

  public static Repeat repeat(Location loc, Command body, List<Arm> until) {
    Preconditions.checkArgument(!until.isEmpty(), "repeat needs at least one until arm");
    return new Repeat(loc, body, ImmutableList.copyOf(until));
  }

  public static New newNonce(Location loc, String variable) {
    return new New(loc, Identifier.of(loc, variable));
  }

  public static Call call(Location loc, CallExpression call) {
    return new Call(loc, call);
  }

  public static Emit emit(Location loc, CallExpression event) {
    return new Emit(loc, event);
  }

  public static StoreOp storeOp(Location loc, StoreOpKind op, String instance, Expression term) {
    return new StoreOp(loc, op, Identifier.of(loc, instance), term);
  }

  public static Return returnValue(Location loc, @Nullable Expression value) {
    return new Return(loc, value);
  }

  public static Skip skip(Location loc) {
    return new Skip(loc);
  }
}
