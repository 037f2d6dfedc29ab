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

/**
 * Syntax of the formula of an {@code exists-trace} or {@code all-traces} lemma, as written by the
 * user. The lemma translator closes it and converts it to the normal form consumed by backends.
 *
 * <p>Index variables (trace positions) are the identifiers that appear after {@code @} in an event
 * atom or on either side of a precedence atom. All other identifiers in a formula denote terms.
 */
public abstract class LemmaFormula extends Node {

  /** Kind of the formula, for use in a switch/case. */
  public enum Kind {
    AND,
    EQUAL,
    EVENT,
    EXISTS,
    FORALL,
    IMPLIES,
    NOT,
    OR,
    PRECEDES,
  }

  private final Kind kind;

  LemmaFormula(Location location, Kind kind) {
    super(location);
    this.kind = kind;
  }

  public final Kind kind() {
    return kind;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  /** {@code Tag(args) @ i}. */
  public static final class Event extends LemmaFormula {
    private final CallExpression event;
    private final Identifier index;

    private Event(Location location, CallExpression event, Identifier index) {
      super(location, Kind.EVENT);
      this.event = event;
      this.index = index;
    }

    public CallExpression getEvent() {
      return event;
    }

    public Identifier getIndex() {
      return index;
    }

    @Override
    public String toString() {
      return event + " @ " + index;
    }
  }

  /** {@code i < j}. */
  public static final class Precedes extends LemmaFormula {
    private final Identifier before;
    private final Identifier after;

    private Precedes(Location location, Identifier before, Identifier after) {
      super(location, Kind.PRECEDES);
      this.before = before;
      this.after = after;
    }

    public Identifier getBefore() {
      return before;
    }

    public Identifier getAfter() {
      return after;
    }

    @Override
    public String toString() {
      return before + " < " + after;
    }
  }

  /** {@code t1 = t2}, compared modulo the theory. */
  public static final class Equal extends LemmaFormula {
    private final Expression lhs;
    private final Expression rhs;

    private Equal(Location location, Expression lhs, Expression rhs) {
      super(location, Kind.EQUAL);
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
    public String toString() {
      return lhs + " = " + rhs;
    }
  }

  /** Negation, conjunction, disjunction and implication. */
  public static final class Connective extends LemmaFormula {
    private final ImmutableList<LemmaFormula> operands;

    private Connective(Location location, Kind kind, ImmutableList<LemmaFormula> operands) {
      super(location, kind);
      this.operands = operands;
    }

    public ImmutableList<LemmaFormula> getOperands() {
      return operands;
    }

    @Override
    public String toString() {
      switch (kind()) {
        case NOT:
          return "not(" + operands.get(0) + ")";
        case AND:
          return "(" + Joiner.on(" & ").join(operands) + ")";
        case OR:
          return "(" + Joiner.on(" | ").join(operands) + ")";
        case IMPLIES:
          return "(" + operands.get(0) + " ==> " + operands.get(1) + ")";
        default:
          throw new IllegalStateException(kind().toString());
      }
    }
  }

  /** {@code exists x, i. body} or {@code forall x, i. body}. */
  public static final class Quantified extends LemmaFormula {
    private final ImmutableList<Identifier> variables;
    private final LemmaFormula body;

    private Quantified(
        Location location, Kind kind, ImmutableList<Identifier> variables, LemmaFormula body) {
      super(location, kind);
      this.variables = variables;
      this.body = body;
    }

    public ImmutableList<Identifier> getVariables() {
      return variables;
    }

    public LemmaFormula getBody() {
      return body;
    }

    @Override
    public String toString() {
      return (kind() == Kind.EXISTS ? "exists " : "forall ")
          + Joiner.on(", ").join(variables)
          + ". "
          + body;
    }
  }

  // ==== Factories ====

  public static Event event(Location loc, CallExpression event, String index) {
    return new Event(loc, event, Identifier.of(loc, index));
  }

  public static Precedes precedes(Location loc, String before, String after) {
    return new Precedes(loc, Identifier.of(loc, before), Identifier.of(loc, after));
  }

  public static Equal equal(Location loc, Expression lhs, Expression rhs) {
    return new Equal(loc, lhs, rhs);
  }

  public static Connective not(Location loc, LemmaFormula operand) {
    return new Connective(loc, Kind.NOT, ImmutableList.of(operand));
  }

  public static Connective and(Location loc, List<LemmaFormula> operands) {
    Preconditions.checkArgument(!operands.isEmpty());
    return new Connective(loc, Kind.AND, ImmutableList.copyOf(operands));
  }

  public static Connective or(Location loc, List<LemmaFormula> operands) {
    Preconditions.checkArgument(!operands.isEmpty());
    return new Connective(loc, Kind.OR, ImmutableList.copyOf(operands));
  }

  public static Connective implies(Location loc, LemmaFormula premise, LemmaFormula conclusion) {
    return new Connective(loc, Kind.IMPLIES, ImmutableList.of(premise, conclusion));
  }

  public static Quantified exists(Location loc, List<String> variables, LemmaFormula body) {
    return new Quantified(loc, Kind.EXISTS, identifiers(loc, variables), body);
  }

  public static Quantified forall(Location loc, List<String> variables, LemmaFormula body) {
    return new Quantified(loc, Kind.FORALL, identifiers(loc, variables), body);
  }

  private static ImmutableList<Identifier> identifiers(Location loc, List<String> names) {
    ImmutableList.Builder<Identifier> ids = ImmutableList.builder();
    for (String name : names) {
      ids.add(Identifier.of(loc, name));
    }
    return ids.build();
  }
}
