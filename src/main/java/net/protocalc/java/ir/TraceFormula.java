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
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import net.protocalc.java.theory.Term;

/**
 * A TraceFormula is the normal form of a lemma: a first-order formula over event-occurrence atoms
 * {@code E(t) @ i}, the strict order {@code i < j} of trace positions, term equality, boolean
 * connectives, and quantifiers over index and term variables.
 */
public abstract class TraceFormula {

  /** Kind of the formula, for use in a switch/case. */
  public enum Kind {
    AND,
    EQUAL,
    EVENT,
    EXISTS,
    FALSE,
    FORALL,
    IMPLIES,
    NOT,
    OR,
    PRECEDES,
    TRUE,
  }

  /** The sort of a quantified variable. */
  public enum Sort {
    /** A position in the trace. */
    INDEX,
    /** A message term. */
    TERM;
  }

  /** A quantified variable with its sort. */
  public static final class Var {
    private final String name;
    private final Sort sort;

    private Var(String name, Sort sort) {
      this.name = Preconditions.checkNotNull(name);
      this.sort = sort;
    }

    public static Var index(String name) {
      return new Var(name, Sort.INDEX);
    }

    public static Var term(String name) {
      return new Var(name, Sort.TERM);
    }

    public String getName() {
      return name;
    }

    public Sort getSort() {
      return sort;
    }

    @Override
    public boolean equals(Object that) {
      return that instanceof Var && name.equals(((Var) that).name) && sort == ((Var) that).sort;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, sort);
    }

    @Override
    public String toString() {
      return sort == Sort.INDEX ? "#" + name : name;
    }
  }

  private final Kind kind;

  private TraceFormula(Kind kind) {
    this.kind = kind;
  }

  public final Kind kind() {
    return kind;
  }

  /** Returns the names of the free (index and term) variables of this formula. */
  public final ImmutableSet<String> freeVariables() {
    Set<String> free = new LinkedHashSet<>();
    collectFree(this, new HashSet<>(), free);
    return ImmutableSet.copyOf(free);
  }

  private static void collectFree(TraceFormula f, Set<String> bound, Set<String> free) {
    switch (f.kind()) {
      case TRUE:
      case FALSE:
        return;
      case EVENT:
        Event e = (Event) f;
        addFree(e.getEvent().variables(), bound, free);
        addFree(ImmutableSet.of(e.getIndex()), bound, free);
        return;
      case PRECEDES:
        Precedes p = (Precedes) f;
        addFree(ImmutableSet.of(p.getBefore(), p.getAfter()), bound, free);
        return;
      case EQUAL:
        Equal eq = (Equal) f;
        addFree(eq.getLHS().variables(), bound, free);
        addFree(eq.getRHS().variables(), bound, free);
        return;
      case NOT:
      case AND:
      case OR:
      case IMPLIES:
        for (TraceFormula operand : ((Connective) f).getOperands()) {
          collectFree(operand, bound, free);
        }
        return;
      case EXISTS:
      case FORALL:
        Quantified q = (Quantified) f;
        Set<String> inner = new HashSet<>(bound);
        for (Var v : q.getVariables()) {
          inner.add(v.getName());
        }
        collectFree(q.getBody(), inner, free);
        return;
    }
    throw new IllegalStateException(f.kind().toString());
  }

  private static void addFree(Set<String> names, Set<String> bound, Set<String> free) {
    for (String name : names) {
      if (!bound.contains(name)) {
        free.add(name);
      }
    }
  }

  /** The constants true and false. */
  public static final class Constant extends TraceFormula {
    private Constant(Kind kind) {
      super(kind);
    }

    @Override
    public String toString() {
      return kind() == Kind.TRUE ? "true" : "false";
    }
  }

  /** {@code E(t) @ i}: the event {@code E(t)} occurs at trace position {@code i}. */
  public static final class Event extends TraceFormula {
    private final Term.Application event;
    private final String index;

    private Event(Term.Application event, String index) {
      super(Kind.EVENT);
      this.event = event;
      this.index = index;
    }

    public Term.Application getEvent() {
      return event;
    }

    public String getTag() {
      return event.getSymbol().getName();
    }

    public String getIndex() {
      return index;
    }

    @Override
    public String toString() {
      return event + " @ #" + index;
    }
  }

  /** {@code i < j}. */
  public static final class Precedes extends TraceFormula {
    private final String before;
    private final String after;

    private Precedes(String before, String after) {
      super(Kind.PRECEDES);
      this.before = before;
      this.after = after;
    }

    public String getBefore() {
      return before;
    }

    public String getAfter() {
      return after;
    }

    @Override
    public String toString() {
      return "#" + before + " < #" + after;
    }
  }

  /** {@code t1 = t2} modulo the theory. */
  public static final class Equal extends TraceFormula {
    private final Term lhs;
    private final Term rhs;

    private Equal(Term lhs, Term rhs) {
      super(Kind.EQUAL);
      this.lhs = lhs;
      this.rhs = rhs;
    }

    public Term getLHS() {
      return lhs;
    }

    public Term getRHS() {
      return rhs;
    }

    @Override
    public String toString() {
      return lhs + " = " + rhs;
    }
  }

  /** NOT (one operand), AND and OR (one or more), IMPLIES (premise, conclusion). */
  public static final class Connective extends TraceFormula {
    private final ImmutableList<TraceFormula> operands;

    private Connective(Kind kind, ImmutableList<TraceFormula> operands) {
      super(kind);
      this.operands = operands;
    }

    public ImmutableList<TraceFormula> getOperands() {
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

  /** {@code exists vars. body} or {@code forall vars. body}. */
  public static final class Quantified extends TraceFormula {
    private final ImmutableList<Var> variables;
    private final TraceFormula body;

    private Quantified(Kind kind, ImmutableList<Var> variables, TraceFormula body) {
      super(kind);
      this.variables = variables;
      this.body = body;
    }

    public ImmutableList<Var> getVariables() {
      return variables;
    }

    public TraceFormula getBody() {
      return body;
    }

    @Override
    public String toString() {
      return (kind() == Kind.EXISTS ? "exists " : "forall ")
          + Joiner.on(" ").join(variables)
          + ". "
          + body;
    }
  }

  // ==== Factories ====

  public static final TraceFormula TRUE = new Constant(Kind.TRUE);
  public static final TraceFormula FALSE = new Constant(Kind.FALSE);

  public static Event event(Term.Application event, String index) {
    return new Event(event, index);
  }

  public static Precedes precedes(String before, String after) {
    return new Precedes(before, after);
  }

  public static Equal equal(Term lhs, Term rhs) {
    return new Equal(lhs, rhs);
  }

  public static TraceFormula not(TraceFormula operand) {
    return new Connective(Kind.NOT, ImmutableList.of(operand));
  }

  /** Returns the conjunction, or the single operand, or TRUE for none. */
  public static TraceFormula and(List<TraceFormula> operands) {
    if (operands.isEmpty()) {
      return TRUE;
    }
    return operands.size() == 1
        ? operands.get(0)
        : new Connective(Kind.AND, ImmutableList.copyOf(operands));
  }

  /** Returns the disjunction, or the single operand, or FALSE for none. */
  public static TraceFormula or(List<TraceFormula> operands) {
    if (operands.isEmpty()) {
      return FALSE;
    }
    return operands.size() == 1
        ? operands.get(0)
        : new Connective(Kind.OR, ImmutableList.copyOf(operands));
  }

  public static TraceFormula implies(TraceFormula premise, TraceFormula conclusion) {
    return new Connective(Kind.IMPLIES, ImmutableList.of(premise, conclusion));
  }

  /** Returns {@code exists vars. body}, or {@code body} if there are no variables. */
  public static TraceFormula exists(List<Var> variables, TraceFormula body) {
    return variables.isEmpty()
        ? body
        : new Quantified(Kind.EXISTS, ImmutableList.copyOf(variables), body);
  }

  /** Returns {@code forall vars. body}, or {@code body} if there are no variables. */
  public static TraceFormula forall(List<Var> variables, TraceFormula body) {
    return variables.isEmpty()
        ? body
        : new Quantified(Kind.FORALL, ImmutableList.copyOf(variables), body);
  }
}
