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

package net.protocalc.java.store;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Multiset;
import net.protocalc.java.theory.Substitution;
import net.protocalc.java.theory.Term;
import net.protocalc.java.theory.Theory;
import net.protocalc.java.theory.TheoryException;

/**
 * A Store is the multiset of ground facts of one channel or file instance.
 *
 * <p>Stores exist only in the execution semantics that the compiled IR encodes; the compiler uses
 * them to seed initial file contents and to give that semantics a reference implementation. Facts
 * are kept in normal form, so all comparisons are modulo the theory.
 *
 * <p>A consuming match that finds no fact does not fail: it returns no choices, and the command
 * that issued it blocks.
 */
public final class Store {

  private final StoreInstance instance;
  private final Theory theory;
  private final Multiset<Term> facts = LinkedHashMultiset.create();

  Store(StoreInstance instance, Theory theory) {
    this.instance = instance;
    this.theory = theory;
  }

  public StoreInstance getInstance() {
    return instance;
  }

  /** Returns a snapshot of the facts. */
  public ImmutableMultiset<Term> getFacts() {
    return ImmutableMultiset.copyOf(facts);
  }

  public boolean isEmpty() {
    return facts.isEmpty();
  }

  /** Adds one occurrence of a ground fact. */
  public void insert(Term fact) throws TheoryException {
    Preconditions.checkArgument(fact.isGround(), "non-ground fact %s", fact);
    facts.add(theory.normalize(fact));
  }

  /**
   * Removes one occurrence of a ground fact.
   *
   * @throws FactAbsentException if no occurrence is present
   */
  public void remove(Term fact) throws TheoryException, FactAbsentException {
    Preconditions.checkArgument(fact.isGround(), "non-ground fact %s", fact);
    if (!facts.remove(theory.normalize(fact))) {
      throw new FactAbsentException(instance.getName(), fact);
    }
  }

  /** A Choice is one fact that a match may select, with the resulting bindings. */
  public static final class Choice {
    private final Term fact;
    private final Substitution substitution;

    private Choice(Term fact, Substitution substitution) {
      this.fact = fact;
      this.substitution = substitution;
    }

    public Term getFact() {
      return fact;
    }

    public Substitution getSubstitution() {
      return substitution;
    }

    @Override
    public String toString() {
      return fact + " with " + substitution;
    }
  }

  /**
   * Returns every way of matching {@code pattern} against a fact of this store, one choice per
   * distinct fact, in insertion order. The caller selects one nondeterministically and passes it to
   * {@link #consume}. An empty result means the consuming command blocks.
   */
  public ImmutableList<Choice> matchConsume(Term pattern) throws TheoryException {
    return match(pattern);
  }

  /** Removes the fact selected by a choice previously returned by {@link #matchConsume}. */
  public void consume(Choice choice) {
    Preconditions.checkState(
        facts.remove(choice.getFact()), "fact %s already consumed", choice.getFact());
  }

  /**
   * Matches {@code pattern} against the facts without consuming any, as file reads do. Returns one
   * choice per distinct matching fact, any of which the reader may select; an empty result means
   * the reading command blocks.
   */
  public ImmutableList<Choice> read(Term pattern) throws TheoryException {
    return match(pattern);
  }

  private ImmutableList<Choice> match(Term pattern) throws TheoryException {
    ImmutableList.Builder<Choice> choices = ImmutableList.builder();
    for (Term fact : facts.elementSet()) {
      Substitution subst = theory.tryMatch(pattern, fact);
      if (subst != null) {
        choices.add(new Choice(fact, subst));
      }
    }
    return choices.build();
  }

  @Override
  public String toString() {
    return instance.getName() + facts;
  }
}
