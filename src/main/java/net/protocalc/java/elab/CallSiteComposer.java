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

package net.protocalc.java.elab;

import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;
import net.protocalc.java.ir.Transition;
import net.protocalc.java.syntax.Command;
import net.protocalc.java.syntax.Declaration;
import net.protocalc.java.syntax.Identifier;

/**
 * Decides where the attacker may intercept a syscall call, and what the intercepted call site
 * offers.
 *
 * <p>A call of syscall {@code s} by a process of type {@code T} addressed to an object of type
 * {@code O} is intercepted by each active attack {@code a} on {@code s} for which an attacker grant
 * for {@code T} or {@code O} lists {@code a}. The call site then becomes a choice, resolved by the
 * attacker, between exactly one honest continuation and one continuation per intercepting attack.
 * Calls inside attack bodies are never intercepted.
 */
final class CallSiteComposer {

  /** One continuation of an intercepted call site: the honest syscall body or an attack body. */
  static final class Continuation {
    private final Transition.Alternative alternative;
    private final ImmutableList<Identifier> parameters;
    private final Command body;

    private Continuation(
        Transition.Alternative alternative, ImmutableList<Identifier> parameters, Command body) {
      this.alternative = alternative;
      this.parameters = parameters;
      this.body = body;
    }

    String getName() {
      return alternative.getName();
    }

    boolean isAttack() {
      return alternative.getKind() == Transition.AlternativeKind.ATTACK;
    }

    ImmutableList<Identifier> getParameters() {
      return parameters;
    }

    Command getBody() {
      return body;
    }

    Transition.Alternative getAlternative() {
      return alternative;
    }

    @Override
    public String toString() {
      return alternative.toString();
    }
  }

  private final Environment env;
  private final String processType;

  CallSiteComposer(Environment env, String processType) {
    this.env = env;
    this.processType = processType;
  }

  /**
   * Returns the active attacks that intercept a call of {@code syscall} addressed to an object of
   * type {@code objectType} (null if none), or an empty list if the call is not intercepted.
   */
  ImmutableList<Declaration.Attack> applicableAttacks(
      String syscall, @Nullable String objectType) {
    if (!env.getOptions().composeActiveAttacks()) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<Declaration.Attack> result = ImmutableList.builder();
    for (Declaration.Attack attack : env.getAttacksOn(syscall)) {
      if (env.getPolicy().attackerMayInvokeAt(processType, objectType, attack.getName())) {
        result.add(attack);
      }
    }
    return result.build();
  }

  /** Returns the continuations of an intercepted call site: the honest one first. */
  ImmutableList<Continuation> continuations(
      Declaration.Syscall syscall, ImmutableList<Declaration.Attack> attacks) {
    ImmutableList.Builder<Continuation> result = ImmutableList.builder();
    result.add(
        new Continuation(
            Transition.Alternative.normal(syscall.getName()),
            syscall.getParameters(),
            syscall.getBody()));
    for (Declaration.Attack attack : attacks) {
      result.add(
          new Continuation(
              Transition.Alternative.attack(attack.getName()),
              attack.getParameters(),
              attack.getBody()));
    }
    return result.build();
  }

  /** Returns the choice node of an intercepted call site, listing its continuations in order. */
  Transition.Alternatives choice(String syscall, ImmutableList<Continuation> continuations) {
    ImmutableList.Builder<Transition.Alternative> alternatives = ImmutableList.builder();
    for (Continuation cont : continuations) {
      alternatives.add(cont.getAlternative());
    }
    return Transition.alternatives(syscall, alternatives.build());
  }
}
