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
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import javax.annotation.Nullable;
import net.protocalc.java.ir.Transition;
import net.protocalc.java.policy.AccessPolicy;
import net.protocalc.java.store.StoreModel;
import net.protocalc.java.syntax.CompilerOptions;
import net.protocalc.java.syntax.Declaration;
import net.protocalc.java.theory.Term;
import net.protocalc.java.theory.Theory;

/**
 * The Environment is the result of the declaration phase: every global entity of a model, checked
 * and closed. It is read-only, except for the {@link NonceGenerator}, which process elaboration
 * continues to draw from.
 */
public final class Environment {

  private final String file;
  private final CompilerOptions options;
  private final Theory theory;
  private final AccessPolicy policy;
  private final StoreModel storeModel;
  private final NonceGenerator nonces;
  private final ImmutableMap<String, Term> constants;
  private final ImmutableList<Transition.Fresh> init;
  private final ImmutableMap<String, Declaration.Syscall> syscalls;
  private final ImmutableMap<String, Declaration.Attack> attacks;
  private final ImmutableListMultimap<String, Declaration.Attack> attacksByTarget;
  private final ImmutableMap<String, Declaration.Process> processes;

  Environment(
      String file,
      CompilerOptions options,
      Theory theory,
      AccessPolicy policy,
      StoreModel storeModel,
      NonceGenerator nonces,
      ImmutableMap<String, Term> constants,
      ImmutableList<Transition.Fresh> init,
      ImmutableMap<String, Declaration.Syscall> syscalls,
      ImmutableMap<String, Declaration.Attack> attacks,
      ImmutableMap<String, Declaration.Process> processes) {
    this.file = file;
    this.options = options;
    this.theory = theory;
    this.policy = policy;
    this.storeModel = storeModel;
    this.nonces = nonces;
    this.constants = constants;
    this.init = init;
    this.syscalls = syscalls;
    this.attacks = attacks;
    ImmutableListMultimap.Builder<String, Declaration.Attack> byTarget =
        ImmutableListMultimap.builder();
    for (Declaration.Attack attack : attacks.values()) {
      if (attack.isActive()) {
        byTarget.put(attack.getTarget(), attack);
      }
    }
    this.attacksByTarget = byTarget.build();
    this.processes = processes;
  }

  public String getFile() {
    return file;
  }

  public CompilerOptions getOptions() {
    return options;
  }

  public Theory getTheory() {
    return theory;
  }

  public AccessPolicy getPolicy() {
    return policy;
  }

  public StoreModel getStoreModel() {
    return storeModel;
  }

  NonceGenerator getNonces() {
    return nonces;
  }

  /**
   * Returns the term denoted by a declared constant: a public constant, or, for a fresh constant,
   * the nonce allocated to it by the init sequence. Returns null if there is no such constant.
   */
  @Nullable
  public Term getConstant(String name) {
    return constants.get(name);
  }

  /** Returns the terms of all declared constants, by name. */
  public ImmutableMap<String, Term> getConstants() {
    return constants;
  }

  /** Returns the generation acts of the fresh constants, in declaration order. */
  public ImmutableList<Transition.Fresh> getInit() {
    return init;
  }

  /** Returns the syscall of the specified name, user-declared or built-in, or null. */
  @Nullable
  public Declaration.Syscall getSyscall(String name) {
    return syscalls.get(name);
  }

  public ImmutableMap<String, Declaration.Syscall> getSyscalls() {
    return syscalls;
  }

  @Nullable
  public Declaration.Attack getAttack(String name) {
    return attacks.get(name);
  }

  public ImmutableMap<String, Declaration.Attack> getAttacks() {
    return attacks;
  }

  /** Returns the active attacks that override {@code syscall}, in declaration order. */
  public ImmutableList<Declaration.Attack> getAttacksOn(String syscall) {
    return attacksByTarget.get(syscall);
  }

  @Nullable
  public Declaration.Process getProcess(String name) {
    return processes.get(name);
  }
}
