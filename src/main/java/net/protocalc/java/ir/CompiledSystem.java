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

import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;
import net.protocalc.java.store.StoreModel;
import net.protocalc.java.theory.Theory;

/**
 * A CompiledSystem is the output of the compiler and the contract consumed by backend adapters:
 * the closed theory, the channel and file instances, the generation acts of the system's fresh
 * constants, the transition graph of each process instance, the causal precedence edges between
 * store operations, and the normalized lemmas.
 *
 * <p>It is independent of any concrete prover syntax; see {@link IrPrinter} for a textual form.
 */
public final class CompiledSystem {

  private final String name;
  private final Theory theory;
  private final StoreModel storeModel;
  private final ImmutableList<Transition.Fresh> init;
  private final ImmutableList<ProcessInstance> processes;
  private final ImmutableList<CausalEdge> causalEdges;
  private final ImmutableList<NormalizedLemma> lemmas;

  public CompiledSystem(
      String name,
      Theory theory,
      StoreModel storeModel,
      ImmutableList<Transition.Fresh> init,
      ImmutableList<ProcessInstance> processes,
      ImmutableList<CausalEdge> causalEdges,
      ImmutableList<NormalizedLemma> lemmas) {
    this.name = name;
    this.theory = theory;
    this.storeModel = storeModel;
    this.init = init;
    this.processes = processes;
    this.causalEdges = causalEdges;
    this.lemmas = lemmas;
  }

  /** Returns the name of the model file the system was compiled from. */
  public String getName() {
    return name;
  }

  public Theory getTheory() {
    return theory;
  }

  public StoreModel getStoreModel() {
    return storeModel;
  }

  /**
   * Returns the init sequence: one generation act per fresh constant, executed once before any
   * process instance starts.
   */
  public ImmutableList<Transition.Fresh> getInit() {
    return init;
  }

  public ImmutableList<ProcessInstance> getProcesses() {
    return processes;
  }

  /** Returns the process instance of the specified name, or null. */
  @Nullable
  public ProcessInstance getProcess(String name) {
    for (ProcessInstance process : processes) {
      if (process.getName().equals(name)) {
        return process;
      }
    }
    return null;
  }

  public ImmutableList<CausalEdge> getCausalEdges() {
    return causalEdges;
  }

  public ImmutableList<NormalizedLemma> getLemmas() {
    return lemmas;
  }

  @Override
  public String toString() {
    return IrPrinter.print(this);
  }
}
