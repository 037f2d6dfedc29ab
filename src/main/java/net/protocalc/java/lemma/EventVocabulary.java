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

package net.protocalc.java.lemma;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import net.protocalc.java.ir.ProcessInstance;
import net.protocalc.java.ir.Transition;
import net.protocalc.java.ir.TransitionGraph;
import net.protocalc.java.theory.FunctionSymbol;
import net.protocalc.java.theory.Term;

/**
 * The EventVocabulary records every event emission site of a composed system: the events each
 * process instance can emit, in the order of their per-process ordinals. Lemmas may only mention
 * events of the vocabulary.
 */
public final class EventVocabulary {

  /** One emission site. */
  public static final class EventSite {
    private final String process;
    private final int node;
    private final int ordinal;
    private final Term.Application event;

    EventSite(String process, int node, int ordinal, Term.Application event) {
      this.process = process;
      this.node = node;
      this.ordinal = ordinal;
      this.event = event;
    }

    /** Returns the name of the emitting process instance. */
    public String getProcess() {
      return process;
    }

    /** Returns the index of the EMIT node in the process's transition graph. */
    public int getNode() {
      return node;
    }

    public int getOrdinal() {
      return ordinal;
    }

    public String getTag() {
      return event.getSymbol().getName();
    }

    public int getArity() {
      return event.getSymbol().getArity();
    }

    public Term.Application getEvent() {
      return event;
    }

    @Override
    public String toString() {
      return process + "#" + ordinal + " " + event;
    }
  }

  private final ImmutableList<EventSite> sites;
  private final ImmutableListMultimap<FunctionSymbol, EventSite> byTag;

  private EventVocabulary(ImmutableList<EventSite> sites) {
    this.sites = sites;
    ImmutableListMultimap.Builder<FunctionSymbol, EventSite> byTag =
        ImmutableListMultimap.builder();
    for (EventSite site : sites) {
      byTag.put(site.getEvent().getSymbol(), site);
    }
    this.byTag = byTag.build();
  }

  /** Collects the emission sites of {@code processes}. */
  public static EventVocabulary of(List<ProcessInstance> processes) {
    ImmutableList.Builder<EventSite> sites = ImmutableList.builder();
    for (ProcessInstance process : processes) {
      TransitionGraph graph = process.getGraph();
      for (int i : graph.indicesOf(Transition.Kind.EMIT)) {
        Transition.Emit emit = (Transition.Emit) graph.get(i);
        sites.add(new EventSite(process.getName(), i, emit.getOrdinal(), emit.getEvent()));
      }
    }
    return new EventVocabulary(sites.build());
  }

  /** Returns all sites, by process and then by node index. */
  public ImmutableList<EventSite> getSites() {
    return sites;
  }

  /** Returns the sites emitting events tagged {@code tag} with {@code arity} arguments. */
  public ImmutableList<EventSite> sitesOf(String tag, int arity) {
    return byTag.get(FunctionSymbol.of(tag, arity));
  }

  /** Reports whether some process emits an event tagged {@code tag} with {@code arity} arguments. */
  public boolean contains(String tag, int arity) {
    return byTag.containsKey(FunctionSymbol.of(tag, arity));
  }

  /** Returns the distinct tags, as "Tag/arity" symbols, in order of first emission site. */
  public ImmutableSet<FunctionSymbol> getTags() {
    return byTag.keySet();
  }
}
