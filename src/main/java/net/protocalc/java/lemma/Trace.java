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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;
import net.protocalc.java.theory.Term;

/** A finite trace: the sequence of events emitted by one run of a system, in order. */
public final class Trace {

  private final ImmutableList<Term.Application> events;

  private Trace(ImmutableList<Term.Application> events) {
    this.events = events;
  }

  public static Trace of(List<Term.Application> events) {
    return new Trace(ImmutableList.copyOf(events));
  }

  public static Trace of(Term.Application... events) {
    return new Trace(ImmutableList.copyOf(events));
  }

  public ImmutableList<Term.Application> getEvents() {
    return events;
  }

  public int size() {
    return events.size();
  }

  @Override
  public String toString() {
    return "[" + Joiner.on(", ").join(events) + "]";
  }
}
