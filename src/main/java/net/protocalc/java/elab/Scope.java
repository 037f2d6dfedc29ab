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

import com.google.common.base.Preconditions;
import java.util.HashMap;
import java.util.Map;
import javax.annotation.Nullable;
import net.protocalc.java.theory.Term;

/**
 * A Scope is one block of local bindings during elaboration, linked to its enclosing block.
 *
 * <p>A process body, each branch or until arm, each loop body and each inlined syscall or attack
 * body is a block. A name may be bound at most once per block, but a nested block may shadow a
 * binding of an enclosing one. The body of an inlined call starts a new chain: it cannot see the
 * locals of its caller.
 */
final class Scope {

  /** What a local name denotes. */
  static final class Binding {
    @Nullable private final Term value;
    @Nullable private final String instance;

    private Binding(@Nullable Term value, @Nullable String instance) {
      this.value = value;
      this.instance = instance;
    }

    /** A name bound to a term, such as an IR variable or a call-by-value argument. */
    static Binding value(Term value) {
      return new Binding(Preconditions.checkNotNull(value), null);
    }

    /** A formal parameter bound to a channel or file instance. */
    static Binding instance(String instance) {
      return new Binding(null, Preconditions.checkNotNull(instance));
    }

    boolean isInstance() {
      return instance != null;
    }

    /** Returns the term; not valid for instance bindings. */
    Term getValue() {
      Preconditions.checkState(value != null, "instance binding has no value");
      return value;
    }

    /** Returns the instance name; not valid for value bindings. */
    String getInstance() {
      Preconditions.checkState(instance != null, "value binding has no instance");
      return instance;
    }

    @Override
    public String toString() {
      return instance != null ? "instance " + instance : String.valueOf(value);
    }
  }

  @Nullable private final Scope parent;
  private final Map<String, Binding> bindings = new HashMap<>();

  private Scope(@Nullable Scope parent) {
    this.parent = parent;
  }

  /** Returns a new outermost block. */
  static Scope root() {
    return new Scope(null);
  }

  /** Returns a new block nested in this one. */
  Scope child() {
    return new Scope(this);
  }

  /**
   * Binds {@code name} in this block. Returns false, leaving the existing binding, if the name is
   * already bound in this same block.
   */
  boolean bind(String name, Binding binding) {
    return bindings.putIfAbsent(name, binding) == null;
  }

  /** Returns the innermost binding of {@code name}, or null if it is unbound. */
  @Nullable
  Binding lookup(String name) {
    for (Scope s = this; s != null; s = s.parent) {
      Binding b = s.bindings.get(name);
      if (b != null) {
        return b;
      }
    }
    return null;
  }
}
