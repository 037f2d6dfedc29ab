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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import net.protocalc.java.policy.AccessPolicy;
import net.protocalc.java.syntax.CompileError;
import net.protocalc.java.syntax.Location;
import net.protocalc.java.syntax.TypeKind;
import net.protocalc.java.theory.FunctionSymbol;
import net.protocalc.java.theory.Term;
import net.protocalc.java.theory.Theory;
import net.protocalc.java.theory.TheoryException;

/**
 * The StoreModel is the registry of channel and file instances of a model. It always contains the
 * reserved {@value #ATTACKER} instance, the attacker's knowledge: a term inserted there is leaked
 * (recorded as {@code Out(t)}), and a pattern consumed from there is supplied by the attacker
 * (matched against {@code In(p)}).
 */
public final class StoreModel {

  /** The name of the reserved attacker knowledge store. */
  public static final String ATTACKER = "attacker";

  /** The fact constructor for terms the attacker learns. */
  public static final FunctionSymbol OUT = FunctionSymbol.of("Out", 1);

  /** The fact constructor for terms the attacker supplies. */
  public static final FunctionSymbol IN = FunctionSymbol.of("In", 1);

  private final ImmutableMap<String, StoreInstance> instances;

  private StoreModel(ImmutableMap<String, StoreInstance> instances) {
    this.instances = instances;
  }

  /** Returns the instance of the specified name, or null. */
  @Nullable
  public StoreInstance get(String name) {
    return instances.get(name);
  }

  /** Returns all instances in declaration order, the attacker store first. */
  public ImmutableList<StoreInstance> getInstances() {
    return instances.values().asList();
  }

  /** Returns the fact recording that the attacker learned {@code term}. */
  public static Term leakFact(Term term) {
    return Term.apply(OUT, term);
  }

  /** Returns the fact pattern of a term supplied by the attacker. */
  public static Term injectFact(Term pattern) {
    return Term.apply(IN, pattern);
  }

  /** Returns fresh stores for every instance, seeded with the initial contents. */
  public ImmutableMap<String, Store> newStores(Theory theory) throws TheoryException {
    ImmutableMap.Builder<String, Store> stores = ImmutableMap.builder();
    for (StoreInstance instance : instances.values()) {
      Store store = new Store(instance, theory);
      if (instance.getContent() != null) {
        store.insert(instance.getContent());
      }
      stores.put(instance.getName(), store);
    }
    return stores.buildOrThrow();
  }

  public static Builder builder(AccessPolicy policy, List<CompileError> errors) {
    return new Builder(policy, errors);
  }

  /** A Builder accumulates instance declarations. */
  public static final class Builder {
    private final AccessPolicy policy;
    private final List<CompileError> errors;
    private final Map<String, StoreInstance> instances = new LinkedHashMap<>();

    private Builder(AccessPolicy policy, List<CompileError> errors) {
      this.policy = policy;
      this.errors = errors;
      instances.put(ATTACKER, new StoreInstance(ATTACKER, null, null, null, Location.BUILTIN));
    }

    @FormatMethod
    private void errorf(
        CompileError.Kind kind, Location loc, String decl, String format, Object... args) {
      errors.add(new CompileError(kind, loc, decl, String.format(format, args)));
    }

    /**
     * Declares an instance. Reports {@code DuplicateSymbol} if the name is taken, and {@code
     * UnknownType} if the type is undeclared or is not a channel or filesys type. The content, if
     * any, must be ground.
     */
    @CanIgnoreReturnValue
    public Builder declare(String name, String typeName, @Nullable Term content, Location loc) {
      if (instances.containsKey(name)) {
        errorf(
            CompileError.Kind.DUPLICATE_SYMBOL,
            loc,
            name,
            "channel or file '%s' is already declared",
            name);
        return this;
      }
      TypeKind kind = policy.kindOf(typeName);
      if (kind == null) {
        errorf(CompileError.Kind.UNKNOWN_TYPE, loc, name, "type '%s' is not declared", typeName);
        return this;
      }
      if (kind == TypeKind.PROCESS) {
        errorf(
            CompileError.Kind.UNKNOWN_TYPE,
            loc,
            name,
            "type '%s' is a process type, not a channel or filesys type",
            typeName);
        return this;
      }
      if (content != null && !content.isGround()) {
        errorf(
            CompileError.Kind.UNBOUND_VARIABLE,
            loc,
            name,
            "initial content '%s' has unbound variables %s",
            content,
            content.variables());
        return this;
      }
      instances.put(name, new StoreInstance(name, typeName, kind, content, loc));
      return this;
    }

    public StoreModel build() {
      return new StoreModel(ImmutableMap.copyOf(instances));
    }
  }
}
