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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;

/**
 * The raw syntax tree of a whole model, as produced by the front end after all {@code load}
 * directives have been resolved by textual inclusion: the top-level declarations in source order,
 * followed by the single system composition.
 */
public final class ModelFile {

  private final String file;
  private final ImmutableList<Declaration> declarations;
  private final Composition composition;

  private ModelFile(
      String file, ImmutableList<Declaration> declarations, Composition composition) {
    this.file = file;
    this.declarations = declarations;
    this.composition = composition;
  }

  /** Returns the name of the root source file. */
  public String getFile() {
    return file;
  }

  public ImmutableList<Declaration> getDeclarations() {
    return declarations;
  }

  /** Returns the declarations of the specified kind, in source order. */
  public <T extends Declaration> ImmutableList<T> getDeclarations(
      Declaration.Kind kind, Class<T> type) {
    ImmutableList.Builder<T> result = ImmutableList.builder();
    for (Declaration decl : declarations) {
      if (decl.kind() == kind) {
        result.add(type.cast(decl));
      }
    }
    return result.build();
  }

  public Composition getComposition() {
    return composition;
  }

  /**
   * The {@code system} declaration: the process instances placed in parallel, each given as a call
   * of a process template on channel/file instances, and the lemmas to check.
   */
  public static final class Composition extends Node {
    private final ImmutableList<CallExpression> processes;
    private final ImmutableList<Declaration.Lemma> lemmas;

    private Composition(
        Location location,
        ImmutableList<CallExpression> processes,
        ImmutableList<Declaration.Lemma> lemmas) {
      super(location);
      this.processes = processes;
      this.lemmas = lemmas;
    }

    public static Composition of(
        Location location, List<CallExpression> processes, List<Declaration.Lemma> lemmas) {
      Preconditions.checkArgument(!processes.isEmpty(), "system composes no processes");
      Preconditions.checkArgument(!lemmas.isEmpty(), "system declares no lemmas");
      return new Composition(
          location, ImmutableList.copyOf(processes), ImmutableList.copyOf(lemmas));
    }

    public ImmutableList<CallExpression> getProcesses() {
      return processes;
    }

    public ImmutableList<Declaration.Lemma> getLemmas() {
      return lemmas;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  public static Builder builder(String file) {
    return new Builder(file);
  }

  /** A Builder accumulates declarations in source order. */
  public static final class Builder {
    private final String file;
    private final List<Declaration> declarations = new ArrayList<>();

    private Builder(String file) {
      this.file = file;
    }

    @CanIgnoreReturnValue
    public Builder add(Declaration decl) {
      declarations.add(decl);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addAll(Iterable<? extends Declaration> decls) {
      for (Declaration decl : decls) {
        declarations.add(decl);
      }
      return this;
    }

    public ModelFile build(Composition composition) {
      return new ModelFile(file, ImmutableList.copyOf(declarations), composition);
    }
  }
}
