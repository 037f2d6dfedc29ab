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

import com.google.auto.value.AutoValue;

/**
 * CompilerOptions is the set of options that affect the static elaboration of a model. They are
 * analogous to the command-line options of a typical compiler; the driver that owns the command
 * line is responsible for populating them.
 *
 * <p>The {@link #DEFAULT} options represent the intended dialect. Each option either bounds a
 * search the compiler performs or disables a static check that some legacy models fail.
 */
@AutoValue
public abstract class CompilerOptions {

  /** The default options. */
  public static final CompilerOptions DEFAULT = builder().build();

  /**
   * The number of rewrite steps allowed per declared equation when normalizing a single term. The
   * effective limit is this value times the number of equations (at least one). Exceeding it is a
   * {@code TheoryDivergence} error.
   */
  public abstract int rewriteStepsPerEquation();

  /**
   * When translating a {@code reachable E1, ..., En} lemma, require the listed events to occur in
   * the order given.
   */
  public abstract boolean orderReachableEvents();

  /** Reject lemmas that mention an event tag no process of the system emits. */
  public abstract boolean checkEventVocabulary();

  /**
   * Report a {@code FactAbsent} error for a removal of a ground fact that no insertion site and no
   * initial file content can supply.
   */
  public abstract boolean detectStaticFactAbsence();

  /**
   * Offer the attacker's replacement body as an alternative continuation at every call site where
   * an active attack is granted. Disabling this compiles the honest system only.
   */
  public abstract boolean composeActiveAttacks();

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_CompilerOptions.Builder()
        .rewriteStepsPerEquation(1000)
        .orderReachableEvents(true)
        .checkEventVocabulary(true)
        .detectStaticFactAbsence(true)
        .composeActiveAttacks(true);
  }

  public abstract Builder toBuilder();

  /** Builder for {@link CompilerOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder rewriteStepsPerEquation(int value);

    public abstract Builder orderReachableEvents(boolean value);

    public abstract Builder checkEventVocabulary(boolean value);

    public abstract Builder detectStaticFactAbsence(boolean value);

    public abstract Builder composeActiveAttacks(boolean value);

    public abstract CompilerOptions build();
  }
}
