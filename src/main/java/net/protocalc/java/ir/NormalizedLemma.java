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

import com.google.common.base.Preconditions;
import net.protocalc.java.syntax.Declaration.LemmaKind;
import net.protocalc.java.syntax.Location;

/**
 * A NormalizedLemma is a lemma in canonical form: a closed {@link TraceFormula} that must hold on
 * all traces, or on at least one trace, of the compiled system.
 */
public final class NormalizedLemma {

  /** Whether the formula must hold on every trace or on some trace. */
  public enum TraceQuantifier {
    ALL_TRACES,
    EXISTS_TRACE;

    @Override
    public String toString() {
      return super.toString().toLowerCase().replace('_', '-');
    }
  }

  private final String name;
  private final LemmaKind sourceKind;
  private final TraceQuantifier quantifier;
  private final TraceFormula formula;
  private final Location location;

  public NormalizedLemma(
      String name,
      LemmaKind sourceKind,
      TraceQuantifier quantifier,
      TraceFormula formula,
      Location location) {
    Preconditions.checkArgument(
        formula.freeVariables().isEmpty(),
        "lemma %s is not closed: %s",
        name,
        formula.freeVariables());
    this.name = name;
    this.sourceKind = sourceKind;
    this.quantifier = quantifier;
    this.formula = formula;
    this.location = location;
  }

  public String getName() {
    return name;
  }

  /** Returns the kind the lemma was declared with. */
  public LemmaKind getSourceKind() {
    return sourceKind;
  }

  public TraceQuantifier getQuantifier() {
    return quantifier;
  }

  public TraceFormula getFormula() {
    return formula;
  }

  public Location getLocation() {
    return location;
  }

  @Override
  public String toString() {
    return "lemma " + name + ": " + quantifier + " " + formula;
  }
}
