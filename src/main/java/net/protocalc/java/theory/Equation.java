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

package net.protocalc.java.theory;

import com.google.common.base.Preconditions;
import net.protocalc.java.syntax.Location;

/**
 * An oriented equation {@code lhs = rhs}, used left to right as a rewrite rule. The left-hand side
 * is an application whose head symbol governs the equation; the variables of the right-hand side
 * are a subset of those of the left-hand side.
 */
public final class Equation {

  private final Term.Application lhs;
  private final Term rhs;
  private final Location location;

  Equation(Term.Application lhs, Term rhs, Location location) {
    this.lhs = Preconditions.checkNotNull(lhs);
    this.rhs = Preconditions.checkNotNull(rhs);
    this.location = location;
  }

  public Term.Application getLHS() {
    return lhs;
  }

  public Term getRHS() {
    return rhs;
  }

  /** Returns the symbol at the head of the left-hand side. */
  public FunctionSymbol getHead() {
    return lhs.getSymbol();
  }

  public Location getLocation() {
    return location;
  }

  @Override
  public String toString() {
    return lhs + " = " + rhs;
  }
}
