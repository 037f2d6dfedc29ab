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
import java.util.Objects;
import net.protocalc.java.theory.Term;

/** A Condition is an equality or inequality of two terms, modulo the equational theory. */
public final class Condition {

  private final Term lhs;
  private final Term rhs;
  private final boolean equal;

  private Condition(Term lhs, Term rhs, boolean equal) {
    this.lhs = Preconditions.checkNotNull(lhs);
    this.rhs = Preconditions.checkNotNull(rhs);
    this.equal = equal;
  }

  public static Condition equal(Term lhs, Term rhs) {
    return new Condition(lhs, rhs, true);
  }

  public static Condition notEqual(Term lhs, Term rhs) {
    return new Condition(lhs, rhs, false);
  }

  public Term getLHS() {
    return lhs;
  }

  public Term getRHS() {
    return rhs;
  }

  public boolean isEqual() {
    return equal;
  }

  /** Returns the condition with the opposite polarity. */
  public Condition negate() {
    return new Condition(lhs, rhs, !equal);
  }

  @Override
  public boolean equals(Object that) {
    if (!(that instanceof Condition)) {
      return false;
    }
    Condition c = (Condition) that;
    return equal == c.equal && lhs.equals(c.lhs) && rhs.equals(c.rhs);
  }

  @Override
  public int hashCode() {
    return Objects.hash(lhs, rhs, equal);
  }

  @Override
  public String toString() {
    return lhs + (equal ? " = " : " != ") + rhs;
  }
}
