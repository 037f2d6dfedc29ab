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

/**
 * Syntax node for a guard atom {@code lhs = rhs} or {@code lhs != rhs}, compared modulo the
 * equational theory. A branch or until arm is guarded by a conjunction of such atoms.
 */
public final class Guard extends Node {

  private final Expression lhs;
  private final Expression rhs;
  private final boolean equal;

  Guard(Location location, Expression lhs, Expression rhs, boolean equal) {
    super(location);
    this.lhs = lhs;
    this.rhs = rhs;
    this.equal = equal;
  }

  public static Guard equal(Location location, Expression lhs, Expression rhs) {
    return new Guard(location, lhs, rhs, true);
  }

  public static Guard notEqual(Location location, Expression lhs, Expression rhs) {
    return new Guard(location, lhs, rhs, false);
  }

  public Expression getLHS() {
    return lhs;
  }

  public Expression getRHS() {
    return rhs;
  }

  /** Reports whether this is an equality (as opposed to an inequality) test. */
  public boolean isEqual() {
    return equal;
  }

  @Override
  public String toString() {
    return lhs + (equal ? " = " : " != ") + rhs;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
