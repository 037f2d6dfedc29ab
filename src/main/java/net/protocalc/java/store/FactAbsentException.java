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

import net.protocalc.java.theory.Term;

/** Thrown by {@link Store#remove} when no occurrence of the fact is present. */
public final class FactAbsentException extends Exception {

  private final String instance;
  private final Term fact;

  FactAbsentException(String instance, Term fact) {
    super(String.format("fact '%s' is not present in '%s'", fact, instance));
    this.instance = instance;
    this.fact = fact;
  }

  public String getInstance() {
    return instance;
  }

  public Term getFact() {
    return fact;
  }
}
