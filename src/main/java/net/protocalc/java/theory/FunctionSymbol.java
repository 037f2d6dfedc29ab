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

/**
 * A FunctionSymbol is a name with a fixed arity. Symbols are values: two symbols are equal if they
 * have the same name and arity, whether or not either was declared in a theory. Event tags and
 * fact constructors such as {@code In} and {@code Out} are undeclared symbols.
 */
public final class FunctionSymbol {

  /** The built-in pairing constructor. */
  public static final FunctionSymbol PAIR = new FunctionSymbol("pair", 2);

  /** The built-in first projection, {@code fst(pair(x, y)) = x}. */
  public static final FunctionSymbol FST = new FunctionSymbol("fst", 1);

  /** The built-in second projection, {@code snd(pair(x, y)) = y}. */
  public static final FunctionSymbol SND = new FunctionSymbol("snd", 1);

  private final String name;
  private final int arity;

  private FunctionSymbol(String name, int arity) {
    this.name = Preconditions.checkNotNull(name);
    Preconditions.checkArgument(arity >= 0, "negative arity %s for %s", arity, name);
    this.arity = arity;
  }

  public static FunctionSymbol of(String name, int arity) {
    return new FunctionSymbol(name, arity);
  }

  public String getName() {
    return name;
  }

  public int getArity() {
    return arity;
  }

  @Override
  public boolean equals(Object that) {
    return this == that
        || (that instanceof FunctionSymbol
            && this.name.equals(((FunctionSymbol) that).name)
            && this.arity == ((FunctionSymbol) that).arity);
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + arity;
  }

  /** Returns "name/arity". */
  @Override
  public String toString() {
    return name + "/" + arity;
  }
}
