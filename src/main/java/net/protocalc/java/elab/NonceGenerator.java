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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.protocalc.java.theory.Term;

/**
 * Allocates the nonces of one compilation. Each generation act of the compiled system ({@code new
 * x} in any process instance, in any alternative of an attacker-controlled call site, or a fresh
 * constant of the init sequence) obtains its nonce by calling {@link #generate}, and the returned
 * nonce is distinct from every other nonce allocated by the same generator.
 *
 * <p>The generator is an explicit object threaded through elaboration, not a global counter, so
 * that two compilations of the same model allocate identical ids: nonces are identified by the
 * {@link #getOwner owner} of the compilation and an index counting earlier allocations.
 */
public final class NonceGenerator {

  private final String owner;
  private final List<Term.Nonce> allocated = new ArrayList<>();

  private NonceGenerator(String owner) {
    this.owner = owner;
  }

  /** Creates a generator for the compilation of the model identified by {@code owner}. */
  public static NonceGenerator create(String owner) {
    return new NonceGenerator(owner);
  }

  public String getOwner() {
    return owner;
  }

  /** Returns a new nonce, labelled with the source name of the variable it is bound to. */
  public Term.Nonce generate(String label) {
    Term.Nonce nonce = Term.nonce(label, allocated.size());
    allocated.add(nonce);
    return nonce;
  }

  /** Returns the number of nonces allocated so far. */
  public int size() {
    return allocated.size();
  }

  /** Returns every nonce allocated so far, in allocation order. */
  public ImmutableList<Term.Nonce> getAllocated() {
    return ImmutableList.copyOf(allocated);
  }
}
