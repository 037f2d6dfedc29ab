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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Syntax node for a tuple {@code (a, b, ...)} of at least two elements. The elaborator encodes it
 * as right-nested applications of the built-in {@code pair} constructor.
 */
public final class TupleExpression extends Expression {

  private final ImmutableList<Expression> elements;

  TupleExpression(Location location, ImmutableList<Expression> elements) {
    super(location, Kind.TUPLE);
    Preconditions.checkArgument(elements.size() >= 2, "tuple needs two or more elements");
    this.elements = elements;
  }

  public static TupleExpression of(Location location, List<Expression> elements) {
    return new TupleExpression(location, ImmutableList.copyOf(elements));
  }

  public ImmutableList<Expression> getElements() {
    return elements;
  }

  @Override
  public String toString() {
    return "(" + Joiner.on(", ").join(elements) + ")";
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
