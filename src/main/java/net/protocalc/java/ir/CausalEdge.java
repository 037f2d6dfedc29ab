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

import com.google.auto.value.AutoValue;

/**
 * A CausalEdge states that the consuming (or reading) store operation at {@code consumer} can only
 * happen after the insertion at {@code producer} that supplied its fact. Edges connect nodes of
 * possibly different process instances; they hold under every schedule.
 */
@AutoValue
public abstract class CausalEdge {

  public abstract String instance();

  public abstract String producerProcess();

  public abstract int producerNode();

  public abstract String consumerProcess();

  public abstract int consumerNode();

  public static CausalEdge create(
      String instance,
      String producerProcess,
      int producerNode,
      String consumerProcess,
      int consumerNode) {
    return new AutoValue_CausalEdge(
        instance, producerProcess, producerNode, consumerProcess, consumerNode);
  }

  /** Returns "producer#node -> consumer#node via instance". */
  @Override
  public final String toString() {
    return String.format(
        "%s#%d -> %s#%d via %s",
        producerProcess(), producerNode(), consumerProcess(), consumerNode(), instance());
  }
}
