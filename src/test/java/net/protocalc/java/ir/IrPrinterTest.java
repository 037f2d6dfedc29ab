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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.base.Joiner;
import net.protocalc.java.elab.SystemCompiler;
import net.protocalc.java.syntax.CompilerOptions;
import net.protocalc.java.syntax.TestModels;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Golden test of the text form of a compiled system. */
@RunWith(JUnit4.class)
public class IrPrinterTest {

  @Test
  public void testSymmetricHandshake() throws Exception {
    CompiledSystem system = SystemCompiler.compile(TestModels.symmetric(), CompilerOptions.DEFAULT);
    String expected =
        Joiner.on('\n')
            .join(
                "system test.pcl",
                "theory",
                "  symbols pair/2, fst/1, snd/1, senc/2, sdec/2",
                "  equation fst(pair(x, y)) = x",
                "  equation snd(pair(x, y)) = y",
                "  equation sdec(senc(x, y), y) = x",
                "stores",
                "  attacker",
                "  net: net_ty",
                "  nonces: disk_ty = ~n.1",
                "init",
                "  new k = ~k.0",
                "  new n = ~n.1",
                "process Client = Client{ch=net, f=nonces}: client_ty",
                "  0: start Client -> 1",
                "  1: new msg = ~msg.2 -> 2",
                "  2: read nonces v -> 3",
                "  3: get_nonce_result := v -> 4",
                "  4: nonce := get_nonce_result -> 5",
                "  5: event#0 Sent(msg) -> 6",
                "  6: insert net senc(pair(msg, nonce), ~k.0) -> 7",
                "  7: end",
                "process Server = Server{ch=net, f=nonces}: server_ty",
                "  0: start Server -> 1",
                "  1: consume net x -> 2",
                "  2: recv_result := x -> 3",
                "  3: r := recv_result -> 4",
                "  4: read nonces v -> 5",
                "  5: get_nonce_result := v -> 6",
                "  6: nonce := get_nonce_result -> 7",
                "  7: guard case 1 [snd(sdec(r, ~k.0)) = nonce] -> 8",
                "  8: event#0 Valid(fst(sdec(r, ~k.0))) -> 9",
                "  9: end",
                "edges",
                "  Client#6 -> Server#1 via net",
                "lemma valid_reachable: exists-trace exists m #i1 #i2. (Sent(m) @ #i1 & Valid(m) @"
                    + " #i2 & #i1 < #i2)",
                "lemma valid_auth: all-traces forall m #i. (Valid(m) @ #i ==> exists #j. (Sent(m)"
                    + " @ #j & #j < #i))",
                "");
    assertThat(IrPrinter.print(system)).isEqualTo(expected);
  }

  @Test
  public void testGraphHasNoIndent() throws Exception {
    CompiledSystem system = SystemCompiler.compile(TestModels.injection(), CompilerOptions.DEFAULT);
    String graph = IrPrinter.print(system.getProcess("Client").getGraph());
    assertThat(graph).startsWith("0: start Client -> 1\n1: choose recv [normal:recv,");
    assertThat(graph).endsWith("18: end\n");
    // No causal edges and no init sequence: those sections are left out.
    assertThat(IrPrinter.print(system)).doesNotContain("edges");
    assertThat(IrPrinter.print(system)).doesNotContain("init");
  }
}
