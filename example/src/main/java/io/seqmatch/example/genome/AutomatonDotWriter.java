/*
 * Copyright 2026 The Netty Project
 *
 * The Netty Project licenses this file to you under the Apache License, version 2.0 (the
 * "License"); you may not use this file except in compliance with the License. You may obtain a
 * copy of the License at:
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */
package io.seqmatch.example.genome;

import io.seqmatch.automaton.NucleotideAlphabet;
import io.seqmatch.automaton.NucleotideAutomaton;

import java.io.IOException;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Writes the tables of a {@link NucleotideAutomaton} as a <a href="https://graphviz.org/">Graphviz</a> DOT graph.
 * Trie edges are labelled with their symbol, failure links are drawn dashed (links to the root are left out),
 * the root is blue and nodes with a non-empty output are green.
 */
public final class AutomatonDotWriter {

    private final NucleotideAutomaton automaton;

    public AutomatonDotWriter(NucleotideAutomaton automaton) {
        this.automaton = checkNotNull(automaton, "automaton");
    }

    public void write(Appendable out) throws IOException {
        checkNotNull(out, "out");
        out.append("digraph automaton {\n");
        out.append("    rankdir=LR;\n");
        out.append("    node [shape=circle, style=filled, fillcolor=red];\n");
        out.append("    0 [fillcolor=blue];\n");
        for (int node = 1; node < automaton.nodeCount(); node++) {
            if (!automaton.output(node).isEmpty()) {
                out.append("    ").append(String.valueOf(node)).append(" [fillcolor=green, tooltip=\"");
                out.append(String.join(" ", automaton.output(node))).append("\"];\n");
            }
        }
        for (int node = 0; node < automaton.nodeCount(); node++) {
            for (int symbol = 0; symbol < NucleotideAlphabet.SIZE; symbol++) {
                int next = automaton.transition(node, symbol);
                if (next != NucleotideAutomaton.NO_NODE && next != NucleotideAutomaton.ROOT) {
                    out.append("    ").append(String.valueOf(node)).append(" -> ").append(String.valueOf(next))
                       .append(" [label=\"").append(NucleotideAlphabet.symbol(symbol)).append("\"];\n");
                }
            }
        }
        for (int node = 1; node < automaton.nodeCount(); node++) {
            int failure = automaton.failureLink(node);
            if (failure != NucleotideAutomaton.ROOT) {
                out.append("    ").append(String.valueOf(node)).append(" -> ").append(String.valueOf(failure))
                   .append(" [style=dashed, color=green];\n");
            }
        }
        out.append("}\n");
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        try {
            write(sb);
        } catch (IOException e) {
            // StringBuilder does not throw
            throw new IllegalStateException(e);
        }
        return sb.toString();
    }
}
