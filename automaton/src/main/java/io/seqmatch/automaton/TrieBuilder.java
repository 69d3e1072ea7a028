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
package io.seqmatch.automaton;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static io.seqmatch.automaton.NucleotideAutomaton.BITS_PER_SYMBOL;
import static io.seqmatch.automaton.NucleotideAutomaton.NO_NODE;
import static io.seqmatch.automaton.NucleotideAutomaton.ROOT;

/**
 * Inserts sanitized patterns into a trie kept as parallel arrays indexed by node id.
 * Transitions live in one flat array, the row of node {@code n} starts at {@code n << BITS_PER_SYMBOL}.
 */
final class TrieBuilder {

    static final class Trie {
        final int maxNodes;
        final int[] transitions;
        final int[] depths;
        final List<Set<String>> outputs;
        final List<String> patterns;
        int nodeCount;

        Trie(int maxNodes) {
            this.maxNodes = maxNodes;
            transitions = new int[maxNodes << BITS_PER_SYMBOL];
            Arrays.fill(transitions, NO_NODE);
            depths = new int[maxNodes];
            outputs = new ArrayList<Set<String>>(maxNodes);
            patterns = new ArrayList<String>();
            newNode(0);
        }

        int newNode(int depth) {
            int node = nodeCount++;
            depths[node] = depth;
            outputs.add(new LinkedHashSet<String>());
            return node;
        }
    }

    private TrieBuilder() {
    }

    /**
     * Returns the upper bound of nodes needed to hold {@code patterns}: the sum of their lengths plus the root.
     */
    static int maxNodes(List<String> patterns) {
        long bound = 1;
        for (String pattern : patterns) {
            bound += pattern.length();
        }
        if (bound > Integer.MAX_VALUE >> BITS_PER_SYMBOL) {
            throw new IllegalArgumentException("total pattern length: " + (bound - 1) + " (expected: <= " +
                    ((Integer.MAX_VALUE >> BITS_PER_SYMBOL) - 1) + ')');
        }
        return (int) bound;
    }

    /**
     * Builds the trie for {@code patterns}, which must already be sanitized.
     */
    static Trie build(List<String> patterns) {
        Trie trie = new Trie(maxNodes(patterns));
        for (String pattern : patterns) {
            int node = ROOT;
            for (int i = 0; i < pattern.length(); i++) {
                int index = node << BITS_PER_SYMBOL | NucleotideAlphabet.index(pattern.charAt(i));
                int next = trie.transitions[index];
                if (next == NO_NODE) {
                    next = trie.newNode(i + 1);
                    trie.transitions[index] = next;
                }
                node = next;
            }
            if (trie.outputs.get(node).add(pattern)) {
                trie.patterns.add(pattern);
            }
        }
        return trie;
    }
}
