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

import io.seqmatch.automaton.TrieBuilder.Trie;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Queue;

import static io.seqmatch.automaton.NucleotideAutomaton.BITS_PER_SYMBOL;
import static io.seqmatch.automaton.NucleotideAutomaton.NO_NODE;
import static io.seqmatch.automaton.NucleotideAutomaton.ROOT;

/**
 * Computes the failure link of every node of a {@link Trie} breadth-first, completes the root row of the
 * transition table and merges each node's output set with the output set of its failure node.
 */
final class FailureLinkBuilder {

    private FailureLinkBuilder() {
    }

    /**
     * Links {@code trie} in place and returns the failure links indexed by node id. The root has no failure
     * link and maps to {@link NucleotideAutomaton#NO_NODE}.
     */
    static int[] build(Trie trie) {
        final int[] transitions = trie.transitions;
        final int[] failureLinks = new int[trie.nodeCount];
        Arrays.fill(failureLinks, NO_NODE);

        Queue<Integer> queue = new ArrayDeque<Integer>();
        for (int symbol = 0; symbol < NucleotideAlphabet.SIZE; symbol++) {
            int child = transitions[ROOT << BITS_PER_SYMBOL | symbol];
            if (child != NO_NODE) {
                failureLinks[child] = ROOT;
                queue.add(child);
            } else {
                // the root row is total, so every fallback walk ends at the root at the latest
                transitions[ROOT << BITS_PER_SYMBOL | symbol] = ROOT;
            }
        }

        while (!queue.isEmpty()) {
            final int parent = queue.remove();
            for (int symbol = 0; symbol < NucleotideAlphabet.SIZE; symbol++) {
                final int child = transitions[parent << BITS_PER_SYMBOL | symbol];
                if (child == NO_NODE) {
                    continue;
                }
                int fallback = failureLinks[parent];
                while (transitions[fallback << BITS_PER_SYMBOL | symbol] == NO_NODE) {
                    fallback = failureLinks[fallback];
                }
                final int failure = transitions[fallback << BITS_PER_SYMBOL | symbol];
                failureLinks[child] = failure;
                trie.outputs.get(child).addAll(trie.outputs.get(failure));
                queue.add(child);
            }
        }
        return failureLinks;
    }
}
