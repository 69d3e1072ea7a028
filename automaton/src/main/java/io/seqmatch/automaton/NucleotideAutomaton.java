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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * An <a href="https://en.wikipedia.org/wiki/Aho%E2%80%93Corasick_algorithm">Aho–Corasick</a> automaton over the
 * {@link NucleotideAlphabet}.
 * <br>
 * Nodes are identified by dense ids, {@link #ROOT} being {@code 0}. Only the root row of the transition table is
 * complete; a missing transition from any other node is resolved while searching by following failure links,
 * which always point to a node of strictly smaller depth and therefore end at the root.
 * <br>
 * Instances are immutable and can be shared by any number of threads. Every search keeps its cursor local,
 * either on the stack of {@link #search(CharSequence, MatchListener)} or in its own
 * {@link NucleotideSearchProcessor}.
 * <br>
 * Usage example:
 * <pre>
 *      NucleotideAutomaton automaton = NucleotideAutomaton.newAutomaton("CAT", "AT");
 *      Map&lt;String, List&lt;Integer&gt;&gt; matches = automaton.search("xcat");
 *      // matches is {CAT=[1], AT=[2]}
 * </pre>
 */
public final class NucleotideAutomaton {

    /**
     * Id of the root node.
     */
    public static final int ROOT = 0;

    /**
     * Returned for an absent transition and for the failure link of the root.
     */
    public static final int NO_NODE = -1;

    static final int BITS_PER_SYMBOL = 2;

    private final int maxNodes;
    private final int nodeCount;
    private final int[] transitions;
    private final int[] failureLinks;
    private final int[] depths;
    private final List<Set<String>> outputs;
    private final List<String> patterns;

    NucleotideAutomaton(Trie trie, int[] failureLinks) {
        maxNodes = trie.maxNodes;
        nodeCount = trie.nodeCount;
        transitions = trie.transitions;
        depths = trie.depths;
        this.failureLinks = failureLinks;
        List<Set<String>> outputs = new ArrayList<Set<String>>(nodeCount);
        for (Set<String> output : trie.outputs) {
            outputs.add(output.isEmpty() ? Collections.<String>emptySet() : Collections.unmodifiableSet(output));
        }
        this.outputs = Collections.unmodifiableList(outputs);
        patterns = Collections.unmodifiableList(new ArrayList<String>(trie.patterns));
    }

    /**
     * Creates a new {@link NucleotideAutomatonBuilder}.
     */
    public static NucleotideAutomatonBuilder builder() {
        return new NucleotideAutomatonBuilder();
    }

    /**
     * Builds an automaton for {@code patterns} with the default {@link NucleotideAutomatonBuilder} settings.
     * Patterns containing characters other than {@code A, C, G, T} (in any case) are ignored.
     */
    public static NucleotideAutomaton newAutomaton(CharSequence... patterns) {
        return builder().addPatterns(patterns).build();
    }

    /**
     * Builds an automaton for {@code patterns} with the default {@link NucleotideAutomatonBuilder} settings.
     */
    public static NucleotideAutomaton newAutomaton(Iterable<? extends CharSequence> patterns) {
        return builder().addPatterns(patterns).build();
    }

    /**
     * Returns the number of live nodes, the root included.
     */
    public int nodeCount() {
        return nodeCount;
    }

    /**
     * Returns the upper bound of nodes the tables were sized for.
     */
    public int maxNodes() {
        return maxNodes;
    }

    /**
     * Returns the accepted patterns, upper-cased and without duplicates, in insertion order.
     */
    public List<String> patterns() {
        return patterns;
    }

    /**
     * Returns the direct transition of {@code node} on {@code symbol}, or {@link #NO_NODE} if there is none.
     * Transitions of the root are never absent.
     */
    public int transition(int node, int symbol) {
        checkNode(node);
        if (symbol < 0 || symbol >= NucleotideAlphabet.SIZE) {
            throw new IllegalArgumentException(
                    "symbol: " + symbol + " (expected: 0-" + (NucleotideAlphabet.SIZE - 1) + ')');
        }
        return transitions[node << BITS_PER_SYMBOL | symbol];
    }

    /**
     * Returns the failure link of {@code node}, or {@link #NO_NODE} for the {@link #ROOT}.
     */
    public int failureLink(int node) {
        return failureLinks[checkNode(node)];
    }

    /**
     * Returns the depth of {@code node}, which is the length of the path that spells it.
     */
    public int depth(int node) {
        return depths[checkNode(node)];
    }

    /**
     * Returns all patterns recognized when {@code node} is reached, including those inherited along its
     * failure links.
     */
    public Set<String> output(int node) {
        return outputs.get(checkNode(node));
    }

    /**
     * Creates a new {@link NucleotideSearchProcessor} positioned at the {@link #ROOT}.
     */
    public NucleotideSearchProcessor newSearchProcessor() {
        return new NucleotideSearchProcessor(this);
    }

    /**
     * Finds every occurrence of every pattern in {@code sequence}.
     *
     * @return the start offsets of each pattern found, in increasing order. Patterns are iterated in the order
     *         they were first found; patterns with no occurrence are absent.
     */
    public Map<String, List<Integer>> search(CharSequence sequence) {
        final Map<String, List<Integer>> matches = new LinkedHashMap<String, List<Integer>>();
        search(sequence, new MatchListener() {
            @Override
            public void onMatch(String pattern, int offset) {
                List<Integer> offsets = matches.get(pattern);
                if (offsets == null) {
                    offsets = new ArrayList<Integer>();
                    matches.put(pattern, offsets);
                }
                offsets.add(offset);
            }
        });
        return matches;
    }

    /**
     * Scans {@code sequence} once and notifies {@code listener} of every occurrence in increasing order of the
     * position it ends at. Letters are matched regardless of case; any other character ends every partial match.
     */
    public void search(CharSequence sequence, MatchListener listener) {
        checkNotNull(sequence, "sequence");
        checkNotNull(listener, "listener");
        int state = ROOT;
        for (int i = 0; i < sequence.length(); i++) {
            int symbol = NucleotideAlphabet.indexOf(Character.toUpperCase(sequence.charAt(i)));
            if (symbol < 0) {
                state = ROOT;
                continue;
            }
            state = nextState(state, symbol);
            for (String pattern : outputs.get(state)) {
                listener.onMatch(pattern, i - pattern.length() + 1);
            }
        }
    }

    int nextState(int state, int symbol) {
        int next = transitions[state << BITS_PER_SYMBOL | symbol];
        while (next == NO_NODE) {
            state = failureLinks[state];
            next = transitions[state << BITS_PER_SYMBOL | symbol];
        }
        return next;
    }

    Set<String> outputOf(int state) {
        return outputs.get(state);
    }

    private int checkNode(int node) {
        if (node < 0 || node >= nodeCount) {
            throw new IllegalArgumentException("node: " + node + " (expected: 0-" + (nodeCount - 1) + ')');
        }
        return node;
    }

    @Override
    public String toString() {
        return "NucleotideAutomaton(patterns: " + patterns.size() + ", nodes: " + nodeCount + '/' + maxNodes + ')';
    }
}
