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

import io.seqmatch.automaton.NucleotideAutomaton;
import io.seqmatch.example.util.RandomSequences;

import java.io.BufferedWriter;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * Searches a random nucleotide sequence for a set of random patterns and prints where each one was found.
 * Set {@code -Ddot=<file>} to also write the automaton as a Graphviz DOT graph.
 */
public final class SequenceSearchExample {

    static final int PATTERN_LENGTH = Integer.parseInt(System.getProperty("patternLength", "8"));
    static final int PATTERN_COUNT = Integer.parseInt(System.getProperty("patternCount", "10"));
    static final int BODY_LENGTH = Integer.parseInt(System.getProperty("bodyLength", "10000"));
    static final long SEED = Long.parseLong(System.getProperty("seed", String.valueOf(System.nanoTime())));
    static final String DOT = System.getProperty("dot");

    public static void main(String[] args) throws Exception {
        RandomSequences sequences = new RandomSequences(SEED);
        List<String> patterns = sequences.genomes(PATTERN_LENGTH, PATTERN_COUNT);
        String body = sequences.body(BODY_LENGTH);

        NucleotideAutomaton automaton = NucleotideAutomaton.newAutomaton(patterns);
        Map<String, List<Integer>> matches = automaton.search(body);

        System.err.format("Seed %d, %s%n", SEED, automaton);
        for (Map.Entry<String, List<Integer>> e : matches.entrySet()) {
            System.out.println(e.getKey() + ": " + e.getValue());
        }

        if (DOT != null) {
            Writer out = new BufferedWriter(new OutputStreamWriter(
                    Files.newOutputStream(Paths.get(DOT)), StandardCharsets.UTF_8));
            try {
                new AutomatonDotWriter(automaton).write(out);
            } finally {
                out.close();
            }
        }
    }
}
