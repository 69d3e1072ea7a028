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

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;
import java.util.concurrent.TimeUnit;

@Threads(1)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Fork(2)
@Warmup(iterations = 5, time = 1)
@Measurement(iterations = 8, time = 1)
@State(Scope.Benchmark)
public class NucleotideAutomatonBenchmark {

    @Param({ "10", "1000" })
    int patternCount;

    @Param({ "8", "32" })
    int patternLength;

    @Param({ "1048576" })
    int sequenceLength;

    @Param({ "0" })
    int seed;

    List<String> patterns;
    String sequence;
    NucleotideAutomaton automaton;

    @Setup(Level.Trial)
    public void init() {
        final SplittableRandom random = new SplittableRandom(seed);
        patterns = new ArrayList<String>(patternCount);
        for (int i = 0; i < patternCount; i++) {
            patterns.add(randomSequence(random, patternLength));
        }
        sequence = randomSequence(random, sequenceLength);
        automaton = NucleotideAutomaton.newAutomaton(patterns);
    }

    private static String randomSequence(SplittableRandom random, int length) {
        char[] symbols = new char[length];
        for (int i = 0; i < length; i++) {
            symbols[i] = NucleotideAlphabet.symbol(random.nextInt(NucleotideAlphabet.SIZE));
        }
        return new String(symbols);
    }

    @Benchmark
    public NucleotideAutomaton build() {
        return NucleotideAutomaton.newAutomaton(patterns);
    }

    @Benchmark
    public void searchWithListener(final Blackhole bh) {
        automaton.search(sequence, new MatchListener() {
            @Override
            public void onMatch(String pattern, int offset) {
                bh.consume(offset);
            }
        });
    }

    @Benchmark
    public Object searchToMap() {
        return automaton.search(sequence);
    }
}
