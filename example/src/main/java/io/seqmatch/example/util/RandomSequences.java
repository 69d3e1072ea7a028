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
package io.seqmatch.example.util;

import io.seqmatch.automaton.NucleotideAlphabet;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static io.netty.util.internal.ObjectUtil.checkNotNull;
import static io.netty.util.internal.ObjectUtil.checkPositive;
import static io.netty.util.internal.ObjectUtil.checkPositiveOrZero;

/**
 * Random nucleotide patterns and sequences for examples and benchmarks.
 */
public final class RandomSequences {

    private final Random random;

    public RandomSequences(Random random) {
        this.random = checkNotNull(random, "random");
    }

    public RandomSequences(long seed) {
        this(new Random(seed));
    }

    /**
     * Returns {@code count} random patterns of {@code length} symbols each.
     */
    public List<String> genomes(int length, int count) {
        checkPositive(length, "length");
        checkPositiveOrZero(count, "count");
        List<String> genomes = new ArrayList<String>(count);
        for (int i = 0; i < count; i++) {
            genomes.add(body(length));
        }
        return genomes;
    }

    /**
     * Returns a random sequence of {@code length} symbols.
     */
    public String body(int length) {
        checkPositiveOrZero(length, "length");
        char[] symbols = new char[length];
        for (int i = 0; i < length; i++) {
            symbols[i] = NucleotideAlphabet.symbol(random.nextInt(NucleotideAlphabet.SIZE));
        }
        return new String(symbols);
    }
}
