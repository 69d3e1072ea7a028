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

/**
 * The fixed nucleotide alphabet {@code A, C, G, T} and its dense index mapping {@code 0..3}.
 * <br>
 * The mapping is case-sensitive: callers are expected to upper-case their input before asking for an index.
 */
public final class NucleotideAlphabet {

    /**
     * Number of symbols in the alphabet.
     */
    public static final int SIZE = 4;

    private static final char[] SYMBOLS = { 'A', 'C', 'G', 'T' };
    private static final byte[] INDEX = new byte[128];

    static {
        for (int i = 0; i < INDEX.length; i++) {
            INDEX[i] = -1;
        }
        for (int i = 0; i < SYMBOLS.length; i++) {
            INDEX[SYMBOLS[i]] = (byte) i;
        }
    }

    private NucleotideAlphabet() {
    }

    /**
     * Returns the index of {@code symbol} in {@code [0, SIZE)}.
     *
     * @throws InvalidSymbolException if {@code symbol} is not one of {@code A, C, G, T}
     */
    public static int index(char symbol) {
        int index = indexOf(symbol);
        if (index < 0) {
            throw new InvalidSymbolException(symbol);
        }
        return index;
    }

    /**
     * Returns the index of {@code symbol}, or {@code -1} if it is not part of the alphabet.
     */
    public static int indexOf(char symbol) {
        return symbol < INDEX.length ? INDEX[symbol] : -1;
    }

    /**
     * Returns {@code true} if {@code symbol} is one of {@code A, C, G, T}.
     */
    public static boolean isValid(char symbol) {
        return indexOf(symbol) >= 0;
    }

    /**
     * Returns the symbol for {@code index}.
     *
     * @throws IllegalArgumentException if {@code index} is outside {@code [0, SIZE)}
     */
    public static char symbol(int index) {
        if (index < 0 || index >= SIZE) {
            throw new IllegalArgumentException("index: " + index + " (expected: 0-" + (SIZE - 1) + ')');
        }
        return SYMBOLS[index];
    }
}
