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
 * An {@link IllegalArgumentException} which is raised when a character outside of the
 * {@link NucleotideAlphabet} is mapped to an index.
 */
public class InvalidSymbolException extends IllegalArgumentException {

    private static final long serialVersionUID = 3820517726398504211L;

    private final char symbol;

    public InvalidSymbolException(char symbol) {
        super("invalid symbol: '" + symbol + "' (expected: one of A, C, G, T)");
        this.symbol = symbol;
    }

    /**
     * Returns the rejected character.
     */
    public char symbol() {
        return symbol;
    }
}
