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

import io.netty.util.ByteProcessor;

import java.util.Set;

/**
 * A {@link ByteProcessor} that walks a {@link NucleotideAutomaton} one byte at a time, so the automaton can be
 * applied to a {@code ByteBuf} through {@code forEachByte}.
 * <br>
 * {@link #process(byte)} returns {@code false} whenever the state reached recognizes at least one pattern, which
 * makes {@code forEachByte} return the index of the last byte of the occurrence. The patterns are then available
 * from {@link #getFoundPatterns()}. To continue, resume {@code forEachByte} at the next index with the same
 * processor.
 * <br>
 * Usage example (given that the {@code haystack} is a {@code ByteBuf} containing "XCAT"):
 * <pre>
 *      NucleotideSearchProcessor processor = NucleotideAutomaton.newAutomaton("CAT", "AT").newSearchProcessor();
 *
 *      int idx = haystack.forEachByte(processor);
 *      // idx is 3, processor.getFoundPatterns() is [CAT, AT]
 * </pre>
 * A processor is a mutable cursor and must not be shared between threads; create one per search session.
 */
public final class NucleotideSearchProcessor implements ByteProcessor {

    private final NucleotideAutomaton automaton;
    private int state = NucleotideAutomaton.ROOT;

    NucleotideSearchProcessor(NucleotideAutomaton automaton) {
        this.automaton = automaton;
    }

    @Override
    public boolean process(byte value) {
        int symbol = NucleotideAlphabet.indexOf(Character.toUpperCase((char) (value & 0xff)));
        if (symbol < 0) {
            state = NucleotideAutomaton.ROOT;
            return true;
        }
        state = automaton.nextState(state, symbol);
        return automaton.outputOf(state).isEmpty();
    }

    /**
     * Returns the patterns that end at the last processed byte, longest first.
     */
    public Set<String> getFoundPatterns() {
        return automaton.outputOf(state);
    }

    /**
     * Returns the id of the node the processor is at.
     */
    public int state() {
        return state;
    }

    /**
     * Moves the processor back to the {@link NucleotideAutomaton#ROOT}.
     */
    public void reset() {
        state = NucleotideAutomaton.ROOT;
    }
}
