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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RandomSequencesTest {

    @Test
    public void testGenomes() {
        List<String> genomes = new RandomSequences(1).genomes(8, 10);

        assertEquals(10, genomes.size());
        for (String genome : genomes) {
            assertEquals(8, genome.length());
            assertAlphabetOnly(genome);
        }
    }

    @Test
    public void testBody() {
        String body = new RandomSequences(1).body(10000);

        assertEquals(10000, body.length());
        assertAlphabetOnly(body);
        assertEquals("", new RandomSequences(1).body(0));
    }

    @Test
    public void testSameSeedSameSequences() {
        assertEquals(new RandomSequences(99).body(500), new RandomSequences(99).body(500));
    }

    @Test
    public void testInvalidLength() {
        assertThrows(IllegalArgumentException.class, new Executable() {
            @Override
            public void execute() {
                new RandomSequences(1).genomes(0, 1);
            }
        });
    }

    private static void assertAlphabetOnly(String sequence) {
        for (int i = 0; i < sequence.length(); i++) {
            assertTrue(NucleotideAlphabet.isValid(sequence.charAt(i)), sequence);
        }
    }
}
