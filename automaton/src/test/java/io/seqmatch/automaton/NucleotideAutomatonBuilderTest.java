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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class NucleotideAutomatonBuilderTest {

    @Test
    public void testRejectEmptyPatternSet() {
        final NucleotideAutomatonBuilder builder = NucleotideAutomaton.builder()
                .addPatterns("ACGU", "hello")
                .rejectEmptyPatternSet(true);

        assertThrows(EmptyPatternSetException.class, new Executable() {
            @Override
            public void execute() {
                builder.build();
            }
        });
    }

    @Test
    public void testRejectEmptyPatternSetWithoutPatterns() {
        assertThrows(EmptyPatternSetException.class, new Executable() {
            @Override
            public void execute() {
                NucleotideAutomaton.builder().rejectEmptyPatternSet(true).build();
            }
        });
    }

    @Test
    public void testAcceptsEmptyPatternSetByDefault() {
        NucleotideAutomaton automaton = NucleotideAutomaton.builder().addPattern("ACGU").build();

        assertEquals(1, automaton.nodeCount());
        assertThat(automaton.search("ACGUACGT")).isEmpty();
    }

    @Test
    public void testStrictBuilderAcceptsUsablePatterns() {
        NucleotideAutomaton automaton = NucleotideAutomaton.builder()
                .rejectEmptyPatternSet(true)
                .addPattern("ACGU")
                .addPatterns(Arrays.asList("gc", "cg"))
                .build();

        assertThat(automaton.patterns()).containsExactly("GC", "CG");
    }

    @Test
    public void testBuilderIsReusable() {
        NucleotideAutomatonBuilder builder = NucleotideAutomaton.builder().addPattern("A");
        NucleotideAutomaton first = builder.build();
        NucleotideAutomaton second = builder.addPattern("C").build();

        assertThat(first.patterns()).containsExactly("A");
        assertThat(second.patterns()).containsExactly("A", "C");
    }

    @Test
    public void testNullPatterns() {
        assertThrows(NullPointerException.class, new Executable() {
            @Override
            public void execute() {
                NucleotideAutomaton.builder().addPattern(null);
            }
        });
        assertThrows(IllegalArgumentException.class, new Executable() {
            @Override
            public void execute() {
                NucleotideAutomaton.builder().addPatterns("A", null);
            }
        });
        assertThrows(IllegalArgumentException.class, new Executable() {
            @Override
            public void execute() {
                NucleotideAutomaton.builder().addPatterns(Arrays.asList("A", null));
            }
        });
    }
}
