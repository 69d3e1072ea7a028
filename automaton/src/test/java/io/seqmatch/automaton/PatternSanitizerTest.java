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
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class PatternSanitizerTest {

    @Test
    public void testUpperCases() {
        assertEquals("ACGT", PatternSanitizer.sanitize("acgt"));
        assertEquals("GATTACA", PatternSanitizer.sanitize("GaTtAcA"));
        assertEquals("T", PatternSanitizer.sanitize(new StringBuilder("t")));
    }

    @Test
    public void testDropsWholePattern() {
        assertNull(PatternSanitizer.sanitize("acgtx"));
        assertNull(PatternSanitizer.sanitize("NACGT"));
        assertNull(PatternSanitizer.sanitize("AC GT"));
        assertNull(PatternSanitizer.sanitize("ACGç"));
    }

    @Test
    public void testDropsEmptyPattern() {
        assertNull(PatternSanitizer.sanitize(""));
    }

    @Test
    public void testKeepsOrderAndDuplicates() {
        assertThat(PatternSanitizer.sanitize(Arrays.asList("tt", "acgtx", "AC", "tt", "", "g")))
                .containsExactly("TT", "AC", "TT", "G");
    }

    @Test
    public void testEmptyInput() {
        assertThat(PatternSanitizer.sanitize(Collections.<String>emptyList())).isEmpty();
    }

    @Test
    public void testNullEntry() {
        assertThrows(IllegalArgumentException.class, new Executable() {
            @Override
            public void execute() {
                PatternSanitizer.sanitize(Arrays.asList("A", null));
            }
        });
        assertThrows(NullPointerException.class, new Executable() {
            @Override
            public void execute() {
                PatternSanitizer.sanitize((CharSequence) null);
            }
        });
    }
}
