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

import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static io.netty.util.internal.ObjectUtil.checkNotNull;
import static io.netty.util.internal.ObjectUtil.checkNotNullArrayParam;

/**
 * Normalizes raw patterns to upper case and drops every pattern that still contains a character outside of
 * the {@link NucleotideAlphabet}. A pattern is either accepted as a whole or dropped as a whole, it is never
 * truncated.
 */
public final class PatternSanitizer {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(PatternSanitizer.class);

    private PatternSanitizer() {
    }

    /**
     * Returns the sanitized form of {@code pattern}, or {@code null} if the pattern is empty or contains a
     * character outside of the alphabet.
     */
    public static String sanitize(CharSequence pattern) {
        checkNotNull(pattern, "pattern");
        if (pattern.length() == 0) {
            logger.trace("Rejected empty pattern");
            return null;
        }
        String upper = pattern.toString().toUpperCase(Locale.ROOT);
        try {
            for (int i = 0; i < upper.length(); i++) {
                NucleotideAlphabet.index(upper.charAt(i));
            }
        } catch (InvalidSymbolException e) {
            logger.trace("Rejected pattern '{}': {}", pattern, e.getMessage());
            return null;
        }
        return upper;
    }

    /**
     * Sanitizes every pattern of {@code patterns} and returns the accepted ones in input order. Duplicates are
     * kept.
     *
     * @throws IllegalArgumentException if {@code patterns} contains {@code null}
     */
    public static List<String> sanitize(Iterable<? extends CharSequence> patterns) {
        checkNotNull(patterns, "patterns");
        List<String> accepted = new ArrayList<String>();
        int index = 0;
        for (CharSequence pattern : patterns) {
            String sanitized = sanitize(checkNotNullArrayParam(pattern, index++, "patterns"));
            if (sanitized != null) {
                accepted.add(sanitized);
            }
        }
        if (logger.isDebugEnabled() && accepted.size() != index) {
            logger.debug("Accepted {} of {} patterns", accepted.size(), index);
        }
        return accepted;
    }
}
