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

import io.netty.util.internal.SystemPropertyUtil;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static io.netty.util.internal.ObjectUtil.checkNotNull;
import static io.netty.util.internal.ObjectUtil.checkNotNullArrayParam;

/**
 * Collects raw patterns and builds an immutable {@link NucleotideAutomaton} from them.
 * <br>
 * Patterns are upper-cased and patterns containing any other character than {@code A, C, G, T} are dropped
 * (see {@link PatternSanitizer}). If no pattern is left, {@link #build()} either returns an automaton that only
 * consists of the root and matches nothing, or throws {@link EmptyPatternSetException} when
 * {@link #rejectEmptyPatternSet(boolean)} is enabled. The default is taken from the
 * {@code io.seqmatch.automaton.rejectEmptyPatternSet} system property and is {@code false}.
 */
public final class NucleotideAutomatonBuilder {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(NucleotideAutomatonBuilder.class);

    static final String PROP_REJECT_EMPTY_PATTERN_SET = "io.seqmatch.automaton.rejectEmptyPatternSet";
    private static final boolean DEFAULT_REJECT_EMPTY_PATTERN_SET;

    static {
        DEFAULT_REJECT_EMPTY_PATTERN_SET = SystemPropertyUtil.getBoolean(PROP_REJECT_EMPTY_PATTERN_SET, false);
        logger.debug("-D{}: {}", PROP_REJECT_EMPTY_PATTERN_SET, DEFAULT_REJECT_EMPTY_PATTERN_SET);
    }

    private final List<CharSequence> patterns = new ArrayList<CharSequence>();
    private boolean rejectEmptyPatternSet = DEFAULT_REJECT_EMPTY_PATTERN_SET;

    NucleotideAutomatonBuilder() {
    }

    public NucleotideAutomatonBuilder addPattern(CharSequence pattern) {
        patterns.add(checkNotNull(pattern, "pattern"));
        return this;
    }

    public NucleotideAutomatonBuilder addPatterns(CharSequence... patterns) {
        checkNotNull(patterns, "patterns");
        for (int i = 0; i < patterns.length; i++) {
            this.patterns.add(checkNotNullArrayParam(patterns[i], i, "patterns"));
        }
        return this;
    }

    public NucleotideAutomatonBuilder addPatterns(Iterable<? extends CharSequence> patterns) {
        checkNotNull(patterns, "patterns");
        int i = 0;
        for (CharSequence pattern : patterns) {
            this.patterns.add(checkNotNullArrayParam(pattern, i++, "patterns"));
        }
        return this;
    }

    /**
     * Sets whether {@link #build()} fails with {@link EmptyPatternSetException} when no usable pattern was
     * added, instead of returning a root-only automaton.
     */
    public NucleotideAutomatonBuilder rejectEmptyPatternSet(boolean rejectEmptyPatternSet) {
        this.rejectEmptyPatternSet = rejectEmptyPatternSet;
        return this;
    }

    /**
     * Builds the automaton. The builder can be reused afterwards; the result does not see later changes.
     *
     * @throws EmptyPatternSetException if every pattern was rejected and the builder is configured to reject
     *                                  an empty pattern set
     */
    public NucleotideAutomaton build() {
        List<String> sanitized = PatternSanitizer.sanitize(patterns);
        if (sanitized.isEmpty()) {
            if (rejectEmptyPatternSet) {
                throw new EmptyPatternSetException(
                        "no usable pattern among " + patterns.size() + " candidate(s) (expected: only A, C, G, T)");
            }
            logger.debug("No usable pattern among {} candidate(s), building a root-only automaton", patterns.size());
        }

        TrieBuilder.Trie trie = TrieBuilder.build(sanitized);
        int[] failureLinks = FailureLinkBuilder.build(trie);
        NucleotideAutomaton automaton = new NucleotideAutomaton(trie, failureLinks);
        if (logger.isDebugEnabled()) {
            logger.debug("Built {} from {} candidate(s)", automaton, patterns.size());
        }
        return automaton;
    }
}
