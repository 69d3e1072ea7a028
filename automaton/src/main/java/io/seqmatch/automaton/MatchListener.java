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
 * Receives the occurrences found by {@link NucleotideAutomaton#search(CharSequence, MatchListener)}.
 */
public interface MatchListener {

    /**
     * Invoked once per occurrence.
     *
     * @param pattern the sanitized pattern found
     * @param offset  the index in the searched sequence at which the occurrence starts
     */
    void onMatch(String pattern, int offset);
}
