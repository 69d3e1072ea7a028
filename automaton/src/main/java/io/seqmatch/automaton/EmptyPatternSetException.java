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
 * An {@link IllegalArgumentException} which is raised when a strict {@link NucleotideAutomatonBuilder} is asked
 * to build an automaton and none of the supplied patterns survives sanitization.
 */
public class EmptyPatternSetException extends IllegalArgumentException {

    private static final long serialVersionUID = -6175035402367148872L;

    public EmptyPatternSetException() { }

    public EmptyPatternSetException(String message) {
        super(message);
    }

    public EmptyPatternSetException(String message, Throwable cause) {
        super(message, cause);
    }

    public EmptyPatternSetException(Throwable cause) {
        super(cause);
    }
}
