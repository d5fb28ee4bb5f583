/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.acks.automaton;

import com.axonops.acks.api.Pattern;

/**
 * Receives verified, deduplicated matches from the {@link SearchEngine}.
 *
 * @param <E> exception type the sink may throw; it aborts the pass and propagates unchanged
 * @since 1.0.0
 */
@FunctionalInterface
public interface MatchSink<E extends Exception> {

    /**
     * @param pattern matched pattern
     * @param end end offset of the match (exclusive), relative to the start of the searched region
     * @return true to continue, false to stop the pass after this match
     * @throws E to abort the pass
     */
    boolean accept(Pattern pattern, int end) throws E;
}
