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

package com.axonops.acks.api;

/**
 * Receives matches from {@link MultiPatternMatcher#scan(byte[], MatchHandler)}, synchronously and
 * in the order they are found.
 *
 * <p>Throwing from {@link #onMatch} stops the scan at the current byte; the exception propagates
 * unchanged out of {@code scan}. The type parameter carries checked exceptions through, so a
 * handler declared {@code MatchHandler<IOException>} makes {@code scan} throw {@code IOException}.
 *
 * @param <E> exception type the handler may throw
 * @since 1.0.0
 */
@FunctionalInterface
public interface MatchHandler<E extends Exception> {

    /**
     * Called once per reported match.
     *
     * @param patternId external id of the matched pattern
     * @param from start offset of the match, or 0 unless
     *     {@link com.axonops.acks.config.AcksConfig#reportStartOffsets()} is enabled
     * @param to end offset of the match (exclusive), relative to the start of the scanned region
     * @throws E to abort the scan
     */
    void onMatch(int patternId, long from, long to) throws E;
}
