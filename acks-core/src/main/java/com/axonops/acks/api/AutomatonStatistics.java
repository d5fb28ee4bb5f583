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
 * Immutable snapshot of a built automaton's shape and memory footprint.
 *
 * @param patternCount registered patterns
 * @param stateCount trie states, including the root
 * @param alphabetSize compressed symbols, including the reserved symbol 0
 * @param transitionTableEntries {@code stateCount x alphabetSize}
 * @param maxPatternId highest registered pattern id, or 0 with no patterns
 * @param hasReportOnce whether any pattern is {@link PatternFlag#REPORT_ONCE}
 * @param buildTimeNanos time spent in {@link MultiPatternMatcher#build()}
 * @since 1.0.0
 */
public record AutomatonStatistics(
    int patternCount,
    int stateCount,
    int alphabetSize,
    long transitionTableEntries,
    int maxPatternId,
    boolean hasReportOnce,
    long buildTimeNanos) {

  /** Approximate heap used by the transition table (4 bytes per entry). */
  public long transitionTableBytes() {
    return transitionTableEntries * Integer.BYTES;
  }

  /** Fraction of the 256 byte values that the patterns use, between 0.0 and 1.0. */
  public double alphabetUtilization() {
    return (alphabetSize - 1) / 256.0;
  }
}
