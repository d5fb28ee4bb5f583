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

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

/**
 * Tests for per-call report-once bookkeeping.
 */
class ReportOnceTrackerTest {

    @Test
    void testCreate_BitsetAtThreshold() {
        assertThat(ReportOnceTracker.create(10, 10)).isInstanceOf(ReportOnceTracker.Bitset.class);
        assertThat(ReportOnceTracker.create(0, 0)).isInstanceOf(ReportOnceTracker.Bitset.class);
    }

    @Test
    void testCreate_HashedAboveThreshold() {
        assertThat(ReportOnceTracker.create(11, 10)).isInstanceOf(ReportOnceTracker.Hashed.class);
    }

    @Test
    void testBitset_WordBoundaries() {
        ReportOnceTracker tracker = ReportOnceTracker.create(200, 1000);

        assertThat(tracker.markFirst(63)).isTrue();
        assertThat(tracker.markFirst(64)).isTrue();
        assertThat(tracker.markFirst(0)).isTrue();
        assertThat(tracker.markFirst(200)).isTrue();

        assertThat(tracker.markFirst(63)).isFalse();
        assertThat(tracker.markFirst(64)).isFalse();
        assertThat(tracker.markFirst(0)).isFalse();
        assertThat(tracker.markFirst(200)).isFalse();
        assertThat(tracker.markFirst(127)).isTrue();
    }

    @Test
    void testHashed_MarksOnce() {
        ReportOnceTracker tracker = ReportOnceTracker.create(Integer.MAX_VALUE, 10);

        assertThat(tracker.markFirst(Integer.MAX_VALUE)).isTrue();
        assertThat(tracker.markFirst(Integer.MAX_VALUE)).isFalse();
        assertThat(tracker.markFirst(5)).isTrue();
    }
}
