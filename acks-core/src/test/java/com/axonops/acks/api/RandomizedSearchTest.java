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

import static com.axonops.acks.test.TestUtils.sorted;
import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Cross-checks the automaton against a brute-force scan on seeded random inputs.
 *
 * <p>A small alphabet with both cases forces heavy prefix sharing, overlapping matches and case
 * folding collisions.
 */
class RandomizedSearchTest {

    private static final byte[] SYMBOLS = {'a', 'b', 'A', 'B', 'c', 0, (byte) 0xE9};

    private static byte[] randomBytes(Random random, int length) {
        byte[] bytes = new byte[length];
        for (int i = 0; i < length; i++) {
            bytes[i] = SYMBOLS[random.nextInt(SYMBOLS.length)];
        }
        return bytes;
    }

    private static byte lower(byte b) {
        return b >= 'A' && b <= 'Z' ? (byte) (b + 32) : b;
    }

    /** Occurrence as the automaton sees it: every byte compared with ASCII case folded. */
    private static boolean foldedAt(Pattern pattern, byte[] text, int start) {
        if (start < 0 || start + pattern.length() > text.length) {
            return false;
        }
        for (int j = 0; j < pattern.length(); j++) {
            if (lower(pattern.byteAt(j)) != lower(text[start + j])) {
                return false;
            }
        }
        return true;
    }

    /**
     * Whether the pattern ending at {@code end} is reported; report-once ids are spent on the
     * folded hit, before exact verification.
     */
    private static boolean reported(Pattern pattern, byte[] text, int end, Set<Integer> spent) {
        int start = end - pattern.length() + 1;
        if (!foldedAt(pattern, text, start)) {
            return false;
        }
        if (pattern.isReportOnce() && !spent.add(pattern.id())) {
            return false;
        }
        return pattern.isCaseInsensitive()
            || Arrays.equals(pattern.content(), 0, pattern.length(), text, start, start + pattern.length());
    }

    private static int[] bruteForce(List<Pattern> patterns, byte[] text) {
        List<Integer> ids = new ArrayList<>();
        Set<Integer> spent = new HashSet<>();
        for (int end = 0; end < text.length; end++) {
            for (Pattern pattern : patterns) {
                if (reported(pattern, text, end, spent)) {
                    ids.add(pattern.id());
                }
            }
        }
        return ids.stream().mapToInt(Integer::intValue).toArray();
    }

    private static int[] bruteForceEnds(List<Pattern> patterns, byte[] text) {
        List<Integer> ends = new ArrayList<>();
        Set<Integer> spent = new HashSet<>();
        for (int end = 0; end < text.length; end++) {
            for (Pattern pattern : patterns) {
                if (reported(pattern, text, end, spent)) {
                    ends.add(end + 1);
                }
            }
        }
        return ends.stream().mapToInt(Integer::intValue).toArray();
    }

    private static List<Pattern> randomPatterns(Random random, int count) {
        List<Pattern> patterns = new ArrayList<>();
        for (int id = 0; id < count; id++) {
            int flags = random.nextInt(4);
            patterns.add(Pattern.withFlagMask(randomBytes(random, 1 + random.nextInt(5)), id * 7, flags));
        }
        return patterns;
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 2L, 3L, 42L, 1234L, 98765L})
    void testSearch_AgreesWithBruteForce(long seed) {
        Random random = new Random(seed);

        for (int round = 0; round < 20; round++) {
            List<Pattern> patterns = randomPatterns(random, 1 + random.nextInt(30));
            MultiPatternMatcher matcher = new MultiPatternMatcher();
            matcher.addPatterns(patterns);
            matcher.build();

            for (int t = 0; t < 10; t++) {
                byte[] text = randomBytes(random, random.nextInt(200));
                assertThat(sorted(matcher.search(text)))
                    .as("seed %d round %d text %d", seed, round, t)
                    .containsExactly(sorted(bruteForce(patterns, text)));
            }
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {7L, 99L, 2024L})
    void testScan_EndOffsetsAgreeWithBruteForce(long seed) {
        Random random = new Random(seed);

        for (int round = 0; round < 20; round++) {
            List<Pattern> patterns = randomPatterns(random, 1 + random.nextInt(20));
            MultiPatternMatcher matcher = new MultiPatternMatcher();
            matcher.addPatterns(patterns);
            matcher.build();

            byte[] text = randomBytes(random, random.nextInt(300));
            List<Long> ends = new ArrayList<>();
            matcher.scan(text, (id, from, to) -> ends.add(to));

            // Ends are non-decreasing, so sorting only reorders matches sharing an end
            int[] actual = ends.stream().mapToInt(Long::intValue).toArray();
            assertThat(actual).as("seed %d round %d", seed, round).isSorted();
            assertThat(actual).containsExactly(bruteForceEnds(patterns, text));
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {5L, 555L})
    void testSearch_RegionAgreesWithCopiedRegion(long seed) {
        Random random = new Random(seed);
        List<Pattern> patterns = randomPatterns(random, 25);
        MultiPatternMatcher matcher = new MultiPatternMatcher();
        matcher.addPatterns(patterns);
        matcher.build();

        for (int t = 0; t < 50; t++) {
            byte[] text = randomBytes(random, 1 + random.nextInt(200));
            int offset = random.nextInt(text.length);
            int length = random.nextInt(text.length - offset + 1);
            byte[] copy = Arrays.copyOfRange(text, offset, offset + length);

            assertThat(matcher.search(text, offset, length)).containsExactly(matcher.search(copy));
        }
    }
}
