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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * An exact byte sequence to search for, with the caller's id and matching flags.
 *
 * <p>Immutable: the content is copied on construction and never exposed without copying.
 *
 * <p>The id is the value reported for every match and the key used to deduplicate
 * {@link PatternFlag#REPORT_ONCE} patterns. Several patterns may share an id; they are then
 * indistinguishable in results and share one report-once slot. Small, densely packed ids keep
 * report-once deduplication on its bitset path (see
 * {@link com.axonops.acks.config.AcksConfig#reportOnceBitsetMaxId()}).
 *
 * @since 1.0.0
 */
public final class Pattern {

    private final byte[] content;
    private final int id;
    private final int flags;
    private final int length;

    private Pattern(byte[] content, int id, int flags) {
        Objects.requireNonNull(content, "content cannot be null");
        if (content.length == 0) {
            throw new IllegalArgumentException("Pattern content must be non-empty (id: " + id + ")");
        }
        if (id < 0) {
            throw new IllegalArgumentException("Pattern id must be non-negative: " + id);
        }
        this.content = content.clone();
        this.id = id;
        this.flags = flags;
        this.length = content.length;
    }

    /**
     * Creates a pattern from raw bytes.
     *
     * @param content bytes to search for (non-empty, copied)
     * @param id external identifier reported on match (non-negative)
     * @param flags matching options
     * @return new pattern
     * @throws NullPointerException if content is null
     * @throws IllegalArgumentException if content is empty or id negative
     */
    public static Pattern of(byte[] content, int id, PatternFlag... flags) {
        return new Pattern(content, id, PatternFlag.toMask(toSet(flags)));
    }

    /**
     * Creates a pattern from a string, encoded as UTF-8.
     *
     * @param content text to search for (non-empty)
     * @param id external identifier reported on match (non-negative)
     * @param flags matching options
     * @return new pattern
     */
    public static Pattern of(String content, int id, PatternFlag... flags) {
        Objects.requireNonNull(content, "content cannot be null");
        return of(content.getBytes(StandardCharsets.UTF_8), id, flags);
    }

    /**
     * Creates a pattern from raw bytes and a flag bitmask (see {@link PatternFlag#bit()}).
     *
     * @param content bytes to search for (non-empty, copied)
     * @param id external identifier reported on match (non-negative)
     * @param flagMask bitwise OR of flag bits; unknown bits are dropped
     * @return new pattern
     */
    public static Pattern withFlagMask(byte[] content, int id, int flagMask) {
        return new Pattern(content, id, PatternFlag.toMask(PatternFlag.fromMask(flagMask)));
    }

    private static Set<PatternFlag> toSet(PatternFlag[] flags) {
        Objects.requireNonNull(flags, "flags cannot be null");
        EnumSet<PatternFlag> set = EnumSet.noneOf(PatternFlag.class);
        for (PatternFlag flag : flags) {
            set.add(Objects.requireNonNull(flag, "flag cannot be null"));
        }
        return set;
    }

    /**
     * @return copy of the pattern bytes
     */
    public byte[] content() {
        return content.clone();
    }

    public int id() {
        return id;
    }

    /**
     * @return pattern length in bytes
     */
    public int length() {
        return length;
    }

    public int flagMask() {
        return flags;
    }

    public EnumSet<PatternFlag> flags() {
        return PatternFlag.fromMask(flags);
    }

    public boolean isCaseInsensitive() {
        return (flags & PatternFlag.CASE_INSENSITIVE.bit()) != 0;
    }

    public boolean isReportOnce() {
        return (flags & PatternFlag.REPORT_ONCE.bit()) != 0;
    }

    /**
     * Byte at {@code index} without copying the content.
     */
    public byte byteAt(int index) {
        return content[index];
    }

    /**
     * Compares the pattern byte-for-byte against {@code text[offset, offset + length())}.
     *
     * @return false if the window falls outside {@code [from, to)} or any byte differs
     */
    public boolean matchesAt(byte[] text, int offset, int from, int to) {
        if (offset < from || offset + length > to) {
            return false;
        }
        return Arrays.equals(content, 0, length, text, offset, offset + length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Pattern other)) {
            return false;
        }
        return id == other.id && flags == other.flags && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(content) + id) + flags;
    }

    @Override
    public String toString() {
        String text = new String(content, StandardCharsets.UTF_8);
        if (text.length() > 100) {
            text = text.substring(0, 97) + "...";
        }
        return "Pattern{id=" + id + ", flags=" + flags() + ", content='" + text + "'}";
    }
}
