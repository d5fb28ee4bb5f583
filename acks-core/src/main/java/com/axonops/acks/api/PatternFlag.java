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

import java.util.EnumSet;
import java.util.Set;

/**
 * Matching options of a {@link Pattern}. Flags combine freely.
 *
 * @since 1.0.0
 */
public enum PatternFlag {

    /** Match any ASCII-case variant of the pattern bytes. Non-ASCII bytes still match exactly. */
    CASE_INSENSITIVE(1),

    /** Report the pattern at most once per search or scan call, however often it occurs. */
    REPORT_ONCE(1 << 1);

    private final int bit;

    PatternFlag(int bit) {
        this.bit = bit;
    }

    /**
     * @return the bit this flag occupies in a flag mask
     */
    public int bit() {
        return bit;
    }

    /**
     * Combines flags into a bitmask.
     *
     * @param flags flags to combine (may be empty)
     * @return bitwise OR of the flag bits
     */
    public static int toMask(Set<PatternFlag> flags) {
        int mask = 0;
        for (PatternFlag flag : flags) {
            mask |= flag.bit;
        }
        return mask;
    }

    /**
     * Expands a bitmask into flags. Unknown bits are ignored.
     *
     * @param mask flag bitmask
     * @return mutable set of the flags present in {@code mask}
     */
    public static EnumSet<PatternFlag> fromMask(int mask) {
        EnumSet<PatternFlag> flags = EnumSet.noneOf(PatternFlag.class);
        for (PatternFlag flag : values()) {
            if ((mask & flag.bit) != 0) {
                flags.add(flag);
            }
        }
        return flags;
    }
}
