/*
 * Copyright (c) 2023. The BifroMQ Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *    http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and limitations under the License.
 */

package com.baidu.rockslevel.engine;

import static com.google.protobuf.UnsafeByteOperations.unsafeWrap;

import com.google.protobuf.ByteString;
import javax.annotation.Nullable;

/**
 * Converts the gt/gte/lt/lte form of a range into a half-open [lower, upper) interval.
 */
public class KeyRangeUtil {
    private static final ByteString ZERO = ByteString.copyFrom(new byte[] {0x00});

    /**
     * Inclusive lower bound of the range, or null if the range is left open-ended.
     */
    @Nullable
    public static ByteString lowerBound(RangeOptions range) {
        if (range.gt() != null) {
            return successor(range.gt());
        }
        return range.gte();
    }

    /**
     * Exclusive upper bound of the range, or null if the range is right open-ended.
     */
    @Nullable
    public static ByteString upperBound(RangeOptions range) {
        if (range.lt() != null) {
            return range.lt();
        }
        if (range.lte() != null) {
            return successor(range.lte());
        }
        return null;
    }

    public static boolean isEmpty(RangeOptions range) {
        ByteString lower = lowerBound(range);
        ByteString upper = upperBound(range);
        return lower != null && upper != null && compare(lower, upper) >= 0;
    }

    public static boolean inRange(ByteString key, @Nullable ByteString lower, @Nullable ByteString upper) {
        if (lower != null && compare(key, lower) < 0) {
            return false;
        }
        return upper == null || compare(key, upper) < 0;
    }

    /**
     * The smallest key strictly greater than the given key.
     */
    public static ByteString successor(ByteString key) {
        return key.concat(ZERO);
    }

    @Nullable
    public static byte[] toBytes(@Nullable ByteString key) {
        return key == null ? null : key.toByteArray();
    }

    public static int compare(byte[] a, byte[] b) {
        return compare(unsafeWrap(a), unsafeWrap(b));
    }

    public static int compare(ByteString a, ByteString b) {
        return ByteString.unsignedLexicographicalComparator().compare(a, b);
    }
}
