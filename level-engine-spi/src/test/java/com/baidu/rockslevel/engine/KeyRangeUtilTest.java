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

import static com.google.protobuf.ByteString.copyFromUtf8;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;

import com.google.protobuf.ByteString;
import org.testng.annotations.Test;

public class KeyRangeUtilTest {
    @Test
    public void openEnded() {
        assertNull(KeyRangeUtil.lowerBound(RangeOptions.ALL));
        assertNull(KeyRangeUtil.upperBound(RangeOptions.ALL));
        assertFalse(KeyRangeUtil.isEmpty(RangeOptions.ALL));
    }

    @Test
    public void exclusiveLowerBound() {
        RangeOptions range = RangeOptions.builder().gt(copyFromUtf8("a")).build();
        ByteString lower = KeyRangeUtil.lowerBound(range);
        assertFalse(KeyRangeUtil.inRange(copyFromUtf8("a"), lower, null));
        assertTrue(KeyRangeUtil.inRange(copyFromUtf8("a\0"), lower, null));
        assertTrue(KeyRangeUtil.inRange(copyFromUtf8("b"), lower, null));
    }

    @Test
    public void inclusiveUpperBound() {
        RangeOptions range = RangeOptions.builder().lte(copyFromUtf8("c")).build();
        ByteString upper = KeyRangeUtil.upperBound(range);
        assertTrue(KeyRangeUtil.inRange(copyFromUtf8("c"), null, upper));
        assertFalse(KeyRangeUtil.inRange(copyFromUtf8("c\0"), null, upper));
        assertFalse(KeyRangeUtil.inRange(copyFromUtf8("d"), null, upper));
    }

    @Test
    public void exclusiveWinsOverInclusive() {
        RangeOptions range = RangeOptions.builder()
            .gt(copyFromUtf8("b")).gte(copyFromUtf8("a"))
            .lt(copyFromUtf8("d")).lte(copyFromUtf8("e"))
            .build();
        assertEquals(KeyRangeUtil.lowerBound(range), copyFromUtf8("b\0"));
        assertEquals(KeyRangeUtil.upperBound(range), copyFromUtf8("d"));
    }

    @Test
    public void emptyRange() {
        assertTrue(KeyRangeUtil.isEmpty(RangeOptions.builder().gte(copyFromUtf8("b")).lt(copyFromUtf8("b")).build()));
        assertTrue(KeyRangeUtil.isEmpty(RangeOptions.builder().gt(copyFromUtf8("b")).lte(copyFromUtf8("b")).build()));
        assertFalse(KeyRangeUtil.isEmpty(RangeOptions.builder().gte(copyFromUtf8("b")).lte(copyFromUtf8("b")).build()));
    }

    @Test
    public void unsignedCompare() {
        assertTrue(KeyRangeUtil.compare(new byte[] {(byte) 0xFF}, new byte[] {0x01}) > 0);
        assertTrue(KeyRangeUtil.compare(new byte[] {0x01}, new byte[] {0x01, 0x00}) < 0);
        assertEquals(KeyRangeUtil.compare(ByteString.EMPTY, ByteString.EMPTY), 0);
    }
}
