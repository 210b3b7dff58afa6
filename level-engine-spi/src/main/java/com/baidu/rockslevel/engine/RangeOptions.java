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

import com.google.protobuf.ByteString;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Range of a scan, a query or a clear. At most one of gt/gte and one of lt/lte takes effect, the exclusive one
 * winning if both are given.
 */
@Getter
@Accessors(fluent = true)
@Builder(toBuilder = true)
@ToString
public class RangeOptions {
    public static final RangeOptions ALL = RangeOptions.builder().build();

    @Nullable
    private final ByteString gt;
    @Nullable
    private final ByteString gte;
    @Nullable
    private final ByteString lt;
    @Nullable
    private final ByteString lte;
    @Builder.Default
    private final boolean reverse = false;
    /**
     * Maximum number of rows, negative means unlimited.
     */
    @Builder.Default
    private final int limit = -1;
    @Builder.Default
    private final boolean keys = true;
    @Builder.Default
    private final boolean values = true;
    @Nullable
    private final String column;
}
