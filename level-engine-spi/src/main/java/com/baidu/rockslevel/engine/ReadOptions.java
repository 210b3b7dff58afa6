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

import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Getter;
import lombok.experimental.Accessors;

@Getter
@Accessors(fluent = true)
@Builder(toBuilder = true)
public class ReadOptions {
    public static final ReadOptions DEFAULT = ReadOptions.builder().build();

    @Nullable
    private final String column;
    @Builder.Default
    private final boolean fillCache = true;
    /**
     * Pins reads to the sequence of the given snapshot instead of the latest state.
     */
    @Nullable
    private final ISnapshotPin snapshot;
}
