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

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

@Getter
@Accessors(fluent = true)
@Builder(toBuilder = true)
@ToString
public class OpenOptions {
    public static final OpenOptions DEFAULT = OpenOptions.builder().build();

    @Builder.Default
    private final boolean createIfMissing = true;
    @Builder.Default
    private final boolean errorIfExists = false;
    /**
     * Column families to open besides the default one. Missing ones are created.
     */
    @Builder.Default
    private final List<String> columns = List.of();
}
