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

/**
 * One operation recorded in the engine's write stream.
 *
 * @param type   the kind of operation
 * @param column the column the operation was applied to
 * @param key    the key, or the begin key of a range deletion; null if keys were not requested
 * @param value  the value, or the end key of a range deletion; null if values were not requested or absent
 */
public record ChangeEntry(ChangeType type,
                          String column,
                          @Nullable ByteString key,
                          @Nullable ByteString value) {
}
