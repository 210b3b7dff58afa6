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
import java.util.List;
import javax.annotation.Nullable;

/**
 * One atomically committed write batch read back from the write-ahead log.
 *
 * @param sequence the sequence number of the first operation in the batch
 * @param count    the number of sequence numbers the batch consumed
 * @param entries  the decoded operations
 * @param data     the raw serialized batch, present only when requested
 */
public record ChangeBatch(long sequence, int count, List<ChangeEntry> entries, @Nullable ByteString data) {
    public long lastSequence() {
        return sequence + count - 1;
    }
}
