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

package com.baidu.rockslevel;

import com.baidu.rockslevel.engine.ChangeEntry;
import com.google.protobuf.ByteString;
import java.util.List;
import javax.annotation.Nullable;

/**
 * One committed write batch delivered by an {@link UpdateFeed}.
 *
 * @param rows     the decoded operations of the batch
 * @param sequence the sequence number of the last operation in the batch
 * @param count    the number of operations in the batch
 * @param data     the raw serialized batch, if requested
 */
public record Updates(List<ChangeEntry> rows, long sequence, int count, @Nullable ByteString data) {
}
