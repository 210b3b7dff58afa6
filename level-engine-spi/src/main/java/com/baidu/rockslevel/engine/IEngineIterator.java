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
import java.util.concurrent.CompletableFuture;

/**
 * A range scan over a consistent view of the engine. The caller must not issue a new call before the previous
 * {@link #nextv(int)} has completed.
 */
public interface IEngineIterator {
    /**
     * The sequence number of the view the iterator reads from.
     */
    long sequence();

    /**
     * Pull at most {@code size} rows.
     */
    CompletableFuture<IteratorPage> nextv(int size);

    /**
     * Reposition the iterator, clamped to the range it was created with. Takes effect on the next pull.
     */
    void seek(ByteString target);

    void close();
}
