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
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * An embedded ordered key-value engine. Reads complete asynchronously on the engine's own threads. Writes are
 * applied synchronously on the calling thread and throw {@link StorageEngineException} on failure.
 */
public interface IStorageEngine {
    /**
     * Open the engine at the given location.
     *
     * @return the names of the column families that are open
     */
    CompletableFuture<Set<String>> open(String location, OpenOptions options);

    CompletableFuture<Void> close();

    Set<String> columns();

    /**
     * The sequence number of the last committed write.
     */
    long currentSequence();

    CompletableFuture<Optional<ByteString>> get(ByteString key, ReadOptions options);

    CompletableFuture<List<Optional<ByteString>>> getMany(List<ByteString> keys, ReadOptions options);

    void put(ByteString key, ByteString value, WriteOptions options);

    void delete(ByteString key, WriteOptions options);

    void clear(RangeOptions range, WriteOptions options);

    /**
     * Apply all operations in one atomic write.
     */
    void batchApply(List<BatchOperation> operations, WriteOptions options);

    IEngineIterator newIterator(RangeOptions range, ReadOptions options);

    IEngineSnapshot newSnapshot();

    /**
     * Subscribe to the batches committed after {@link UpdatesOptions#since()}.
     */
    IEngineUpdates subscribeUpdates(UpdatesOptions options);

    String getProperty(String property);

    WalFile currentWalFile();

    List<WalFile> sortedWalFiles();

    void flushWal(boolean sync);
}
