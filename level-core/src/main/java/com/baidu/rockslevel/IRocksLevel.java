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

import com.baidu.rockslevel.engine.BatchOperation;
import com.baidu.rockslevel.engine.OpenOptions;
import com.baidu.rockslevel.engine.RangeOptions;
import com.baidu.rockslevel.engine.ReadOptions;
import com.baidu.rockslevel.engine.UpdatesOptions;
import com.baidu.rockslevel.engine.WalFile;
import com.baidu.rockslevel.engine.WriteOptions;
import com.google.protobuf.ByteString;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * An ordered key-value database living in a directory.
 *
 * <p>Operations returning a future complete on the database's scheduler thread. Operations issued while the database
 * is opening are deferred and run in issue order once it opens. Argument errors are thrown synchronously.
 */
public interface IRocksLevel {
    enum Status {
        NEW,
        OPENING,
        OPEN,
        CLOSING,
        CLOSED
    }

    String location();

    Status status();

    /**
     * The options of the last successful open, null if never opened.
     */
    OpenOptions options();

    /**
     * The column families that are open.
     */
    Set<String> columns();

    /**
     * The sequence number of the last committed write.
     */
    long sequence();

    default CompletableFuture<Void> open() {
        return open(OpenOptions.DEFAULT);
    }

    CompletableFuture<Void> open(OpenOptions options);

    /**
     * Close all open children, then the engine. Calling it again returns the same outcome.
     */
    CompletableFuture<Void> close();

    default CompletableFuture<Optional<ByteString>> get(ByteString key) {
        return get(key, ReadOptions.DEFAULT);
    }

    CompletableFuture<Optional<ByteString>> get(ByteString key, ReadOptions options);

    default CompletableFuture<List<Optional<ByteString>>> getMany(List<ByteString> keys) {
        return getMany(keys, ReadOptions.DEFAULT);
    }

    CompletableFuture<List<Optional<ByteString>>> getMany(List<ByteString> keys, ReadOptions options);

    default CompletableFuture<Void> put(ByteString key, ByteString value) {
        return put(key, value, WriteOptions.DEFAULT);
    }

    CompletableFuture<Void> put(ByteString key, ByteString value, WriteOptions options);

    default CompletableFuture<Void> delete(ByteString key) {
        return delete(key, WriteOptions.DEFAULT);
    }

    CompletableFuture<Void> delete(ByteString key, WriteOptions options);

    default CompletableFuture<Void> clear(RangeOptions range) {
        return clear(range, WriteOptions.DEFAULT);
    }

    CompletableFuture<Void> clear(RangeOptions range, WriteOptions options);

    default CompletableFuture<Void> batch(List<BatchOperation> operations) {
        return batch(operations, WriteOptions.DEFAULT);
    }

    /**
     * Apply the operations atomically.
     */
    CompletableFuture<Void> batch(List<BatchOperation> operations, WriteOptions options);

    ChainedBatch chainedBatch();

    default LevelIterator iterator(RangeOptions range) {
        return iterator(range, ReadOptions.DEFAULT);
    }

    LevelIterator iterator(RangeOptions range, ReadOptions options);

    /**
     * Pin the current state. Pass the snapshot through {@link ReadOptions#snapshot()} to read from it.
     */
    LevelSnapshot snapshot();

    default CompletableFuture<QueryResult> query(RangeOptions range) {
        return query(range, ReadOptions.DEFAULT);
    }

    /**
     * Read one page of the range. The page size is the range limit, or a default when the range has none.
     */
    CompletableFuture<QueryResult> query(RangeOptions range, ReadOptions options);

    default UpdateFeed updates() {
        return updates(UpdatesOptions.DEFAULT);
    }

    UpdateFeed updates(UpdatesOptions options);

    String getProperty(String property);

    CompletableFuture<WalFile> getCurrentWalFile();

    CompletableFuture<List<WalFile>> getSortedWalFiles();

    default CompletableFuture<Void> flushWal() {
        return flushWal(false);
    }

    CompletableFuture<Void> flushWal(boolean sync);
}
