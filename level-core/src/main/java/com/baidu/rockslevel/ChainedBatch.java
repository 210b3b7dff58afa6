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
import com.baidu.rockslevel.engine.WriteOptions;
import com.google.protobuf.ByteString;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Collects operations and writes them atomically. A batch is usable until it is written or closed.
 */
public final class ChainedBatch implements ILevelResource {
    private enum State {
        OPEN,
        WRITING,
        CLOSED
    }

    private final RocksLevel db;
    private final ResourceTracker tracker;
    private final List<BatchOperation> operations = new ArrayList<>();
    private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();
    private State state = State.OPEN;

    ChainedBatch(RocksLevel db, ResourceTracker tracker) {
        this.db = db;
        this.tracker = tracker;
    }

    public ChainedBatch put(ByteString key, ByteString value) {
        return add(BatchOperation.put(key, value));
    }

    public ChainedBatch put(ByteString key, ByteString value, String column) {
        return add(BatchOperation.put(key, value, column));
    }

    public ChainedBatch delete(ByteString key) {
        return add(BatchOperation.delete(key));
    }

    public ChainedBatch delete(ByteString key, String column) {
        return add(BatchOperation.delete(key, column));
    }

    /**
     * Drop the operations collected so far.
     */
    public synchronized ChainedBatch clear() {
        checkOpen();
        operations.clear();
        return this;
    }

    public synchronized int length() {
        return operations.size();
    }

    public CompletableFuture<Void> write() {
        return write(WriteOptions.DEFAULT);
    }

    public CompletableFuture<Void> write(WriteOptions options) {
        List<BatchOperation> toWrite;
        synchronized (this) {
            if (state != State.OPEN) {
                return CompletableFuture.failedFuture(LevelException.invalidState("Batch is not open"));
            }
            state = State.WRITING;
            toWrite = List.copyOf(operations);
        }
        return db.write(toWrite, options).whenComplete((v, e) -> close());
    }

    @Override
    public CompletableFuture<Void> close() {
        synchronized (this) {
            if (state == State.CLOSED) {
                return closeFuture;
            }
            state = State.CLOSED;
            operations.clear();
        }
        tracker.detach(this);
        closeFuture.complete(null);
        return closeFuture;
    }

    private synchronized ChainedBatch add(BatchOperation op) {
        checkOpen();
        db.checkOperation(op);
        operations.add(op);
        return this;
    }

    private void checkOpen() {
        if (state != State.OPEN) {
            throw LevelException.invalidState("Batch is not open");
        }
    }
}
