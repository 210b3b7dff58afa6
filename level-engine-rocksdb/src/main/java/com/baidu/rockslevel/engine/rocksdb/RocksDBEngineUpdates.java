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

package com.baidu.rockslevel.engine.rocksdb;

import static com.google.protobuf.UnsafeByteOperations.unsafeWrap;

import com.baidu.rockslevel.engine.ChangeBatch;
import com.baidu.rockslevel.engine.ChangeEntry;
import com.baidu.rockslevel.engine.IEngineUpdates;
import com.baidu.rockslevel.engine.StorageEngineException;
import com.baidu.rockslevel.engine.UpdatesOptions;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.disposables.Disposable;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.IntFunction;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.TransactionLogIterator;
import org.rocksdb.WriteBatch;

/**
 * Tails the write-ahead log. A pending {@link #next()} parks on the engine's sequence stream until a batch at or
 * beyond the expected sequence has been committed.
 */
@Slf4j
class RocksDBEngineUpdates implements IEngineUpdates {
    private final RocksDB db;
    private final Observable<Long> sequences;
    private final Executor ioExecutor;
    private final IntFunction<String> columnName;
    private final Consumer<Object> onClosed;
    private final boolean keys;
    private final boolean values;
    private final boolean data;
    private long nextSequence;
    private TransactionLogIterator logIterator;
    private CompletableFuture<Optional<ChangeBatch>> pending;
    private Disposable waiting;
    private boolean interrupted;
    private boolean closed;

    RocksDBEngineUpdates(RocksDB db,
                         long since,
                         UpdatesOptions options,
                         Observable<Long> sequences,
                         Executor ioExecutor,
                         IntFunction<String> columnName,
                         Consumer<Object> onClosed) {
        this.db = db;
        this.nextSequence = since + 1;
        this.sequences = sequences;
        this.ioExecutor = ioExecutor;
        this.columnName = columnName;
        this.onClosed = onClosed;
        this.keys = options.keys();
        this.values = options.values();
        this.data = options.data();
    }

    @Override
    public CompletableFuture<Optional<ChangeBatch>> next() {
        CompletableFuture<Optional<ChangeBatch>> onDone = new CompletableFuture<>();
        synchronized (this) {
            if (interrupted || closed) {
                onDone.complete(Optional.empty());
                return onDone;
            }
            pending = onDone;
            long expected = nextSequence;
            waiting = sequences.filter(seq -> seq >= expected)
                .firstElement()
                .subscribe(seq -> schedule(onDone), onDone::completeExceptionally);
        }
        return onDone;
    }

    private void schedule(CompletableFuture<Optional<ChangeBatch>> onDone) {
        try {
            ioExecutor.execute(() -> read(onDone));
        } catch (Throwable e) {
            onDone.completeExceptionally(new StorageEngineException("Engine is not serving reads", e));
        }
    }

    private synchronized void read(CompletableFuture<Optional<ChangeBatch>> onDone) {
        if (closed || interrupted) {
            onDone.complete(Optional.empty());
            return;
        }
        try {
            if (logIterator == null || !logIterator.isValid()) {
                closeLogIterator();
                logIterator = db.getUpdatesSince(nextSequence);
            }
            if (!logIterator.isValid()) {
                logIterator.status();
                throw new StorageEngineException("No write batch found at sequence " + nextSequence);
            }
            TransactionLogIterator.BatchResult result = logIterator.getBatch();
            ChangeBatch changes;
            try (WriteBatch batch = result.writeBatch()) {
                List<ChangeEntry> entries = WriteBatchDecoder.decode(batch, columnName, keys, values);
                changes = new ChangeBatch(result.sequenceNumber(), batch.count(), entries,
                    data ? unsafeWrap(batch.data()) : null);
            }
            nextSequence = changes.sequence() + changes.count();
            logIterator.next();
            onDone.complete(Optional.of(changes));
        } catch (StorageEngineException e) {
            closeLogIterator();
            onDone.completeExceptionally(e);
        } catch (RocksDBException e) {
            closeLogIterator();
            onDone.completeExceptionally(new StorageEngineException("Failed to read updates since " + nextSequence, e));
        }
    }

    @Override
    public void interrupt() {
        CompletableFuture<Optional<ChangeBatch>> toWake;
        synchronized (this) {
            interrupted = true;
            if (waiting != null) {
                waiting.dispose();
            }
            toWake = pending;
        }
        if (toWake != null) {
            toWake.complete(Optional.empty());
        }
    }

    @Override
    public void close() {
        interrupt();
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            closeLogIterator();
        }
        onClosed.accept(this);
    }

    private void closeLogIterator() {
        if (logIterator != null) {
            logIterator.close();
            logIterator = null;
        }
    }
}
