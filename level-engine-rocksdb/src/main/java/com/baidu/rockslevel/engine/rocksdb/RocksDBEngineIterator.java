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

import static com.baidu.rockslevel.engine.KeyRangeUtil.compare;
import static com.baidu.rockslevel.engine.KeyRangeUtil.lowerBound;
import static com.baidu.rockslevel.engine.KeyRangeUtil.toBytes;
import static com.baidu.rockslevel.engine.KeyRangeUtil.upperBound;
import static com.google.protobuf.UnsafeByteOperations.unsafeWrap;

import com.baidu.rockslevel.engine.IEngineIterator;
import com.baidu.rockslevel.engine.IteratorPage;
import com.baidu.rockslevel.engine.KeyRangeUtil;
import com.baidu.rockslevel.engine.KeyValue;
import com.baidu.rockslevel.engine.RangeOptions;
import com.baidu.rockslevel.engine.StorageEngineException;
import com.google.protobuf.ByteString;
import java.lang.ref.Cleaner;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.Slice;
import org.rocksdb.Snapshot;

@Slf4j
class RocksDBEngineIterator implements IEngineIterator {
    private record NativeState(RocksIterator itr,
                               ReadOptions readOptions,
                               Slice lowerSlice,
                               Slice upperSlice,
                               Snapshot ownedSnapshot,
                               RocksDB db) implements Runnable {

        @Override
        public void run() {
            itr.close();
            readOptions.close();
            if (lowerSlice != null) {
                lowerSlice.close();
            }
            if (upperSlice != null) {
                upperSlice.close();
            }
            if (ownedSnapshot != null) {
                db.releaseSnapshot(ownedSnapshot);
            }
        }
    }

    private final RocksIterator rocksIterator;
    private final Cleaner.Cleanable onClose;
    private final Executor ioExecutor;
    private final Consumer<Object> onClosed;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final long sequence;
    private final boolean empty;
    private final boolean reverse;
    private final boolean keys;
    private final boolean values;
    private final int limit;
    private final byte[] lower;
    private final byte[] upper;
    private volatile byte[] seekTarget;
    private boolean positioned;
    private int yielded;

    RocksDBEngineIterator(RocksDB db,
                          ColumnFamilyHandle cfHandle,
                          RangeOptions range,
                          @Nullable Snapshot snapshot,
                          boolean fillCache,
                          Executor ioExecutor,
                          Consumer<Object> onClosed) {
        this.ioExecutor = ioExecutor;
        this.onClosed = onClosed;
        this.reverse = range.reverse();
        this.keys = range.keys();
        this.values = range.values();
        this.limit = range.limit();
        this.empty = KeyRangeUtil.isEmpty(range) || limit == 0;
        this.lower = toBytes(lowerBound(range));
        this.upper = toBytes(upperBound(range));

        Snapshot ownedSnapshot = null;
        if (snapshot == null) {
            ownedSnapshot = db.getSnapshot();
            snapshot = ownedSnapshot;
        }
        sequence = snapshot.getSequenceNumber();
        ReadOptions readOptions = new ReadOptions().setSnapshot(snapshot).setFillCache(fillCache);
        Slice lowerSlice = null;
        Slice upperSlice = null;
        if (!empty) {
            if (lower != null) {
                lowerSlice = new Slice(lower);
                readOptions.setIterateLowerBound(lowerSlice);
            }
            if (upper != null) {
                upperSlice = new Slice(upper);
                readOptions.setIterateUpperBound(upperSlice);
            }
        }
        rocksIterator = db.newIterator(cfHandle, readOptions);
        onClose = AutoCleaner.register(this,
            new NativeState(rocksIterator, readOptions, lowerSlice, upperSlice, ownedSnapshot, db));
    }

    @Override
    public long sequence() {
        return sequence;
    }

    @Override
    public CompletableFuture<IteratorPage> nextv(int size) {
        try {
            return CompletableFuture.supplyAsync(() -> pull(size), ioExecutor);
        } catch (Throwable e) {
            return CompletableFuture.failedFuture(new StorageEngineException("Engine is not serving reads", e));
        }
    }

    @Override
    public void seek(ByteString target) {
        seekTarget = target.toByteArray();
    }

    /**
     * Read at most {@code size} rows on the calling thread.
     */
    IteratorPage pull(int size) {
        if (closed.get()) {
            throw new StorageEngineException("Iterator has been closed");
        }
        if (empty) {
            return new IteratorPage(List.of(), true);
        }
        try {
            byte[] target = seekTarget;
            if (target != null) {
                seekTarget = null;
                position(target);
                positioned = true;
            } else if (!positioned) {
                if (reverse) {
                    rocksIterator.seekToLast();
                } else {
                    rocksIterator.seekToFirst();
                }
                positioned = true;
            }
            List<KeyValue> rows = new ArrayList<>(Math.min(size, 1024));
            while (rows.size() < size && hasMore()) {
                rows.add(new KeyValue(keys ? unsafeWrap(rocksIterator.key()) : null,
                    values ? unsafeWrap(rocksIterator.value()) : null));
                yielded++;
                if (reverse) {
                    rocksIterator.prev();
                } else {
                    rocksIterator.next();
                }
            }
            boolean finished = !hasMore();
            if (!rocksIterator.isValid()) {
                rocksIterator.status();
            }
            return new IteratorPage(rows, finished);
        } catch (RocksDBException e) {
            throw new StorageEngineException("Iterate failed", e);
        }
    }

    private boolean hasMore() {
        if (limit >= 0 && yielded >= limit) {
            return false;
        }
        if (!rocksIterator.isValid()) {
            return false;
        }
        byte[] key = rocksIterator.key();
        return (lower == null || compare(key, lower) >= 0) && (upper == null || compare(key, upper) < 0);
    }

    private void position(byte[] target) {
        if (reverse) {
            if (upper != null && compare(target, upper) >= 0) {
                rocksIterator.seekToLast();
            } else {
                rocksIterator.seekForPrev(target);
            }
        } else {
            if (lower != null && compare(target, lower) < 0) {
                rocksIterator.seekToFirst();
            } else {
                rocksIterator.seek(target);
            }
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            onClose.clean();
            onClosed.accept(this);
        }
    }
}
