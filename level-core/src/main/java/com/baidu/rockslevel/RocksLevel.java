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
import com.baidu.rockslevel.engine.IEngineIterator;
import com.baidu.rockslevel.engine.IEngineSnapshot;
import com.baidu.rockslevel.engine.IEngineUpdates;
import com.baidu.rockslevel.engine.IStorageEngine;
import com.baidu.rockslevel.engine.IteratorPage;
import com.baidu.rockslevel.engine.OpenOptions;
import com.baidu.rockslevel.engine.RangeOptions;
import com.baidu.rockslevel.engine.ReadOptions;
import com.baidu.rockslevel.engine.StorageEngineException;
import com.baidu.rockslevel.engine.UpdatesOptions;
import com.baidu.rockslevel.engine.WalFile;
import com.baidu.rockslevel.engine.WriteOptions;
import com.baidu.rockslevel.engine.rocksdb.RocksDBStorageEngine;
import com.baidu.rockslevel.metrics.LevelOpMeters;
import com.baidu.rockslevel.sysprops.props.IteratorPrefetchRows;
import com.baidu.rockslevel.sysprops.props.QueryDefaultLimit;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.protobuf.ByteString;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link IRocksLevel} over an {@link IStorageEngine}, RocksDB by default.
 */
@Slf4j
public class RocksLevel implements IRocksLevel {
    private final String location;
    private final IStorageEngine engine;
    private final Executor scheduler;
    private final ResourceTracker tracker = new ResourceTracker();
    private final Object lock = new Object();
    // guarded by lock
    private final Queue<Runnable> deferred = new ArrayDeque<>();
    private volatile Status status = Status.NEW;
    private volatile OpenOptions openOptions;
    private volatile Set<String> columns = Set.of();
    private volatile LevelOpMeters meters;
    private CompletableFuture<Void> openFuture;
    private CompletableFuture<Void> closeFuture;

    public RocksLevel(String location) {
        this(location, new RocksDBStorageEngine());
    }

    public RocksLevel(String location, IStorageEngine engine) {
        this(location, engine, newScheduler());
    }

    /**
     * @param scheduler the executor all completions are delivered on, it must run tasks one at a time in order
     */
    public RocksLevel(String location, IStorageEngine engine, Executor scheduler) {
        if (location == null || location.isEmpty()) {
            throw LevelException.invalidArgument("The first argument 'location' must be a non-empty string");
        }
        this.location = location;
        this.engine = engine;
        this.scheduler = scheduler;
    }

    private static Executor newScheduler() {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(1, 1, 60, TimeUnit.SECONDS, new LinkedBlockingQueue<>(),
            new ThreadFactoryBuilder().setNameFormat("rockslevel-scheduler-%d").setDaemon(true).build());
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    @Override
    public String location() {
        return location;
    }

    @Override
    public Status status() {
        return status;
    }

    @Override
    public OpenOptions options() {
        return openOptions;
    }

    @Override
    public Set<String> columns() {
        return columns;
    }

    @Override
    public long sequence() {
        requireOpen();
        return engine.currentSequence();
    }

    @Override
    public CompletableFuture<Void> open(OpenOptions options) {
        if (options == null) {
            throw LevelException.invalidArgument("The first argument 'options' must not be null");
        }
        CompletableFuture<Void> onOpened;
        synchronized (lock) {
            switch (status) {
                case OPEN:
                    return CompletableFuture.completedFuture(null);
                case OPENING:
                    return openFuture;
                case CLOSING:
                    return closeFuture.handle((v, e) -> null).thenCompose(v -> open(options));
                default:
                    status = Status.OPENING;
                    openFuture = new CompletableFuture<>();
                    onOpened = openFuture;
                    tracker.reset();
            }
        }
        CompletableFuture<Set<String>> engineOpened;
        try {
            if (options.createIfMissing()) {
                Files.createDirectories(Paths.get(location));
            }
            engineOpened = engine.open(location, options);
        } catch (IOException e) {
            engineOpened = CompletableFuture.failedFuture(
                new StorageEngineException("Failed to create directory " + location, e));
        } catch (Throwable e) {
            engineOpened = CompletableFuture.failedFuture(e);
        }
        engineOpened.whenCompleteAsync((openedColumns, e) -> {
            List<Runnable> toRun;
            synchronized (lock) {
                if (e != null) {
                    status = Status.CLOSED;
                } else {
                    columns = openedColumns;
                    openOptions = options;
                    meters = new LevelOpMeters(location);
                    status = Status.OPEN;
                }
                toRun = new ArrayList<>(deferred);
                deferred.clear();
            }
            // queued operations go before anything chained on the open future, a close included
            toRun.forEach(Runnable::run);
            if (e != null) {
                log.warn("Failed to open database: location={}", location, unwrap(e));
                onOpened.completeExceptionally(unwrap(e));
            } else {
                log.debug("Database opened: location={}, columns={}", location, openedColumns);
                onOpened.complete(null);
            }
        }, scheduler);
        return onOpened;
    }

    @Override
    public CompletableFuture<Void> close() {
        CompletableFuture<Void> onClosed;
        synchronized (lock) {
            switch (status) {
                case NEW:
                    status = Status.CLOSED;
                    return CompletableFuture.completedFuture(null);
                case OPENING:
                    return openFuture.handle((v, e) -> null).thenCompose(v -> close());
                case CLOSING:
                    return closeFuture;
                case CLOSED:
                    return CompletableFuture.completedFuture(null);
                default:
                    status = Status.CLOSING;
                    closeFuture = new CompletableFuture<>();
                    onClosed = closeFuture;
            }
        }
        tracker.closeAll()
            .thenCompose(v -> engine.close())
            .whenCompleteAsync((v, e) -> {
                synchronized (lock) {
                    status = Status.CLOSED;
                }
                LevelOpMeters current = meters;
                if (current != null) {
                    current.close();
                }
                if (e != null) {
                    log.warn("Failed to close database: location={}", location, unwrap(e));
                    onClosed.completeExceptionally(unwrap(e));
                } else {
                    log.debug("Database closed: location={}", location);
                    onClosed.complete(null);
                }
            }, scheduler);
        return onClosed;
    }

    @Override
    public CompletableFuture<Optional<ByteString>> get(ByteString key, ReadOptions options) {
        checkKey(key);
        PinnedRead pinned = pin(options);
        return pinned.hold(deferOrRun(() -> timed(meters.getCallTimer, () -> engine.get(key, pinned.options()))));
    }

    @Override
    public CompletableFuture<List<Optional<ByteString>>> getMany(List<ByteString> keys, ReadOptions options) {
        if (keys == null) {
            throw LevelException.invalidArgument("The first argument 'keys' must be a list");
        }
        keys.forEach(this::checkKey);
        PinnedRead pinned = pin(options);
        return pinned.hold(
            deferOrRun(() -> timed(meters.getManyCallTimer, () -> engine.getMany(keys, pinned.options()))));
    }

    @Override
    public CompletableFuture<Void> put(ByteString key, ByteString value, WriteOptions options) {
        checkKey(key);
        checkValue(value);
        return deferOrRun(() -> runOnCaller(meters.putCallTimer, () -> {
            engine.put(key, value, options);
            return null;
        }));
    }

    @Override
    public CompletableFuture<Void> delete(ByteString key, WriteOptions options) {
        checkKey(key);
        return deferOrRun(() -> runOnCaller(meters.deleteCallTimer, () -> {
            engine.delete(key, options);
            return null;
        }));
    }

    @Override
    public CompletableFuture<Void> clear(RangeOptions range, WriteOptions options) {
        checkRange(range);
        return deferOrRun(() -> runOnCaller(meters.clearCallTimer, () -> {
            engine.clear(range, options);
            return null;
        }));
    }

    @Override
    public CompletableFuture<Void> batch(List<BatchOperation> operations, WriteOptions options) {
        if (operations == null) {
            throw LevelException.invalidArgument("The first argument 'operations' must be a list");
        }
        for (BatchOperation op : operations) {
            checkOperation(op);
        }
        List<BatchOperation> ops = List.copyOf(operations);
        return deferOrRun(() -> runOnCaller(meters.batchCallTimer, () -> {
            engine.batchApply(ops, options);
            return null;
        }));
    }

    @Override
    public ChainedBatch chainedBatch() {
        requireOpen();
        ChainedBatch batch = new ChainedBatch(this, tracker);
        tracker.attach(batch);
        return batch;
    }

    @Override
    public LevelIterator iterator(RangeOptions range, ReadOptions options) {
        checkRange(range);
        requireOpen();
        PinnedRead pinned = pin(options);
        IEngineIterator itr;
        try {
            itr = engine.newIterator(range, pinned.options());
        } catch (Throwable e) {
            pinned.release();
            throw e;
        }
        LevelIterator levelItr = new LevelIterator(itr, tracker, scheduler, meters.iterNextCallTimer,
            IteratorPrefetchRows.INSTANCE.get(), pinned::release);
        attachOrRelease(levelItr, () -> {
            itr.close();
            pinned.release();
        });
        return levelItr;
    }

    @Override
    public LevelSnapshot snapshot() {
        requireOpen();
        IEngineSnapshot engineSnapshot = engine.newSnapshot();
        LevelSnapshot snapshot = new LevelSnapshot(this, engineSnapshot, tracker);
        attachOrRelease(snapshot, engineSnapshot::close);
        return snapshot;
    }

    @Override
    public CompletableFuture<QueryResult> query(RangeOptions range, ReadOptions options) {
        checkRange(range);
        PinnedRead pinned = pin(options);
        return pinned.hold(deferOrRun(() -> {
            int limit = range.limit() >= 0 ? range.limit() : QueryDefaultLimit.INSTANCE.get();
            IEngineIterator itr = engine.newIterator(range.toBuilder().limit(-1).build(), pinned.options());
            QueryResource resource = new QueryResource();
            attachOrRelease(resource, itr::close);
            Timer.Sample sample = Timer.start();
            CompletableFuture<QueryResult> onDone = new CompletableFuture<>();
            CompletableFuture<IteratorPage> page;
            try {
                page = itr.nextv(limit);
            } catch (Throwable e) {
                page = CompletableFuture.failedFuture(e);
            }
            page.whenCompleteAsync((result, e) -> {
                try {
                    itr.close();
                } catch (Throwable closeError) {
                    log.warn("Failed to release query iterator: location={}", location, closeError);
                } finally {
                    tracker.detach(resource);
                    resource.released.complete(null);
                    sample.stop(meters.queryCallTimer);
                }
                if (e != null) {
                    onDone.completeExceptionally(unwrap(e));
                } else {
                    onDone.complete(new QueryResult(result.rows(), itr.sequence(), result.finished()));
                }
            }, scheduler);
            return onDone;
        }));
    }

    @Override
    public UpdateFeed updates(UpdatesOptions options) {
        requireOpen();
        long since = options.since() >= 0 ? options.since() : engine.currentSequence();
        IEngineUpdates subscription = engine.subscribeUpdates(options.toBuilder().since(since).build());
        UpdateFeed feed = new UpdateFeed(since, subscription, tracker, scheduler, meters.updatesNextCallTimer);
        attachOrRelease(feed, subscription::close);
        return feed;
    }

    @Override
    public String getProperty(String property) {
        if (property == null) {
            throw LevelException.invalidArgument("The first argument 'property' must be a string");
        }
        requireOpen();
        return engine.getProperty(property);
    }

    @Override
    public CompletableFuture<WalFile> getCurrentWalFile() {
        return deferOrRun(() -> runOnCaller(meters.walCallTimer, engine::currentWalFile));
    }

    @Override
    public CompletableFuture<List<WalFile>> getSortedWalFiles() {
        return deferOrRun(() -> runOnCaller(meters.walCallTimer, engine::sortedWalFiles));
    }

    @Override
    public CompletableFuture<Void> flushWal(boolean sync) {
        return deferOrRun(() -> runOnCaller(meters.walCallTimer, () -> {
            engine.flushWal(sync);
            return null;
        }));
    }

    @Override
    public String toString() {
        return "RocksLevel{location=" + location + ", status=" + status + "}";
    }

    ResourceTracker tracker() {
        return tracker;
    }

    CompletableFuture<Void> write(List<BatchOperation> operations, WriteOptions options) {
        return deferOrRun(() -> runOnCaller(meters.batchCallTimer, () -> {
            engine.batchApply(operations, options);
            return null;
        }));
    }

    /**
     * Run the operation now if open, queue it if opening, and fail it otherwise.
     */
    private <T> CompletableFuture<T> deferOrRun(Supplier<CompletableFuture<T>> op) {
        synchronized (lock) {
            if (status == Status.OPENING) {
                CompletableFuture<T> onDone = new CompletableFuture<>();
                deferred.add(() -> {
                    if (status != Status.OPEN) {
                        onDone.completeExceptionally(LevelException.notOpen());
                        return;
                    }
                    invoke(op).whenComplete((v, e) -> {
                        if (e != null) {
                            onDone.completeExceptionally(unwrap(e));
                        } else {
                            onDone.complete(v);
                        }
                    });
                });
                return onDone;
            }
            if (status != Status.OPEN) {
                return CompletableFuture.failedFuture(LevelException.notOpen());
            }
        }
        return invoke(op);
    }

    private <T> CompletableFuture<T> invoke(Supplier<CompletableFuture<T>> op) {
        try {
            return op.get();
        } catch (Throwable e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Run a synchronous engine call on the calling thread and deliver its outcome through the scheduler.
     */
    private <T> CompletableFuture<T> runOnCaller(Timer timer, Supplier<T> call) {
        CompletableFuture<T> onDone = new CompletableFuture<>();
        Timer.Sample sample = Timer.start();
        try {
            T result = call.get();
            sample.stop(timer);
            scheduler.execute(() -> onDone.complete(result));
        } catch (Throwable e) {
            scheduler.execute(() -> onDone.completeExceptionally(e));
        }
        return onDone;
    }

    /**
     * Deliver the outcome of an asynchronous engine call through the scheduler.
     */
    private <T> CompletableFuture<T> timed(Timer timer, Supplier<CompletableFuture<T>> call) {
        CompletableFuture<T> onDone = new CompletableFuture<>();
        Timer.Sample sample = Timer.start();
        call.get().whenCompleteAsync((v, e) -> {
            if (e != null) {
                onDone.completeExceptionally(unwrap(e));
            } else {
                sample.stop(timer);
                onDone.complete(v);
            }
        }, scheduler);
        return onDone;
    }

    private void attachOrRelease(ILevelResource resource, Runnable release) {
        try {
            tracker.attach(resource);
        } catch (LevelException e) {
            release.run();
            throw e;
        }
    }

    /**
     * Swap a {@link LevelSnapshot} in the options for its engine snapshot and hold it until the read is done.
     */
    private PinnedRead pin(ReadOptions options) {
        if (options == null) {
            throw LevelException.invalidArgument("Read options cannot be null");
        }
        if (options.snapshot() instanceof LevelSnapshot levelSnapshot) {
            return new PinnedRead(options.toBuilder().snapshot(levelSnapshot.acquire(this)).build(), levelSnapshot);
        }
        return new PinnedRead(options, null);
    }

    private void requireOpen() {
        if (status != Status.OPEN) {
            throw LevelException.notOpen();
        }
    }

    private void checkKey(ByteString key) {
        if (key == null) {
            throw LevelException.invalidArgument("Key cannot be null");
        }
    }

    private void checkValue(ByteString value) {
        if (value == null) {
            throw LevelException.invalidArgument("Value cannot be null");
        }
    }

    private void checkRange(RangeOptions range) {
        if (range == null) {
            throw LevelException.invalidArgument("Range options cannot be null");
        }
    }

    void checkOperation(BatchOperation op) {
        if (op == null || op.type() == null) {
            throw LevelException.invalidArgument("A batch operation must have a type");
        }
        checkKey(op.key());
        if (op.type() == BatchOperation.Type.PUT) {
            checkValue(op.value());
        }
    }

    static Throwable unwrap(Throwable e) {
        if (e instanceof CompletionException && e.getCause() != null) {
            return e.getCause();
        }
        return e;
    }

    private record PinnedRead(ReadOptions options, @Nullable LevelSnapshot snapshot) {
        void release() {
            if (snapshot != null) {
                snapshot.release();
            }
        }

        <T> CompletableFuture<T> hold(CompletableFuture<T> read) {
            if (snapshot == null) {
                return read;
            }
            CompletableFuture<T> onDone = new CompletableFuture<>();
            read.whenComplete((v, e) -> {
                release();
                if (e != null) {
                    onDone.completeExceptionally(unwrap(e));
                } else {
                    onDone.complete(v);
                }
            });
            return onDone;
        }
    }

    /**
     * Stands for a query in progress so that a concurrent close waits for its iterator to be released.
     */
    private static class QueryResource implements ILevelResource {
        private final CompletableFuture<Void> released = new CompletableFuture<>();

        @Override
        public CompletableFuture<Void> close() {
            return released;
        }
    }
}
