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

import static com.baidu.rockslevel.engine.KeyRangeUtil.lowerBound;
import static com.baidu.rockslevel.engine.KeyRangeUtil.toBytes;
import static com.baidu.rockslevel.engine.KeyRangeUtil.upperBound;
import static com.google.protobuf.UnsafeByteOperations.unsafeWrap;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.baidu.rockslevel.engine.BatchOperation;
import com.baidu.rockslevel.engine.IEngineIterator;
import com.baidu.rockslevel.engine.IEngineSnapshot;
import com.baidu.rockslevel.engine.IEngineUpdates;
import com.baidu.rockslevel.engine.ISnapshotPin;
import com.baidu.rockslevel.engine.IStorageEngine;
import com.baidu.rockslevel.engine.IteratorPage;
import com.baidu.rockslevel.engine.KeyRangeUtil;
import com.baidu.rockslevel.engine.KeyValue;
import com.baidu.rockslevel.engine.OpenOptions;
import com.baidu.rockslevel.engine.RangeOptions;
import com.baidu.rockslevel.engine.ReadOptions;
import com.baidu.rockslevel.engine.StorageEngineException;
import com.baidu.rockslevel.engine.UpdatesOptions;
import com.baidu.rockslevel.engine.WalFile;
import com.baidu.rockslevel.engine.WriteOptions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.protobuf.ByteString;
import io.reactivex.rxjava3.subjects.BehaviorSubject;
import io.reactivex.rxjava3.subjects.Subject;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.DBOptions;
import org.rocksdb.LogFile;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.WalFileType;

/**
 * {@link IStorageEngine} backed by RocksDB. Reads and change feeds are served from a private IO pool, writes run on
 * the caller's thread and publish the latest sequence number once committed.
 */
@Slf4j
public class RocksDBStorageEngine implements IStorageEngine {
    public static final String DEFAULT_COLUMN = new String(RocksDB.DEFAULT_COLUMN_FAMILY, UTF_8);

    static {
        RocksDB.loadLibrary();
    }

    private enum State {
        INIT, OPENING, OPEN, CLOSING, CLOSED
    }

    @FunctionalInterface
    private interface NativeCall<T> {
        T call(RocksDB db) throws RocksDBException;
    }

    private final RocksDBEngineConfigurator configurator;
    private final AtomicReference<State> state = new AtomicReference<>(State.INIT);
    private final ReadWriteLock lifecycleLock = new ReentrantReadWriteLock();
    private final Subject<Long> sequences = BehaviorSubject.createDefault(0L).toSerialized();
    private final Map<Object, Runnable> liveHandles = new ConcurrentHashMap<>();
    private final Map<String, ColumnFamilyHandle> cfHandles = new ConcurrentHashMap<>();
    private final Map<Integer, String> cfNames = new ConcurrentHashMap<>();
    private final List<ColumnFamilyOptions> cfOptions = new ArrayList<>();
    private final ThreadPoolExecutor lifecycleExecutor;
    private volatile ExecutorService ioExecutor;
    private volatile RocksDB db;
    private DBOptions dbOptions;
    private String location;

    public RocksDBStorageEngine() {
        this(RocksDBEngineConfigurator.builder().build());
    }

    public RocksDBStorageEngine(RocksDBEngineConfigurator configurator) {
        this.configurator = configurator;
        lifecycleExecutor = new ThreadPoolExecutor(1, 1, 60, TimeUnit.SECONDS, new LinkedBlockingQueue<>(),
            new ThreadFactoryBuilder().setNameFormat("rockslevel-engine-lifecycle-%d").setDaemon(true).build());
        lifecycleExecutor.allowCoreThreadTimeOut(true);
    }

    @Override
    public CompletableFuture<Set<String>> open(String location, OpenOptions options) {
        if (!state.compareAndSet(State.INIT, State.OPENING) && !state.compareAndSet(State.CLOSED, State.OPENING)) {
            return CompletableFuture.failedFuture(new StorageEngineException("Engine is " + state.get()));
        }
        return CompletableFuture.supplyAsync(() -> {
            try {
                doOpen(location, options);
                state.set(State.OPEN);
                log.debug("RocksDB engine opened: path={}, columns={}", location, cfHandles.keySet());
                return columns();
            } catch (Throwable e) {
                releaseNative();
                state.set(State.CLOSED);
                if (e instanceof StorageEngineException) {
                    throw (StorageEngineException) e;
                }
                throw new StorageEngineException("Failed to open RocksDB at " + location, e);
            }
        }, lifecycleExecutor);
    }

    private void doOpen(String location, OpenOptions options) throws RocksDBException {
        this.location = location;
        dbOptions = configurator.dbOptions()
            .setCreateIfMissing(options.createIfMissing())
            .setErrorIfExists(options.errorIfExists());
        Set<String> names = new LinkedHashSet<>();
        names.add(DEFAULT_COLUMN);
        names.addAll(existingColumns(location));
        names.addAll(options.columns());
        List<ColumnFamilyDescriptor> descriptors = new ArrayList<>();
        for (String name : names) {
            ColumnFamilyOptions cfOption = configurator.cfOptions(name);
            cfOptions.add(cfOption);
            descriptors.add(new ColumnFamilyDescriptor(name.getBytes(UTF_8), cfOption));
        }
        List<ColumnFamilyHandle> handles = new ArrayList<>();
        RocksDB opened = RocksDB.open(dbOptions, location, descriptors, handles);
        for (ColumnFamilyHandle handle : handles) {
            String name = new String(handle.getName(), UTF_8);
            cfHandles.put(name, handle);
            cfNames.put(handle.getID(), name);
        }
        int threads = configurator.ioParallelism();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(),
            new ThreadFactoryBuilder().setNameFormat("rockslevel-engine-io-%d").setDaemon(true).build());
        executor.allowCoreThreadTimeOut(true);
        ioExecutor = executor;
        db = opened;
        sequences.onNext(opened.getLatestSequenceNumber());
    }

    private List<String> existingColumns(String location) {
        try (Options options = new Options()) {
            return RocksDB.listColumnFamilies(options, location).stream()
                .map(name -> new String(name, UTF_8))
                .toList();
        } catch (RocksDBException e) {
            log.debug("No column family found at {}: {}", location, e.getMessage());
            return List.of();
        }
    }

    @Override
    public CompletableFuture<Void> close() {
        if (!state.compareAndSet(State.OPEN, State.CLOSING)) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> {
            try {
                doClose();
            } finally {
                state.set(State.CLOSED);
            }
        }, lifecycleExecutor);
    }

    private void doClose() {
        ExecutorService executor = ioExecutor;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Pending reads are not finished in time: path={}", location);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageEngineException("Interrupted while closing RocksDB at " + location, e);
        }
        lifecycleLock.writeLock().lock();
        try {
            for (Runnable closer : new ArrayList<>(liveHandles.values())) {
                closer.run();
            }
            liveHandles.clear();
            cfHandles.values().forEach(ColumnFamilyHandle::close);
            cfHandles.clear();
            RocksDB current = db;
            db = null;
            current.closeE();
            log.debug("RocksDB engine closed: path={}", location);
        } catch (RocksDBException e) {
            throw new StorageEngineException("Failed to close RocksDB at " + location, e);
        } finally {
            releaseNative();
            lifecycleLock.writeLock().unlock();
        }
    }

    private void releaseNative() {
        cfHandles.values().forEach(ColumnFamilyHandle::close);
        cfHandles.clear();
        cfNames.clear();
        if (db != null) {
            db.close();
            db = null;
        }
        cfOptions.forEach(ColumnFamilyOptions::close);
        cfOptions.clear();
        if (dbOptions != null) {
            dbOptions.close();
            dbOptions = null;
        }
        if (ioExecutor != null) {
            ioExecutor.shutdown();
            ioExecutor = null;
        }
    }

    @Override
    public Set<String> columns() {
        return Set.copyOf(cfHandles.keySet());
    }

    @Override
    public long currentSequence() {
        return guarded("Failed to read sequence", RocksDB::getLatestSequenceNumber);
    }

    @Override
    public CompletableFuture<Optional<ByteString>> get(ByteString key, ReadOptions options) {
        return readAsync("Get failed", rocksDB -> {
            try (org.rocksdb.ReadOptions readOptions = toReadOptions(options)) {
                byte[] value = rocksDB.get(cf(options.column()), readOptions, key.toByteArray());
                return Optional.ofNullable(value == null ? null : unsafeWrap(value));
            }
        });
    }

    @Override
    public CompletableFuture<List<Optional<ByteString>>> getMany(List<ByteString> keys, ReadOptions options) {
        return readAsync("Multi-get failed", rocksDB -> {
            ColumnFamilyHandle cfHandle = cf(options.column());
            List<ColumnFamilyHandle> cfList = new ArrayList<>(keys.size());
            List<byte[]> keyList = new ArrayList<>(keys.size());
            for (ByteString key : keys) {
                cfList.add(cfHandle);
                keyList.add(key.toByteArray());
            }
            try (org.rocksdb.ReadOptions readOptions = toReadOptions(options)) {
                List<byte[]> values = rocksDB.multiGetAsList(readOptions, cfList, keyList);
                List<Optional<ByteString>> result = new ArrayList<>(values.size());
                for (byte[] value : values) {
                    result.add(Optional.ofNullable(value == null ? null : unsafeWrap(value)));
                }
                return result;
            }
        });
    }

    @Override
    public void put(ByteString key, ByteString value, WriteOptions options) {
        guarded("Put failed", rocksDB -> {
            try (org.rocksdb.WriteOptions writeOptions = toWriteOptions(options)) {
                rocksDB.put(cf(options.column()), writeOptions, key.toByteArray(), value.toByteArray());
            }
            publish(rocksDB);
            return null;
        });
    }

    @Override
    public void delete(ByteString key, WriteOptions options) {
        guarded("Delete failed", rocksDB -> {
            try (org.rocksdb.WriteOptions writeOptions = toWriteOptions(options)) {
                rocksDB.delete(cf(options.column()), writeOptions, key.toByteArray());
            }
            publish(rocksDB);
            return null;
        });
    }

    @Override
    public void clear(RangeOptions range, WriteOptions options) {
        if (KeyRangeUtil.isEmpty(range) || range.limit() == 0) {
            return;
        }
        guarded("Clear failed", rocksDB -> {
            ColumnFamilyHandle cfHandle = cf(range.column() != null ? range.column() : options.column());
            try (org.rocksdb.WriteOptions writeOptions = toWriteOptions(options)) {
                RocksDBBatchWriter writer = new RocksDBBatchWriter(rocksDB, writeOptions);
                byte[] upper = toBytes(upperBound(range));
                if (range.limit() < 0 && upper != null) {
                    byte[] lower = toBytes(lowerBound(range));
                    writer.deleteRange(cfHandle, lower == null ? new byte[0] : lower, upper);
                } else {
                    collectDeletes(rocksDB, cfHandle, range, writer);
                }
                if (writer.done()) {
                    publish(rocksDB);
                }
            }
            return null;
        });
    }

    private void collectDeletes(RocksDB rocksDB, ColumnFamilyHandle cfHandle, RangeOptions range,
                                RocksDBBatchWriter writer) throws RocksDBException {
        RangeOptions keysOnly = range.toBuilder().keys(true).values(false).build();
        RocksDBEngineIterator itr =
            new RocksDBEngineIterator(rocksDB, cfHandle, keysOnly, null, false, Runnable::run, handle -> {
            });
        try {
            IteratorPage page;
            do {
                page = itr.pull(1024);
                for (KeyValue row : page.rows()) {
                    writer.delete(cfHandle, row.key().toByteArray());
                }
            } while (!page.finished());
        } catch (Throwable e) {
            writer.abort();
            throw e;
        } finally {
            itr.close();
        }
    }

    @Override
    public void batchApply(List<BatchOperation> operations, WriteOptions options) {
        if (operations.isEmpty()) {
            return;
        }
        guarded("Batch failed", rocksDB -> {
            try (org.rocksdb.WriteOptions writeOptions = toWriteOptions(options)) {
                RocksDBBatchWriter writer = new RocksDBBatchWriter(rocksDB, writeOptions);
                try {
                    for (BatchOperation op : operations) {
                        ColumnFamilyHandle cfHandle = cf(op.column() != null ? op.column() : options.column());
                        switch (op.type()) {
                            case PUT -> writer.put(cfHandle, op.key(), op.value());
                            case DELETE -> writer.delete(cfHandle, op.key().toByteArray());
                            default -> throw new StorageEngineException("Unknown batch operation: " + op.type());
                        }
                    }
                } catch (Throwable e) {
                    writer.abort();
                    throw e;
                }
                writer.done();
            }
            publish(rocksDB);
            return null;
        });
    }

    @Override
    public IEngineIterator newIterator(RangeOptions range, ReadOptions options) {
        return guarded("Failed to create iterator", rocksDB -> {
            String column = range.column() != null ? range.column() : options.column();
            RocksDBEngineIterator itr = new RocksDBEngineIterator(rocksDB, cf(column), range,
                options.snapshot() != null ? rocksSnapshot(options.snapshot()).snapshot() : null,
                options.fillCache(), ioExecutor, liveHandles::remove);
            liveHandles.put(itr, itr::close);
            return itr;
        });
    }

    @Override
    public IEngineSnapshot newSnapshot() {
        return guarded("Failed to create snapshot", rocksDB -> {
            RocksDBEngineSnapshot snapshot = new RocksDBEngineSnapshot(rocksDB, liveHandles::remove);
            liveHandles.put(snapshot, snapshot::close);
            return snapshot;
        });
    }

    @Override
    public IEngineUpdates subscribeUpdates(UpdatesOptions options) {
        return guarded("Failed to subscribe updates", rocksDB -> {
            long since = options.since() < 0 ? rocksDB.getLatestSequenceNumber() : options.since();
            RocksDBEngineUpdates updates = new RocksDBEngineUpdates(rocksDB, since, options, sequences,
                ioExecutor, cfNames::get, liveHandles::remove);
            liveHandles.put(updates, updates::close);
            return updates;
        });
    }

    @Override
    public String getProperty(String property) {
        return guarded("Failed to get property " + property, rocksDB -> rocksDB.getProperty(property));
    }

    @Override
    public WalFile currentWalFile() {
        List<WalFile> walFiles = sortedWalFiles();
        for (int i = walFiles.size() - 1; i >= 0; i--) {
            if (walFiles.get(i).alive()) {
                return walFiles.get(i);
            }
        }
        throw new StorageEngineException("No alive WAL file found");
    }

    @Override
    public List<WalFile> sortedWalFiles() {
        return guarded("Failed to list WAL files", rocksDB -> {
            List<WalFile> walFiles = new ArrayList<>();
            for (LogFile logFile : rocksDB.getSortedWalFiles()) {
                walFiles.add(new WalFile(logFile.pathName(),
                    logFile.logNumber(),
                    logFile.type() == WalFileType.kAliveLogFile,
                    logFile.startSequence(),
                    logFile.sizeFileBytes()));
            }
            return walFiles;
        });
    }

    @Override
    public void flushWal(boolean sync) {
        guarded("Failed to flush WAL", rocksDB -> {
            rocksDB.flushWal(sync);
            return null;
        });
    }

    private void publish(RocksDB rocksDB) {
        sequences.onNext(rocksDB.getLatestSequenceNumber());
    }

    private <T> T guarded(String errorMessage, NativeCall<T> call) {
        lifecycleLock.readLock().lock();
        try {
            RocksDB current = db;
            if (state.get() != State.OPEN || current == null) {
                throw new StorageEngineException("Engine is not open");
            }
            return call.call(current);
        } catch (RocksDBException e) {
            throw new StorageEngineException(errorMessage, e);
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    private <T> CompletableFuture<T> readAsync(String errorMessage, NativeCall<T> call) {
        ExecutorService executor = ioExecutor;
        if (state.get() != State.OPEN || executor == null) {
            return CompletableFuture.failedFuture(new StorageEngineException("Engine is not open"));
        }
        try {
            return CompletableFuture.supplyAsync(() -> guarded(errorMessage, call), executor);
        } catch (Throwable e) {
            return CompletableFuture.failedFuture(new StorageEngineException("Engine is not serving reads", e));
        }
    }

    private ColumnFamilyHandle cf(@Nullable String column) {
        ColumnFamilyHandle handle = cfHandles.get(column == null ? DEFAULT_COLUMN : column);
        if (handle == null) {
            throw new StorageEngineException("Unknown column: " + column);
        }
        return handle;
    }

    private RocksDBEngineSnapshot rocksSnapshot(ISnapshotPin snapshot) {
        if (snapshot instanceof RocksDBEngineSnapshot rocksDBSnapshot) {
            return rocksDBSnapshot;
        }
        throw new StorageEngineException("Snapshot is not created by this engine");
    }

    private org.rocksdb.ReadOptions toReadOptions(ReadOptions options) {
        org.rocksdb.ReadOptions readOptions = new org.rocksdb.ReadOptions().setFillCache(options.fillCache());
        if (options.snapshot() != null) {
            readOptions.setSnapshot(rocksSnapshot(options.snapshot()).snapshot());
        }
        return readOptions;
    }

    private org.rocksdb.WriteOptions toWriteOptions(WriteOptions options) {
        return new org.rocksdb.WriteOptions().setSync(options.sync());
    }
}
