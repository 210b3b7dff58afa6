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

import com.baidu.rockslevel.engine.IEngineIterator;
import com.baidu.rockslevel.engine.IteratorPage;
import com.baidu.rockslevel.engine.KeyValue;
import com.google.protobuf.ByteString;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * A cursor over a range of the database. Only one read may be in flight at a time.
 *
 * <p>{@link #next()} is served from a prefetched page, {@link #nextv(int)} pulls from the engine directly once the
 * prefetched rows are used up.
 */
public final class LevelIterator implements ILevelResource {
    enum State {
        CREATED,
        ACTIVE,
        EXHAUSTED,
        CLOSED
    }

    private final IEngineIterator engineItr;
    private final ResourceTracker tracker;
    private final Executor scheduler;
    private final Timer nextCallTimer;
    private final int prefetchRows;
    private final Runnable onReleased;
    private final Deque<KeyValue> cache = new ArrayDeque<>();
    private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();
    private State state = State.CREATED;
    private boolean engineFinished;
    private CompletableFuture<?> inflight;
    private int count;

    LevelIterator(IEngineIterator engineItr,
                  ResourceTracker tracker,
                  Executor scheduler,
                  Timer nextCallTimer,
                  int prefetchRows,
                  Runnable onReleased) {
        this.engineItr = engineItr;
        this.tracker = tracker;
        this.scheduler = scheduler;
        this.nextCallTimer = nextCallTimer;
        this.prefetchRows = prefetchRows;
        this.onReleased = onReleased;
    }

    /**
     * The sequence number of the view this cursor reads from.
     */
    public long sequence() {
        return engineItr.sequence();
    }

    /**
     * The number of rows handed out so far.
     */
    public synchronized int count() {
        return count;
    }

    synchronized State state() {
        return state;
    }

    /**
     * The next row, or empty once the range is exhausted.
     */
    public CompletableFuture<Optional<KeyValue>> next() {
        return read(1, prefetchRows, rows -> rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0)));
    }

    /**
     * Up to {@code size} rows, an empty list once the range is exhausted.
     */
    public CompletableFuture<List<KeyValue>> nextv(int size) {
        if (size <= 0) {
            throw LevelException.invalidArgument("The first argument 'size' must be positive");
        }
        return read(size, size, Function.identity());
    }

    /**
     * All remaining rows. The cursor is closed afterwards.
     */
    public CompletableFuture<List<KeyValue>> all() {
        List<KeyValue> collected = new ArrayList<>();
        CompletableFuture<List<KeyValue>> onDone = new CompletableFuture<>();
        collect(collected).whenComplete((v, e) -> close().whenComplete((cv, ce) -> {
            if (e != null) {
                onDone.completeExceptionally(RocksLevel.unwrap(e));
            } else {
                onDone.complete(collected);
            }
        }));
        return onDone;
    }

    private CompletableFuture<Void> collect(List<KeyValue> collected) {
        return nextv(Math.max(prefetchRows, 1)).thenCompose(rows -> {
            if (rows.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }
            collected.addAll(rows);
            return collect(collected);
        });
    }

    /**
     * Move the cursor to the first row at or after the target, or at or before it when reversed. The target is clamped
     * to the range.
     */
    public synchronized void seek(ByteString target) {
        if (target == null) {
            throw LevelException.invalidArgument("The first argument 'target' must not be null");
        }
        if (state == State.CLOSED) {
            throw LevelException.invalidState("Iterator has been closed");
        }
        if (state == State.EXHAUSTED) {
            throw LevelException.invalidState("Iterator has been exhausted");
        }
        if (inflight != null) {
            throw LevelException.invalidState("Iterator is busy with a pending read");
        }
        cache.clear();
        engineFinished = false;
        engineItr.seek(target);
    }

    private <T> CompletableFuture<T> read(int size, int pullSize, Function<List<KeyValue>, T> mapper) {
        CompletableFuture<T> onDone = new CompletableFuture<>();
        synchronized (this) {
            switch (state) {
                case CLOSED:
                    return CompletableFuture.failedFuture(LevelException.invalidState("Iterator has been closed"));
                case EXHAUSTED:
                    scheduler.execute(() -> onDone.complete(mapper.apply(List.of())));
                    return onDone;
                default:
                    break;
            }
            if (inflight != null) {
                return CompletableFuture.failedFuture(
                    LevelException.invalidState("Iterator is busy with a pending read"));
            }
            state = State.ACTIVE;
            if (!cache.isEmpty() || engineFinished) {
                List<KeyValue> rows = take(size);
                scheduler.execute(() -> onDone.complete(mapper.apply(rows)));
                return onDone;
            }
            inflight = onDone;
        }
        Timer.Sample sample = Timer.start();
        CompletableFuture<IteratorPage> page;
        try {
            page = engineItr.nextv(pullSize);
        } catch (Throwable e) {
            page = CompletableFuture.failedFuture(e);
        }
        page.whenCompleteAsync((result, e) -> {
            List<KeyValue> rows = null;
            synchronized (this) {
                inflight = null;
                if (e == null) {
                    sample.stop(nextCallTimer);
                    engineFinished = result.finished();
                    if (state != State.CLOSED) {
                        cache.addAll(result.rows());
                        rows = take(size);
                    } else {
                        rows = result.rows().subList(0, Math.min(size, result.rows().size()));
                    }
                }
            }
            if (e != null) {
                onDone.completeExceptionally(RocksLevel.unwrap(e));
            } else {
                onDone.complete(mapper.apply(rows));
            }
        }, scheduler);
        return onDone;
    }

    // must hold the monitor
    private List<KeyValue> take(int size) {
        List<KeyValue> rows = new ArrayList<>(Math.min(size, cache.size()));
        while (rows.size() < size && !cache.isEmpty()) {
            rows.add(cache.poll());
        }
        count += rows.size();
        if (rows.isEmpty() && engineFinished) {
            state = State.EXHAUSTED;
        }
        return rows;
    }

    @Override
    public CompletableFuture<Void> close() {
        CompletableFuture<?> pending;
        synchronized (this) {
            if (state == State.CLOSED) {
                return closeFuture;
            }
            state = State.CLOSED;
            cache.clear();
            pending = inflight;
        }
        CompletableFuture<?> settled = pending == null
            ? CompletableFuture.completedFuture(null) : pending.handle((v, e) -> null);
        settled.whenCompleteAsync((v, e) -> {
            try {
                try {
                    engineItr.close();
                } finally {
                    onReleased.run();
                }
                closeFuture.complete(null);
            } catch (Throwable closeError) {
                closeFuture.completeExceptionally(closeError);
            } finally {
                tracker.detach(this);
            }
        }, scheduler);
        return closeFuture;
    }

    @Override
    public String toString() {
        return "LevelIterator{state=" + state() + ", count=" + count() + "}";
    }
}
