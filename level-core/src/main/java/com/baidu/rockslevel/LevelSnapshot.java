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

import com.baidu.rockslevel.engine.IEngineSnapshot;
import com.baidu.rockslevel.engine.ISnapshotPin;
import java.util.concurrent.CompletableFuture;

/**
 * Pins the state of the database at {@link #sequence()}. Reads given this snapshot through
 * {@link com.baidu.rockslevel.engine.ReadOptions} ignore later writes.
 *
 * <p>Every read or cursor using the snapshot holds it until done; closing waits for them before the engine
 * snapshot is released.
 */
public final class LevelSnapshot implements ILevelResource, ISnapshotPin {
    private final RocksLevel owner;
    private final IEngineSnapshot delegate;
    private final ResourceTracker tracker;
    private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();
    // guarded by this
    private boolean closed;
    private int holders;

    LevelSnapshot(RocksLevel owner, IEngineSnapshot delegate, ResourceTracker tracker) {
        this.owner = owner;
        this.delegate = delegate;
        this.tracker = tracker;
    }

    @Override
    public long sequence() {
        return delegate.sequence();
    }

    /**
     * Hold the engine snapshot for one read. Each call must be paired with {@link #release()}.
     */
    synchronized IEngineSnapshot acquire(RocksLevel db) {
        if (db != owner) {
            throw LevelException.invalidArgument("Snapshot belongs to another database");
        }
        if (closed) {
            throw LevelException.invalidState("Snapshot has been closed");
        }
        holders++;
        return delegate;
    }

    void release() {
        boolean drained;
        synchronized (this) {
            holders--;
            drained = closed && holders == 0;
        }
        if (drained) {
            releaseEngineSnapshot();
        }
    }

    @Override
    public CompletableFuture<Void> close() {
        boolean drained;
        synchronized (this) {
            if (closed) {
                return closeFuture;
            }
            closed = true;
            drained = holders == 0;
        }
        if (drained) {
            releaseEngineSnapshot();
        }
        return closeFuture;
    }

    synchronized int holders() {
        return holders;
    }

    private void releaseEngineSnapshot() {
        try {
            delegate.close();
            closeFuture.complete(null);
        } catch (Throwable e) {
            closeFuture.completeExceptionally(e);
        } finally {
            tracker.detach(this);
        }
    }

    @Override
    public String toString() {
        return "LevelSnapshot{sequence=" + delegate.sequence() + "}";
    }
}
