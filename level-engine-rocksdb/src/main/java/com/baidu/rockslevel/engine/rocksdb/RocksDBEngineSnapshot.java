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

import com.baidu.rockslevel.engine.IEngineSnapshot;
import java.lang.ref.Cleaner;
import java.util.function.Consumer;
import org.rocksdb.RocksDB;
import org.rocksdb.Snapshot;

class RocksDBEngineSnapshot implements IEngineSnapshot {
    private record ClosableResources(Snapshot snapshot, RocksDB db) implements Runnable {
        @Override
        public void run() {
            db.releaseSnapshot(snapshot);
        }
    }

    private final Snapshot snapshot;
    private final long sequence;
    private final Cleaner.Cleanable cleanable;
    private final Consumer<Object> onClosed;

    RocksDBEngineSnapshot(RocksDB db, Consumer<Object> onClosed) {
        this.snapshot = db.getSnapshot();
        this.sequence = snapshot.getSequenceNumber();
        this.onClosed = onClosed;
        cleanable = AutoCleaner.register(this, new ClosableResources(snapshot, db));
    }

    Snapshot snapshot() {
        return snapshot;
    }

    @Override
    public long sequence() {
        return sequence;
    }

    @Override
    public void close() {
        cleanable.clean();
        onClosed.accept(this);
    }
}
