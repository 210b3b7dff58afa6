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

import com.baidu.rockslevel.engine.StorageEngineException;
import com.google.protobuf.ByteString;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

class RocksDBBatchWriter {
    private final RocksDB db;
    private final WriteOptions writeOptions;
    private final WriteBatch batch;

    RocksDBBatchWriter(RocksDB db, WriteOptions writeOptions) {
        this.db = db;
        this.writeOptions = writeOptions;
        this.batch = new WriteBatch();
    }

    void put(ColumnFamilyHandle cfHandle, ByteString key, ByteString value) throws RocksDBException {
        batch.put(cfHandle, key.toByteArray(), value.toByteArray());
    }

    void delete(ColumnFamilyHandle cfHandle, byte[] key) throws RocksDBException {
        batch.delete(cfHandle, key);
    }

    void deleteRange(ColumnFamilyHandle cfHandle, byte[] startKey, byte[] endKey) throws RocksDBException {
        batch.deleteRange(cfHandle, startKey, endKey);
    }

    /**
     * Commit the collected operations in one write and release the batch.
     *
     * @return true if anything was written
     */
    boolean done() {
        try {
            if (batch.count() > 0) {
                db.write(writeOptions, batch);
                return true;
            }
            return false;
        } catch (Throwable e) {
            throw new StorageEngineException("Batch write error", e);
        } finally {
            if (batch.isOwningHandle()) {
                batch.close();
            }
        }
    }

    void abort() {
        batch.clear();
        batch.close();
    }

    int count() {
        return batch.count();
    }
}
