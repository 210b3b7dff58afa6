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

import com.baidu.rockslevel.engine.ChangeEntry;
import com.baidu.rockslevel.engine.ChangeType;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;
import org.rocksdb.RocksDBException;
import org.rocksdb.WriteBatch;

/**
 * Turns the operations recorded in a write batch into change entries. Transaction markers and log data carry no
 * key-value change and are skipped.
 */
class WriteBatchDecoder extends WriteBatch.Handler {
    private static final int DEFAULT_CF_ID = 0;

    private final IntFunction<String> columnName;
    private final boolean keys;
    private final boolean values;
    private final List<ChangeEntry> entries = new ArrayList<>();

    WriteBatchDecoder(IntFunction<String> columnName, boolean keys, boolean values) {
        this.columnName = columnName;
        this.keys = keys;
        this.values = values;
    }

    static List<ChangeEntry> decode(WriteBatch batch, IntFunction<String> columnName, boolean keys, boolean values)
        throws RocksDBException {
        try (WriteBatchDecoder decoder = new WriteBatchDecoder(columnName, keys, values)) {
            batch.iterate(decoder);
            return decoder.entries;
        }
    }

    private void add(ChangeType type, int columnFamilyId, byte[] key, byte[] value) {
        entries.add(new ChangeEntry(type,
            columnName.apply(columnFamilyId),
            keys ? unsafeWrap(key) : null,
            values && value != null ? unsafeWrap(value) : null));
    }

    public void put(int columnFamilyId, byte[] key, byte[] value) {
        add(ChangeType.PUT, columnFamilyId, key, value);
    }

    public void put(byte[] key, byte[] value) {
        add(ChangeType.PUT, DEFAULT_CF_ID, key, value);
    }

    public void merge(int columnFamilyId, byte[] key, byte[] value) {
        add(ChangeType.MERGE, columnFamilyId, key, value);
    }

    public void merge(byte[] key, byte[] value) {
        add(ChangeType.MERGE, DEFAULT_CF_ID, key, value);
    }

    public void delete(int columnFamilyId, byte[] key) {
        add(ChangeType.DELETE, columnFamilyId, key, null);
    }

    public void delete(byte[] key) {
        add(ChangeType.DELETE, DEFAULT_CF_ID, key, null);
    }

    public void singleDelete(int columnFamilyId, byte[] key) {
        add(ChangeType.SINGLE_DELETE, columnFamilyId, key, null);
    }

    public void singleDelete(byte[] key) {
        add(ChangeType.SINGLE_DELETE, DEFAULT_CF_ID, key, null);
    }

    // value carries the exclusive end key
    public void deleteRange(int columnFamilyId, byte[] beginKey, byte[] endKey) {
        add(ChangeType.DELETE_RANGE, columnFamilyId, beginKey, endKey);
    }

    public void deleteRange(byte[] beginKey, byte[] endKey) {
        add(ChangeType.DELETE_RANGE, DEFAULT_CF_ID, beginKey, endKey);
    }

    public void logData(byte[] blob) {
    }

    public void putBlobIndex(int columnFamilyId, byte[] key, byte[] value) {
        add(ChangeType.PUT, columnFamilyId, key, value);
    }

    public void markBeginPrepare() {
    }

    public void markEndPrepare(byte[] xid) {
    }

    public void markNoop(boolean emptyBatch) {
    }

    public void markRollback(byte[] xid) {
    }

    public void markCommit(byte[] xid) {
    }

    public void markCommitWithTimestamp(byte[] xid, byte[] ts) {
    }
}
