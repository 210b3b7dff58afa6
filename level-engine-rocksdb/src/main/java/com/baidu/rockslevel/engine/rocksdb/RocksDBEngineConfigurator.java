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

import static com.baidu.rockslevel.engine.rocksdb.AutoCleaner.autoRelease;
import static java.lang.Math.max;

import com.baidu.rockslevel.sysprops.props.EngineIOParallelism;
import lombok.Builder;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.rocksdb.BlockBasedTableConfig;
import org.rocksdb.BloomFilter;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.CompactionStyle;
import org.rocksdb.CompressionType;
import org.rocksdb.DBOptions;
import org.rocksdb.DataBlockIndexType;
import org.rocksdb.Env;
import org.rocksdb.IndexType;
import org.rocksdb.LRUCache;
import org.rocksdb.util.SizeUnit;

/**
 * Tunables of the RocksDB backed storage engine.
 */
@Getter
@Accessors(fluent = true)
@Builder(toBuilder = true)
public class RocksDBEngineConfigurator {
    /**
     * Archived WAL files are kept at least this long so that change feeds can replay them.
     */
    @Builder.Default
    private long walTtlSeconds = 3600;
    @Builder.Default
    private long walSizeLimitMB = 0;
    @Builder.Default
    private int maxOpenFiles = 256;
    @Builder.Default
    private int backgroundJobs = max(Runtime.getRuntime().availableProcessors() / 4, 2);
    @Builder.Default
    private long blockCacheSize = 32 * SizeUnit.MB;
    @Builder.Default
    private long writeBufferSize = 16 * SizeUnit.MB;
    @Builder.Default
    private int ioParallelism = EngineIOParallelism.INSTANCE.get();

    public DBOptions dbOptions() {
        return new DBOptions()
            .setEnv(Env.getDefault())
            .setCreateMissingColumnFamilies(true)
            .setAvoidUnnecessaryBlockingIO(true)
            .setMaxManifestFileSize(64 * SizeUnit.MB)
            // info log settings
            .setMaxLogFileSize(128 * SizeUnit.MB)
            .setKeepLogFileNum(4)
            // wal retention
            .setWalTtlSeconds(walTtlSeconds)
            .setWalSizeLimitMB(walSizeLimitMB)
            .setMaxOpenFiles(maxOpenFiles)
            .setIncreaseParallelism(backgroundJobs)
            .setMaxBackgroundJobs(backgroundJobs);
    }

    public ColumnFamilyOptions cfOptions(String name) {
        ColumnFamilyOptions targetOption = new ColumnFamilyOptions();
        targetOption
            .setTableFormatConfig(new BlockBasedTableConfig()
                .setIndexType(IndexType.kTwoLevelIndexSearch)
                .setFilterPolicy(autoRelease(new BloomFilter(16, false), targetOption))
                .setPartitionFilters(true)
                .setMetadataBlockSize(8 * SizeUnit.KB)
                .setCacheIndexAndFilterBlocks(true)
                .setPinTopLevelIndexAndFilter(true)
                .setCacheIndexAndFilterBlocksWithHighPriority(true)
                .setPinL0FilterAndIndexBlocksInCache(true)
                .setDataBlockIndexType(DataBlockIndexType.kDataBlockBinaryAndHash)
                .setDataBlockHashTableUtilRatio(0.75)
                .setBlockSize(4 * SizeUnit.KB)
                .setBlockCache(autoRelease(new LRUCache(blockCacheSize, 8), targetOption)))
            .setForceConsistencyChecks(true)
            .setCompactionStyle(CompactionStyle.LEVEL)
            .setCompressionType(CompressionType.NO_COMPRESSION)
            .setWriteBufferSize(writeBufferSize)
            .setMaxWriteBufferNumber(4)
            .setMinWriteBufferNumberToMerge(2)
            .setLevel0FileNumCompactionTrigger(4)
            .setMaxBytesForLevelBase(writeBufferSize * 2 * 4)
            .setTargetFileSizeBase(writeBufferSize * 2 * 4 / 10)
            .setLevel0SlowdownWritesTrigger(80)
            .setLevel0StopWritesTrigger(100);
        return targetOption;
    }
}
