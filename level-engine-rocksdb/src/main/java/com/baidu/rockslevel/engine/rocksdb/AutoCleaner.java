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

import java.lang.ref.Cleaner;
import lombok.extern.slf4j.Slf4j;

/**
 * The one {@link Cleaner} of the engine. Native RocksDB objects registered here are freed once their Java owner
 * becomes unreachable, or earlier when the returned {@link Cleaner.Cleanable} is cleaned.
 */
@Slf4j
class AutoCleaner {
    private static final Cleaner CLEANER = Cleaner.create();

    /**
     * Close {@code object} when {@code owner} is collected. Used for native members of option objects, which have
     * no close path of their own.
     */
    static <T extends AutoCloseable, O> T autoRelease(T object, O owner) {
        CLEANER.register(owner, new NativeRelease(object));
        return object;
    }

    /**
     * Run {@code release} once, either on {@link Cleaner.Cleanable#clean()} or when {@code owner} is collected.
     * {@code release} must not reference {@code owner}.
     */
    static Cleaner.Cleanable register(Object owner, Runnable release) {
        return CLEANER.register(owner, release);
    }

    private record NativeRelease(AutoCloseable nativeObject) implements Runnable {
        @Override
        public void run() {
            try {
                nativeObject.close();
            } catch (Exception e) {
                log.error("Failed to free native object: {}", nativeObject.getClass().getSimpleName(), e);
            }
        }
    }
}
