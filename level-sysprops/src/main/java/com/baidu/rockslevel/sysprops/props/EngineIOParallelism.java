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

package com.baidu.rockslevel.sysprops.props;

import com.baidu.rockslevel.sysprops.LevelSysProp;
import com.baidu.rockslevel.sysprops.parser.IntegerParser;

/**
 * The number of threads the storage engine uses to serve asynchronous reads and change feeds.
 */
public final class EngineIOParallelism extends LevelSysProp<Integer, IntegerParser> {
    public static final EngineIOParallelism INSTANCE = new EngineIOParallelism();

    private EngineIOParallelism() {
        super("rockslevel_engine_io_threads",
            Math.max(2, Runtime.getRuntime().availableProcessors() / 2), IntegerParser.between(1, 1024));
    }
}
