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

package com.baidu.rockslevel.metrics;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;

public class LevelOpMeters {
    public static final String CALL_TIMER = "rockslevel.op.call";

    public final Timer getCallTimer;
    public final Timer getManyCallTimer;
    public final Timer putCallTimer;
    public final Timer deleteCallTimer;
    public final Timer clearCallTimer;
    public final Timer batchCallTimer;
    public final Timer iterNextCallTimer;
    public final Timer queryCallTimer;
    public final Timer updatesNextCallTimer;
    public final Timer walCallTimer;
    private final List<Meter> meters = new ArrayList<>();

    public LevelOpMeters(String location) {
        Tags tags = Tags.of("location", location);
        getCallTimer = timer(tags.and("op", "get"));
        getManyCallTimer = timer(tags.and("op", "mget"));
        putCallTimer = timer(tags.and("op", "put"));
        deleteCallTimer = timer(tags.and("op", "del"));
        clearCallTimer = timer(tags.and("op", "clear"));
        batchCallTimer = timer(tags.and("op", "batch"));
        iterNextCallTimer = timer(tags.and("op", "next"));
        queryCallTimer = timer(tags.and("op", "query"));
        updatesNextCallTimer = timer(tags.and("op", "updates"));
        walCallTimer = timer(tags.and("op", "wal"));
    }

    private Timer timer(Tags tags) {
        Timer timer = Timer.builder(CALL_TIMER).tags(tags).register(Metrics.globalRegistry);
        meters.add(timer);
        return timer;
    }

    public void close() {
        meters.forEach(Metrics.globalRegistry::remove);
    }
}
