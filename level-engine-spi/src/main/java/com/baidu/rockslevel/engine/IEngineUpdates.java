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

package com.baidu.rockslevel.engine;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A subscription to the committed write stream of the engine.
 */
public interface IEngineUpdates {
    /**
     * The next committed batch. The returned future stays pending until a batch is available, and completes empty
     * once the subscription is interrupted or closed.
     */
    CompletableFuture<Optional<ChangeBatch>> next();

    /**
     * Wake up a pending {@link #next()} with an empty result.
     */
    void interrupt();

    void close();
}
