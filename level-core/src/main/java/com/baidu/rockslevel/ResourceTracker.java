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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the open children of a database so that closing the database closes them first.
 */
@Slf4j
class ResourceTracker {
    private final Set<ILevelResource> resources = ConcurrentHashMap.newKeySet();
    private boolean sweeping;

    /**
     * Register a resource. Fails with an invalid-state error once a sweep has begun.
     */
    synchronized void attach(ILevelResource resource) {
        if (sweeping) {
            throw LevelException.invalidState("Database is closing");
        }
        resources.add(resource);
    }

    void detach(ILevelResource resource) {
        resources.remove(resource);
    }

    int size() {
        return resources.size();
    }

    synchronized void reset() {
        sweeping = false;
        resources.clear();
    }

    /**
     * Close every tracked resource. Errors from a child's close are logged and never fail the sweep.
     */
    CompletableFuture<Void> closeAll() {
        List<ILevelResource> toClose;
        synchronized (this) {
            sweeping = true;
            toClose = new ArrayList<>(resources);
        }
        List<CompletableFuture<Void>> closeFutures = new ArrayList<>(toClose.size());
        for (ILevelResource resource : toClose) {
            closeFutures.add(closeQuietly(resource));
        }
        return CompletableFuture.allOf(closeFutures.toArray(CompletableFuture[]::new))
            .whenComplete((v, e) -> resources.removeAll(toClose));
    }

    private CompletableFuture<Void> closeQuietly(ILevelResource resource) {
        try {
            return resource.close().handle((v, e) -> {
                if (e != null) {
                    log.warn("Failed to close resource: {}", resource, e);
                }
                return null;
            });
        } catch (Throwable e) {
            log.warn("Failed to close resource: {}", resource, e);
            return CompletableFuture.completedFuture(null);
        }
    }
}
