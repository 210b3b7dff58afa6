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

import com.baidu.rockslevel.engine.ChangeBatch;
import com.baidu.rockslevel.engine.IEngineUpdates;
import io.micrometer.core.instrument.Timer;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.ObservableEmitter;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;

/**
 * A gap-free stream of the batches committed after a given sequence number. Each delivered batch starts right after
 * the previous one ends, a gap fails the feed with a protocol violation and closes it.
 */
@Slf4j
public final class UpdateFeed implements ILevelResource {
    private final IEngineUpdates subscription;
    private final ResourceTracker tracker;
    private final Executor scheduler;
    private final Timer nextCallTimer;
    private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();
    private long lastSequence;
    private boolean first = true;
    private boolean closed;
    private CompletableFuture<Optional<Updates>> inflight;

    UpdateFeed(long since,
               IEngineUpdates subscription,
               ResourceTracker tracker,
               Executor scheduler,
               Timer nextCallTimer) {
        this.lastSequence = since;
        this.subscription = subscription;
        this.tracker = tracker;
        this.scheduler = scheduler;
        this.nextCallTimer = nextCallTimer;
    }

    /**
     * The sequence number of the last operation delivered, or the starting point if nothing has been delivered yet.
     */
    public synchronized long sequence() {
        return lastSequence;
    }

    /**
     * The next committed batch. Stays pending until one is committed and completes empty once the feed is closed.
     */
    public CompletableFuture<Optional<Updates>> next() {
        CompletableFuture<Optional<Updates>> onDone = new CompletableFuture<>();
        synchronized (this) {
            if (closed) {
                return CompletableFuture.completedFuture(Optional.empty());
            }
            if (inflight != null) {
                return CompletableFuture.failedFuture(
                    LevelException.invalidState("Update feed is busy with a pending read"));
            }
            inflight = onDone;
        }
        Timer.Sample sample = Timer.start();
        CompletableFuture<Optional<ChangeBatch>> engineNext;
        try {
            engineNext = subscription.next();
        } catch (Throwable e) {
            engineNext = CompletableFuture.failedFuture(e);
        }
        engineNext.whenCompleteAsync((batch, e) -> {
            Throwable failure = e == null ? null : RocksLevel.unwrap(e);
            Optional<Updates> updates = Optional.empty();
            synchronized (this) {
                inflight = null;
                if (failure == null && batch.isPresent()) {
                    ChangeBatch changes = batch.get();
                    long expected = lastSequence + 1;
                    if (!contiguous(changes, expected)) {
                        failure = LevelException.protocolViolation(expected, changes.sequence());
                    } else {
                        first = false;
                        lastSequence = changes.lastSequence();
                        updates = Optional.of(
                            new Updates(changes.entries(), lastSequence, changes.count(), changes.data()));
                        sample.stop(nextCallTimer);
                    }
                }
            }
            if (failure instanceof LevelException.ProtocolViolationException) {
                log.warn("Update feed closed on gap: {}", failure.getMessage());
                close();
            }
            if (failure != null) {
                onDone.completeExceptionally(failure);
            } else {
                onDone.complete(updates);
            }
        }, scheduler);
        return onDone;
    }

    // must hold the monitor
    private boolean contiguous(ChangeBatch changes, long expected) {
        if (first) {
            return changes.sequence() <= expected && changes.lastSequence() >= expected;
        }
        return changes.sequence() == expected;
    }

    /**
     * A cold view of the feed. Subscribing starts pulling, disposing closes the feed.
     */
    public Observable<Updates> observe() {
        return Observable.create(emitter -> {
            emitter.setCancellable(this::close);
            pull(emitter);
        });
    }

    private void pull(ObservableEmitter<Updates> emitter) {
        if (emitter.isDisposed()) {
            return;
        }
        next().whenComplete((updates, e) -> {
            if (e != null) {
                emitter.tryOnError(e);
            } else if (updates.isEmpty()) {
                emitter.onComplete();
            } else {
                emitter.onNext(updates.get());
                pull(emitter);
            }
        });
    }

    /**
     * Wake up a pending read, wait for it to settle, then release the engine subscription. A failure of the pending
     * read is logged and does not fail the close.
     */
    @Override
    public CompletableFuture<Void> close() {
        CompletableFuture<?> pending;
        synchronized (this) {
            if (closed) {
                return closeFuture;
            }
            closed = true;
            pending = inflight;
        }
        subscription.interrupt();
        CompletableFuture<?> settled = pending == null
            ? CompletableFuture.completedFuture(null)
            : pending.handle((v, e) -> {
                if (e != null) {
                    log.debug("Pending read failed while closing update feed", e);
                }
                return null;
            });
        settled.whenCompleteAsync((v, e) -> {
            try {
                subscription.close();
                closeFuture.complete(null);
            } catch (Throwable closeError) {
                closeFuture.completeExceptionally(closeError);
            } finally {
                tracker.detach(this);
            }
        }, scheduler);
        return closeFuture;
    }

    @Override
    public String toString() {
        return "UpdateFeed{sequence=" + sequence() + "}";
    }
}
