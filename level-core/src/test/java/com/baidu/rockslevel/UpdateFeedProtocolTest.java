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

import static com.baidu.rockslevel.TestUtil.bs;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

import com.baidu.rockslevel.engine.ChangeBatch;
import com.baidu.rockslevel.engine.ChangeEntry;
import com.baidu.rockslevel.engine.ChangeType;
import com.baidu.rockslevel.engine.IEngineUpdates;
import com.baidu.rockslevel.engine.StorageEngineException;
import com.google.common.util.concurrent.MoreExecutors;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.mockito.Mock;
import org.testng.annotations.Test;

public class UpdateFeedProtocolTest extends MockableTest {
    @Mock
    private IEngineUpdates subscription;
    private ResourceTracker tracker;
    private Timer timer;

    @Override
    protected void doSetup(Method method) {
        tracker = new ResourceTracker();
        timer = Timer.builder("test").register(new SimpleMeterRegistry());
    }

    private UpdateFeed newFeed(long since) {
        UpdateFeed feed = new UpdateFeed(since, subscription, tracker, MoreExecutors.directExecutor(), timer);
        tracker.attach(feed);
        return feed;
    }

    private static ChangeBatch batch(long sequence, int count) {
        List<ChangeEntry> entries = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            entries.add(new ChangeEntry(ChangeType.PUT, "default", bs("k" + (sequence + i)), bs("v")));
        }
        return new ChangeBatch(sequence, count, entries, null);
    }

    private static CompletableFuture<Optional<ChangeBatch>> ready(ChangeBatch batch) {
        return CompletableFuture.completedFuture(Optional.of(batch));
    }

    @Test
    public void contiguousBatches() {
        when(subscription.next()).thenReturn(ready(batch(11, 2)), ready(batch(13, 1)));
        UpdateFeed feed = newFeed(10);
        assertEquals(feed.next().join().get().sequence(), 12);
        assertEquals(feed.next().join().get().sequence(), 13);
        assertEquals(feed.sequence(), 13);
        assertEquals(timer.count(), 2);
    }

    @Test
    public void firstBatchMayStartBeforeSince() {
        when(subscription.next()).thenReturn(ready(batch(9, 3)), ready(batch(12, 1)));
        UpdateFeed feed = newFeed(10);
        Updates first = feed.next().join().get();
        assertEquals(first.sequence(), 11);
        assertEquals(first.count(), 3);
        assertEquals(feed.next().join().get().sequence(), 12);
    }

    @Test
    public void gapIsProtocolViolation() {
        when(subscription.next()).thenReturn(ready(batch(11, 1)), ready(batch(13, 1)));
        UpdateFeed feed = newFeed(10);
        feed.next().join();
        assertViolation(feed.next());
        verify(subscription).interrupt();
        verify(subscription).close();
        assertTrue(feed.next().join().isEmpty());
        assertEquals(tracker.size(), 0);
    }

    @Test
    public void firstBatchMissingSinceIsProtocolViolation() {
        when(subscription.next()).thenReturn(ready(batch(12, 1)));
        UpdateFeed feed = newFeed(10);
        assertViolation(feed.next());
        verify(subscription).close();
    }

    @Test
    public void overlappingBatchIsProtocolViolation() {
        when(subscription.next()).thenReturn(ready(batch(11, 2)), ready(batch(12, 2)));
        UpdateFeed feed = newFeed(10);
        feed.next().join();
        assertViolation(feed.next());
    }

    @Test
    public void engineErrorSurfacesVerbatim() {
        StorageEngineException error = new StorageEngineException("boom");
        when(subscription.next()).thenReturn(CompletableFuture.failedFuture(error));
        UpdateFeed feed = newFeed(10);
        try {
            feed.next().join();
            fail();
        } catch (CompletionException e) {
            assertEquals(e.getCause(), error);
        }
        verify(subscription, times(0)).close();
    }

    @Test
    public void closeWaitsForPendingReadAndIgnoresItsFailure() {
        CompletableFuture<Optional<ChangeBatch>> engineNext = new CompletableFuture<>();
        when(subscription.next()).thenReturn(engineNext);
        UpdateFeed feed = newFeed(10);
        CompletableFuture<Optional<Updates>> pending = feed.next();
        CompletableFuture<Void> closed = feed.close();
        verify(subscription).interrupt();
        assertFalse(closed.isDone());
        engineNext.completeExceptionally(new StorageEngineException("interrupted"));
        closed.join();
        assertTrue(pending.isCompletedExceptionally());
        verify(subscription).close();
        assertEquals(tracker.size(), 0);
    }

    @Test
    public void concurrentReadIsRejected() {
        when(subscription.next()).thenReturn(new CompletableFuture<>());
        UpdateFeed feed = newFeed(10);
        feed.next();
        try {
            feed.next().join();
            fail();
        } catch (CompletionException e) {
            assertTrue(e.getCause() instanceof LevelException.InvalidStateException);
        }
    }

    private static void assertViolation(CompletableFuture<Optional<Updates>> next) {
        try {
            next.join();
            fail();
        } catch (CompletionException e) {
            assertTrue(e.getCause() instanceof LevelException.ProtocolViolationException);
            assertEquals(((LevelException) e.getCause()).code, LevelException.Code.ProtocolViolation);
        }
    }
}
