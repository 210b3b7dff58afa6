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

import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.expectThrows;

import java.util.concurrent.CompletableFuture;
import org.mockito.Mock;
import org.testng.annotations.Test;

public class ResourceTrackerTest extends MockableTest {
    @Mock
    private ILevelResource resource1;
    @Mock
    private ILevelResource resource2;

    @Test
    public void attachAndDetach() {
        ResourceTracker tracker = new ResourceTracker();
        tracker.attach(resource1);
        tracker.attach(resource1);
        tracker.attach(resource2);
        assertEquals(tracker.size(), 2);
        tracker.detach(resource1);
        tracker.detach(resource1);
        assertEquals(tracker.size(), 1);
    }

    @Test
    public void closeAllClosesEachOnce() {
        ResourceTracker tracker = new ResourceTracker();
        when(resource1.close()).thenReturn(CompletableFuture.completedFuture(null));
        when(resource2.close()).thenReturn(CompletableFuture.completedFuture(null));
        tracker.attach(resource1);
        tracker.attach(resource2);
        tracker.closeAll().join();
        verify(resource1, times(1)).close();
        verify(resource2, times(1)).close();
        assertEquals(tracker.size(), 0);
    }

    @Test
    public void closeAllIgnoresChildFailures() {
        ResourceTracker tracker = new ResourceTracker();
        when(resource1.close()).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("async")));
        when(resource2.close()).thenThrow(new IllegalStateException("sync"));
        tracker.attach(resource1);
        tracker.attach(resource2);
        tracker.closeAll().join();
        verify(resource1).close();
        verify(resource2).close();
    }

    @Test
    public void closeAllWaitsForChildren() {
        ResourceTracker tracker = new ResourceTracker();
        CompletableFuture<Void> closing = new CompletableFuture<>();
        when(resource1.close()).thenReturn(closing);
        tracker.attach(resource1);
        CompletableFuture<Void> swept = tracker.closeAll();
        assertFalse(swept.isDone());
        closing.complete(null);
        swept.join();
    }

    @Test
    public void detachFromWithinClose() {
        ResourceTracker tracker = new ResourceTracker();
        when(resource1.close()).then(invocation -> {
            tracker.detach(resource1);
            return CompletableFuture.completedFuture(null);
        });
        tracker.attach(resource1);
        tracker.closeAll().join();
        assertEquals(tracker.size(), 0);
    }

    @Test
    public void attachRejectedOnceSweeping() {
        ResourceTracker tracker = new ResourceTracker();
        tracker.closeAll().join();
        LevelException e = expectThrows(LevelException.class, () -> tracker.attach(resource1));
        assertEquals(e.code, LevelException.Code.InvalidState);
        tracker.reset();
        tracker.attach(resource1);
        assertEquals(tracker.size(), 1);
    }
}
