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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

import com.baidu.rockslevel.engine.IEngineIterator;
import com.baidu.rockslevel.engine.IEngineSnapshot;
import com.baidu.rockslevel.engine.IStorageEngine;
import com.baidu.rockslevel.engine.IteratorPage;
import com.baidu.rockslevel.engine.OpenOptions;
import com.baidu.rockslevel.engine.RangeOptions;
import com.baidu.rockslevel.engine.ReadOptions;
import com.baidu.rockslevel.engine.StorageEngineException;
import com.baidu.rockslevel.engine.WriteOptions;
import com.google.protobuf.ByteString;
import java.lang.reflect.Method;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import lombok.SneakyThrows;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.testng.annotations.Test;

public class RocksLevelLifecycleTest extends MockableTest {
    @Mock
    private IStorageEngine engine;
    private Path dbDir;
    private RocksLevel db;

    @SneakyThrows
    @Override
    protected void doSetup(Method method) {
        dbDir = Files.createTempDirectory("rockslevel");
        db = new RocksLevel(dbDir.toString(), engine);
        when(engine.close()).thenReturn(CompletableFuture.completedFuture(null));
    }

    @Override
    protected void doTeardown(Method method) {
        TestUtil.deleteDir(dbDir.toString());
    }

    private void open() {
        when(engine.open(anyString(), any())).thenReturn(CompletableFuture.completedFuture(Set.of("default")));
        db.open().join();
    }

    @Test
    public void openFailureSurfacesEngineError() {
        StorageEngineException error = new StorageEngineException("corrupted");
        when(engine.open(anyString(), any())).thenReturn(CompletableFuture.failedFuture(error));
        try {
            db.open().join();
            fail();
        } catch (CompletionException e) {
            assertSame(e.getCause(), error);
        }
        assertEquals(db.status(), IRocksLevel.Status.CLOSED);
    }

    @Test
    public void openTwiceSharesOutcome() {
        CompletableFuture<Set<String>> engineOpened = new CompletableFuture<>();
        when(engine.open(anyString(), any())).thenReturn(engineOpened);
        CompletableFuture<Void> first = db.open();
        CompletableFuture<Void> second = db.open();
        assertSame(first, second);
        assertEquals(db.status(), IRocksLevel.Status.OPENING);
        engineOpened.complete(Set.of("default", "meta"));
        first.join();
        assertEquals(db.status(), IRocksLevel.Status.OPEN);
        assertEquals(db.columns(), Set.of("default", "meta"));
        verify(engine).open(dbDir.toString(), OpenOptions.DEFAULT);
    }

    @Test
    public void deferredOperationsRunInIssueOrder() {
        CompletableFuture<Set<String>> engineOpened = new CompletableFuture<>();
        when(engine.open(anyString(), any())).thenReturn(engineOpened);
        when(engine.get(any(), any())).thenReturn(CompletableFuture.completedFuture(Optional.of(bs("v"))));
        List<Integer> completions = new ArrayList<>();
        CompletableFuture<Void> opened = db.open();
        CompletableFuture<Void> put = db.put(bs("a"), bs("1")).thenRun(() -> completions.add(1));
        CompletableFuture<Void> delete = db.delete(bs("a")).thenRun(() -> completions.add(2));
        CompletableFuture<Optional<ByteString>> get = db.get(bs("a"));
        verify(engine, never()).put(any(), any(), any());
        engineOpened.complete(Set.of("default"));
        opened.join();
        CompletableFuture.allOf(put, delete, get).join();
        assertEquals(completions, List.of(1, 2));
        InOrder inOrder = inOrder(engine);
        inOrder.verify(engine).put(bs("a"), bs("1"), WriteOptions.DEFAULT);
        inOrder.verify(engine).delete(bs("a"), WriteOptions.DEFAULT);
        inOrder.verify(engine).get(bs("a"), ReadOptions.DEFAULT);
    }

    @Test
    public void deferredOperationsFailWhenOpenFails() {
        CompletableFuture<Set<String>> engineOpened = new CompletableFuture<>();
        when(engine.open(anyString(), any())).thenReturn(engineOpened);
        CompletableFuture<Void> opened = db.open();
        CompletableFuture<Void> put = db.put(bs("a"), bs("1"));
        engineOpened.completeExceptionally(new StorageEngineException("no space"));
        try {
            put.join();
            fail();
        } catch (CompletionException e) {
            assertTrue(e.getCause() instanceof LevelException.InvalidStateException);
        }
        assertTrue(opened.isCompletedExceptionally());
        verify(engine, never()).put(any(), any(), any());
    }

    @Test
    public void writeErrorSurfacesVerbatim() {
        open();
        StorageEngineException error = new StorageEngineException("io error");
        doThrow(error).when(engine).put(any(), any(), any());
        try {
            db.put(bs("a"), bs("1")).join();
            fail();
        } catch (CompletionException e) {
            assertSame(e.getCause(), error);
        }
    }

    @Test
    public void mutationsCompleteInIssueOrder() {
        open();
        List<Integer> completions = new ArrayList<>();
        List<CompletableFuture<Void>> writes = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            int index = i;
            writes.add(db.put(bs("k" + i), bs("v")).thenRun(() -> completions.add(index)));
        }
        CompletableFuture.allOf(writes.toArray(CompletableFuture[]::new)).join();
        for (int i = 0; i < 100; i++) {
            assertEquals((int) completions.get(i), i);
        }
    }

    @Test
    public void closeSweepsResourcesBeforeEngine() {
        open();
        IEngineIterator engineItr = mock(IEngineIterator.class);
        IEngineSnapshot engineSnapshot = mock(IEngineSnapshot.class);
        when(engine.newIterator(any(), any())).thenReturn(engineItr);
        when(engine.newSnapshot()).thenReturn(engineSnapshot);
        db.iterator(RangeOptions.ALL);
        db.snapshot();
        db.close().join();
        InOrder inOrder = inOrder(engineItr, engineSnapshot, engine);
        inOrder.verify(engineItr).close();
        inOrder.verify(engine).close();
        verify(engineSnapshot).close();
        assertEquals(db.tracker().size(), 0);
        assertEquals(db.status(), IRocksLevel.Status.CLOSED);
    }

    @Test
    public void childCloseFailureDoesNotFailClose() {
        open();
        IEngineIterator engineItr = mock(IEngineIterator.class);
        doThrow(new StorageEngineException("close failed")).when(engineItr).close();
        when(engine.newIterator(any(), any())).thenReturn(engineItr);
        db.iterator(RangeOptions.ALL);
        db.close().join();
        verify(engine).close();
        assertEquals(db.status(), IRocksLevel.Status.CLOSED);
    }

    @Test
    public void closeWaitsForChildClose() {
        open();
        CompletableFuture<Void> childClosed = new CompletableFuture<>();
        ILevelResource child = () -> childClosed;
        db.tracker().attach(child);
        CompletableFuture<Void> closed = db.close();
        assertEquals(db.status(), IRocksLevel.Status.CLOSING);
        assertSame(db.close(), closed);
        assertFalse(closed.isDone());
        verify(engine, never()).close();
        childClosed.complete(null);
        closed.join();
        verify(engine).close();
    }

    @Test
    public void resourceCreationRejectedWhileClosing() {
        open();
        CompletableFuture<Void> childClosed = new CompletableFuture<>();
        db.tracker().attach(() -> childClosed);
        db.close();
        try {
            db.iterator(RangeOptions.ALL);
            fail();
        } catch (LevelException e) {
            assertEquals(e.code, LevelException.Code.InvalidState);
        }
        childClosed.complete(null);
    }

    @Test
    public void queryAttachesTransientResource() {
        open();
        IEngineIterator engineItr = mock(IEngineIterator.class);
        CompletableFuture<IteratorPage> page = new CompletableFuture<>();
        when(engine.newIterator(any(), any())).thenReturn(engineItr);
        when(engineItr.nextv(5)).thenReturn(page);
        when(engineItr.sequence()).thenReturn(42L);
        CompletableFuture<QueryResult> result = db.query(RangeOptions.builder().limit(5).build());
        assertEquals(db.tracker().size(), 1);
        CompletableFuture<Void> closed = db.close();
        assertFalse(closed.isDone());
        page.complete(new IteratorPage(List.of(), true));
        closed.join();
        assertEquals(result.join().sequence(), 42L);
        verify(engineItr).close();
    }

    @Test
    public void queryReleasesIteratorOnFailure() {
        open();
        IEngineIterator engineItr = mock(IEngineIterator.class);
        when(engine.newIterator(any(), any())).thenReturn(engineItr);
        when(engineItr.nextv(1000)).thenReturn(CompletableFuture.failedFuture(new StorageEngineException("bad")));
        try {
            db.query(RangeOptions.ALL).join();
            fail();
        } catch (CompletionException e) {
            assertTrue(e.getCause() instanceof StorageEngineException);
        }
        verify(engineItr).close();
        assertEquals(db.tracker().size(), 0);
    }

    @Test
    public void closeBeforeOpen() {
        db.close().join();
        assertEquals(db.status(), IRocksLevel.Status.CLOSED);
        verify(engine, never()).close();
    }

    @Test
    public void openRejectsNullOptions() {
        try {
            db.open(null);
            fail();
        } catch (LevelException e) {
            assertEquals(e.code, LevelException.Code.InvalidArgument);
        }
        assertEquals(db.status(), IRocksLevel.Status.NEW);
        verify(engine, never()).open(anyString(), any());
    }

    @Test
    public void closeIssuedWhileOpeningRunsAfterDeferredOperations() {
        CompletableFuture<Set<String>> engineOpened = new CompletableFuture<>();
        when(engine.open(anyString(), any())).thenReturn(engineOpened);
        db.open();
        CompletableFuture<Void> put = db.put(bs("a"), bs("1"));
        CompletableFuture<Void> closed = db.close();
        engineOpened.complete(Set.of("default"));
        put.join();
        closed.join();
        assertEquals(db.status(), IRocksLevel.Status.CLOSED);
        InOrder inOrder = inOrder(engine);
        inOrder.verify(engine).put(bs("a"), bs("1"), WriteOptions.DEFAULT);
        inOrder.verify(engine).close();
    }

    @Test
    public void closeAgainAfterEngineCloseFailure() {
        open();
        StorageEngineException error = new StorageEngineException("boom");
        when(engine.close()).thenReturn(CompletableFuture.failedFuture(error));
        try {
            db.close().join();
            fail();
        } catch (CompletionException e) {
            assertSame(e.getCause(), error);
        }
        assertEquals(db.status(), IRocksLevel.Status.CLOSED);
        db.close().join();
        db.close().join();
        verify(engine).close();
    }

    @Test
    public void snapshotCloseWaitsForPendingRead() {
        open();
        IEngineSnapshot engineSnapshot = mock(IEngineSnapshot.class);
        CompletableFuture<Optional<ByteString>> engineRead = new CompletableFuture<>();
        when(engine.newSnapshot()).thenReturn(engineSnapshot);
        when(engine.get(any(), argThat(options -> options.snapshot() == engineSnapshot))).thenReturn(engineRead);
        LevelSnapshot snapshot = db.snapshot();
        ReadOptions pinned = ReadOptions.builder().snapshot(snapshot).build();
        CompletableFuture<Optional<ByteString>> read = db.get(bs("k"), pinned);
        assertEquals(snapshot.holders(), 1);

        CompletableFuture<Void> closed = snapshot.close();
        assertFalse(closed.isDone());
        verify(engineSnapshot, never()).close();
        try {
            db.get(bs("k"), pinned);
            fail();
        } catch (LevelException e) {
            assertEquals(e.code, LevelException.Code.InvalidState);
        }

        engineRead.complete(Optional.of(bs("old")));
        assertEquals(read.join(), Optional.of(bs("old")));
        closed.join();
        verify(engineSnapshot).close();
        assertEquals(db.tracker().size(), 0);
    }

    @Test
    public void databaseCloseWaitsForPendingSnapshotRead() {
        open();
        IEngineSnapshot engineSnapshot = mock(IEngineSnapshot.class);
        CompletableFuture<Optional<ByteString>> engineRead = new CompletableFuture<>();
        when(engine.newSnapshot()).thenReturn(engineSnapshot);
        when(engine.get(any(), any())).thenReturn(engineRead);
        LevelSnapshot snapshot = db.snapshot();
        ReadOptions pinned = ReadOptions.builder().snapshot(snapshot).build();
        CompletableFuture<Optional<ByteString>> read = db.get(bs("k"), pinned);

        CompletableFuture<Void> closed = db.close();
        assertFalse(closed.isDone());
        verify(engineSnapshot, never()).close();
        verify(engine, never()).close();

        engineRead.complete(Optional.empty());
        read.join();
        closed.join();
        InOrder inOrder = inOrder(engineSnapshot, engine);
        inOrder.verify(engineSnapshot).close();
        inOrder.verify(engine).close();
    }

    @Test
    public void snapshotHeldByCursorUntilCursorCloses() {
        open();
        IEngineSnapshot engineSnapshot = mock(IEngineSnapshot.class);
        IEngineIterator engineItr = mock(IEngineIterator.class);
        when(engine.newSnapshot()).thenReturn(engineSnapshot);
        when(engine.newIterator(any(), argThat(options -> options.snapshot() == engineSnapshot))).thenReturn(engineItr);
        LevelSnapshot snapshot = db.snapshot();
        LevelIterator itr = db.iterator(RangeOptions.ALL, ReadOptions.builder().snapshot(snapshot).build());

        CompletableFuture<Void> closed = snapshot.close();
        assertFalse(closed.isDone());
        verify(engineSnapshot, never()).close();

        itr.close().join();
        closed.join();
        InOrder inOrder = inOrder(engineItr, engineSnapshot);
        inOrder.verify(engineItr).close();
        inOrder.verify(engineSnapshot).close();
    }
}
