package org.muma.mini.kv.server;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.muma.mini.kv.store.KeyspaceStore;
import org.muma.mini.kv.store.impl.MemoryKeyspaceStore;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ExpirySweeperTest {

    private ExpirySweeper sweeper;

    @AfterEach
    void tearDown() {
        if (sweeper != null) {
            sweeper.stop();
        }
    }

    @Test
    void testRunsPeriodically() {
        KeyspaceStore store = mock(KeyspaceStore.class);
        sweeper = new ExpirySweeper(store, 20);
        sweeper.start();
        assertTrue(sweeper.isRunning());

        verify(store, timeout(2000).atLeast(3)).cleanupExpired();

        sweeper.stop();
        assertFalse(sweeper.isRunning());
    }

    @Test
    void testFailureDoesNotStopSchedule() {
        KeyspaceStore store = mock(KeyspaceStore.class);
        when(store.cleanupExpired()).thenThrow(new IllegalStateException("boom")).thenReturn(0);

        sweeper = new ExpirySweeper(store, 20);
        sweeper.start();

        verify(store, timeout(2000).atLeast(2)).cleanupExpired();
    }

    @Test
    void testSweepRemovesExpiredKeys() {
        AtomicLong now = new AtomicLong(1_000L);
        MemoryKeyspaceStore store = new MemoryKeyspaceStore(now::get);
        store.setString("a", "1", 100);
        store.setString("b", "2", 0);
        now.addAndGet(200);

        sweeper = new ExpirySweeper(store, 1000);
        sweeper.sweep();

        assertEquals(1, store.size());
    }

    @Test
    void testInvalidInterval() {
        KeyspaceStore store = mock(KeyspaceStore.class);
        assertThrows(IllegalArgumentException.class, () -> new ExpirySweeper(store, 0));
    }
}
