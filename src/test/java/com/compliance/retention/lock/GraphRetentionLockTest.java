package com.compliance.retention.lock;

import com.compliance.retention.graph.StubGraphConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraphRetentionLockTest {

    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");

    private StubGraphConnection connection;
    private GraphRetentionLock lock;

    @BeforeEach
    void setUp() {
        connection = new StubGraphConnection();
        lock = new GraphRetentionLock(connection, new LockConfig(1000, 2, 1, 60),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void tryLock_succeedsWhenNodeOwnedByCaller() {
        connection.queryResults = List.of(Map.of("owner", lock.ownerId()));

        assertTrue(lock.tryLock(RetentionLock.RUN_KEY));

        Map<String, Object> params = connection.executedParams.get(connection.executedParams.size() - 1);
        assertEquals(RetentionLock.RUN_KEY, params.get("key"));
        assertEquals(NOW.toEpochMilli(), params.get("now"));
        assertEquals(NOW.toEpochMilli() + 60_000L, params.get("expiresAt"));
    }

    @Test
    void tryLock_retriesThenFailsWhenHeldByOther() {
        connection.queryResults = List.of(Map.of("owner", "someone-else"));

        assertThrows(LockAcquisitionException.class, () -> lock.tryLock(RetentionLock.RUN_KEY));
        assertEquals(3, connection.queriesContaining("MERGE (l:RetentionLock").size());
    }

    @Test
    void tryLock_succeedsOnRetry() {
        connection.enqueue(List.of(Map.of("owner", "someone-else")))
                .enqueue(List.of(Map.of("owner", lock.ownerId())));

        assertTrue(lock.tryLock(RetentionLock.RUN_KEY));
        assertEquals(2, connection.queriesContaining("MERGE (l:RetentionLock").size());
    }

    @Test
    void tryLock_treatsQueryFailureAsNotAcquired() {
        connection.failure = new RuntimeException("connection reset");

        assertThrows(LockAcquisitionException.class, () -> lock.tryLock(RetentionLock.RUN_KEY));
    }

    @Test
    void unlock_deletesOnlyOwnNode() {
        lock.unlock(RetentionLock.RUN_KEY);

        assertEquals(1, connection.queriesContaining("DELETE l").size());
        Map<String, Object> params = connection.executedParams.get(connection.executedParams.size() - 1);
        assertEquals(lock.ownerId(), params.get("owner"));
    }

    @Test
    void unlock_swallowsConnectionFailure() {
        connection.failure = new RuntimeException("connection reset");

        assertDoesNotThrow(() -> lock.unlock(RetentionLock.RUN_KEY));
    }

    @Test
    void constructor_createsKeyIndex() {
        assertEquals(1, connection.queriesContaining("CREATE INDEX FOR (n:RetentionLock)").size());
    }
}
