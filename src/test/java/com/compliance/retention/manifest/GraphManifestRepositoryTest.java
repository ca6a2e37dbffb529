package com.compliance.retention.manifest;

import com.compliance.retention.graph.StubGraphConnection;
import com.compliance.retention.store.StoreAccessException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GraphManifestRepository using a stub GraphConnection.
 */
class GraphManifestRepositoryTest {

    private static final Instant CREATED = Instant.parse("2025-06-01T00:00:00Z");

    private StubGraphConnection connection;
    private GraphManifestRepository repository;

    @BeforeEach
    void setUp() {
        connection = new StubGraphConnection();
        repository = new GraphManifestRepository(connection);
    }

    private DeletionManifest createStored() {
        return repository.create(DeletionManifest.pending(CREATED, List.of(
                new ManifestEntry("session_data", 10, Duration.ofDays(30),
                        CREATED.minus(Duration.ofDays(90)), CREATED.minus(Duration.ofDays(31)), false))));
    }

    private String lastPayload() {
        return (String) connection.executedParams.get(connection.executedParams.size() - 1).get("payload");
    }

    @Test
    @DisplayName("create stores a pending node with a JSON payload")
    void createStoresNode() {
        DeletionManifest stored = createStored();

        assertNotNull(stored.manifestId());
        assertEquals(1, connection.queriesContaining("CREATE (m:DeletionManifest").size());
        Map<String, Object> params = connection.executedParams.get(connection.executedParams.size() - 1);
        assertEquals("PENDING", params.get("status"));
        assertTrue(lastPayload().contains("\"retentionPeriod\":\"PT720H\""));
        assertTrue(lastPayload().contains("\"createdAt\":\"2025-06-01T00:00:00Z\""));
    }

    @Test
    @DisplayName("Stored payloads read back into equal manifests")
    void payloadReadsBack() {
        DeletionManifest stored = createStored();
        connection.queryResults = List.of(Map.of("payload", lastPayload()));

        assertEquals(stored, repository.findById(stored.manifestId()).orElseThrow());
    }

    @Test
    @DisplayName("finalise updates only a pending node")
    void finaliseGuardsStatus() {
        DeletionManifest stored = createStored();
        connection.enqueue(List.of(Map.of("payload", lastPayload())))
                .enqueue(List.of(Map.of("updated", 1L)));

        DeletionManifest finalised = repository.finalise(stored.manifestId(),
                Map.of("session_data", DeletionOutcome.verified("session_data", 10, 0)), CREATED.plusSeconds(5));

        assertEquals(ManifestStatus.COMPLETED, finalised.status());
        String update = connection.queriesContaining("SET m.status").get(0);
        assertTrue(update.contains("status: 'PENDING'"));
    }

    @Test
    @DisplayName("finalise fails when the node was no longer pending")
    void finaliseLostRace() {
        DeletionManifest stored = createStored();
        connection.enqueue(List.of(Map.of("payload", lastPayload())))
                .enqueue(List.of(Map.of("updated", 0L)));

        assertThrows(IllegalStateException.class, () -> repository.finalise(stored.manifestId(), Map.of(),
                CREATED.plusSeconds(5)));
    }

    @Test
    @DisplayName("Unknown manifests cannot be finalised")
    void finaliseUnknown() {
        assertThrows(IllegalArgumentException.class,
                () -> repository.finalise("missing", Map.of(), CREATED));
    }

    @Test
    @DisplayName("Connection failures surface as StoreAccessException")
    void failuresWrapped() {
        connection.failure = new IllegalStateException("down");

        assertThrows(StoreAccessException.class, this::createStored);
        assertThrows(StoreAccessException.class, () -> repository.findAll());
    }
}
