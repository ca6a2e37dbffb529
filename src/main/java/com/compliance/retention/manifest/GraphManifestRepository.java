package com.compliance.retention.manifest;

import com.compliance.retention.graph.GraphConnection;
import com.compliance.retention.graph.GraphSupport;
import com.compliance.retention.store.StoreAccessException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * FalkorDB-backed implementation of {@link ManifestRepository}.
 * Each manifest is a {@code :DeletionManifest} node holding its id, status,
 * creation time and the full manifest as a JSON payload.
 */
public class GraphManifestRepository implements ManifestRepository {
    private static final Logger log = LoggerFactory.getLogger(GraphManifestRepository.class);

    private final GraphConnection connection;
    private final ObjectMapper objectMapper;

    public GraphManifestRepository(GraphConnection connection) {
        this.connection = connection;
        this.objectMapper = GraphSupport.newObjectMapper();
        GraphSupport.ensureIndex(connection, "DeletionManifest", "id");
    }

    @Override
    public DeletionManifest create(DeletionManifest manifest) {
        DeletionManifest stored = manifest.withId(UUID.randomUUID().toString());
        try {
            connection.execute("""
                    CREATE (m:DeletionManifest {
                        id: $id,
                        status: $status,
                        createdAt: $createdAt,
                        payload: $payload
                    })
                    """, Map.of(
                    "id", stored.manifestId(),
                    "status", stored.status().name(),
                    "createdAt", stored.createdAt().toEpochMilli(),
                    "payload", serialize(stored)
            ));
        } catch (RuntimeException e) {
            throw new StoreAccessException("Manifest could not be stored: " + e.getMessage(), e);
        }
        log.debug("manifest.stored id={} categories={}", stored.manifestId(), stored.categories().size());
        return stored;
    }

    @Override
    public DeletionManifest finalise(String manifestId, Map<String, DeletionOutcome> results, Instant completedAt) {
        DeletionManifest current = findById(manifestId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown manifest: " + manifestId));
        DeletionManifest finalised = current.finalise(results, completedAt);
        List<Map<String, Object>> rows;
        try {
            rows = connection.query("""
                    MATCH (m:DeletionManifest {id: $id, status: 'PENDING'})
                    SET m.status = $status, m.completedAt = $completedAt, m.payload = $payload
                    RETURN count(m) as updated
                    """, Map.of(
                    "id", manifestId,
                    "status", finalised.status().name(),
                    "completedAt", completedAt.toEpochMilli(),
                    "payload", serialize(finalised)
            ));
        } catch (RuntimeException e) {
            throw new StoreAccessException("Manifest " + manifestId + " could not be finalised: " + e.getMessage(), e);
        }
        if (GraphSupport.firstLong(rows, "updated") == 0) {
            throw new IllegalStateException("Manifest " + manifestId + " was finalised concurrently");
        }
        return finalised;
    }

    @Override
    public Optional<DeletionManifest> findById(String manifestId) {
        List<Map<String, Object>> rows = query("""
                MATCH (m:DeletionManifest {id: $id})
                RETURN m.payload as payload
                """, Map.of("id", manifestId));
        return rows.isEmpty() ? Optional.empty() : Optional.of(deserialize((String) rows.get(0).get("payload")));
    }

    @Override
    public List<DeletionManifest> findAll() {
        List<Map<String, Object>> rows = query("""
                MATCH (m:DeletionManifest)
                RETURN m.payload as payload
                ORDER BY m.createdAt ASC
                """, Map.of());
        List<DeletionManifest> manifests = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            manifests.add(deserialize((String) row.get("payload")));
        }
        return manifests;
    }

    private List<Map<String, Object>> query(String query, Map<String, Object> params) {
        try {
            return connection.query(query, params);
        } catch (RuntimeException e) {
            throw new StoreAccessException("Manifest lookup failed: " + e.getMessage(), e);
        }
    }

    private String serialize(DeletionManifest manifest) {
        try {
            return objectMapper.writeValueAsString(manifest);
        } catch (JsonProcessingException e) {
            throw new StoreAccessException("Failed to serialize manifest " + manifest.manifestId(), e);
        }
    }

    private DeletionManifest deserialize(String json) {
        try {
            return objectMapper.readValue(json, DeletionManifest.class);
        } catch (JsonProcessingException e) {
            throw new StoreAccessException("Stored manifest is unreadable", e);
        }
    }
}
