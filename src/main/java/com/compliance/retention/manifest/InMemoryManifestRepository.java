package com.compliance.retention.manifest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory implementation of {@link ManifestRepository}. Thread-safe.
 */
public class InMemoryManifestRepository implements ManifestRepository {

    private final Map<String, DeletionManifest> manifests = new LinkedHashMap<>();

    @Override
    public synchronized DeletionManifest create(DeletionManifest manifest) {
        DeletionManifest stored = manifest.withId(UUID.randomUUID().toString());
        manifests.put(stored.manifestId(), stored);
        return stored;
    }

    @Override
    public synchronized DeletionManifest finalise(String manifestId, Map<String, DeletionOutcome> results,
                                                  Instant completedAt) {
        DeletionManifest current = manifests.get(manifestId);
        if (current == null) {
            throw new IllegalArgumentException("Unknown manifest: " + manifestId);
        }
        DeletionManifest finalised = current.finalise(results, completedAt);
        manifests.put(manifestId, finalised);
        return finalised;
    }

    @Override
    public synchronized Optional<DeletionManifest> findById(String manifestId) {
        return Optional.ofNullable(manifests.get(manifestId));
    }

    @Override
    public synchronized List<DeletionManifest> findAll() {
        return List.copyOf(new ArrayList<>(manifests.values()));
    }
}
