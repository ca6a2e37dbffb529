package com.compliance.retention.manifest;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable storage for deletion manifests.
 */
public interface ManifestRepository {

    /**
     * Persists a pending manifest in one write.
     *
     * @return the stored manifest carrying its assigned id
     */
    DeletionManifest create(DeletionManifest manifest);

    /**
     * Records the deletion outcomes and moves the manifest out of PENDING.
     *
     * @return the finalised manifest
     * @throws IllegalArgumentException if no manifest has this id
     * @throws IllegalStateException    if the manifest was already finalised
     */
    DeletionManifest finalise(String manifestId, Map<String, DeletionOutcome> results, Instant completedAt);

    Optional<DeletionManifest> findById(String manifestId);

    /**
     * Gets all manifests, oldest first.
     */
    List<DeletionManifest> findAll();
}
