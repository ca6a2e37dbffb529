package com.compliance.retention.deletion;

import com.compliance.retention.manifest.DeletionManifest;
import com.compliance.retention.manifest.DeletionOutcome;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a deletion run produced.
 *
 * @param manifest the manifest as finalised, or the still pending one when finalisation failed
 * @param outcomes outcomes keyed by category, in manifest order
 */
public record DeletionResult(DeletionManifest manifest, Map<String, DeletionOutcome> outcomes) {

    public DeletionResult {
        outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    public boolean finalised() {
        return !manifest.isPending();
    }
}
