package com.compliance.retention.lock;

import com.compliance.retention.graph.GraphConnection;
import com.compliance.retention.graph.GraphSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Graph-node lock for deployments where several JVMs may start a retention cycle.
 *
 * <p>A {@code :RetentionLock} node is claimed with MERGE; a node whose TTL has passed
 * is taken over by the next claimant.</p>
 */
public class GraphRetentionLock implements RetentionLock {
    private static final Logger log = LoggerFactory.getLogger(GraphRetentionLock.class);

    private final GraphConnection connection;
    private final LockConfig config;
    private final Clock clock;
    private final String ownerId;

    public GraphRetentionLock(GraphConnection connection) {
        this(connection, LockConfig.defaults(), Clock.systemUTC());
    }

    public GraphRetentionLock(GraphConnection connection, LockConfig config, Clock clock) {
        this.connection = connection;
        this.config = config;
        this.clock = clock;
        this.ownerId = ProcessHandle.current().pid() + "-" + Thread.currentThread().getId()
                + "-" + System.nanoTime();
        GraphSupport.ensureIndex(connection, "RetentionLock", "key");
    }

    @Override
    public boolean tryLock(String key) {
        for (int attempt = 0; attempt <= config.maxRetries(); attempt++) {
            if (claim(key)) {
                log.debug("lock.acquired key={} attempt={}", key, attempt + 1);
                return true;
            }
            if (attempt < config.maxRetries()) {
                try {
                    Thread.sleep(config.retryDelayMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new LockAcquisitionException("Interrupted while acquiring lock '" + key + "'", e);
                }
            }
        }
        throw new LockAcquisitionException(
                "Lock '" + key + "' held by another owner after " + (config.maxRetries() + 1) + " attempts");
    }

    @Override
    public void unlock(String key) {
        try {
            connection.execute("""
                    MATCH (l:RetentionLock {key: $key, owner: $owner})
                    DELETE l
                    """, Map.of("key", key, "owner", ownerId));
            log.debug("lock.released key={}", key);
        } catch (RuntimeException e) {
            log.warn("lock.release.failed key={} error={}", key, e.getMessage());
        }
    }

    public String ownerId() {
        return ownerId;
    }

    private boolean claim(String key) {
        long now = clock.millis();
        long expiresAt = now + config.lockTtlSeconds() * 1000L;
        String query = """
                MERGE (l:RetentionLock {key: $key})
                ON CREATE SET l.owner = $owner, l.acquiredAt = $now, l.expiresAt = $expiresAt
                ON MATCH SET l.owner = CASE WHEN l.expiresAt < $now THEN $owner ELSE l.owner END,
                    l.acquiredAt = CASE WHEN l.expiresAt < $now THEN $now ELSE l.acquiredAt END,
                    l.expiresAt = CASE WHEN l.expiresAt < $now THEN $expiresAt ELSE l.expiresAt END
                RETURN l.owner as owner
                """;
        try {
            List<Map<String, Object>> rows = connection.query(query, Map.of(
                    "key", key,
                    "owner", ownerId,
                    "now", now,
                    "expiresAt", expiresAt
            ));
            return !rows.isEmpty() && ownerId.equals(rows.get(0).get("owner"));
        } catch (RuntimeException e) {
            log.warn("lock.claim.failed key={} error={}", key, e.getMessage());
            return false;
        }
    }
}
