package com.compliance.retention.graph;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Shared helpers for the graph-backed stores: index creation, row value
 * conversion and the JSON mapper used for node payloads.
 */
public final class GraphSupport {
    private static final Logger log = LoggerFactory.getLogger(GraphSupport.class);

    private GraphSupport() {
    }

    /**
     * Creates an index if the database accepts it; an existing index is not an error.
     */
    public static void ensureIndex(GraphConnection connection, String label, String property) {
        String query = "CREATE INDEX FOR (n:" + InputSanitizer.validateIdentifier(label) + ") ON (n."
                + InputSanitizer.validateIdentifier(property) + ")";
        try {
            connection.execute(query);
        } catch (RuntimeException e) {
            log.debug("graph.index.skipped label={} property={} reason={}", label, property, e.getMessage());
        }
    }

    /**
     * Reads a numeric column from the first row, or 0 when there is no row or value.
     */
    public static long firstLong(List<Map<String, Object>> rows, String column) {
        if (rows.isEmpty()) {
            return 0;
        }
        return toLong(rows.get(0).get(column));
    }

    public static long toLong(Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s && !s.isEmpty()) {
            return Long.parseLong(s);
        }
        return 0;
    }

    /**
     * Converts an epoch-millisecond column to an instant, keeping nulls.
     */
    public static Instant toInstant(Object epochMillis) {
        if (epochMillis instanceof Number n) {
            return Instant.ofEpochMilli(n.longValue());
        }
        return null;
    }

    public static Long toEpochMillis(Instant instant) {
        return instant != null ? instant.toEpochMilli() : null;
    }

    /**
     * Creates the mapper used for manifest, report and audit payloads.
     * Timestamps are written as ISO-8601 strings; derived accessors such as
     * {@code isPending()} are written too and ignored on read.
     */
    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
