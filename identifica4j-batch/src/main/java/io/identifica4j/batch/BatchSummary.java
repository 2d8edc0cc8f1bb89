/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.batch;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate figures for one batch run.
 *
 * @param averageConfidence mean confidence over rows that did not fail, 0 when every row failed
 * @param entitiesByExtractor personal-data entities per extractor name ("pattern", recognizer names)
 */
public record BatchSummary(
        int total,
        int personalData,
        int publicCount,
        int errors,
        double averageConfidence,
        int rowsWithoutEntities,
        int rowsWithEntities,
        int maxEntitiesPerRow,
        Map<String, Integer> entitiesByExtractor) {

    public BatchSummary {
        entitiesByExtractor = Collections.unmodifiableMap(new TreeMap<>(entitiesByExtractor));
    }

    public static BatchSummary empty() {
        return new BatchSummary(0, 0, 0, 0, 0.0, 0, 0, 0, Map.of());
    }
}
