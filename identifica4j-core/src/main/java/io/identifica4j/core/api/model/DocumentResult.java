/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.api.model;

import java.util.List;
import java.util.Objects;

/**
 * Document-level result.
 *
 * @param entities personal-data entities ordered by (start, end)
 * @param excluded non-personal PERSON entities with their reason; empty unless verbose
 */
public record DocumentResult(
        Intent intent, double confidence, List<ClassifiedEntity> entities, List<ClassifiedEntity> excluded) {

    public DocumentResult {
        Objects.requireNonNull(intent, "intent");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of [0,1]: " + confidence);
        }
        entities = List.copyOf(entities);
        excluded = excluded == null ? List.of() : List.copyOf(excluded);
    }

    public boolean hasPersonalData() {
        return intent == Intent.HAS_PERSONAL_DATA;
    }

    public int entityCount() {
        return entities.size();
    }

    public List<Finding> findings() {
        return entities.stream().map(ClassifiedEntity::toFinding).toList();
    }
}
