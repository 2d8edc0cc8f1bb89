/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.batch.training;

import io.identifica4j.core.api.model.Intent;
import java.util.List;
import java.util.Objects;

public record TrainingExample(String text, Intent intent, List<AnnotatedEntity> entities) {
    public TrainingExample {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(intent, "intent");
        entities = entities == null ? List.of() : List.copyOf(entities);
    }

    public List<AnnotatedEntity> personEntities() {
        return entities.stream().filter(AnnotatedEntity::isPerson).toList();
    }
}
