/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.batch.training;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;

/** Labeled examples plus descriptive metadata (source, counts, generation date...). */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrainingDataset(String version, String language, Map<String, Object> metadata, List<TrainingExample> examples) {
    public static final String DEFAULT_VERSION = "1.0";
    public static final String DEFAULT_LANGUAGE = "pt";

    public TrainingDataset {
        version = version == null ? DEFAULT_VERSION : version;
        language = language == null ? DEFAULT_LANGUAGE : language;
        examples = examples == null ? List.of() : List.copyOf(examples);
    }

    public static TrainingDataset of(List<TrainingExample> examples) {
        return new TrainingDataset(DEFAULT_VERSION, DEFAULT_LANGUAGE, null, examples);
    }
}
