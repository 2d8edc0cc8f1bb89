/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.recognize;

import io.identifica4j.core.api.model.CandidateSpan;
import java.util.List;

/**
 * Proposes PERSON candidate spans. A model-backed implementation plugs in here; the choice between
 * implementations is made when the classifier is composed.
 */
public interface EntityRecognizer {
    String name();

    List<CandidateSpan> recognize(String text);

    /** Null object: never proposes anything. */
    static EntityRecognizer none() {
        return NoopEntityRecognizer.INSTANCE;
    }
}
