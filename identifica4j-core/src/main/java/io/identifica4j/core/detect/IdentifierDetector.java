/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.detect;

import io.identifica4j.core.api.model.CandidateSpan;
import io.identifica4j.core.api.model.IdentifierType;
import java.util.List;

/** Stateless detector for one kind of self-evidently personal identifier. */
public interface IdentifierDetector {
    IdentifierType type();

    /** Never fails on well-formed text; returns an empty list for null or empty input. */
    List<CandidateSpan> detect(String text);
}
