/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.api.model;

import java.util.Objects;

/** A span together with its verdict. */
public record ClassifiedEntity(CandidateSpan span, Verdict verdict) {
    public ClassifiedEntity {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(verdict, "verdict");
    }

    public boolean personalData() {
        return verdict.personalData();
    }

    /** PII-free view: type, reason and offsets only. */
    public Finding toFinding() {
        return new Finding(span.type(), verdict.reason().code(), span.start(), span.end());
    }
}
