/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.detect;

import io.identifica4j.core.api.model.CandidateSpan;
import io.identifica4j.core.preset.IdentifierRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs every enabled {@link IdentifierDetector} and returns the spans ordered by (start, end).
 *
 * <p>Overlapping spans from different detectors are kept: each contributes to the document result on its
 * own, and a raw document number is personal data whatever else matched around it.</p>
 */
public final class StructuredIdentifierExtractor {
    private static final Comparator<CandidateSpan> ORDER =
            Comparator.comparingInt(CandidateSpan::start).thenComparingInt(CandidateSpan::end);

    private final List<IdentifierDetector> detectors;

    public StructuredIdentifierExtractor(List<IdentifierDetector> detectors) {
        this.detectors = List.copyOf(detectors);
    }

    /** All built-in detectors. */
    public static StructuredIdentifierExtractor defaults() {
        return new StructuredIdentifierExtractor(
                new IdentifierRegistry().build(List.copyOf(IdentifierRegistry.defaultTypes())));
    }

    public List<CandidateSpan> extract(String text) {
        if (text == null || text.isEmpty()) return List.of();
        List<CandidateSpan> all = new ArrayList<>();
        for (IdentifierDetector d : detectors) {
            all.addAll(d.detect(text));
        }
        all.sort(ORDER);
        return List.copyOf(all);
    }

    public List<IdentifierDetector> detectors() {
        return detectors;
    }
}
