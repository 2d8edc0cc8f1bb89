/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.aggregate;

import io.identifica4j.core.api.model.ClassifiedEntity;
import io.identifica4j.core.api.model.DocumentResult;
import io.identifica4j.core.api.model.Intent;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Merges per-span verdicts into one document result.
 *
 * <p>Confidence is a fixed value per intent, not a calibrated probability: flagging requires positive
 * evidence, so {@code has_personal_data} gets the higher value and the conservative {@code public} default
 * the lower one.</p>
 */
public final class DocumentAggregator {
    public static final double DEFAULT_PERSONAL_DATA_CONFIDENCE = 0.90;
    public static final double DEFAULT_PUBLIC_CONFIDENCE = 0.85;

    private static final Comparator<ClassifiedEntity> ORDER = Comparator.comparingInt(
                    (ClassifiedEntity e) -> e.span().start())
            .thenComparingInt(e -> e.span().end());

    private final double personalDataConfidence;
    private final double publicConfidence;

    public DocumentAggregator() {
        this(DEFAULT_PERSONAL_DATA_CONFIDENCE, DEFAULT_PUBLIC_CONFIDENCE);
    }

    public DocumentAggregator(double personalDataConfidence, double publicConfidence) {
        this.personalDataConfidence = checkConfidence(personalDataConfidence);
        this.publicConfidence = checkConfidence(publicConfidence);
    }

    /**
     * @param classified every classified span of the document, in any order
     * @param verbose    when true, non-personal PERSON spans are kept in {@link DocumentResult#excluded()}
     */
    public DocumentResult aggregate(List<ClassifiedEntity> classified, boolean verbose) {
        List<ClassifiedEntity> personal = new ArrayList<>();
        List<ClassifiedEntity> excluded = new ArrayList<>();
        for (ClassifiedEntity e : classified) {
            if (e.personalData()) personal.add(e);
            else if (verbose && e.span().isPerson()) excluded.add(e);
        }
        personal.sort(ORDER);
        excluded.sort(ORDER);

        boolean hasPersonalData = !personal.isEmpty();
        return new DocumentResult(
                hasPersonalData ? Intent.HAS_PERSONAL_DATA : Intent.PUBLIC,
                hasPersonalData ? personalDataConfidence : publicConfidence,
                personal,
                excluded);
    }

    private static double checkConfidence(double c) {
        if (Double.isNaN(c) || c < 0.0 || c > 1.0) throw new IllegalArgumentException("confidence out of [0,1]: " + c);
        return c;
    }
}
