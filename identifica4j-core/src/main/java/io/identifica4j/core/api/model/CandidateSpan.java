/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.api.model;

import io.identifica4j.core.api.InvalidSpanException;
import java.util.Objects;

/**
 * A candidate entity occurrence, indices [start,end) into the source text.
 *
 * @param text      surface text of the span
 * @param label     coarse label
 * @param type      finer tag, e.g. {@code CPF} or {@code PESSOA}
 * @param extractor who proposed the span ({@value #PATTERN_EXTRACTOR} or a recognizer name)
 */
public record CandidateSpan(int start, int end, String text, EntityLabel label, String type, String extractor) {

    public static final String PATTERN_EXTRACTOR = "pattern";
    public static final String PERSON_TYPE = "PESSOA";

    public CandidateSpan {
        if (start < 0 || start >= end) {
            throw new InvalidSpanException("span [" + start + "," + end + ") is empty or negative");
        }
        Objects.requireNonNull(label, "label");
        text = Objects.requireNonNullElse(text, "");
        type = (type == null || type.isBlank()) ? label.name() : type;
        extractor = (extractor == null || extractor.isBlank()) ? "unknown" : extractor;
    }

    public static CandidateSpan person(int start, int end, String text, String extractor) {
        return new CandidateSpan(start, end, text, EntityLabel.PERSON, PERSON_TYPE, extractor);
    }

    public static CandidateSpan identifier(int start, int end, String text, IdentifierType type) {
        return new CandidateSpan(start, end, text, type.label(), type.name(), PATTERN_EXTRACTOR);
    }

    public boolean isPerson() {
        return label == EntityLabel.PERSON;
    }

    /**
     * The slice of {@code source} this span covers.
     *
     * @throws InvalidSpanException if the span runs past the end of {@code source}
     */
    public String coveredText(String source) {
        if (end > source.length()) {
            throw new InvalidSpanException(
                    "span [" + start + "," + end + ") exceeds text length " + source.length());
        }
        return source.substring(start, end);
    }

    /** Number of whitespace-separated tokens in {@code s}. */
    public static int countTokens(String s) {
        String t = s == null ? "" : s.strip();
        return t.isEmpty() ? 0 : t.split("\\s+").length;
    }
}
