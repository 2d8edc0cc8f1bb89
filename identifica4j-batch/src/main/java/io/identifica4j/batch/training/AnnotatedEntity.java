/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.batch.training;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.identifica4j.core.api.model.CandidateSpan;
import java.util.Locale;
import java.util.Set;

/**
 * A hand-annotated entity of a training example.
 *
 * @param entity entity tag, e.g. {@code PESSOA}, {@code CPF}
 * @param role   optional role annotation ({@code solicitante}, {@code homenageado}...)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnnotatedEntity(int start, int end, String value, String entity, String role) {
    public static final String ANNOTATION_EXTRACTOR = "annotation";

    private static final Set<String> PERSON_TAGS = Set.of("pessoa", "person", "per", "nome");

    @JsonIgnore
    public boolean isPerson() {
        return entity != null && PERSON_TAGS.contains(entity.toLowerCase(Locale.ROOT));
    }

    /**
     * PERSON candidate span for this annotation. Without a {@code value}, the surface text is read from
     * {@code source} at the annotated offsets.
     *
     * @throws io.identifica4j.core.api.InvalidSpanException if the offsets do not fit inside {@code source}
     */
    public CandidateSpan toPersonSpan(String source) {
        CandidateSpan span = CandidateSpan.person(start, end, value, ANNOTATION_EXTRACTOR);
        String covered = span.coveredText(source);
        if (value == null || value.isBlank()) {
            return CandidateSpan.person(start, end, covered, ANNOTATION_EXTRACTOR);
        }
        return span;
    }
}
