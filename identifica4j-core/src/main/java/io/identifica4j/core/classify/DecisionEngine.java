/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.classify;

import io.identifica4j.core.api.InvalidSpanException;
import io.identifica4j.core.api.model.CandidateSpan;
import io.identifica4j.core.api.model.ClassifiedEntity;
import io.identifica4j.core.api.model.Verdict;
import io.identifica4j.core.lexicon.LexiconStore;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a span identifies a natural person.
 *
 * <ol>
 *   <li>Structured identifiers (document, e-mail, phone) are personal data, unconditionally.</li>
 *   <li>PERSON spans: an exclusion context vetoes everything else.</li>
 *   <li>An individualizing role makes the name personal data.</li>
 *   <li>Otherwise, associated document or contact data makes it personal data.</li>
 *   <li>Otherwise the bare name is public.</li>
 * </ol>
 */
public final class DecisionEngine {
    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    private final ExclusionClassifier exclusion;
    private final RoleClassifier role;
    private final AssociatedDataClassifier associatedData;

    public DecisionEngine(ExclusionClassifier exclusion, RoleClassifier role, AssociatedDataClassifier associatedData) {
        this.exclusion = Objects.requireNonNull(exclusion, "exclusion");
        this.role = Objects.requireNonNull(role, "role");
        this.associatedData = Objects.requireNonNull(associatedData, "associatedData");
    }

    public static DecisionEngine create(LexiconStore lexicons, WindowSettings windows) {
        return new DecisionEngine(
                new ExclusionClassifier(lexicons, windows.exclusion()),
                new RoleClassifier(lexicons, windows.role()),
                new AssociatedDataClassifier(windows.associatedData()));
    }

    /**
     * @throws InvalidSpanException if the span does not fit inside {@code text}
     */
    public Verdict decide(String text, CandidateSpan span) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(span, "span");
        span.coveredText(text);

        Verdict v = span.isPerson() ? decidePerson(text, span) : Verdict.structuredIdentifier(span.type());
        if (log.isDebugEnabled()) {
            log.debug(
                    "span [{},{}) type={} -> personal={} reason={}",
                    span.start(),
                    span.end(),
                    span.type(),
                    v.personalData(),
                    v.reason().code());
        }
        return v;
    }

    public ClassifiedEntity classify(String text, CandidateSpan span) {
        return new ClassifiedEntity(span, decide(text, span));
    }

    private Verdict decidePerson(String text, CandidateSpan span) {
        Optional<ExclusionMatch> ex = exclusion.test(text, span.start(), span.end());
        if (ex.isPresent()) return Verdict.excluded(ex.get().reason(), ex.get().evidence());

        Optional<RoleMatch> r = role.test(text, span.start(), span.end());
        if (r.isPresent()) return Verdict.role(r.get().kind(), r.get().evidence());

        if (associatedData.test(text, span.start(), span.end())) {
            return Verdict.associatedData(AssociatedDataClassifier.EVIDENCE);
        }
        return Verdict.noRole();
    }
}
