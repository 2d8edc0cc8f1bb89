/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.api;

import io.identifica4j.core.aggregate.DocumentAggregator;
import io.identifica4j.core.api.model.CandidateSpan;
import io.identifica4j.core.api.model.ClassifiedEntity;
import io.identifica4j.core.api.model.DocumentResult;
import io.identifica4j.core.api.model.IdentifierType;
import io.identifica4j.core.classify.DecisionEngine;
import io.identifica4j.core.classify.WindowSettings;
import io.identifica4j.core.detect.StructuredIdentifierExtractor;
import io.identifica4j.core.lexicon.LexiconStore;
import io.identifica4j.core.preset.IdentifierRegistry;
import io.identifica4j.core.recognize.CapitalizedNameRecognizer;
import io.identifica4j.core.recognize.EntityRecognizer;
import io.identifica4j.core.report.NoopReporter;
import io.identifica4j.core.report.Reporter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: classifies a document into {@code has_personal_data} or {@code public}.
 *
 * <p>Holds only immutable collaborators, so one instance can serve any number of threads.</p>
 */
public final class SemanticClassifier {
    private static final Logger log = LoggerFactory.getLogger(SemanticClassifier.class);

    private final DecisionEngine engine;
    private final StructuredIdentifierExtractor extractor;
    private final EntityRecognizer recognizer;
    private final DocumentAggregator aggregator;
    private final Reporter reporter;
    private final boolean verbose;

    public SemanticClassifier(
            DecisionEngine engine,
            StructuredIdentifierExtractor extractor,
            EntityRecognizer recognizer,
            DocumentAggregator aggregator,
            Reporter reporter,
            boolean verbose) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.recognizer = Objects.requireNonNull(recognizer, "recognizer");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.verbose = verbose;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Classifies using only the supplied spans. */
    public DocumentResult classify(String text, List<CandidateSpan> spans) {
        return classify(text, spans, verbose);
    }

    /**
     * Classifies using only the supplied spans. PERSON spans covering fewer than two tokens of {@code text} are
     * ignored: a single given name never identifies anyone.
     *
     * @throws InvalidSpanException if a span does not fit inside {@code text}
     */
    public DocumentResult classify(String text, List<CandidateSpan> spans, boolean verbose) {
        Objects.requireNonNull(text, "text");
        List<ClassifiedEntity> classified = new ArrayList<>();
        if (spans != null) {
            for (CandidateSpan s : spans) {
                Objects.requireNonNull(s, "span");
                String covered = s.coveredText(text);
                if (s.isPerson() && CandidateSpan.countTokens(covered) < 2) {
                    log.trace("ignoring single-token PERSON span [{},{})", s.start(), s.end());
                    continue;
                }
                classified.add(engine.classify(text, s));
            }
        }
        DocumentResult result = aggregator.aggregate(classified, verbose);
        report(result);
        return result;
    }

    /** Runs the structured-identifier extractor and the recognizer, then {@link #classify}. */
    public DocumentResult classifyText(String text) {
        return classifyText(text, verbose);
    }

    public DocumentResult classifyText(String text, boolean verbose) {
        Objects.requireNonNull(text, "text");
        return classify(text, candidates(text), verbose);
    }

    /** Structured identifiers first, then recognizer proposals. */
    public List<CandidateSpan> candidates(String text) {
        List<CandidateSpan> spans = new ArrayList<>(extractor.extract(text));
        spans.addAll(recognizer.recognize(text));
        return spans;
    }

    public EntityRecognizer recognizer() {
        return recognizer;
    }

    public StructuredIdentifierExtractor extractor() {
        return extractor;
    }

    private void report(DocumentResult result) {
        try {
            reporter.report(result);
        } catch (RuntimeException e) {
            // reporting is best-effort; the classification itself stands
            log.warn("Reporter {} failed: {}", reporter.getClass().getSimpleName(), e.toString());
        }
    }

    public static final class Builder {
        private LexiconStore lexicons;
        private WindowSettings windows = WindowSettings.defaults();
        private List<IdentifierType> identifierTypes = List.of();
        private EntityRecognizer recognizer = new CapitalizedNameRecognizer();
        private double personalDataConfidence = DocumentAggregator.DEFAULT_PERSONAL_DATA_CONFIDENCE;
        private double publicConfidence = DocumentAggregator.DEFAULT_PUBLIC_CONFIDENCE;
        private Reporter reporter = new NoopReporter();
        private boolean verbose;

        private Builder() {}

        public Builder lexicons(LexiconStore lexicons) {
            this.lexicons = lexicons;
            return this;
        }

        public Builder windows(WindowSettings windows) {
            this.windows = Objects.requireNonNull(windows, "windows");
            return this;
        }

        /** Empty means every identifier type. */
        public Builder identifierTypes(List<IdentifierType> types) {
            this.identifierTypes = types == null ? List.of() : List.copyOf(types);
            return this;
        }

        public Builder recognizer(EntityRecognizer recognizer) {
            this.recognizer = Objects.requireNonNull(recognizer, "recognizer");
            return this;
        }

        public Builder confidence(double personalData, double publicDefault) {
            this.personalDataConfidence = personalData;
            this.publicConfidence = publicDefault;
            return this;
        }

        public Builder reporter(Reporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter");
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public SemanticClassifier build() {
            LexiconStore lex = lexicons != null ? lexicons : LexiconStore.defaults();
            return new SemanticClassifier(
                    DecisionEngine.create(lex, windows),
                    new StructuredIdentifierExtractor(new IdentifierRegistry().build(identifierTypes)),
                    recognizer,
                    new DocumentAggregator(personalDataConfidence, publicConfidence),
                    reporter,
                    verbose);
        }
    }
}
