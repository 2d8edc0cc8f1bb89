/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.spring;

import io.identifica4j.core.api.model.IdentifierType;
import io.identifica4j.core.aggregate.DocumentAggregator;
import io.identifica4j.core.context.ContextWindow.Radius;
import java.util.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.Resource;

@Getter
@ConfigurationProperties(prefix = "identifica4j")
public class Identifica4jProperties {

    @Setter
    private boolean enabled = true;

    /** Keep rejected PERSON spans, with their reason, in results. */
    @Setter
    private boolean verbose = false;

    @Setter
    private RecognizerKind recognizer = RecognizerKind.CAPITALIZED;

    private List<IdentifierType> identifiers = new ArrayList<>();

    private Window window = new Window();
    private Confidence confidence = new Confidence();
    private Lexicon lexicon = new Lexicon();
    private Batch batch = new Batch();
    private ReporterSettings reporter = new ReporterSettings();

    public enum RecognizerKind {
        CAPITALIZED,
        NONE
    }

    public List<IdentifierType> getIdentifiers() {
        return Collections.unmodifiableList(identifiers);
    }

    public void setIdentifiers(List<IdentifierType> identifiers) {
        this.identifiers = new ArrayList<>(Objects.requireNonNullElse(identifiers, List.of()));
    }

    public void setWindow(Window w) {
        this.window = (w == null) ? new Window() : w;
    }

    public void setConfidence(Confidence c) {
        this.confidence = (c == null) ? new Confidence() : c;
    }

    public void setLexicon(Lexicon l) {
        this.lexicon = (l == null) ? new Lexicon() : l;
    }

    public void setBatch(Batch b) {
        this.batch = (b == null) ? new Batch() : b;
    }

    public void setReporter(ReporterSettings r) {
        this.reporter = (r == null) ? new ReporterSettings() : r;
    }

    // ---- nested: window (characters on each side of a span) ----
    @Getter
    @Setter
    public static final class Window {
        private int exclusion = Radius.NARROW.before();
        private int role = Radius.ROLE.before();
        private int associatedData = Radius.ASSOCIATED_DATA.before();
    }

    // ---- nested: confidence ----
    public static final class Confidence {
        @Getter
        @Setter
        private double personalData = DocumentAggregator.DEFAULT_PERSONAL_DATA_CONFIDENCE;

        private double publicConfidence = DocumentAggregator.DEFAULT_PUBLIC_CONFIDENCE;

        // bound as identifica4j.confidence.public
        public double getPublic() {
            return publicConfidence;
        }

        public void setPublic(double v) {
            this.publicConfidence = v;
        }
    }

    // ---- nested: lexicon ----
    public static final class Lexicon {
        @Setter
        @Getter
        private boolean replaceDefaults = false;

        /** Optional JSON lexicon file, e.g. {@code classpath:lexicons.json}. */
        @Setter
        @Getter
        private Resource file;

        private List<String> exclusionTerms = new ArrayList<>();
        private List<String> individualizingVerbs = new ArrayList<>();
        private List<String> individualizingRoles = new ArrayList<>();
        private List<String> identificationContexts = new ArrayList<>();

        /** Extra given names for the capitalized recognizer, added to the built-in list. */
        private List<String> givenNames = new ArrayList<>();

        public List<String> getGivenNames() {
            return Collections.unmodifiableList(givenNames);
        }

        public void setGivenNames(List<String> v) {
            this.givenNames = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
        }

        public List<String> getExclusionTerms() {
            return Collections.unmodifiableList(exclusionTerms);
        }

        public void setExclusionTerms(List<String> v) {
            this.exclusionTerms = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
        }

        public List<String> getIndividualizingVerbs() {
            return Collections.unmodifiableList(individualizingVerbs);
        }

        public void setIndividualizingVerbs(List<String> v) {
            this.individualizingVerbs = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
        }

        public List<String> getIndividualizingRoles() {
            return Collections.unmodifiableList(individualizingRoles);
        }

        public void setIndividualizingRoles(List<String> v) {
            this.individualizingRoles = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
        }

        public List<String> getIdentificationContexts() {
            return Collections.unmodifiableList(identificationContexts);
        }

        public void setIdentificationContexts(List<String> v) {
            this.identificationContexts = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
        }
    }

    // ---- nested: batch ----
    @Getter
    @Setter
    public static final class Batch {
        private int parallelism = 1;
    }

    // ---- nested: reporter ----
    @Getter
    @Setter
    public static final class ReporterSettings {
        /** Size of the recent-findings ring kept for the actuator endpoint. */
        private int capacity = 200;
    }
}
