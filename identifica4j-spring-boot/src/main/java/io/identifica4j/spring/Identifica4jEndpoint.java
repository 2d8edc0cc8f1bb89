/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.spring;

import io.identifica4j.core.api.SemanticClassifier;
import io.identifica4j.core.lexicon.LexiconStore;
import io.identifica4j.core.report.Reporter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;

@Endpoint(id = "identifica4j")
public class Identifica4jEndpoint {

    private final SemanticClassifier classifier;
    private final LexiconStore lexicons;
    private final Identifica4jProperties props;
    private final Reporter reporter;

    public Identifica4jEndpoint(
            SemanticClassifier classifier, LexiconStore lexicons, Identifica4jProperties props, Reporter reporter) {
        this.classifier = classifier;
        this.lexicons = lexicons;
        this.props = props;
        this.reporter = reporter;
    }

    @ReadOperation
    public Map<String, Object> info() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("status", "OK");
        m.put("recognizer", classifier.recognizer().name());
        m.put("identifiers", classifier.extractor().detectors().stream().map(d -> d.type().name()).toList());
        m.put("verbose", props.isVerbose());
        m.put("lexicons", Map.of(
                LexiconStore.EXCLUSION_TERMS, lexicons.exclusionTerms().size(),
                LexiconStore.INDIVIDUALIZING_VERBS, lexicons.individualizingVerbs().size(),
                LexiconStore.INDIVIDUALIZING_ROLES, lexicons.individualizingRoles().size(),
                LexiconStore.IDENTIFICATION_CONTEXTS, lexicons.identificationContexts().size()));
        m.put("recentFindings", reporter instanceof MicrometerReporter mr ? mr.recentFindings() : List.of());
        return m;
    }
}
