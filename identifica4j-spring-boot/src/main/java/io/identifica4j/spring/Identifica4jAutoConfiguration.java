/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.spring;

import io.identifica4j.batch.BatchClassifier;
import io.identifica4j.batch.lexicon.LexiconFiles;
import io.identifica4j.core.api.SemanticClassifier;
import io.identifica4j.core.classify.WindowSettings;
import io.identifica4j.core.context.ContextWindow.Radius;
import io.identifica4j.core.lexicon.LexiconSet;
import io.identifica4j.core.lexicon.LexiconStore;
import io.identifica4j.core.recognize.CapitalizedNameRecognizer;
import io.identifica4j.core.recognize.EntityRecognizer;
import io.identifica4j.core.report.NoopReporter;
import io.identifica4j.core.report.Reporter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.*;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

/**
 * Builds the classifier from YAML and provides a Reporter bean (Micrometer when a registry exists, no-op
 * otherwise), the batch driver and the actuator endpoint.
 */
@Slf4j
@AutoConfiguration(
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(Identifica4jProperties.class)
@ConditionalOnProperty(prefix = "identifica4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class Identifica4jAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public LexiconStore identifica4jLexicons(Identifica4jProperties props) {
        Identifica4jProperties.Lexicon lx = props.getLexicon();
        LexiconStore store;
        if (lx.getFile() != null) {
            store = lx.isReplaceDefaults() ? loadFile(lx.getFile(), null) : loadFile(lx.getFile(), LexiconStore.defaults());
            store = store.withAdditions(
                    lx.getExclusionTerms(),
                    lx.getIndividualizingVerbs(),
                    lx.getIndividualizingRoles(),
                    lx.getIdentificationContexts());
        } else if (lx.isReplaceDefaults()) {
            store = new LexiconStore(
                    LexiconSet.of(LexiconStore.EXCLUSION_TERMS, lx.getExclusionTerms()),
                    LexiconSet.of(LexiconStore.INDIVIDUALIZING_VERBS, lx.getIndividualizingVerbs()),
                    LexiconSet.of(LexiconStore.INDIVIDUALIZING_ROLES, lx.getIndividualizingRoles()),
                    LexiconSet.of(LexiconStore.IDENTIFICATION_CONTEXTS, lx.getIdentificationContexts()));
        } else {
            store = LexiconStore.defaults()
                    .withAdditions(
                            lx.getExclusionTerms(),
                            lx.getIndividualizingVerbs(),
                            lx.getIndividualizingRoles(),
                            lx.getIdentificationContexts());
        }
        log.info(
                "Identifica4J lexicons: {} exclusion terms, {} verbs, {} roles, {} identification contexts",
                store.exclusionTerms().size(),
                store.individualizingVerbs().size(),
                store.individualizingRoles().size(),
                store.identificationContexts().size());
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(Reporter.class)
    public Reporter identifica4jReporter() {
        return new NoopReporter();
    }

    @Bean
    @ConditionalOnMissingBean
    public SemanticClassifier identifica4jClassifier(
            Identifica4jProperties props, LexiconStore lexicons, Reporter reporter) {
        Identifica4jProperties.Window w = props.getWindow();
        return SemanticClassifier.builder()
                .lexicons(lexicons)
                .windows(new WindowSettings(
                        symmetric(w.getExclusion()), symmetric(w.getRole()), symmetric(w.getAssociatedData())))
                .identifierTypes(props.getIdentifiers())
                .recognizer(recognizer(props.getRecognizer(), props.getLexicon().getGivenNames()))
                .confidence(props.getConfidence().getPersonalData(), props.getConfidence().getPublic())
                .reporter(reporter)
                .verbose(props.isVerbose())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public BatchClassifier identifica4jBatchClassifier(Identifica4jProperties props, SemanticClassifier classifier) {
        return new BatchClassifier(classifier, props.getBatch().getParallelism());
    }

    static EntityRecognizer recognizer(Identifica4jProperties.RecognizerKind kind, List<String> givenNames) {
        if (kind == null) return CapitalizedNameRecognizer.withAdditionalNames(givenNames);
        return switch (kind) {
            case CAPITALIZED -> CapitalizedNameRecognizer.withAdditionalNames(givenNames);
            case NONE -> EntityRecognizer.none();
        };
    }

    private static Radius symmetric(int chars) {
        return new Radius(chars, chars);
    }

    private static LexiconStore loadFile(Resource file, LexiconStore base) {
        try (InputStream in = file.getInputStream()) {
            LexiconStore store = base == null ? LexiconFiles.load(in) : LexiconFiles.extend(base, in);
            log.info("Loaded lexicons from {}", file.getDescription());
            return store;
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read lexicons from " + file.getDescription(), e);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MicrometerReporterConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean(Reporter.class)
        public MicrometerReporter identifica4jMicrometerReporter(MeterRegistry registry, Identifica4jProperties props) {
            return new MicrometerReporter(registry, props.getReporter().getCapacity());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(Endpoint.class)
    static class EndpointConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public Identifica4jEndpoint identifica4jEndpoint(
                SemanticClassifier classifier,
                LexiconStore lexicons,
                Identifica4jProperties props,
                ObjectProvider<Reporter> reporter) {
            return new Identifica4jEndpoint(classifier, lexicons, props, reporter.getIfAvailable());
        }
    }
}
