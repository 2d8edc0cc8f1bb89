/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.batch.lexicon;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.identifica4j.core.lexicon.LexiconSet;
import io.identifica4j.core.lexicon.LexiconStore;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads lexicons from JSON:
 *
 * <pre>
 * {"exclusion_terms": [...], "individualizing_verbs": [...],
 *  "individualizing_roles": [...], "identification_contexts": [...]}
 * </pre>
 *
 * Missing keys read as empty lists; unknown keys are rejected so a misspelled key does not go unnoticed.
 */
@Slf4j
public final class LexiconFiles {
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(StreamReadFeature.AUTO_CLOSE_SOURCE)
            .build();

    private LexiconFiles() {}

    /**
     * Lexicons exactly as written in the file.
     *
     * @throws io.identifica4j.core.api.LexiconNotLoadedException if the file has no exclusion terms
     */
    public static LexiconStore load(InputStream in) throws IOException {
        LexiconDocument doc = MAPPER.readValue(in, LexiconDocument.class);
        return new LexiconStore(
                LexiconSet.of(LexiconStore.EXCLUSION_TERMS, nonNull(doc.exclusionTerms())),
                LexiconSet.of(LexiconStore.INDIVIDUALIZING_VERBS, nonNull(doc.individualizingVerbs())),
                LexiconSet.of(LexiconStore.INDIVIDUALIZING_ROLES, nonNull(doc.individualizingRoles())),
                LexiconSet.of(LexiconStore.IDENTIFICATION_CONTEXTS, nonNull(doc.identificationContexts())));
    }

    /** {@code base} with the file's phrases appended to each set. */
    public static LexiconStore extend(LexiconStore base, InputStream in) throws IOException {
        LexiconDocument doc = MAPPER.readValue(in, LexiconDocument.class);
        return base.withAdditions(
                doc.exclusionTerms(), doc.individualizingVerbs(), doc.individualizingRoles(), doc.identificationContexts());
    }

    public static LexiconStore load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            LexiconStore store = load(in);
            log.info("Loaded lexicons from {}", file);
            return store;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read lexicons " + file, e);
        }
    }

    public static LexiconStore extend(LexiconStore base, Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return extend(base, in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read lexicons " + file, e);
        }
    }

    private static List<String> nonNull(List<String> l) {
        return l == null ? List.of() : l;
    }

    record LexiconDocument(
            @JsonProperty(LexiconStore.EXCLUSION_TERMS) List<String> exclusionTerms,
            @JsonProperty(LexiconStore.INDIVIDUALIZING_VERBS) List<String> individualizingVerbs,
            @JsonProperty(LexiconStore.INDIVIDUALIZING_ROLES) List<String> individualizingRoles,
            @JsonProperty(LexiconStore.IDENTIFICATION_CONTEXTS) List<String> identificationContexts) {}
}
