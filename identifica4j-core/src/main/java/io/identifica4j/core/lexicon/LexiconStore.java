/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.lexicon;

import io.identifica4j.core.api.LexiconNotLoadedException;
import io.identifica4j.core.preset.DefaultLexicons;
import java.util.Collection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The four lexicons the classifiers read. Built once, shared by every classification, never mutated,
 * so concurrent readers need no locking.
 */
public final class LexiconStore {
    private static final Logger log = LoggerFactory.getLogger(LexiconStore.class);

    public static final String EXCLUSION_TERMS = "exclusion_terms";
    public static final String INDIVIDUALIZING_VERBS = "individualizing_verbs";
    public static final String INDIVIDUALIZING_ROLES = "individualizing_roles";
    public static final String IDENTIFICATION_CONTEXTS = "identification_contexts";

    private final LexiconSet exclusionTerms;
    private final LexiconSet individualizingVerbs;
    private final LexiconSet individualizingRoles;
    private final LexiconSet identificationContexts;

    /**
     * @throws LexiconNotLoadedException if a set is missing or the exclusion set is empty
     */
    public LexiconStore(
            LexiconSet exclusionTerms,
            LexiconSet individualizingVerbs,
            LexiconSet individualizingRoles,
            LexiconSet identificationContexts) {
        this.exclusionTerms = require(exclusionTerms, EXCLUSION_TERMS);
        this.individualizingVerbs = require(individualizingVerbs, INDIVIDUALIZING_VERBS);
        this.individualizingRoles = require(individualizingRoles, INDIVIDUALIZING_ROLES);
        this.identificationContexts = require(identificationContexts, IDENTIFICATION_CONTEXTS);
        if (exclusionTerms.isEmpty()) {
            throw new LexiconNotLoadedException(EXCLUSION_TERMS + " is empty; refusing to classify without an exclusion veto");
        }
        log.debug(
                "Lexicons loaded: {}={} {}={} {}={} {}={}",
                EXCLUSION_TERMS,
                exclusionTerms.size(),
                INDIVIDUALIZING_VERBS,
                individualizingVerbs.size(),
                INDIVIDUALIZING_ROLES,
                individualizingRoles.size(),
                IDENTIFICATION_CONTEXTS,
                identificationContexts.size());
    }

    /** Built-in Brazilian Portuguese lexicons. */
    public static LexiconStore defaults() {
        return DefaultLexicons.brazilianPortuguese();
    }

    /** Returns a store whose sets are this store's phrases followed by the given ones (null = nothing to add). */
    public LexiconStore withAdditions(
            Collection<String> exclusion, Collection<String> verbs, Collection<String> roles, Collection<String> contexts) {
        return new LexiconStore(
                exclusionTerms.plus(exclusion),
                individualizingVerbs.plus(verbs),
                individualizingRoles.plus(roles),
                identificationContexts.plus(contexts));
    }

    private static LexiconSet require(LexiconSet set, String name) {
        if (set == null) throw new LexiconNotLoadedException(name + " is not loaded");
        return set;
    }

    public LexiconSet exclusionTerms() {
        return exclusionTerms;
    }

    public LexiconSet individualizingVerbs() {
        return individualizingVerbs;
    }

    public LexiconSet individualizingRoles() {
        return individualizingRoles;
    }

    public LexiconSet identificationContexts() {
        return identificationContexts;
    }
}
