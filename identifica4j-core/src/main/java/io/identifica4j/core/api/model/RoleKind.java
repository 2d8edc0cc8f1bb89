/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.api.model;

/** Which lexicon category tied a name to an individual. */
public enum RoleKind {
    VERB("verb"),
    ROLE_NOUN("role_noun"),
    IDENTIFICATION_CONTEXT("identification_context");

    private final String code;

    RoleKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
