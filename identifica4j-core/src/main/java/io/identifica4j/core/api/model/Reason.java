/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.api.model;

/** Why a span was (or was not) judged to be personal data. Codes are stable and appear in reports. */
public enum Reason {
    EXCLUSION_CONTEXT("exclusion_context", false),
    LAW_TRIBUTE("lei_homenagem", false),
    TRIBUTE("homenagem", false),
    NAMED_REPORT("relatorio_nomeado", false),
    INDIVIDUALIZING_ROLE("individualizing_role", true),
    ASSOCIATED_DATA("associated_data", true),
    NO_INDIVIDUALIZING_ROLE("no_individualizing_role", false),
    DOCUMENT_OR_CONTACT("documento_ou_contato", true);

    private final String code;
    private final boolean personalData;

    Reason(String code, boolean personalData) {
        this.code = code;
        this.personalData = personalData;
    }

    public String code() {
        return code;
    }

    public boolean personalData() {
        return personalData;
    }

    /** True for reasons produced by the exclusion veto. */
    public boolean isExclusion() {
        return this == EXCLUSION_CONTEXT || this == LAW_TRIBUTE || this == TRIBUTE || this == NAMED_REPORT;
    }
}
