/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.api.model;

import java.util.Locale;

/** Document-level outcome. */
public enum Intent {
    HAS_PERSONAL_DATA("has_personal_data", "tem_pii"),
    PUBLIC("public", "publico");

    private final String code;
    private final String legacyCode;

    Intent(String code, String legacyCode) {
        this.code = code;
        this.legacyCode = legacyCode;
    }

    public String code() {
        return code;
    }

    /** Accepts the current codes, the legacy Portuguese codes and enum names. */
    public static Intent fromCode(String raw) {
        if (raw == null) throw new IllegalArgumentException("intent is null");
        String k = raw.strip().toLowerCase(Locale.ROOT);
        for (Intent i : values()) {
            if (i.code.equals(k) || i.legacyCode.equals(k) || i.name().equalsIgnoreCase(k)) return i;
        }
        throw new IllegalArgumentException("unknown intent: " + raw);
    }
}
