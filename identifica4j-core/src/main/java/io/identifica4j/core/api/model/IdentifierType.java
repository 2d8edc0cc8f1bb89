/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.api.model;

/** Structured identifier kinds users can enable or disable in configuration. */
public enum IdentifierType {
    CPF(EntityLabel.DOCUMENT), // 000.000.000-00
    RG(EntityLabel.DOCUMENT), // 00.000.000-0 or 9 contiguous digits
    VOTER_ID(EntityLabel.DOCUMENT), // 12 digits, titulo de eleitor
    PASSPORT(EntityLabel.DOCUMENT), // AB123456
    SPELLED_DIGITS(EntityLabel.DOCUMENT), // "um dois tres quatro cinco seis"
    EMAIL(EntityLabel.EMAIL),
    PHONE(EntityLabel.PHONE);

    private final EntityLabel label;

    IdentifierType(EntityLabel label) {
        this.label = label;
    }

    public EntityLabel label() {
        return label;
    }
}
