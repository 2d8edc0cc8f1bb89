/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.api.model;

/** Coarse entity labels shared by the recognizer and the structured-identifier extractor. */
public enum EntityLabel {
    PERSON,
    DOCUMENT,
    EMAIL,
    PHONE
}
