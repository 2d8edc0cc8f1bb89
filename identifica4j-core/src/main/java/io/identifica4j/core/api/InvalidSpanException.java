/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.api;

/** A candidate span is empty, negative, or does not fit inside the text it refers to. */
public class InvalidSpanException extends IllegalArgumentException {
    public InvalidSpanException(String message) {
        super(message);
    }
}
