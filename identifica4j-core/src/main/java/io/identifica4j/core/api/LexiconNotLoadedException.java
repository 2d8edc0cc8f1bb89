/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.api;

/**
 * Lexicons are missing or unusable. Raised at construction time: an empty exclusion set would
 * silently turn the exclusion veto into a no-op.
 */
public class LexiconNotLoadedException extends IllegalStateException {
    public LexiconNotLoadedException(String message) {
        super(message);
    }
}
