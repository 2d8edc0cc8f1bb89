/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.report;

import io.identifica4j.core.api.model.DocumentResult;

public final class NoopReporter implements Reporter {
    @Override
    public void report(DocumentResult result) {
        /* no-op */
    }
}
