/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.report;

import io.identifica4j.core.api.model.DocumentResult;

/** Receives every document result produced by the classifier (metrics, audit trails). */
public interface Reporter {
    void report(DocumentResult result);
}
