/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.batch;

import java.util.List;
import java.util.Map;

/** Output rows, in input order, each with the classification columns appended. */
public record BatchResult(List<Map<String, String>> rows, BatchSummary summary) {
    public BatchResult {
        rows = List.copyOf(rows);
    }
}
