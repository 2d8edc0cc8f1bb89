/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.batch;

/**
 * Receives batch progress. Calls are serialized and {@code completed} strictly increases from 1 to
 * {@code total}.
 */
@FunctionalInterface
public interface ProgressListener {
    void onProgress(int completed, int total);

    static ProgressListener none() {
        return (completed, total) -> {
            /* no-op */
        };
    }
}
