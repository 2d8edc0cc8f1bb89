/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.spring;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.identifica4j.core.api.model.DocumentResult;
import io.identifica4j.core.api.model.Finding;
import io.identifica4j.core.report.Reporter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/** Counts classified documents and personal-data entities, and keeps the most recent findings. */
public final class MicrometerReporter implements Reporter {
    public static final String DOCUMENTS = "identifica4j_documents_total";
    public static final String ENTITIES = "identifica4j_entities_total";

    private final MeterRegistry registry;
    private final Deque<Finding> ring = new ArrayDeque<>();
    private final int capacity;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "MeterRegistry is a framework-managed, thread-safe component; "
                    + "keeping a reference is required for metrics reporting and it is not exposed via accessors.")
    public MicrometerReporter(MeterRegistry registry, int capacity) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.capacity = Math.max(10, capacity);
    }

    @Override
    public synchronized void report(DocumentResult result) {
        if (result == null) return;
        registry.counter(DOCUMENTS, "intent", result.intent().code()).increment();
        for (Finding f : result.findings()) {
            registry.counter(ENTITIES, "type", f.type(), "reason", f.reason()).increment();
            if (ring.size() >= capacity) ring.removeFirst();
            ring.addLast(f);
        }
    }

    /** Returns an unmodifiable snapshot of the recent findings ring buffer. */
    public synchronized List<Finding> recentFindings() {
        return List.copyOf(ring);
    }

    public int capacity() {
        return capacity;
    }
}
