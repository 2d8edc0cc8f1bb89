/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.batch;

import io.identifica4j.core.api.SemanticClassifier;
import io.identifica4j.core.api.model.ClassifiedEntity;
import io.identifica4j.core.api.model.DocumentResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;

/**
 * Classifies a table of rows, one document per row, and appends the result columns.
 *
 * <p>A row that fails is logged and receives sentinel values; the rest of the batch continues. Rows may be
 * classified in parallel, but output order always equals input order.
 */
@Slf4j
public final class BatchClassifier {
    public static final String INTENT = "intent";
    public static final String CONFIDENCE = "confidence";
    public static final String ENTITY_COUNT = "entity_count";
    public static final String HAS_PERSONAL_DATA_FLAG = "has_personal_data_flag";

    public static final String ERROR_INTENT = "error";
    public static final String ERROR_VALUE = "-1";

    private final SemanticClassifier classifier;
    private final int parallelism;

    public BatchClassifier(SemanticClassifier classifier) {
        this(classifier, 1);
    }

    public BatchClassifier(SemanticClassifier classifier, int parallelism) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        if (parallelism < 1) throw new IllegalArgumentException("parallelism must be >= 1: " + parallelism);
        this.parallelism = parallelism;
    }

    public BatchResult classify(List<Map<String, String>> rows, String textColumn) {
        return classify(rows, textColumn, ProgressListener.none());
    }

    /**
     * @throws IllegalArgumentException if {@code textColumn} is not a column of the table
     */
    public BatchResult classify(List<Map<String, String>> rows, String textColumn, ProgressListener listener) {
        Objects.requireNonNull(rows, "rows");
        Objects.requireNonNull(textColumn, "textColumn");
        ProgressListener progress = listener != null ? listener : ProgressListener.none();
        if (rows.isEmpty()) return new BatchResult(List.of(), BatchSummary.empty());
        if (!rows.get(0).containsKey(textColumn)) {
            throw new IllegalArgumentException(
                    "text column '" + textColumn + "' not found; available: " + rows.get(0).keySet());
        }

        Progress counter = new Progress(rows.size(), progress);
        List<DocumentResult> results =
                parallelism == 1 || rows.size() == 1
                        ? runSequential(rows, textColumn, counter)
                        : runParallel(rows, textColumn, counter);

        List<Map<String, String>> out = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            out.add(withColumns(rows.get(i), results.get(i)));
        }
        BatchSummary summary = summarize(results);
        log.info(
                "Batch done: {} rows, {} with personal data, {} public, {} errors",
                summary.total(),
                summary.personalData(),
                summary.publicCount(),
                summary.errors());
        return new BatchResult(out, summary);
    }

    private List<DocumentResult> runSequential(List<Map<String, String>> rows, String column, Progress counter) {
        List<DocumentResult> results = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            results.add(classifyRow(i, rows.get(i), column));
            counter.advance();
        }
        return results;
    }

    private List<DocumentResult> runParallel(List<Map<String, String>> rows, String column, Progress counter) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, rows.size()));
        try {
            List<Future<DocumentResult>> futures = new ArrayList<>(rows.size());
            for (int i = 0; i < rows.size(); i++) {
                final int index = i;
                futures.add(pool.submit(() -> {
                    DocumentResult r = classifyRow(index, rows.get(index), column);
                    counter.advance();
                    return r;
                }));
            }
            List<DocumentResult> results = new ArrayList<>(rows.size());
            for (Future<DocumentResult> f : futures) {
                results.add(f.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("batch interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("batch worker failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    /** Returns null when the row could not be classified. */
    private DocumentResult classifyRow(int index, Map<String, String> row, String column) {
        try {
            String text = row.get(column);
            if (text == null) throw new IllegalArgumentException("missing value in column '" + column + "'");
            return classifier.classifyText(text);
        } catch (RuntimeException e) {
            log.warn("Row {} could not be classified: {}", index, e.toString());
            return null;
        }
    }

    private static Map<String, String> withColumns(Map<String, String> row, DocumentResult r) {
        Map<String, String> out = new LinkedHashMap<>(row);
        if (r == null) {
            out.put(INTENT, ERROR_INTENT);
            out.put(CONFIDENCE, ERROR_VALUE);
            out.put(ENTITY_COUNT, ERROR_VALUE);
            out.put(HAS_PERSONAL_DATA_FLAG, ERROR_VALUE);
        } else {
            out.put(INTENT, r.intent().code());
            out.put(CONFIDENCE, String.valueOf(r.confidence()));
            out.put(ENTITY_COUNT, String.valueOf(r.entityCount()));
            out.put(HAS_PERSONAL_DATA_FLAG, r.hasPersonalData() ? "1" : "0");
        }
        return out;
    }

    private static BatchSummary summarize(List<DocumentResult> results) {
        int personal = 0, pub = 0, errors = 0, none = 0, some = 0, max = 0;
        double confidenceSum = 0.0;
        Map<String, Integer> byExtractor = new TreeMap<>();
        for (DocumentResult r : results) {
            if (r == null) {
                errors++;
                continue;
            }
            if (r.hasPersonalData()) personal++;
            else pub++;
            confidenceSum += r.confidence();
            int n = r.entityCount();
            if (n == 0) none++;
            else some++;
            max = Math.max(max, n);
            for (ClassifiedEntity e : r.entities()) {
                byExtractor.merge(e.span().extractor(), 1, Integer::sum);
            }
        }
        int classified = personal + pub;
        double avg = classified == 0 ? 0.0 : confidenceSum / classified;
        return new BatchSummary(results.size(), personal, pub, errors, avg, none, some, max, byExtractor);
    }

    /** Serializes progress callbacks so completed counts reach the listener in increasing order. */
    private static final class Progress {
        private final int total;
        private final ProgressListener listener;
        private int completed;

        Progress(int total, ProgressListener listener) {
            this.total = total;
            this.listener = listener;
        }

        synchronized void advance() {
            completed++;
            try {
                listener.onProgress(completed, total);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed at {}/{}: {}", completed, total, e.toString());
            }
        }
    }
}
