/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.batch.training;

import io.identifica4j.batch.training.EvaluationReport.IntentMetrics;
import io.identifica4j.batch.training.EvaluationReport.Misclassification;
import io.identifica4j.core.api.SemanticClassifier;
import io.identifica4j.core.api.model.CandidateSpan;
import io.identifica4j.core.api.model.ClassifiedEntity;
import io.identifica4j.core.api.model.DocumentResult;
import io.identifica4j.core.api.model.Intent;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Scores a {@link SemanticClassifier} against labeled examples.
 *
 * <p>Examples that carry annotated PERSON entities are classified with those spans standing in for the
 * recognizer (structured identifiers are still extracted). Other examples go through the classifier's own
 * recognizer.
 */
@Slf4j
public final class Evaluator {

    public EvaluationReport evaluate(SemanticClassifier classifier, List<TrainingExample> examples) {
        Objects.requireNonNull(classifier, "classifier");
        Objects.requireNonNull(examples, "examples");

        Map<Intent, int[]> counts = new EnumMap<>(Intent.class); // total, tp, fp, fn
        for (Intent i : Intent.values()) counts.put(i, new int[4]);
        Map<String, Integer> confusion = new HashMap<>();
        for (String k : List.of(
                EvaluationReport.PUBLIC_AS_PUBLIC,
                EvaluationReport.PUBLIC_AS_PERSONAL,
                EvaluationReport.PERSONAL_AS_PUBLIC,
                EvaluationReport.PERSONAL_AS_PERSONAL)) {
            confusion.put(k, 0);
        }
        List<Misclassification> fps = new ArrayList<>();
        List<Misclassification> fns = new ArrayList<>();
        Map<String, Integer> personalReasons = new HashMap<>();
        Map<String, Integer> excludedReasons = new HashMap<>();
        int correct = 0;

        for (int n = 0; n < examples.size(); n++) {
            TrainingExample ex = examples.get(n);
            DocumentResult r = classify(classifier, ex, n);
            Intent expected = ex.intent();
            Intent predicted = r.intent();

            counts.get(expected)[0]++;
            if (expected == predicted) {
                correct++;
                counts.get(expected)[1]++;
            } else {
                counts.get(predicted)[2]++;
                counts.get(expected)[3]++;
                if (predicted == Intent.HAS_PERSONAL_DATA) {
                    if (fps.size() < EvaluationReport.MAX_SAMPLES) {
                        fps.add(sample(ex, r, firstReason(r.entities())));
                    }
                } else if (fns.size() < EvaluationReport.MAX_SAMPLES) {
                    fns.add(sample(ex, r, firstReason(r.excluded())));
                }
            }
            confusion.merge(confusionKey(expected, predicted), 1, Integer::sum);

            if (r.hasPersonalData()) {
                for (ClassifiedEntity e : r.entities()) personalReasons.merge(e.verdict().reason().code(), 1, Integer::sum);
            }
            for (ClassifiedEntity e : r.excluded()) excludedReasons.merge(e.verdict().reason().code(), 1, Integer::sum);
        }

        Map<Intent, IntentMetrics> byIntent = new EnumMap<>(Intent.class);
        counts.forEach((intent, c) -> byIntent.put(intent, new IntentMetrics(c[0], c[1], c[2], c[3])));

        int total = examples.size();
        double accuracy = total == 0 ? 0.0 : (double) correct / total;
        log.info("Evaluated {} examples: accuracy {}", total, String.format(Locale.ROOT, "%.4f", accuracy));
        return new EvaluationReport(
                total, correct, accuracy, byIntent, confusion, fps, fns, personalReasons, excludedReasons);
    }

    private static DocumentResult classify(SemanticClassifier classifier, TrainingExample ex, int index) {
        List<AnnotatedEntity> persons = ex.personEntities();
        try {
            if (persons.isEmpty()) return classifier.classifyText(ex.text(), true);
            List<CandidateSpan> spans = new ArrayList<>(classifier.extractor().extract(ex.text()));
            for (AnnotatedEntity a : persons) spans.add(a.toPersonSpan(ex.text()));
            return classifier.classify(ex.text(), spans, true);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("example " + index + ": " + e.getMessage(), e);
        }
    }

    private static String confusionKey(Intent expected, Intent predicted) {
        return side(expected) + "_as_" + side(predicted);
    }

    private static String side(Intent intent) {
        return intent == Intent.HAS_PERSONAL_DATA ? "personal" : "public";
    }

    private static String firstReason(List<ClassifiedEntity> entities) {
        return entities.isEmpty() ? null : entities.get(0).verdict().reason().code();
    }

    private static Misclassification sample(TrainingExample ex, DocumentResult r, String reason) {
        return new Misclassification(ex.text(), ex.intent(), r.intent(), r.entityCount(), reason);
    }
}
