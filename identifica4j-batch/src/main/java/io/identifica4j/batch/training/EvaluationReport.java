/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.batch.training;

import io.identifica4j.core.api.model.Intent;
import java.util.List;
import java.util.Map;

/**
 * Outcome of running a classifier over labeled examples.
 *
 * @param confusion counts keyed {@code <expected>_as_<predicted>}, e.g. {@code public_as_personal}
 * @param personalReasons reason codes of personal-data entities in documents predicted personal
 * @param excludedReasons reason codes of rejected PERSON entities
 */
public record EvaluationReport(
        int total,
        int correct,
        double accuracy,
        Map<Intent, IntentMetrics> byIntent,
        Map<String, Integer> confusion,
        List<Misclassification> falsePositives,
        List<Misclassification> falseNegatives,
        Map<String, Integer> personalReasons,
        Map<String, Integer> excludedReasons) {

    public static final int MAX_SAMPLES = 20;

    public static final String PUBLIC_AS_PUBLIC = "public_as_public";
    public static final String PUBLIC_AS_PERSONAL = "public_as_personal";
    public static final String PERSONAL_AS_PUBLIC = "personal_as_public";
    public static final String PERSONAL_AS_PERSONAL = "personal_as_personal";

    public EvaluationReport {
        byIntent = Map.copyOf(byIntent);
        confusion = Map.copyOf(confusion);
        falsePositives = List.copyOf(falsePositives);
        falseNegatives = List.copyOf(falseNegatives);
        personalReasons = Map.copyOf(personalReasons);
        excludedReasons = Map.copyOf(excludedReasons);
    }

    public int incorrect() {
        return total - correct;
    }

    public IntentMetrics metrics(Intent intent) {
        return byIntent.get(intent);
    }

    public record IntentMetrics(int total, int truePositives, int falsePositives, int falseNegatives) {
        public double precision() {
            int predicted = truePositives + falsePositives;
            return predicted == 0 ? 0.0 : (double) truePositives / predicted;
        }

        public double recall() {
            int actual = truePositives + falseNegatives;
            return actual == 0 ? 0.0 : (double) truePositives / actual;
        }

        public double f1() {
            double p = precision();
            double r = recall();
            return p + r == 0.0 ? 0.0 : 2 * p * r / (p + r);
        }
    }

    /**
     * @param reason first personal-data reason for a false positive, first exclusion reason for a false
     *               negative; null when there is none
     */
    public record Misclassification(String text, Intent expected, Intent predicted, int entityCount, String reason) {}
}
