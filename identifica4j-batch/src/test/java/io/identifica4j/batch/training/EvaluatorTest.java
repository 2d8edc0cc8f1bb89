/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.batch.training;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.identifica4j.batch.training.EvaluationReport.IntentMetrics;
import io.identifica4j.core.api.SemanticClassifier;
import io.identifica4j.core.api.model.Intent;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EvaluatorTest {

    private final SemanticClassifier classifier = SemanticClassifier.builder().build();
    private final Evaluator evaluator = new Evaluator();

    @Test
    void scoresLabeledExamples() throws IOException {
        List<TrainingExample> examples = TrainingDatasetsTest.load("/training/sample.json").examples();

        EvaluationReport report = evaluator.evaluate(classifier, examples);

        assertThat(report.total()).isEqualTo(6);
        assertThat(report.correct()).isEqualTo(4);
        assertThat(report.incorrect()).isEqualTo(2);
        assertThat(report.accuracy()).isCloseTo(4.0 / 6, within(1e-9));
        assertThat(report.confusion()).containsOnly(
                Map.entry(EvaluationReport.PUBLIC_AS_PUBLIC, 2),
                Map.entry(EvaluationReport.PUBLIC_AS_PERSONAL, 1),
                Map.entry(EvaluationReport.PERSONAL_AS_PUBLIC, 1),
                Map.entry(EvaluationReport.PERSONAL_AS_PERSONAL, 2));

        IntentMetrics personal = report.metrics(Intent.HAS_PERSONAL_DATA);
        assertThat(personal).isEqualTo(new IntentMetrics(3, 2, 1, 1));
        assertThat(personal.precision()).isCloseTo(2.0 / 3, within(1e-9));
        assertThat(personal.recall()).isCloseTo(2.0 / 3, within(1e-9));
        assertThat(personal.f1()).isCloseTo(2.0 / 3, within(1e-9));
    }

    @Test
    void collectsMisclassificationsAndReasons() throws IOException {
        List<TrainingExample> examples = TrainingDatasetsTest.load("/training/sample.json").examples();

        EvaluationReport report = evaluator.evaluate(classifier, examples);

        assertThat(report.falsePositives()).singleElement().satisfies(fp -> {
            assertThat(fp.text()).startsWith("Pedro Oliveira");
            assertThat(fp.reason()).isEqualTo("individualizing_role");
        });
        assertThat(report.falseNegatives()).singleElement().satisfies(fn -> {
            assertThat(fn.text()).isEqualTo("Maria Santos");
            assertThat(fn.predicted()).isEqualTo(Intent.PUBLIC);
            assertThat(fn.reason()).isEqualTo("no_individualizing_role");
        });
        assertThat(report.personalReasons()).containsOnly(
                Map.entry("individualizing_role", 2), Map.entry("documento_ou_contato", 1));
        assertThat(report.excludedReasons()).containsOnly(
                Map.entry("exclusion_context", 2), Map.entry("no_individualizing_role", 1));
    }

    @Test
    void annotatedSpansOutsideTextNameTheExample() {
        var bad = new TrainingExample(
                "Maria Santos", Intent.PUBLIC, List.of(new AnnotatedEntity(0, 40, "Maria Santos", "PESSOA", null)));

        assertThatThrownBy(() -> evaluator.evaluate(classifier, List.of(bad)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("example 0:");
    }

    @Test
    void annotationWithoutValueReadsNameFromText() {
        var ex = new TrainingExample(
                "Maria Santos solicitou cópia",
                Intent.HAS_PERSONAL_DATA,
                List.of(new AnnotatedEntity(0, 12, null, "PESSOA", null)));

        EvaluationReport report = evaluator.evaluate(classifier, List.of(ex));

        assertThat(report.correct()).isEqualTo(1);
        assertThat(report.personalReasons()).containsOnly(Map.entry("individualizing_role", 1));
        assertThat(ex.entities().get(0).toPersonSpan(ex.text()).text()).isEqualTo("Maria Santos");
    }

    @Test
    void emptyInputGivesZeroAccuracy() {
        EvaluationReport report = evaluator.evaluate(classifier, List.of());

        assertThat(report.total()).isZero();
        assertThat(report.accuracy()).isZero();
        assertThat(report.metrics(Intent.PUBLIC).precision()).isZero();
    }
}
