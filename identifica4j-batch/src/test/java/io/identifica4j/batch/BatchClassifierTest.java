/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.identifica4j.core.api.SemanticClassifier;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BatchClassifierTest {

    private final SemanticClassifier classifier = SemanticClassifier.builder().build();

    private static List<Map<String, String>> fixture() throws IOException {
        try (InputStream in = BatchClassifierTest.class.getResourceAsStream("/csv/requests.csv")) {
            return CsvTables.read(in);
        }
    }

    private static Map<String, String> row(String id, String text) {
        Map<String, String> r = new LinkedHashMap<>();
        r.put("id", id);
        r.put("texto", text);
        return r;
    }

    @Test
    void appendsClassificationColumns() throws IOException {
        BatchResult result = new BatchClassifier(classifier).classify(fixture(), "texto");

        assertThat(result.rows()).hasSize(4);
        assertThat(result.rows().get(0))
                .containsEntry("id", "1")
                .containsEntry(BatchClassifier.INTENT, "has_personal_data")
                .containsEntry(BatchClassifier.CONFIDENCE, "0.9")
                .containsEntry(BatchClassifier.ENTITY_COUNT, "1")
                .containsEntry(BatchClassifier.HAS_PERSONAL_DATA_FLAG, "1");
        assertThat(result.rows().get(1))
                .containsEntry(BatchClassifier.INTENT, "public")
                .containsEntry(BatchClassifier.CONFIDENCE, "0.85")
                .containsEntry(BatchClassifier.ENTITY_COUNT, "0")
                .containsEntry(BatchClassifier.HAS_PERSONAL_DATA_FLAG, "0");
        assertThat(result.rows().get(0).keySet())
                .containsExactly("id", "texto", "intent", "confidence", "entity_count", "has_personal_data_flag");
    }

    @Test
    void summarizesTheRun() throws IOException {
        BatchSummary s = new BatchClassifier(classifier).classify(fixture(), "texto").summary();

        assertThat(s.total()).isEqualTo(4);
        assertThat(s.personalData()).isEqualTo(2);
        assertThat(s.publicCount()).isEqualTo(2);
        assertThat(s.errors()).isZero();
        assertThat(s.averageConfidence()).isCloseTo(0.875, within(1e-9));
        assertThat(s.rowsWithoutEntities()).isEqualTo(2);
        assertThat(s.rowsWithEntities()).isEqualTo(2);
        assertThat(s.maxEntitiesPerRow()).isEqualTo(1);
        assertThat(s.entitiesByExtractor()).containsOnly(Map.entry("capitalized", 1), Map.entry("pattern", 1));
    }

    @Test
    void failingRowGetsSentinelsAndBatchContinues() {
        Map<String, String> broken = new HashMap<>();
        broken.put("id", "2");
        broken.put("texto", null);
        List<Map<String, String>> rows = List.of(row("1", "Maria Santos"), broken, row("3", "João Silva solicitou"));

        BatchResult result = new BatchClassifier(classifier).classify(rows, "texto");

        assertThat(result.rows().get(1))
                .containsEntry(BatchClassifier.INTENT, BatchClassifier.ERROR_INTENT)
                .containsEntry(BatchClassifier.CONFIDENCE, "-1")
                .containsEntry(BatchClassifier.ENTITY_COUNT, "-1")
                .containsEntry(BatchClassifier.HAS_PERSONAL_DATA_FLAG, "-1");
        assertThat(result.rows().get(2)).containsEntry(BatchClassifier.INTENT, "has_personal_data");
        assertThat(result.summary().errors()).isEqualTo(1);
        assertThat(result.summary().averageConfidence()).isCloseTo(0.875, within(1e-9));
    }

    @Test
    void classifierExceptionIsCapturedPerRow() {
        SemanticClassifier failing = mock(SemanticClassifier.class);
        when(failing.classifyText(anyString())).thenThrow(new IllegalStateException("boom"));

        BatchResult result = new BatchClassifier(failing).classify(List.of(row("1", "x")), "texto");

        assertThat(result.rows().get(0)).containsEntry(BatchClassifier.INTENT, "error");
        assertThat(result.summary().errors()).isEqualTo(1);
        assertThat(result.summary().averageConfidence()).isZero();
    }

    @Test
    void unknownColumnFailsFast() {
        assertThatThrownBy(() -> new BatchClassifier(classifier).classify(List.of(row("1", "x")), "text"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("text column 'text' not found");
    }

    @Test
    void emptyTableYieldsEmptySummary() {
        BatchResult result = new BatchClassifier(classifier).classify(List.of(), "texto");

        assertThat(result.rows()).isEmpty();
        assertThat(result.summary()).isEqualTo(BatchSummary.empty());
    }

    @Test
    void parallelRunKeepsOrderAndReportsMonotonicProgress() {
        List<Map<String, String>> rows = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            rows.add(i % 2 == 0 ? row(String.valueOf(i), "João Silva solicitou acesso") : row(String.valueOf(i), "Rua Maria Santos"));
        }
        List<Integer> seen = new ArrayList<>();

        BatchResult result = new BatchClassifier(classifier, 4).classify(rows, "texto", (done, total) -> {
            assertThat(total).isEqualTo(60);
            seen.add(done);
        });

        for (int i = 0; i < 60; i++) {
            assertThat(result.rows().get(i).get("id")).isEqualTo(String.valueOf(i));
            assertThat(result.rows().get(i).get(BatchClassifier.INTENT))
                    .isEqualTo(i % 2 == 0 ? "has_personal_data" : "public");
        }
        assertThat(seen).hasSize(60).isSorted().doesNotHaveDuplicates().startsWith(1).endsWith(60);
    }

    @Test
    void parallelismMustBePositive() {
        assertThatThrownBy(() -> new BatchClassifier(classifier, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
