/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.batch;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvTablesTest {

    @Test
    void readsHeaderBasedRowsInColumnOrder() throws IOException {
        String csv = "id,texto\n1,\"Rua Carlos Alberto, 100\"\n2,Ação civil\n";

        List<Map<String, String>> rows = CsvTables.read(new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8)));

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).keySet()).containsExactly("id", "texto");
        assertThat(rows.get(0)).containsEntry("texto", "Rua Carlos Alberto, 100");
        assertThat(rows.get(1)).containsEntry("texto", "Ação civil");
    }

    @Test
    void writesUnionOfColumnsAndQuotesWhenNeeded() throws IOException {
        Map<String, String> first = new LinkedHashMap<>();
        first.put("id", "1");
        first.put("texto", "Rua Carlos Alberto, 100");
        Map<String, String> second = new LinkedHashMap<>();
        second.put("id", "2");
        second.put("intent", "public");
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        CsvTables.write(List.of(first, second), out);

        String[] lines = out.toString(StandardCharsets.UTF_8).split("\\R");
        assertThat(lines[0]).isEqualTo("id,texto,intent");
        assertThat(lines[1]).isEqualTo("1,\"Rua Carlos Alberto, 100\",");
        assertThat(lines[2]).isEqualTo("2,,public");
    }

    @Test
    void pathVariantsRoundTripThroughFiles(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("out.csv");
        Map<String, String> row = new LinkedHashMap<>();
        row.put("texto", "João Silva solicitou");
        row.put("intent", "has_personal_data");

        CsvTables.write(List.of(row), file);

        assertThat(Files.readString(file, StandardCharsets.UTF_8)).startsWith("texto,intent");
        assertThat(CsvTables.read(file)).containsExactly(row);
    }
}
