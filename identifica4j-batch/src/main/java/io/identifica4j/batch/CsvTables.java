/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.batch;

import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Header-based CSV tables as lists of ordered string maps (UTF-8). Streams passed in are never closed here.
 */
public final class CsvTables {
    private static final CsvMapper MAPPER = CsvMapper.builder()
            .disable(StreamReadFeature.AUTO_CLOSE_SOURCE)
            .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();

    private CsvTables() {}

    public static List<Map<String, String>> read(InputStream in) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> it =
                MAPPER.readerForMapOf(String.class).with(schema).readValues(in)) {
            return it.readAll();
        }
    }

    /** Writes rows; the header is the union of row keys in first-seen order. */
    public static void write(List<Map<String, String>> rows, OutputStream out) throws IOException {
        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
        for (String column : columns(rows)) {
            schema.addColumn(column);
        }
        try (SequenceWriter w = MAPPER.writer(schema.build()).writeValues(out)) {
            w.writeAll(rows);
        }
    }

    public static List<Map<String, String>> read(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read CSV " + file, e);
        }
    }

    public static void write(List<Map<String, String>> rows, Path file) {
        try (OutputStream out = Files.newOutputStream(file)) {
            write(rows, out);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write CSV " + file, e);
        }
    }

    static List<String> columns(List<Map<String, String>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, String> row : rows) {
            columns.addAll(row.keySet());
        }
        return new ArrayList<>(columns);
    }
}
