/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package demo;

import io.identifica4j.batch.BatchClassifier;
import io.identifica4j.batch.BatchResult;
import io.identifica4j.batch.CsvTables;
import io.identifica4j.core.api.SemanticClassifier;
import io.identifica4j.core.api.model.ClassifiedEntity;
import io.identifica4j.core.api.model.DocumentResult;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

@RestController
@Slf4j
public class ClassifyController {

    private final SemanticClassifier classifier;
    private final BatchClassifier batch;

    public ClassifyController(SemanticClassifier classifier, BatchClassifier batch) {
        this.classifier = classifier;
        this.batch = batch;
    }

    public record ClassifyRequest(String text, Boolean verbose) {}

    @PostMapping(path = "/classify", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> classify(@RequestBody ClassifyRequest request) {
        if (request == null || request.text() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "text is required");
        }
        boolean verbose = request.verbose() != null && request.verbose();
        DocumentResult result = classifier.classifyText(request.text(), verbose);
        log.info(
                "Classified {} chars: intent={}, entities={}",
                request.text().length(),
                result.intent().code(),
                result.entityCount());
        return toJson(result);
    }

    @GetMapping("/classify")
    public Map<String, Object> classify(@RequestParam String text) {
        return toJson(classifier.classifyText(text));
    }

    /** Upload a CSV, get it back with intent, confidence, entity_count and has_personal_data_flag columns. */
    @PostMapping(path = "/classify/csv", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<byte[]> classifyCsv(
            @RequestParam("file") MultipartFile file, @RequestParam(defaultValue = "texto") String column)
            throws IOException {
        List<Map<String, String>> rows;
        try (InputStream in = file.getInputStream()) {
            rows = CsvTables.read(in);
        }
        BatchResult result;
        try {
            result = batch.classify(rows, column, (done, total) -> {
                if (done == total || done % 100 == 0) log.info("CSV progress {}/{}", done, total);
            });
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        CsvTables.write(result.rows(), out);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"classified.csv\"")
                .header("X-Personal-Data-Rows", String.valueOf(result.summary().personalData()))
                .contentType(new MediaType("text", "csv"))
                .body(out.toByteArray());
    }

    private static Map<String, Object> toJson(DocumentResult r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("intent", r.intent().code());
        m.put("confidence", r.confidence());
        m.put("entities", r.entities().stream().map(ClassifyController::entity).toList());
        if (!r.excluded().isEmpty()) {
            m.put("excluded", r.excluded().stream().map(ClassifyController::entity).toList());
        }
        return m;
    }

    private static Map<String, Object> entity(ClassifiedEntity e) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("start", e.span().start());
        m.put("end", e.span().end());
        m.put("value", e.span().text());
        m.put("type", e.span().type());
        m.put("extractor", e.span().extractor());
        m.put("reason", e.verdict().reason().code());
        if (e.verdict().roleKind() != null) m.put("role_kind", e.verdict().roleKind().code());
        if (e.verdict().evidence() != null) m.put("evidence", e.verdict().evidence());
        return m;
    }
}
