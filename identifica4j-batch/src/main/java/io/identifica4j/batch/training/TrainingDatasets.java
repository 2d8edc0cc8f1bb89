/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.batch.training;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.identifica4j.core.api.model.Intent;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/**
 * JSON interchange for labeled examples.
 *
 * <pre>
 * {"version": "1.0", "language": "pt", "metadata": {...},
 *  "examples": [{"text": "...", "intent": "has_personal_data",
 *                "entities": [{"start": 0, "end": 12, "value": "...", "entity": "PESSOA", "role": "solicitante"}]}]}
 * </pre>
 *
 * Intents are written with their current codes; {@code tem_pii} and {@code publico} are accepted on read.
 * The older layout that nests examples under {@code data.common_examples} is read as well.
 */
@Slf4j
public final class TrainingDatasets {
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new SimpleModule("identifica4j-intent")
                    .addSerializer(Intent.class, new IntentSerializer())
                    .addDeserializer(Intent.class, new IntentDeserializer()))
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(StreamReadFeature.AUTO_CLOSE_SOURCE)
            .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
            .build();

    private TrainingDatasets() {}

    public static TrainingDataset read(InputStream in) throws IOException {
        JsonNode root = MAPPER.readTree(in);
        if (root == null || !root.isObject()) throw new IOException("training data must be a JSON object");
        if (!root.has("examples") && root.path("data").has("common_examples")) {
            log.debug("Reading legacy data.common_examples layout");
            ObjectNode copy = ((ObjectNode) root).deepCopy();
            copy.set("examples", root.path("data").path("common_examples"));
            copy.remove("data");
            root = copy;
        }
        TrainingDataset ds = MAPPER.treeToValue(root, TrainingDataset.class);
        log.debug("Loaded {} training examples (version {})", ds.examples().size(), ds.version());
        return ds;
    }

    public static void write(TrainingDataset dataset, OutputStream out) throws IOException {
        MAPPER.writeValue(out, dataset);
    }

    public static TrainingDataset read(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read training data " + file, e);
        }
    }

    public static void write(TrainingDataset dataset, Path file) {
        try (OutputStream out = Files.newOutputStream(file)) {
            write(dataset, out);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write training data " + file, e);
        }
    }

    private static final class IntentSerializer extends JsonSerializer<Intent> {
        @Override
        public void serialize(Intent value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeString(value.code());
        }
    }

    private static final class IntentDeserializer extends JsonDeserializer<Intent> {
        @Override
        public Intent deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            String raw = p.getValueAsString();
            try {
                return Intent.fromCode(raw);
            } catch (IllegalArgumentException e) {
                return (Intent) ctxt.handleWeirdStringValue(Intent.class, raw, e.getMessage());
            }
        }
    }
}
