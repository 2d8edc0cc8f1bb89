/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.api.model;

/** A single classification occurrence (type + reason + start + end), useful for metrics. Never carries the text. */
public record Finding(String type, String reason, int start, int end) {}
