/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.classify;

import io.identifica4j.core.api.model.RoleKind;

public record RoleMatch(RoleKind kind, String evidence) {}
