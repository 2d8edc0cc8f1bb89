/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.classify;

import io.identifica4j.core.api.model.Reason;

/** Why a name was vetoed: the exclusion reason and the phrase or fragment that triggered it. */
public record ExclusionMatch(Reason reason, String evidence) {}
