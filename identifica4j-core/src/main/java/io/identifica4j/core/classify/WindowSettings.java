/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.classify;

import io.identifica4j.core.context.ContextWindow.Radius;
import java.util.Objects;

/**
 * Context radii used by the classifiers.
 *
 * @param exclusion      narrow: naming cues ("Rua", "Hospital") must sit right next to the name
 * @param role           wide: individualizing cues may be a full clause away
 * @param associatedData wide: document numbers and contact data near the name
 */
public record WindowSettings(Radius exclusion, Radius role, Radius associatedData) {
    public WindowSettings {
        Objects.requireNonNull(exclusion, "exclusion");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(associatedData, "associatedData");
    }

    public static WindowSettings defaults() {
        return new WindowSettings(Radius.NARROW, Radius.ROLE, Radius.ASSOCIATED_DATA);
    }
}
