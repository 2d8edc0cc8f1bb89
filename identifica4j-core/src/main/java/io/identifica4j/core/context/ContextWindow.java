/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.context;

import java.util.Locale;
import java.util.Objects;

/**
 * Lower-cased text around a span. Radius overrun is an expected boundary condition, so the range
 * [start-before, end+after] is clamped to the text instead of failing.
 */
public record ContextWindow(int radiusBefore, int radiusAfter, String normalizedText) {

    public ContextWindow {
        if (radiusBefore < 0 || radiusAfter < 0) throw new IllegalArgumentException("radius must be >= 0");
        Objects.requireNonNull(normalizedText, "normalizedText");
    }

    public static ContextWindow of(String text, int start, int end, int before, int after) {
        return new ContextWindow(before, after, slice(text, start, end, before, after));
    }

    /** Same as {@link #of} but returns only the normalized text. */
    public static String slice(String text, int start, int end, int before, int after) {
        if (text == null || text.isEmpty()) return "";
        int len = text.length();
        int from = clamp((long) start - before, len);
        int to = clamp((long) end + after, len);
        if (to <= from) return "";
        return text.substring(from, to).toLowerCase(Locale.ROOT);
    }

    private static int clamp(long v, int len) {
        return (int) Math.max(0, Math.min(len, v));
    }

    /** A pair of radii; narrow for exclusion cues, wide for role and associated-data cues. */
    public record Radius(int before, int after) {
        public static final Radius NARROW = new Radius(30, 30);
        public static final Radius ROLE = new Radius(100, 100);
        public static final Radius ASSOCIATED_DATA = new Radius(150, 150);

        public Radius {
            if (before < 0 || after < 0) throw new IllegalArgumentException("radius must be >= 0");
        }

        public ContextWindow around(String text, int start, int end) {
            return ContextWindow.of(text, start, end, before, after);
        }
    }
}
