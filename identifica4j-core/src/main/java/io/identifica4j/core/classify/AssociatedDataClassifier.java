/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.classify;

import io.identifica4j.core.context.ContextWindow;
import io.identifica4j.core.context.ContextWindow.Radius;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/** True when a document keyword, a document-number grouping or an e-mail address sits near the name. */
public final class AssociatedDataClassifier {
    public static final String EVIDENCE = "documento_ou_contato";

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("\\bcpf\\b"),
            Pattern.compile("\\brg\\b"),
            Pattern.compile("\\be-?mail\\b"),
            Pattern.compile("\\btelefone\\b"),
            Pattern.compile("\\d{3}\\.?\\d{3}\\.?\\d{3}-?\\d{2}"), // CPF
            Pattern.compile("\\d{2}\\.?\\d{3}\\.?\\d{3}"), // RG
            Pattern.compile("[a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,}"));

    private final Radius radius;

    public AssociatedDataClassifier(Radius radius) {
        this.radius = Objects.requireNonNull(radius, "radius");
    }

    public boolean test(String text, int start, int end) {
        String window = ContextWindow.slice(text, start, end, radius.before(), radius.after());
        if (window.isEmpty()) return false;
        for (Pattern p : PATTERNS) {
            if (p.matcher(window).find()) return true;
        }
        return false;
    }
}
