/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.classify;

import io.identifica4j.core.api.model.Reason;
import io.identifica4j.core.context.ContextWindow;
import io.identifica4j.core.context.ContextWindow.Radius;
import io.identifica4j.core.lexicon.LexiconSet;
import io.identifica4j.core.lexicon.LexiconStore;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects names used as the denomination of an institution, place, normative act, honor or company.
 *
 * <p>Works on the narrow window only. Structural patterns ("Lei &lt;Name&gt;", "Prêmio &lt;Name&gt;",
 * "Relatório &lt;Name&gt;") are tested first, then any exclusion term at token boundaries.</p>
 */
public final class ExclusionClassifier {

    /** Law, decree or statute keyword followed by two words. */
    static final Pattern LAW_TRIBUTE =
            Pattern.compile("(?iu)(?<!\\p{L})(?:lei|decreto|estatuto)\\s+\\p{L}+\\s+\\p{L}+");

    /** Award, program or project keyword followed by a name. */
    static final Pattern TRIBUTE = Pattern.compile(
            "(?iu)(?<!\\p{L})(?:prêmio|premio|projeto|programa|medalha|comenda)\\s+\\p{L}+");

    /** Report keyword followed by a name. */
    static final Pattern NAMED_REPORT = Pattern.compile("(?iu)(?<!\\p{L})(?:relatório|relatorio)\\s+\\p{L}+");

    private static final List<StructuralPattern> PATTERNS = List.of(
            new StructuralPattern(LAW_TRIBUTE, Reason.LAW_TRIBUTE),
            new StructuralPattern(TRIBUTE, Reason.TRIBUTE),
            new StructuralPattern(NAMED_REPORT, Reason.NAMED_REPORT));

    private final LexiconSet exclusionTerms;
    private final Radius radius;

    public ExclusionClassifier(LexiconStore lexicons, Radius radius) {
        this.exclusionTerms = Objects.requireNonNull(lexicons, "lexicons").exclusionTerms();
        this.radius = Objects.requireNonNull(radius, "radius");
    }

    public Optional<ExclusionMatch> test(String text, int start, int end) {
        String window = ContextWindow.slice(text, start, end, radius.before(), radius.after());
        if (window.isEmpty()) return Optional.empty();

        for (StructuralPattern p : PATTERNS) {
            Matcher m = p.pattern().matcher(window);
            if (m.find()) return Optional.of(new ExclusionMatch(p.reason(), m.group()));
        }
        return exclusionTerms.firstMatch(window).map(term -> new ExclusionMatch(Reason.EXCLUSION_CONTEXT, term));
    }

    private record StructuralPattern(Pattern pattern, Reason reason) {}
}
