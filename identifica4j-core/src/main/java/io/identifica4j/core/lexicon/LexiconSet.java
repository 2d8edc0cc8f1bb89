/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.lexicon;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Immutable, named set of normalized phrases.
 *
 * <p>Phrases are lower-cased ({@link Locale#ROOT}), whitespace-collapsed, and stored together with a
 * dot-less variant ({@code "s.a."} also yields {@code "sa"}). Declaration order is kept, so
 * {@link #firstMatch(String)} is deterministic.</p>
 *
 * <p>Matching happens at token boundaries: a phrase edge that is a letter or digit must not touch another
 * letter or digit in the window. {@code "r."} therefore matches {@code "r. maria"} but not {@code "dr. maria"}.</p>
 */
public final class LexiconSet {
    private static final Pattern WS = Pattern.compile("\\s+");

    private final String name;
    private final Set<String> phrases;

    private LexiconSet(String name, Set<String> phrases) {
        this.name = Objects.requireNonNull(name, "name");
        this.phrases = Collections.unmodifiableSet(phrases);
    }

    public static LexiconSet of(String name, Collection<String> raw) {
        Set<String> out = new LinkedHashSet<>();
        if (raw != null) {
            for (String p : raw) {
                String n = normalize(p);
                if (n.isEmpty()) continue;
                out.add(n);
                String dotless = n.replace(".", "").strip();
                if (!dotless.isEmpty()) out.add(dotless);
            }
        }
        return new LexiconSet(name, out);
    }

    public static LexiconSet of(String name, String... raw) {
        return of(name, Arrays.asList(raw));
    }

    /** Public so callers can normalize windows and user input the same way. */
    public static String normalize(String s) {
        if (s == null) return "";
        return WS.matcher(s.strip().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    /** Returns a new set with {@code more} appended after the current phrases. */
    public LexiconSet plus(Collection<String> more) {
        List<String> all = new ArrayList<>(phrases);
        if (more != null) all.addAll(more);
        return of(name, all);
    }

    /** First phrase, in declaration order, occurring in {@code window} at token boundaries. */
    public Optional<String> firstMatch(String window) {
        if (window == null || window.isEmpty() || phrases.isEmpty()) return Optional.empty();
        String w = normalize(window);
        for (String p : phrases) {
            if (occursAsToken(w, p)) return Optional.of(p);
        }
        return Optional.empty();
    }

    public boolean matches(String window) {
        return firstMatch(window).isPresent();
    }

    public boolean contains(String phrase) {
        return phrases.contains(normalize(phrase));
    }

    public String name() {
        return name;
    }

    public Set<String> phrases() {
        return phrases;
    }

    public int size() {
        return phrases.size();
    }

    public boolean isEmpty() {
        return phrases.isEmpty();
    }

    static boolean occursAsToken(String haystack, String phrase) {
        int from = 0;
        int idx;
        while ((idx = haystack.indexOf(phrase, from)) >= 0) {
            int end = idx + phrase.length();
            boolean leftOk = !isWordChar(phrase.charAt(0)) || idx == 0 || !isWordChar(haystack.charAt(idx - 1));
            boolean rightOk = !isWordChar(phrase.charAt(phrase.length() - 1))
                    || end == haystack.length()
                    || !isWordChar(haystack.charAt(end));
            if (leftOk && rightOk) return true;
            from = idx + 1;
        }
        return false;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c);
    }

    @Override
    public String toString() {
        return name + phrases;
    }
}
