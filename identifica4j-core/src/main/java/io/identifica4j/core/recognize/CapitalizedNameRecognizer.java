/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.recognize;

import io.identifica4j.core.api.model.CandidateSpan;
import io.identifica4j.core.lexicon.LexiconSet;
import io.identifica4j.core.preset.DefaultLexicons;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic PERSON proposer for deployments without a trained model: runs of 2 to {@value #MAX_TOKENS}
 * capitalized tokens separated by single spaces, optionally joined by lowercase particles
 * ("da", "de", "do", "das", "dos"). A run opens only on a known given name, or on an honorific ("Dr.", "Sra.")
 * directly followed by one, and needs at least two tokens besides the honorific. An abbreviation dot stays
 * inside a run; any other punctuation ends it, and a sentence-final dot is left out of the span.
 *
 * <p>Title-case phrases that do not start with a given name ("Processos Administrativos") are never proposed.
 * Words before the given name ("Hospital João Silva") stay outside the span and are judged as context.</p>
 */
public final class CapitalizedNameRecognizer implements EntityRecognizer {
    public static final String NAME = "capitalized";
    public static final int MAX_TOKENS = 4;
    public static final String GIVEN_NAMES = "given_names";
    public static final String HONORIFICS = "honorifics";

    private static final Pattern TOKEN = Pattern.compile("[\\p{L}][\\p{L}'’\\-]*\\.?");
    private static final Set<String> PARTICLES = Set.of("da", "de", "do", "das", "dos");

    private final LexiconSet givenNames;
    private final LexiconSet honorifics;

    public CapitalizedNameRecognizer() {
        this(LexiconSet.of(GIVEN_NAMES, DefaultLexicons.givenNames()));
    }

    public CapitalizedNameRecognizer(LexiconSet givenNames) {
        this(givenNames, LexiconSet.of(HONORIFICS, DefaultLexicons.honorifics()));
    }

    public CapitalizedNameRecognizer(LexiconSet givenNames, LexiconSet honorifics) {
        this.givenNames = Objects.requireNonNull(givenNames, "givenNames");
        this.honorifics = Objects.requireNonNull(honorifics, "honorifics");
    }

    /** Recognizer over the built-in given names plus {@code extra}. */
    public static CapitalizedNameRecognizer withAdditionalNames(Collection<String> extra) {
        return new CapitalizedNameRecognizer(LexiconSet.of(GIVEN_NAMES, DefaultLexicons.givenNames()).plus(extra));
    }

    @Override
    public String name() {
        return NAME;
    }

    public LexiconSet givenNames() {
        return givenNames;
    }

    @Override
    public List<CandidateSpan> recognize(String text) {
        if (text == null || text.isEmpty()) return List.of();
        List<Token> tokens = tokenize(text);
        List<CandidateSpan> out = new ArrayList<>();

        int i = 0;
        while (i < tokens.size()) {
            if (!opensName(text, tokens, i)) {
                i++;
                continue;
            }
            int last = i; // index of last capitalized token in the run
            int count = 1;
            int names = isHonorific(tokens.get(i)) ? 0 : 1;
            int j = i + 1;
            while (j < tokens.size() && count < MAX_TOKENS) {
                Token prev = tokens.get(j - 1);
                Token cur = tokens.get(j);
                if (endsSentence(prev) || !adjacent(text, prev, cur)) break;
                if (cur.capitalized()) {
                    last = j;
                    count++;
                    names++;
                    j++;
                } else if (PARTICLES.contains(cur.value()) && j + 1 < tokens.size()
                        && tokens.get(j + 1).capitalized()
                        && adjacent(text, cur, tokens.get(j + 1))) {
                    j++; // particle, keep going
                } else {
                    break;
                }
            }
            if (names >= 2) {
                int start = tokens.get(i).start();
                int end = trimSentenceDot(tokens.get(last));
                out.add(CandidateSpan.person(start, end, text.substring(start, end), NAME));
                i = last + 1;
            } else {
                i++;
            }
        }
        return List.copyOf(out);
    }

    private boolean opensName(String text, List<Token> tokens, int i) {
        Token t = tokens.get(i);
        if (!t.capitalized()) return false;
        if (isGivenName(t)) return true;
        return isHonorific(t)
                && i + 1 < tokens.size()
                && adjacent(text, t, tokens.get(i + 1))
                && tokens.get(i + 1).capitalized()
                && isGivenName(tokens.get(i + 1));
    }

    private boolean isGivenName(Token t) {
        String v = t.value();
        return givenNames.contains(v.endsWith(".") ? v.substring(0, v.length() - 1) : v);
    }

    private boolean isHonorific(Token t) {
        return honorifics.contains(t.value());
    }

    private static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(text);
        while (m.find()) {
            String v = m.group();
            tokens.add(new Token(m.start(), m.end(), v, Character.isUpperCase(v.charAt(0))));
        }
        return tokens;
    }

    /** "Silva." at the end of a sentence loses its dot; short abbreviations such as "Jr." keep it. */
    private static int trimSentenceDot(Token t) {
        return endsSentence(t) ? t.end() - 1 : t.end();
    }

    private static boolean endsSentence(Token t) {
        String v = t.value();
        return v.endsWith(".") && v.length() > 4;
    }

    /** Tokens are adjacent when only a single space separates them. */
    private static boolean adjacent(String text, Token a, Token b) {
        return b.start() == a.end() + 1 && text.charAt(a.end()) == ' ';
    }

    private record Token(int start, int end, String value, boolean capitalized) {}
}
