/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.detect;

import io.identifica4j.core.api.model.CandidateSpan;
import io.identifica4j.core.api.model.IdentifierType;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects document numbers dictated in words ("um dois três quatro cinco seis sete oito nove zero zero").
 *
 * <p>A run needs at least {@link #MIN_WORDS} consecutive number-words; words may be separated by
 * whitespace, commas, semicolons, dashes or the connector "e". Digit values are concatenated ("dez" gives
 * "10") and the run is reported only when the concatenation has at least {@link #MIN_DIGITS} digits, so
 * incidental phrases such as "dois ou três" never trigger.</p>
 *
 * <p>The reported type follows the digit count: 11 is a CPF, 9 an RG, 12 a voter id; any other length is
 * {@link IdentifierType#SPELLED_DIGITS}.</p>
 */
public final class SpelledDigitsDetector implements IdentifierDetector {
    public static final int MIN_WORDS = 3;
    public static final int MIN_DIGITS = 6;

    private static final Pattern WORD = Pattern.compile("\\p{L}+");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s,;\\-]*");
    private static final Pattern CONNECTOR = Pattern.compile("(?iu)(?<!\\p{L})e(?!\\p{L})");
    private static final Pattern MARKS = Pattern.compile("\\p{M}+");

    private static final Map<String, String> VALUES = Map.ofEntries(
            Map.entry("zero", "0"),
            Map.entry("um", "1"),
            Map.entry("uma", "1"),
            Map.entry("dois", "2"),
            Map.entry("duas", "2"),
            Map.entry("tres", "3"),
            Map.entry("quatro", "4"),
            Map.entry("cinco", "5"),
            Map.entry("seis", "6"),
            Map.entry("sete", "7"),
            Map.entry("oito", "8"),
            Map.entry("nove", "9"),
            Map.entry("dez", "10"));

    @Override
    public IdentifierType type() {
        return IdentifierType.SPELLED_DIGITS;
    }

    @Override
    public List<CandidateSpan> detect(String text) {
        if (text == null || text.isEmpty()) return List.of();
        List<CandidateSpan> spans = new ArrayList<>();
        Run run = null;
        Matcher m = WORD.matcher(text);
        while (m.find()) {
            String word = m.group();
            String digits = VALUES.get(fold(word));
            if (digits == null) {
                if (run != null && isConnector(word)) continue;
                run = flush(run, text, spans);
                continue;
            }
            if (run != null && joinable(text, run.end, m.start())) {
                run.add(m.end(), digits);
            } else {
                flush(run, text, spans);
                run = new Run(m.start(), m.end(), digits);
            }
        }
        flush(run, text, spans);
        return List.copyOf(spans);
    }

    /** Decodes a run of number words into its digit string, or returns null if a word is unknown. */
    public static String digitsOf(String words) {
        if (words == null) return null;
        StringBuilder sb = new StringBuilder();
        Matcher m = WORD.matcher(words);
        while (m.find()) {
            if (isConnector(m.group())) continue;
            String d = VALUES.get(fold(m.group()));
            if (d == null) return null;
            sb.append(d);
        }
        return sb.toString();
    }

    static IdentifierType typeFor(int digitCount) {
        return switch (digitCount) {
            case 11 -> IdentifierType.CPF;
            case 9 -> IdentifierType.RG;
            case 12 -> IdentifierType.VOTER_ID;
            default -> IdentifierType.SPELLED_DIGITS;
        };
    }

    private static Run flush(Run run, String text, List<CandidateSpan> out) {
        if (run != null && run.words >= MIN_WORDS && run.digits.length() >= MIN_DIGITS) {
            IdentifierType t = typeFor(run.digits.length());
            out.add(CandidateSpan.identifier(run.start, run.end, text.substring(run.start, run.end), t));
        }
        return null;
    }

    private static boolean joinable(String text, int from, int to) {
        String gap = CONNECTOR.matcher(text.substring(from, to)).replaceAll(" ");
        return SEPARATORS.matcher(gap).matches();
    }

    private static boolean isConnector(String word) {
        return "e".equalsIgnoreCase(word);
    }

    private static String fold(String word) {
        String d = Normalizer.normalize(word.toLowerCase(Locale.ROOT), Normalizer.Form.NFD);
        return MARKS.matcher(d).replaceAll("");
    }

    private static final class Run {
        private final int start;
        private int end;
        private int words;
        private final StringBuilder digits = new StringBuilder();

        Run(int start, int end, String firstDigits) {
            this.start = start;
            this.end = end;
            this.words = 1;
            this.digits.append(firstDigits);
        }

        void add(int newEnd, String d) {
            end = newEnd;
            words++;
            digits.append(d);
        }
    }
}
