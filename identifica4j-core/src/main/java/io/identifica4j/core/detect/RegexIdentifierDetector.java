/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.detect;

import io.identifica4j.core.api.model.CandidateSpan;
import io.identifica4j.core.api.model.IdentifierType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** One compiled pattern, one identifier type. Every match becomes a span. */
public final class RegexIdentifierDetector implements IdentifierDetector {

    /** 000.000.000-00 with optional separators. */
    public static final String CPF = "\\b\\d{3}\\.?\\d{3}\\.?\\d{3}-?\\d{2}\\b";
    /** 00.000.000-0 with optional separators, or 9 contiguous digits. */
    public static final String RG = "\\b\\d{2}\\.?\\d{3}\\.?\\d{3}-?\\d\\b|\\b\\d{9}\\b";
    /** 0000 0000 0000, dots or spaces between groups, or 12 contiguous digits. */
    public static final String VOTER_ID = "\\b\\d{4}[ .]?\\d{4}[ .]?\\d{4}\\b";
    public static final String PASSPORT = "\\b[A-Z]{2}\\d{6}\\b";
    public static final String EMAIL = "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b";
    /** Optional (dd) area code, then 8 or 9 digits with an optional dash or space before the last four. */
    public static final String PHONE = "(?<![\\w(])(?:\\(\\d{2}\\)\\s?|\\d{2}\\s)?\\d{4,5}[-\\s]?\\d{4}(?!\\w)";

    private final IdentifierType type;
    private final Pattern pattern;

    public RegexIdentifierDetector(IdentifierType type, String regex) {
        this.type = Objects.requireNonNull(type, "type");
        this.pattern = Pattern.compile(regex);
    }

    public static RegexIdentifierDetector cpf() {
        return new RegexIdentifierDetector(IdentifierType.CPF, CPF);
    }

    public static RegexIdentifierDetector rg() {
        return new RegexIdentifierDetector(IdentifierType.RG, RG);
    }

    public static RegexIdentifierDetector voterId() {
        return new RegexIdentifierDetector(IdentifierType.VOTER_ID, VOTER_ID);
    }

    public static RegexIdentifierDetector passport() {
        return new RegexIdentifierDetector(IdentifierType.PASSPORT, PASSPORT);
    }

    public static RegexIdentifierDetector email() {
        return new RegexIdentifierDetector(IdentifierType.EMAIL, EMAIL);
    }

    public static RegexIdentifierDetector phone() {
        return new RegexIdentifierDetector(IdentifierType.PHONE, PHONE);
    }

    @Override
    public IdentifierType type() {
        return type;
    }

    @Override
    public List<CandidateSpan> detect(String text) {
        if (text == null || text.isEmpty()) return List.of();
        Matcher m = pattern.matcher(text);
        List<CandidateSpan> spans = new ArrayList<>();
        while (m.find()) {
            if (m.end() > m.start()) spans.add(CandidateSpan.identifier(m.start(), m.end(), m.group(), type));
        }
        return List.copyOf(spans);
    }
}
