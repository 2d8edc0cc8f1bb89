/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.preset;

import io.identifica4j.core.api.model.IdentifierType;
import io.identifica4j.core.detect.IdentifierDetector;
import io.identifica4j.core.detect.RegexIdentifierDetector;
import io.identifica4j.core.detect.SpelledDigitsDetector;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Builds {@link IdentifierDetector} instances from logical {@link IdentifierType}s.
 *
 * <p>{@link IdentifierType#SPELLED_DIGITS} enables the spelled-out number detector, which may itself report
 * CPF, RG or voter-id spans depending on the digit count.</p>
 */
public final class IdentifierRegistry {

    /** Default enabled identifiers (user may override in configuration). */
    public static EnumSet<IdentifierType> defaultTypes() {
        return EnumSet.allOf(IdentifierType.class);
    }

    /**
     * Build detectors in a deterministic order (documents, then contact data, then spelled numbers).
     *
     * @param types enabled types; null or empty means {@link #defaultTypes()}
     * @return immutable list of active detectors
     */
    public List<IdentifierDetector> build(List<IdentifierType> types) {
        EnumSet<IdentifierType> enabled =
                (types == null || types.isEmpty()) ? defaultTypes() : EnumSet.copyOf(types);

        List<IdentifierDetector> out = new ArrayList<>();
        if (enabled.contains(IdentifierType.CPF)) out.add(RegexIdentifierDetector.cpf());
        if (enabled.contains(IdentifierType.RG)) out.add(RegexIdentifierDetector.rg());
        if (enabled.contains(IdentifierType.VOTER_ID)) out.add(RegexIdentifierDetector.voterId());
        if (enabled.contains(IdentifierType.PASSPORT)) out.add(RegexIdentifierDetector.passport());

        if (enabled.contains(IdentifierType.EMAIL)) out.add(RegexIdentifierDetector.email());
        if (enabled.contains(IdentifierType.PHONE)) out.add(RegexIdentifierDetector.phone());

        if (enabled.contains(IdentifierType.SPELLED_DIGITS)) out.add(new SpelledDigitsDetector());
        return List.copyOf(out);
    }
}
