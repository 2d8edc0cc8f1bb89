/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.detect;

import static org.assertj.core.api.Assertions.assertThat;

import io.identifica4j.core.api.model.CandidateSpan;
import io.identifica4j.core.api.model.EntityLabel;
import java.util.List;
import org.junit.jupiter.api.Test;

class SpelledDigitsDetectorTest {

    private final SpelledDigitsDetector detector = new SpelledDigitsDetector();

    @Test
    void elevenSpelledDigitsAreACpf() {
        String text = "meu cpf é um dois três quatro cinco seis sete oito nove zero zero, obrigado";

        List<CandidateSpan> spans = detector.detect(text);

        assertThat(spans).singleElement().satisfies(s -> {
            assertThat(s.type()).isEqualTo("CPF");
            assertThat(s.label()).isEqualTo(EntityLabel.DOCUMENT);
            assertThat(s.text()).startsWith("um dois").endsWith("zero zero");
        });
    }

    @Test
    void nineDigitsAreAnRgAndAccentIsOptional() {
        assertThat(detector.detect("nove oito sete seis cinco quatro tres dois um"))
                .extracting(CandidateSpan::type)
                .containsExactly("RG");
    }

    @Test
    void separatorsAndConnectorKeepTheRun() {
        List<CandidateSpan> spans = detector.detect("número um, dois, três, quatro, cinco e seis");

        assertThat(spans).singleElement().satisfies(s -> {
            assertThat(s.type()).isEqualTo("SPELLED_DIGITS");
            assertThat(s.text()).isEqualTo("um, dois, três, quatro, cinco e seis");
        });
    }

    @Test
    void dezContributesTwoDigits() {
        assertThat(SpelledDigitsDetector.digitsOf("dez dez dez")).isEqualTo("101010");
        assertThat(detector.detect("dez dez dez")).hasSize(1);
    }

    @Test
    void shortIncidentalNumbersAreIgnored() {
        assertThat(detector.detect("dois ou três pedidos")).isEmpty();
        assertThat(detector.detect("um dois três")).isEmpty();
        assertThat(detector.detect("um dois. três quatro. cinco seis")).isEmpty();
    }

    @Test
    void unknownWordBreaksDecoding() {
        assertThat(SpelledDigitsDetector.digitsOf("um dois onze")).isNull();
    }
}
