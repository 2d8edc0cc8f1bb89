/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import io.identifica4j.core.api.model.CandidateSpan;
import io.identifica4j.core.api.model.ClassifiedEntity;
import io.identifica4j.core.api.model.DocumentResult;
import io.identifica4j.core.api.model.Finding;
import io.identifica4j.core.api.model.IdentifierType;
import io.identifica4j.core.api.model.Intent;
import io.identifica4j.core.api.model.Verdict;
import io.identifica4j.core.classify.WindowSettings;
import io.identifica4j.core.context.ContextWindow.Radius;
import io.identifica4j.core.lexicon.LexiconStore;
import io.identifica4j.core.recognize.EntityRecognizer;
import io.identifica4j.core.report.Reporter;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SemanticClassifierTest {

    private final SemanticClassifier classifier =
            SemanticClassifier.builder().verbose(true).build();

    private static final String BIOCASA_REQUEST = "Prezados, boa noite. Na qualidade de representante da BIOCASA "
            + "COMERCIO DE MATERIAL FISIOTERÁPICO LTDA - ME, solicito, gentilmente, o envio dos Processos "
            + "Administrativos, extratos, bem como quaisquer outras informações relativas às Certidões de Dívida "
            + "Ativa nº 1000258954 e 0002574863. Agradeço a disponibilidade e aguardo o retorno. Atenciosamente,";

    private static Verdict firstVerdict(DocumentResult r) {
        List<ClassifiedEntity> list = r.entities().isEmpty() ? r.excluded() : r.entities();
        return list.get(0).verdict();
    }

    @ParameterizedTest(name = "{0} -> {1} ({2})")
    @CsvSource(
            delimiter = '|',
            nullValues = "-",
            textBlock = """
            Hospital Dr. João Silva            | PUBLIC            | exclusion_context       | -         | hospital
            Rua Maria Santos                   | PUBLIC            | exclusion_context       | -         | rua
            Rua Carlos Alberto, 100            | PUBLIC            | exclusion_context       | -         | rua
            Lei Carlos Alberto                 | PUBLIC            | lei_homenagem           | -         | lei carlos alberto
            Relatório Pedro Álvares            | PUBLIC            | relatorio_nomeado       | -         | relatório pedro
            João Silva solicitou acesso        | HAS_PERSONAL_DATA | individualizing_role    | verb      | solicitou
            Requerente: Maria Santos           | HAS_PERSONAL_DATA | individualizing_role    | role_noun | requerente
            Nome completo: Maria Santos        | HAS_PERSONAL_DATA | individualizing_role    | identification_context | nome completo:
            CPF: 123.456.789-00                | HAS_PERSONAL_DATA | documento_ou_contato    | -         | CPF
            'Maria Santos, CPF 123.456.789-00' | HAS_PERSONAL_DATA | associated_data         | -         | documento_ou_contato
            Maria Santos                       | PUBLIC            | no_individualizing_role | -         | -
            """)
    void scenarios(String text, Intent intent, String reason, String roleKind, String evidence) {
        DocumentResult r = classifier.classifyText(text);
        Verdict v = firstVerdict(r);

        assertThat(r.intent()).isEqualTo(intent);
        assertThat(v.reason().code()).isEqualTo(reason);
        assertThat(v.roleKind() == null ? null : v.roleKind().code()).isEqualTo(roleKind);
        assertThat(v.evidence()).isEqualTo(evidence);
        assertThat(r.confidence()).isEqualTo(intent == Intent.HAS_PERSONAL_DATA ? 0.90 : 0.85);
    }

    @Test
    void companyRequestWithoutNaturalPersonIsPublic() {
        DocumentResult r = classifier.classifyText(BIOCASA_REQUEST);

        assertThat(r.intent()).isEqualTo(Intent.PUBLIC);
        assertThat(r.entities()).isEmpty();
        assertThat(r.excluded()).isEmpty();
    }

    @Test
    void representativeNamedInCompanyRequestIsPersonalData() {
        DocumentResult r = classifier.classifyText("Na qualidade de representante da BIOCASA, João Silva solicita");

        assertThat(r.intent()).isEqualTo(Intent.HAS_PERSONAL_DATA);
        assertThat(r.entities()).singleElement().satisfies(e -> assertThat(e.span().text()).isEqualTo("João Silva"));
    }

    @Test
    void textWithoutNamesIsPublic() {
        DocumentResult r = classifier.classifyText("Solicito informações sobre o contrato 12/2024");

        assertThat(r.intent()).isEqualTo(Intent.PUBLIC);
        assertThat(r.entities()).isEmpty();
        assertThat(r.excluded()).isEmpty();
    }

    @Test
    void findingsCarryNoSurfaceText() {
        DocumentResult r = classifier.classifyText("CPF: 123.456.789-00");

        assertThat(r.findings()).containsExactly(new Finding("CPF", "documento_ou_contato", 5, 19));
    }

    @Test
    void classificationIsIdempotent() {
        String text = "A requerente Maria Santos, moradora da Rua Direita, pediu cópia do Relatório Pedro Álvares";

        assertThat(classifier.classifyText(text)).isEqualTo(classifier.classifyText(text));
    }

    @Test
    void onlySuppliedSpansAreClassified() {
        DocumentResult r = classifier.classify("CPF 123.456.789-00", List.of());

        assertThat(r.intent()).isEqualTo(Intent.PUBLIC);
    }

    @Test
    void addingPersonalSpanOnlyFlipsTowardsPersonal() {
        String text = "Maria Santos, CPF 123.456.789-00";
        CandidateSpan name = CandidateSpan.person(0, 12, "Maria Santos", "ner");
        CandidateSpan cpf = CandidateSpan.identifier(18, 32, "123.456.789-00", IdentifierType.CPF);
        SemanticClassifier noAssociatedData = SemanticClassifier.builder()
                .windows(new WindowSettings(Radius.NARROW, Radius.ROLE, new Radius(0, 0)))
                .build();

        assertThat(noAssociatedData.classify(text, List.of(name)).intent()).isEqualTo(Intent.PUBLIC);
        assertThat(noAssociatedData.classify(text, List.of(name, cpf)).intent()).isEqualTo(Intent.HAS_PERSONAL_DATA);
    }

    @Test
    void singleTokenPersonSpansAreIgnored() {
        String text = "Maria solicitou acesso";

        DocumentResult r = classifier.classify(text, List.of(CandidateSpan.person(0, 5, "Maria", "ner")));

        assertThat(r.intent()).isEqualTo(Intent.PUBLIC);
        assertThat(r.excluded()).isEmpty();
    }

    @Test
    void spanOutsideTextIsRejected() {
        var span = CandidateSpan.person(0, 50, "Maria Santos", "ner");

        assertThatThrownBy(() -> classifier.classify("Maria Santos", List.of(span)))
                .isInstanceOf(InvalidSpanException.class);
    }

    @Test
    void singleTokenSpanOutsideTextIsRejected() {
        var span = CandidateSpan.person(50, 60, "Maria", "ner");

        assertThatThrownBy(() -> classifier.classify("Oi", List.of(span)))
                .isInstanceOf(InvalidSpanException.class);
    }

    @Test
    void personTokensAreCountedOnTheCoveredText() {
        String text = "Maria Santos solicitou acesso";

        DocumentResult r = classifier.classify(text, List.of(CandidateSpan.person(0, 12, null, "ner")));

        assertThat(r.intent()).isEqualTo(Intent.HAS_PERSONAL_DATA);
    }

    @Test
    void verboseCanBeOverriddenPerCall() {
        assertThat(classifier.classifyText("Maria Santos", false).excluded()).isEmpty();
        assertThat(classifier.classifyText("Maria Santos", true).excluded()).hasSize(1);
    }

    @Test
    void lexiconAdditionsVetoNames() {
        String text = "Escritório Maria Santos, e-mail de contato";
        assertThat(classifier.classifyText(text).intent()).isEqualTo(Intent.HAS_PERSONAL_DATA);

        SemanticClassifier extended = SemanticClassifier.builder()
                .lexicons(LexiconStore.defaults().withAdditions(List.of("escritório"), null, null, null))
                .build();

        assertThat(extended.classifyText(text).intent()).isEqualTo(Intent.PUBLIC);
    }

    @Test
    void recognizerAndIdentifierTypesAreConfigurable() {
        SemanticClassifier minimal = SemanticClassifier.builder()
                .recognizer(EntityRecognizer.none())
                .identifierTypes(List.of(IdentifierType.EMAIL))
                .build();

        assertThat(minimal.classifyText("João Silva solicitou acesso").intent()).isEqualTo(Intent.PUBLIC);
        assertThat(minimal.classifyText("CPF: 123.456.789-00").intent()).isEqualTo(Intent.PUBLIC);
        assertThat(minimal.classifyText("Contato: joao@gmail.com").intent()).isEqualTo(Intent.HAS_PERSONAL_DATA);
    }

    @Test
    void everyResultIsReported() {
        Reporter reporter = mock(Reporter.class);
        SemanticClassifier reporting = SemanticClassifier.builder().reporter(reporter).build();

        DocumentResult r = reporting.classifyText("João Silva solicitou acesso");

        verify(reporter).report(r);
    }

    @Test
    void failingReporterDoesNotBreakClassification() {
        Reporter reporter = mock(Reporter.class);
        doThrow(new IllegalStateException("registry closed")).when(reporter).report(any());
        SemanticClassifier reporting = SemanticClassifier.builder().reporter(reporter).build();

        assertThat(reporting.classifyText("João Silva solicitou acesso").hasPersonalData()).isTrue();
    }

    @Test
    void nullTextIsRejected() {
        assertThatThrownBy(() -> classifier.classifyText(null)).isInstanceOf(NullPointerException.class);
    }
}
