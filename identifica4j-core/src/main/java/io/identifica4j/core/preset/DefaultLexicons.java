/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.preset;

import io.identifica4j.core.lexicon.LexiconSet;
import io.identifica4j.core.lexicon.LexiconStore;
import java.util.List;

/**
 * Built-in Brazilian Portuguese lexicons.
 *
 * <h3>Exclusion terms</h3>
 * Words that, right next to a name, show the name denotes an institution, a place, a normative act, an
 * honor or a company rather than an acting individual.
 *
 * <h3>Individualizing cues</h3>
 * Verbs of individual action, role nouns and identification headers that tie a name to a natural person.
 *
 * <h3>Given names</h3>
 * Common Brazilian first names and the honorifics that may precede them. The heuristic recognizer only opens a
 * name where one of them appears.
 */
public final class DefaultLexicons {
    private DefaultLexicons() {}

    public static List<String> exclusionTerms() {
        return List.of(
                // health, education and culture institutions
                "hospital", "maternidade", "upa", "ubs", "posto de saúde", "clínica",
                "policlínica", "ambulatório", "pronto-socorro", "pronto socorro",
                "escola", "colégio", "universidade", "faculdade", "instituto", "fundação",
                "creche", "centro educacional", "campus",
                "biblioteca", "museu", "arquivo", "teatro", "centro cultural", "galeria",
                "auditório", "casa de cultura", "memorial",
                // public roads and place names
                "rua", "r.", "avenida", "av.", "alameda", "travessa", "praça",
                "largo", "rodovia", "estrada", "via", "viaduto", "ponte", "túnel",
                "rotatória", "passarela", "viela", "beco", "bairro", "distrito",
                // public buildings
                "edifício", "prédio", "palácio", "fórum", "tribunal", "cartório",
                "delegacia", "batalhão", "quartel", "prefeitura", "câmara", "assembleia",
                // normative acts and honors
                "lei", "decreto", "portaria", "resolução", "instrução normativa",
                "programa", "projeto", "plano", "prêmio", "medalha", "comenda",
                "relatório", "parecer", "nota técnica",
                // companies
                "s.a.", "s.a", "ltda.", "eireli", "me", "mei", "companhia",
                "empresa", "grupo", "holding", "associação", "cooperativa");
    }

    public static List<String> individualizingVerbs() {
        return List.of(
                "solicitou", "requereu", "requisitou", "pediu", "demandou",
                "protocolou", "apresentou", "encaminhou", "enviou",
                "compareceu", "assinou", "autorizou", "declarou",
                "reclamou", "denunciou", "reportou");
    }

    public static List<String> individualizingRoles() {
        return List.of(
                "solicitante", "requerente", "requisitante", "demandante",
                "cidadão", "cidadã", "munícipe", "contribuinte",
                "titular", "responsável", "representante", "interessado",
                "reclamante", "denunciante", "autor", "peticionário",
                "morador", "moradora", "residente", "paciente");
    }

    public static List<String> identificationContexts() {
        return List.of(
                "nome:", "nome completo:", "identificação:", "titular:",
                "dados do solicitante", "dados do requerente",
                "na qualidade de", "qualidade de");
    }

    public static List<String> givenNames() {
        return List.of(
                "maria", "ana", "francisca", "antônia", "antonia", "adriana", "juliana", "márcia", "marcia",
                "fernanda", "patrícia", "patricia", "aline", "sandra", "camila", "amanda", "bruna", "jéssica",
                "jessica", "letícia", "leticia", "júlia", "julia", "luciana", "vanessa", "mariana", "gabriela",
                "vera", "vitória", "vitoria", "larissa", "cláudia", "claudia", "beatriz", "luana", "rita",
                "sônia", "sonia", "renata", "eliane", "josefa", "simone", "natália", "natalia", "cristina",
                "carla", "débora", "debora", "rosângela", "rosangela", "raimunda", "helena", "alice", "laura",
                "isabela", "sofia", "valentina", "lúcia", "lucia", "tereza", "teresa", "regina", "paula",
                "roberta", "daniela", "rafaela", "tatiane", "priscila", "carolina", "joana", "luíza", "luiza",
                "joão", "joao", "josé", "jose", "antônio", "antonio", "francisco", "carlos", "paulo", "pedro",
                "lucas", "luiz", "luis", "marcos", "gabriel", "rafael", "daniel", "marcelo", "bruno", "eduardo",
                "felipe", "raimundo", "rodrigo", "manoel", "manuel", "mateus", "matheus", "andré", "andre",
                "fernando", "fábio", "fabio", "leonardo", "gustavo", "guilherme", "leandro", "tiago", "thiago",
                "anderson", "ricardo", "márcio", "marcio", "jorge", "sebastião", "sebastiao", "alexandre",
                "roberto", "edson", "diego", "vitor", "victor", "sérgio", "sergio", "cláudio", "claudio",
                "renato", "henrique", "miguel", "arthur", "artur", "heitor", "bernardo", "davi", "samuel",
                "enzo", "vinícius", "vinicius", "caio", "igor", "otávio", "otavio", "rogério", "rogerio",
                "júlio", "julio", "alberto", "augusto", "benedito", "geraldo", "luciano", "wagner", "wellington",
                "adriano", "alessandro", "fabiano", "hugo", "murilo", "nelson", "osvaldo", "reinaldo", "valter",
                "walter", "severino", "domingos", "joaquim", "benjamin", "lorenzo", "theo", "nicolas");
    }

    public static List<String> honorifics() {
        return List.of("sr.", "sra.", "srta.", "dr.", "dra.", "prof.", "profa.", "dona", "seu");
    }

    public static LexiconStore brazilianPortuguese() {
        return new LexiconStore(
                LexiconSet.of(LexiconStore.EXCLUSION_TERMS, exclusionTerms()),
                LexiconSet.of(LexiconStore.INDIVIDUALIZING_VERBS, individualizingVerbs()),
                LexiconSet.of(LexiconStore.INDIVIDUALIZING_ROLES, individualizingRoles()),
                LexiconSet.of(LexiconStore.IDENTIFICATION_CONTEXTS, identificationContexts()));
    }
}
