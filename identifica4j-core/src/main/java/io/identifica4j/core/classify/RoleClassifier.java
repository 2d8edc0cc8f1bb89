/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.classify;

import io.identifica4j.core.api.model.RoleKind;
import io.identifica4j.core.context.ContextWindow;
import io.identifica4j.core.context.ContextWindow.Radius;
import io.identifica4j.core.lexicon.LexiconSet;
import io.identifica4j.core.lexicon.LexiconStore;
import java.util.Objects;
import java.util.Optional;

/**
 * Looks for an individualizing cue anywhere in the wide window: verbs, then role nouns, then
 * identification headers. The first category that matches wins; proximity is not ranked, so an unrelated
 * verb in a long window still flags the name (biased toward over-flagging).
 */
public final class RoleClassifier {
    private final LexiconSet verbs;
    private final LexiconSet roles;
    private final LexiconSet contexts;
    private final Radius radius;

    public RoleClassifier(LexiconStore lexicons, Radius radius) {
        Objects.requireNonNull(lexicons, "lexicons");
        this.verbs = lexicons.individualizingVerbs();
        this.roles = lexicons.individualizingRoles();
        this.contexts = lexicons.identificationContexts();
        this.radius = Objects.requireNonNull(radius, "radius");
    }

    public Optional<RoleMatch> test(String text, int start, int end) {
        String window = ContextWindow.slice(text, start, end, radius.before(), radius.after());
        if (window.isEmpty()) return Optional.empty();

        Optional<String> hit = verbs.firstMatch(window);
        if (hit.isPresent()) return Optional.of(new RoleMatch(RoleKind.VERB, hit.get()));

        hit = roles.firstMatch(window);
        if (hit.isPresent()) return Optional.of(new RoleMatch(RoleKind.ROLE_NOUN, hit.get()));

        return contexts.firstMatch(window).map(c -> new RoleMatch(RoleKind.IDENTIFICATION_CONTEXT, c));
    }
}
