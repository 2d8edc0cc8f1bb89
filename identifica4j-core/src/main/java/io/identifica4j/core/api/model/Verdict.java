/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.identifica4j.core.api.model;

import java.util.Objects;

/**
 * Decision for a single span.
 *
 * @param roleKind set only when {@code reason} is {@link Reason#INDIVIDUALIZING_ROLE}
 * @param evidence matched phrase or pattern; informational, may be null
 */
public record Verdict(boolean personalData, Reason reason, RoleKind roleKind, String evidence) {

    public Verdict {
        Objects.requireNonNull(reason, "reason");
        if (personalData != reason.personalData()) {
            throw new IllegalArgumentException("reason " + reason.code() + " contradicts personalData=" + personalData);
        }
    }

    public static Verdict excluded(Reason reason, String evidence) {
        if (!reason.isExclusion()) throw new IllegalArgumentException("not an exclusion reason: " + reason.code());
        return new Verdict(false, reason, null, evidence);
    }

    public static Verdict role(RoleKind kind, String evidence) {
        return new Verdict(true, Reason.INDIVIDUALIZING_ROLE, Objects.requireNonNull(kind, "kind"), evidence);
    }

    public static Verdict associatedData(String evidence) {
        return new Verdict(true, Reason.ASSOCIATED_DATA, null, evidence);
    }

    public static Verdict noRole() {
        return new Verdict(false, Reason.NO_INDIVIDUALIZING_ROLE, null, null);
    }

    public static Verdict structuredIdentifier(String type) {
        return new Verdict(true, Reason.DOCUMENT_OR_CONTACT, null, type);
    }
}
