package org.propertyplus.verification;

import java.util.Locale;
import java.util.Objects;

/**
 * Clé (sujet, purpose) d'une session. Le sujet est normalisé (trim + minuscules).
 */
public record SessionKey(String subject, VerificationPurpose purpose) {

    public SessionKey {
        Objects.requireNonNull(purpose, "purpose");
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must be provided");
        }
    }

    public static SessionKey of(String subject, VerificationPurpose purpose) {
        if (subject == null) {
            throw new IllegalArgumentException("subject must be provided");
        }
        return new SessionKey(subject.trim().toLowerCase(Locale.ROOT), purpose);
    }

    @Override
    public String toString() {
        return purpose + ":" + subject;
    }
}
