package org.propertyplus.verification;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * État d'un défi à code unique pour une clé (sujet, purpose).
 * Immuable : le store remplace la valeur à chaque transition.
 */
@Value
@Builder(toBuilder = true)
public class VerificationSession {

    SessionKey key;

    // null pour une session ouverte par le facteur secondaire (aucun code envoyé)
    String code;

    Instant issuedAt;

    Instant verifiedAt;

    Instant consumedAt;

    int failedAttempts;

    public static VerificationSession issued(SessionKey key, String code, Instant now) {
        return VerificationSession.builder()
                .key(key)
                .code(code)
                .issuedAt(now)
                .build();
    }

    public static VerificationSession confirmedWithoutCode(SessionKey key, Instant now) {
        return VerificationSession.builder()
                .key(key)
                .issuedAt(now)
                .verifiedAt(now)
                .build();
    }

    public boolean hasCode() {
        return code != null;
    }

    public boolean isVerified() {
        return verifiedAt != null;
    }

    public boolean isConsumed() {
        return consumedAt != null;
    }
}
