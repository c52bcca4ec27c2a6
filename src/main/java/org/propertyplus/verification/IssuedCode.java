package org.propertyplus.verification;

import java.time.Instant;

/**
 * Résultat de {@link VerificationSessionStore#issueOrReuse}: {@code isNew} vaut false
 * quand le code existant est renvoyé pendant la fenêtre de renvoi.
 */
public record IssuedCode(String code, boolean isNew, Instant issuedAt) {
}
