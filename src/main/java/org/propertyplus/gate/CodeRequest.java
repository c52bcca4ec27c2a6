package org.propertyplus.gate;

/**
 * Issue d'une demande de code. {@code codeRequired=false} quand le purpose passe
 * par le mot de passe actuel (changement de mot de passe sans 2FA).
 */
public record CodeRequest(boolean codeRequired, boolean newCode, long expiresInSeconds) {

    public static CodeRequest notRequired() {
        return new CodeRequest(false, false, 0);
    }
}
