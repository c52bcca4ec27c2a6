package org.propertyplus.verification;

/**
 * Propriétaire des sessions de vérification (code, émission, vérification, consommation).
 * <p>
 * Toutes les décisions de temps (fenêtre de renvoi, expiration) sont prises ici.
 * Les opérations sur une même clé (sujet, purpose) sont linéarisées ; le store
 * ne journalise rien et ne formate aucun message : il renvoie des erreurs typées.
 */
public interface VerificationSessionStore {

    /**
     * Renvoie le code vivant émis il y a moins que la fenêtre de renvoi,
     * sinon génère un nouveau code qui remplace toute session précédente.
     */
    IssuedCode issueOrReuse(String subject, VerificationPurpose purpose);

    /**
     * NO_ACTIVE_SESSION, EXPIRED, TOO_MANY_ATTEMPTS ou MISMATCH ; sinon marque la session vérifiée.
     * Idempotent : une seconde vérification correcte ne change pas {@code verifiedAt}.
     */
    GateResult<Void> verify(String subject, VerificationPurpose purpose, String submittedCode);

    /**
     * Ouvre une session déjà vérifiée, sans code : le facteur secondaire
     * (mot de passe actuel) a été contrôlé par l'appelant.
     */
    void markVerified(String subject, VerificationPurpose purpose);

    /**
     * Lecture seule : mêmes erreurs que {@link #consume}, sans rien dépenser.
     * Permet de refuser une finalisation avant tout contrôle du mot de passe.
     */
    GateResult<Void> checkVerified(String subject, VerificationPurpose purpose);

    /**
     * Dépense la session vérifiée. Une fois consommée, elle n'est plus lisible
     * par {@link #verify} et une seconde consommation échoue (ALREADY_CONSUMED).
     */
    GateResult<Void> consume(String subject, VerificationPurpose purpose);

    void discard(String subject, VerificationPurpose purpose);

    void discardAll(String subject);

    /** Supprime les sessions expirées et consommées ; renvoie le nombre supprimé. */
    int purgeExpired();
}
