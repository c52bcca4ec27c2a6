package org.propertyplus.verification;

/**
 * Action qu'une session de vérification autorise.
 * Un même sujet peut avoir une session vivante par purpose, sans interférence entre elles.
 */
public enum VerificationPurpose {
    SIGNUP_EMAIL,
    PASSWORD_RESET,
    PASSWORD_CHANGE,
    TWO_FACTOR_TOGGLE,
    ACCOUNT_DELETE
}
