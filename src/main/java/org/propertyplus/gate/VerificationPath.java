package org.propertyplus.gate;

public enum VerificationPath {
    /** code à usage unique envoyé au sujet */
    CODE,
    /** mot de passe actuel à la place du code */
    SECONDARY_FACTOR
}
