package org.propertyplus.gate;

/**
 * Contrôle non basé sur un code, typiquement la ressaisie du mot de passe actuel.
 */
@FunctionalInterface
public interface SecondaryFactorCheck {

    boolean check(String subject, String presentedSecret);
}
