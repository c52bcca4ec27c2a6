package org.propertyplus.gate;

import java.util.Optional;

/**
 * Mutation protégée par une session de vérification (changer le mot de passe,
 * désactiver la 2FA, supprimer le compte...). Invoquée au plus une fois par consommation.
 *
 * @param <P> données fournies à la finalisation
 * @param <R> résultat de l'action
 */
@FunctionalInterface
public interface GatedAction<P, R> {

    R perform(String subject, P payload);

    /**
     * Refus métier évalué avant la consommation (ex. nouveau mot de passe identique à l'ancien) :
     * la session reste intacte et l'utilisateur peut corriger sa saisie.
     */
    default Optional<String> refuse(String subject, P payload) {
        return Optional.empty();
    }
}
