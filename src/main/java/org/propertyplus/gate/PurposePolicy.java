package org.propertyplus.gate;

import lombok.Builder;
import lombok.Getter;
import org.propertyplus.verification.VerificationPurpose;

import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Ligne de la table des politiques : ce qui distingue un purpose d'un autre
 * autour de la même machine à états.
 */
@Getter
@Builder
public class PurposePolicy {

    private final VerificationPurpose purpose;

    @Builder.Default
    private final Predicate<String> precondition = subject -> true;

    @Builder.Default
    private final String preconditionMessage = "Action not allowed";

    @Builder.Default
    private final Function<String, VerificationPath> path = subject -> VerificationPath.CODE;

    // mot de passe actuel exigé en plus à la finalisation
    private final boolean finalSecretRequired;

    @Builder.Default
    private final Consumer<String> afterSuccess = subject -> { };

    public VerificationPath pathFor(String subject) {
        return path.apply(subject);
    }
}
