package org.propertyplus.gate;

import lombok.extern.slf4j.Slf4j;
import org.propertyplus.config.VerificationProperties;
import org.propertyplus.verification.GateError;
import org.propertyplus.verification.GateResult;
import org.propertyplus.verification.IssuedCode;
import org.propertyplus.verification.VerificationPurpose;
import org.propertyplus.verification.VerificationSessionStore;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Séquence commune à toutes les actions sensibles :
 * émission du code, livraison, vérification, confirmation finale, exécution unique.
 * <p>
 * Les différences entre purposes (précondition, chemin de vérification, mot de passe final,
 * effets après succès) viennent de {@link PurposePolicies}. Aucun échec ne sort d'ici
 * sous forme d'exception : tout revient en {@link GateResult}.
 */
@Slf4j
@Service
public class GatedActionCoordinator {

    private final VerificationSessionStore store;
    private final PurposePolicies policies;
    private final CodeDelivery codeDelivery;
    private final SecondaryFactorCheck secondaryFactorCheck;
    private final VerificationProperties properties;

    public GatedActionCoordinator(VerificationSessionStore store,
                                  PurposePolicies policies,
                                  CodeDelivery codeDelivery,
                                  SecondaryFactorCheck secondaryFactorCheck,
                                  VerificationProperties properties) {
        this.store = store;
        this.policies = policies;
        this.codeDelivery = codeDelivery;
        this.secondaryFactorCheck = secondaryFactorCheck;
        this.properties = properties;
    }

    public GateResult<CodeRequest> requestCode(String subject, VerificationPurpose purpose) {
        return requestCode(subject, purpose, codeDelivery);
    }

    public GateResult<CodeRequest> requestCode(String subject, VerificationPurpose purpose, CodeDelivery delivery) {
        PurposePolicy policy = policies.of(purpose);
        GateResult<Void> pre = checkPrecondition(policy, subject);
        if (!pre.isOk()) {
            return pre.propagate();
        }
        if (policy.pathFor(subject) == VerificationPath.SECONDARY_FACTOR) {
            return GateResult.ok(CodeRequest.notRequired());
        }

        // la session est écrite avant la livraison : un renvoi concurrent réutilise ce code
        IssuedCode issued = store.issueOrReuse(subject, purpose);
        log.info("Verification code {} for purpose={} subject={}", issued.isNew() ? "issued" : "reused", purpose, subject);

        if (!deliver(delivery, subject, issued.code(), purpose)) {
            log.warn("Code delivery failed for purpose={} subject={}", purpose, subject);
            return GateResult.fail(GateError.DELIVERY_FAILED, "Failed to send verification code");
        }
        return GateResult.ok(new CodeRequest(true, issued.isNew(), properties.getExpiryWindow().toSeconds()));
    }

    public GateResult<Void> confirmCode(String subject, VerificationPurpose purpose, String submittedCode) {
        PurposePolicy policy = policies.of(purpose);
        if (policy.pathFor(subject) != VerificationPath.CODE) {
            return GateResult.fail(GateError.PRECONDITION_FAILED, "No verification code is required for this action");
        }
        GateResult<Void> result = store.verify(subject, purpose, submittedCode);
        if (!result.isOk()) {
            return result.failWith(messageFor(result.getError()));
        }
        return result;
    }

    /**
     * Chemin sans code : le mot de passe actuel tient lieu de vérification.
     */
    public GateResult<Void> confirmSecondaryFactor(String subject, VerificationPurpose purpose, String secret) {
        PurposePolicy policy = policies.of(purpose);
        if (policy.pathFor(subject) != VerificationPath.SECONDARY_FACTOR) {
            return GateResult.fail(GateError.PRECONDITION_FAILED, "A verification code is required for this action");
        }
        if (!secondaryFactorCheck.check(subject, secret)) {
            return GateResult.fail(GateError.SECONDARY_FACTOR_FAILED, messageFor(GateError.SECONDARY_FACTOR_FAILED));
        }
        store.markVerified(subject, purpose);
        return GateResult.ok();
    }

    /**
     * Consomme la session puis exécute l'action une seule fois.
     * Le mot de passe final et le garde-fou de l'action ne sont évalués que sur une
     * session déjà vérifiée. Si la consommation échoue, l'action n'est jamais appelée. Un échec de l'action
     * ne réarme pas la session : il faut recommencer un cycle de vérification.
     */
    public <P, R> GateResult<R> execute(String subject,
                                        VerificationPurpose purpose,
                                        String secret,
                                        P payload,
                                        GatedAction<P, R> action) {
        PurposePolicy policy = policies.of(purpose);
        GateResult<Void> pre = checkPrecondition(policy, subject);
        if (!pre.isOk()) {
            return pre.propagate();
        }
        // le code passe avant le mot de passe : sans session vérifiée, aucun contrôle du secret
        GateResult<Void> ready = store.checkVerified(subject, purpose);
        if (!ready.isOk()) {
            return ready.failWith(messageFor(ready.getError()));
        }
        if (policy.isFinalSecretRequired() && !secondaryFactorCheck.check(subject, secret)) {
            return GateResult.fail(GateError.SECONDARY_FACTOR_FAILED, messageFor(GateError.SECONDARY_FACTOR_FAILED));
        }
        Optional<String> refusal = action.refuse(subject, payload);
        if (refusal.isPresent()) {
            return GateResult.fail(GateError.PRECONDITION_FAILED, refusal.get());
        }

        GateResult<Void> consumed = store.consume(subject, purpose);
        if (!consumed.isOk()) {
            return consumed.failWith(messageFor(consumed.getError()));
        }
        log.info("Verification consumed for purpose={} subject={}", purpose, subject);

        R result;
        try {
            result = action.perform(subject, payload);
        } catch (RuntimeException ex) {
            log.error("Gated action failed for purpose={} subject={}", purpose, subject, ex);
            return GateResult.fail(GateError.ACTION_FAILED, messageFor(GateError.ACTION_FAILED));
        }
        policy.getAfterSuccess().accept(subject);
        return GateResult.ok(result);
    }

    /** Annule la démarche en cours (changement d'état qui la rend caduque). */
    public void abandon(String subject, VerificationPurpose purpose) {
        store.discard(subject, purpose);
    }

    private GateResult<Void> checkPrecondition(PurposePolicy policy, String subject) {
        if (!policy.getPrecondition().test(subject)) {
            return GateResult.fail(GateError.PRECONDITION_FAILED, policy.getPreconditionMessage());
        }
        return GateResult.ok();
    }

    private static boolean deliver(CodeDelivery delivery, String destination, String code, VerificationPurpose purpose) {
        try {
            return delivery.deliver(destination, code, purpose);
        } catch (RuntimeException ex) {
            log.warn("Code delivery threw for purpose={} destination={}", purpose, destination, ex);
            return false;
        }
    }

    static String messageFor(GateError error) {
        return switch (error) {
            case NO_ACTIVE_SESSION -> "Verification failed or timed out";
            case EXPIRED -> "OTP has expired";
            case MISMATCH -> "Invalid OTP";
            case TOO_MANY_ATTEMPTS -> "Too many incorrect attempts. Please request a new code";
            case NOT_VERIFIED -> "Verification incomplete";
            case ALREADY_CONSUMED -> "This verification has already been used";
            case DELIVERY_FAILED -> "Failed to send verification code";
            case SECONDARY_FACTOR_FAILED -> "Incorrect password";
            case PRECONDITION_FAILED -> "Action not allowed";
            case ACTION_FAILED -> "Database error";
        };
    }
}
