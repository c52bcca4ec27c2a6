package org.propertyplus.gate;

import org.propertyplus.service.AccountService;
import org.propertyplus.service.NotificationService;
import org.propertyplus.verification.VerificationSessionStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

import static org.propertyplus.verification.VerificationPurpose.*;

@Configuration
public class GatePolicyConfig {

    @Bean
    public PurposePolicies purposePolicies(RegistrationCheck registrations,
                                           AccountService accounts,
                                           NotificationService notifications,
                                           VerificationSessionStore store) {
        return new PurposePolicies(List.of(
                PurposePolicy.builder()
                        .purpose(SIGNUP_EMAIL)
                        .precondition(email -> !registrations.isRegistered(email))
                        .preconditionMessage("Email already registered")
                        .build(),
                PurposePolicy.builder()
                        .purpose(PASSWORD_RESET)
                        .precondition(registrations::isRegistered)
                        .preconditionMessage("Email not registered")
                        .afterSuccess(email -> {
                            store.discard(email, PASSWORD_CHANGE);
                            notifications.notifyPasswordUpdated(email);
                        })
                        .build(),
                PurposePolicy.builder()
                        .purpose(PASSWORD_CHANGE)
                        .precondition(registrations::isRegistered)
                        .preconditionMessage("Account not found")
                        // sans 2FA, le mot de passe actuel remplace le code
                        .path(email -> accounts.isTwoFactorEnabled(email)
                                ? VerificationPath.CODE
                                : VerificationPath.SECONDARY_FACTOR)
                        .afterSuccess(notifications::notifyPasswordUpdated)
                        .build(),
                PurposePolicy.builder()
                        .purpose(TWO_FACTOR_TOGGLE)
                        .precondition(registrations::isRegistered)
                        .preconditionMessage("Account not found")
                        .finalSecretRequired(true)
                        .afterSuccess(email -> store.discard(email, PASSWORD_CHANGE))
                        .build(),
                PurposePolicy.builder()
                        .purpose(ACCOUNT_DELETE)
                        .precondition(registrations::isRegistered)
                        .preconditionMessage("Account not found")
                        .finalSecretRequired(true)
                        .afterSuccess(store::discardAll)
                        .build()
        ));
    }
}
