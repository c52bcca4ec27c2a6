package org.propertyplus.service;

import org.propertyplus.dto.RegisterRequest;
import org.propertyplus.gate.GatedAction;
import org.propertyplus.model.Account;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Actions de compte passées au coordinateur, une par purpose.
 */
@Component
public class AccountActions {

    @Autowired
    private AccountService accountService;

    @Autowired
    private NotificationService notifications;

    public GatedAction<RegisterRequest, Account> register() {
        return new GatedAction<>() {
            @Override
            public Account perform(String verifiedEmail, RegisterRequest req) {
                Account a = accountService.register(verifiedEmail, req);
                notifications.sendWelcome(a.getEmail(), a.getUsername());
                return a;
            }

            @Override
            public Optional<String> refuse(String verifiedEmail, RegisterRequest req) {
                if (accountService.isUsernameTaken(req.getUsername())) {
                    return Optional.of("Username already taken");
                }
                return Optional.empty();
            }
        };
    }

    public GatedAction<String, Account> resetPassword() {
        return (email, newPassword) -> accountService.updatePassword(email, newPassword);
    }

    public GatedAction<String, Account> changePassword() {
        return new GatedAction<>() {
            @Override
            public Account perform(String email, String newPassword) {
                return accountService.updatePassword(email, newPassword);
            }

            @Override
            public Optional<String> refuse(String email, String newPassword) {
                if (accountService.passwordMatches(email, newPassword)) {
                    return Optional.of("New password cannot be the same as your old password");
                }
                return Optional.empty();
            }
        };
    }

    public GatedAction<Boolean, Account> setTwoFactor() {
        return (email, enabled) -> accountService.setTwoFactor(email, enabled);
    }

    public GatedAction<Void, Account> deleteAccount() {
        return (email, ignored) -> {
            Account gone = accountService.delete(email);
            notifications.sendAccountDeleted(gone.getEmail(), gone.getUsername());
            return gone;
        };
    }
}
