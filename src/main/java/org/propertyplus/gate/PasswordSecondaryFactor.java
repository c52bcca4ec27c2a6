package org.propertyplus.gate;

import org.propertyplus.service.AccountService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

// mot de passe actuel comparé au hash BCrypt du compte
@Component
public class PasswordSecondaryFactor implements SecondaryFactorCheck {

    @Autowired
    private AccountService accountService;

    @Override
    public boolean check(String subject, String presentedSecret) {
        return accountService.passwordMatches(subject, presentedSecret);
    }
}
