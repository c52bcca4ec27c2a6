package org.propertyplus.gate;

import lombok.extern.slf4j.Slf4j;
import org.propertyplus.config.VerificationProperties;
import org.propertyplus.service.MailService;
import org.propertyplus.verification.VerificationPurpose;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@ConditionalOnProperty(name = "app.verification.delivery", havingValue = "mail", matchIfMissing = true)
public class MailCodeDelivery implements CodeDelivery {

    @Autowired
    private MailService mailService;

    @Autowired
    private VerificationProperties properties;

    @Override
    public boolean deliver(String destination, String code, VerificationPurpose purpose) {
        try {
            mailService.send(destination, subjectFor(purpose), bodyFor(purpose, code));
            return true;
        } catch (MailException ex) {
            log.error("Verification mail failed for purpose={} destination={}", purpose, destination, ex);
            return false;
        }
    }

    static String subjectFor(VerificationPurpose purpose) {
        return switch (purpose) {
            case TWO_FACTOR_TOGGLE -> "2FA DISABLE - PropertyPlus";
            case ACCOUNT_DELETE -> "Account Deletion Code - PropertyPlus";
            case PASSWORD_RESET -> "Password Reset Code - PropertyPlus";
            default -> "Your Verification Code - PropertyPlus";
        };
    }

    String bodyFor(VerificationPurpose purpose, String code) {
        String intro = switch (purpose) {
            case SIGNUP_EMAIL -> "Use this code to verify your email address";
            case PASSWORD_RESET -> "Use this code to reset your password";
            case PASSWORD_CHANGE -> "Use this code to change your password";
            case TWO_FACTOR_TOGGLE -> "Use this code to disable two-factor authentication";
            case ACCOUNT_DELETE -> "Use this code to confirm the deletion of your account";
        };
        long minutes = properties.getExpiryWindow().toMinutes();
        return intro + ": " + code + "\n\n"
                + "This code expires in " + minutes + " minutes. "
                + "If you did not request it, you can ignore this email.";
    }
}
