package org.propertyplus.service;

import lombok.extern.slf4j.Slf4j;
import org.propertyplus.model.Account;
import org.propertyplus.repo.AccountRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.mail.MailException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Mails d'information du compte. Un échec d'envoi est journalisé, jamais propagé :
 * l'action qui l'a déclenché est déjà faite.
 */
@Slf4j
@Service
public class NotificationService {

    static final DateTimeFormatter UPDATE_FORMAT = DateTimeFormatter.ofPattern("dd MMM yyyy, hh:mm a", Locale.ENGLISH);

    @Autowired
    private MailService mailService;

    @Autowired
    private AccountRepository accountRepo;

    public boolean sendWelcome(String email, String username) {
        return sendQuietly(email, "Welcome to the Family!",
                "Welcome to PropertyPlus, " + username + "!", "Welcome");
    }

    public boolean notifyPasswordUpdated(String email) {
        Account a = accountRepo.findByEmailIgnoreCase(email).orElse(null);
        if (a == null) {
            log.warn("Password update notice skipped, no account for {}", email);
            return false;
        }
        LocalDateTime when = a.getLastPasswordUpdate() != null ? a.getLastPasswordUpdate() : LocalDateTime.now();
        return sendQuietly(a.getEmail(), "Your Password Has Been Updated",
                "Hi " + a.getUsername() + ", your password was updated at " + UPDATE_FORMAT.format(when) + ".\n\n"
                        + "If this wasn't you, reset your password immediately.",
                "Password update");
    }

    public boolean sendAccountDeleted(String email, String username) {
        return sendQuietly(email, "Account Deleted - PropertyPlus",
                "Hello " + username + ", your account has been successfully deleted.", "Deletion");
    }

    private boolean sendQuietly(String to, String subject, String body, String kind) {
        try {
            mailService.send(to, subject, body);
            return true;
        } catch (MailException ex) {
            log.error("{} mail delivery failed for {}", kind, to, ex);
            return false;
        }
    }
}
