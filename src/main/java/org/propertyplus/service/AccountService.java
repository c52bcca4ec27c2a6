package org.propertyplus.service;

import org.propertyplus.dto.RegisterRequest;
import org.propertyplus.gate.RegistrationCheck;
import org.propertyplus.model.Account;
import org.propertyplus.repo.AccountRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Locale;

@Service
public class AccountService implements RegistrationCheck {
    @Autowired
    private AccountRepository accountRepo;
    private final BCryptPasswordEncoder passwordEncoder = new BCryptPasswordEncoder();

    @Transactional
    public Account register(String verifiedEmail, RegisterRequest req) {
        Account a = Account.builder()
                .email(normalize(verifiedEmail))
                .username(req.getUsername().trim())
                .passwordHash(passwordEncoder.encode(req.getPassword()))
                .fullName(req.getFullName())
                .contactNumber(req.getContactNumber())
                .role(req.getRole() != null ? req.getRole() : "Buyer")
                .twoFactorEnabled(true)
                .createdAt(LocalDateTime.now())
                .build();
        return accountRepo.save(a);
    }

    public Account findByEmail(String email) {
        if (email == null) return null;
        return accountRepo.findByEmailIgnoreCase(email.trim()).orElse(null);
    }

    // connexion par nom d'utilisateur ou par e-mail
    public Account findByLogin(String login) {
        if (login == null) return null;
        return accountRepo.findByUsername(login.trim())
                .orElseGet(() -> findByEmail(login));
    }

    @Override
    public boolean isRegistered(String email) {
        return email != null && accountRepo.existsByEmailIgnoreCase(email.trim());
    }

    public boolean isUsernameTaken(String username) {
        return username != null && accountRepo.existsByUsername(username.trim());
    }

    public boolean checkPassword(Account account, String rawPassword) {
        return rawPassword != null && passwordEncoder.matches(rawPassword, account.getPasswordHash());
    }

    public boolean passwordMatches(String email, String rawPassword) {
        Account a = findByEmail(email);
        return a != null && checkPassword(a, rawPassword);
    }

    public boolean isTwoFactorEnabled(String email) {
        Account a = findByEmail(email);
        return a != null && a.isTwoFactorEnabled();
    }

    @Transactional
    public Account updatePassword(String email, String newPassword) {
        Account a = accountRepo.findByEmailIgnoreCase(email)
                .orElseThrow(() -> new IllegalArgumentException("Account not found"));
        a.setPasswordHash(passwordEncoder.encode(newPassword));
        a.setLastPasswordUpdate(LocalDateTime.now());
        return accountRepo.save(a);
    }

    @Transactional
    public Account setTwoFactor(String email, boolean enabled) {
        Account a = accountRepo.findByEmailIgnoreCase(email)
                .orElseThrow(() -> new IllegalArgumentException("Account not found"));
        a.setTwoFactorEnabled(enabled);
        return accountRepo.save(a);
    }

    // coordonnées modifiables après confirmation du mot de passe
    @Transactional
    public Account updateProfileDetails(String email, String contactNumber, String city, String state) {
        Account a = accountRepo.findByEmailIgnoreCase(email)
                .orElseThrow(() -> new IllegalArgumentException("Account not found"));
        a.setContactNumber(trimToNull(contactNumber));
        a.setCity(trimToNull(city));
        a.setState(trimToNull(state));
        return accountRepo.save(a);
    }

    // les annonces, leads et favoris du compte relèvent du service des annonces
    @Transactional
    public Account delete(String email) {
        Account a = accountRepo.findByEmailIgnoreCase(email)
                .orElseThrow(() -> new IllegalArgumentException("Account not found"));
        accountRepo.delete(a);
        return a;
    }

    private static String trimToNull(String value) {
        if (value == null) return null;
        String t = value.trim();
        return t.isEmpty() ? null : t;
    }

    private static String normalize(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
