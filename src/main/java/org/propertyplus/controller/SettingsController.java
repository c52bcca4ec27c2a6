package org.propertyplus.controller;

import jakarta.validation.Valid;
import org.propertyplus.dto.ChangePasswordRequest;
import org.propertyplus.dto.OtpRequest;
import org.propertyplus.dto.PasswordRequest;
import org.propertyplus.dto.ProfileDetailsRequest;
import org.propertyplus.dto.TwoFactorRequest;
import org.propertyplus.gate.CodeRequest;
import org.propertyplus.gate.GatedActionCoordinator;
import org.propertyplus.gate.SecondaryFactorCheck;
import org.propertyplus.model.Account;
import org.propertyplus.service.AccountActions;
import org.propertyplus.service.AccountService;
import org.propertyplus.verification.GateResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.propertyplus.verification.VerificationPurpose.*;

/**
 * Actions sensibles du compte connecté. Le sujet des vérifications est toujours
 * l'e-mail authentifié, jamais une valeur du corps de requête.
 */
@RestController
@RequestMapping("/api/settings")
public class SettingsController {

    @Autowired
    private GatedActionCoordinator gate;

    @Autowired
    private AccountService accountService;

    @Autowired
    private AccountActions actions;

    @Autowired
    private SecondaryFactorCheck currentPassword;

    // --- Coordonnées du profil ---
    @PostMapping("/profile")
    public ResponseEntity<?> updateProfileDetails(@Valid @RequestBody ProfileDetailsRequest req, Authentication authentication) {
        String email = authentication.getName();
        if (!currentPassword.check(email, req.getPassword())) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Incorrect password",
                    "code", "SECONDARY_FACTOR_FAILED"));
        }
        Account a = accountService.updateProfileDetails(email, req.getContactNumber(), req.getCity(), req.getState());
        // champs vides renvoyés à null
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Profile updated successfully");
        body.put("contactNumber", a.getContactNumber());
        body.put("city", a.getCity());
        body.put("state", a.getState());
        return ResponseEntity.ok(body);
    }

    // --- Changement de mot de passe ---
    @PostMapping("/password/request")
    public ResponseEntity<?> requestPasswordChange(Authentication authentication) {
        GateResult<CodeRequest> r = gate.requestCode(authentication.getName(), PASSWORD_CHANGE);
        if (!r.isOk()) {
            return GateResponses.failure(r);
        }
        return GateResponses.codeSent(r.getValue());
    }

    @PostMapping("/password/verify-code")
    public ResponseEntity<?> verifyPasswordCode(@Valid @RequestBody OtpRequest req, Authentication authentication) {
        GateResult<Void> r = gate.confirmCode(authentication.getName(), PASSWORD_CHANGE, req.getOtp());
        if (!r.isOk()) {
            return GateResponses.failure(r);
        }
        return ResponseEntity.ok(Map.of("message", "Code verified"));
    }

    @PostMapping("/password/verify-current")
    public ResponseEntity<?> verifyCurrentPassword(@Valid @RequestBody PasswordRequest req, Authentication authentication) {
        GateResult<Void> r = gate.confirmSecondaryFactor(authentication.getName(), PASSWORD_CHANGE, req.getPassword());
        if (!r.isOk()) {
            return GateResponses.failure(r);
        }
        return ResponseEntity.ok(Map.of("message", "Password verified"));
    }

    @PostMapping("/password/finalize")
    public ResponseEntity<?> finalizePasswordChange(@Valid @RequestBody ChangePasswordRequest req, Authentication authentication) {
        String email = authentication.getName();
        // code fourni avec la finalisation : vérifié ici plutôt qu'en étape séparée
        if (req.getOtp() != null && !req.getOtp().isBlank()) {
            GateResult<Void> verified = gate.confirmCode(email, PASSWORD_CHANGE, req.getOtp());
            if (!verified.isOk()) {
                return GateResponses.failure(verified);
            }
        }
        GateResult<Account> r = gate.execute(email, PASSWORD_CHANGE, null, req.getNewPassword(), actions.changePassword());
        if (!r.isOk()) {
            return GateResponses.failure(r);
        }
        return ResponseEntity.ok(Map.of(
                "message", "Password changed successfully",
                "lastPasswordUpdate", String.valueOf(r.getValue().getLastPasswordUpdate())));
    }

    // --- Double authentification ---
    @PostMapping("/two-factor/request")
    public ResponseEntity<?> requestTwoFactorDisable(Authentication authentication) {
        String email = authentication.getName();
        if (!accountService.isTwoFactorEnabled(email)) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Two-factor authentication is already disabled",
                    "code", "PRECONDITION_FAILED"));
        }
        GateResult<CodeRequest> r = gate.requestCode(email, TWO_FACTOR_TOGGLE);
        if (!r.isOk()) {
            return GateResponses.failure(r);
        }
        return GateResponses.codeSent(r.getValue());
    }

    @PostMapping("/two-factor/verify-code")
    public ResponseEntity<?> verifyTwoFactorCode(@Valid @RequestBody OtpRequest req, Authentication authentication) {
        GateResult<Void> r = gate.confirmCode(authentication.getName(), TWO_FACTOR_TOGGLE, req.getOtp());
        if (!r.isOk()) {
            return GateResponses.failure(r);
        }
        return ResponseEntity.ok(Map.of("message", "Code verified"));
    }

    @PostMapping("/two-factor/finalize")
    public ResponseEntity<?> finalizeTwoFactor(@Valid @RequestBody TwoFactorRequest req, Authentication authentication) {
        String email = authentication.getName();
        if (Boolean.TRUE.equals(req.getEnabled())) {
            // activer ne demande que le mot de passe
            if (!accountService.passwordMatches(email, req.getPassword())) {
                return ResponseEntity.badRequest().body(Map.of(
                        "error", "Incorrect password",
                        "code", "SECONDARY_FACTOR_FAILED"));
            }
            accountService.setTwoFactor(email, true);
            gate.abandon(email, PASSWORD_CHANGE);
            return ResponseEntity.ok(Map.of("enabled", true, "message", "Two-factor authentication enabled"));
        }
        GateResult<Account> r = gate.execute(email, TWO_FACTOR_TOGGLE, req.getPassword(), false, actions.setTwoFactor());
        if (!r.isOk()) {
            return GateResponses.failure(r);
        }
        return ResponseEntity.ok(Map.of("enabled", false, "message", "Two-factor authentication disabled"));
    }

    // --- Suppression du compte ---
    @PostMapping("/delete/request")
    public ResponseEntity<?> requestDeletion(Authentication authentication) {
        GateResult<CodeRequest> r = gate.requestCode(authentication.getName(), ACCOUNT_DELETE);
        if (!r.isOk()) {
            return GateResponses.failure(r);
        }
        return GateResponses.codeSent(r.getValue());
    }

    @PostMapping("/delete/verify-code")
    public ResponseEntity<?> verifyDeletionCode(@Valid @RequestBody OtpRequest req, Authentication authentication) {
        GateResult<Void> r = gate.confirmCode(authentication.getName(), ACCOUNT_DELETE, req.getOtp());
        if (!r.isOk()) {
            return GateResponses.failure(r);
        }
        return ResponseEntity.ok(Map.of("message", "Code verified"));
    }

    @PostMapping("/delete/finalize")
    public ResponseEntity<?> finalizeDeletion(@Valid @RequestBody PasswordRequest req, Authentication authentication) {
        GateResult<Account> r = gate.execute(authentication.getName(), ACCOUNT_DELETE, req.getPassword(), null, actions.deleteAccount());
        if (!r.isOk()) {
            return GateResponses.failure(r);
        }
        return ResponseEntity.ok(Map.of("message", "Account deleted"));
    }
}
