package org.propertyplus.controller;

import jakarta.validation.Valid;
import org.propertyplus.dto.*;
import org.propertyplus.gate.CodeRequest;
import org.propertyplus.gate.GatedActionCoordinator;
import org.propertyplus.model.Account;
import org.propertyplus.security.JwtUtil;
import org.propertyplus.service.AccountActions;
import org.propertyplus.service.AccountService;
import org.propertyplus.verification.GateResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

import static org.propertyplus.verification.VerificationPurpose.PASSWORD_RESET;
import static org.propertyplus.verification.VerificationPurpose.SIGNUP_EMAIL;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

    @Autowired
    private GatedActionCoordinator gate;

    @Autowired
    private AccountService accountService;

    @Autowired
    private AccountActions actions;

    @Autowired
    private JwtUtil jwtUtil;

    // --- Inscription : code, vérification, création du compte ---
    @PostMapping("/signup/send-code")
    public ResponseEntity<?> sendSignupCode(@Valid @RequestBody EmailRequest req) {
        GateResult<CodeRequest> r = gate.requestCode(req.getEmail(), SIGNUP_EMAIL);
        if (!r.isOk()) {
            return GateResponses.failure(r);
        }
        return GateResponses.codeSent(r.getValue());
    }

    @PostMapping("/signup/verify")
    public ResponseEntity<?> verifySignupCode(@Valid @RequestBody EmailOtpRequest req) {
        GateResult<Void> r = gate.confirmCode(req.getEmail(), SIGNUP_EMAIL, req.getOtp());
        if (!r.isOk()) {
            return GateResponses.failure(r);
        }
        return ResponseEntity.ok(Map.of("message", "Email verified"));
    }

    @PostMapping("/register")
    public ResponseEntity<?> register(@Valid @RequestBody RegisterRequest req) {
        GateResult<Account> r = gate.execute(req.getEmail(), SIGNUP_EMAIL, null, req, actions.register());
        if (!r.isOk()) {
            return GateResponses.failure(r);
        }
        Account a = r.getValue();
        return ResponseEntity.ok(toAuthResponse(a));
    }

    @PostMapping("/check-username")
    public ResponseEntity<?> checkUsername(@RequestBody UsernameRequest req) {
        return ResponseEntity.ok(Map.of("exists", accountService.isUsernameTaken(req.getUsername())));
    }

    @PostMapping("/login")
    public ResponseEntity<?> login(@Valid @RequestBody LoginRequest req) {
        Account a = accountService.findByLogin(req.getLogin());
        if (a == null || !accountService.checkPassword(a, req.getPassword())) {
            return ResponseEntity.status(401).body(Map.of("error", "Invalid username or password"));
        }
        return ResponseEntity.ok(toAuthResponse(a));
    }

    // --- Mot de passe oublié ---
    @PostMapping("/forgot/send-code")
    public ResponseEntity<?> sendResetCode(@Valid @RequestBody EmailRequest req) {
        GateResult<CodeRequest> r = gate.requestCode(req.getEmail(), PASSWORD_RESET);
        if (!r.isOk()) {
            return GateResponses.failure(r);
        }
        return GateResponses.codeSent(r.getValue());
    }

    @PostMapping("/forgot/verify")
    public ResponseEntity<?> verifyResetCode(@Valid @RequestBody EmailOtpRequest req) {
        GateResult<Void> r = gate.confirmCode(req.getEmail(), PASSWORD_RESET, req.getOtp());
        if (!r.isOk()) {
            return GateResponses.failure(r);
        }
        return ResponseEntity.ok(Map.of("message", "Code verified"));
    }

    @PostMapping("/forgot/reset")
    public ResponseEntity<?> resetPassword(@Valid @RequestBody ResetPasswordRequest req) {
        GateResult<Account> r = gate.execute(req.getEmail(), PASSWORD_RESET, null,
                req.getNewPassword(), actions.resetPassword());
        if (!r.isOk()) {
            return GateResponses.failure(r);
        }
        return ResponseEntity.ok(Map.of("message", "Password updated successfully"));
    }

    private AuthResponse toAuthResponse(Account a) {
        String token = jwtUtil.generateToken(a.getEmail(), a.getRole());
        return new AuthResponse(token, a.getEmail(), a.getUsername(), a.getRole());
    }
}
