package org.propertyplus.controller;

import org.propertyplus.gate.CodeRequest;
import org.propertyplus.verification.GateResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

/**
 * Traduction HTTP des résultats du coordinateur : {"error": message, "code": GateError}.
 */
final class GateResponses {

    private GateResponses() {
    }

    static ResponseEntity<?> failure(GateResult<?> result) {
        HttpStatus status = switch (result.getError()) {
            case DELIVERY_FAILED -> HttpStatus.SERVICE_UNAVAILABLE;
            case ACTION_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
            default -> HttpStatus.BAD_REQUEST;
        };
        String message = result.getMessage() != null ? result.getMessage() : result.getError().name();
        return ResponseEntity.status(status).body(Map.of(
                "error", message,
                "code", result.getError().name()));
    }

    static ResponseEntity<?> codeSent(CodeRequest request) {
        if (!request.codeRequired()) {
            return ResponseEntity.ok(Map.of(
                    "otpRequired", false,
                    "message", "Confirm your current password to continue"));
        }
        return ResponseEntity.ok(Map.of(
                "otpRequired", true,
                "newCode", request.newCode(),
                "expiresIn", request.expiresInSeconds(),
                "message", "Verification code sent"));
    }
}
