package org.propertyplus.verification;

public enum GateError {
    NO_ACTIVE_SESSION,
    EXPIRED,
    MISMATCH,
    TOO_MANY_ATTEMPTS,
    NOT_VERIFIED,
    ALREADY_CONSUMED,
    DELIVERY_FAILED,
    SECONDARY_FACTOR_FAILED,
    PRECONDITION_FAILED,
    ACTION_FAILED
}
