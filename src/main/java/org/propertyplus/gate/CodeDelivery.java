package org.propertyplus.gate;

import org.propertyplus.verification.VerificationPurpose;

/**
 * Transport d'un code vers sa destination (e-mail, SMS...).
 * Renvoie false en cas d'échec ; ne doit jamais toucher à l'état des sessions.
 */
@FunctionalInterface
public interface CodeDelivery {

    boolean deliver(String destination, String code, VerificationPurpose purpose);
}
