package org.propertyplus.gate;

import lombok.extern.slf4j.Slf4j;
import org.propertyplus.verification.VerificationPurpose;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Livraison de développement : le code est seulement écrit dans les logs.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.verification.delivery", havingValue = "log")
public class LoggingCodeDelivery implements CodeDelivery {

    @Override
    public boolean deliver(String destination, String code, VerificationPurpose purpose) {
        log.info("Verification code purpose={} destination={} code={}", purpose, destination, code);
        return true;
    }
}
