package org.propertyplus.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.verification")
public class VerificationProperties {

    private int codeLength = 6;

    // pendant cette fenêtre, une nouvelle demande renvoie le même code
    private Duration resendWindow = Duration.ofSeconds(60);

    private Duration expiryWindow = Duration.ofMinutes(10);

    // 0 = essais illimités jusqu'à expiration
    private int maxAttempts = 0;

    private Duration purgeInterval = Duration.ofMinutes(10);

    /** memory | jpa */
    private String store = "memory";

    /** mail | log */
    private String delivery = "mail";
}
