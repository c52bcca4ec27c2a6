package org.propertyplus.verification;

import org.propertyplus.config.VerificationProperties;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Code numérique uniforme, zéros de tête compris (ex. "004217").
 */
@Component
public class RandomCodeGenerator implements CodeGenerator {

    private final SecureRandom random = new SecureRandom();
    private final int length;

    public RandomCodeGenerator(VerificationProperties properties) {
        this.length = properties.getCodeLength();
        if (length < 1 || length > 9) {
            throw new IllegalArgumentException("code length must be between 1 and 9, got " + length);
        }
    }

    @Override
    public String generate() {
        int bound = (int) Math.pow(10, length);
        return String.format("%0" + length + "d", random.nextInt(bound));
    }
}
