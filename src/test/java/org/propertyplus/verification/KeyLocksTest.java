package org.propertyplus.verification;

import org.junit.jupiter.api.Test;

import java.util.IdentityHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.propertyplus.verification.VerificationPurpose.*;

class KeyLocksTest {

    private final KeyLocks locks = new KeyLocks();

    @Test
    void of_shouldReturnSameMonitor_forEquivalentSubjects() {
        Object a = locks.of(SessionKey.of("John@Example.com", ACCOUNT_DELETE));
        Object b = locks.of(SessionKey.of("  john@example.com ", ACCOUNT_DELETE));

        assertThat(a).isSameAs(b);
    }

    @Test
    void of_shouldSpreadSimilarSubjectsOverSeveralMonitors() {
        Map<Object, Boolean> seen = new IdentityHashMap<>();
        for (int i = 0; i < 500; i++) {
            seen.put(locks.of(SessionKey.of("user" + i + "@example.com", SIGNUP_EMAIL)), true);
        }

        assertThat(seen.size()).isGreaterThan(64);
    }
}
