package org.propertyplus.verification;

import org.propertyplus.config.VerificationProperties;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Machine à états commune aux implémentations du store.
 * Les sous-classes fournissent le stockage ({@link #load}, {@link #save}, {@link #remove})
 * et la section critique par clé ({@link #locked}).
 */
public abstract class AbstractVerificationSessionStore implements VerificationSessionStore {

    protected final Clock clock;
    protected final VerificationProperties properties;
    private final CodeGenerator codeGenerator;

    protected AbstractVerificationSessionStore(Clock clock, VerificationProperties properties, CodeGenerator codeGenerator) {
        this.clock = clock;
        this.properties = properties;
        this.codeGenerator = codeGenerator;
    }

    protected abstract Optional<VerificationSession> load(SessionKey key);

    protected abstract void save(VerificationSession session);

    protected abstract void remove(SessionKey key);

    protected abstract <T> T locked(SessionKey key, Supplier<T> work);

    @Override
    public IssuedCode issueOrReuse(String subject, VerificationPurpose purpose) {
        SessionKey key = SessionKey.of(subject, purpose);
        return locked(key, () -> {
            Instant now = clock.instant();
            Optional<VerificationSession> current = load(key).filter(s -> isReusable(s, now));
            if (current.isPresent()) {
                VerificationSession s = current.get();
                return new IssuedCode(s.getCode(), false, s.getIssuedAt());
            }
            VerificationSession fresh = VerificationSession.issued(key, codeGenerator.generate(), now);
            save(fresh);
            return new IssuedCode(fresh.getCode(), true, now);
        });
    }

    @Override
    public GateResult<Void> verify(String subject, VerificationPurpose purpose, String submittedCode) {
        SessionKey key = SessionKey.of(subject, purpose);
        return locked(key, () -> {
            Instant now = clock.instant();
            VerificationSession s = load(key)
                    .filter(VerificationSession::hasCode)
                    .filter(x -> !x.isConsumed())
                    .orElse(null);
            if (s == null) {
                return GateResult.fail(GateError.NO_ACTIVE_SESSION);
            }
            if (isExpired(s, now)) {
                return GateResult.fail(GateError.EXPIRED);
            }
            if (attemptsExhausted(s)) {
                return GateResult.fail(GateError.TOO_MANY_ATTEMPTS);
            }
            if (!matches(s.getCode(), submittedCode)) {
                save(s.toBuilder().failedAttempts(s.getFailedAttempts() + 1).build());
                return GateResult.fail(GateError.MISMATCH);
            }
            if (!s.isVerified()) {
                save(s.toBuilder().verifiedAt(now).build());
            }
            return GateResult.ok();
        });
    }

    @Override
    public void markVerified(String subject, VerificationPurpose purpose) {
        SessionKey key = SessionKey.of(subject, purpose);
        locked(key, () -> {
            save(VerificationSession.confirmedWithoutCode(key, clock.instant()));
            return null;
        });
    }

    @Override
    public GateResult<Void> checkVerified(String subject, VerificationPurpose purpose) {
        SessionKey key = SessionKey.of(subject, purpose);
        return locked(key, () -> readiness(load(key).orElse(null), clock.instant()));
    }

    @Override
    public GateResult<Void> consume(String subject, VerificationPurpose purpose) {
        SessionKey key = SessionKey.of(subject, purpose);
        return locked(key, () -> {
            Instant now = clock.instant();
            VerificationSession s = load(key).orElse(null);
            GateResult<Void> ready = readiness(s, now);
            if (!ready.isOk()) {
                return ready;
            }
            save(s.toBuilder().consumedAt(now).build());
            return GateResult.ok();
        });
    }

    @Override
    public void discard(String subject, VerificationPurpose purpose) {
        SessionKey key = SessionKey.of(subject, purpose);
        locked(key, () -> {
            remove(key);
            return null;
        });
    }

    @Override
    public void discardAll(String subject) {
        for (VerificationPurpose purpose : VerificationPurpose.values()) {
            discard(subject, purpose);
        }
    }

    // même ordre de contrôle pour checkVerified et consume
    private GateResult<Void> readiness(VerificationSession s, Instant now) {
        if (s == null) {
            return GateResult.fail(GateError.NO_ACTIVE_SESSION);
        }
        if (s.isConsumed()) {
            return GateResult.fail(GateError.ALREADY_CONSUMED);
        }
        if (!s.isVerified()) {
            return GateResult.fail(GateError.NOT_VERIFIED);
        }
        if (isExpired(s, now)) {
            return GateResult.fail(GateError.EXPIRED);
        }
        return GateResult.ok();
    }

    protected boolean isExpired(VerificationSession s, Instant now) {
        // now - issuedAt >= fenêtre d'expiration
        return !now.isBefore(s.getIssuedAt().plus(properties.getExpiryWindow()));
    }

    protected boolean isStale(VerificationSession s, Instant now) {
        return s.isConsumed() || isExpired(s, now);
    }

    private boolean isReusable(VerificationSession s, Instant now) {
        return s.hasCode()
                && !s.isConsumed()
                && !isExpired(s, now)
                && now.isBefore(s.getIssuedAt().plus(properties.getResendWindow()));
    }

    private boolean attemptsExhausted(VerificationSession s) {
        int max = properties.getMaxAttempts();
        return max > 0 && s.getFailedAttempts() >= max;
    }

    private static boolean matches(String expected, String submitted) {
        if (submitted == null) {
            return false;
        }
        String cleaned = StringUtils.trimAllWhitespace(submitted);
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                cleaned.getBytes(StandardCharsets.UTF_8));
    }
}
