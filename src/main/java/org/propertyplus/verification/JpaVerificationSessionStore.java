package org.propertyplus.verification;

import org.propertyplus.config.VerificationProperties;
import org.propertyplus.model.VerificationSessionEntity;
import org.propertyplus.repo.VerificationSessionRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Store partagé en base : une ligne par (sujet, purpose).
 * <p>
 * Chaque opération tourne dans sa propre transaction, ouverte et validée à l'intérieur
 * du verrou de stripe. Entre instances, une ligne existante est verrouillée par la lecture
 * PESSIMISTIC_WRITE ; une ligne absente ne peut pas l'être, c'est alors la contrainte
 * unique (subject, purpose) qui départage deux insertions : la perdante rejoue l'opération
 * une fois, sur la ligne désormais présente.
 */
@Component
@ConditionalOnProperty(name = "app.verification.store", havingValue = "jpa")
public class JpaVerificationSessionStore extends AbstractVerificationSessionStore {

    private final VerificationSessionRepository repo;
    private final TransactionTemplate tx;
    private final KeyLocks locks;

    public JpaVerificationSessionStore(Clock clock,
                                       VerificationProperties properties,
                                       CodeGenerator codeGenerator,
                                       KeyLocks locks,
                                       VerificationSessionRepository repo,
                                       PlatformTransactionManager transactionManager) {
        super(clock, properties, codeGenerator);
        this.repo = repo;
        this.locks = locks;
        this.tx = new TransactionTemplate(transactionManager);
    }

    @Override
    protected Optional<VerificationSession> load(SessionKey key) {
        return repo.findForUpdate(key.subject(), key.purpose()).map(e -> toSession(key, e));
    }

    @Override
    protected void save(VerificationSession session) {
        SessionKey key = session.getKey();
        // mise à jour en place : pas de delete + insert sur la contrainte unique
        VerificationSessionEntity e = repo.findForUpdate(key.subject(), key.purpose())
                .orElseGet(() -> VerificationSessionEntity.builder()
                        .subject(key.subject())
                        .purpose(key.purpose())
                        .build());
        e.setCode(session.getCode());
        e.setIssuedAt(session.getIssuedAt());
        e.setVerifiedAt(session.getVerifiedAt());
        e.setConsumedAt(session.getConsumedAt());
        e.setFailedAttempts(session.getFailedAttempts());
        repo.save(e);
    }

    @Override
    protected void remove(SessionKey key) {
        repo.deleteBySubjectAndPurpose(key.subject(), key.purpose());
    }

    @Override
    protected <T> T locked(SessionKey key, Supplier<T> work) {
        synchronized (locks.of(key)) {
            try {
                return tx.execute(status -> work.get());
            } catch (DataIntegrityViolationException e) {
                // ligne insérée entre-temps par une autre instance
                return tx.execute(status -> work.get());
            }
        }
    }

    @Override
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(properties.getExpiryWindow());
        Integer removed = tx.execute(status -> repo.deleteStale(cutoff));
        return removed != null ? removed : 0;
    }

    private static VerificationSession toSession(SessionKey key, VerificationSessionEntity e) {
        return VerificationSession.builder()
                .key(key)
                .code(e.getCode())
                .issuedAt(e.getIssuedAt())
                .verifiedAt(e.getVerifiedAt())
                .consumedAt(e.getConsumedAt())
                .failedAttempts(e.getFailedAttempts())
                .build();
    }
}
