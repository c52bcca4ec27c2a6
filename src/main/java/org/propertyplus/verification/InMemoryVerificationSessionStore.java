package org.propertyplus.verification;

import org.propertyplus.config.VerificationProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Store en mémoire du processus (une instance applicative).
 */
@Component
@ConditionalOnProperty(name = "app.verification.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryVerificationSessionStore extends AbstractVerificationSessionStore {

    private final Map<SessionKey, VerificationSession> sessions = new ConcurrentHashMap<>();
    private final KeyLocks locks;

    public InMemoryVerificationSessionStore(Clock clock,
                                            VerificationProperties properties,
                                            CodeGenerator codeGenerator,
                                            KeyLocks locks) {
        super(clock, properties, codeGenerator);
        this.locks = locks;
    }

    @Override
    protected Optional<VerificationSession> load(SessionKey key) {
        return Optional.ofNullable(sessions.get(key));
    }

    @Override
    protected void save(VerificationSession session) {
        sessions.put(session.getKey(), session);
    }

    @Override
    protected void remove(SessionKey key) {
        sessions.remove(key);
    }

    @Override
    protected <T> T locked(SessionKey key, Supplier<T> work) {
        synchronized (locks.of(key)) {
            return work.get();
        }
    }

    @Override
    public int purgeExpired() {
        int removed = 0;
        for (SessionKey key : sessions.keySet()) {
            boolean gone = locked(key, () -> {
                Instant now = clock.instant();
                VerificationSession s = sessions.get(key);
                if (s != null && isStale(s, now)) {
                    sessions.remove(key);
                    return true;
                }
                return false;
            });
            if (gone) removed++;
        }
        return removed;
    }

    int size() {
        return sessions.size();
    }
}
