package org.propertyplus.task;

import lombok.extern.slf4j.Slf4j;
import org.propertyplus.verification.VerificationSessionStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class VerificationSessionPurgeTask {
    @Autowired
    private VerificationSessionStore store;

    // sessions expirées ou déjà consommées, toutes les 10 minutes par défaut
    @Scheduled(fixedDelayString = "${app.verification.purge-interval:PT10M}")
    public void purge() {
        int removed = store.purgeExpired();
        if (removed > 0) {
            log.info("Purged {} stale verification session(s)", removed);
        }
    }
}
