package org.propertyplus.verification;

import org.springframework.stereotype.Component;

/**
 * Moniteur associé à une clé (sujet, purpose). Une même clé retombe toujours
 * sur le même moniteur ; deux clés peuvent en partager un.
 * Portée : le processus courant uniquement.
 */
@Component
public class KeyLocks {

    private static final int STRIPES = 128; // puissance de 2

    private final Object[] monitors = new Object[STRIPES];

    public KeyLocks() {
        for (int i = 0; i < STRIPES; i++) {
            monitors[i] = new Object();
        }
    }

    public Object of(SessionKey key) {
        int h = key.hashCode();
        // sujets proches (même domaine e-mail) : on mélange les bits hauts
        h ^= (h >>> 16);
        return monitors[h & (STRIPES - 1)];
    }
}
