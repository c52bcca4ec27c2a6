package org.propertyplus.gate;

import org.propertyplus.verification.VerificationPurpose;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

public class PurposePolicies {

    private final Map<VerificationPurpose, PurposePolicy> byPurpose = new EnumMap<>(VerificationPurpose.class);

    public PurposePolicies(Collection<PurposePolicy> policies) {
        for (PurposePolicy p : policies) {
            if (byPurpose.put(p.getPurpose(), p) != null) {
                throw new IllegalStateException("Duplicate policy for " + p.getPurpose());
            }
        }
        for (VerificationPurpose purpose : VerificationPurpose.values()) {
            if (!byPurpose.containsKey(purpose)) {
                throw new IllegalStateException("Missing policy for " + purpose);
            }
        }
    }

    public PurposePolicy of(VerificationPurpose purpose) {
        return byPurpose.get(purpose);
    }
}
