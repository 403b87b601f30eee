package com.partsbin.core.match;

import com.partsbin.core.model.ComponentIdentity;
import com.partsbin.core.model.ComponentSpec;

import java.util.Objects;

/**
 * An identity the matcher may select, with the usage count used for tie breaks.
 */
public record MatchCandidate(ComponentIdentity identity, int usageCount) {

    public MatchCandidate {
        Objects.requireNonNull(identity, "identity");
    }

    public static MatchCandidate of(ComponentIdentity identity) {
        return new MatchCandidate(identity, 0);
    }

    public static MatchCandidate of(ComponentSpec spec) {
        return new MatchCandidate(spec.identity(), spec.usageCount());
    }
}
