package com.sharesgate.access;

import com.sharesgate.domain.GateDecision;

/**
 * Pushes a member permission change to the external community.
 */
public interface AccessNotifier {

    /**
     * @throws AccessNotifierException when the community rejects or cannot be reached
     */
    void apply(GateDecision decision);
}
