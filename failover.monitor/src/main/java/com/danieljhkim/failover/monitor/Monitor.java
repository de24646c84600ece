package com.danieljhkim.failover.monitor;

import com.danieljhkim.failover.common.constants.NodeRole;

/**
 * A cluster participant the decider can wait on and ask about. The witness implements only this;
 * data nodes implement it through {@link Candidate}.
 */
public interface Monitor {

    /**
     * Returns the role this participant holds in the replication topology.
     */
    NodeRole getRole();

    /**
     * Re-resolves the given candidate through the witness, returning a reference that may be
     * reachable when the original is not.
     */
    Candidate bounce(Candidate candidate);

    /**
     * Blocks until this participant is usable.
     */
    void ready() throws InterruptedException;
}
