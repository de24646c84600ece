package com.danieljhkim.failover.monitor;

/**
 * Carries out the physical side of a role change: replication, proxies, and so on. Calls are fire
 * and forget; the decider does not observe their outcome.
 */
public interface Performer {

    void transitionToActive(Candidate self);

    void transitionToBackupOf(Candidate self, Candidate active);

    void transitionToSingle(Candidate self);

    /** Stops serving entirely. */
    void stop();
}
