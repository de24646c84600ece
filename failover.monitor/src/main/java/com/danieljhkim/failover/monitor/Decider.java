package com.danieljhkim.failover.monitor;

import java.time.Duration;
import java.util.Optional;

/**
 * Keeps the local node's database role consistent with what the peer currently is.
 */
public interface Decider {

    /**
     * Runs {@link #reCheck()} at a fixed rate on the calling thread until it is interrupted.
     * Failures of individual passes are logged and otherwise ignored.
     *
     * @param interval time between passes, must be positive
     * @throws InterruptedException when the calling thread is interrupted
     */
    void loop(Duration interval) throws InterruptedException;

    /**
     * Runs one reconciliation pass: observe the peer, decide the local transition, apply it.
     *
     * @return what the pass did
     * @throws com.danieljhkim.failover.common.exception.ClusterUnavailableException if the local
     *     node was told to stop serving
     */
    Decision reCheck();

    /**
     * Makes the local node active without looking at the peer.
     */
    void promote();

    /**
     * Makes the local node a backup of the peer without looking at the peer.
     */
    void demote();

    /**
     * Returns the outcome of the most recent pass or override, if any has completed.
     */
    Optional<Decision> getLastDecision();
}
