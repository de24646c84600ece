package com.danieljhkim.failover.monitor;

/**
 * Outcome of one reconciliation pass or manual override.
 */
public enum Decision {
    BECAME_ACTIVE,
    BECAME_BACKUP,
    BECAME_SINGLE,
    /** Nothing to do: a lone single node, or both nodes still initializing. */
    NO_CHANGE,
    /** The performer was told to stop serving. */
    STOPPED
}
