package com.danieljhkim.failover.common.exception;

/**
 * Thrown when the local node has been told to stop serving because it cannot establish a safe view
 * of the cluster: neither the peer nor the witness answered, or a backup that has not caught up
 * would otherwise be promoted. Callers should keep retrying on their normal cadence.
 */
public class ClusterUnavailableException extends FailoverException {

    private static final String DEFAULT_MESSAGE = "none of the nodes in the cluster are available";

    public ClusterUnavailableException(String nodeId) {
        super(DEFAULT_MESSAGE, nodeId);
    }

    public ClusterUnavailableException(String message, String nodeId) {
        super(message, nodeId);
    }

    public ClusterUnavailableException(String message, String nodeId, Throwable cause) {
        super(message, nodeId, cause);
    }
}
