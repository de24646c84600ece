package com.danieljhkim.failover.common.exception;

/** Base exception for all failover domain exceptions. */
public abstract class FailoverException extends RuntimeException {

    private final String nodeId;

    protected FailoverException(String message) {
        super(message);
        this.nodeId = null;
    }

    protected FailoverException(String message, String nodeId) {
        super(message);
        this.nodeId = nodeId;
    }

    protected FailoverException(String message, Throwable cause) {
        super(message, cause);
        this.nodeId = null;
    }

    protected FailoverException(String message, String nodeId, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
    }

    /**
     * Returns the ID of the node that raised this exception, if any.
     */
    public String getNodeId() {
        return nodeId;
    }
}
