package com.danieljhkim.failover.common.exception;

/**
 * Exception thrown when a call against a cluster member fails, e.g. reading or writing its role.
 */
public class NodeOperationException extends FailoverException {

    public NodeOperationException(String message) {
        super(message);
    }

    public NodeOperationException(String message, String nodeId) {
        super(message, nodeId);
    }

    public NodeOperationException(String message, String nodeId, Throwable cause) {
        super(message, nodeId, cause);
    }
}
