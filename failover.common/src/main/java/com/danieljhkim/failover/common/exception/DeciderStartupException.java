package com.danieljhkim.failover.common.exception;

/**
 * Exception thrown when the decider cannot establish a view of the cluster it knows how to act on.
 * The host process must not start serving; whether to restart is its call.
 */
public class DeciderStartupException extends FailoverException {

    private static final String DEFAULT_MESSAGE = "failover decider could not start";

    public DeciderStartupException(String nodeId, Throwable cause) {
        super(DEFAULT_MESSAGE, nodeId, cause);
    }

    public DeciderStartupException(String message, String nodeId, Throwable cause) {
        super(message, nodeId, cause);
    }
}
