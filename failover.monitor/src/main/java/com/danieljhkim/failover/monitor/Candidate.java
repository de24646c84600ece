package com.danieljhkim.failover.monitor;

import com.danieljhkim.failover.common.constants.DbRole;

/**
 * One data node of the pair. Implementations report failures as unchecked exceptions, typically
 * {@link com.danieljhkim.failover.common.exception.NodeOperationException}.
 */
public interface Candidate extends Monitor {

    /** Identifier used in log lines and exceptions. */
    String getId();

    DbRole getDbRole();

    void setDbRole(DbRole role);

    /**
     * Returns true if this node has replayed everything the previous active node wrote.
     */
    boolean hasSynced();
}
