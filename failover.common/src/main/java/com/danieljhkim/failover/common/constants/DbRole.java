package com.danieljhkim.failover.common.constants;

/**
 * The role the failover layer assigns to a node. Proxies and replication honor this role, not the
 * replication topology's own primary/secondary designation.
 */
public enum DbRole {
    /** No role assigned yet; the node is still coming up. */
    INITIALIZED("initialized"),
    /** Serving writes with no replica behind it. */
    SINGLE("single"),
    /** Serving writes while the peer replicates from it. */
    ACTIVE("active"),
    /** Replicating from the active peer. */
    BACKUP("backup"),
    /** Terminal or unhealthy. Only ever reported for the peer. */
    DEAD("dead");

    private final String value;

    DbRole(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /** Returns true if a node in this role accepts writes. */
    public boolean isWritable() {
        return this == SINGLE || this == ACTIVE;
    }

    /**
     * Parses the lowercase wire value used by databases and witnesses.
     *
     * @throws IllegalArgumentException if the value names no role
     */
    public static DbRole fromValue(String value) {
        if (value != null) {
            for (DbRole role : values()) {
                if (role.value.equalsIgnoreCase(value.trim())) {
                    return role;
                }
            }
        }
        throw new IllegalArgumentException("Unknown database role: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
