package com.danieljhkim.failover.common.constants;

/**
 * The role a node holds in the underlying replication topology, as reported by the database engine
 * itself.
 */
public enum NodeRole {
    INITIALIZED("initialized"),
    PRIMARY("primary"),
    SECONDARY("secondary");

    private final String value;

    NodeRole(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static NodeRole fromValue(String value) {
        if (value != null) {
            for (NodeRole role : values()) {
                if (role.value.equalsIgnoreCase(value.trim())) {
                    return role;
                }
            }
        }
        throw new IllegalArgumentException("Unknown node role: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
