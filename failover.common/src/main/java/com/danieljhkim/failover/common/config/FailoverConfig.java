package com.danieljhkim.failover.common.config;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class FailoverConfig {

    private NodeConfig self;
    private NodeConfig peer;
    private NodeConfig witness;
    private DeciderConfig decider = new DeciderConfig();

    @Override
    public String toString() {
        return "FailoverConfig{" + "self=" + self + ", peer=" + peer + ", witness=" + witness + ", decider=" + decider
                + '}';
    }

    @Setter
    @Getter
    public static class NodeConfig {
        private String id;
        private String host;
        private int port;

        public String address() {
            return host + ":" + port;
        }

        @Override
        public String toString() {
            return "NodeConfig{" + "id='" + id + '\'' + ", host='" + host + '\'' + ", port=" + port + '}';
        }
    }

    @Setter
    @Getter
    public static class DeciderConfig {
        private long checkIntervalMs = 5000;
        private long bootstrapRetryDelayMs = 1000;
        private boolean schedulerEnabled = true;

        @Override
        public String toString() {
            return "DeciderConfig{" + "checkIntervalMs="
                    + checkIntervalMs + ", bootstrapRetryDelayMs="
                    + bootstrapRetryDelayMs + ", schedulerEnabled="
                    + schedulerEnabled + '}';
        }
    }
}
