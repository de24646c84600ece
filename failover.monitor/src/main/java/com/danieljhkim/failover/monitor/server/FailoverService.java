package com.danieljhkim.failover.monitor.server;

import com.danieljhkim.failover.common.config.FailoverConfig;
import com.danieljhkim.failover.monitor.Candidate;
import com.danieljhkim.failover.monitor.Decider;
import com.danieljhkim.failover.monitor.FailoverDecider;
import com.danieljhkim.failover.monitor.Monitor;
import com.danieljhkim.failover.monitor.Performer;
import com.danieljhkim.failover.monitor.scheduler.ReCheckScheduler;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires a decider and its scheduler for a host process. The host supplies the collaborators that
 * talk to the real database, witness and transition scripts.
 */
public class FailoverService {
    private static final Logger logger = LoggerFactory.getLogger(FailoverService.class);

    private final FailoverConfig config;
    private final Candidate me;
    private final Candidate other;
    private final Monitor monitor;
    private final Performer performer;

    private Decider decider;
    private ReCheckScheduler scheduler;

    public FailoverService(FailoverConfig config, Candidate me, Candidate other, Monitor monitor, Performer performer) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.me = Objects.requireNonNull(me, "me cannot be null");
        this.other = Objects.requireNonNull(other, "other cannot be null");
        this.monitor = Objects.requireNonNull(monitor, "monitor cannot be null");
        this.performer = Objects.requireNonNull(performer, "performer cannot be null");
        warnOnIdMismatch("self", config.getSelf(), me);
        warnOnIdMismatch("peer", config.getPeer(), other);
    }

    /**
     * Blocks until the cluster view is established, then starts periodic re-checks.
     *
     * @throws com.danieljhkim.failover.common.exception.DeciderStartupException if startup fails
     */
    public synchronized Decider start() {
        if (decider != null) {
            throw new IllegalStateException("FailoverService already started");
        }
        // nothing may change roles until the scheduler settings are known to be usable
        if (config.getDecider().getCheckIntervalMs() <= 0) {
            throw new IllegalArgumentException("decider.checkIntervalMs must be positive");
        }
        logger.info("Starting failover decider for {} paired with {}", me.getId(), other.getId());
        Decider created = FailoverDecider.create(me, other, monitor, performer, config.getDecider());
        ReCheckScheduler createdScheduler = new ReCheckScheduler(created, config.getDecider());
        createdScheduler.start();
        decider = created;
        scheduler = createdScheduler;
        return decider;
    }

    public synchronized void shutdown() throws InterruptedException {
        if (scheduler != null) {
            scheduler.shutdown();
            scheduler = null;
        }
        logger.info("FailoverService stopped");
    }

    private static void warnOnIdMismatch(String label, FailoverConfig.NodeConfig node, Candidate candidate) {
        if (node != null && node.getId() != null && !node.getId().equals(candidate.getId())) {
            logger.warn("Configured {} id {} does not match candidate {}", label, node.getId(), candidate.getId());
        }
    }
}
