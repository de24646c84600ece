package com.danieljhkim.failover.monitor.scheduler;

import com.danieljhkim.failover.common.config.FailoverConfig;
import com.danieljhkim.failover.common.exception.ClusterUnavailableException;
import com.danieljhkim.failover.monitor.Decider;
import com.danieljhkim.failover.monitor.Decision;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Scheduler for running reconciliation passes at a fixed rate.
 * Manages its own ScheduledExecutorService and delegates to the Decider.
 */
@Slf4j
public class ReCheckScheduler {

    private final ScheduledExecutorService reCheckExecutor;
    private final Decider decider;
    private final long intervalMs;
    private final boolean enabled;

    public ReCheckScheduler(Decider decider, FailoverConfig.DeciderConfig config) {
        this.decider = decider;
        this.intervalMs = config.getCheckIntervalMs();
        this.enabled = config.isSchedulerEnabled();
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("checkIntervalMs must be positive");
        }
        this.reCheckExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "failover-recheck");
            t.setDaemon(true);
            return t;
        });
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void start() {
        if (!enabled) {
            log.info("Re-check scheduler is disabled.");
            return;
        }
        log.info("Starting re-check scheduler with interval {} ms", intervalMs);
        reCheckExecutor.scheduleAtFixedRate(this::reCheck, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    public void shutdown() throws InterruptedException {
        log.info("Shutting down re-check scheduler...");
        reCheckExecutor.shutdown();
        if (!reCheckExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
            log.warn("Re-check scheduler did not terminate in time; forcing shutdown");
            reCheckExecutor.shutdownNow();
        }
    }

    private void reCheck() {
        try {
            Decision decision = decider.reCheck();
            log.debug("Scheduled re-check finished: {}", decision);
        } catch (ClusterUnavailableException e) {
            log.warn("Scheduled re-check stopped the node: {}", e.getMessage());
        } catch (Exception e) {
            // an escaping exception would cancel the fixed-rate task
            log.error("Error during scheduled re-check", e);
        }
    }
}
