package com.danieljhkim.failover.monitor;

import com.danieljhkim.failover.common.config.FailoverConfig;
import com.danieljhkim.failover.common.constants.DbRole;
import com.danieljhkim.failover.common.constants.NodeRole;
import com.danieljhkim.failover.common.exception.ClusterUnavailableException;
import com.danieljhkim.failover.common.exception.DeciderStartupException;
import com.danieljhkim.failover.common.exception.NodeOperationException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives the local node's database role from what the peer reports.
 *
 * <p>Every action is a reaction to the peer's current role, never an independent claim, so the two
 * nodes cannot promote themselves at the same time without having seen each other. When the peer
 * cannot be observed, directly or through the witness, the local node keeps serving only if it is
 * already {@link DbRole#SINGLE}; otherwise it is stopped.
 *
 * <p>Thread-safety: passes and manual overrides hold one lock for the whole read, decide and act
 * sequence, including the collaborator calls.
 */
@Slf4j
public class FailoverDecider implements Decider {

    private final Candidate me;
    private final Candidate other;
    private final Monitor monitor;
    private final Performer performer;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicReference<Decision> lastDecision = new AtomicReference<>();

    FailoverDecider(Candidate me, Candidate other, Monitor monitor, Performer performer) {
        this.me = Objects.requireNonNull(me, "me cannot be null");
        this.other = Objects.requireNonNull(other, "other cannot be null");
        this.monitor = Objects.requireNonNull(monitor, "monitor cannot be null");
        this.performer = Objects.requireNonNull(performer, "performer cannot be null");
    }

    /**
     * Creates a decider and blocks until it has a view of the cluster it can act on.
     *
     * <p>Waits for the peer and the witness to be ready and runs a pass, over and over, for as long
     * as the pass ends in {@link ClusterUnavailableException}. Any other failure aborts startup.
     *
     * @param retryDelay pause between attempts, may be zero
     * @throws DeciderStartupException if a pass fails for another reason or the thread is interrupted
     */
    public static FailoverDecider create(
            Candidate me, Candidate other, Monitor monitor, Performer performer, Duration retryDelay) {
        Objects.requireNonNull(retryDelay, "retryDelay cannot be null");
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must not be negative");
        }
        FailoverDecider decider = new FailoverDecider(me, other, monitor, performer);
        decider.bootstrap(retryDelay);
        return decider;
    }

    public static FailoverDecider create(
            Candidate me,
            Candidate other,
            Monitor monitor,
            Performer performer,
            FailoverConfig.DeciderConfig config) {
        return create(me, other, monitor, performer, Duration.ofMillis(config.getBootstrapRetryDelayMs()));
    }

    private void bootstrap(Duration retryDelay) {
        for (int attempt = 1; ; attempt++) {
            try {
                other.ready();
                monitor.ready();
                Decision decision = reCheck();
                log.info("[{}] Cluster view established after {} attempt(s): {}", me.getId(), attempt, decision);
                return;
            } catch (ClusterUnavailableException e) {
                log.warn("[{}] Cluster unavailable on startup attempt {}, retrying", me.getId(), attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DeciderStartupException("interrupted while waiting for the cluster", me.getId(), e);
            } catch (RuntimeException e) {
                log.error("[{}] Unrecoverable error on startup attempt {}", me.getId(), attempt, e);
                throw new DeciderStartupException(me.getId(), e);
            }
            pause(retryDelay);
        }
    }

    private void pause(Duration retryDelay) {
        if (retryDelay.isZero()) {
            return;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(retryDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeciderStartupException("interrupted while waiting for the cluster", me.getId(), e);
        }
    }

    @Override
    public void loop(Duration interval) throws InterruptedException {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        long intervalNanos = interval.toNanos();
        long next = System.nanoTime() + intervalNanos;
        while (true) {
            if (Thread.interrupted()) {
                throw new InterruptedException();
            }
            long wait = next - System.nanoTime();
            if (wait > 0) {
                TimeUnit.NANOSECONDS.sleep(wait);
                next += intervalNanos;
            } else {
                // fell behind; drop the missed ticks
                next = System.nanoTime() + intervalNanos;
            }
            tick();
        }
    }

    private void tick() {
        try {
            reCheck();
        } catch (ClusterUnavailableException e) {
            log.warn("[{}] {}", me.getId(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] Reconciliation pass failed", me.getId(), e);
        }
    }

    @Override
    public Decision reCheck() {
        lock.lock();
        try {
            Decision decision = decide();
            lastDecision.set(decision);
            return decision;
        } catch (ClusterUnavailableException e) {
            lastDecision.set(Decision.STOPPED);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void promote() {
        lock.lock();
        try {
            log.info("[{}] Manual promotion requested", me.getId());
            lastDecision.set(becomeActive());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void demote() {
        lock.lock();
        try {
            log.info("[{}] Manual demotion requested", me.getId());
            lastDecision.set(becomeBackup());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Decision> getLastDecision() {
        return Optional.ofNullable(lastDecision.get());
    }

    private Decision decide() {
        Optional<DbRole> observed = observePeer();
        if (observed.isEmpty()) {
            return onPeerUnreachable();
        }
        DbRole otherRole = observed.get();
        log.debug("[{}] Peer {} reports {}", me.getId(), other.getId(), otherRole);

        return switch (otherRole) {
            case SINGLE, ACTIVE -> becomeBackup();
            case DEAD -> onPeerDead();
            case INITIALIZED -> onPeerInitialized();
            case BACKUP -> becomeActive();
        };
    }

    /**
     * Reads the peer's role directly, then through the witness. Empty if both fail.
     */
    private Optional<DbRole> observePeer() {
        try {
            return Optional.of(readDbRole(other));
        } catch (RuntimeException e) {
            log.debug("[{}] Direct read of {} failed: {}", me.getId(), other.getId(), e.getMessage());
        }
        try {
            Candidate bounced = monitor.bounce(other);
            if (bounced == null) {
                log.warn("[{}] Witness could not resolve {}", me.getId(), other.getId());
                return Optional.empty();
            }
            return Optional.of(readDbRole(bounced));
        } catch (RuntimeException e) {
            log.warn("[{}] {} unreachable directly and through the witness: {}",
                    me.getId(), other.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    private Decision onPeerUnreachable() {
        DbRole myRole;
        try {
            myRole = readDbRole(me);
        } catch (RuntimeException e) {
            throw stopServing("cannot see the cluster and cannot read own role", e);
        }
        if (myRole == DbRole.SINGLE) {
            log.info("[{}] Peer unreachable, staying single", me.getId());
            return Decision.NO_CHANGE;
        }
        throw stopServing("cannot see the cluster while " + myRole, null);
    }

    private Decision onPeerDead() {
        DbRole myRole = readDbRole(me);
        if (myRole == DbRole.BACKUP && !me.hasSynced()) {
            // a stale replica must not become the only copy
            throw stopServing("peer is dead but this backup has not caught up", null);
        }
        return becomeSingle();
    }

    private Decision onPeerInitialized() {
        NodeRole myRole = me.getRole();
        return switch (myRole) {
            case PRIMARY -> becomeActive();
            case SECONDARY -> becomeBackup();
            case INITIALIZED -> {
                log.debug("[{}] Both nodes still initializing", me.getId());
                yield Decision.NO_CHANGE;
            }
        };
    }

    private Decision becomeActive() {
        assignRole(DbRole.ACTIVE);
        log.info("[{}] Transitioning to active", me.getId());
        performer.transitionToActive(me);
        return Decision.BECAME_ACTIVE;
    }

    private Decision becomeBackup() {
        assignRole(DbRole.BACKUP);
        log.info("[{}] Transitioning to backup of {}", me.getId(), other.getId());
        performer.transitionToBackupOf(me, other);
        return Decision.BECAME_BACKUP;
    }

    private Decision becomeSingle() {
        assignRole(DbRole.SINGLE);
        log.info("[{}] Transitioning to single", me.getId());
        performer.transitionToSingle(me);
        return Decision.BECAME_SINGLE;
    }

    /**
     * Records the new role on the local node. A failed write is logged and the transition still
     * runs; the next pass re-derives the role from the peer.
     */
    private void assignRole(DbRole role) {
        try {
            me.setDbRole(role);
        } catch (RuntimeException e) {
            log.warn("[{}] Failed to record role {}: {}", me.getId(), role, e.getMessage(), e);
        }
    }

    private ClusterUnavailableException stopServing(String reason, Throwable cause) {
        log.warn("[{}] Stopping: {}", me.getId(), reason);
        performer.stop();
        return new ClusterUnavailableException("cluster unavailable: " + reason, me.getId(), cause);
    }

    private static DbRole readDbRole(Candidate candidate) {
        DbRole role = candidate.getDbRole();
        if (role == null) {
            throw new NodeOperationException("no database role reported", candidate.getId());
        }
        return role;
    }
}
