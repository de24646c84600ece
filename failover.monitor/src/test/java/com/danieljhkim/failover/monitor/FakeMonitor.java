package com.danieljhkim.failover.monitor;

import com.danieljhkim.failover.common.constants.NodeRole;
import com.danieljhkim.failover.common.exception.NodeOperationException;
import java.util.concurrent.atomic.AtomicInteger;

/** Fake witness. Relays to a configurable candidate and runs an optional hook on each ready(). */
public class FakeMonitor implements Monitor {

    public interface ReadyHook {
        void onReady(int count) throws InterruptedException;
    }

    private final AtomicInteger readyCount = new AtomicInteger();
    private final AtomicInteger bounceCount = new AtomicInteger();

    private volatile Candidate relay;
    private volatile boolean reachable = true;
    private volatile ReadyHook readyHook = count -> {};

    /** Relays to the given candidate; null makes the witness unable to resolve it. */
    public void relayTo(Candidate relay) {
        this.relay = relay;
    }

    public void setReachable(boolean reachable) {
        this.reachable = reachable;
    }

    public void onReady(ReadyHook hook) {
        this.readyHook = hook;
    }

    public int getReadyCount() {
        return readyCount.get();
    }

    public int getBounceCount() {
        return bounceCount.get();
    }

    @Override
    public NodeRole getRole() {
        return NodeRole.INITIALIZED;
    }

    @Override
    public Candidate bounce(Candidate candidate) {
        bounceCount.incrementAndGet();
        if (!reachable) {
            throw new NodeOperationException("witness unreachable", "witness");
        }
        return relay;
    }

    @Override
    public void ready() throws InterruptedException {
        readyHook.onReady(readyCount.incrementAndGet());
    }
}
