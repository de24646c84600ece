package com.danieljhkim.failover.monitor;

import com.danieljhkim.failover.common.constants.DbRole;
import com.danieljhkim.failover.common.constants.NodeRole;
import com.danieljhkim.failover.common.exception.NodeOperationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/** Fake Candidate for testing purposes. Records role writes in an optional shared event log. */
public class FakeCandidate implements Candidate {

    private final String id;
    private final List<String> events;
    private final List<DbRole> roleWrites = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger readyCount = new AtomicInteger();
    private final AtomicInteger hasSyncedCount = new AtomicInteger();

    private volatile DbRole dbRole = DbRole.INITIALIZED;
    private volatile NodeRole nodeRole = NodeRole.INITIALIZED;
    private volatile boolean synced = true;
    private volatile boolean reachable = true;
    private volatile RuntimeException dbRoleFailure;
    private volatile RuntimeException syncFailure;
    private volatile RuntimeException roleFailure;
    private volatile RuntimeException roleWriteFailure;

    public FakeCandidate(String id) {
        this(id, Collections.synchronizedList(new ArrayList<>()));
    }

    public FakeCandidate(String id, List<String> events) {
        this.id = id;
        this.events = events;
    }

    public FakeCandidate withDbRole(DbRole role) {
        this.dbRole = role;
        return this;
    }

    public FakeCandidate withNodeRole(NodeRole role) {
        this.nodeRole = role;
        return this;
    }

    public FakeCandidate withSynced(boolean synced) {
        this.synced = synced;
        return this;
    }

    public void setReachable(boolean reachable) {
        this.reachable = reachable;
    }

    public void failDbRoleReads(RuntimeException failure) {
        this.dbRoleFailure = failure;
    }

    public void failSyncChecks(RuntimeException failure) {
        this.syncFailure = failure;
    }

    public void failRoleReads(RuntimeException failure) {
        this.roleFailure = failure;
    }

    public void failRoleWrites(RuntimeException failure) {
        this.roleWriteFailure = failure;
    }

    public DbRole currentDbRole() {
        return dbRole;
    }

    public List<DbRole> getRoleWrites() {
        synchronized (roleWrites) {
            return List.copyOf(roleWrites);
        }
    }

    public int getReadyCount() {
        return readyCount.get();
    }

    public int getHasSyncedCount() {
        return hasSyncedCount.get();
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public DbRole getDbRole() {
        if (!reachable) {
            throw new NodeOperationException("connection refused", id);
        }
        if (dbRoleFailure != null) {
            throw dbRoleFailure;
        }
        return dbRole;
    }

    @Override
    public void setDbRole(DbRole role) {
        roleWrites.add(role);
        if (roleWriteFailure != null) {
            throw roleWriteFailure;
        }
        events.add("set:" + id + ":" + role);
        this.dbRole = role;
    }

    @Override
    public boolean hasSynced() {
        hasSyncedCount.incrementAndGet();
        if (syncFailure != null) {
            throw syncFailure;
        }
        return synced;
    }

    @Override
    public NodeRole getRole() {
        if (roleFailure != null) {
            throw roleFailure;
        }
        return nodeRole;
    }

    @Override
    public Candidate bounce(Candidate candidate) {
        return candidate;
    }

    @Override
    public void ready() {
        readyCount.incrementAndGet();
    }
}
