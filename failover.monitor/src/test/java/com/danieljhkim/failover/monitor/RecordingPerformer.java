package com.danieljhkim.failover.monitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Performer that records each transition as a string in an event log. */
public class RecordingPerformer implements Performer {

    private final List<String> events;
    private final List<String> transitions = Collections.synchronizedList(new ArrayList<>());

    public RecordingPerformer() {
        this(Collections.synchronizedList(new ArrayList<>()));
    }

    public RecordingPerformer(List<String> events) {
        this.events = events;
    }

    public List<String> getTransitions() {
        synchronized (transitions) {
            return List.copyOf(transitions);
        }
    }

    public long count(String transition) {
        return getTransitions().stream().filter(transition::equals).count();
    }

    @Override
    public void transitionToActive(Candidate self) {
        record("active:" + self.getId());
    }

    @Override
    public void transitionToBackupOf(Candidate self, Candidate active) {
        record("backup:" + self.getId() + "->" + active.getId());
    }

    @Override
    public void transitionToSingle(Candidate self) {
        record("single:" + self.getId());
    }

    @Override
    public void stop() {
        record("stop");
    }

    private void record(String transition) {
        transitions.add(transition);
        events.add("perform:" + transition);
    }
}
