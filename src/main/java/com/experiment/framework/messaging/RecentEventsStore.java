package com.experiment.framework.messaging;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * In-memory sink keeping the last N lifecycle events for the REST API.
 */
@Component
public class RecentEventsStore implements ExperimentEventSink {

    private static final int MAX_RECENT = 100;
    private final ConcurrentLinkedDeque<ExperimentEvent> recent = new ConcurrentLinkedDeque<>();

    @Override
    public String getSinkName() {
        return "recent-events";
    }

    @Override
    public void publish(ExperimentEvent event) {
        recent.addFirst(event);
        while (recent.size() > MAX_RECENT) recent.removeLast();
    }

    /**
     * Newest first.
     */
    public List<ExperimentEvent> getRecent(int limit) {
        List<ExperimentEvent> out = new ArrayList<>();
        for (ExperimentEvent e : recent) {
            if (out.size() >= limit) break;
            out.add(e);
        }
        return out;
    }
}
