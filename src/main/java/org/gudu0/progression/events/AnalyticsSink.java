package org.gudu0.progression.events;

public interface AnalyticsSink {
    void record(ProgressionEvent event);
}
