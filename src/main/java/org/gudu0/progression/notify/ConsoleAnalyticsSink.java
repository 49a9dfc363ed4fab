package org.gudu0.progression.notify;

import org.gudu0.progression.events.AnalyticsSink;
import org.gudu0.progression.events.ProgressionEvent;
import org.gudu0.progression.util.ConsoleLog;

import java.util.Map;
import java.util.TreeMap;

/**
 * Writes analytics records to the debug log.
 */
public class ConsoleAnalyticsSink implements AnalyticsSink {
    private final String slot;

    public ConsoleAnalyticsSink(String slot) {
        this.slot = slot;
    }

    @Override
    public void record(ProgressionEvent event) {
        // sorted so log lines diff cleanly
        Map<String, Object> attrs = new TreeMap<>(event.attributes());
        attrs.put("slot", slot);
        ConsoleLog.debug("Analytics", event.name() + " " + attrs);
    }
}
