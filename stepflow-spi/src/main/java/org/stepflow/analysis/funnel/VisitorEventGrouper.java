package org.stepflow.analysis.funnel;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class VisitorEventGrouper {
    private VisitorEventGrouper() {
    }

    /**
     * Visitor id to that visitor's events, both in arrival order. Events are not sorted here.
     */
    public static Map<String, List<RawStepEvent>> group(List<RawStepEvent> events) {
        Map<String, List<RawStepEvent>> timelines = new LinkedHashMap<>();
        for (RawStepEvent event : events) {
            timelines.computeIfAbsent(event.getVisitorId(), k -> new ArrayList<>()).add(event);
        }

        ImmutableMap.Builder<String, List<RawStepEvent>> builder = ImmutableMap.builder();
        for (Map.Entry<String, List<RawStepEvent>> entry : timelines.entrySet()) {
            builder.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
        }
        return builder.build();
    }
}
